package com.example.delivery.service;

import com.example.delivery.model.NotificationChannel;

public record NotificationCreateCommand(
    String userId, NotificationChannel channel, String message, String destination) {}
