package com.example.delivery.service;

import java.util.UUID;

public class NotificationNotFoundException extends RuntimeException {

  public NotificationNotFoundException(UUID notificationId) {
    super("notification not found: " + notificationId);
  }
}
