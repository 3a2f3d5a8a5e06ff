/*
 * どこで: Notification Delivery ドメインモデル
 * 何を: email/sms 宛先の書式を検証する
 * なぜ: 作成時の入力検証と配信アダプタで同じ規則を使うため
 */
package com.example.delivery.model;

import java.util.regex.Pattern;

public final class DestinationFormat {

  private static final Pattern EMAIL = Pattern.compile("^[\\w.-]+@[\\w.-]+\\.\\w+$");
  private static final Pattern PHONE = Pattern.compile("^\\+\\d{10,15}$");

  private DestinationFormat() {}

  public static boolean isValid(NotificationChannel channel, String destination) {
    return switch (channel) {
      case EMAIL -> destination != null && EMAIL.matcher(destination).matches();
      case SMS -> destination != null && PHONE.matcher(destination).matches();
      case IN_APP -> true;
    };
  }
}
