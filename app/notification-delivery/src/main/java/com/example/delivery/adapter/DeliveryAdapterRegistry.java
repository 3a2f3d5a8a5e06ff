/*
 * どこで: Notification Delivery 配信アダプタ
 * 何を: チャネル -> アダプタの単一ディスパッチ表
 * なぜ: 全チャネルの網羅と設定不備を起動時に検出するため
 */
package com.example.delivery.adapter;

import com.example.delivery.model.NotificationChannel;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class DeliveryAdapterRegistry {

  private final Map<NotificationChannel, DeliveryAdapter> adapters;

  public DeliveryAdapterRegistry(List<DeliveryAdapter> adapters) {
    final EnumMap<NotificationChannel, DeliveryAdapter> table =
        new EnumMap<>(NotificationChannel.class);
    for (DeliveryAdapter adapter : adapters) {
      final DeliveryAdapter previous = table.putIfAbsent(adapter.channel(), adapter);
      if (previous != null) {
        throw new IllegalStateException(
            "duplicate delivery adapter for channel=" + adapter.channel().value());
      }
      if (!adapter.isConfigured()) {
        throw new IllegalStateException(
            "delivery adapter is enabled but not configured channel=" + adapter.channel().value());
      }
    }
    for (NotificationChannel channel : NotificationChannel.values()) {
      if (!table.containsKey(channel)) {
        throw new IllegalStateException("no delivery adapter for channel=" + channel.value());
      }
    }
    this.adapters = Collections.unmodifiableMap(table);
  }

  public DeliveryAdapter adapterFor(NotificationChannel channel) {
    return adapters.get(channel);
  }
}
