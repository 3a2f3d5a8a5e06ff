package com.example.delivery.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record NotificationStatsResponse(Map<String, Long> counts) {
  public NotificationStatsResponse {
    // 表示順を保ったまま不変化する
    counts = Collections.unmodifiableMap(new LinkedHashMap<>(counts));
  }
}
