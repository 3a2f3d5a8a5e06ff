/*
 * どこで: 共通ユーティリティ
 * 何を: lease/claim の所有者を表すワーカー識別子を解決する
 * なぜ: 配信ワーカーとスケジューラが同じ規則でロック所有者を名乗るため
 */
package com.example.common;

import java.net.InetAddress;
import java.net.UnknownHostException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class WorkerIds {

  private static final Logger logger = LoggerFactory.getLogger(WorkerIds.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";

  private WorkerIds() {}

  public static String resolveHostname() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }

  // 同一ホスト内の複数ワーカーを区別するため suffix を付ける
  public static String workerId(String suffix) {
    if (suffix == null || suffix.isBlank()) {
      return resolveHostname();
    }
    return resolveHostname() + "/" + suffix;
  }
}
