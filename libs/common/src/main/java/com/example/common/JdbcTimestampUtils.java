/*
 * どこで: 共通ユーティリティ
 * 何を: JDBC の Timestamp と Instant を相互変換する
 * なぜ: lease 期限やリトライ時刻を常に明示型でバインドし、UTC のまま読み戻すため
 */
package com.example.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // PostgreSQL JDBC は Instant の型推論に失敗することがあるため Timestamp で渡す
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
