/*
 * Where: shared JDBC utilities
 * What: converts between Instant and java.sql.Timestamp explicitly
 * Why: the PostgreSQL driver cannot always infer a SQL type for a bare Instant
 */
package com.example.dmpipeline.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instants are UTC; Timestamp.from keeps them UTC regardless of the DB session time zone.
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
