/*
 * Where: DM pipeline data access
 * What: dm_delivery_log upsert, existence check and reporting queries
 * Why: the log both gates duplicate sends and records every delivery outcome
 */
package com.example.dmpipeline.repository;

import static com.example.dmpipeline.common.JdbcTimestampUtils.toInstant;
import static com.example.dmpipeline.common.JdbcTimestampUtils.toTimestamp;

import com.example.dmpipeline.model.DeliveryKey;
import com.example.dmpipeline.model.DeliveryRecord;
import com.example.dmpipeline.model.DeliveryStatus;
import com.example.dmpipeline.model.PostDeliveryCount;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DeliveryLogRepository {

  private static final String SELECT_COLUMNS =
      "SELECT user_id, post_id, comment_id, status, retry_count, error_message, sent_at"
          + " FROM dm_delivery_log";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * Inserts the outcome or merges it into the existing row for the same (user, post).
   *
   * <p>A new row stores {@code retries}. A merge adds one for the repeated processing plus the
   * retries it used, so retry_count never decreases.
   */
  public void recordOutcome(
      String userId,
      String postId,
      String commentId,
      DeliveryStatus status,
      String errorMessage,
      int retries,
      Instant at) {
    final String sql =
        """
        INSERT INTO dm_delivery_log (
          user_id, post_id, comment_id, status, retry_count, error_message, sent_at, created_at
        ) VALUES (
          :userId, :postId, :commentId, :status, :retries, :errorMessage, :at, :at
        )
        ON CONFLICT (user_id, post_id) DO UPDATE
        SET comment_id = EXCLUDED.comment_id,
            status = EXCLUDED.status,
            error_message = EXCLUDED.error_message,
            sent_at = EXCLUDED.sent_at,
            retry_count = dm_delivery_log.retry_count + 1 + EXCLUDED.retry_count
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("postId", postId)
            .addValue("commentId", commentId)
            .addValue("status", status.value())
            .addValue("retries", Math.max(retries, 0))
            .addValue("errorMessage", errorMessage)
            .addValue("at", toTimestamp(at));
    jdbcTemplate.update(sql, params);
  }

  public boolean exists(DeliveryKey key) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1 FROM dm_delivery_log WHERE user_id = :userId AND post_id = :postId
        )
        """;
    final Boolean exists = jdbcTemplate.queryForObject(sql, keyParams(key), Boolean.class);
    return Boolean.TRUE.equals(exists);
  }

  public Optional<DeliveryRecord> find(DeliveryKey key) {
    final String sql = SELECT_COLUMNS + " WHERE user_id = :userId AND post_id = :postId";
    return jdbcTemplate.query(sql, keyParams(key), this::mapRow).stream().findFirst();
  }

  public List<DeliveryRecord> findByUserId(String userId) {
    final String sql = SELECT_COLUMNS + " WHERE user_id = :userId ORDER BY sent_at DESC, post_id";
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("userId", userId), this::mapRow);
  }

  public long countByStatus(DeliveryStatus status) {
    final String sql = "SELECT COUNT(*) FROM dm_delivery_log WHERE status = :status";
    final Long count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("status", status.value()), Long.class);
    return count == null ? 0L : count;
  }

  public long countWrittenSince(Instant since) {
    final String sql = "SELECT COUNT(*) FROM dm_delivery_log WHERE sent_at > :since";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("since", toTimestamp(since));
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0L : count;
  }

  public List<PostDeliveryCount> findTopPosts(int limit) {
    final String sql =
        """
        SELECT post_id, COUNT(*) AS delivery_count
        FROM dm_delivery_log
        GROUP BY post_id
        ORDER BY delivery_count DESC, post_id
        LIMIT :limit
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", limit);
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) -> new PostDeliveryCount(rs.getString("post_id"), rs.getInt("delivery_count")));
  }

  public void ping() {
    jdbcTemplate.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
  }

  private MapSqlParameterSource keyParams(DeliveryKey key) {
    return new MapSqlParameterSource()
        .addValue("userId", key.userId())
        .addValue("postId", key.postId());
  }

  private DeliveryRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new DeliveryRecord(
        rs.getString("user_id"),
        rs.getString("post_id"),
        rs.getString("comment_id"),
        DeliveryStatus.fromValue(rs.getString("status")),
        rs.getInt("retry_count"),
        rs.getString("error_message"),
        toInstant(rs.getTimestamp("sent_at")));
  }
}
