package io.hmis.backend.projection;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import javax.sql.DataSource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Aggregates stored in {@code public.projection_values}, one row per (key, field). An increment
 * runs in one transaction that drops the key's expired rows, upserts every field and moves the
 * whole key's expiry forward.
 *
 * <p>Writers to the same key are serialized by a transaction-scoped advisory lock on the key, taken
 * before any row is touched. Row locks alone are not enough: the expiry restamp locks every field
 * of the key, including fields another writer upserted first.
 */
@Repository
@ConditionalOnProperty(name = "hmis.store.type", havingValue = "jdbc", matchIfMissing = true)
public class JdbcProjectionStore implements ProjectionStore {

  private final JdbcClient jdbc;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public JdbcProjectionStore(@Qualifier("appDataSource") DataSource dataSource, Clock clock) {
    this.jdbc = JdbcClient.create(dataSource);
    this.transactionTemplate =
        new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    this.clock = clock;
  }

  @Override
  public void hashIncrement(String key, Map<String, BigDecimal> deltas, Duration ttl) {
    increment(key, deltas, ttl);
  }

  @Override
  public Optional<Map<String, BigDecimal>> hashGetAll(String key) {
    var values = new LinkedHashMap<String, BigDecimal>();
    jdbc.sql(
            """
            SELECT field, value FROM public.projection_values
            WHERE projection_key = ? AND expires_at > ?
            ORDER BY field
            """)
        .params(key, Timestamp.from(clock.instant()))
        .query(
            rs -> {
              values.put(rs.getString("field"), rs.getBigDecimal("value"));
            });
    return values.isEmpty() ? Optional.empty() : Optional.of(values);
  }

  @Override
  public void rankIncrement(String key, String member, BigDecimal delta, Duration ttl) {
    increment(key, Map.of(member, delta), ttl);
  }

  @Override
  public List<RankedMember> rankTop(String key, int limit) {
    return jdbc.sql(
            """
            SELECT field, value FROM public.projection_values
            WHERE projection_key = ? AND expires_at > ?
            ORDER BY value DESC, field
            LIMIT ?
            """)
        .params(key, Timestamp.from(clock.instant()), limit)
        .query((rs, rowNum) -> new RankedMember(rs.getString("field"), rs.getBigDecimal("value")))
        .list();
  }

  private void increment(String key, Map<String, BigDecimal> deltas, Duration ttl) {
    var now = clock.instant();
    var expiresAt = Timestamp.from(now.plus(ttl));
    transactionTemplate.executeWithoutResult(
        status -> {
          lockKey(key);
          jdbc.sql(
                  "DELETE FROM public.projection_values"
                      + " WHERE projection_key = ? AND expires_at <= ?")
              .params(key, Timestamp.from(now))
              .update();
          new TreeMap<>(deltas)
              .forEach(
                  (field, delta) ->
                      jdbc.sql(
                              """
                              INSERT INTO public.projection_values
                                  (projection_key, field, value, expires_at)
                              VALUES (?, ?, ?, ?)
                              ON CONFLICT (projection_key, field)
                              DO UPDATE SET value = projection_values.value + EXCLUDED.value,
                                            expires_at = EXCLUDED.expires_at
                              """)
                          .params(key, field, delta, expiresAt)
                          .update());
          jdbc.sql("UPDATE public.projection_values SET expires_at = ? WHERE projection_key = ?")
              .params(expiresAt, key)
              .update();
        });
  }

  private void lockKey(String key) {
    jdbc.sql("SELECT pg_advisory_xact_lock(hashtext(?))").param(key).query().listOfRows();
  }
}
