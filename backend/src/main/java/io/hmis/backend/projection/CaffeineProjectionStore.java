package io.hmis.backend.projection;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Process-local aggregates in a Caffeine cache with per-entry expiry. Each write replaces the entry
 * through {@code asMap().compute}, which is atomic per key, and restarts its time-to-live.
 */
@Component
@ConditionalOnProperty(name = "hmis.store.type", havingValue = "memory")
public class CaffeineProjectionStore implements ProjectionStore {

  private static final Comparator<RankedMember> BY_SCORE_DESC =
      Comparator.comparing(RankedMember::score).reversed().thenComparing(RankedMember::member);

  private final Cache<String, Aggregate> cache;

  public CaffeineProjectionStore() {
    this(Ticker.systemTicker());
  }

  public CaffeineProjectionStore(Ticker ticker) {
    this.cache =
        Caffeine.newBuilder()
            .ticker(ticker)
            .executor(Runnable::run)
            .expireAfter(new AggregateExpiry())
            .build();
  }

  @Override
  public void hashIncrement(String key, Map<String, BigDecimal> deltas, Duration ttl) {
    increment(key, deltas, ttl);
  }

  @Override
  public Optional<Map<String, BigDecimal>> hashGetAll(String key) {
    return Optional.ofNullable(cache.getIfPresent(key)).map(Aggregate::values);
  }

  @Override
  public void rankIncrement(String key, String member, BigDecimal delta, Duration ttl) {
    increment(key, Map.of(member, delta), ttl);
  }

  @Override
  public List<RankedMember> rankTop(String key, int limit) {
    var aggregate = cache.getIfPresent(key);
    if (aggregate == null) {
      return List.of();
    }
    return aggregate.values().entrySet().stream()
        .map(e -> new RankedMember(e.getKey(), e.getValue()))
        .sorted(BY_SCORE_DESC)
        .limit(limit)
        .toList();
  }

  private void increment(String key, Map<String, BigDecimal> deltas, Duration ttl) {
    cache
        .asMap()
        .compute(
            key,
            (k, current) -> {
              var values =
                  current != null
                      ? new HashMap<>(current.values())
                      : new HashMap<String, BigDecimal>();
              deltas.forEach((field, delta) -> values.merge(field, delta, BigDecimal::add));
              return new Aggregate(Map.copyOf(values), ttl);
            });
  }

  private record Aggregate(Map<String, BigDecimal> values, Duration ttl) {}

  private static final class AggregateExpiry implements Expiry<String, Aggregate> {

    @Override
    public long expireAfterCreate(String key, Aggregate value, long currentTime) {
      return value.ttl().toNanos();
    }

    @Override
    public long expireAfterUpdate(
        String key, Aggregate value, long currentTime, long currentDuration) {
      return value.ttl().toNanos();
    }

    @Override
    public long expireAfterRead(
        String key, Aggregate value, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
