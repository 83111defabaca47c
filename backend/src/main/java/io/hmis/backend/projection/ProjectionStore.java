package io.hmis.backend.projection;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keyed aggregates with per-key expiry, owned by projection maintainers. Two shapes share the key
 * space: counter hashes (field to number) and rankings (member to score). Every write refreshes the
 * key's time-to-live; a key read after it expired behaves as if it never existed.
 *
 * <p>All increments of one call are applied atomically: a concurrent reader sees either none or
 * all of them.
 */
public interface ProjectionStore {

  void hashIncrement(String key, Map<String, BigDecimal> deltas, Duration ttl);

  /** Empty when the key is absent or expired. */
  Optional<Map<String, BigDecimal>> hashGetAll(String key);

  void rankIncrement(String key, String member, BigDecimal delta, Duration ttl);

  /** Highest scores first; ties ordered by member. Empty list when absent or expired. */
  List<RankedMember> rankTop(String key, int limit);
}
