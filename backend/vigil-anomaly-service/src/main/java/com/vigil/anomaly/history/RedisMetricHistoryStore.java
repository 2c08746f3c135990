package com.vigil.anomaly.history;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Redis list per series, newest at the head and trimmed to capacity. Idle series expire through
 * the key TTL. The read of prior values and the push are two commands, so two writers on the
 * same series can both score against the same history.
 */
@Component
@Profile("redis-history")
public class RedisMetricHistoryStore implements MetricHistoryStore {

  private static final Logger log = LoggerFactory.getLogger(RedisMetricHistoryStore.class);

  static final String KEY_PREFIX = "vigil:history:";
  static final String KEYS_SET = "vigil:history:keys";

  private final StringRedisTemplate redis;
  private final int capacity;
  private final long ttlSeconds;

  public RedisMetricHistoryStore(StringRedisTemplate redis,
                                 @Value("${vigil.history.capacity:100}") int capacity,
                                 @Value("${vigil.history.ttl-seconds:172800}") long ttlSeconds) {
    this.redis = redis;
    this.capacity = capacity;
    this.ttlSeconds = ttlSeconds;
  }

  @Override
  public double[] snapshot(String key) {
    return toOldestFirst(redis.opsForList().range(KEY_PREFIX + key, 0, capacity - 1));
  }

  @Override
  public double[] append(String key, double value) {
    String histKey = KEY_PREFIX + key;
    double[] prior = toOldestFirst(redis.opsForList().range(histKey, 0, capacity - 1));
    redis.opsForList().leftPush(histKey, Double.toString(value));
    redis.opsForList().trim(histKey, 0, capacity - 1);
    redis.opsForSet().add(KEYS_SET, key);
    try {
      redis.expire(histKey, Duration.ofSeconds(ttlSeconds));
    } catch (Exception e) {
      log.debug("Could not refresh TTL on {}: {}", histKey, e.getMessage());
    }
    return prior;
  }

  @Override
  public int size(String key) {
    Long n = redis.opsForList().size(KEY_PREFIX + key);
    return n == null ? 0 : n.intValue();
  }

  @Override
  public Set<String> keys() {
    Set<String> members = redis.opsForSet().members(KEYS_SET);
    return members == null ? Set.of() : Set.copyOf(members);
  }

  @Override
  public int capacity() {
    return capacity;
  }

  // Expired lists vanish on their own; only the key index needs pruning.
  @Override
  public int evictIdle(Duration idle) {
    int removed = 0;
    for (String key : keys()) {
      if (Boolean.FALSE.equals(redis.hasKey(KEY_PREFIX + key))) {
        redis.opsForSet().remove(KEYS_SET, key);
        removed++;
      }
    }
    return removed;
  }

  private static double[] toOldestFirst(List<String> newestFirst) {
    if (newestFirst == null || newestFirst.isEmpty()) return new double[0];
    double[] out = new double[newestFirst.size()];
    int n = 0;
    for (int i = newestFirst.size() - 1; i >= 0; i--) {
      String raw = newestFirst.get(i);
      try {
        out[n] = Double.parseDouble(raw);
        n++;
      } catch (NumberFormatException e) {
        log.warn("Skipping malformed history entry '{}'", raw);
      }
    }
    return n == out.length ? out : Arrays.copyOf(out, n);
  }
}
