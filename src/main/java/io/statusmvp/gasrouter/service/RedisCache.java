package io.statusmvp.gasrouter.service;

import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * String values in Redis under the {@code app.redis.keyPrefix} namespace. Redis is a mirror here,
 * never the source of truth, so connection errors degrade to a miss or a skipped write.
 */
@Component
public class RedisCache {
  private static final Logger log = LoggerFactory.getLogger(RedisCache.class);

  private final StringRedisTemplate redis;
  private final String keyPrefix;

  public RedisCache(
      StringRedisTemplate redis, @Value("${app.redis.keyPrefix:gas-router:}") String keyPrefix) {
    this.redis = redis;
    this.keyPrefix = keyPrefix == null ? "" : keyPrefix.trim();
  }

  public Optional<String> get(String key) {
    if (key == null) return Optional.empty();
    try {
      return Optional.ofNullable(redis.opsForValue().get(keyPrefix + key));
    } catch (Exception e) {
      log.debug("redis read failed for {}: {}", key, e.getMessage());
      return Optional.empty();
    }
  }

  /** Stores with a TTL; {@code ttlSeconds <= 0} stores without expiry. */
  public void set(String key, String value, long ttlSeconds) {
    if (key == null || value == null) return;
    try {
      if (ttlSeconds > 0) {
        redis.opsForValue().set(keyPrefix + key, value, Duration.ofSeconds(ttlSeconds));
      } else {
        redis.opsForValue().set(keyPrefix + key, value);
      }
    } catch (Exception e) {
      log.debug("redis write failed for {}: {}", key, e.getMessage());
    }
  }
}
