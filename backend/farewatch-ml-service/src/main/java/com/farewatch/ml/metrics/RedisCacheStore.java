package com.farewatch.ml.metrics;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

@Component
public class RedisCacheStore implements CacheStore {

  private final StringRedisTemplate redis;

  public RedisCacheStore(StringRedisTemplate redis) {
    this.redis = redis;
  }

  @Override
  public void setWithTtl(String key, String value, Duration ttl) {
    redis.opsForValue().set(key, value, ttl);
  }

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(redis.opsForValue().get(key));
  }
}
