package com.farewatch.ml.metrics;

import java.time.Duration;
import java.util.Optional;

public interface CacheStore {

  void setWithTtl(String key, String value, Duration ttl);

  Optional<String> get(String key);
}
