package com.farewatch.ml.metrics;

import com.farewatch.ml.model.ModelMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Keeps the latest training summary per model in the cache with a retention TTL.
 * An expired entry simply reads as absent.
 */
@Component
public class MetricsSink {

  private static final Logger log = LoggerFactory.getLogger(MetricsSink.class);

  private final CacheStore cache;
  private final ObjectMapper json;
  private final String keyPrefix;
  private final Duration ttl;

  public MetricsSink(CacheStore cache,
                     ObjectMapper json,
                     @Value("${farewatch.ml.metrics.key-prefix:ml:model:metrics:}") String keyPrefix,
                     @Value("${farewatch.ml.metrics.ttl-seconds:86400}") long ttlSeconds) {
    this.cache = cache;
    this.json = json;
    this.keyPrefix = keyPrefix;
    this.ttl = Duration.ofSeconds(ttlSeconds);
  }

  public void record(ModelMetrics metrics) {
    try {
      cache.setWithTtl(key(metrics.modelId()), json.writeValueAsString(metrics), ttl);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize metrics for " + metrics.modelId(), e);
    }
  }

  public Optional<ModelMetrics> find(String modelId) {
    return cache.get(key(modelId)).flatMap(raw -> {
      try {
        return Optional.of(json.readValue(raw, ModelMetrics.class));
      } catch (JsonProcessingException e) {
        log.warn("Discarding unreadable metrics for '{}': {}", modelId, e.getOriginalMessage());
        return Optional.empty();
      }
    });
  }

  String key(String modelId) {
    return keyPrefix + modelId;
  }
}
