package com.farewatch.ml.service;

import com.farewatch.ml.model.HealthResponse;
import com.farewatch.ml.store.ModelStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;

@Service
public class HealthService {

  private static final Logger log = LoggerFactory.getLogger(HealthService.class);

  static final String CONNECTED = "connected";
  static final String DISCONNECTED = "disconnected";
  private static final int DB_TIMEOUT_SECONDS = 2;

  private final ModelStore models;
  private final DataSource dataSource;
  private final RedisConnectionFactory redis;

  public HealthService(ModelStore models, DataSource dataSource, RedisConnectionFactory redis) {
    this.models = models;
    this.dataSource = dataSource;
    this.redis = redis;
  }

  public HealthResponse check() {
    return new HealthResponse("healthy", models.size(), database(), redis());
  }

  private String database() {
    try (Connection c = dataSource.getConnection()) {
      return c.isValid(DB_TIMEOUT_SECONDS) ? CONNECTED : DISCONNECTED;
    } catch (Exception e) {
      log.debug("Database probe failed: {}", e.getMessage());
      return DISCONNECTED;
    }
  }

  private String redis() {
    try (RedisConnection c = redis.getConnection()) {
      return c.ping() != null ? CONNECTED : DISCONNECTED;
    } catch (Exception e) {
      log.debug("Redis probe failed: {}", e.getMessage());
      return DISCONNECTED;
    }
  }
}
