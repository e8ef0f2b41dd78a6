package com.farewatch.ml.controller;

import com.farewatch.ml.model.HealthResponse;
import com.farewatch.ml.service.HealthService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {
  private final HealthService health;

  public HealthController(HealthService health) {
    this.health = health;
  }

  @GetMapping("/health")
  public HealthResponse health() {
    return health.check();
  }
}
