package com.farewatch.ml.controller;

import com.farewatch.ml.metrics.MetricsSink;
import com.farewatch.ml.model.MetricsResponse;
import com.farewatch.ml.model.ModelDeletedResponse;
import com.farewatch.ml.model.ModelsResponse;
import com.farewatch.ml.model.TrainingOutcome;
import com.farewatch.ml.model.TrainingRequest;
import com.farewatch.ml.model.TrainingResponse;
import com.farewatch.ml.service.NotFoundException;
import com.farewatch.ml.store.ModelStore;
import com.farewatch.ml.training.TrainingService;
import java.time.Instant;
import java.util.List;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ModelController {
  private final TrainingService training;
  private final ModelStore models;
  private final MetricsSink metrics;

  public ModelController(TrainingService training, ModelStore models, MetricsSink metrics) {
    this.training = training;
    this.models = models;
    this.metrics = metrics;
  }

  @PostMapping("/api/model/train")
  public TrainingResponse train(@RequestBody(required = false) TrainingRequest request) {
    TrainingRequest effective = request != null ? request : new TrainingRequest(null, false);
    List<TrainingOutcome> outcomes = training.trigger(effective);
    long trained = outcomes.stream().filter(TrainingOutcome::trained).count();
    return new TrainingResponse("success",
        "Trained " + trained + " of " + outcomes.size() + " model(s)", outcomes);
  }

  @GetMapping("/api/model/metrics/{model_id}")
  public MetricsResponse metrics(@PathVariable("model_id") String modelId) {
    return metrics.find(modelId)
        .map(m -> new MetricsResponse(modelId, m))
        .orElseThrow(() -> new NotFoundException("Metrics not found for model: " + modelId));
  }

  @GetMapping("/models")
  public ModelsResponse listModels() {
    List<String> ids = models.listIds();
    return new ModelsResponse(ids, ids.size(), Instant.now());
  }

  @DeleteMapping("/models/{model_id}")
  public ModelDeletedResponse deleteModel(@PathVariable("model_id") String modelId) {
    models.delete(modelId);
    return new ModelDeletedResponse("Model deleted", modelId, Instant.now());
  }
}
