package com.farewatch.ml.controller;

import com.farewatch.ml.model.AnomalyResult;
import com.farewatch.ml.model.DetectRequest;
import com.farewatch.ml.model.FeedbackResponse;
import com.farewatch.ml.scoring.ScoringEngine;
import com.farewatch.ml.service.FeedbackService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AnomalyController {
  private final ScoringEngine scoring;
  private final FeedbackService feedback;

  public AnomalyController(ScoringEngine scoring, FeedbackService feedback) {
    this.scoring = scoring;
    this.feedback = feedback;
  }

  @PostMapping("/api/anomaly/detect")
  public AnomalyResult detect(@Valid @RequestBody DetectRequest request) {
    return scoring.score(request.modelId(), request.features().toFeatureVector());
  }

  @PostMapping("/api/anomaly/feedback")
  public FeedbackResponse submitFeedback(
      @RequestParam(name = "anomaly_id") String anomalyId,
      @RequestParam(name = "is_correct") boolean correct
  ) {
    feedback.recordFeedback(anomalyId, correct);
    return new FeedbackResponse("success", "Feedback recorded");
  }
}
