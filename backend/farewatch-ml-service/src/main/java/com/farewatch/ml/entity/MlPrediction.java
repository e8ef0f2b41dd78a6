package com.farewatch.ml.entity;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "ml_predictions")
public class MlPrediction {
  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false)
  private String modelVersion;

  private String routeId;
  private String priceHistoryId;
  private boolean predictedAnomaly;
  private Boolean actualAnomaly;
  private Instant feedbackReceivedAt;

  public Long getId() { return id; }
  public String getModelVersion() { return modelVersion; }
  public String getRouteId() { return routeId; }
  public String getPriceHistoryId() { return priceHistoryId; }
  public boolean isPredictedAnomaly() { return predictedAnomaly; }
  public Boolean getActualAnomaly() { return actualAnomaly; }
  public Instant getFeedbackReceivedAt() { return feedbackReceivedAt; }
}
