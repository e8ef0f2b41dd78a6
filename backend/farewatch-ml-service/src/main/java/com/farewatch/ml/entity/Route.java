package com.farewatch.ml.entity;

import jakarta.persistence.*;

@Entity
@Table(name = "routes")
public class Route {
  @Id
  private String id;

  @Column(nullable = false)
  private String origin;

  @Column(nullable = false)
  private String destination;

  private String tier;

  private Double priorityScore;

  public String getId() { return id; }
  public String getOrigin() { return origin; }
  public String getDestination() { return destination; }
  public String getTier() { return tier; }
  public Double getPriorityScore() { return priorityScore; }
}
