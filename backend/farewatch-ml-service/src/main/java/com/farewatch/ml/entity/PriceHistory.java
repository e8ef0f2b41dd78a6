package com.farewatch.ml.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "price_history")
public class PriceHistory {
  @Id
  private String id;

  @Column(nullable = false)
  private String routeId;

  @Column(nullable = false)
  private double price;

  private LocalDate departureDate;
  private LocalDate returnDate;

  @Column(nullable = false)
  private Instant createdAt;

  public String getId() { return id; }
  public String getRouteId() { return routeId; }
  public double getPrice() { return price; }
  public LocalDate getDepartureDate() { return departureDate; }
  public LocalDate getReturnDate() { return returnDate; }
  public Instant getCreatedAt() { return createdAt; }
}
