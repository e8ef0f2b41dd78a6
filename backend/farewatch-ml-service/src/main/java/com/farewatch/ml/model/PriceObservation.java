package com.farewatch.ml.model;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One recorded fare for a route. Immutable once observed.
 */
public record PriceObservation(
    String routeId,
    double price,
    LocalDate departureDate,
    LocalDate returnDate,
    Instant observedAt
) {}
