package com.farewatch.ml.feature;

import com.farewatch.ml.model.FeatureVector;
import com.farewatch.ml.model.PriceObservation;
import com.farewatch.ml.model.RouteStatistics;
import com.farewatch.ml.model.TrainingRow;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

// Feature order: price_ratio, z_score, day_of_week, days_until_departure, trip_duration,
// seasonal_factor, price_variance, recent_trend (always 0 here).
public final class FeatureExtractor {

  private static final long SECONDS_PER_DAY = 86_400L;

  private FeatureExtractor() {
  }

  public static FeatureVector extract(TrainingRow row) {
    Objects.requireNonNull(row, "row must not be null");
    return extract(row.observation(), row.statistics());
  }

  public static FeatureVector extract(PriceObservation obs, RouteStatistics stats) {
    Objects.requireNonNull(obs, "observation must not be null");
    Objects.requireNonNull(stats, "statistics must not be null");

    double avg = stats.avgPrice30d() != null ? stats.avgPrice30d() : Double.NaN;
    Double std = stats.stdPrice30d();
    double safeStd = (std == null || std == 0.0) ? 1.0 : std;

    double priceRatio = obs.price() / avg;
    double zScore = (obs.price() - avg) / safeStd;
    double priceVariance = (std != null ? std : Double.NaN) / avg;

    LocalDate departure = obs.departureDate();
    return new FeatureVector(
        priceRatio,
        zScore,
        departure.getDayOfWeek().getValue() - 1,
        leadTimeDays(departure, obs.observedAt()),
        obs.returnDate() != null ? ChronoUnit.DAYS.between(departure, obs.returnDate()) : 0L,
        seasonalFactor(departure.getMonthValue()),
        priceVariance,
        0.0
    );
  }

  // Floored days to midnight UTC of departure; negative after departure.
  public static long leadTimeDays(LocalDate departureDate, Instant observedAt) {
    long seconds = Duration.between(observedAt, departureDate.atStartOfDay(ZoneOffset.UTC).toInstant()).toSeconds();
    return Math.floorDiv(seconds, SECONDS_PER_DAY);
  }

  public static double seasonalFactor(int month) {
    if (month < 1 || month > 12) {
      throw new IllegalArgumentException("month must be in [1, 12], got: " + month);
    }
    return switch (month) {
      case 6, 7, 8 -> 1.3;
      case 12 -> 1.4;
      case 2, 11 -> 0.8;
      default -> 1.0;
    };
  }
}
