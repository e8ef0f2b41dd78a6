package com.farewatch.ml.scoring;

import com.farewatch.ml.detector.AnomalyDetector;

/**
 * How a detector score is read and turned into the response fields. One per deployment.
 */
public enum ScoringConvention {

  SCORE_SAMPLES(0.15) {
    @Override
    public double score(AnomalyDetector detector, double[] scaledRow) {
      return detector.scoreSamples(scaledRow);
    }

    @Override
    public double anomalyProbability(double score) {
      return 1.0 / (1.0 + Math.exp(10.0 * score));
    }

    @Override
    public double predictedPrice(double priceRatio) {
      return priceRatio > 0 ? 1.0 / priceRatio : 1.0;
    }
  },

  // Negative is an outlier.
  DECISION_FUNCTION(0.10) {
    @Override
    public double score(AnomalyDetector detector, double[] scaledRow) {
      return detector.decisionFunction(scaledRow);
    }

    @Override
    public double anomalyProbability(double score) {
      return 1.0 / (1.0 + Math.exp(score));
    }

    @Override
    public double predictedPrice(double priceRatio) {
      return 100.0 * (1.0 + 0.5 * priceRatio);
    }
  };

  private final double relativeBand;

  ScoringConvention(double relativeBand) {
    this.relativeBand = relativeBand;
  }

  public abstract double score(AnomalyDetector detector, double[] scaledRow);

  public abstract double anomalyProbability(double score);

  // Heuristic, not a fitted regression.
  public abstract double predictedPrice(double priceRatio);

  public double[] confidenceInterval(double predictedPrice) {
    return new double[] {predictedPrice * (1.0 - relativeBand), predictedPrice * (1.0 + relativeBand)};
  }
}
