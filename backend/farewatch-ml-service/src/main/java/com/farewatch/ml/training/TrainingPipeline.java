package com.farewatch.ml.training;

import com.farewatch.ml.detector.AnomalyDetector;
import com.farewatch.ml.detector.DetectorFactory;
import com.farewatch.ml.feature.FeatureExtractor;
import com.farewatch.ml.feature.StandardScaler;
import com.farewatch.ml.metrics.MetricsSink;
import com.farewatch.ml.model.FeatureVector;
import com.farewatch.ml.model.LabeledSample;
import com.farewatch.ml.model.ModelMetrics;
import com.farewatch.ml.model.TrainingOutcome;
import com.farewatch.ml.model.TrainingRow;
import com.farewatch.ml.store.AnomalyModel;
import com.farewatch.ml.store.ModelStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Fits a scaler and detector for one model id from windowed price history, then publishes the
 * pair to the {@link ModelStore} and its summary to the {@link MetricsSink}.
 *
 * <p>Not thread-safe with respect to itself; callers go through {@link TrainingService}, which
 * runs one fit at a time off the request threads.
 */
@Component
public class TrainingPipeline {

  private static final Logger log = LoggerFactory.getLogger(TrainingPipeline.class);

  static final int SYNTHETIC_ROWS = 1000;
  static final double SYNTHETIC_CONTAMINATION = 0.1;
  private static final double MAX_CONTAMINATION = 0.5;

  private final HistoricalDataStore data;
  private final DetectorFactory detectors;
  private final ModelStore models;
  private final MetricsSink metricsSink;
  private final MeterRegistry metrics;
  private final Timer trainingDuration;
  private final int minSamples;
  private final double defaultContamination;
  private final long randomSeed;

  public TrainingPipeline(HistoricalDataStore data,
                          DetectorFactory detectors,
                          ModelStore models,
                          MetricsSink metricsSink,
                          MeterRegistry metrics,
                          @Value("${farewatch.ml.training.min-samples:100}") int minSamples,
                          @Value("${farewatch.ml.training.default-contamination:0.05}") double defaultContamination,
                          @Value("${farewatch.ml.training.random-seed:42}") long randomSeed) {
    this.data = data;
    this.detectors = detectors;
    this.models = models;
    this.metricsSink = metricsSink;
    this.metrics = metrics;
    this.trainingDuration = metrics.timer("farewatch_training_duration_seconds");
    this.minSamples = minSamples;
    this.defaultContamination = defaultContamination;
    this.randomSeed = randomSeed;
  }

  /**
   * Train and publish a model.
   *
   * @param routeId route to train, or empty for the global model
   * @return the outcome; fewer than the minimum number of usable rows is a skip, not an error
   */
  public TrainingOutcome train(Optional<String> routeId) {
    String modelId = routeId.orElse(ModelStore.GLOBAL_MODEL_ID);
    Instant start = Instant.now();
    Timer.Sample sample = Timer.start(metrics);
    try {
      log.info("[train] Training model '{}'", modelId);
      List<LabeledSample> samples = labeledSamples(data.fetchTrainingRows(routeId));
      if (samples.size() < minSamples) {
        log.warn("[train] Not enough data for '{}': {} rows (need {}), keeping current model",
            modelId, samples.size(), minSamples);
        runs("skipped").increment();
        return TrainingOutcome.skipped(modelId, samples.size());
      }

      double[][] matrix = samples.stream()
          .map(s -> s.features().toModelInput())
          .toArray(double[][]::new);
      StandardScaler scaler = StandardScaler.fit(matrix);
      double[][] scaled = scaler.transform(matrix);

      double contamination = contamination(samples);
      if (contamination > MAX_CONTAMINATION) {
        log.warn("[train] Label fraction {} for '{}' exceeds {}, fitting with the cap",
            contamination, modelId, MAX_CONTAMINATION);
      }
      AnomalyDetector detector = detectors.fit(scaled, Math.min(contamination, MAX_CONTAMINATION));

      long detected = 0;
      for (double[] row : scaled) {
        if (detector.isOutlier(row)) {
          detected++;
        }
      }

      Instant trainedAt = Instant.now();
      models.put(new AnomalyModel(modelId, detector, scaler, trainedAt, samples.size(), contamination));
      metricsSink.record(new ModelMetrics(modelId, contamination, samples.size(), detected, trainedAt));
      runs("trained").increment();

      log.info("[train] Model '{}' trained on {} rows: contamination={} detected={} in {} ms",
          modelId, samples.size(), String.format("%.4f", contamination), detected,
          trainedAt.toEpochMilli() - start.toEpochMilli());
      return new TrainingOutcome(modelId, TrainingOutcome.Status.TRAINED, samples.size(), contamination, detected);
    } catch (RuntimeException e) {
      runs("failed").increment();
      throw e;
    } finally {
      sample.stop(trainingDuration);
    }
  }

  /**
   * Fit and publish a model on standard-normal noise, for deployments that must answer every
   * scoring request even before real training has happened.
   */
  public AnomalyModel synthesizeDefault(String modelId) {
    Random random = new Random(randomSeed);
    double[][] rows = new double[SYNTHETIC_ROWS][FeatureVector.MODEL_FEATURE_COUNT];
    for (double[] row : rows) {
      for (int j = 0; j < row.length; j++) {
        row[j] = random.nextGaussian();
      }
    }
    StandardScaler scaler = StandardScaler.fit(rows);
    AnomalyDetector detector = detectors.fit(scaler.transform(rows), SYNTHETIC_CONTAMINATION);
    AnomalyModel model = new AnomalyModel(modelId, detector, scaler, Instant.now(), SYNTHETIC_ROWS,
        SYNTHETIC_CONTAMINATION);
    models.put(model);
    runs("synthesized").increment();
    log.info("[train] Synthesized default model '{}'", modelId);
    return model;
  }

  private static List<LabeledSample> labeledSamples(List<TrainingRow> rows) {
    return rows.stream()
        .filter(r -> r.statistics().hasAverage())
        .map(r -> new LabeledSample(FeatureExtractor.extract(r), r.anomaly()))
        .toList();
  }

  private double contamination(List<LabeledSample> samples) {
    long positives = samples.stream().filter(LabeledSample::anomaly).count();
    if (positives == 0) {
      return defaultContamination;
    }
    return (double) positives / samples.size();
  }

  private Counter runs(String outcome) {
    return metrics.counter("farewatch_training_runs_total", "outcome", outcome);
  }
}
