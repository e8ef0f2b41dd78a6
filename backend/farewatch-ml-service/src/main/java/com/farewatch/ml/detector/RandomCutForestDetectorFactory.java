package com.farewatch.ml.detector;

import com.amazon.randomcutforest.RandomCutForest;
import com.amazon.randomcutforest.state.RandomCutForestMapper;
import com.amazon.randomcutforest.state.RandomCutForestState;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Fits Random Cut Forests with a fixed seed so that identical training data always
 * yields the same forest, and persists them as JSON (tree state included, so a
 * restored forest scores exactly like the original).
 */
@Component
public class RandomCutForestDetectorFactory implements DetectorFactory {

  private static final Logger log = LoggerFactory.getLogger(RandomCutForestDetectorFactory.class);

  private final int numberOfTrees;
  private final int maxSampleSize;
  private final long randomSeed;
  private final ObjectMapper json;

  public RandomCutForestDetectorFactory(@Value("${farewatch.ml.training.trees:200}") int numberOfTrees,
                                        @Value("${farewatch.ml.training.max-sample-size:256}") int maxSampleSize,
                                        @Value("${farewatch.ml.training.random-seed:42}") long randomSeed) {
    if (numberOfTrees < 1) {
      throw new IllegalArgumentException("numberOfTrees must be >= 1, got: " + numberOfTrees);
    }
    if (maxSampleSize < 1) {
      throw new IllegalArgumentException("maxSampleSize must be >= 1, got: " + maxSampleSize);
    }
    this.numberOfTrees = numberOfTrees;
    this.maxSampleSize = maxSampleSize;
    this.randomSeed = randomSeed;
    this.json = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  @Override
  public AnomalyDetector fit(double[][] scaledRows, double contamination) {
    Objects.requireNonNull(scaledRows, "scaledRows must not be null");
    if (scaledRows.length == 0) {
      throw new IllegalArgumentException("cannot fit a detector on an empty matrix");
    }
    if (!(contamination > 0.0 && contamination <= 0.5)) {
      throw new IllegalArgumentException("contamination must be in (0, 0.5], got: " + contamination);
    }

    // "auto" per-tree sample size, capped by the number of rows
    int sampleSize = Math.min(maxSampleSize, scaledRows.length);
    RandomCutForest forest = RandomCutForest.builder()
        .dimensions(scaledRows[0].length)
        .numberOfTrees(numberOfTrees)
        .sampleSize(sampleSize)
        .randomSeed(randomSeed)
        .timeDecay(0.0)
        .build();
    for (double[] row : scaledRows) {
      forest.update(row);
    }

    RandomCutForestDetector unthresholded = new RandomCutForestDetector(forest, 0.0);
    double[] scores = new double[scaledRows.length];
    for (int i = 0; i < scaledRows.length; i++) {
      scores[i] = unthresholded.scoreSamples(scaledRows[i]);
    }
    double offset = Percentiles.of(scores, 100.0 * contamination);
    log.debug("Fitted forest: rows={} trees={} sampleSize={} offset={}",
        scaledRows.length, numberOfTrees, sampleSize, offset);
    return new RandomCutForestDetector(forest, offset);
  }

  @Override
  public byte[] serialize(AnomalyDetector detector) {
    if (!(detector instanceof RandomCutForestDetector rcf)) {
      throw new IllegalArgumentException("Unsupported detector type: " + detector.getClass().getName());
    }
    RandomCutForestState state;
    synchronized (rcf.forest()) {
      state = mapper().toState(rcf.forest());
    }
    try {
      return json.writeValueAsBytes(new DetectorState(rcf.offset(), state));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to serialize forest state", e);
    }
  }

  @Override
  public AnomalyDetector deserialize(byte[] blob) {
    Objects.requireNonNull(blob, "blob must not be null");
    try {
      DetectorState state = json.readValue(blob, DetectorState.class);
      return new RandomCutForestDetector(mapper().toModel(state.forest()), state.offset());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to deserialize forest state", e);
    }
  }

  private static RandomCutForestMapper mapper() {
    RandomCutForestMapper mapper = new RandomCutForestMapper();
    mapper.setSaveExecutorContextEnabled(true);
    mapper.setSaveTreeStateEnabled(true);
    return mapper;
  }

  record DetectorState(double offset, RandomCutForestState forest) {}
}
