package com.farewatch.ml.store;

import com.farewatch.ml.detector.DetectorFactory;
import com.farewatch.ml.feature.StandardScaler;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Converts {@link AnomalyModel}s to and from the two blobs kept by {@link ModelArtifactStore}.
 * The detector blob wraps the library's own state together with the training metadata. Both
 * blobs carry the same generation id, and a pair whose ids differ is rejected on decode.
 */
@Component
public class ModelCodec {

  private final DetectorFactory detectors;
  private final ObjectMapper json;

  public ModelCodec(DetectorFactory detectors) {
    this.detectors = detectors;
    this.json = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  public ModelArtifacts encode(AnomalyModel model) {
    if (!model.isTrained()) {
      throw new IllegalArgumentException("Refusing to persist untrained model " + model.modelId());
    }
    try {
      String generation = UUID.randomUUID().toString();
      JsonNode detectorState = json.readTree(detectors.serialize(model.detector()));
      DetectorEnvelope envelope = new DetectorEnvelope(generation, model.modelId(), model.trainedAt(),
          model.sampleCount(), model.contamination(), detectorState);
      ScalerState scaler = new ScalerState(generation, model.scaler().mean(), model.scaler().scale());
      return new ModelArtifacts(json.writeValueAsBytes(envelope), json.writeValueAsBytes(scaler));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to encode model " + model.modelId(), e);
    }
  }

  public AnomalyModel decode(String modelId, ModelArtifacts artifacts) {
    try {
      DetectorEnvelope envelope = json.readValue(artifacts.detectorBlob(), DetectorEnvelope.class);
      ScalerState scaler = json.readValue(artifacts.scalerBlob(), ScalerState.class);
      if (!Objects.equals(envelope.generation(), scaler.generation())) {
        throw new IllegalStateException("Detector and scaler of model " + modelId
            + " belong to different generations (" + envelope.generation() + " vs " + scaler.generation() + ")");
      }
      return new AnomalyModel(
          modelId,
          detectors.deserialize(json.writeValueAsBytes(envelope.detector())),
          StandardScaler.of(scaler.mean(), scaler.scale()),
          envelope.trainedAt(),
          envelope.sampleCount(),
          envelope.contamination());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to decode model " + modelId, e);
    }
  }

  record DetectorEnvelope(String generation, String modelId, Instant trainedAt, int sampleCount,
                          double contamination, JsonNode detector) {}

  record ScalerState(String generation, double[] mean, double[] scale) {}
}
