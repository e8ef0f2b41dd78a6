package com.farewatch.ml.training;

import com.farewatch.ml.detector.AnomalyDetector;
import com.farewatch.ml.feature.StandardScaler;
import com.farewatch.ml.model.TrainingOutcome;
import com.farewatch.ml.model.TrainingRequest;
import com.farewatch.ml.store.AnomalyModel;
import com.farewatch.ml.store.ModelStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TrainingServiceTest {

  @Mock
  private TrainingPipeline pipeline;
  @Mock
  private HistoricalDataStore data;
  @Mock
  private ModelStore models;

  private ThreadPoolTaskExecutor executor;
  private TrainingService service;

  @BeforeEach
  void setUp() {
    executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setThreadNamePrefix("model-training-");
    executor.initialize();
    service = new TrainingService(pipeline, data, models, executor);
  }

  @AfterEach
  void tearDown() {
    executor.shutdown();
  }

  @Test
  @DisplayName("Should run fits on the training thread, not the caller's")
  void shouldFitOffCallerThread() {
    AtomicReference<String> thread = new AtomicReference<>();
    when(pipeline.train(Optional.of("r-1"))).thenAnswer(inv -> {
      thread.set(Thread.currentThread().getName());
      return TrainingOutcome.skipped("r-1", 3);
    });

    service.train(Optional.of("r-1"));

    assertThat(thread.get()).startsWith("model-training-");
  }

  @Test
  @DisplayName("Should retrain global first and then every tier 1 and 2 route")
  void shouldRetrainAll() {
    when(data.fetchRoutesByTiers(List.of("1", "2"))).thenReturn(List.of("a", "b"));
    when(pipeline.train(any())).thenAnswer(inv -> {
      Optional<String> id = inv.getArgument(0);
      return TrainingOutcome.skipped(id.orElse("global"), 0);
    });

    List<TrainingOutcome> outcomes = service.trigger(new TrainingRequest(null, true));

    assertThat(outcomes).extracting(TrainingOutcome::modelId).containsExactly("global", "a", "b");
    InOrder order = inOrder(pipeline);
    order.verify(pipeline).train(Optional.empty());
    order.verify(pipeline).train(Optional.of("a"));
    order.verify(pipeline).train(Optional.of("b"));
  }

  @Test
  @DisplayName("Should train global when no route is given")
  void shouldDefaultToGlobal() {
    when(pipeline.train(Optional.empty())).thenReturn(TrainingOutcome.skipped("global", 0));

    service.trigger(new TrainingRequest("  ", false));

    verify(pipeline).train(Optional.empty());
    verify(data, never()).fetchRoutesByTiers(any());
  }

  @Test
  @DisplayName("Should rethrow the pipeline's own exception")
  void shouldUnwrapFailures() {
    when(pipeline.train(Optional.of("r-1"))).thenThrow(new IllegalStateException("boom"));

    assertThatThrownBy(() -> service.train(Optional.of("r-1")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("boom");
  }

  @Test
  @DisplayName("Should not synthesize when a trained model already exists")
  void shouldReuseExistingModel() {
    AnomalyModel existing = new AnomalyModel("r-1", mock(AnomalyDetector.class),
        StandardScaler.of(new double[] {0}, new double[] {1}), Instant.now(), 100, 0.05);
    when(models.get("r-1")).thenReturn(Optional.of(existing));

    assertThat(service.synthesizeIfAbsent("r-1")).isSameAs(existing);
    verify(pipeline, never()).synthesizeDefault(any());
  }
}
