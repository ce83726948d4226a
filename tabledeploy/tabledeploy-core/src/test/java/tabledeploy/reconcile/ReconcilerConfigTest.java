package tabledeploy.reconcile;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ReconcilerConfigTest {
  @Test
  void backoffDoublesUpToTheCap() {
    ReconcilerConfig config = ReconcilerConfig.builder()
            .retryBackoff(Duration.ofMillis(100))
            .maxRetryBackoff(Duration.ofMillis(500))
            .build();

    assertThat(config.backoffBefore(2)).isEqualTo(Duration.ofMillis(100));
    assertThat(config.backoffBefore(3)).isEqualTo(Duration.ofMillis(200));
    assertThat(config.backoffBefore(4)).isEqualTo(Duration.ofMillis(400));
    assertThat(config.backoffBefore(5)).isEqualTo(Duration.ofMillis(500));
    assertThat(config.backoffBefore(50)).isEqualTo(Duration.ofMillis(500));
  }

  @Test
  void defaults() {
    ReconcilerConfig config = ReconcilerConfig.defaults();

    assertThat(config.batchSize()).isEqualTo(25);
    assertThat(config.maxAttempts()).isEqualTo(3);
    assertThat(config.retryTransportErrors()).isFalse();
  }

  @Test
  void rejectsNonsense() {
    assertThrows(IllegalArgumentException.class, () -> ReconcilerConfig.builder().maxAttempts(0).build());
    assertThrows(IllegalArgumentException.class, () -> ReconcilerConfig.builder().retryBackoff(Duration.ofMillis(-1)).build());
    assertThrows(IllegalArgumentException.class, () -> ReconcilerConfig.defaults().backoffBefore(1));
  }
}
