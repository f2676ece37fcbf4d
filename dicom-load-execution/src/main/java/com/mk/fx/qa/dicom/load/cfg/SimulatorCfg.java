package com.mk.fx.qa.dicom.load.cfg;

import com.mk.fx.qa.dicom.load.cstore.OutcomeKind;
import com.mk.fx.qa.dicom.load.cstore.ProtocolClient;
import com.mk.fx.qa.dicom.load.cstore.SimulatedProtocolClient;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Provides the simulated storage client when no real {@link ProtocolClient} bean is present. Its
 * behaviour is set under {@code dicom.load.simulator}.
 */
@Slf4j
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "dicom.load.simulator")
public class SimulatorCfg {

  @PositiveOrZero private long latencyMs = 20;

  @PositiveOrZero private long jitterMs = 0;

  @PositiveOrZero private int failEvery = 0;

  @NotNull private OutcomeKind failureKind = OutcomeKind.PROTOCOL_REJECTED;

  private boolean reachable = true;

  @Bean
  @ConditionalOnMissingBean(ProtocolClient.class)
  public ProtocolClient simulatedProtocolClient() {
    log.warn(
        "No ProtocolClient bean configured; runs use the simulator (latency={}ms, jitter={}ms, failEvery={} {})",
        latencyMs,
        jitterMs,
        failEvery,
        failureKind);
    return SimulatedProtocolClient.builder()
        .latency(Duration.ofMillis(latencyMs))
        .jitter(Duration.ofMillis(jitterMs))
        .failEvery(failEvery, failureKind)
        .reachable(reachable)
        .build();
  }
}
