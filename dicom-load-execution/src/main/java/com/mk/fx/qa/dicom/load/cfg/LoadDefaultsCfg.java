package com.mk.fx.qa.dicom.load.cfg;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Values used for run options a submission leaves out. */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "dicom.load.defaults")
public class LoadDefaultsCfg {

  @NotBlank
  @Size(max = 16)
  private String localIdentity = "PERF_SENDER";

  @Positive private long timeoutMs = 30_000;

  @PositiveOrZero private int retryCount = 0;

  @PositiveOrZero private long retryBackoffMs = 0;

  @DecimalMin("0.0")
  @DecimalMax("1.0")
  private double maxErrorRate = 0.02;

  @PositiveOrZero private long maxP95LatencyMs = 2_000;

  @Positive private double loadMultiplier = 3.0;

  private boolean echoBeforeRun = true;

  private long seed = 42L;

  @Min(100)
  private long progressIntervalMs = 5_000;
}
