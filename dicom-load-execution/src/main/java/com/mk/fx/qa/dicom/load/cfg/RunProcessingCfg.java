package com.mk.fx.qa.dicom.load.cfg;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** How many runs execute side by side and how many finished runs are remembered. */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "dicom.load.runs")
public class RunProcessingCfg {

  @Min(1)
  @Max(16)
  private int concurrency = 1;

  @Positive private int historySize = 50;
}
