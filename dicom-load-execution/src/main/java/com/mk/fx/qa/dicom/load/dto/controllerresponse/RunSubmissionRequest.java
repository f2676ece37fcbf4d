package com.mk.fx.qa.dicom.load.dto.controllerresponse;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import java.util.Map;
import lombok.Data;

/**
 * Request to start a run. {@code options} carries the run options by name, for example {@code
 * targetHost}, {@code targetRate} or {@code durationSeconds}.
 */
@Data
public class RunSubmissionRequest {

  @NotEmpty
  @JsonProperty("options")
  private Map<String, Object> options;
}
