package com.mk.fx.qa.dicom.load.resource;

import com.mk.fx.qa.dicom.load.dto.controllerresponse.RunMetricsResponse;
import com.mk.fx.qa.dicom.load.dto.controllerresponse.RunSubmissionRequest;
import com.mk.fx.qa.dicom.load.metrics.MetricsSnapshot;
import com.mk.fx.qa.dicom.load.model.LoadRun;
import java.time.Instant;
import java.util.UUID;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(
    componentModel = "spring",
    imports = {UUID.class, Instant.class})
public interface RunMapper {

  @Mapping(target = "id", expression = "java(UUID.randomUUID())")
  @Mapping(target = "createdAt", expression = "java(Instant.now())")
  LoadRun toDomain(RunSubmissionRequest request);

  @Mapping(target = "latencyP50Ms", source = "p50LatencyMs")
  @Mapping(target = "latencyP95Ms", source = "p95LatencyMs")
  @Mapping(target = "latencyP99Ms", source = "p99LatencyMs")
  @Mapping(target = "latencyMinMs", source = "minLatencyMs")
  @Mapping(target = "latencyMaxMs", source = "maxLatencyMs")
  @Mapping(target = "latencyMeanMs", source = "meanLatencyMs")
  RunMetricsResponse toResponse(MetricsSnapshot snapshot);
}
