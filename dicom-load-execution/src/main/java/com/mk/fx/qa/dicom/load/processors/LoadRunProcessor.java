package com.mk.fx.qa.dicom.load.processors;

import com.mk.fx.qa.dicom.load.driver.RunVerdict;
import com.mk.fx.qa.dicom.load.model.LoadRun;
import java.util.UUID;

/** Executes submitted runs on behalf of the run service. */
public interface LoadRunProcessor {

  /**
   * Checks the run's options without executing anything, so bad submissions are refused up front.
   *
   * @throws com.mk.fx.qa.dicom.load.LoadSetupException if the options are unusable
   */
  void validate(LoadRun run);

  /**
   * Executes the run on the calling thread and returns its verdict.
   *
   * @throws com.mk.fx.qa.dicom.load.LoadSetupException if the run cannot start
   */
  RunVerdict execute(LoadRun run) throws Exception;

  /** Requests cooperative cancellation; safe to call before or during {@link #execute}. */
  void cancel(UUID runId);

  /** Drops whatever the processor still keeps for a finished run that left the history. */
  default void forget(UUID runId) {}
}
