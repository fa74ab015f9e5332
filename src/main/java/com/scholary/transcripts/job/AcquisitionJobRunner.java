package com.scholary.transcripts.job;

import com.scholary.transcripts.service.AcquisitionOrchestrator;
import com.scholary.transcripts.service.AcquisitionResult;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs acquisition jobs on the bounded acquisition executor.
 *
 * <p>Lives in its own bean so the {@code @Async} proxy applies when the controller calls it.
 */
@Service
public class AcquisitionJobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(AcquisitionJobRunner.class);

  private final AcquisitionOrchestrator orchestrator;

  public AcquisitionJobRunner(AcquisitionOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  /**
   * Acquire a transcript for the job's request and record the outcome on the job.
   *
   * <p>Only cancellation and unexpected errors fail the job.
   */
  @Async("acquisitionExecutor")
  public void run(AcquisitionJob job) {
    MDC.put("jobId", job.getJobId());
    try {
      job.start();
      LOGGER.info("Starting async acquisition for job: {}", job.getJobId());

      AcquisitionResult result = orchestrator.acquire(job.getRequest());
      job.complete(result);

      LOGGER.info(
          "Completed async acquisition for job: {}, success={}, attempts={}",
          job.getJobId(),
          result.success(),
          result.attempts().size());

    } catch (CancellationException e) {
      LOGGER.warn("Async acquisition cancelled for job: {}", job.getJobId());
      job.fail(e.getMessage());
    } catch (RuntimeException e) {
      LOGGER.error("Async acquisition failed for job: {}", job.getJobId(), e);
      job.fail(e.getMessage());
    } finally {
      MDC.remove("jobId");
    }
  }
}
