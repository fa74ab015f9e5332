package com.scholary.transcripts.api;

import com.scholary.transcripts.job.AcquisitionJob;
import com.scholary.transcripts.job.AcquisitionJobRunner;
import com.scholary.transcripts.job.JobRepository;
import com.scholary.transcripts.service.AcquisitionOrchestrator;
import com.scholary.transcripts.service.AcquisitionRequest;
import com.scholary.transcripts.service.AcquisitionResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for transcript acquisition.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Synchronous acquisition (blocks until every needed strategy has run)
 *   <li>Asynchronous acquisition (returns job ID immediately)
 *   <li>Job status polling
 * </ul>
 *
 * <p>An unavailable transcript is a normal 200 response with {@code success=false}.
 */
@RestController
@RequestMapping("/api/acquisitions")
@Tag(name = "Acquisition", description = "Transcript acquisition API")
public class AcquisitionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(AcquisitionController.class);

  private final AcquisitionOrchestrator orchestrator;
  private final AcquisitionJobRunner jobRunner;
  private final JobRepository jobRepository;

  public AcquisitionController(
      AcquisitionOrchestrator orchestrator,
      AcquisitionJobRunner jobRunner,
      JobRepository jobRepository) {
    this.orchestrator = orchestrator;
    this.jobRunner = jobRunner;
    this.jobRepository = jobRepository;
  }

  @PostMapping
  @Operation(
      summary = "Acquire transcript",
      description =
          "Try the declared transcript, the episode page, mirror captions and speech-to-text in "
              + "order, returning the first transcript found and every attempt made.")
  public ResponseEntity<AcquisitionResult> acquire(
      @Valid @RequestBody AcquisitionRequestBody body) {
    AcquisitionRequest request = body.toRequest();
    LOGGER.info("Acquisition request: contentId={}", request.contentId());
    return ResponseEntity.ok(orchestrator.acquire(request));
  }

  /** Start an asynchronous acquisition job. */
  @PostMapping("/jobs")
  @Operation(
      summary = "Start acquisition job",
      description = "Start asynchronous acquisition and return job ID for status polling")
  public ResponseEntity<AsyncJobResponse> startJob(
      @Valid @RequestBody AcquisitionRequestBody body) {
    AcquisitionRequest request = body.toRequest();
    AcquisitionJob job = jobRepository.create(request);
    String jobId = job.getJobId();
    LOGGER.info("Created async acquisition job: {}, contentId={}", jobId, request.contentId());

    try {
      jobRunner.run(job);
    } catch (TaskRejectedException e) {
      jobRepository.delete(jobId);
      throw e;
    }

    return ResponseEntity.accepted()
        .body(new AsyncJobResponse(jobId, "/api/acquisitions/jobs/" + jobId));
  }

  /**
   * Get job status.
   *
   * <p>Includes the acquisition result once the job has completed.
   */
  @GetMapping("/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of an acquisition job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(job -> ResponseEntity.ok(JobStatusResponse.from(job)))
        .orElse(ResponseEntity.notFound().build());
  }
}
