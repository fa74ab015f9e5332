package com.scholary.transcripts.job;

import com.scholary.transcripts.service.AcquisitionRequest;
import com.scholary.transcripts.service.AcquisitionResult;
import java.time.Instant;
import java.util.Objects;

/**
 * One async acquisition, from submission until its result is read or evicted.
 *
 * <p>The runner thread writes and request threads read, so the mutable state is volatile and each
 * transition publishes its fields before the status.
 */
public class AcquisitionJob {

  private final String jobId;
  private final AcquisitionRequest request;
  private final Instant createdAt;

  private volatile AcquisitionResult result;
  private volatile String error;
  private volatile Instant finishedAt;
  private volatile JobStatus status;

  public AcquisitionJob(String jobId, AcquisitionRequest request) {
    this.jobId = Objects.requireNonNull(jobId, "jobId");
    this.request = Objects.requireNonNull(request, "request");
    this.createdAt = Instant.now();
    this.status = JobStatus.PENDING;
  }

  public void start() {
    requireStatus(JobStatus.PENDING);
    status = JobStatus.PROCESSING;
  }

  /** An unavailable transcript is still a completed job. */
  public void complete(AcquisitionResult result) {
    requireStatus(JobStatus.PROCESSING);
    this.result = Objects.requireNonNull(result, "result");
    this.finishedAt = Instant.now();
    status = JobStatus.COMPLETED;
  }

  public void fail(String error) {
    if (status.isFinished()) {
      throw new IllegalStateException("Job " + jobId + " already " + status);
    }
    this.error = error == null ? "Unknown error" : error;
    this.finishedAt = Instant.now();
    status = JobStatus.FAILED;
  }

  private void requireStatus(JobStatus expected) {
    if (status != expected) {
      throw new IllegalStateException(
          "Job " + jobId + " is " + status + ", expected " + expected);
    }
  }

  public String getJobId() {
    return jobId;
  }

  public AcquisitionRequest getRequest() {
    return request;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getFinishedAt() {
    return finishedAt;
  }

  public JobStatus getStatus() {
    return status;
  }

  /** The acquisition result; null until the job has completed. */
  public AcquisitionResult getResult() {
    return result;
  }

  public String getError() {
    return error;
  }
}
