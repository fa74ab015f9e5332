package com.scholary.transcripts.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.transcripts.job.AcquisitionJob;
import com.scholary.transcripts.job.JobStatus;
import com.scholary.transcripts.service.AcquisitionResult;
import java.time.Instant;

/**
 * Status of an async acquisition job.
 *
 * @param result present once the job has completed
 * @param error present when the job failed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(
    String jobId,
    JobStatus status,
    Instant createdAt,
    Instant finishedAt,
    AcquisitionResult result,
    String error) {

  static JobStatusResponse from(AcquisitionJob job) {
    JobStatus status = job.getStatus();
    return new JobStatusResponse(
        job.getJobId(),
        status,
        job.getCreatedAt(),
        job.getFinishedAt(),
        status == JobStatus.COMPLETED ? job.getResult() : null,
        status == JobStatus.FAILED ? job.getError() : null);
  }
}
