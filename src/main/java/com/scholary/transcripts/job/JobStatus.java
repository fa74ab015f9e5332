package com.scholary.transcripts.job;

/** Lifecycle of an async acquisition job. PENDING moves to PROCESSING, then to a final state. */
public enum JobStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED;

  public boolean isFinished() {
    return this == COMPLETED || this == FAILED;
  }
}
