package com.scholary.transcripts.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.scholary.transcripts.service.AcquisitionRequest;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory store of async acquisition jobs.
 *
 * <p>Entries expire a fixed time after submission and the store is bounded in size, so results
 * nobody polls for do not pile up. Nothing survives a restart; clients resubmit.
 */
@Repository
public class JobRepository {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobRepository.class);

  private final Cache<String, AcquisitionJob> jobs;

  public JobRepository(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes) {
    this.jobs =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .removalListener(
                (String jobId, AcquisitionJob job, RemovalCause cause) -> {
                  if (cause.wasEvicted()) {
                    LOGGER.debug("Evicted acquisition job: {}, cause={}", jobId, cause);
                  }
                })
            .build();
    LOGGER.info(
        "Initialized job store: maxSize={}, expireAfterMinutes={}", maxSize, expireAfterMinutes);
  }

  /** Register a new PENDING job for the request under a fresh ID. */
  public AcquisitionJob create(AcquisitionRequest request) {
    AcquisitionJob job = new AcquisitionJob(UUID.randomUUID().toString(), request);
    jobs.put(job.getJobId(), job);
    return job;
  }

  public Optional<AcquisitionJob> findById(String jobId) {
    return Optional.ofNullable(jobs.getIfPresent(jobId));
  }

  public void delete(String jobId) {
    jobs.invalidate(jobId);
  }
}
