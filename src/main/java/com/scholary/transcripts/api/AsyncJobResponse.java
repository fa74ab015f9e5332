package com.scholary.transcripts.api;

/**
 * Response for an async acquisition request.
 *
 * <p>Returns a job ID that can be used to poll for status.
 */
public record AsyncJobResponse(String jobId, String statusUrl) {}
