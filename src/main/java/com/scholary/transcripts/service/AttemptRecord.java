package com.scholary.transcripts.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.transcripts.transcript.StrategyTag;
import java.util.Objects;

/**
 * One entry in the acquisition audit trail.
 *
 * @param strategy the strategy tried or skipped
 * @param success whether it produced the transcript
 * @param error why it did not, null on success
 * @param outcome the failure class
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AttemptRecord(
    StrategyTag strategy, boolean success, String error, AttemptOutcome outcome) {

  public AttemptRecord {
    Objects.requireNonNull(strategy, "strategy");
    Objects.requireNonNull(outcome, "outcome");
    if (success != (outcome == AttemptOutcome.SUCCEEDED)) {
      throw new IllegalArgumentException("success must match outcome " + outcome);
    }
    if (!success && (error == null || error.isBlank())) {
      throw new IllegalArgumentException("A failed attempt needs an error message");
    }
  }

  public static AttemptRecord succeeded(StrategyTag strategy) {
    return new AttemptRecord(strategy, true, null, AttemptOutcome.SUCCEEDED);
  }

  public static AttemptRecord skipped(StrategyTag strategy, String reason) {
    return new AttemptRecord(strategy, false, reason, AttemptOutcome.SKIPPED);
  }

  public static AttemptRecord failed(StrategyTag strategy, AttemptOutcome outcome, String error) {
    return new AttemptRecord(strategy, false, error, outcome);
  }
}
