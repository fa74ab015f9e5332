package com.scholary.transcripts.http;

/** Why a strategy could not produce a transcript. */
public enum FailureKind {
  /** Timeout, DNS or connection failure, or a non-2xx response. */
  TRANSPORT,

  /** Payload fetched, but it did not contain a usable transcript. */
  CONTENT_SHAPE,

  /** Rejected before the expensive work: body too large, audio too long, invalid audio URL. */
  RESOURCE_LIMIT
}
