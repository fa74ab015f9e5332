package com.scholary.transcripts.api;

import com.scholary.transcripts.service.ManualTranscriptService;
import com.scholary.transcripts.transcript.Transcript;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/** Accepts transcripts entered by an operator when acquisition found nothing. */
@RestController
@Tag(name = "Manual transcripts", description = "Operator-supplied transcripts")
public class ManualTranscriptController {

  private final ManualTranscriptService manualTranscriptService;

  public ManualTranscriptController(ManualTranscriptService manualTranscriptService) {
    this.manualTranscriptService = manualTranscriptService;
  }

  @PostMapping("/api/transcripts/manual")
  @Operation(
      summary = "Submit manual transcript",
      description = "Normalize operator text into a transcript; 422 when it is too short")
  public ResponseEntity<Transcript> submit(@Valid @RequestBody ManualTranscriptRequest request) {
    return ResponseEntity.ok(
        manualTranscriptService.submit(request.text(), request.contentType(), request.language()));
  }
}
