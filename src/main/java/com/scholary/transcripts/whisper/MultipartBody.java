package com.scholary.transcripts.whisper;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Minimal multipart/form-data encoder.
 *
 * <p>The JDK HTTP client has no multipart support; the transcription API needs one file part and
 * a few text fields, which is all this writes.
 */
final class MultipartBody {

  private static final String CRLF = "\r\n";

  private final String boundary = "----transcripts" + UUID.randomUUID().toString().replace("-", "");
  private final ByteArrayOutputStream out = new ByteArrayOutputStream();

  MultipartBody field(String name, String value) {
    writePartHeader("form-data; name=\"" + name + "\"", null);
    write(value);
    write(CRLF);
    return this;
  }

  MultipartBody file(String name, Path file, String contentType) throws IOException {
    String disposition =
        "form-data; name=\"" + name + "\"; filename=\"" + file.getFileName() + "\"";
    writePartHeader(disposition, contentType);
    Files.copy(file, out);
    write(CRLF);
    return this;
  }

  String contentType() {
    return "multipart/form-data; boundary=" + boundary;
  }

  byte[] toByteArray() {
    ByteArrayOutputStream copy = new ByteArrayOutputStream(out.size() + boundary.length() + 8);
    copy.writeBytes(out.toByteArray());
    copy.writeBytes(("--" + boundary + "--" + CRLF).getBytes(StandardCharsets.UTF_8));
    return copy.toByteArray();
  }

  private void writePartHeader(String disposition, String contentType) {
    write("--" + boundary + CRLF);
    write("Content-Disposition: " + disposition + CRLF);
    if (contentType != null) {
      write("Content-Type: " + contentType + CRLF);
    }
    write(CRLF);
  }

  private void write(String text) {
    out.writeBytes(text.getBytes(StandardCharsets.UTF_8));
  }
}
