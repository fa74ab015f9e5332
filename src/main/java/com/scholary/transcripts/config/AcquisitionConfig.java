package com.scholary.transcripts.config;

import com.scholary.transcripts.http.HttpFetcher;
import com.scholary.transcripts.http.JdkHttpFetcher;
import java.net.http.HttpClient;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the shared HTTP client used by every acquisition strategy.
 *
 * <p>The client is built once with the configured connect timeout; strategies set their own read
 * timeouts and user agents per request.
 */
@Configuration
@EnableConfigurationProperties(AcquisitionProperties.class)
public class AcquisitionConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(AcquisitionConfig.class);

  @Bean
  public HttpClient acquisitionHttpClient(AcquisitionProperties properties) {
    LOGGER.info(
        "Initialized acquisition HTTP client: connectTimeout={}s",
        properties.http().connectTimeoutSeconds());
    return HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(properties.http().connectTimeoutSeconds()))
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
  }

  @Bean
  public HttpFetcher httpFetcher(HttpClient acquisitionHttpClient) {
    return new JdkHttpFetcher(acquisitionHttpClient);
  }
}
