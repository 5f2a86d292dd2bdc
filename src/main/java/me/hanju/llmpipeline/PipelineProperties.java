package me.hanju.llmpipeline;

import java.time.Duration;

import me.hanju.llmpipeline.payload.request.CompletionRequest;

public class PipelineProperties {

  private double defaultTemperature = CompletionRequest.DEFAULT_TEMPERATURE;
  private int defaultMaxTokens = CompletionRequest.DEFAULT_MAX_TOKENS;
  private Duration retrievalTimeout = Duration.ofSeconds(10);
  private Duration invocationTimeout = Duration.ofSeconds(60);

  public PipelineProperties() {
  }

  public PipelineProperties(
      final double defaultTemperature,
      final int defaultMaxTokens,
      final Duration retrievalTimeout,
      final Duration invocationTimeout) {
    this.defaultTemperature = defaultTemperature;
    this.defaultMaxTokens = defaultMaxTokens;
    this.retrievalTimeout = retrievalTimeout;
    this.invocationTimeout = invocationTimeout;
  }

  public double getDefaultTemperature() {
    return defaultTemperature;
  }

  public void setDefaultTemperature(final double defaultTemperature) {
    this.defaultTemperature = defaultTemperature;
  }

  public int getDefaultMaxTokens() {
    return defaultMaxTokens;
  }

  public void setDefaultMaxTokens(final int defaultMaxTokens) {
    this.defaultMaxTokens = defaultMaxTokens;
  }

  public Duration getRetrievalTimeout() {
    return retrievalTimeout;
  }

  public void setRetrievalTimeout(final Duration retrievalTimeout) {
    this.retrievalTimeout = retrievalTimeout;
  }

  public Duration getInvocationTimeout() {
    return invocationTimeout;
  }

  public void setInvocationTimeout(final Duration invocationTimeout) {
    this.invocationTimeout = invocationTimeout;
  }
}
