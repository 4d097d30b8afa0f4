package com.flamingo.ai.contentpipeline.service.capability;

import com.flamingo.ai.contentpipeline.config.PipelineConfig;
import com.flamingo.ai.contentpipeline.exception.FatalCapabilityException;
import com.flamingo.ai.contentpipeline.exception.TransientCapabilityException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Calls external capabilities with exponential backoff.
 *
 * <p>Only {@link TransientCapabilityException} is retried. Once the attempt limit is reached the
 * last transient failure is reported as a {@link FatalCapabilityException}, so callers see exactly
 * one failure type per call.
 */
@Component
@Slf4j
public class CapabilityInvoker {

  private final RetryRegistry retryRegistry;
  private final MeterRegistry meterRegistry;
  private final int maxAttempts;

  public CapabilityInvoker(PipelineConfig pipelineConfig, MeterRegistry meterRegistry) {
    PipelineConfig.RetrySettings settings = pipelineConfig.getRetry();
    this.maxAttempts = settings.getMaxAttempts();
    this.meterRegistry = meterRegistry;

    RetryConfig retryConfig =
        RetryConfig.custom()
            .maxAttempts(settings.getMaxAttempts())
            .intervalFunction(
                IntervalFunction.ofExponentialBackoff(
                    settings.getBackoffBase(), settings.getBackoffMultiplier()))
            .retryExceptions(TransientCapabilityException.class)
            .build();
    this.retryRegistry = RetryRegistry.of(retryConfig);
    this.retryRegistry
        .getEventPublisher()
        .onEntryAdded(
            event ->
                event
                    .getAddedEntry()
                    .getEventPublisher()
                    .onRetry(
                        retryEvent ->
                            log.warn(
                                "Retrying {} (attempt {}): {}",
                                retryEvent.getName(),
                                retryEvent.getNumberOfRetryAttempts(),
                                retryEvent.getLastThrowable().getMessage())));
  }

  /**
   * Invokes a capability call, retrying transient failures.
   *
   * @param capability name used for logs, metrics and error reports
   * @param call the capability call
   * @return the call's result
   * @throws FatalCapabilityException when the call fails fatally or runs out of attempts
   */
  public <T> T invoke(String capability, Supplier<T> call) {
    Retry retry = retryRegistry.retry(capability);
    Supplier<T> classified =
        () -> {
          try {
            return call.get();
          } catch (RuntimeException e) {
            throw CapabilityFailures.classify(capability, e);
          }
        };

    try {
      T result = Retry.decorateSupplier(retry, classified).get();
      meterRegistry.counter("capability.calls", "capability", capability, "outcome", "success")
          .increment();
      return result;
    } catch (TransientCapabilityException e) {
      meterRegistry.counter("capability.calls", "capability", capability, "outcome", "exhausted")
          .increment();
      log.error("{} still failing after {} attempts: {}", capability, maxAttempts, e.getMessage());
      throw new FatalCapabilityException(
          capability, capability + " failed after " + maxAttempts + " attempts", e);
    } catch (FatalCapabilityException e) {
      meterRegistry.counter("capability.calls", "capability", capability, "outcome", "fatal")
          .increment();
      throw e;
    }
  }
}
