package com.example.mailagent.workflow;

import com.example.mailagent.config.MailAgentProperties;
import com.example.mailagent.integration.ExternalErrors;
import com.example.mailagent.integration.PortFailure;
import com.example.mailagent.integration.PortResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.retry.support.RetryTemplateBuilder;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Calls a port with a per-attempt timeout and retries transient failures with exponential backoff.
 * Never throws: the last failure is returned once attempts are exhausted.
 */
@Component
public class RetryingCaller {

    private static final Logger logger = LoggerFactory.getLogger(RetryingCaller.class);

    private final ExecutorService portCallExecutor;
    private final RetryTemplate retryTemplate;
    private final long callTimeoutMillis;
    private final int maxAttempts;

    public RetryingCaller(MailAgentProperties properties,
                          @Qualifier("portCallExecutor") ExecutorService portCallExecutor) {
        MailAgentProperties.Retry retry = properties.getRetry();
        this.portCallExecutor = portCallExecutor;
        this.callTimeoutMillis = retry.getCallTimeout().toMillis();
        this.maxAttempts = Math.max(1, retry.getMaxAttempts());
        this.retryTemplate = buildTemplate(retry, maxAttempts);
    }

    private static RetryTemplate buildTemplate(MailAgentProperties.Retry retry, int maxAttempts) {
        RetryTemplateBuilder builder = RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .retryOn(RetryableFailure.class);
        long initial = retry.getInitialDelay().toMillis();
        if (initial <= 0) {
            builder.noBackoff();
        } else {
            long max = Math.max(initial + 1, retry.getMaxDelay().toMillis());
            double multiplier = Math.max(1.1, retry.getMultiplier());
            builder.exponentialBackoff(initial, multiplier, max);
        }
        return builder.build();
    }

    public <T> PortResult<T> call(String operation, String instanceId, Supplier<PortResult<T>> port) {
        AtomicReference<PortResult<T>> last = new AtomicReference<>();
        try {
            return retryTemplate.execute(context -> {
                int attempt = context.getRetryCount() + 1;
                PortResult<T> result = attempt(operation, port);
                last.set(result);
                if (result.isSuccess()) {
                    return result;
                }
                PortFailure failure = result.getFailure();
                if (!failure.isRetryable()) {
                    logger.error("{} for instance {} failed permanently on attempt {}: {}", operation, instanceId, attempt, failure);
                    return result;
                }
                logger.warn("{} for instance {} failed on attempt {}/{}: {}", operation, instanceId, attempt, maxAttempts, failure);
                throw new RetryableFailure(failure);
            }, context -> {
                logger.error("{} for instance {} exhausted {} attempts: {}", operation, instanceId, maxAttempts, last.get());
                return last.get();
            });
        } catch (BackOffInterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("{} for instance {} interrupted while backing off", operation, instanceId);
            return last.get() != null ? last.get() : PortResult.failure(PortFailure.transientFailure(operation + " interrupted"));
        }
    }

    /**
     * For side effects that may have landed although the call reported a failure (timeouts, 5xx).
     * Before any repeated send, and before the first one when {@code earlierAttempt} is set,
     * {@code lookup} is asked whether the effect already exists; a match is returned instead of sending.
     */
    public <T> PortResult<T> callReconciled(String operation, String instanceId, boolean earlierAttempt,
                                            Supplier<PortResult<Optional<T>>> lookup,
                                            Supplier<PortResult<T>> send) {
        AtomicBoolean mayExist = new AtomicBoolean(earlierAttempt);
        return call(operation, instanceId, () -> {
            if (mayExist.getAndSet(true)) {
                PortResult<Optional<T>> found = lookup.get();
                if (found == null) {
                    return PortResult.failure(PortFailure.permanentFailure(operation + " lookup returned no result"));
                }
                if (!found.isSuccess()) {
                    return PortResult.failure(found.getFailure());
                }
                if (found.getValue().isPresent()) {
                    logger.info("{} for instance {} already took effect, not sending again", operation, instanceId);
                    return PortResult.success(found.getValue().get());
                }
            }
            return send.get();
        });
    }

    private <T> PortResult<T> attempt(String operation, Supplier<PortResult<T>> port) {
        Future<PortResult<T>> future;
        try {
            future = portCallExecutor.submit(port::get);
        } catch (RejectedExecutionException e) {
            return PortResult.failure(PortFailure.transientFailure(operation + " rejected, port call pool is saturated"));
        }
        try {
            PortResult<T> result = future.get(callTimeoutMillis, TimeUnit.MILLISECONDS);
            if (result == null) {
                return PortResult.failure(PortFailure.permanentFailure(operation + " returned no result"));
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            return PortResult.failure(PortFailure.transientFailure(operation + " timed out after " + callTimeoutMillis + " ms"));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return PortResult.failure(ExternalErrors.classify(operation, cause));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return PortResult.failure(PortFailure.transientFailure(operation + " interrupted"));
        }
    }

    /**
     * Signals the retry template that the attempt may be repeated.
     */
    static final class RetryableFailure extends RuntimeException {
        RetryableFailure(PortFailure failure) {
            super(failure.toString(), null, false, false);
        }
    }
}
