package com.myorg.scf.sidecar.retry;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff.
 *
 * <p>Attempt 1 runs immediately; the delay before attempt {@code n+1} is
 * {@code baseDelay * backoffFactor^(n-1)}. Only failures assignable to one of {@code retryOn}
 * are retried, anything else propagates after the first attempt. When attempts run out the
 * last failure is rethrown as is.
 */
@Slf4j
@Getter
public final class RetryPolicy {

    /** Blocking pause between attempts. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration d) throws InterruptedException;
    }

    public static final Sleeper THREAD_SLEEP = d -> Thread.sleep(d.toMillis());

    private final String name;
    private final int maxAttempts;
    private final Duration baseDelay;
    private final double backoffFactor;
    private final Set<Class<? extends Throwable>> retryOn;
    private final Sleeper sleeper;

    private RetryPolicy(Builder b) {
        if (b.maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (b.baseDelay.isNegative()) throw new IllegalArgumentException("baseDelay must be >= 0");
        if (b.backoffFactor < 1.0) throw new IllegalArgumentException("backoffFactor must be >= 1");
        if (b.retryOn.isEmpty()) throw new IllegalArgumentException("retryOn must not be empty");
        this.name = b.name;
        this.maxAttempts = b.maxAttempts;
        this.baseDelay = b.baseDelay;
        this.backoffFactor = b.backoffFactor;
        this.retryOn = Set.copyOf(b.retryOn);
        this.sleeper = b.sleeper;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Fixed interval, any exception retried. */
    public static RetryPolicy fixed(String name, int maxAttempts, Duration interval) {
        return builder().name(name).maxAttempts(maxAttempts).baseDelay(interval).backoffFactor(1.0)
                .retryOn(Exception.class).build();
    }

    /** Delay before attempt {@code attempt + 1}; attempt is 1-based. */
    public Duration delayAfter(int attempt) {
        double factor = Math.pow(backoffFactor, Math.max(0, attempt - 1));
        long ms = (long) Math.min(Long.MAX_VALUE, baseDelay.toMillis() * factor);
        return Duration.ofMillis(ms);
    }

    public boolean isRetryable(Throwable t) {
        for (Class<? extends Throwable> c : retryOn) {
            if (c.isInstance(t)) return true;
        }
        return false;
    }

    public <T, E extends Exception> T execute(RetryableCall<T, E> call) throws E {
        return execute(call, () -> false);
    }

    /**
     * Stops early once {@code cancelled} turns true or the calling thread is interrupted while
     * waiting: no further attempt is made and the last failure is rethrown.
     */
    public <T, E extends Exception> T execute(RetryableCall<T, E> call, BooleanSupplier cancelled) throws E {
        int attempt = 1;
        while (true) {
            try {
                return call.call();
            } catch (Exception e) {
                if (!isRetryable(e) || attempt >= maxAttempts || cancelled.getAsBoolean()) throw e;

                Duration delay = delayAfter(attempt);
                log.warn("Retry [{}] attempt {}/{} failed ({}), next in {}ms",
                        name, attempt, maxAttempts, e.toString(), delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
                if (cancelled.getAsBoolean()) {
                    log.debug("Retry [{}] cancelled after attempt {}", name, attempt);
                    throw e;
                }
                attempt++;
            }
        }
    }

    /**
     * Same contract for calls that complete asynchronously. The returned future fails with the
     * last failure itself, not a wrapper.
     */
    public <T> CompletableFuture<T> executeAsync(Supplier<CompletableFuture<T>> call) {
        CompletableFuture<T> result = new CompletableFuture<>();
        attemptAsync(call, 1, result);
        return result;
    }

    private <T> void attemptAsync(Supplier<CompletableFuture<T>> call, int attempt, CompletableFuture<T> result) {
        CompletableFuture<T> f;
        try {
            f = Objects.requireNonNull(call.get(), "call returned null");
        } catch (Throwable t) {
            f = CompletableFuture.failedFuture(t);
        }

        f.whenComplete((value, err) -> {
            if (err == null) {
                result.complete(value);
                return;
            }
            Throwable cause = unwrap(err);
            if (!isRetryable(cause) || attempt >= maxAttempts) {
                result.completeExceptionally(cause);
                return;
            }
            Duration delay = delayAfter(attempt);
            log.warn("Retry [{}] attempt {}/{} failed ({}), next in {}ms",
                    name, attempt, maxAttempts, cause.toString(), delay.toMillis());
            Executor later = CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS);
            later.execute(() -> attemptAsync(call, attempt + 1, result));
        });
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }

    public static final class Builder {
        private String name = "default";
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private double backoffFactor = 2.0;
        private final Set<Class<? extends Throwable>> retryOn = new LinkedHashSet<>();
        private Sleeper sleeper = THREAD_SLEEP;

        private Builder() {}

        public Builder name(String name) { this.name = name; return this; }
        public Builder maxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; return this; }
        public Builder baseDelay(Duration baseDelay) { this.baseDelay = Objects.requireNonNull(baseDelay); return this; }
        public Builder backoffFactor(double backoffFactor) { this.backoffFactor = backoffFactor; return this; }
        public Builder sleeper(Sleeper sleeper) { this.sleeper = Objects.requireNonNull(sleeper); return this; }

        @SafeVarargs
        public final Builder retryOn(Class<? extends Throwable>... types) {
            for (Class<? extends Throwable> t : types) retryOn.add(Objects.requireNonNull(t));
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
