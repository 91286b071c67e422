package com.chaincollector.collector;

import com.chaincollector.domain.enums.ExpiryRule;
import java.util.NoSuchElementException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Outcome of one orchestrator stage: a {@link Success} carrying the value, or a {@link Failure}
 * naming the stage, the expiry rule it ran for (if any), a reason and the cause.
 */
public abstract class StageResult<T> {

    private StageResult() {}

    public static <T> StageResult<T> success(T value) {
        return new Success<>(value);
    }

    public static <T> StageResult<T> failure(
            CollectionStage stage, ExpiryRule rule, String reason, Throwable cause) {
        return new Failure<>(stage, rule, reason, cause);
    }

    /**
     * Runs {@code body}; a RuntimeException becomes a failure for {@code stage}.
     */
    public static <T> StageResult<T> attempt(CollectionStage stage, ExpiryRule rule, Supplier<T> body) {
        try {
            return success(body.get());
        } catch (RuntimeException e) {
            return failure(stage, rule, e.getMessage(), e);
        }
    }

    public abstract boolean isSuccess();

    public abstract T getValue();

    public abstract Failure<T> asFailure();

    /** Maps a success; a failure passes through retyped. */
    public abstract <R> StageResult<R> map(Function<? super T, ? extends R> mapper);

    public static final class Success<T> extends StageResult<T> {

        private final T value;

        private Success(T value) {
            this.value = value;
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getValue() {
            return value;
        }

        @Override
        public Failure<T> asFailure() {
            throw new IllegalStateException("Stage succeeded");
        }

        @Override
        public <R> StageResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Success<>(mapper.apply(value));
        }

        @Override
        public String toString() {
            return "Success(" + value + ")";
        }
    }

    public static final class Failure<T> extends StageResult<T> {

        private final CollectionStage stage;
        private final ExpiryRule rule;
        private final String reason;
        private final Throwable cause;

        private Failure(CollectionStage stage, ExpiryRule rule, String reason, Throwable cause) {
            this.stage = stage;
            this.rule = rule;
            this.reason = reason;
            this.cause = cause;
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getValue() {
            throw new NoSuchElementException("Stage " + stage + " failed: " + reason);
        }

        @Override
        public Failure<T> asFailure() {
            return this;
        }

        @Override
        public <R> StageResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Failure<>(stage, rule, reason, cause);
        }

        public CollectionStage getStage() {
            return stage;
        }

        /** Null for index-level stages. */
        public ExpiryRule getRule() {
            return rule;
        }

        public String getReason() {
            return reason;
        }

        public Throwable getCause() {
            return cause;
        }

        @Override
        public String toString() {
            return "Failure(" + stage + (rule != null ? "[" + rule + "]" : "") + ": " + reason + ")";
        }
    }
}
