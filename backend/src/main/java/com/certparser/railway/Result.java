package com.certparser.railway;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Two-track value: either a {@link Success} holding a non-null value or a {@link Failure} holding a
 * {@link FailureDescription}. Combinators only ever run on the track they belong to, so a chain of
 * {@code flatMap} calls stops at the first failure.
 *
 * <p>Reading the wrong track through {@link #unwrapSuccess()} or {@link #unwrapFailure()} is a
 * programming error and throws {@link IllegalStateException}.
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    record Success<T>(T value) implements Result<T> {
        public Success {
            Objects.requireNonNull(value, "Success must not hold null");
        }
    }

    record Failure<T>(FailureDescription error) implements Result<T> {
        public Failure {
            Objects.requireNonNull(error, "Failure requires an error");
        }

        <U> Failure<U> retype() {
            return new Failure<>(error);
        }
    }

    @FunctionalInterface
    interface Function3<A, B, C, R> {
        R apply(A a, B b, C c);
    }

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(FailureDescription error) {
        return new Failure<>(error);
    }

    static <T> Result<T> failure(ErrorCode code, String message) {
        return new Failure<>(FailureDescription.of(code, message));
    }

    static <T> Result<T> failure(ErrorCode code, String message, Throwable cause) {
        return new Failure<>(FailureDescription.of(code, message, cause));
    }

    /**
     * Runs a throwing computation. Any exception, or a null result, becomes a failure with the given
     * code and message; the exception is kept as the cause.
     */
    static <T> Result<T> fromComputation(Callable<T> computation, ErrorCode code, String message) {
        try {
            T value = computation.call();
            if (value == null) {
                return failure(code, message);
            }
            return success(value);
        } catch (Exception e) {
            return failure(code, message, e);
        }
    }

    static <T> Result<T> fromNullable(T value, ErrorCode code, String message) {
        return value == null ? failure(code, message) : success(value);
    }

    static <A, B, R> Result<R> combine(Result<A> first, Result<B> second, BiFunction<? super A, ? super B, ? extends R> combiner) {
        if (first instanceof Failure<A> failure) {
            return failure.retype();
        }
        if (second instanceof Failure<B> failure) {
            return failure.retype();
        }
        return success(combiner.apply(first.unwrapSuccess(), second.unwrapSuccess()));
    }

    static <A, B, C, R> Result<R> combine3(
        Result<A> first,
        Result<B> second,
        Result<C> third,
        Function3<? super A, ? super B, ? super C, ? extends R> combiner
    ) {
        if (first instanceof Failure<A> failure) {
            return failure.retype();
        }
        if (second instanceof Failure<B> failure) {
            return failure.retype();
        }
        if (third instanceof Failure<C> failure) {
            return failure.retype();
        }
        return success(combiner.apply(first.unwrapSuccess(), second.unwrapSuccess(), third.unwrapSuccess()));
    }

    static <T> Result<List<T>> allOf(List<Result<T>> results) {
        List<T> values = new ArrayList<>(results.size());
        for (Result<T> result : results) {
            if (result instanceof Failure<T> failure) {
                return failure.retype();
            }
            values.add(result.unwrapSuccess());
        }
        return success(List.copyOf(values));
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default boolean isFailure() {
        return this instanceof Failure;
    }

    default T unwrapSuccess() {
        if (this instanceof Success<T> success) {
            return success.value();
        }
        throw new IllegalStateException("unwrapSuccess() called on failure: " + ((Failure<T>) this).error());
    }

    default FailureDescription unwrapFailure() {
        if (this instanceof Failure<T> failure) {
            return failure.error();
        }
        throw new IllegalStateException("unwrapFailure() called on success");
    }

    default <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (this instanceof Success<T> success) {
            return success(mapper.apply(success.value()));
        }
        return ((Failure<T>) this).retype();
    }

    default <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
        if (this instanceof Success<T> success) {
            return Objects.requireNonNull(mapper.apply(success.value()), "flatMap function returned null");
        }
        return ((Failure<T>) this).retype();
    }

    default Result<T> ensure(Predicate<? super T> predicate, FailureDescription error) {
        if (this instanceof Success<T> success && !predicate.test(success.value())) {
            return failure(error);
        }
        return this;
    }

    default Result<T> ensure(Predicate<? super T> predicate, ErrorCode code, String message) {
        if (this instanceof Success<T> success && !predicate.test(success.value())) {
            return failure(code, message);
        }
        return this;
    }

    default Result<T> mapFailure(UnaryOperator<FailureDescription> mapper) {
        if (this instanceof Failure<T> failure) {
            return failure(mapper.apply(failure.error()));
        }
        return this;
    }

    default Result<T> recover(Function<? super FailureDescription, ? extends T> recovery) {
        if (this instanceof Failure<T> failure) {
            return success(recovery.apply(failure.error()));
        }
        return this;
    }

    default Result<T> peek(Consumer<? super T> action) {
        if (this instanceof Success<T> success) {
            action.accept(success.value());
        }
        return this;
    }

    default Result<T> peekFailure(Consumer<? super FailureDescription> action) {
        if (this instanceof Failure<T> failure) {
            action.accept(failure.error());
        }
        return this;
    }

    default <R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super FailureDescription, ? extends R> onFailure) {
        if (this instanceof Success<T> success) {
            return onSuccess.apply(success.value());
        }
        return onFailure.apply(((Failure<T>) this).error());
    }

    default T getOrElse(T defaultValue) {
        return this instanceof Success<T> success ? success.value() : defaultValue;
    }

    default T getOrElseGet(Function<? super FailureDescription, ? extends T> fallback) {
        if (this instanceof Success<T> success) {
            return success.value();
        }
        return fallback.apply(((Failure<T>) this).error());
    }

    default Result<T> within(ExecutionContext context) {
        return context.execute(() -> this);
    }

    default <U> CompletableFuture<Result<U>> mapAsync(Function<? super T, ? extends CompletionStage<U>> mapper) {
        if (this instanceof Failure<T> failure) {
            return CompletableFuture.completedFuture(failure.retype());
        }
        try {
            return mapper.apply(unwrapSuccess())
                .toCompletableFuture()
                .<Result<U>>handle((value, error) -> {
                    if (error != null) {
                        return asyncFailure(error);
                    }
                    return value == null ? asyncFailure(null) : success(value);
                });
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(asyncFailure(e));
        }
    }

    default <U> CompletableFuture<Result<U>> flatMapAsync(Function<? super T, ? extends CompletionStage<Result<U>>> mapper) {
        if (this instanceof Failure<T> failure) {
            return CompletableFuture.completedFuture(failure.retype());
        }
        try {
            return mapper.apply(unwrapSuccess())
                .toCompletableFuture()
                .<Result<U>>handle((result, error) -> {
                    if (error != null) {
                        return asyncFailure(error);
                    }
                    return result == null ? asyncFailure(null) : result;
                });
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(asyncFailure(e));
        }
    }

    private static <U> Result<U> asyncFailure(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        String detail = cause == null ? "no value produced" : String.valueOf(cause.getMessage());
        return failure(ErrorCode.EXTERNAL_SERVICE_ERROR, "Async operation failed: " + detail, cause);
    }
}
