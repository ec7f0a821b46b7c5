package io.github.flameyossnowy.skeletal.api.result;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of a storage operation: either a value or the error that stopped it.
 *
 * @param <T> the result type
 */
public final class TransactionResult<T> {
    private final T result;
    private final Throwable error;

    private TransactionResult(@Nullable T result, @Nullable Throwable error) {
        this.result = result;
        this.error = error;
    }

    @Contract("_ -> new")
    public static <T> @NotNull TransactionResult<T> success(@Nullable T result) {
        return new TransactionResult<>(result, null);
    }

    @Contract("_ -> new")
    public static <T> @NotNull TransactionResult<T> failure(@NotNull Throwable error) {
        return new TransactionResult<>(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isError() {
        return error != null;
    }

    public Optional<T> getResult() {
        return Optional.ofNullable(result);
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Returns the value, or throws an {@link IllegalStateException} carrying {@code message}
     * and the original error.
     */
    public T expect(String message) {
        if (error != null) {
            throw new IllegalStateException(message, error);
        }
        return result;
    }

    /**
     * Returns the value, rethrowing the error if it is unchecked.
     */
    public T orElseThrow() {
        if (error == null) {
            return result;
        }
        if (error instanceof RuntimeException runtime) {
            throw runtime;
        }
        throw new IllegalStateException(error);
    }

    public T orElse(T other) {
        return error == null ? result : other;
    }

    public TransactionResult<T> ifError(@NotNull Consumer<Throwable> consumer) {
        if (error != null) consumer.accept(error);
        return this;
    }

    public TransactionResult<T> ifSuccess(@NotNull Consumer<T> consumer) {
        if (error == null) consumer.accept(result);
        return this;
    }

    public <R> TransactionResult<R> map(@NotNull Function<T, R> mapper) {
        if (error != null) {
            return new TransactionResult<>(null, error);
        }
        return new TransactionResult<>(mapper.apply(result), null);
    }

    /**
     * True when this result failed with an error of the given type.
     */
    public boolean isErrorOf(@NotNull Class<? extends Throwable> type) {
        return type.isInstance(error);
    }

    @Override
    public String toString() {
        return error == null ? "Success[" + result + "]" : "Failure[" + error + "]";
    }
}
