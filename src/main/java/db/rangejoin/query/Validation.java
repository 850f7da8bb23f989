package db.rangejoin.query;

import java.util.function.Function;

/**
 * Outcome of a validation step: a value, or the first error found.
 */
public final class Validation<T> {
    private final T value;
    private final JoinError error;

    private Validation(T value, JoinError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Validation<T> ok(T value) { return new Validation<>(value, null); }

    public static <T> Validation<T> fail(JoinError error) {
        if (error == null) throw new IllegalArgumentException("error must not be null");
        return new Validation<>(null, error);
    }

    public boolean isOk() { return error == null; }

    public JoinError error() { return error; }

    public T value() {
        if (error != null) throw new IllegalStateException("Validation failed: " + error);
        return value;
    }

    // Carries the error of a failed step into a result of another type
    public <U> Validation<U> propagate() {
        if (error == null) throw new IllegalStateException("Cannot propagate a successful validation");
        return fail(error);
    }

    public <U> Validation<U> map(Function<? super T, ? extends U> fn) {
        return isOk() ? ok(fn.apply(value)) : fail(error);
    }

    public T orElseThrow() {
        if (error != null) throw new RangeJoinException(error);
        return value;
    }

    @Override
    public String toString() { return isOk() ? "Ok(" + value + ")" : "Fail(" + error + ")"; }
}
