package com.hcltech.taskgraph.common.errorsor;

import com.hcltech.taskgraph.common.function.ThrowingSupplier;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Either a value or a non-empty list of error messages.
 * Validations use it to report every problem at once rather than failing on the first.
 */
public interface ErrorsOr<T> {

    boolean isError();

    boolean isValue();

    Optional<T> getValue();

    List<String> getErrors();

    ErrorsOr<T> addPrefixIfError(String prefix);

    <T1> T1 fold(Function<T, T1> onValue, Function<List<String>, T1> onError);

    // --- Helpers ---
    static <T> ErrorsOr<T> lift(T value) {
        return new Value<>(value);
    }

    static <T> ErrorsOr<T> error(String error) {
        return new Error<>(List.of(error));
    }

    static <T> ErrorsOr<T> errors(List<String> errors) {
        return new Error<>(errors);
    }

    /** Value when {@code errors} is empty, otherwise all of them. */
    static <T> ErrorsOr<T> valueOrErrors(T value, List<String> errors) {
        return errors.isEmpty() ? lift(value) : errors(errors);
    }

    default T valueOrThrow() {
        return getValue().orElseThrow(() ->
                new IllegalStateException("Expected value but got errors: " + getErrors()));
    }

    default List<String> errorsOrThrow() {
        if (isError()) return getErrors();
        throw new IllegalStateException("Expected errors but got value: " + getValue().orElse(null));
    }

    default <U> ErrorsOr<U> map(Function<? super T, ? extends U> f) {
        return isError() ? ErrorsOr.errors(getErrors()) : ErrorsOr.lift(f.apply(getValue().get()));
    }

    default <U> ErrorsOr<U> flatMap(Function<? super T, ErrorsOr<U>> f) {
        return isError() ? ErrorsOr.errors(getErrors()) : f.apply(getValue().get());
    }

    default void ifError(Consumer<? super List<String>> consumer) {
        if (isError()) consumer.accept(getErrors());
    }

    /** Wrap a throwing supplier; the formatter turns the exception into the error message. */
    static <T> ErrorsOr<T> trying(ThrowingSupplier<T> body, Function<Exception, String> toMsg) {
        try {
            return ErrorsOr.lift(body.get());
        } catch (Exception e) {
            return ErrorsOr.error(toMsg.apply(e));
        }
    }
}
