package com.barte.sdk.decode;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Value of an optional response field. Keeps apart a field the server did not
 * send ({@link State#ABSENT}), one it sent as JSON {@code null} ({@link State#NULL})
 * and one that carries a value ({@link State#PRESENT}).
 */
public final class Field<T> {

    public enum State { ABSENT, NULL, PRESENT }

    private final State state;
    private final T value;

    private Field(State state, T value) {
        this.state = state;
        this.value = value;
    }

    public static <T> Field<T> absent() {
        return new Field<>(State.ABSENT, null);
    }

    public static <T> Field<T> ofNull() {
        return new Field<>(State.NULL, null);
    }

    public static <T> Field<T> of(T value) {
        return new Field<>(State.PRESENT, Objects.requireNonNull(value, "value"));
    }

    public State state() {
        return state;
    }

    public boolean isPresent() {
        return state == State.PRESENT;
    }

    public boolean isAbsent() {
        return state == State.ABSENT;
    }

    public boolean isNull() {
        return state == State.NULL;
    }

    /** @throws NoSuchElementException if the field is absent or null */
    public T get() {
        if (state != State.PRESENT) {
            throw new NoSuchElementException("field is " + state.name().toLowerCase());
        }
        return value;
    }

    public T orElse(T other) {
        return state == State.PRESENT ? value : other;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    /** Maps a present value; absent and null states carry over unchanged. */
    public <R> Field<R> map(Function<? super T, ? extends R> mapper) {
        if (state != State.PRESENT) {
            return new Field<>(state, null);
        }
        return Field.of(mapper.apply(value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Field)) return false;
        Field<?> other = (Field<?>) o;
        return state == other.state && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, value);
    }

    @Override
    public String toString() {
        return state == State.PRESENT ? "Field[" + value + "]" : "Field." + state;
    }
}
