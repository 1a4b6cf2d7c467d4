package com.github.anirbanmu.herald.discord.json;

import java.util.function.Function;

public sealed interface DecodeResult<T> {
    record Success<T>(T value) implements DecodeResult<T> {
    }

    record Failure<T>(DecodeError error) implements DecodeResult<T> {
        public <U> Failure<U> cast() {
            return new Failure<>(error);
        }
    }

    static <T> DecodeResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> DecodeResult<T> formatError(String field, String detail) {
        return new Failure<>(new DecodeError.FormatError(field, detail));
    }

    default boolean isSuccess() {
        return this instanceof Success<T>;
    }

    default <U> DecodeResult<U> map(Function<? super T, ? extends U> fn) {
        if (this instanceof Success<T> s) {
            return new Success<>(fn.apply(s.value()));
        }
        return ((Failure<T>) this).cast();
    }

    default <U> DecodeResult<U> flatMap(Function<? super T, DecodeResult<U>> fn) {
        if (this instanceof Success<T> s) {
            return fn.apply(s.value());
        }
        return ((Failure<T>) this).cast();
    }

    default T orElseThrow() {
        if (this instanceof Success<T> s) {
            return s.value();
        }
        throw new GatewayDecodeException(((Failure<T>) this).error());
    }
}
