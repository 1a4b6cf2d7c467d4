package com.github.anirbanmu.herald.discord;

import java.util.function.Function;

// outcome of one REST call. failures are values, not exceptions
public sealed interface DiscordResult<T> {
    record Success<T>(T value) implements DiscordResult<T> {
    }

    record Failure<T>(String message, int statusCode, Throwable exception) implements DiscordResult<T> {
        public Failure(String message) {
            this(message, -1, null);
        }

        public Failure(String message, Throwable exception) {
            this(message, -1, exception);
        }

        public Failure(String message, int statusCode) {
            this(message, statusCode, null);
        }

        // same failure, retyped for a caller expecting a different success type
        public <U> Failure<U> cast() {
            return new Failure<>(message, statusCode, exception);
        }
    }

    default boolean isSuccess() {
        return this instanceof Success<T>;
    }

    default <U> DiscordResult<U> map(Function<? super T, ? extends U> fn) {
        if (this instanceof Success<T> s) {
            return new Success<>(fn.apply(s.value()));
        }
        return ((Failure<T>) this).cast();
    }
}
