package com.qweather.sdk.core.envelope;

import com.qweather.sdk.core.client.QWeatherException;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

public sealed interface ApiResponse<T> permits ApiResponse.Success, ApiResponse.Failure {

    static <T> ApiResponse<T> success(Envelope<T> envelope) {
        return new Success<>(envelope);
    }

    static <T> ApiResponse<T> failure(ApiError error) {
        return new Failure<>(error);
    }

    boolean isSuccess();

    Optional<Envelope<T>> envelope();

    Optional<ApiError> error();

    <R> ApiResponse<R> map(Function<? super T, ? extends R> mapper);

    default Optional<T> payload() {
        return envelope().map(Envelope::payload);
    }

    default T orElseThrow() {
        return payload().orElseThrow(() -> new QWeatherException(error().orElseThrow()));
    }

    record Success<T>(Envelope<T> value) implements ApiResponse<T> {
        public Success {
            Objects.requireNonNull(value, "envelope is required");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<Envelope<T>> envelope() {
            return Optional.of(value);
        }

        @Override
        public Optional<ApiError> error() {
            return Optional.empty();
        }

        @Override
        public <R> ApiResponse<R> map(Function<? super T, ? extends R> mapper) {
            return new Success<>(new Envelope<>(
                    value.code(),
                    value.updateTime(),
                    value.fxLink(),
                    value.refer(),
                    mapper.apply(value.payload())
            ));
        }
    }

    record Failure<T>(ApiError cause) implements ApiResponse<T> {
        public Failure {
            Objects.requireNonNull(cause, "error is required");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<Envelope<T>> envelope() {
            return Optional.empty();
        }

        @Override
        public Optional<ApiError> error() {
            return Optional.of(cause);
        }

        @Override
        public <R> ApiResponse<R> map(Function<? super T, ? extends R> mapper) {
            return new Failure<>(cause);
        }
    }
}
