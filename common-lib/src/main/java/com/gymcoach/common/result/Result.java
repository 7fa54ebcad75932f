package com.gymcoach.common.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of one analysis computation.
 *
 * <p>Three terminal states, distinguishable without inspecting payloads:
 * <ul>
 *   <li>{@link Ok}: computed value, plus warnings such as the count of skipped records</li>
 *   <li>{@link InsufficientData}: too few usable records. A valid answer, not an error.</li>
 *   <li>{@link Failed}: the computation itself broke or an upstream input was unavailable</li>
 * </ul>
 *
 * <p>Serialized with a {@code status} discriminator ({@code ok}, {@code insufficient_data},
 * {@code failed}) so orchestration layers can branch on it directly.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "status")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Result.Ok.class,               name = "ok"),
    @JsonSubTypes.Type(value = Result.InsufficientData.class, name = "insufficient_data"),
    @JsonSubTypes.Type(value = Result.Failed.class,           name = "failed")
})
public sealed interface Result<T> permits Result.Ok, Result.InsufficientData, Result.Failed {

    record Ok<T>(
        @JsonProperty("value")    T            value,
        @JsonProperty("warnings") List<String> warnings
    ) implements Result<T> {
        public Ok {
            warnings = warnings == null ? List.of() : List.copyOf(warnings);
        }
    }

    record InsufficientData<T>(
        @JsonProperty("reason") String reason
    ) implements Result<T> {}

    record Failed<T>(
        @JsonProperty("error") AnalysisError error
    ) implements Result<T> {}

    static <T> Result<T> ok(T value) {
        return new Ok<>(value, List.of());
    }

    static <T> Result<T> ok(T value, List<String> warnings) {
        return new Ok<>(value, warnings);
    }

    static <T> Result<T> insufficient(String reason) {
        return new InsufficientData<>(reason);
    }

    static <T> Result<T> failed(String component, ErrorKind kind, String message) {
        return new Failed<>(new AnalysisError(component, kind, message));
    }

    /** Wraps a nullable value: {@code null} becomes {@link InsufficientData}. */
    static <T> Result<T> ofNullable(T value, String reasonWhenMissing) {
        return value == null ? insufficient(reasonWhenMissing) : ok(value);
    }

    @JsonIgnore
    default boolean isOk() {
        return this instanceof Ok;
    }

    @JsonIgnore
    default Optional<T> toOptional() {
        if (this instanceof Ok<T> ok) return Optional.ofNullable(ok.value());
        return Optional.empty();
    }

    default <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        if (this instanceof Ok<T> ok) return new Ok<>(mapper.apply(ok.value()), ok.warnings());
        if (this instanceof InsufficientData<T> insufficient) return new InsufficientData<>(insufficient.reason());
        Failed<T> failed = (Failed<T>) this;
        return new Failed<>(failed.error());
    }
}
