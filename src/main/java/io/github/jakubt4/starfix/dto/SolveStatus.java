package io.github.jakubt4.starfix.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Outcome code carried in {@link SolveResult#status()}. Serialized as its integer code.
 */
public enum SolveStatus {

    MATCH_FOUND(1),
    NO_MATCH(2),
    TIMEOUT(3),
    CANCELLED(4),
    TOO_FEW(5);

    private final int code;

    SolveStatus(final int code) {
        this.code = code;
    }

    @JsonValue
    public int code() {
        return code;
    }

    @JsonCreator
    public static SolveStatus fromCode(final int code) {
        return Arrays.stream(values())
                .filter(status -> status.code == code)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown solve status code: " + code));
    }
}
