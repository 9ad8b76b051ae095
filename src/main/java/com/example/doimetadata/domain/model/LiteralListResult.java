package com.example.doimetadata.domain.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of reading a stringified list-of-mappings source field.
 * Either {@link #parsed(List) parsed} with validated entries or {@link #failed(String, Throwable) failed}
 * with a reason; callers must check {@link #isParsed()} before reading {@link #entries()}.
 */
public final class LiteralListResult {

    private final List<Map<String, Object>> entries;
    private final String failure;
    private final Throwable cause;

    private LiteralListResult(List<Map<String, Object>> entries, String failure, Throwable cause) {
        this.entries = entries;
        this.failure = failure;
        this.cause = cause;
    }

    public static LiteralListResult parsed(List<Map<String, Object>> entries) {
        return new LiteralListResult(List.copyOf(entries), null, null);
    }

    public static LiteralListResult failed(String reason, Throwable cause) {
        return new LiteralListResult(null, reason, cause);
    }

    public boolean isParsed() {
        return failure == null;
    }

    /**
     * @return validated entries
     * @throws IllegalStateException when the parse failed
     */
    public List<Map<String, Object>> entries() {
        if (!isParsed()) {
            throw new IllegalStateException("Literal list was not parsed: " + failure);
        }
        return entries;
    }

    public String failure() {
        return failure;
    }

    public Throwable cause() {
        return cause;
    }
}
