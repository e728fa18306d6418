package com.ticketdesk;

import java.util.Objects;
import java.util.Optional;

/**
 * What one retrieval attempt produced. Only {@link Kind#FOUND} stops a
 * platform's fallback chain; the other two are expected and simply advance it.
 */
public final class StrategyOutcome {

    public enum Kind { FOUND, NOT_FOUND, TRANSPORT_ERROR }

    private final Kind kind;
    private final PlatformResult result;
    private final String detail;

    private StrategyOutcome(Kind kind, PlatformResult result, String detail) {
        this.kind = kind;
        this.result = result;
        this.detail = detail;
    }

    public static StrategyOutcome found(PlatformResult result) {
        return new StrategyOutcome(Kind.FOUND, Objects.requireNonNull(result, "result"), null);
    }

    public static StrategyOutcome notFound(String detail) {
        return new StrategyOutcome(Kind.NOT_FOUND, null, detail);
    }

    public static StrategyOutcome transportError(String detail) {
        return new StrategyOutcome(Kind.TRANSPORT_ERROR, null, detail);
    }

    public Kind kind() { return kind; }
    public String detail() { return detail; }
    public boolean isFound() { return kind == Kind.FOUND; }
    public Optional<PlatformResult> result() { return Optional.ofNullable(result); }

    @Override
    public String toString() {
        return isFound() ? "FOUND " + result : kind + " (" + detail + ")";
    }
}
