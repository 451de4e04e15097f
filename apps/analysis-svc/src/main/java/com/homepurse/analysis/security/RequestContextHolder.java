package com.homepurse.analysis.security;

import java.util.Optional;
import org.slf4j.MDC;

/**
 * Per-request trace id and, once resolved, the caller's household scope. Both are mirrored into
 * the logging MDC.
 */
public final class RequestContextHolder {

    public static final String TRACE_MDC_KEY = "trace_id";
    public static final String HOUSEHOLD_MDC_KEY = "household_id";

    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static void begin(String traceId) {
        CONTEXT.set(new RequestContext(traceId, null));
        MDC.put(TRACE_MDC_KEY, traceId);
    }

    public static void bindScope(HouseholdScope scope) {
        RequestContext current = CONTEXT.get();
        CONTEXT.set(new RequestContext(current != null ? current.traceId() : null, scope));
        MDC.put(HOUSEHOLD_MDC_KEY, scope.householdId().toString());
    }

    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static Optional<String> traceId() {
        return get().map(RequestContext::traceId);
    }

    public static Optional<HouseholdScope> scope() {
        return get().map(RequestContext::scope);
    }

    public static void clear() {
        CONTEXT.remove();
        MDC.remove(TRACE_MDC_KEY);
        MDC.remove(HOUSEHOLD_MDC_KEY);
    }

    public record RequestContext(String traceId, HouseholdScope scope) {
    }
}
