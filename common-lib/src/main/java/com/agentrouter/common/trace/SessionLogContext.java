package com.agentrouter.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the session id through a reactive pipeline and exposes it, together with the agent
 * id where there is one, to log statements.
 *
 * <p>Inside a pipeline the session id lives in the Reactor Context ({@link #bind}). The MDC
 * keys exist only while a {@link #log} action runs, so a worker thread never leaks one
 * session's id into another session's log lines.
 */
public final class SessionLogContext {

    public static final String SESSION_ID_KEY = "sessionId";
    public static final String AGENT_ID_KEY   = "agentId";

    static final String UNKNOWN = "unknown";

    private SessionLogContext() {}

    /** Binds {@code sessionId} to the subscription of {@code pipeline}. Apply last. */
    public static <T> Mono<T> bind(Mono<T> pipeline, String sessionId) {
        return pipeline.contextWrite(ctx -> ctx.put(SESSION_ID_KEY, sessionId));
    }

    public static String sessionId(ContextView ctx) {
        return ctx.getOrDefault(SESSION_ID_KEY, UNKNOWN);
    }

    public static void log(String sessionId, Runnable logAction) {
        try (MDC.MDCCloseable session = MDC.putCloseable(SESSION_ID_KEY, sessionId)) {
            logAction.run();
        }
    }

    /** Same as {@link #log(String, Runnable)} with the agent id also in scope. */
    public static void log(String sessionId, String agentId, Runnable logAction) {
        try (MDC.MDCCloseable session = MDC.putCloseable(SESSION_ID_KEY, sessionId);
             MDC.MDCCloseable agent = MDC.putCloseable(AGENT_ID_KEY, agentId)) {
            logAction.run();
        }
    }
}
