package com.marketengine.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.function.Consumer;

/**
 * Tags a refinement pipeline with its analysis snapshot id and exposes the id
 * to log statements, both as an argument and as the {@code snapshotId} MDC key
 * used by the log pattern. MDC holds the id only while the statement runs.
 */
public final class SnapshotTrace {

    public static final String KEY = "snapshotId";

    private SnapshotTrace() {}

    /** Call last in assembly; {@code contextWrite} is visible to every upstream operator. */
    public static <T> Mono<T> tag(Mono<T> mono, String snapshotId) {
        return mono.contextWrite(ctx -> ctx.put(KEY, snapshotId));
    }

    /** Runs {@code statement} with the tagged id, or {@code "unknown"} for an untagged pipeline. */
    public static void log(ContextView ctx, Consumer<String> statement) {
        String snapshotId = ctx.getOrDefault(KEY, "unknown");
        MDC.put(KEY, snapshotId);
        try {
            statement.accept(snapshotId);
        } finally {
            MDC.remove(KEY);
        }
    }
}
