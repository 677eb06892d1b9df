package com.di.bugsummary.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Writes one structured {@code [TX] EVENT:} line per milestone of a summary operation
 * (fact change journaled, rollup batch, integrity check).
 *
 * <p>Every line carries the application instance id, the transaction id taken from the MDC
 * ({@code jobId} for scheduled rollups) and the calling thread, so interleaved writers and
 * rollups can be told apart in the log.
 */
@Slf4j
@Component
public class TransactionEventLogger {

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;
    private static final int STACK_TRACE_LINES = 5;

    private final String applicationId;

    public TransactionEventLogger(@Value("${spring.application.name:bugsummary}") String applicationName) {
        this.applicationId = applicationName + "-" + UUID.randomUUID().toString().substring(0, 8);
        log.info("[TX] TransactionEventLogger initialized with applicationId: {}", applicationId);
    }

    public String getApplicationId() {
        return applicationId;
    }

    public void logEvent(String eventType, Map<String, Object> context, String transactionId, String transactionContext) {
        logEvent(eventType, context, transactionId, transactionContext, null);
    }

    /**
     * @param eventType          e.g. {@code FACT_CHANGE_COMPLETED}
     * @param context            event details; may be null
     * @param transactionId      id from the MDC, "unknown" when null
     * @param transactionContext short name of the operation, e.g. {@code bugsummary_rollup}
     * @param exception          failure for {@code *_FAILED} events, otherwise null
     */
    public void logEvent(String eventType, Map<String, Object> context, String transactionId,
                         String transactionContext, Throwable exception) {
        Thread thread = Thread.currentThread();
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("eventType", eventType);
        event.put("timestamp", ISO_FORMATTER.format(Instant.now()));
        event.put("applicationId", applicationId);
        event.put("transactionId", transactionId != null ? transactionId : "unknown");
        event.put("threadId", thread.getId());
        event.put("threadName", thread.getName());

        Map<String, Object> details = context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>();
        if (transactionContext != null && !transactionContext.isEmpty()) {
            details.put("transactionContext", transactionContext);
        }
        if (exception != null) {
            details.put("stackTraceSummary", stackTraceSummary(exception));
        }
        if (!details.isEmpty()) {
            event.put("context", details);
        }

        if (exception != null) {
            log.warn("[TX] EVENT: {}", format(event));
        } else {
            log.info("[TX] EVENT: {}", format(event));
        }
    }

    private static String format(Map<?, ?> map) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            sb.append('"').append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else if (value instanceof Map<?, ?> nested) {
                sb.append(format(nested));
            } else if (value == null) {
                sb.append("null");
            } else {
                sb.append('"').append(escapeJson(String.valueOf(value))).append('"');
            }
        }
        return sb.append('}').toString();
    }

    private static String escapeJson(String str) {
        return str.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    static String stackTraceSummary(Throwable exception) {
        StringWriter sw = new StringWriter();
        exception.printStackTrace(new PrintWriter(sw));
        String[] lines = sw.toString().split("\n");
        int include = Math.min(STACK_TRACE_LINES, lines.length);
        StringBuilder summary = new StringBuilder();
        for (int i = 0; i < include; i++) {
            if (i > 0) summary.append(" | ");
            summary.append(lines[i].trim());
        }
        if (lines.length > STACK_TRACE_LINES) {
            summary.append(" | ... (").append(lines.length - STACK_TRACE_LINES).append(" more lines)");
        }
        return summary.toString();
    }
}
