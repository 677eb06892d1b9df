package com.di.bugsummary.aspect;

import com.di.bugsummary.summary.model.BugTaskFact;
import com.di.bugsummary.util.TransactionEventLogger;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.sql.SQLException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Logs transaction events around methods annotated with {@link LogTransaction}.
 *
 * <p>Fact rows are logged by task and bug id only; collections by their size. Failures are
 * categorized with {@link ErrorCategory} and rethrown unchanged.
 */
@Slf4j
@Aspect
@Component
public class TransactionEventAspect {

    private final TransactionEventLogger eventLogger;

    public TransactionEventAspect(TransactionEventLogger eventLogger) {
        this.eventLogger = eventLogger;
    }

    @Around("@annotation(com.di.bugsummary.aspect.LogTransaction)")
    public Object logTransaction(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();
        LogTransaction annotation = method.getAnnotation(LogTransaction.class);
        if (annotation == null) {
            return joinPoint.proceed();
        }

        String eventType = annotation.eventType();
        String transactionContext = annotation.transactionContext();
        String transactionId = MDC.get(annotation.transactionIdKey());
        if (transactionId == null) {
            transactionId = MDC.get("jobId");
        }
        long startTime = System.currentTimeMillis();

        Map<String, Object> context = extractContext(joinPoint.getArgs(), signature, annotation);
        context.put("method", method.getName());
        context.put("className", method.getDeclaringClass().getSimpleName());

        eventLogger.logEvent(eventType + "_STARTED", context, transactionId, transactionContext);
        try {
            Object result = joinPoint.proceed();
            long durationMs = System.currentTimeMillis() - startTime;
            if (annotation.includeResult() && result != null) {
                context.put("result", describe(result));
            }
            context.put("durationMs", durationMs);
            eventLogger.logEvent(eventType + "_COMPLETED", context, transactionId, transactionContext);
            return result;
        } catch (Throwable e) {
            long durationMs = System.currentTimeMillis() - startTime;
            ErrorCategory errorCategory = ErrorCategory.categorize(e);
            context.put("errorMessage", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            context.put("errorType", e.getClass().getSimpleName());
            context.put("errorCategory", errorCategory.name());
            context.put("errorCategoryName", errorCategory.getName());
            context.put("durationMs", durationMs);

            Throwable rootCause = rootCause(e);
            if (rootCause != e) {
                context.put("rootCauseType", rootCause.getClass().getSimpleName());
                context.put("rootCauseMessage", rootCause.getMessage());
            }
            SQLException sqlEx = sqlCause(e);
            if (sqlEx != null) {
                context.put("sqlState", sqlEx.getSQLState());
                context.put("errorCode", sqlEx.getErrorCode());
            }
            eventLogger.logEvent(eventType + "_FAILED", context, transactionId, transactionContext, e);
            throw e;
        }
    }

    private Map<String, Object> extractContext(Object[] args, MethodSignature signature, LogTransaction annotation) {
        Map<String, Object> context = new LinkedHashMap<>();
        String[] names = annotation.parameterNames().length > 0
                ? annotation.parameterNames()
                : signature.getParameterNames();
        if (names == null) {
            return context;
        }
        for (int i = 0; i < Math.min(names.length, args.length); i++) {
            if (names[i] != null && !names[i].isEmpty()) {
                context.put(names[i], describe(args[i]));
            }
        }
        return context;
    }

    static Object describe(Object value) {
        if (value == null || value instanceof Number || value instanceof Boolean || value instanceof String) {
            return value;
        }
        if (value instanceof BugTaskFact fact) {
            return "task=" + fact.getTaskId() + " bug=" + fact.getBugId();
        }
        if (value instanceof Collection<?> c) {
            return "size=" + c.size();
        }
        return String.valueOf(value);
    }

    private static SQLException sqlCause(Throwable e) {
        if (e instanceof SQLException sqlEx) {
            return sqlEx;
        }
        if (e instanceof DataAccessException dae && dae.getMostSpecificCause() instanceof SQLException sqlEx) {
            return sqlEx;
        }
        return null;
    }

    private static Throwable rootCause(Throwable exception) {
        Throwable cause = exception.getCause();
        if (cause == null || cause == exception) {
            return exception;
        }
        return rootCause(cause);
    }
}
