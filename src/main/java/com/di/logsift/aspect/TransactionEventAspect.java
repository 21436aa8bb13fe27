package com.di.logsift.aspect;

import com.di.logsift.util.TransactionEventLogger;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Emits started/completed/failed events around methods annotated with {@link LogTransaction},
 * with duration, MDC transaction id, selected arguments and, on failure, the error category
 * and root cause.
 */
@Slf4j
@Aspect
@Component
public class TransactionEventAspect {

    private final TransactionEventLogger eventLogger;

    public TransactionEventAspect(TransactionEventLogger eventLogger) {
        this.eventLogger = eventLogger;
    }

    @Around("@annotation(com.di.logsift.aspect.LogTransaction)")
    public Object logTransaction(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();
        LogTransaction annotation = method.getAnnotation(LogTransaction.class);

        String eventType = annotation.eventType();
        String transactionId = MDC.get(annotation.transactionIdKey());
        long startTime = System.currentTimeMillis();

        Map<String, Object> context = extractContext(joinPoint.getArgs(), method, annotation);
        eventLogger.logEvent(eventType + "_STARTED", context, transactionId, annotation.transactionContext());

        try {
            Object result = joinPoint.proceed();

            long durationMs = System.currentTimeMillis() - startTime;
            if (result != null && annotation.includeResult()) {
                context.put("result", result.toString());
            }
            context.put("durationMs", durationMs);
            eventLogger.logEvent(eventType + "_COMPLETED", context,
                    transactionId != null ? transactionId : MDC.get(annotation.transactionIdKey()),
                    annotation.transactionContext());
            return result;

        } catch (Throwable e) {
            long durationMs = System.currentTimeMillis() - startTime;

            ErrorCategory errorCategory = ErrorCategory.categorize(e);
            context.put("errorMessage", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            context.put("errorType", e.getClass().getSimpleName());
            context.put("errorCategory", errorCategory.name());
            context.put("errorCategoryDescription", errorCategory.getDescription());
            context.put("durationMs", durationMs);

            Throwable rootCause = getRootCause(e);
            if (rootCause != e) {
                context.put("rootCauseType", rootCause.getClass().getSimpleName());
                context.put("rootCauseMessage", rootCause.getMessage());
            }

            eventLogger.logEvent(eventType + "_FAILED", context, transactionId, annotation.transactionContext(), e);
            throw e;
        }
    }

    private Map<String, Object> extractContext(Object[] args, Method method, LogTransaction annotation) {
        Map<String, Object> context = new LinkedHashMap<>();
        String[] parameterNames = annotation.parameterNames();

        if (parameterNames.length > 0) {
            for (int i = 0; i < Math.min(args.length, parameterNames.length); i++) {
                if (parameterNames[i] != null && !parameterNames[i].isEmpty()) {
                    context.put(parameterNames[i], describe(args[i]));
                }
            }
        } else {
            Parameter[] parameters = method.getParameters();
            for (int i = 0; i < parameters.length && i < args.length; i++) {
                if (isSimple(args[i])) {
                    context.put(parameters[i].getName(), describe(args[i]));
                }
            }
        }

        context.put("method", method.getName());
        context.put("className", method.getDeclaringClass().getSimpleName());
        return context;
    }

    private static boolean isSimple(Object value) {
        return value == null || value instanceof CharSequence || value instanceof Number
                || value instanceof Boolean || value instanceof Path || value instanceof Enum<?>;
    }

    private static Object describe(Object value) {
        if (value == null || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        return value.toString();
    }

    private Throwable getRootCause(Throwable exception) {
        Throwable cause = exception.getCause();
        if (cause == null || cause == exception) {
            return exception;
        }
        return getRootCause(cause);
    }
}
