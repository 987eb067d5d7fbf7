package com.example.paperdigest.thread;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Carries the caller's MDC (run id, stage) into pooled worker threads.
 */
public final class MdcContext {

    private MdcContext() {
    }

    public static <T> Callable<T> wrap(Callable<T> task) {
        // Capture MDC context from the calling (parent) thread
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                return task.call();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
    }

    public static <T> Supplier<T> wrapSupplier(Supplier<T> task) {
        Callable<T> wrapped = wrap(task::get);
        return () -> {
            try {
                return wrapped.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        };
    }
}
