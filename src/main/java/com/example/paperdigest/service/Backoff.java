package com.example.paperdigest.service;

import java.time.Duration;

/**
 * Sleeps between retry attempts.
 */
public final class Backoff {

    private Backoff() {
        // utility class
    }

    /**
     * @return false if the thread was interrupted while waiting (the interrupt flag is restored)
     */
    public static boolean pause(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public static String rootCauseMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        String msg = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return msg.length() > 150 ? msg.substring(0, 150) + "..." : msg;
    }
}
