package com.example.paperdigest.port;

import com.example.paperdigest.model.AttentionSignal;

import java.util.List;

/**
 * Answer of one signal source for one paper.
 */
public record SignalFetch(
        String source,
        SignalStatus status,
        List<AttentionSignal> signals,
        String detail
) {
    public SignalFetch {
        signals = signals != null ? List.copyOf(signals) : List.of();
    }

    public static SignalFetch available(String source, List<AttentionSignal> signals) {
        return signals.isEmpty()
                ? noData(source)
                : new SignalFetch(source, SignalStatus.AVAILABLE, signals, null);
    }

    public static SignalFetch noData(String source) {
        return new SignalFetch(source, SignalStatus.NO_DATA, List.of(), null);
    }

    public static SignalFetch unavailable(String source, String detail) {
        return new SignalFetch(source, SignalStatus.UNAVAILABLE, List.of(), detail);
    }

    public boolean isUnavailable() {
        return status == SignalStatus.UNAVAILABLE;
    }
}
