package com.example.paperdigest.service;

import com.example.paperdigest.config.DigestProperties;
import com.example.paperdigest.port.SignalFetch;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Optional;

/**
 * In-memory cache of signal fetches keyed by (paper id, source, day).
 * An entry, once written, is never replaced; unavailable fetches are not stored.
 */
@Component
public class SignalCache {

    record Key(String paperId, String source, LocalDate day) {}

    private final Cache<Key, SignalFetch> cache;

    public SignalCache(DigestProperties properties) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(Math.max(1, properties.spotlight().cacheSize()))
                .expireAfterWrite(Duration.ofHours(36))
                .build();
    }

    public Optional<SignalFetch> get(String paperId, String source, LocalDate day) {
        return Optional.ofNullable(cache.getIfPresent(new Key(paperId, source, day)));
    }

    /**
     * @return the fetch now cached for the key (the earlier one if present)
     */
    public SignalFetch putIfAbsent(String paperId, String source, LocalDate day, SignalFetch fetch) {
        if (fetch.isUnavailable()) {
            return fetch;
        }
        SignalFetch previous = cache.asMap().putIfAbsent(new Key(paperId, source, day), fetch);
        return previous != null ? previous : fetch;
    }

    long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
