package org.dxworks.rapidframe.naming;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memoizes lookups of a slower oracle. Safe to share between parallel file
 * workers.
 */
public final class CachingWordOracle implements WordOracle {

    private final WordOracle delegate;
    private final Map<String, Boolean> cache = new ConcurrentHashMap<>();

    public CachingWordOracle(WordOracle delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public boolean isAvailable() {
        return delegate.isAvailable();
    }

    @Override
    public boolean isWord(String lowercaseToken) {
        return cache.computeIfAbsent(lowercaseToken, delegate::isWord);
    }
}
