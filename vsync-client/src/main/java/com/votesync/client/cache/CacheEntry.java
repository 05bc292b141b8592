package com.votesync.client.cache;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Duration;

/**
 * A cached value with how long it stays valid from the time it was stored
 */
@Getter
@RequiredArgsConstructor
public class CacheEntry<T> {

    private final T value;
    private final Duration ttl;
}
