package io.github.chirino.speakercache.service;

import io.github.chirino.speakercache.cache.CacheInfo;

public record CacheStatus(String userKey, boolean exists, String message, CacheInfo info) {

    public String activeBackend() {
        return info.activeBackend();
    }

    public int volatileEntryCount() {
        return info.volatileEntries();
    }
}
