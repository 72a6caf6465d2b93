package io.github.chirino.speakercache.service;

public record CacheVoiceResult(
        String userKey, boolean success, String activeBackend, String message) {}
