package io.github.chirino.speakercache.service;

public record SweepResult(long removedCount, String message) {}
