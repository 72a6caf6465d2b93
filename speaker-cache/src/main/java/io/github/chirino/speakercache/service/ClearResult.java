package io.github.chirino.speakercache.service;

public record ClearResult(String userKey, boolean deleted, String message) {

    public String status() {
        return deleted ? "success" : "not_found";
    }
}
