package io.github.chirino.speakercache.service;

public class VoiceSampleNotFoundException extends RuntimeException {

    private final String userKey;

    public VoiceSampleNotFoundException(String userKey) {
        super("No voice sample recorded for user " + userKey);
        this.userKey = userKey;
    }

    public String getUserKey() {
        return userKey;
    }
}
