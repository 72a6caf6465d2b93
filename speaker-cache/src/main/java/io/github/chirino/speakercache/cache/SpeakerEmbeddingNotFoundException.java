package io.github.chirino.speakercache.cache;

/** Raised when a caller requires a cached speaker embedding that has not been populated. */
public class SpeakerEmbeddingNotFoundException extends RuntimeException {

    public static final String POPULATE_OPERATION = "cache_user_voice";

    private final String userKey;

    public SpeakerEmbeddingNotFoundException(String userKey) {
        super(
                "Speaker embedding not found for user "
                        + userKey
                        + ". Please call "
                        + POPULATE_OPERATION
                        + " first.");
        this.userKey = userKey;
    }

    public String getUserKey() {
        return userKey;
    }

    public String getRemediation() {
        return "Populate the cache with " + POPULATE_OPERATION + " for user " + userKey;
    }
}
