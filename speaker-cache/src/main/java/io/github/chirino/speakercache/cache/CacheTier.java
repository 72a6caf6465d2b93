package io.github.chirino.speakercache.cache;

/** Storage path currently serving requests, in order of preference. */
public enum CacheTier {
    PRIMARY,
    SECONDARY,
    VOLATILE;

    public boolean isDurable() {
        return this != VOLATILE;
    }

    public boolean isPreferredOver(CacheTier other) {
        return ordinal() < other.ordinal();
    }
}
