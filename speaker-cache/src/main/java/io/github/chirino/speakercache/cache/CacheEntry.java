package io.github.chirino.speakercache.cache;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * One stored speaker embedding. There is exactly one entry per user key; writing again replaces
 * it and restarts its TTL. An entry whose {@code expiresAt} has passed is treated as absent even
 * while it is still physically stored.
 */
public record CacheEntry(
        @JsonProperty("user_id") String userKey,
        @JsonProperty("embedding_data") byte[] payload,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("expires_at") Instant expiresAt) {

    @JsonCreator
    public CacheEntry {
        Objects.requireNonNull(userKey, "userKey");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(expiresAt, "expiresAt");
        if (!expiresAt.isAfter(createdAt)) {
            throw new IllegalArgumentException(
                    "expiresAt " + expiresAt + " must be after createdAt " + createdAt);
        }
    }

    public static CacheEntry create(String userKey, byte[] payload, Instant now, Duration ttl) {
        requirePositive(ttl);
        return new CacheEntry(userKey, payload, now, now.plus(ttl));
    }

    public static void requirePositive(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be positive: " + ttl);
        }
    }

    @JsonIgnore
    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CacheEntry other)) {
            return false;
        }
        return userKey.equals(other.userKey)
                && Arrays.equals(payload, other.payload)
                && createdAt.equals(other.createdAt)
                && expiresAt.equals(other.expiresAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userKey, Arrays.hashCode(payload), createdAt, expiresAt);
    }

    @Override
    public String toString() {
        return "CacheEntry[userKey="
                + userKey
                + ", payloadBytes="
                + payload.length
                + ", createdAt="
                + createdAt
                + ", expiresAt="
                + expiresAt
                + "]";
    }
}
