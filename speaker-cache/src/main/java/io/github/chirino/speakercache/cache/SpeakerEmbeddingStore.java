package io.github.chirino.speakercache.cache;

import io.github.chirino.speakercache.codec.SpeakerEmbedding;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Durable storage for speaker embeddings, one entry per user key. Implementations never throw
 * from data operations: failures come back as a {@link BackendResult} carrying a {@link
 * BackendError} so the {@link TieredCacheManager} can fail over.
 */
public interface SpeakerEmbeddingStore {

    /** Short backend label, e.g. {@code redis} or {@code mongodb}. */
    String name();

    /**
     * Probe the backend and prepare any indexes it needs. Never throws.
     *
     * @return true if the backend is reachable
     */
    boolean connect();

    /** Last known connectivity state. Cheap, does not re-probe. */
    boolean available();

    /** True if the backend removes expired entries on its own. */
    boolean nativeExpiration();

    /** Replace any existing entry for {@code userKey}. */
    BackendResult<Boolean> set(String userKey, SpeakerEmbedding embedding, Duration ttl);

    /**
     * Get the embedding for {@code userKey}. Expired entries are deleted and reported as absent.
     */
    BackendResult<Optional<SpeakerEmbedding>> get(String userKey);

    /** @return true if an entry existed and was removed */
    BackendResult<Boolean> delete(String userKey);

    /** @return true if a non-expired entry exists */
    BackendResult<Boolean> exists(String userKey);

    /**
     * Eagerly remove expired entries.
     *
     * @return the number of entries removed, 0 for backends with native expiration
     */
    BackendResult<Long> sweepExpired();

    /** Diagnostic details for status reporting. */
    Map<String, Object> describe();
}
