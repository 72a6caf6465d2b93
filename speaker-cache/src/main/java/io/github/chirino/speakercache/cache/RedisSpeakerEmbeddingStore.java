package io.github.chirino.speakercache.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.chirino.speakercache.codec.CorruptPayloadException;
import io.github.chirino.speakercache.codec.SpeakerEmbedding;
import io.github.chirino.speakercache.codec.SpeakerEmbeddingCodec;
import io.quarkus.redis.client.RedisClientName;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.quarkus.redis.datasource.value.SetArgs;
import io.smallrye.mutiny.TimeoutException;
import io.vertx.mutiny.redis.client.Response;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Redis backed store. Entries are JSON encoded {@link CacheEntry} values written with {@code SET
 * .. EX}, so Redis expires them natively; the stored {@code expires_at} is still checked on read so
 * that logical expiry does not depend on Redis eviction timing.
 */
@ApplicationScoped
public class RedisSpeakerEmbeddingStore implements SpeakerEmbeddingStore {
    private static final Logger LOG = Logger.getLogger(RedisSpeakerEmbeddingStore.class);

    /** Deletes KEYS[1] only while it still holds ARGV[1], so a concurrent SET is never lost. */
    static final String DELETE_IF_UNCHANGED =
            "if redis.call('GET', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('DEL', KEYS[1]) else return 0 end";

    private final String clientName;
    private final String keyPrefix;
    private final Duration timeout;
    private final Instance<ReactiveRedisDataSource> redisSources;
    private final SpeakerEmbeddingCodec codec;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private volatile ReactiveRedisDataSource dataSource;
    private volatile ReactiveKeyCommands<String> keys;
    private volatile ReactiveValueCommands<String, String> values;
    private volatile boolean connected;

    @Inject
    public RedisSpeakerEmbeddingStore(
            @ConfigProperty(name = "speaker-cache.redis.client") Optional<String> clientName,
            @ConfigProperty(
                            name = "speaker-cache.redis.key-prefix",
                            defaultValue = "speaker_embedding:")
                    String keyPrefix,
            @ConfigProperty(name = "speaker-cache.operation-timeout", defaultValue = "PT5S")
                    Duration timeout,
            @Any Instance<ReactiveRedisDataSource> redisSources,
            SpeakerEmbeddingCodec codec,
            ObjectMapper objectMapper,
            Clock clock) {
        this.clientName = clientName.filter(it -> !it.isBlank()).orElse(null);
        this.keyPrefix = keyPrefix;
        this.timeout = timeout;
        this.redisSources = redisSources;
        this.codec = codec;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public boolean connect() {
        try {
            if (dataSource == null) {
                Instance<ReactiveRedisDataSource> selected =
                        clientName != null
                                ? redisSources.select(RedisClientName.Literal.of(clientName))
                                : redisSources;
                if (selected.isUnsatisfied()) {
                    LOG.warnf(
                            "Redis client '%s' is not available",
                            clientName == null ? "<default>" : clientName);
                    connected = false;
                    return false;
                }
                ReactiveRedisDataSource ds = selected.get();
                keys = ds.key();
                values = ds.value(String.class);
                dataSource = ds;
            }
            Response response = dataSource.execute("PING").await().atMost(timeout);
            connected = true;
            LOG.infof("Connected to Redis speaker cache (PING -> %s)", response);
            return true;
        } catch (Exception e) {
            LOG.warnf("Failed to connect to Redis speaker cache: %s", e.getMessage());
            connected = false;
            return false;
        }
    }

    @Override
    public boolean available() {
        return connected && keys != null && values != null;
    }

    @Override
    public boolean nativeExpiration() {
        return true;
    }

    @Override
    public BackendResult<Boolean> set(String userKey, SpeakerEmbedding embedding, Duration ttl) {
        if (!available()) {
            return BackendResult.failed(BackendError.UNREACHABLE);
        }
        try {
            CacheEntry entry =
                    CacheEntry.create(userKey, codec.encode(embedding), clock.instant(), ttl);
            String json = objectMapper.writeValueAsString(entry);
            values.set(key(userKey), json, new SetArgs().ex(ttl)).await().atMost(timeout);
            return BackendResult.ok(Boolean.TRUE);
        } catch (Exception e) {
            return failure("set", userKey, e);
        }
    }

    @Override
    public BackendResult<Optional<SpeakerEmbedding>> get(String userKey) {
        if (!available()) {
            return BackendResult.failed(BackendError.UNREACHABLE);
        }
        String key = key(userKey);
        try {
            String json = values.get(key).await().atMost(timeout);
            if (json == null) {
                return BackendResult.ok(Optional.empty());
            }
            try {
                CacheEntry entry = readEntry(userKey, json);
                if (entry.isExpired(clock.instant())) {
                    deleteIfUnchanged(key, json);
                    return BackendResult.ok(Optional.empty());
                }
                return BackendResult.ok(Optional.of(codec.decode(entry.payload())));
            } catch (CorruptPayloadException e) {
                return discardCorrupt(userKey, json, e);
            }
        } catch (Exception e) {
            return failure("get", userKey, e);
        }
    }

    @Override
    public BackendResult<Boolean> delete(String userKey) {
        if (!available()) {
            return BackendResult.failed(BackendError.UNREACHABLE);
        }
        try {
            Integer removed = keys.del(key(userKey)).await().atMost(timeout);
            return BackendResult.ok(removed != null && removed > 0);
        } catch (Exception e) {
            return failure("delete", userKey, e);
        }
    }

    @Override
    public BackendResult<Boolean> exists(String userKey) {
        if (!available()) {
            return BackendResult.failed(BackendError.UNREACHABLE);
        }
        String key = key(userKey);
        try {
            String json = values.get(key).await().atMost(timeout);
            if (json == null) {
                return BackendResult.ok(Boolean.FALSE);
            }
            try {
                CacheEntry entry = readEntry(userKey, json);
                if (entry.isExpired(clock.instant())) {
                    deleteIfUnchanged(key, json);
                    return BackendResult.ok(Boolean.FALSE);
                }
                return BackendResult.ok(Boolean.TRUE);
            } catch (CorruptPayloadException e) {
                return discardCorrupt(userKey, json, e);
            }
        } catch (Exception e) {
            return failure("exists", userKey, e);
        }
    }

    @Override
    public BackendResult<Long> sweepExpired() {
        // Redis drops expired keys itself.
        return BackendResult.ok(0L);
    }

    @Override
    public Map<String, Object> describe() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("type", name());
        details.put("status", available() ? "connected" : "disconnected");
        details.put("client", clientName == null ? "<default>" : clientName);
        details.put("keyPrefix", keyPrefix);
        details.put("nativeExpiration", nativeExpiration());
        return details;
    }

    String key(String userKey) {
        return keyPrefix + userKey;
    }

    private CacheEntry readEntry(String userKey, String json) {
        try {
            CacheEntry entry = objectMapper.readValue(json, CacheEntry.class);
            if (entry == null || !userKey.equals(entry.userKey())) {
                throw new CorruptPayloadException("Stored entry does not belong to " + userKey);
            }
            return entry;
        } catch (IOException e) {
            throw new CorruptPayloadException("Unreadable cache entry for " + userKey, e);
        }
    }

    private void deleteIfUnchanged(String key, String json) {
        dataSource.execute("EVAL", DELETE_IF_UNCHANGED, "1", key, json).await().atMost(timeout);
    }

    private <T> BackendResult<T> discardCorrupt(
            String userKey, String json, CorruptPayloadException e) {
        LOG.warnf(
                "Discarding corrupt speaker embedding for %s in Redis: %s",
                userKey, e.getMessage());
        try {
            deleteIfUnchanged(key(userKey), json);
        } catch (Exception deleteFailure) {
            LOG.warnf(
                    "Failed to delete corrupt speaker embedding for %s in Redis: %s",
                    userKey, deleteFailure.getMessage());
        }
        return BackendResult.failed(BackendError.CORRUPT);
    }

    private <T> BackendResult<T> failure(String operation, String userKey, Exception e) {
        BackendError error =
                e instanceof TimeoutException ? BackendError.TIMEOUT : BackendError.UNREACHABLE;
        LOG.warnf("Redis %s failed for %s (%s): %s", operation, userKey, error, e.getMessage());
        connected = false;
        return BackendResult.failed(error);
    }
}
