package io.github.chirino.speakercache.cache;

import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.MongoSocketReadTimeoutException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.result.DeleteResult;
import io.github.chirino.speakercache.codec.CorruptPayloadException;
import io.github.chirino.speakercache.codec.SpeakerEmbedding;
import io.github.chirino.speakercache.codec.SpeakerEmbeddingCodec;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.Binary;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * MongoDB backed store. One document per user, keyed by a unique index on {@code user_id}. A TTL
 * index on {@code expires_at} lets MongoDB purge expired documents in the background; since that
 * monitor only runs periodically, reads still check {@code expires_at} and {@link #sweepExpired()}
 * deletes expired documents on demand.
 */
@ApplicationScoped
public class MongoSpeakerEmbeddingStore implements SpeakerEmbeddingStore {
    private static final Logger LOG = Logger.getLogger(MongoSpeakerEmbeddingStore.class);

    static final String USER_ID = "user_id";
    static final String EMBEDDING_DATA = "embedding_data";
    static final String CREATED_AT = "created_at";
    static final String EXPIRES_AT = "expires_at";

    private final String databaseName;
    private final String collectionName;
    private final MongoClient mongoClient;
    private final SpeakerEmbeddingCodec codec;
    private final Clock clock;
    private volatile MongoCollection<Document> collection;
    private volatile boolean connected;
    private volatile boolean ttlIndexReady;

    @Inject
    public MongoSpeakerEmbeddingStore(
            @ConfigProperty(name = "speaker-cache.mongo.database", defaultValue = "meditation_app")
                    String databaseName,
            @ConfigProperty(
                            name = "speaker-cache.mongo.collection",
                            defaultValue = "speaker_embeddings")
                    String collectionName,
            MongoClient mongoClient,
            SpeakerEmbeddingCodec codec,
            Clock clock) {
        this.databaseName = databaseName;
        this.collectionName = collectionName;
        this.mongoClient = mongoClient;
        this.codec = codec;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "mongodb";
    }

    @Override
    public boolean connect() {
        try {
            mongoClient.getDatabase("admin").runCommand(new Document("ping", 1));
            MongoCollection<Document> target =
                    mongoClient.getDatabase(databaseName).getCollection(collectionName);
            createIndexes(target);
            collection = target;
            connected = true;
            LOG.infof("Connected to MongoDB speaker cache %s.%s", databaseName, collectionName);
            return true;
        } catch (Exception e) {
            LOG.warnf("Failed to connect to MongoDB speaker cache: %s", e.getMessage());
            connected = false;
            return false;
        }
    }

    private void createIndexes(MongoCollection<Document> target) {
        try {
            target.createIndex(Indexes.ascending(USER_ID), new IndexOptions().unique(true));
        } catch (Exception e) {
            LOG.warnf("Could not create unique index on %s: %s", USER_ID, e.getMessage());
        }
        try {
            target.createIndex(
                    Indexes.ascending(EXPIRES_AT),
                    new IndexOptions().expireAfter(0L, TimeUnit.SECONDS));
            ttlIndexReady = true;
        } catch (Exception e) {
            LOG.warnf("Could not create TTL index on %s: %s", EXPIRES_AT, e.getMessage());
            ttlIndexReady = false;
        }
    }

    @Override
    public boolean available() {
        return connected && collection != null;
    }

    @Override
    public boolean nativeExpiration() {
        return ttlIndexReady;
    }

    @Override
    public BackendResult<Boolean> set(String userKey, SpeakerEmbedding embedding, Duration ttl) {
        if (!available()) {
            return BackendResult.failed(BackendError.UNREACHABLE);
        }
        try {
            CacheEntry entry =
                    CacheEntry.create(userKey, codec.encode(embedding), clock.instant(), ttl);
            Document document =
                    new Document(USER_ID, entry.userKey())
                            .append(EMBEDDING_DATA, new Binary(entry.payload()))
                            .append(CREATED_AT, Date.from(entry.createdAt()))
                            .append(EXPIRES_AT, Date.from(entry.expiresAt()));
            collection.replaceOne(byUser(userKey), document, new ReplaceOptions().upsert(true));
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
        try {
            Document document = collection.find(byUser(userKey)).first();
            if (document == null || !document.containsKey(EMBEDDING_DATA)) {
                return BackendResult.ok(Optional.empty());
            }
            try {
                if (isExpired(document)) {
                    collection.deleteOne(expiredFor(userKey));
                    return BackendResult.ok(Optional.empty());
                }
                return BackendResult.ok(Optional.of(codec.decode(payloadOf(document))));
            } catch (CorruptPayloadException e) {
                return discardCorrupt(userKey, document, e);
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
            DeleteResult result = collection.deleteOne(byUser(userKey));
            return BackendResult.ok(result.getDeletedCount() > 0);
        } catch (Exception e) {
            return failure("delete", userKey, e);
        }
    }

    @Override
    public BackendResult<Boolean> exists(String userKey) {
        if (!available()) {
            return BackendResult.failed(BackendError.UNREACHABLE);
        }
        try {
            Document document =
                    collection
                            .find(byUser(userKey))
                            .projection(
                                    Projections.include(EMBEDDING_DATA, CREATED_AT, EXPIRES_AT))
                            .first();
            if (document == null || !document.containsKey(EMBEDDING_DATA)) {
                return BackendResult.ok(Boolean.FALSE);
            }
            try {
                if (isExpired(document)) {
                    collection.deleteOne(expiredFor(userKey));
                    return BackendResult.ok(Boolean.FALSE);
                }
                return BackendResult.ok(Boolean.TRUE);
            } catch (CorruptPayloadException e) {
                return discardCorrupt(userKey, document, e);
            }
        } catch (Exception e) {
            return failure("exists", userKey, e);
        }
    }

    @Override
    public BackendResult<Long> sweepExpired() {
        if (!available()) {
            return BackendResult.failed(BackendError.UNREACHABLE);
        }
        try {
            DeleteResult result =
                    collection.deleteMany(Filters.lt(EXPIRES_AT, Date.from(clock.instant())));
            return BackendResult.ok(result.getDeletedCount());
        } catch (Exception e) {
            return failure("sweepExpired", "*", e);
        }
    }

    @Override
    public Map<String, Object> describe() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("type", name());
        details.put("status", available() ? "connected" : "disconnected");
        details.put("database", databaseName);
        details.put("collection", collectionName);
        details.put("nativeExpiration", nativeExpiration());
        return details;
    }

    private static Bson byUser(String userKey) {
        return Filters.eq(USER_ID, userKey);
    }

    /** Matches the user's document only while it is still expired, never a fresh upsert. */
    private Bson expiredFor(String userKey) {
        return Filters.and(byUser(userKey), Filters.lt(EXPIRES_AT, Date.from(clock.instant())));
    }

    /** Matches exactly the document that was read; a replacement carries new timestamps. */
    private static Bson sameDocument(String userKey, Document document) {
        return Filters.and(
                byUser(userKey),
                Filters.eq(CREATED_AT, document.get(CREATED_AT)),
                Filters.eq(EXPIRES_AT, document.get(EXPIRES_AT)));
    }

    private boolean isExpired(Document document) {
        Object expiresAt = document.get(EXPIRES_AT);
        if (expiresAt == null) {
            return false;
        }
        if (!(expiresAt instanceof Date date)) {
            throw new CorruptPayloadException(
                    "Unexpected " + EXPIRES_AT + " type " + expiresAt.getClass().getName());
        }
        Instant now = clock.instant();
        return date.toInstant().isBefore(now);
    }

    private static byte[] payloadOf(Document document) {
        Object data = document.get(EMBEDDING_DATA);
        if (data instanceof Binary binary) {
            return binary.getData();
        }
        if (data instanceof byte[] bytes) {
            return bytes;
        }
        throw new CorruptPayloadException(
                "Unexpected "
                        + EMBEDDING_DATA
                        + " type "
                        + (data == null ? "null" : data.getClass().getName()));
    }

    private <T> BackendResult<T> discardCorrupt(
            String userKey, Document document, CorruptPayloadException e) {
        LOG.warnf(
                "Discarding corrupt speaker embedding for %s in MongoDB: %s",
                userKey, e.getMessage());
        try {
            collection.deleteOne(sameDocument(userKey, document));
        } catch (Exception deleteFailure) {
            LOG.warnf(
                    "Failed to delete corrupt speaker embedding for %s in MongoDB: %s",
                    userKey, deleteFailure.getMessage());
        }
        return BackendResult.failed(BackendError.CORRUPT);
    }

    private <T> BackendResult<T> failure(String operation, String userKey, Exception e) {
        BackendError error = isTimeout(e) ? BackendError.TIMEOUT : BackendError.UNREACHABLE;
        LOG.warnf("MongoDB %s failed for %s (%s): %s", operation, userKey, error, e.getMessage());
        connected = false;
        return BackendResult.failed(error);
    }

    private static boolean isTimeout(Exception e) {
        return e instanceof MongoTimeoutException
                || e instanceof MongoSocketReadTimeoutException
                || e instanceof MongoExecutionTimeoutException;
    }
}
