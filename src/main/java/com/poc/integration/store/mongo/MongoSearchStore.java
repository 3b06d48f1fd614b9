package com.poc.integration.store.mongo;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoException;
import com.mongodb.MongoWriteException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Projections;
import com.poc.integration.encryption.FieldEncryptionSpec;
import com.poc.integration.encryption.QueryKind;
import com.poc.integration.model.CustomerProjection;
import com.poc.integration.model.CustomerRecord;
import com.poc.integration.store.DuplicateRecordException;
import com.poc.integration.store.SearchStore;
import com.poc.integration.store.SearchUnavailableException;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Search store backed by a MongoDB collection with Queryable Encryption.
 *
 * <p>The collection must come from an auto-encrypting client: filters carry plaintext values
 * and the driver encrypts them, and documents are decrypted on read.
 * Equality queries are plain filters; preview queries use the encrypted string operators
 * inside {@code $expr}.
 */
public class MongoSearchStore implements SearchStore {

    private static final Logger log = LoggerFactory.getLogger(MongoSearchStore.class);

    private final MongoCollection<Document> collection;
    private final CustomerDocumentMapper mapper;

    public MongoSearchStore(MongoCollection<Document> collection, CustomerDocumentMapper mapper) {
        this.collection = collection;
        this.mapper = mapper;
    }

    @Override
    public List<String> findIdentifiers(FieldEncryptionSpec spec, QueryKind kind, String value,
                                        int limit, Duration timeout) {
        Bson filter = buildFilter(spec, kind, value);
        log.debug("Searching {} ({}) with filter {}", spec.field(), kind, filter);

        try {
            List<String> ids = new ArrayList<>();
            for (Document doc : within(timeout).find(filter)
                    .projection(Projections.include(CustomerDocumentMapper.ID_FIELD))
                    .limit(limit)) {
                String id = doc.getString(CustomerDocumentMapper.ID_FIELD);
                if (id != null) {
                    ids.add(id);
                }
            }
            return ids;
        } catch (MongoException e) {
            throw new SearchUnavailableException("Search on " + spec.field() + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<CustomerProjection> findProjections(FieldEncryptionSpec spec, QueryKind kind, String value,
                                                    int limit, Duration timeout) {
        Bson filter = buildFilter(spec, kind, value);

        try {
            List<CustomerProjection> projections = new ArrayList<>();
            for (Document doc : within(timeout).find(filter).limit(limit)) {
                projections.add(mapper.toProjection(doc));
            }
            return projections;
        } catch (MongoException e) {
            throw new SearchUnavailableException("Search on " + spec.field() + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void insert(CustomerRecord record, Duration timeout) {
        try {
            within(timeout).insertOne(mapper.toDocument(record));
        } catch (MongoWriteException e) {
            if (e.getError().getCategory() == ErrorCategory.DUPLICATE_KEY) {
                throw new DuplicateRecordException(record.id(),
                    "Customer " + record.id() + " already exists in the search store", e);
            }
            throw new SearchUnavailableException("Insert of " + record.id() + " failed: " + e.getMessage(), e);
        } catch (MongoException e) {
            throw new SearchUnavailableException("Insert of " + record.id() + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(String customerId, Duration timeout) {
        try {
            within(timeout).deleteOne(Filters.eq(CustomerDocumentMapper.ID_FIELD, customerId));
        } catch (MongoException e) {
            throw new SearchUnavailableException("Delete of " + customerId + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public long countExisting(Collection<String> customerIds, Duration timeout) {
        if (customerIds.isEmpty()) {
            return 0;
        }
        try {
            return within(timeout).countDocuments(Filters.in(CustomerDocumentMapper.ID_FIELD, customerIds));
        } catch (MongoException e) {
            throw new SearchUnavailableException("Count failed: " + e.getMessage(), e);
        }
    }

    @Override
    public long countAll(Duration timeout) {
        try {
            return within(timeout).countDocuments();
        } catch (MongoException e) {
            throw new SearchUnavailableException("Count failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void clear(Duration timeout) {
        try {
            long deleted = within(timeout).deleteMany(new Document()).getDeletedCount();
            log.info("Deleted {} documents from {}", deleted, collection.getNamespace());
        } catch (MongoException e) {
            throw new SearchUnavailableException("Clear failed: " + e.getMessage(), e);
        }
    }

    /**
     * Filter for one encrypted field query. The value is passed as plaintext.
     */
    static Bson buildFilter(FieldEncryptionSpec spec, QueryKind kind, String value) {
        return switch (kind) {
            case EQUALITY -> Filters.eq(spec.path(), value);
            case PREFIX -> encryptedString("$encStrStartsWith", spec.path(), "prefix", value);
            case SUFFIX -> encryptedString("$encStrEndsWith", spec.path(), "suffix", value);
            case SUBSTRING -> encryptedString("$encStrContains", spec.path(), "substring", value);
        };
    }

    private static Bson encryptedString(String operator, String path, String argument, String value) {
        Document expression = new Document("input", "$" + path).append(argument, value);
        return new Document("$expr", new Document(operator, expression));
    }

    private MongoCollection<Document> within(Duration timeout) {
        return collection.withTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
