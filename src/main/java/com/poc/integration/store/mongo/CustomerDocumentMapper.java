package com.poc.integration.store.mongo;

import com.poc.integration.encryption.FieldEncryptionSpec;
import com.poc.integration.encryption.FieldEncryptionTable;
import com.poc.integration.model.Address;
import com.poc.integration.model.CustomerField;
import com.poc.integration.model.CustomerProjection;
import com.poc.integration.model.CustomerRecord;
import com.poc.integration.model.Preferences;
import org.bson.Document;

import java.math.BigDecimal;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;

/**
 * Converts between customer records and documents in the encrypted customers collection.
 *
 * <p>Document layout:
 * <pre>
 * {
 *   alloy_record_id: "uuid",
 *   searchable_name, searchable_email, searchable_phone,
 *   metadata: { category, status, tier, loyalty_points, last_purchase_date, lifetime_value },
 *   address: { street, city, state, zip_code },
 *   preferences: { newsletter, sms },
 *   created_at, updated_at
 * }
 * </pre>
 * Paths of fields registered in the encryption table follow the table; the driver encrypts
 * and decrypts them transparently.
 */
public class CustomerDocumentMapper {

    public static final String ID_FIELD = "alloy_record_id";

    private static final Map<String, String> DEFAULT_PATHS = Map.ofEntries(
        Map.entry("name", "searchable_name"),
        Map.entry("email", "searchable_email"),
        Map.entry("phone", "searchable_phone"),
        Map.entry("category", "metadata.category"),
        Map.entry("status", "metadata.status"),
        Map.entry("tier", "metadata.tier"),
        Map.entry("loyalty_points", "metadata.loyalty_points"),
        Map.entry("last_purchase_date", "metadata.last_purchase_date"),
        Map.entry("lifetime_value", "metadata.lifetime_value"),
        Map.entry("address", "address"),
        Map.entry("preferences", "preferences")
    );

    private final Map<String, String> paths;

    public CustomerDocumentMapper(FieldEncryptionTable table) {
        this.paths = new HashMap<>(DEFAULT_PATHS);
        for (FieldEncryptionSpec spec : table.specs()) {
            paths.put(spec.field(), spec.path());
        }
    }

    public String pathOf(String field) {
        String path = paths.get(field);
        if (path == null) {
            throw new IllegalArgumentException("No document path for field " + field);
        }
        return path;
    }

    public Document toDocument(CustomerRecord record) {
        Document doc = new Document(ID_FIELD, record.id());
        put(doc, "name", record.fullName());
        put(doc, "email", record.email());
        put(doc, "phone", record.phone());
        put(doc, "category", record.category());
        put(doc, "status", record.status());
        put(doc, "tier", record.tier());
        put(doc, "loyalty_points", record.loyaltyPoints());
        put(doc, "last_purchase_date", record.lastPurchaseDate());
        // Kept as a string so the stored value never loses scale.
        put(doc, "lifetime_value", record.lifetimeValue() == null ? null : record.lifetimeValue().toPlainString());

        Address address = record.address();
        if (address != null) {
            put(doc, "address", new Document("street", address.street())
                .append("city", address.city())
                .append("state", address.state())
                .append("zip_code", address.zipCode()));
        }
        Preferences preferences = record.preferences();
        if (preferences != null) {
            put(doc, "preferences", new Document("newsletter", preferences.newsletter())
                .append("sms", preferences.sms()));
        }

        Date now = new Date();
        doc.append("created_at", now);
        doc.append("updated_at", now);
        return doc;
    }

    /**
     * Projection of a decrypted document. Order aggregates are not held by the search
     * store and come back as the unavailable sentinel.
     */
    public CustomerProjection toProjection(Document doc) {
        String customerId = doc.getString(ID_FIELD);

        Document address = get(doc, "address", Document.class);
        Document preferences = get(doc, "preferences", Document.class);
        Object lifetimeValue = get(doc, "lifetime_value", Object.class);
        Number loyaltyPoints = get(doc, "loyalty_points", Number.class);

        return CustomerProjection.builder(customerId)
            .set(CustomerField.FULL_NAME, get(doc, "name", String.class))
            .set(CustomerField.EMAIL, get(doc, "email", String.class))
            .set(CustomerField.PHONE, get(doc, "phone", String.class))
            .set(CustomerField.ADDRESS, address == null ? null : new Address(
                address.getString("street"),
                address.getString("city"),
                address.getString("state"),
                address.getString("zip_code")))
            .set(CustomerField.PREFERENCES, preferences == null ? null : new Preferences(
                Boolean.TRUE.equals(preferences.getBoolean("newsletter")),
                Boolean.TRUE.equals(preferences.getBoolean("sms"))))
            .set(CustomerField.TIER, get(doc, "tier", String.class))
            .set(CustomerField.CATEGORY, get(doc, "category", String.class))
            .set(CustomerField.STATUS, get(doc, "status", String.class))
            .set(CustomerField.LOYALTY_POINTS, loyaltyPoints == null ? 0 : loyaltyPoints.intValue())
            .set(CustomerField.LAST_PURCHASE_DATE, get(doc, "last_purchase_date", String.class))
            .set(CustomerField.LIFETIME_VALUE, lifetimeValue == null ? null : new BigDecimal(lifetimeValue.toString()))
            .markRecordStoreOnlyUnavailable()
            .build();
    }

    private void put(Document doc, String field, Object value) {
        String[] segments = pathOf(field).split("\\.");
        Document target = doc;
        for (int i = 0; i < segments.length - 1; i++) {
            Document child = target.get(segments[i], Document.class);
            if (child == null) {
                child = new Document();
                target.put(segments[i], child);
            }
            target = child;
        }
        target.put(segments[segments.length - 1], value);
    }

    private <T> T get(Document doc, String field, Class<T> type) {
        String[] segments = pathOf(field).split("\\.");
        Document target = doc;
        for (int i = 0; i < segments.length - 1; i++) {
            target = target.get(segments[i], Document.class);
            if (target == null) {
                return null;
            }
        }
        return target.get(segments[segments.length - 1], type);
    }
}
