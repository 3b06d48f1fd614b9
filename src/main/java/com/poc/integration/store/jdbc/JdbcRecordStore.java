package com.poc.integration.store.jdbc;

import com.poc.integration.model.Address;
import com.poc.integration.model.CustomerField;
import com.poc.integration.model.CustomerOrder;
import com.poc.integration.model.CustomerProjection;
import com.poc.integration.model.CustomerRecord;
import com.poc.integration.model.OrderItem;
import com.poc.integration.model.Preferences;
import com.poc.integration.store.DuplicateRecordException;
import com.poc.integration.store.RecordStore;
import com.poc.integration.store.RecordStoreUnavailableException;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Record store on PostgreSQL / AlloyDB.
 *
 * <p>PII columns are encrypted in the database with pgcrypto ({@code pgp_sym_encrypt}) and
 * decrypted on fetch with the same symmetric key. Customers are only addressed by id;
 * order aggregates are computed from the {@code orders} table at fetch time.
 */
public class JdbcRecordStore implements RecordStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcRecordStore.class);

    static final String UNIQUE_VIOLATION = "23505";

    static final String[] SCHEMA_DDL = {
        "CREATE EXTENSION IF NOT EXISTS pgcrypto",
        """
        CREATE TABLE IF NOT EXISTS customers (
            id UUID PRIMARY KEY,
            full_name_encrypted BYTEA NOT NULL,
            email_encrypted BYTEA NOT NULL,
            phone_encrypted BYTEA,
            address_encrypted BYTEA,
            preferences_encrypted BYTEA,
            tier VARCHAR(50),
            category VARCHAR(50),
            status VARCHAR(50),
            loyalty_points INTEGER DEFAULT 0,
            last_purchase_date VARCHAR(100),
            lifetime_value DECIMAL(12, 2) DEFAULT 0.00,
            created_at TIMESTAMP WITH TIME ZONE DEFAULT NOW(),
            updated_at TIMESTAMP WITH TIME ZONE DEFAULT NOW()
        )""",
        """
        CREATE TABLE IF NOT EXISTS orders (
            id UUID PRIMARY KEY,
            customer_id UUID NOT NULL REFERENCES customers(id) ON DELETE CASCADE,
            order_number VARCHAR(50) NOT NULL,
            order_date DATE NOT NULL,
            total_amount DECIMAL(12, 2) NOT NULL,
            status VARCHAR(50),
            items JSONB
        )""",
        "CREATE INDEX IF NOT EXISTS idx_orders_customer_id ON orders(customer_id)"
    };

    static final String INSERT_CUSTOMER_SQL = """
        INSERT INTO customers (
            id, full_name_encrypted, email_encrypted, phone_encrypted,
            address_encrypted, preferences_encrypted,
            tier, category, status, loyalty_points, last_purchase_date, lifetime_value
        ) VALUES (
            ?::uuid,
            pgp_sym_encrypt(?, ?), pgp_sym_encrypt(?, ?), pgp_sym_encrypt(?, ?),
            pgp_sym_encrypt(?, ?), pgp_sym_encrypt(?, ?),
            ?, ?, ?, ?, ?, ?
        )""";

    static final String INSERT_ORDER_SQL = """
        INSERT INTO orders (id, customer_id, order_number, order_date, total_amount, status, items)
        VALUES (?::uuid, ?::uuid, ?, ?, ?, ?, ?::jsonb)""";

    static final String FETCH_SQL = """
        SELECT
            c.id::text AS customer_id,
            pgp_sym_decrypt(c.full_name_encrypted, ?) AS full_name,
            pgp_sym_decrypt(c.email_encrypted, ?) AS email,
            pgp_sym_decrypt(c.phone_encrypted, ?) AS phone,
            pgp_sym_decrypt(c.address_encrypted, ?) AS address,
            pgp_sym_decrypt(c.preferences_encrypted, ?) AS preferences,
            c.tier, c.category, c.status, c.loyalty_points, c.last_purchase_date, c.lifetime_value,
            COALESCE(o.order_count, 0) AS order_count,
            COALESCE(o.total_order_value, 0) AS total_order_value
        FROM customers c
        LEFT JOIN (
            SELECT customer_id, COUNT(*) AS order_count, SUM(total_amount) AS total_order_value
            FROM orders
            GROUP BY customer_id
        ) o ON o.customer_id = c.id
        WHERE c.id = ANY(?::uuid[])""";

    static final String DELETE_ORDERS_SQL = "DELETE FROM orders WHERE customer_id = ?::uuid";
    static final String DELETE_CUSTOMER_SQL = "DELETE FROM customers WHERE id = ?::uuid";
    static final String COUNT_EXISTING_SQL = "SELECT COUNT(*) FROM customers WHERE id = ANY(?::uuid[])";
    static final String COUNT_ALL_SQL = "SELECT COUNT(*) FROM customers";
    static final String CLEAR_SQL = "TRUNCATE TABLE orders, customers";

    private final DataSource dataSource;
    private final String encryptionKey;

    public JdbcRecordStore(DataSource dataSource, String encryptionKey) {
        if (dataSource == null) {
            throw new IllegalArgumentException("DataSource cannot be null");
        }
        if (encryptionKey == null || encryptionKey.isEmpty()) {
            throw new IllegalArgumentException("Encryption key cannot be empty");
        }
        this.dataSource = dataSource;
        this.encryptionKey = encryptionKey;
    }

    /**
     * Creates the pgcrypto extension and the customer and order tables if missing.
     */
    public void initializeSchema(Duration timeout) {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.setQueryTimeout(timeoutSeconds(timeout));
            for (String ddl : SCHEMA_DDL) {
                stmt.execute(ddl);
            }
            log.info("Record store schema ready");
        } catch (SQLException e) {
            throw new RecordStoreUnavailableException("Schema initialization failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Map<String, CustomerProjection> fetchMany(Collection<String> customerIds, Duration timeout) {
        Map<String, CustomerProjection> result = new LinkedHashMap<>();
        if (customerIds.isEmpty()) {
            return result;
        }

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(FETCH_SQL)) {
            ps.setQueryTimeout(timeoutSeconds(timeout));
            for (int i = 1; i <= 5; i++) {
                ps.setString(i, encryptionKey);
            }
            ps.setArray(6, idArray(conn, customerIds));

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    CustomerProjection projection = mapRow(rs);
                    result.put(projection.getCustomerId(), projection);
                }
            }
            log.debug("Fetched {} of {} customers", result.size(), customerIds.size());
            return result;
        } catch (SQLException e) {
            throw new RecordStoreUnavailableException("Fetch failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void insert(CustomerRecord record, Duration timeout) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                insertCustomer(conn, record, timeout);
                insertOrders(conn, record, timeout);
                conn.commit();
            } catch (SQLException e) {
                rollbackQuietly(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                throw new DuplicateRecordException(record.id(),
                    "Customer " + record.id() + " already exists in the record store", e);
            }
            throw new RecordStoreUnavailableException("Insert of " + record.id() + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(String customerId, Duration timeout) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                executeUpdate(conn, DELETE_ORDERS_SQL, customerId, timeout);
                executeUpdate(conn, DELETE_CUSTOMER_SQL, customerId, timeout);
                conn.commit();
            } catch (SQLException e) {
                rollbackQuietly(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new RecordStoreUnavailableException("Delete of " + customerId + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public long countExisting(Collection<String> customerIds, Duration timeout) {
        if (customerIds.isEmpty()) {
            return 0;
        }
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(COUNT_EXISTING_SQL)) {
            ps.setQueryTimeout(timeoutSeconds(timeout));
            ps.setArray(1, idArray(conn, customerIds));
            return singleCount(ps);
        } catch (SQLException e) {
            throw new RecordStoreUnavailableException("Count failed: " + e.getMessage(), e);
        }
    }

    @Override
    public long countAll(Duration timeout) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(COUNT_ALL_SQL)) {
            ps.setQueryTimeout(timeoutSeconds(timeout));
            return singleCount(ps);
        } catch (SQLException e) {
            throw new RecordStoreUnavailableException("Count failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void clear(Duration timeout) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(CLEAR_SQL)) {
            ps.setQueryTimeout(timeoutSeconds(timeout));
            ps.executeUpdate();
            log.info("Truncated customers and orders");
        } catch (SQLException e) {
            throw new RecordStoreUnavailableException("Clear failed: " + e.getMessage(), e);
        }
    }

    private void insertCustomer(Connection conn, CustomerRecord record, Duration timeout) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(INSERT_CUSTOMER_SQL)) {
            ps.setQueryTimeout(timeoutSeconds(timeout));
            int i = 1;
            ps.setString(i++, record.id());
            i = setEncrypted(ps, i, record.fullName());
            i = setEncrypted(ps, i, record.email());
            i = setEncrypted(ps, i, record.phone());
            i = setEncrypted(ps, i, addressJson(record.address()));
            i = setEncrypted(ps, i, preferencesJson(record.preferences()));
            ps.setString(i++, record.tier());
            ps.setString(i++, record.category());
            ps.setString(i++, record.status());
            ps.setInt(i++, record.loyaltyPoints());
            ps.setString(i++, record.lastPurchaseDate());
            ps.setBigDecimal(i, record.lifetimeValue());
            ps.executeUpdate();
        }
    }

    private void insertOrders(Connection conn, CustomerRecord record, Duration timeout) throws SQLException {
        if (record.orders().isEmpty()) {
            return;
        }
        try (PreparedStatement ps = conn.prepareStatement(INSERT_ORDER_SQL)) {
            ps.setQueryTimeout(timeoutSeconds(timeout));
            for (CustomerOrder order : record.orders()) {
                ps.setString(1, order.orderId());
                ps.setString(2, record.id());
                ps.setString(3, order.orderNumber());
                ps.setObject(4, order.orderDate());
                ps.setBigDecimal(5, order.totalAmount());
                ps.setString(6, order.status());
                ps.setString(7, itemsJson(order.items()));
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private int setEncrypted(PreparedStatement ps, int index, String value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value);
        }
        ps.setString(index + 1, encryptionKey);
        return index + 2;
    }

    private void executeUpdate(Connection conn, String sql, String customerId, Duration timeout) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setQueryTimeout(timeoutSeconds(timeout));
            ps.setString(1, customerId);
            ps.executeUpdate();
        }
    }

    private long singleCount(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0;
        }
    }

    private Array idArray(Connection conn, Collection<String> customerIds) throws SQLException {
        return conn.createArrayOf("text", customerIds.toArray(new String[0]));
    }

    private void rollbackQuietly(Connection conn, SQLException original) {
        try {
            conn.rollback();
        } catch (SQLException rollbackFailure) {
            original.addSuppressed(rollbackFailure);
        }
    }

    static CustomerProjection mapRow(ResultSet rs) throws SQLException {
        return CustomerProjection.builder(rs.getString("customer_id"))
            .set(CustomerField.FULL_NAME, rs.getString("full_name"))
            .set(CustomerField.EMAIL, rs.getString("email"))
            .set(CustomerField.PHONE, rs.getString("phone"))
            .set(CustomerField.ADDRESS, parseAddress(rs.getString("address")))
            .set(CustomerField.PREFERENCES, parsePreferences(rs.getString("preferences")))
            .set(CustomerField.TIER, rs.getString("tier"))
            .set(CustomerField.CATEGORY, rs.getString("category"))
            .set(CustomerField.STATUS, rs.getString("status"))
            .set(CustomerField.LOYALTY_POINTS, rs.getInt("loyalty_points"))
            .set(CustomerField.LAST_PURCHASE_DATE, rs.getString("last_purchase_date"))
            .set(CustomerField.LIFETIME_VALUE, rs.getBigDecimal("lifetime_value"))
            .set(CustomerField.ORDER_COUNT, rs.getInt("order_count"))
            .set(CustomerField.TOTAL_ORDER_VALUE, orZero(rs.getBigDecimal("total_order_value")))
            .build();
    }

    static String addressJson(Address address) {
        if (address == null) {
            return null;
        }
        return new Document("street", address.street())
            .append("city", address.city())
            .append("state", address.state())
            .append("zip_code", address.zipCode())
            .toJson();
    }

    static String preferencesJson(Preferences preferences) {
        if (preferences == null) {
            return null;
        }
        return new Document("newsletter", preferences.newsletter())
            .append("sms", preferences.sms())
            .toJson();
    }

    static Address parseAddress(String json) {
        if (json == null) {
            return null;
        }
        Document doc = Document.parse(json);
        return new Address(doc.getString("street"), doc.getString("city"),
            doc.getString("state"), doc.getString("zip_code"));
    }

    static Preferences parsePreferences(String json) {
        if (json == null) {
            return null;
        }
        Document doc = Document.parse(json);
        return new Preferences(Boolean.TRUE.equals(doc.getBoolean("newsletter")),
            Boolean.TRUE.equals(doc.getBoolean("sms")));
    }

    private static String itemsJson(List<OrderItem> items) {
        List<Document> docs = new ArrayList<>();
        for (OrderItem item : items) {
            docs.add(new Document("product", item.product())
                .append("price", item.price().toPlainString())
                .append("quantity", item.quantity()));
        }
        return new Document("items", docs).toJson();
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    // JDBC query timeouts are whole seconds; round up so short deadlines still apply.
    static int timeoutSeconds(Duration timeout) {
        long millis = timeout.toMillis();
        return (int) Math.max(1, (millis + 999) / 1000);
    }
}
