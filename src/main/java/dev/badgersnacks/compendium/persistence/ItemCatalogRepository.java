package dev.badgersnacks.compendium.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.badgersnacks.compendium.model.AttunementClass;
import dev.badgersnacks.compendium.model.ExpandedItem;
import dev.badgersnacks.compendium.model.ItemKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * JDBC access to the shared {@code items} table.
 *
 * <p>Every write runs in its own transaction. Generated rows are recognised by a non-null {@code variant_of};
 * variant expansion never deletes or overwrites anything else. Class restrictions parsed from an item's
 * {@code reqAttune} text live in {@code item_attunement}, written with the item and removed with it.
 */
public class ItemCatalogRepository implements GeneratedItemStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(ItemCatalogRepository.class);

    private static final String INSERT_SQL = "INSERT INTO items "
            + "(name, source, item_type, rarity, data, variant_of, base_item) VALUES (?, ?, ?, ?, ?, ?, ?)";
    private static final String INSERT_ATTUNEMENT_SQL = "INSERT INTO item_attunement (item_id, class_name) "
            + "SELECT id, ? FROM items WHERE name = ? AND source = ?";
    private static final String SELECT_COLUMNS =
            "SELECT name, source, item_type, rarity, data, variant_of, base_item FROM items";

    private final CatalogDatabase database;
    private final ObjectMapper mapper;

    public ItemCatalogRepository(CatalogDatabase database, ObjectMapper mapper) {
        this.database = Objects.requireNonNull(database, "database");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        ensureSchema();
    }

    private void ensureSchema() {
        try (Connection c = database.open();
             Statement s = c.createStatement()) {
            s.execute("CREATE TABLE IF NOT EXISTS items ("
                    + "id BIGINT AUTO_INCREMENT PRIMARY KEY, "
                    + "name VARCHAR(512) NOT NULL, "
                    + "source VARCHAR(64) NOT NULL, "
                    + "item_type VARCHAR(64), "
                    + "rarity VARCHAR(64), "
                    + "data CLOB NOT NULL, "
                    + "variant_of VARCHAR(512), "
                    + "base_item VARCHAR(640), "
                    + "CONSTRAINT uq_items_name_source UNIQUE (name, source))");
            s.execute("CREATE INDEX IF NOT EXISTS idx_items_variant_of ON items(variant_of)");
            s.execute("CREATE TABLE IF NOT EXISTS item_attunement ("
                    + "item_id BIGINT NOT NULL, "
                    + "class_name VARCHAR(32) NOT NULL, "
                    + "PRIMARY KEY (item_id, class_name), "
                    + "CONSTRAINT fk_item_attunement_item FOREIGN KEY (item_id) "
                    + "REFERENCES items(id) ON DELETE CASCADE)");
        } catch (SQLException e) {
            throw new CatalogPersistenceException("Failed to ensure catalog schema at " + database.url(), e);
        }
    }

    @Override
    public ReplaceOutcome replaceGeneratedItems(List<ExpandedItem> items) {
        Objects.requireNonNull(items, "items");
        List<CatalogItemRow> rows = new ArrayList<>(items.size());
        for (ExpandedItem item : items) {
            rows.add(CatalogItemRow.fromExpanded(item, mapper));
        }
        ReplaceOutcome outcome = inTransaction("replace generated items", connection -> {
            int deleted;
            try (Statement s = connection.createStatement()) {
                deleted = s.executeUpdate("DELETE FROM items WHERE variant_of IS NOT NULL");
            }
            Set<ItemKey> taken = loadKeys(connection);
            List<CatalogItemRow> accepted = new ArrayList<>(rows.size());
            List<ItemKey> collisions = new ArrayList<>();
            for (CatalogItemRow row : rows) {
                if (taken.contains(row.key())) {
                    collisions.add(row.key());
                } else {
                    accepted.add(row);
                }
            }
            int inserted = insertBatch(connection, accepted);
            return new ReplaceOutcome(deleted, inserted, collisions);
        });
        LOGGER.info("Replaced generated items: {} removed, {} inserted, {} blocked by existing rows",
                outcome.deleted(), outcome.inserted(), outcome.collisions().size());
        return outcome;
    }

    /**
     * Replaces the directly-ingested rows of the given sources. Any other row that shares a key with an incoming
     * row is dropped as well; generated rows among them are recomputed by the next expansion run.
     */
    public int replaceIngestedItems(Collection<String> sources, List<CatalogItemRow> rows) {
        Objects.requireNonNull(sources, "sources");
        Objects.requireNonNull(rows, "rows");
        for (CatalogItemRow row : rows) {
            if (row.isGenerated()) {
                throw new IllegalArgumentException("Generated row passed as ingested item: " + row.key().asString());
            }
        }
        return inTransaction("replace ingested items", connection -> {
            try (PreparedStatement delete = connection.prepareStatement(
                    "DELETE FROM items WHERE source = ? AND variant_of IS NULL")) {
                for (String source : sources) {
                    delete.setString(1, source);
                    delete.addBatch();
                }
                delete.executeBatch();
            }
            try (PreparedStatement delete = connection.prepareStatement(
                    "DELETE FROM items WHERE name = ? AND source = ?")) {
                for (CatalogItemRow row : rows) {
                    delete.setString(1, row.name());
                    delete.setString(2, row.source());
                    delete.addBatch();
                }
                delete.executeBatch();
            }
            return insertBatch(connection, rows);
        });
    }

    public void insertItem(CatalogItemRow row) {
        Objects.requireNonNull(row, "row");
        inTransaction("insert item " + row.key().asString(), connection -> insertBatch(connection, List.of(row)));
    }

    public Optional<CatalogItemRow> findItem(ItemKey key) {
        Objects.requireNonNull(key, "key");
        try (Connection c = database.open();
             PreparedStatement ps = c.prepareStatement(SELECT_COLUMNS + " WHERE name = ? AND source = ?")) {
            ps.setString(1, key.name());
            ps.setString(2, key.source());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readRow(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new CatalogPersistenceException("Failed to look up item " + key.asString(), e);
        }
    }

    public List<CatalogItemRow> listItems() {
        return query(SELECT_COLUMNS + " ORDER BY name, source");
    }

    public List<CatalogItemRow> listGeneratedItems() {
        return query(SELECT_COLUMNS + " WHERE variant_of IS NOT NULL ORDER BY name, source");
    }

    /**
     * Class names the item's attunement is restricted to, alphabetically. Empty for unrestricted or unknown items.
     */
    public List<String> findAttunementClasses(ItemKey key) {
        Objects.requireNonNull(key, "key");
        try (Connection c = database.open();
             PreparedStatement ps = c.prepareStatement("SELECT a.class_name FROM item_attunement a "
                     + "JOIN items i ON i.id = a.item_id WHERE i.name = ? AND i.source = ? ORDER BY a.class_name")) {
            ps.setString(1, key.name());
            ps.setString(2, key.source());
            try (ResultSet rs = ps.executeQuery()) {
                List<String> classes = new ArrayList<>();
                while (rs.next()) {
                    classes.add(rs.getString(1));
                }
                return classes;
            }
        } catch (SQLException e) {
            throw new CatalogPersistenceException("Failed to look up attunement of " + key.asString(), e);
        }
    }

    public int countGenerated() {
        try (Connection c = database.open();
             Statement s = c.createStatement();
             ResultSet rs = s.executeQuery("SELECT COUNT(*) FROM items WHERE variant_of IS NOT NULL")) {
            rs.next();
            return rs.getInt(1);
        } catch (SQLException e) {
            throw new CatalogPersistenceException("Failed to count generated items", e);
        }
    }

    private List<CatalogItemRow> query(String sql) {
        try (Connection c = database.open();
             Statement s = c.createStatement();
             ResultSet rs = s.executeQuery(sql)) {
            List<CatalogItemRow> rows = new ArrayList<>();
            while (rs.next()) {
                rows.add(readRow(rs));
            }
            return rows;
        } catch (SQLException e) {
            throw new CatalogPersistenceException("Failed to list catalog items", e);
        }
    }

    private Set<ItemKey> loadKeys(Connection connection) throws SQLException {
        Set<ItemKey> keys = new HashSet<>();
        try (Statement s = connection.createStatement();
             ResultSet rs = s.executeQuery("SELECT name, source FROM items")) {
            while (rs.next()) {
                keys.add(new ItemKey(rs.getString(1), rs.getString(2)));
            }
        }
        return keys;
    }

    private int insertBatch(Connection connection, List<CatalogItemRow> rows) throws SQLException {
        if (rows.isEmpty()) {
            return 0;
        }
        try (PreparedStatement ps = connection.prepareStatement(INSERT_SQL)) {
            for (CatalogItemRow row : rows) {
                ps.setString(1, row.name());
                ps.setString(2, row.source());
                setNullableString(ps, 3, row.itemType());
                setNullableString(ps, 4, row.rarity());
                ps.setString(5, row.data());
                setNullableString(ps, 6, row.variantOf());
                setNullableString(ps, 7, row.baseItem());
                ps.addBatch();
            }
            ps.executeBatch();
        }
        insertAttunement(connection, rows);
        return rows.size();
    }

    private void insertAttunement(Connection connection, List<CatalogItemRow> rows) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(INSERT_ATTUNEMENT_SQL)) {
            int pending = 0;
            for (CatalogItemRow row : rows) {
                for (AttunementClass attunementClass : attunementClasses(row)) {
                    ps.setString(1, attunementClass.className());
                    ps.setString(2, row.name());
                    ps.setString(3, row.source());
                    ps.addBatch();
                    pending++;
                }
            }
            if (pending > 0) {
                ps.executeBatch();
            }
        }
    }

    private List<AttunementClass> attunementClasses(CatalogItemRow row) {
        if (!row.data().contains("reqAttune")) {
            return List.of();
        }
        try {
            JsonNode reqAttune = mapper.readTree(row.data()).get("reqAttune");
            return reqAttune != null && reqAttune.isTextual()
                    ? AttunementClass.mentionedIn(reqAttune.textValue())
                    : List.of();
        } catch (JsonProcessingException e) {
            LOGGER.warn("Unreadable data for item {}, attunement classes not indexed", row.key().asString(), e);
            return List.of();
        }
    }

    private static void setNullableString(PreparedStatement ps, int index, String value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value);
        }
    }

    private static CatalogItemRow readRow(ResultSet rs) throws SQLException {
        return new CatalogItemRow(
                rs.getString("name"),
                rs.getString("source"),
                rs.getString("item_type"),
                rs.getString("rarity"),
                rs.getString("data"),
                rs.getString("variant_of"),
                rs.getString("base_item"));
    }

    private <T> T inTransaction(String action, SqlWork<T> work) {
        try (Connection connection = database.open()) {
            connection.setAutoCommit(false);
            try {
                T result = work.apply(connection);
                connection.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                try {
                    connection.rollback();
                } catch (SQLException rollbackError) {
                    e.addSuppressed(rollbackError);
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new CatalogPersistenceException("Failed to " + action, e);
        }
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T apply(Connection connection) throws SQLException;
    }
}
