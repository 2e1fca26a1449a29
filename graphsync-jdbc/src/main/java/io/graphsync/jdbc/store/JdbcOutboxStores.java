package io.graphsync.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC outbox stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.graphsync.jdbc.store.AbstractJdbcOutboxStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcOutboxStore store = JdbcOutboxStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL, custom table
 * AbstractJdbcOutboxStore store = JdbcOutboxStores.detect("jdbc:postgresql://db/app", "graph_outbox");
 *
 * // Get by name
 * AbstractJdbcOutboxStore store = JdbcOutboxStores.get("h2");
 * }</pre>
 */
public final class JdbcOutboxStores {

    private static final List<AbstractJdbcOutboxStore> STORES;
    private static final Map<String, AbstractJdbcOutboxStore> BY_NAME = new ConcurrentHashMap<>();

    static {
        STORES = ServiceLoader.load(AbstractJdbcOutboxStore.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (AbstractJdbcOutboxStore store : STORES) {
            BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
        }
    }

    private JdbcOutboxStores() {
    }

    /**
     * Returns all registered outbox stores.
     */
    public static List<AbstractJdbcOutboxStore> all() {
        return STORES;
    }

    /**
     * Gets an outbox store by name.
     *
     * @param name outbox store name (case-insensitive)
     * @return the outbox store
     * @throws IllegalArgumentException if no outbox store found
     */
    public static AbstractJdbcOutboxStore get(String name) {
        Objects.requireNonNull(name, "name");
        AbstractJdbcOutboxStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
        if (store == null) {
            throw new IllegalArgumentException("Unknown outbox store: " + name +
                    ". Available: " + BY_NAME.keySet());
        }
        return store;
    }

    /**
     * Auto-detects the outbox store from a DataSource.
     *
     * @throws IllegalStateException if detection fails or no matching outbox store
     */
    public static AbstractJdbcOutboxStore detect(DataSource dataSource) {
        try (Connection conn = dataSource.getConnection()) {
            String url = conn.getMetaData().getURL();
            return detect(url);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to detect outbox store from DataSource", e);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    /**
     * Auto-detects the outbox store from a DataSource and binds it to a custom table.
     */
    public static AbstractJdbcOutboxStore detect(DataSource dataSource, String tableName) {
        return bind(detect(dataSource), tableName);
    }

    /**
     * Auto-detects the outbox store from a JDBC URL.
     *
     * @throws IllegalArgumentException if no matching outbox store found
     */
    public static AbstractJdbcOutboxStore detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }

        String url = jdbcUrl.toLowerCase(Locale.ROOT);
        for (AbstractJdbcOutboxStore store : STORES) {
            for (String prefix : store.jdbcUrlPrefixes()) {
                if (url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
                    return store;
                }
            }
        }

        throw new IllegalArgumentException("No outbox store found for JDBC URL: " + jdbcUrl +
                ". Supported prefixes: " + allPrefixes());
    }

    /**
     * Auto-detects the outbox store from a JDBC URL and binds it to a custom table.
     *
     * @throws IllegalArgumentException if no store matches or the table name is invalid
     */
    public static AbstractJdbcOutboxStore detect(String jdbcUrl, String tableName) {
        return bind(detect(jdbcUrl), tableName);
    }

    private static AbstractJdbcOutboxStore bind(AbstractJdbcOutboxStore template, String tableName) {
        Objects.requireNonNull(tableName, "tableName");
        if (tableName.equals(template.tableName())) {
            return template;
        }
        return template.withTableName(tableName);
    }

    private static List<String> allPrefixes() {
        return STORES.stream()
                .flatMap(s -> s.jdbcUrlPrefixes().stream())
                .toList();
    }
}
