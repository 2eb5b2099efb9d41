package dev.badgersnacks.compendium.persistence;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;

/**
 * JDBC connection details for the local catalog database (H2).
 */
public final class CatalogDatabase {

    private final String url;
    private final String user;
    private final String password;

    public CatalogDatabase(String url, String user, String password) {
        this.url = Objects.requireNonNull(url, "url");
        this.user = user == null ? "" : user;
        this.password = password == null ? "" : password;
    }

    public static CatalogDatabase from(EngineSettings settings) {
        return new CatalogDatabase(settings.databaseUrl(), settings.databaseUser(), settings.databasePassword());
    }

    /**
     * Private in-memory database that lives until the JVM exits.
     */
    public static CatalogDatabase inMemory(String name) {
        return new CatalogDatabase("jdbc:h2:mem:" + name + ";DB_CLOSE_DELAY=-1", "sa", "");
    }

    public Connection open() throws SQLException {
        return DriverManager.getConnection(url, user, password);
    }

    public String url() {
        return url;
    }
}
