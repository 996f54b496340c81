package com.unit.catalog.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Connection settings for the PostgreSQL catalog database.
 */
public class DataSourceConfig {

    private final String jdbcUrl;
    private final String username;
    private final String password;
    private final int maximumPoolSize;
    private final int minimumIdle;
    private final long connectionTimeoutMillis;
    private final long idleTimeoutMillis;
    private final boolean applySchema;

    private DataSourceConfig(Builder builder) {
        this.jdbcUrl = builder.jdbcUrl;
        this.username = builder.username;
        this.password = builder.password;
        this.maximumPoolSize = builder.maximumPoolSize;
        this.minimumIdle = builder.minimumIdle;
        this.connectionTimeoutMillis = builder.connectionTimeoutMillis;
        this.idleTimeoutMillis = builder.idleTimeoutMillis;
        this.applySchema = builder.applySchema;
    }

    public String getJdbcUrl() { return jdbcUrl; }
    public String getUsername() { return username; }
    public int getMaximumPoolSize() { return maximumPoolSize; }
    public int getMinimumIdle() { return minimumIdle; }
    public long getConnectionTimeoutMillis() { return connectionTimeoutMillis; }
    public long getIdleTimeoutMillis() { return idleTimeoutMillis; }

    /**
     * Whether the bundled schema is applied when the store opens.
     */
    public boolean isApplySchema() { return applySchema; }

    public HikariConfig toHikariConfig() {
        HikariConfig config = new HikariConfig();
        config.setPoolName("unit-catalog");
        config.setJdbcUrl(jdbcUrl);
        config.setUsername(username);
        config.setPassword(password);
        config.setMaximumPoolSize(maximumPoolSize);
        config.setMinimumIdle(minimumIdle);
        config.setConnectionTimeout(connectionTimeoutMillis);
        config.setIdleTimeout(idleTimeoutMillis);
        config.setAutoCommit(false);
        return config;
    }

    public HikariDataSource createDataSource() {
        return new HikariDataSource(toHikariConfig());
    }

    @Override
    public String toString() {
        return "DataSourceConfig{jdbcUrl=" + jdbcUrl + ", username=" + username
                + ", maximumPoolSize=" + maximumPoolSize + ", applySchema=" + applySchema + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String jdbcUrl;
        private String username;
        private String password;
        private int maximumPoolSize = 10;
        private int minimumIdle = 2;
        private long connectionTimeoutMillis = 5000;
        private long idleTimeoutMillis = 600_000;
        private boolean applySchema = true;

        public Builder jdbcUrl(String jdbcUrl) {
            this.jdbcUrl = jdbcUrl;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder maximumPoolSize(int maximumPoolSize) {
            if (maximumPoolSize <= 0) throw new IllegalArgumentException("maximumPoolSize must be > 0");
            this.maximumPoolSize = maximumPoolSize;
            return this;
        }

        public Builder minimumIdle(int minimumIdle) {
            if (minimumIdle < 0) throw new IllegalArgumentException("minimumIdle must be >= 0");
            this.minimumIdle = minimumIdle;
            return this;
        }

        public Builder connectionTimeoutMillis(long connectionTimeoutMillis) {
            if (connectionTimeoutMillis < 250) throw new IllegalArgumentException("connectionTimeoutMillis must be >= 250");
            this.connectionTimeoutMillis = connectionTimeoutMillis;
            return this;
        }

        public Builder idleTimeoutMillis(long idleTimeoutMillis) {
            if (idleTimeoutMillis < 0) throw new IllegalArgumentException("idleTimeoutMillis must be >= 0");
            this.idleTimeoutMillis = idleTimeoutMillis;
            return this;
        }

        public Builder applySchema(boolean applySchema) {
            this.applySchema = applySchema;
            return this;
        }

        public DataSourceConfig build() {
            if (jdbcUrl == null || jdbcUrl.isBlank()) {
                throw new IllegalArgumentException("jdbcUrl is required");
            }
            if (minimumIdle > maximumPoolSize) {
                throw new IllegalArgumentException("minimumIdle must not exceed maximumPoolSize");
            }
            return new DataSourceConfig(this);
        }
    }
}
