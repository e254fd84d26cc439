package com.resource.lock.postgres.pool;

/**
 * Configuration for {@link SimpleConnectionPool}.
 *
 * <p>Every held advisory lease pins one connection, so {@code maxTotal} also
 * bounds the number of Postgres leases that can be held at once.</p>
 */
public class PoolConfig {

    private final int maxTotal;
    private final int maxIdle;
    private final int minIdle;
    private final long maxWaitMillis;
    private final boolean testOnBorrow;
    private final int validationTimeoutSeconds;
    private final String jdbcUrl;
    private final String username;
    private final String password;

    private PoolConfig(Builder builder) {
        this.maxTotal = builder.maxTotal;
        this.maxIdle = builder.maxIdle;
        this.minIdle = builder.minIdle;
        this.maxWaitMillis = builder.maxWaitMillis;
        this.testOnBorrow = builder.testOnBorrow;
        this.validationTimeoutSeconds = builder.validationTimeoutSeconds;
        this.jdbcUrl = builder.jdbcUrl;
        this.username = builder.username;
        this.password = builder.password;
    }

    public int getMaxTotal() { return maxTotal; }
    public int getMaxIdle() { return maxIdle; }
    public int getMinIdle() { return minIdle; }
    public long getMaxWaitMillis() { return maxWaitMillis; }
    public boolean isTestOnBorrow() { return testOnBorrow; }
    public int getValidationTimeoutSeconds() { return validationTimeoutSeconds; }
    public String getJdbcUrl() { return jdbcUrl; }
    public String getUsername() { return username; }
    public String getPassword() { return password; }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxTotal = 10;
        private int maxIdle = 10;
        private int minIdle = 0;
        private long maxWaitMillis = 5000;
        private boolean testOnBorrow = true;
        private int validationTimeoutSeconds = 2;
        private String jdbcUrl = "jdbc:postgresql://localhost:5432/postgres";
        private String username;
        private String password;

        public Builder maxTotal(int maxTotal) {
            if (maxTotal <= 0) throw new IllegalArgumentException("maxTotal must be > 0");
            this.maxTotal = maxTotal;
            return this;
        }

        public Builder maxIdle(int maxIdle) {
            if (maxIdle < 0) throw new IllegalArgumentException("maxIdle must be >= 0");
            this.maxIdle = maxIdle;
            return this;
        }

        public Builder minIdle(int minIdle) {
            if (minIdle < 0) throw new IllegalArgumentException("minIdle must be >= 0");
            this.minIdle = minIdle;
            return this;
        }

        public Builder maxWaitMillis(long maxWaitMillis) {
            if (maxWaitMillis <= 0) throw new IllegalArgumentException("maxWaitMillis must be > 0");
            this.maxWaitMillis = maxWaitMillis;
            return this;
        }

        public Builder testOnBorrow(boolean testOnBorrow) {
            this.testOnBorrow = testOnBorrow;
            return this;
        }

        public Builder validationTimeoutSeconds(int validationTimeoutSeconds) {
            if (validationTimeoutSeconds < 0) {
                throw new IllegalArgumentException("validationTimeoutSeconds must be >= 0");
            }
            this.validationTimeoutSeconds = validationTimeoutSeconds;
            return this;
        }

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

        public PoolConfig build() {
            if (maxIdle > maxTotal) {
                throw new IllegalArgumentException("maxIdle cannot exceed maxTotal");
            }
            if (minIdle > maxIdle) {
                throw new IllegalArgumentException("minIdle cannot exceed maxIdle");
            }
            if (jdbcUrl == null || jdbcUrl.isBlank()) {
                throw new IllegalArgumentException("jdbcUrl must not be blank");
            }
            return new PoolConfig(this);
        }
    }

    @Override
    public String toString() {
        return "PoolConfig{" +
                "maxTotal=" + maxTotal +
                ", maxIdle=" + maxIdle +
                ", minIdle=" + minIdle +
                ", maxWaitMillis=" + maxWaitMillis +
                ", testOnBorrow=" + testOnBorrow +
                ", jdbcUrl='" + jdbcUrl + '\'' +
                ", username='" + username + '\'' +
                '}';
    }
}
