package com.hcltech.hierarchy.config;

import org.jetbrains.annotations.Nullable;

/**
 * @param type        oracle, h2 or jdbc
 * @param driverClass only needed when the driver does not register itself
 * @param poolSize    maximum pooled connections, defaults to {@value #DEFAULT_POOL_SIZE}
 */
public record DatabaseConfig(String type,
                             String url,
                             @Nullable String user,
                             @Nullable String password,
                             @Nullable String driverClass,
                             Integer poolSize) {

    public static final int DEFAULT_POOL_SIZE = 2;

    public DatabaseConfig {
        if (poolSize == null) poolSize = DEFAULT_POOL_SIZE;
    }

    public DatabaseConfig withPassword(String password) {
        return new DatabaseConfig(type, url, user, password, driverClass, poolSize);
    }

    public DatabaseConfig withPoolSize(int poolSize) {
        return new DatabaseConfig(type, url, user, password, driverClass, poolSize);
    }

    @Override
    public String toString() {
        return "DatabaseConfig[type=" + type + ", url=" + url + ", user=" + user
                + ", password=" + (password == null ? null : "****")
                + ", driverClass=" + driverClass + ", poolSize=" + poolSize + "]";
    }
}
