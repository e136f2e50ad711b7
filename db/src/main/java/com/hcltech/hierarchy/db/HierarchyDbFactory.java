package com.hcltech.hierarchy.db;

import com.hcltech.hierarchy.common.errorsor.ErrorsOr;
import com.hcltech.hierarchy.config.DatabaseConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the {@link HierarchyDb} named by {@link DatabaseConfig#type()}: {@code oracle}, {@code h2} or
 * {@code jdbc} (any driver, dialect guessed from the url).
 */
public final class HierarchyDbFactory {
    private HierarchyDbFactory() {}

    public static ErrorsOr<HierarchyDb> create(DatabaseConfig config) {
        if (config == null) return ErrorsOr.error("Database config is missing");
        String type = config.type() == null ? null : config.type().trim().toLowerCase(Locale.ROOT);
        if (type == null || !List.of("oracle", "h2", "jdbc").contains(type)) {
            return ErrorsOr.error("Unsupported database type: " + config.type());
        }

        List<String> errors = new ArrayList<>();
        required(errors, "url", config.url());
        if (type.equals("oracle")) {
            required(errors, "user", config.user());
            required(errors, "password", config.password());
        }
        if (!errors.isEmpty()) return ErrorsOr.<HierarchyDb>errors(errors).addPrefixIfError(type + ": ");

        SqlDialect dialect = switch (type) {
            case "oracle" -> SqlDialect.ORACLE;
            case "h2" -> SqlDialect.H2;
            default -> SqlDialect.forUrl(config.url());
        };
        return ErrorsOr.<HierarchyDb>trying(() -> JdbcHierarchyDb.pooled(config, dialect))
                .addPrefixIfError("Cannot open " + type + " database " + config.url() + ": ");
    }

    private static void required(List<String> errors, String name, String value) {
        if (value == null || value.isBlank()) errors.add(name + " is required");
    }
}
