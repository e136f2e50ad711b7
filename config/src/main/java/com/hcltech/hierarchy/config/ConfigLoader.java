package com.hcltech.hierarchy.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.hcltech.hierarchy.common.IEnvGetter;
import com.hcltech.hierarchy.common.errorsor.ErrorsOr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public interface ConfigLoader {
    Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    String PASSWORD_ENV = "HIERARCHY_DB_PASSWORD";
    String POOL_SIZE_ENV = "HIERARCHY_DB_POOL_SIZE";

    ObjectMapper JSON = BaseConfigLoader.base(new ObjectMapper());
    ObjectReader CONFIG_READER = JSON.readerFor(HierarchyConfig.class);

    static HierarchyConfig fromJson(InputStream in) throws IOException {
        return CONFIG_READER.readValue(in);
    }

    static HierarchyConfig fromJson(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return fromJson(in);
        }
    }

    static HierarchyConfig fromJson(String json) throws IOException {
        try (InputStream in = new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))) {
            return fromJson(in);
        }
    }

    /** Reads, applies the environment overrides and validates. */
    static HierarchyConfig load(Path path, IEnvGetter env) throws IOException {
        HierarchyConfig cfg = withEnvironment(fromJson(path), env);
        HierarchyConfig valid = validate(cfg).valueOrThrow(msg -> new IllegalArgumentException("Invalid config " + path + ": " + msg));
        log.info("Loaded config {}: source {}.{} -> destination {}.{}", path,
                valid.source().schema(), valid.source().table(),
                valid.destination().schema(), valid.destination().table());
        return valid;
    }

    /** Environment values win over the file. */
    static HierarchyConfig withEnvironment(HierarchyConfig cfg, IEnvGetter env) {
        DatabaseConfig db = cfg.database();
        if (db == null) return cfg;
        String password = IEnvGetter.getStringOr(env, PASSWORD_ENV, db.password());
        int poolSize = IEnvGetter.getIntOr(env, POOL_SIZE_ENV, db.poolSize());
        return cfg.withDatabase(db.withPassword(password).withPoolSize(poolSize));
    }

    /** Every missing or inconsistent field, reported together. */
    static ErrorsOr<HierarchyConfig> validate(HierarchyConfig cfg) {
        if (cfg == null) return ErrorsOr.error("Config is empty");
        List<String> errors = new ArrayList<>();

        DatabaseConfig db = cfg.database();
        if (db == null) {
            errors.add("'database' section is missing");
        } else {
            required(errors, "database.type", db.type());
            required(errors, "database.url", db.url());
            if ("oracle".equalsIgnoreCase(db.type())) {
                required(errors, "database.user", db.user());
                required(errors, "database.password", db.password());
            }
            if (db.poolSize() < 1) errors.add("database.poolSize must be at least 1 but was " + db.poolSize());
        }

        SourceConfig source = cfg.source();
        if (source == null) {
            errors.add("'source' section is missing");
        } else {
            required(errors, "source.schema", source.schema());
            required(errors, "source.table", source.table());
            required(errors, "source.parent", source.parent());
            required(errors, "source.child", source.child());
        }

        DestinationConfig destination = cfg.destination();
        if (destination == null) {
            errors.add("'destination' section is missing");
        } else {
            required(errors, "destination.schema", destination.schema());
            required(errors, "destination.table", destination.table());
        }
        return ErrorsOr.liftIfNoErrors(cfg, errors);
    }

    private static void required(List<String> errors, String name, String value) {
        if (value == null || value.isBlank()) errors.add(name + " is required");
    }
}
