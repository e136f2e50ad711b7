package com.hcltech.hierarchy.db;

import com.hcltech.hierarchy.common.IEnvGetter;
import com.hcltech.hierarchy.config.ConfigLoader;
import com.hcltech.hierarchy.config.HierarchyConfig;
import com.hcltech.hierarchy.config.IfExists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * {@code HierarchyApp <config.json> [fail|append|replace]}
 * <p>
 * The optional policy overrides {@code destination.ifExists} from the file.
 */
public class HierarchyApp {
    private static final Logger log = LoggerFactory.getLogger(HierarchyApp.class);

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    public static void main(String[] args) {
        int code = run(args, IEnvGetter.env);
        if (code != OK) System.exit(code);
    }

    static int run(String[] args, IEnvGetter env) {
        if (args.length < 1 || args.length > 2) {
            System.err.println("Usage: HierarchyApp <config.json> [fail|append|replace]");
            return USAGE;
        }
        IfExists override;
        try {
            override = args.length == 2 ? IfExists.parse(args[1]) : null;
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            return USAGE;
        }
        try {
            HierarchyConfig config = ConfigLoader.load(Path.of(args[0]), env);
            HierarchyDb db = HierarchyDbFactory.create(config.database()).valueOrThrow(IllegalStateException::new);
            try (HierarchyJob job = new HierarchyJob(config, db)) {
                int rows = override == null ? job.run() : job.run(override);
                log.info("Hierarchy job finished: {} row(s) written", rows);
            }
            return OK;
        } catch (Exception e) {
            log.error("Hierarchy job failed: {}", e.getMessage(), e);
            return FAILED;
        }
    }
}
