package com.hcltech.hierarchy.db;

import com.hcltech.hierarchy.common.IEnvGetter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HierarchyAppTest {

    @TempDir
    Path dir;

    private final IEnvGetter env = IEnvGetter.fromMap(Map.of());

    private Path config(H2TestDatabase h2) throws Exception {
        String json = """
                {
                  "database": { "type": "h2", "url": "%s", "user": "sa" },
                  "source": { "schema": "PUBLIC", "table": "EDGES", "parent": "PARENT", "child": "CHILD" },
                  "destination": { "schema": "PUBLIC", "table": "HIER", "emptyValue": "" }
                }
                """.formatted(h2.url());
        Path file = dir.resolve("hierarchy.json");
        Files.writeString(file, json);
        return file;
    }

    @Test
    void runsTheJobEndToEnd() throws Exception {
        var h2 = new H2TestDatabase().execute(
                "CREATE TABLE EDGES (PARENT VARCHAR(10), CHILD VARCHAR(10))",
                "INSERT INTO EDGES VALUES ('A', 'B'), ('B', 'C'), ('A', 'A')");
        Path cfg = config(h2);

        assertEquals(HierarchyApp.OK, HierarchyApp.run(new String[]{cfg.toString()}, env));

        assertEquals(List.of(
                List.of("A", "", "", "A"),
                List.of("A", "B", "", "B"),
                List.of("A", "B", "C", "C")), h2.query("SELECT * FROM HIER ORDER BY PK"));

        assertEquals(HierarchyApp.FAILED, HierarchyApp.run(new String[]{cfg.toString()}, env), "default policy is fail");
        assertEquals(HierarchyApp.OK, HierarchyApp.run(new String[]{cfg.toString(), "append"}, env));
        assertEquals(6, h2.query("SELECT * FROM HIER").size());
        assertEquals(HierarchyApp.OK, HierarchyApp.run(new String[]{cfg.toString(), "REPLACE"}, env));
        assertEquals(3, h2.query("SELECT * FROM HIER").size());
    }

    @Test
    void usageErrors() {
        assertEquals(HierarchyApp.USAGE, HierarchyApp.run(new String[0], env));
        assertEquals(HierarchyApp.USAGE, HierarchyApp.run(new String[]{"a.json", "truncate"}, env));
    }

    @Test
    void missingConfigFails() {
        assertEquals(HierarchyApp.FAILED, HierarchyApp.run(new String[]{dir.resolve("none.json").toString()}, env));
    }
}
