package com.hcltech.hierarchy.core;

import com.hcltech.hierarchy.core.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * All root-to-node paths implied by a parent/child edge source.
 * <p>
 * Built lazily on first read (or by {@link #create()}), discarded by {@link #delete()} and rebuilt from scratch
 * on the next read. A build is all-or-nothing: a failed build leaves the hierarchy unbuilt, never half built
 * and never holding the previous result.
 * Not thread-safe: confine an instance to one owner.
 */
public final class Hierarchy<N> {
    private static final Logger log = LoggerFactory.getLogger(Hierarchy.class);

    private final ParentSelection<N> parentSelection;
    private List<Edge<N>> source;
    private String levelLabel = HierarchyTables.DEFAULT_LEVEL_LABEL;
    private String primkeyLabel = HierarchyTables.DEFAULT_PRIMKEY_LABEL;
    private Built<N> built;

    private record Built<N>(HierarchyMaps<N> maps, Set<N> roots, Set<List<N>> paths) {}

    private Hierarchy(List<Edge<N>> source, ParentSelection<N> parentSelection) {
        this.source = source;
        this.parentSelection = Objects.requireNonNull(parentSelection, "parentSelection");
    }

    public static <N> Hierarchy<N> of(Collection<Edge<N>> edges) {
        return of(edges, ParentSelection.firstRecorded());
    }

    public static <N> Hierarchy<N> of(Collection<Edge<N>> edges, ParentSelection<N> parentSelection) {
        return new Hierarchy<>(EdgeSources.fromEdges(edges), parentSelection);
    }

    public static <N> Hierarchy<N> fromPairs(Collection<? extends List<? extends N>> pairs) {
        return fromPairs(pairs, ParentSelection.firstRecorded());
    }

    public static <N> Hierarchy<N> fromPairs(Collection<? extends List<? extends N>> pairs,
                                             ParentSelection<N> parentSelection) {
        return new Hierarchy<>(EdgeSources.fromPairs(pairs), parentSelection);
    }

    public static Hierarchy<Object> fromTable(Table table) {
        return fromTable(table, ParentSelection.firstRecorded());
    }

    public static Hierarchy<Object> fromTable(Table table, ParentSelection<Object> parentSelection) {
        return new Hierarchy<>(EdgeSources.fromTable(table), parentSelection);
    }

    /** No source yet; supply one with {@link #replaceSource(Collection)}. */
    public static <N> Hierarchy<N> empty() {
        return empty(ParentSelection.firstRecorded());
    }

    public static <N> Hierarchy<N> empty(ParentSelection<N> parentSelection) {
        return new Hierarchy<>(null, parentSelection);
    }

    public boolean hasSource() {
        return source != null;
    }

    public List<Edge<N>> source() {
        return source == null ? List.of() : source;
    }

    /** Swaps the edge source; the next read rebuilds. */
    public void replaceSource(Collection<Edge<N>> edges) {
        this.source = EdgeSources.fromEdges(edges);
        delete();
    }

    public String levelLabel() {
        return levelLabel;
    }

    public void setLevelLabel(String levelLabel) {
        this.levelLabel = Objects.requireNonNull(levelLabel, "levelLabel");
    }

    public String primkeyLabel() {
        return primkeyLabel;
    }

    public void setPrimkeyLabel(String primkeyLabel) {
        this.primkeyLabel = Objects.requireNonNull(primkeyLabel, "primkeyLabel");
    }

    /** Builds (or rebuilds) maps, roots and paths from the current source. */
    public Set<List<N>> create() {
        built = null;
        if (source == null) {
            log.warn("Failed to create the hierarchy: no edge source is present");
            built = new Built<>(HierarchyMaps.empty(), Set.of(), Set.of());
            return built.paths();
        }
        HierarchyMaps<N> maps = MappingBuilder.build(source);
        Set<N> roots = new RootFinder<>(maps, parentSelection).findRoots();
        Set<List<N>> paths = new PathEnumerator<>(maps).enumerateAll(roots);
        built = new Built<>(maps, Collections.unmodifiableSet(roots), Collections.unmodifiableSet(paths));
        log.info("Successfully created hierarchy: {} edge(s), {} root(s), {} path(s)",
                source.size(), roots.size(), paths.size());
        return built.paths();
    }

    public void delete() {
        built = null;
    }

    public boolean isBuilt() {
        return built != null;
    }

    private Built<N> ensureBuilt() {
        if (built == null) create();
        return built;
    }

    public Set<List<N>> paths() {
        return ensureBuilt().paths();
    }

    public Set<N> roots() {
        return ensureBuilt().roots();
    }

    public HierarchyMaps<N> maps() {
        return ensureBuilt().maps();
    }

    /** @throws EmptyHierarchyException when there are no paths */
    public int maxDepth() {
        return RowFlattener.maxLength(paths());
    }

    public Set<List<Object>> toTuples() {
        return toTuples(FlattenOptions.DEFAULT);
    }

    /** @throws EmptyHierarchyException when flattening an empty hierarchy */
    public Set<List<Object>> toTuples(FlattenOptions options) {
        Set<List<N>> paths = paths();
        if (!options.flattened()) {
            Set<List<Object>> raw = new LinkedHashSet<>();
            for (List<N> p : paths) raw.add(Collections.unmodifiableList(p));
            return raw;
        }
        return RowFlattener.flattenToSet(paths, options.emptyValue(), options.hasPrimkey());
    }

    public List<List<Object>> toLists() {
        return toLists(FlattenOptions.DEFAULT);
    }

    /** Mutable copies in enumeration order. */
    public List<List<Object>> toLists(FlattenOptions options) {
        Set<List<N>> paths = paths();
        Collection<? extends List<?>> rows = options.flattened()
                ? RowFlattener.flatten(paths, options.emptyValue(), options.hasPrimkey())
                : paths;
        List<List<Object>> out = new ArrayList<>(rows.size());
        for (List<?> row : rows) out.add(new ArrayList<>(row));
        return out;
    }

    public Table toTable() {
        return toTable(TableOptions.DEFAULT);
    }

    /** @throws EmptyHierarchyException when there are no paths */
    public Table toTable(TableOptions options) {
        return HierarchyTables.render(paths(),
                options.emptyValue(),
                options.levelLabel() != null ? options.levelLabel() : levelLabel,
                options.hasPrimkey(),
                options.primkeyLabel() != null ? options.primkeyLabel() : primkeyLabel);
    }
}
