package com.fieldlink.relation;

import com.fieldlink.model.RelationConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Owns every relation adapter of the process.
 *
 * <p>All adapters are connected eagerly, in declaration order. If any relation fails to connect
 * the adapters opened so far are closed and the failure is rethrown, so a half-connected registry
 * is never published.
 */
@Slf4j
public class RelationRegistry implements AutoCloseable {

    private final List<RelationAdapter> adapters;

    /**
     * Connect all relations with JDBC adapters.
     *
     * @param relations relation definitions
     * @param poolSettings pool sizing shared by every relation
     */
    public RelationRegistry(List<RelationConfig> relations, PoolSettings poolSettings) {
        this(relations, relation -> new JdbcRelationAdapter(relation, poolSettings));
    }

    /**
     * Connect all relations with the given adapter factory.
     *
     * @param relations relation definitions
     * @param adapterFactory builds and connects one adapter
     */
    public RelationRegistry(List<RelationConfig> relations, Function<RelationConfig, RelationAdapter> adapterFactory) {
        List<RelationAdapter> connected = new ArrayList<>(relations.size());
        try {
            for (RelationConfig relation : relations) {
                connected.add(adapterFactory.apply(relation));
            }
        } catch (RuntimeException e) {
            closeAll(connected);
            throw e;
        }
        this.adapters = Collections.unmodifiableList(connected);
        log.info("Relation registry ready: {} relations connected", adapters.size());
    }

    /**
     * @return connected adapters in declaration order
     */
    public List<RelationAdapter> getAdapters() {
        return adapters;
    }

    @Override
    public void close() {
        closeAll(adapters);
    }

    private static void closeAll(List<RelationAdapter> adapters) {
        for (RelationAdapter adapter : adapters) {
            if (adapter instanceof AutoCloseable closeable) {
                try {
                    closeable.close();
                } catch (Exception e) {
                    log.warn("Failed to close relation `{}`", adapter.getName(), e);
                }
            }
        }
    }
}
