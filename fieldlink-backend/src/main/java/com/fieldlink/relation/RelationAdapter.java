package com.fieldlink.relation;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only access to one relation: answers single-field lookups against the external store.
 *
 * <p>Implementations are shared by all concurrent requests and must be thread-safe.
 */
public interface RelationAdapter {

    /**
     * @return unique relation name
     */
    String getName();

    /**
     * @return ids of the fields this relation exposes, in declaration order
     */
    List<String> getFieldIds();

    /**
     * Find every row whose {@code fieldId} equals {@code value} and collect the values of all exposed fields.
     * Values of all matched rows are aggregated; SQL NULLs are skipped.
     *
     * @param fieldId one of {@link #getFieldIds()}
     * @param value value to match
     * @return discovered values per field id, empty when nothing matched
     * @throws LookupException when the store cannot be queried or a column cannot be read
     */
    Map<String, Set<String>> lookup(String fieldId, String value);
}
