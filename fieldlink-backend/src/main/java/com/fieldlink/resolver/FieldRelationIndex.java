package com.fieldlink.resolver;

import com.fieldlink.config.ConfigException;
import com.fieldlink.model.FieldConfig;
import com.fieldlink.relation.RelationAdapter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable routing table from a field id to the relations exposing it.
 *
 * <p>Built once at startup and read concurrently by every request without synchronization.
 * Relations keep their declaration order for each field so traversals are reproducible.
 */
public final class FieldRelationIndex {

    private final Map<String, FieldConfig> fields;
    private final Map<String, List<RelationAdapter>> relationsByField;
    private final Map<String, RelationAdapter> relationsByName;

    /**
     * Build the index.
     *
     * @param fields declared fields
     * @param relations connected relations in declaration order
     * @throws ConfigException when a relation exposes an undeclared field or two relations share a name
     */
    public FieldRelationIndex(List<FieldConfig> fields, List<? extends RelationAdapter> relations) {
        Map<String, FieldConfig> fieldsById = new LinkedHashMap<>();
        for (FieldConfig field : fields) {
            fieldsById.put(field.getId(), field);
        }

        Map<String, List<RelationAdapter>> byField = new LinkedHashMap<>();
        Map<String, RelationAdapter> byName = new LinkedHashMap<>();
        for (RelationAdapter relation : relations) {
            if (byName.putIfAbsent(relation.getName(), relation) != null) {
                throw new ConfigException("duplicate relation name `" + relation.getName() + "`");
            }
            for (String fieldId : relation.getFieldIds()) {
                if (!fieldsById.containsKey(fieldId)) {
                    throw new ConfigException("undeclared field `" + fieldId + "` used in relation `"
                            + relation.getName() + "`");
                }
                List<RelationAdapter> list = byField.computeIfAbsent(fieldId, k -> new ArrayList<>());
                if (!list.contains(relation)) {
                    list.add(relation);
                }
            }
        }

        Map<String, List<RelationAdapter>> frozen = new LinkedHashMap<>();
        byField.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        this.fields = Collections.unmodifiableMap(fieldsById);
        this.relationsByField = Collections.unmodifiableMap(frozen);
        this.relationsByName = Collections.unmodifiableMap(byName);
    }

    /**
     * @param fieldId field id
     * @return relations exposing the field in declaration order, empty when no relation does
     */
    public Optional<List<RelationAdapter>> relationsFor(String fieldId) {
        return Optional.ofNullable(relationsByField.get(fieldId));
    }

    /**
     * @param name relation name
     * @return the relation adapter
     */
    public Optional<RelationAdapter> relation(String name) {
        return Optional.ofNullable(relationsByName.get(name));
    }

    /**
     * @param fieldId declared field id
     * @return whether discovered values of the field seed further lookups
     * @throws UnknownFieldException when the field is not declared
     */
    public boolean isDistinct(String fieldId) {
        FieldConfig field = fields.get(fieldId);
        if (field == null) {
            throw new UnknownFieldException("unknown field `" + fieldId + "`");
        }
        return field.isDistinct();
    }

    public int relationCount() {
        return relationsByName.size();
    }
}
