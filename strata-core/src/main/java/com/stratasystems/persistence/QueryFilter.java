package com.stratasystems.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stratasystems.persistence.codec.RecordSerializer;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Equality filter over the top-level fields of a record value.
 *
 * <p>A value matches when it is a JSON object and every criterion field is present with
 * an equal value. An empty filter matches everything, including non-object values.
 */
public final class QueryFilter {

    public static final QueryFilter ALL = new QueryFilter(Map.of());

    private final Map<String, JsonNode> criteria;

    private QueryFilter(Map<String, JsonNode> criteria) {
        this.criteria = Collections.unmodifiableMap(new TreeMap<>(criteria));
    }

    /**
     * Builds a filter from plain Java values; each value is converted with Jackson.
     *
     * @param criteria field name to expected value
     * @return the filter
     */
    public static QueryFilter of(Map<String, ?> criteria) {
        if (criteria == null || criteria.isEmpty()) {
            return ALL;
        }
        Map<String, JsonNode> nodes = new TreeMap<>();
        criteria.forEach((field, expected) ->
            nodes.put(Objects.requireNonNull(field, "field"), RecordSerializer.mapper().valueToTree(expected)));
        return new QueryFilter(nodes);
    }

    public static QueryFilter where(String field, Object expected) {
        return of(Map.of(field, expected));
    }

    public boolean isEmpty() {
        return criteria.isEmpty();
    }

    public boolean matches(JsonNode value) {
        if (criteria.isEmpty()) {
            return true;
        }
        if (value == null || !value.isObject()) {
            return false;
        }
        for (Map.Entry<String, JsonNode> criterion : criteria.entrySet()) {
            JsonNode actual = value.get(criterion.getKey());
            if (actual == null || !actual.equals(criterion.getValue())) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return the criteria as a JSON object with fields in sorted order
     */
    public ObjectNode toJson() {
        ObjectNode node = RecordSerializer.mapper().createObjectNode();
        criteria.forEach(node::set);
        return node;
    }

    public Map<String, JsonNode> getCriteria() {
        return criteria;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return criteria.equals(((QueryFilter) o).criteria);
    }

    @Override
    public int hashCode() {
        return criteria.hashCode();
    }

    @Override
    public String toString() {
        return "QueryFilter" + criteria;
    }
}
