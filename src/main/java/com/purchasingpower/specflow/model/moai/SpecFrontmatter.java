package com.purchasingpower.specflow.model.moai;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * YAML-ish frontmatter of a SPEC document.
 *
 * <p>Values are {@code String}, {@code Long} (all-digit values) or {@code List<String>}
 * (bracket notation). The reserved keys {@code spec_id}, {@code phase} and
 * {@code created} are always present and default to the empty string.
 *
 * @since 1.0.0
 */
public final class SpecFrontmatter {

    public static final String SPEC_ID = "spec_id";
    public static final String PHASE = "phase";
    public static final String CREATED = "created";

    private final Map<String, Object> values;

    private SpecFrontmatter(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * Builds frontmatter from parsed entries, filling in the reserved keys first.
     */
    public static SpecFrontmatter of(Map<String, Object> entries) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(SPEC_ID, "");
        values.put(PHASE, "");
        values.put(CREATED, "");
        values.putAll(entries);
        return new SpecFrontmatter(values);
    }

    public static SpecFrontmatter empty() {
        return of(Map.of());
    }

    public Object get(String key) {
        return values.get(key);
    }

    /**
     * String form of a value: lists are comma-joined, missing keys become "".
     */
    public String getString(String key) {
        Object value = values.get(key);
        if (value == null) {
            return "";
        }
        if (value instanceof List<?> list) {
            return String.join(", ", list.stream().map(String::valueOf).toList());
        }
        return String.valueOf(value);
    }

    @SuppressWarnings("unchecked")
    public List<String> getList(String key) {
        Object value = values.get(key);
        return value instanceof List<?> ? (List<String>) value : List.of();
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    @JsonIgnore
    public String getSpecId() {
        return getString(SPEC_ID);
    }

    @JsonIgnore
    public String getPhase() {
        return getString(PHASE);
    }

    @JsonIgnore
    public String getCreated() {
        return getString(CREATED);
    }

    @JsonAnyGetter
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SpecFrontmatter other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "SpecFrontmatter" + values;
    }
}
