package com.hybridrag.store;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.hybridrag.error.ValidationException;

/**
 * Payload predicate with must / should / must_not clauses. The same value is sent to a
 * remote backend in its JSON form ({@link #toMap()}) and evaluated in process
 * ({@link #matches(Map)}) when a backend cannot apply it.
 */
public final class PointFilter {
    private static final PointFilter EMPTY = new PointFilter(List.of(), List.of(), List.of());

    private final List<Condition> must;
    private final List<Condition> should;
    private final List<Condition> mustNot;

    private PointFilter(List<Condition> must, List<Condition> should, List<Condition> mustNot) {
        this.must = List.copyOf(must);
        this.should = List.copyOf(should);
        this.mustNot = List.copyOf(mustNot);
    }

    public static PointFilter empty() {
        return EMPTY;
    }

    public static PointFilter fileEquals(String filePath) {
        return builder().must(PayloadFields.FILE_PATH, PayloadFields.normalizePath(filePath)).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parses the tool-call JSON shape. A map without {@code must}/{@code should}/{@code must_not}
     * is read as shorthand: every entry becomes a must-match (a list value becomes match-any).
     */
    public static PointFilter fromMap(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        boolean structured = raw.containsKey("must") || raw.containsKey("should") || raw.containsKey("must_not");
        if (!structured) {
            Builder builder = builder();
            raw.forEach((key, value) -> {
                if (value == null) {
                    throw new ValidationException("Filter value for " + key + " must not be null");
                }
                if (value instanceof List<?> list) {
                    builder.mustAny(key, new ArrayList<>(list));
                } else {
                    builder.must(key, value);
                }
            });
            return builder.build();
        }
        for (String key : raw.keySet()) {
            if (!key.equals("must") && !key.equals("should") && !key.equals("must_not")) {
                throw new ValidationException("Unknown filter clause: " + key);
            }
        }
        return new PointFilter(parseClause(raw.get("must")), parseClause(raw.get("should")),
                parseClause(raw.get("must_not")));
    }

    public boolean isEmpty() {
        return must.isEmpty() && should.isEmpty() && mustNot.isEmpty();
    }

    public boolean matches(Map<String, Object> payload) {
        for (Condition condition : must) {
            if (!condition.test(payload)) {
                return false;
            }
        }
        if (!should.isEmpty() && should.stream().noneMatch(condition -> condition.test(payload))) {
            return false;
        }
        for (Condition condition : mustNot) {
            if (condition.test(payload)) {
                return false;
            }
        }
        return true;
    }

    public Set<String> keys() {
        Set<String> keys = new LinkedHashSet<>();
        must.forEach(condition -> keys.add(condition.key()));
        should.forEach(condition -> keys.add(condition.key()));
        mustNot.forEach(condition -> keys.add(condition.key()));
        return keys;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        if (!must.isEmpty()) {
            out.put("must", must.stream().map(Condition::toMap).toList());
        }
        if (!should.isEmpty()) {
            out.put("should", should.stream().map(Condition::toMap).toList());
        }
        if (!mustNot.isEmpty()) {
            out.put("must_not", mustNot.stream().map(Condition::toMap).toList());
        }
        return out;
    }

    @Override
    public String toString() {
        return toMap().toString();
    }

    private static List<Condition> parseClause(Object raw) {
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> entries)) {
            throw new ValidationException("Filter clause must be a list of conditions");
        }
        List<Condition> conditions = new ArrayList<>();
        for (Object entry : entries) {
            if (!(entry instanceof Map<?, ?> map)) {
                throw new ValidationException("Filter condition must be an object: " + entry);
            }
            Object key = map.get("key");
            if (!(key instanceof String keyName) || keyName.isBlank()) {
                throw new ValidationException("Filter condition requires a key: " + entry);
            }
            if (map.containsKey("match")) {
                Object match = map.get("match");
                if (match == null) {
                    throw new ValidationException("match value is required for key " + keyName);
                }
                if (match instanceof Map<?, ?> matchMap && matchMap.containsKey("any")) {
                    Object any = matchMap.get("any");
                    if (!(any instanceof List<?> values)) {
                        throw new ValidationException("match.any must be a list for key " + keyName);
                    }
                    conditions.add(new MatchAny(keyName, new ArrayList<>(values)));
                } else if (match instanceof Map<?, ?> matchMap && matchMap.get("value") != null) {
                    conditions.add(new Match(keyName, matchMap.get("value")));
                } else if (match instanceof Map<?, ?>) {
                    throw new ValidationException("match needs value or any for key " + keyName);
                } else {
                    conditions.add(new Match(keyName, match));
                }
            } else if (map.get("range") instanceof Map<?, ?> range) {
                conditions.add(new Range(keyName, number(range.get("gt")), number(range.get("gte")),
                        number(range.get("lt")), number(range.get("lte"))));
            } else {
                throw new ValidationException("Filter condition for key " + keyName + " needs match or range");
            }
        }
        return conditions;
    }

    private static Double number(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new ValidationException("Range bound must be numeric: " + value);
    }

    static boolean looselyEquals(Object expected, Object actual) {
        if (expected == null || actual == null) {
            return expected == actual;
        }
        if (expected instanceof Number a && actual instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
        }
        if (expected instanceof Boolean || actual instanceof Boolean) {
            return expected.toString().equalsIgnoreCase(actual.toString());
        }
        return expected.toString().equals(actual.toString());
    }

    public interface Condition {
        String key();

        boolean test(Map<String, Object> payload);

        Map<String, Object> toMap();
    }

    public record Match(String key, Object value) implements Condition {
        @Override
        public boolean test(Map<String, Object> payload) {
            return looselyEquals(value, payload.get(key));
        }

        @Override
        public Map<String, Object> toMap() {
            return Map.of("key", key, "match", Map.of("value", value));
        }
    }

    public record MatchAny(String key, List<Object> values) implements Condition {
        public MatchAny {
            values = List.copyOf(values);
        }

        @Override
        public boolean test(Map<String, Object> payload) {
            Object actual = payload.get(key);
            return values.stream().anyMatch(value -> looselyEquals(value, actual));
        }

        @Override
        public Map<String, Object> toMap() {
            return Map.of("key", key, "match", Map.of("any", values));
        }
    }

    public record Range(String key, Double gt, Double gte, Double lt, Double lte) implements Condition {
        @Override
        public boolean test(Map<String, Object> payload) {
            if (!(payload.get(key) instanceof Number number)) {
                return false;
            }
            double actual = number.doubleValue();
            return (gt == null || actual > gt)
                    && (gte == null || actual >= gte)
                    && (lt == null || actual < lt)
                    && (lte == null || actual <= lte);
        }

        @Override
        public Map<String, Object> toMap() {
            Map<String, Object> bounds = new LinkedHashMap<>();
            if (gt != null) {
                bounds.put("gt", gt);
            }
            if (gte != null) {
                bounds.put("gte", gte);
            }
            if (lt != null) {
                bounds.put("lt", lt);
            }
            if (lte != null) {
                bounds.put("lte", lte);
            }
            return Map.of("key", key, "range", bounds);
        }
    }

    public static final class Builder {
        private final List<Condition> must = new ArrayList<>();
        private final List<Condition> should = new ArrayList<>();
        private final List<Condition> mustNot = new ArrayList<>();

        private Builder() {
        }

        public Builder must(String key, Object value) {
            must.add(new Match(key, value));
            return this;
        }

        public Builder mustAny(String key, List<Object> values) {
            must.add(new MatchAny(key, values));
            return this;
        }

        public PointFilter build() {
            return new PointFilter(must, should, mustNot);
        }
    }
}
