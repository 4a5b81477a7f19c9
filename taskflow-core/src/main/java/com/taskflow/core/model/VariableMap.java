package com.taskflow.core.model;

import com.taskflow.core.exception.VariableTypeException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Immutable view over a dynamically typed {@code String -> Object} mapping.
 * Used for execution variables, step configuration and action parameters.
 *
 * Typed getters return {@link Optional#empty()} for absent or null values and
 * throw {@link VariableTypeException} when a value is present with the wrong type.
 */
public final class VariableMap {

    private static final VariableMap EMPTY = new VariableMap(Map.of());

    private final Map<String, Object> values;

    private VariableMap(Map<String, Object> values) {
        this.values = values;
    }

    public static VariableMap empty() {
        return EMPTY;
    }

    public static VariableMap of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new VariableMap(freeze(values));
    }

    /**
     * Unmodifiable insertion-ordered copy that, unlike {@link Map#copyOf}, tolerates null values.
     */
    public static Map<String, Object> freeze(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    // ========== Raw access ==========

    public Object get(String key) {
        return values.get(key);
    }

    public boolean containsKey(String key) {
        return values.get(key) != null;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    /**
     * Copy with the given entries merged over this map's entries.
     */
    public VariableMap merge(Map<String, ?> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(values);
        merged.putAll(overrides);
        return new VariableMap(Collections.unmodifiableMap(merged));
    }

    // ========== Typed access ==========

    public Optional<String> string(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof CharSequence text) {
            return Optional.of(text.toString());
        }
        throw new VariableTypeException(key, "string", value);
    }

    public Optional<Integer> integer(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return Optional.of(((Number) value).intValue());
        }
        if (value instanceof Long wide) {
            try {
                return Optional.of(Math.toIntExact(wide));
            } catch (ArithmeticException e) {
                throw new VariableTypeException(key, "integer", value + " is out of int range");
            }
        }
        if (value instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue())) {
            double whole = number.doubleValue();
            if (whole < Integer.MIN_VALUE || whole > Integer.MAX_VALUE) {
                throw new VariableTypeException(key, "integer", value + " is out of int range");
            }
            return Optional.of(number.intValue());
        }
        throw new VariableTypeException(key, "integer", value);
    }

    public Optional<Double> decimal(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Number number) {
            return Optional.of(number.doubleValue());
        }
        throw new VariableTypeException(key, "decimal", value);
    }

    public Optional<Boolean> bool(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Boolean flag) {
            return Optional.of(flag);
        }
        throw new VariableTypeException(key, "boolean", value);
    }

    public Optional<UUID> uuid(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        return Optional.of(toUuid(key, value));
    }

    public Optional<List<Object>> list(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        List<Object> elements;
        if (value instanceof Collection<?> collection) {
            elements = new ArrayList<>(collection);
        } else if (value instanceof Object[] array) {
            elements = new ArrayList<>(Arrays.asList(array));
        } else {
            throw new VariableTypeException(key, "list", value);
        }
        elements.removeIf(Objects::isNull);
        return Optional.of(Collections.unmodifiableList(elements));
    }

    public Optional<List<String>> stringList(String key) {
        return list(key).map(elements -> {
            List<String> strings = new ArrayList<>(elements.size());
            for (Object element : elements) {
                if (element instanceof CharSequence || element instanceof UUID) {
                    strings.add(element.toString());
                } else {
                    throw new VariableTypeException(key, "list of strings", element);
                }
            }
            return List.copyOf(strings);
        });
    }

    public Optional<List<UUID>> uuidList(String key) {
        return list(key).map(elements -> {
            List<UUID> ids = new ArrayList<>(elements.size());
            for (Object element : elements) {
                ids.add(toUuid(key, element));
            }
            return List.copyOf(ids);
        });
    }

    /**
     * Accepts a {@link Duration}, a duration string in ISO or compact form, or a number of seconds.
     */
    public Optional<Duration> duration(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Duration duration) {
            return Optional.of(duration);
        }
        if (value instanceof Number seconds) {
            return Optional.of(Duration.ofMillis(Math.round(seconds.doubleValue() * 1000)));
        }
        if (value instanceof CharSequence text) {
            try {
                return Optional.of(Durations.parse(text.toString()));
            } catch (IllegalArgumentException e) {
                throw new VariableTypeException(key, "duration", e.getMessage());
            }
        }
        throw new VariableTypeException(key, "duration", value);
    }

    private static UUID toUuid(String key, Object value) {
        if (value instanceof UUID id) {
            return id;
        }
        if (value instanceof CharSequence text) {
            try {
                return UUID.fromString(text.toString());
            } catch (IllegalArgumentException e) {
                throw new VariableTypeException(key, "uuid", "'" + text + "' is not a valid UUID");
            }
        }
        throw new VariableTypeException(key, "uuid", value);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof VariableMap that && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
