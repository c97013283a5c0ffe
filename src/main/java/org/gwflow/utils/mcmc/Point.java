package org.gwflow.utils.mcmc;

import org.gwflow.utils.Utils;

import java.util.*;
import java.util.stream.Collectors;

/**
 * An ordered, name-keyed collection of parameter values representing one sample in either physical or transformed
 * space.  Values are addressed by name, never by position, so points in spaces with different parameter sets
 * cannot be silently misaligned.  Instances are immutable.
 */
public final class Point {
    private final Map<String, Double> parameterMap;

    private Point(final LinkedHashMap<String, Double> parameterMap) {
        this.parameterMap = Collections.unmodifiableMap(parameterMap);
    }

    /**
     * Constructs a point from a map of parameter names to values; iteration order of {@code values} is kept.
     */
    public static Point of(final Map<String, Double> values) {
        Utils.nonNull(values, "Map of parameter values cannot be null.");
        final LinkedHashMap<String, Double> copy = new LinkedHashMap<>();
        values.forEach((name, value) -> {
            Utils.nonNull(name, "The parameter name cannot be null.");
            Utils.nonNull(value, "The parameter value cannot be null.");
            copy.put(name, value);
        });
        return new Point(copy);
    }

    /**
     * Constructs a point from parallel lists of names and values.
     */
    public static Point fromArray(final List<String> names, final double[] values) {
        Utils.nonNull(names, "List of parameter names cannot be null.");
        Utils.nonNull(values, "Array of parameter values cannot be null.");
        Utils.validateArg(names.size() == values.length,
                () -> "Number of names (" + names.size() + ") and values (" + values.length + ") must be identical.");
        final Builder builder = builder();
        for (int i = 0; i < values.length; i++) {
            builder.put(names.get(i), values[i]);
        }
        return builder.build();
    }

    public static Point empty() {
        return new Point(new LinkedHashMap<>());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws IllegalArgumentException if the parameter is not present
     */
    public double get(final String parameterName) {
        final Double value = parameterMap.get(parameterName);
        if (value == null) {
            throw new IllegalArgumentException("Can only get pre-existing parameters; check parameter name " + parameterName + ".");
        }
        return value;
    }

    public boolean contains(final String parameterName) {
        return parameterMap.containsKey(parameterName);
    }

    /**
     * @return unmodifiable view of the parameter names, in order
     */
    public Set<String> names() {
        return parameterMap.keySet();
    }

    public int size() {
        return parameterMap.size();
    }

    /**
     * @return a new point holding only the named parameters, in the order given
     */
    public Point subset(final Collection<String> parameterNames) {
        final Builder builder = builder();
        parameterNames.forEach(name -> builder.put(name, get(name)));
        return builder.build();
    }

    /**
     * @return a new point holding every parameter except those named
     */
    public Point without(final Collection<String> parameterNames) {
        final Builder builder = builder();
        parameterMap.forEach((name, value) -> {
            if (!parameterNames.contains(name)) {
                builder.put(name, value);
            }
        });
        return builder.build();
    }

    /**
     * Union of two points with disjoint parameter names.
     * @throws IllegalArgumentException if a parameter name is present in both points
     */
    public Point merge(final Point other) {
        Utils.nonNull(other);
        final Builder builder = builder().putAll(this);
        other.parameterMap.forEach((name, value) -> {
            if (parameterMap.containsKey(name)) {
                throw new IllegalArgumentException("Cannot merge points that share parameter " + name + ".");
            }
            builder.put(name, value);
        });
        return builder.build();
    }

    /**
     * Union of two points in which values of {@code other} replace values of this point with the same name.
     */
    public Point overlay(final Point other) {
        Utils.nonNull(other);
        final LinkedHashMap<String, Double> combined = new LinkedHashMap<>(parameterMap);
        combined.putAll(other.parameterMap);
        return new Point(combined);
    }

    public Point with(final String parameterName, final double value) {
        final LinkedHashMap<String, Double> combined = new LinkedHashMap<>(parameterMap);
        combined.put(Utils.nonNull(parameterName, "The parameter name cannot be null."), value);
        return new Point(combined);
    }

    /**
     * @return the values of the named parameters, in the order given
     */
    public double[] toArray(final List<String> parameterNames) {
        return parameterNames.stream().mapToDouble(this::get).toArray();
    }

    /**
     * @return true if every value is finite
     */
    public boolean isFinite() {
        return parameterMap.values().stream().allMatch(Double::isFinite);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return parameterMap.equals(((Point) o).parameterMap);
    }

    @Override
    public int hashCode() {
        return parameterMap.hashCode();
    }

    @Override
    public String toString() {
        return parameterMap.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }

    public static final class Builder {
        private final LinkedHashMap<String, Double> parameterMap = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(final String parameterName, final double value) {
            Utils.nonNull(parameterName, "The parameter name cannot be null.");
            if (parameterMap.containsKey(parameterName)) {
                throw new IllegalArgumentException("Points cannot contain duplicate parameter names: " + parameterName + ".");
            }
            parameterMap.put(parameterName, value);
            return this;
        }

        public Builder putAll(final Point point) {
            point.parameterMap.forEach(this::put);
            return this;
        }

        public Point build() {
            return new Point(new LinkedHashMap<>(parameterMap));
        }
    }
}
