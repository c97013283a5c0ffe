package org.gwflow.utils.mcmc;

import org.gwflow.utils.Utils;

import java.util.*;

/**
 * Static metadata for one physical parameter: its name, prior bounds and boundary topology.
 * Missing bounds are represented by infinities.  Instances are immutable.
 */
public final class ParameterDescriptor {

    /**
     * Describes how a parameter behaves at (and across) its bounds.
     */
    public enum Topology {
        /** unbounded real line */
        LINEAR,
        /** hard bounds; values outside are invalid */
        BOUNDED,
        /** wraps around; the upper bound is identified with the lower bound */
        PERIODIC,
        /** values crossing a bound are reflected back into range */
        REFLECTIVE,
        /** must be transformed jointly with named partner parameters */
        COMPOSITE
    }

    private final String name;
    private final double lower;
    private final double upper;
    private final Topology topology;
    private final List<String> partners;

    public ParameterDescriptor(final String name, final double lower, final double upper, final Topology topology,
                               final List<String> partners) {
        this.name = Utils.nonEmpty(name, "The parameter name cannot be null or empty.");
        this.topology = Utils.nonNull(topology, "The parameter topology cannot be null.");
        this.partners = Collections.unmodifiableList(new ArrayList<>(Utils.nonNull(partners, "List of partners cannot be null.")));
        Utils.validateArg(!Double.isNaN(lower) && !Double.isNaN(upper), "Bounds of " + name + " cannot be NaN.");
        Utils.validateArg(lower < upper, () -> "Lower bound of " + name + " must be strictly less than upper bound: [" + lower + ", " + upper + "].");
        if (topology == Topology.BOUNDED || topology == Topology.PERIODIC || topology == Topology.REFLECTIVE) {
            Utils.validateArg(Double.isFinite(lower) && Double.isFinite(upper),
                    () -> "Parameter " + name + " with topology " + topology + " requires finite bounds.");
        }
        Utils.validateArg(topology != Topology.COMPOSITE || !this.partners.isEmpty(),
                () -> "Composite parameter " + name + " must name at least one partner.");
        Utils.validateArg(!this.partners.contains(name), () -> "Parameter " + name + " cannot be its own partner.");
        this.lower = lower;
        this.upper = upper;
    }

    public ParameterDescriptor(final String name, final double lower, final double upper, final Topology topology) {
        this(name, lower, upper, topology, Collections.emptyList());
    }

    public static ParameterDescriptor linear(final String name) {
        return new ParameterDescriptor(name, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, Topology.LINEAR);
    }

    public static ParameterDescriptor bounded(final String name, final double lower, final double upper) {
        return new ParameterDescriptor(name, lower, upper, Topology.BOUNDED);
    }

    public static ParameterDescriptor periodic(final String name, final double lower, final double upper) {
        return new ParameterDescriptor(name, lower, upper, Topology.PERIODIC);
    }

    public static ParameterDescriptor reflective(final String name, final double lower, final double upper) {
        return new ParameterDescriptor(name, lower, upper, Topology.REFLECTIVE);
    }

    public static ParameterDescriptor composite(final String name, final double lower, final double upper,
                                                final String... partners) {
        return new ParameterDescriptor(name, lower, upper, Topology.COMPOSITE, Arrays.asList(partners));
    }

    /**
     * Builds descriptors from a prior-bounds lookup (name to {lower, upper}).  Parameters with two finite bounds
     * are {@link Topology#BOUNDED}, all others {@link Topology#LINEAR}.  Iteration order of {@code priorBounds} is kept.
     */
    public static List<ParameterDescriptor> fromPriorBounds(final Map<String, double[]> priorBounds) {
        Utils.nonNull(priorBounds, "Map of prior bounds cannot be null.");
        final List<ParameterDescriptor> descriptors = new ArrayList<>(priorBounds.size());
        priorBounds.forEach((name, bounds) -> {
            Utils.validateArg(bounds != null && bounds.length == 2, () -> "Prior bounds for " + name + " must have two elements.");
            final Topology topology = Double.isFinite(bounds[0]) && Double.isFinite(bounds[1]) ? Topology.BOUNDED : Topology.LINEAR;
            descriptors.add(new ParameterDescriptor(name, bounds[0], bounds[1], topology));
        });
        return descriptors;
    }

    public String name() {
        return name;
    }

    public double lower() {
        return lower;
    }

    public double upper() {
        return upper;
    }

    public Topology topology() {
        return topology;
    }

    public List<String> partners() {
        return partners;
    }

    public boolean hasFiniteBounds() {
        return Double.isFinite(lower) && Double.isFinite(upper);
    }

    public double width() {
        return upper - lower;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final ParameterDescriptor that = (ParameterDescriptor) o;
        return Double.compare(that.lower, lower) == 0 && Double.compare(that.upper, upper) == 0
                && name.equals(that.name) && topology == that.topology && partners.equals(that.partners);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, lower, upper, topology, partners);
    }

    @Override
    public String toString() {
        return name + " " + topology + " [" + lower + ", " + upper + "]";
    }
}
