package org.gwflow.reparameterisations;

import com.google.common.collect.ImmutableMap;
import org.apache.commons.math3.random.RandomGenerator;
import org.gwflow.exceptions.GWFlowException.ConfigurationException;
import org.gwflow.reparameterisations.AnglePairReparameterisation.Convention;
import org.gwflow.reparameterisations.ReflectiveReparameterisation.Bound;
import org.gwflow.utils.Utils;
import org.gwflow.utils.mcmc.ParameterDescriptor;
import org.gwflow.utils.param.ParamUtils;

import java.util.*;

/**
 * Maps string keys (e.g. {@code "distance"}, {@code "sky-ra-dec"}) to factories for the corresponding
 * reparameterisation together with its default options.  Keys are case-insensitive.
 */
public final class ReparameterisationRegistry {

    /**
     * A registered reparameterisation.
     */
    public static final class Entry {
        private final String key;
        private final int numParameters;
        private final boolean requiresBoundedPrior;
        private final Map<String, Object> defaults;
        private final ReparameterisationFactory factory;

        private Entry(final String key, final int numParameters, final boolean requiresBoundedPrior,
                      final Map<String, Object> defaults, final ReparameterisationFactory factory) {
            this.key = key;
            this.numParameters = numParameters;
            this.requiresBoundedPrior = requiresBoundedPrior;
            this.defaults = defaults;
            this.factory = factory;
        }

        public String getKey() {
            return key;
        }

        /**
         * Number of parameters consumed; 0 if the entry accepts any number.
         */
        public int getNumParameters() {
            return numParameters;
        }

        public boolean requiresBoundedPrior() {
            return requiresBoundedPrior;
        }

        /**
         * Default options baked into the factory, for reporting.
         */
        public Map<String, Object> getDefaults() {
            return defaults;
        }

        /**
         * @return true if this entry can consume the given descriptors
         */
        public boolean accepts(final List<ParameterDescriptor> descriptors) {
            return (numParameters == 0 || descriptors.size() == numParameters)
                    && (!requiresBoundedPrior || descriptors.stream().allMatch(ParameterDescriptor::hasFiniteBounds));
        }

        public Reparameterisation create(final List<ParameterDescriptor> descriptors, final RandomGenerator rng) {
            Utils.nonEmpty(descriptors, "List of descriptors cannot be null or empty.");
            if (numParameters != 0 && descriptors.size() != numParameters) {
                throw new ConfigurationException("Reparameterisation " + key + " consumes " + numParameters
                        + " parameter(s) but was given " + descriptors.size() + ".");
            }
            if (requiresBoundedPrior && !descriptors.stream().allMatch(ParameterDescriptor::hasFiniteBounds)) {
                throw new ConfigurationException("Reparameterisation " + key + " requires finite prior bounds: " + descriptors);
            }
            return factory.create(descriptors, rng);
        }

        @Override
        public String toString() {
            return key + defaults;
        }
    }

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    /**
     * Registers (or replaces) a factory under {@code key}.
     */
    public ReparameterisationRegistry register(final String key, final int numParameters, final boolean requiresBoundedPrior,
                                              final Map<String, Object> defaults, final ReparameterisationFactory factory) {
        Utils.nonEmpty(key, "Registry key cannot be null or empty.");
        ParamUtils.isPositiveOrZero(numParameters, "Number of parameters must be non-negative.");
        Utils.nonNull(defaults, "Map of default options cannot be null.");
        Utils.nonNull(factory, "Reparameterisation factory cannot be null.");
        entries.put(key.toLowerCase(Locale.ROOT),
                new Entry(key, numParameters, requiresBoundedPrior, Collections.unmodifiableMap(new LinkedHashMap<>(defaults)), factory));
        return this;
    }

    public Optional<Entry> lookup(final String key) {
        Utils.nonNull(key, "Registry key cannot be null.");
        return Optional.ofNullable(entries.get(key.toLowerCase(Locale.ROOT)));
    }

    /**
     * @throws ConfigurationException if no factory is registered under {@code key}
     */
    public Entry get(final String key) {
        return lookup(key).orElseThrow(() -> new ConfigurationException("Unknown reparameterisation: " + key
                + ". Known reparameterisations: " + entries.keySet()));
    }

    public Reparameterisation create(final String key, final List<ParameterDescriptor> descriptors, final RandomGenerator rng) {
        return get(key).create(descriptors, rng);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    /**
     * @return a new registry holding the general-purpose and gravitational-wave specific reparameterisations
     */
    public static ReparameterisationRegistry createDefault() {
        final ReparameterisationRegistry registry = new ReparameterisationRegistry();
        registry.register("identity", 1, false, Collections.emptyMap(),
                (d, rng) -> new IdentityReparameterisation(d.get(0)));
        registry.register("none", 1, false, Collections.emptyMap(),
                (d, rng) -> new IdentityReparameterisation(d.get(0)));
        registry.register("default", 1, true, Collections.emptyMap(),
                (d, rng) -> new RescaleToBoundsReparameterisation(d.get(0)));
        registry.register("rescale", 1, true, Collections.emptyMap(),
                (d, rng) -> new RescaleToBoundsReparameterisation(d.get(0)));
        registry.register("mass", 1, true, ImmutableMap.<String, Object>of("updateBounds", true),
                (d, rng) -> new RescaleToBoundsReparameterisation(d.get(0), false, true));
        registry.register("time", 1, true, ImmutableMap.<String, Object>of("offset", true, "updateBounds", true),
                (d, rng) -> new RescaleToBoundsReparameterisation(d.get(0), true, true));
        registry.register("logit", 1, true, Collections.emptyMap(),
                (d, rng) -> new LogitReparameterisation(d.get(0)));
        registry.register("reflective", 1, true, ImmutableMap.<String, Object>of("reflectiveBounds", Bound.BOTH),
                (d, rng) -> new ReflectiveReparameterisation(d.get(0), Bound.BOTH));
        registry.register("mass_ratio", 1, true, ImmutableMap.<String, Object>of("detectEdges", true, "allowedBounds", Bound.BOTH),
                (d, rng) -> new ReflectiveReparameterisation(d.get(0), Bound.NONE, true, Bound.BOTH));
        registry.register("periodic", 1, true, Collections.emptyMap(),
                (d, rng) -> new PeriodicReparameterisation(d.get(0)));
        registry.register("angle-2pi", 1, true, Collections.emptyMap(),
                (d, rng) -> new PeriodicReparameterisation(d.get(0)));
        registry.register("angle-pi", 1, true, Collections.emptyMap(),
                (d, rng) -> new PeriodicReparameterisation(d.get(0)));
        registry.register("angle-sine", 1, true, Collections.emptyMap(),
                (d, rng) -> new AngleSineReparameterisation(d.get(0)));
        registry.register("sky-ra-dec", 2, true, ImmutableMap.<String, Object>of("convention", Convention.RA_DEC),
                (d, rng) -> skyPair(d, Convention.RA_DEC));
        registry.register("sky-az-zen", 2, true, ImmutableMap.<String, Object>of("convention", Convention.AZ_ZEN),
                (d, rng) -> skyPair(d, Convention.AZ_ZEN));
        registry.register("distance", 1, true,
                ImmutableMap.<String, Object>of("power", DistanceReparameterisation.DEFAULT_POWER, "detectEdges", true, "allowedBounds", Bound.UPPER),
                (d, rng) -> new DistanceReparameterisation(d.get(0)));
        registry.register("delta_phase", 1, false, Collections.emptyMap(),
                (d, rng) -> new DeltaPhaseReparameterisation(d.get(0).name()));
        registry.register("delta-phase", 1, false, Collections.emptyMap(),
                (d, rng) -> new DeltaPhaseReparameterisation(d.get(0).name()));
        registry.register("lisa-extrinsic", 0, true, ImmutableMap.<String, Object>of("includeModeIndex", false),
                (d, rng) -> new LISAExtrinsicSymmetryReparameterisation.Builder(d, rng).build());
        return registry;
    }

    private static final Set<String> KNOWN_LONGITUDE_PARAMETERS = new HashSet<>(Arrays.asList("ra", "azimuth", "az"));

    /**
     * The longitude is whichever descriptor has a conventional longitude name, otherwise the first.
     */
    private static Reparameterisation skyPair(final List<ParameterDescriptor> descriptors, final Convention convention) {
        final boolean swapped = !KNOWN_LONGITUDE_PARAMETERS.contains(descriptors.get(0).name().toLowerCase(Locale.ROOT))
                && KNOWN_LONGITUDE_PARAMETERS.contains(descriptors.get(1).name().toLowerCase(Locale.ROOT));
        return swapped ?
                new AnglePairReparameterisation(descriptors.get(1), descriptors.get(0), convention) :
                new AnglePairReparameterisation(descriptors.get(0), descriptors.get(1), convention);
    }
}
