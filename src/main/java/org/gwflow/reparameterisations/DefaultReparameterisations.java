package org.gwflow.reparameterisations;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.apache.commons.lang3.tuple.ImmutablePair;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.gwflow.exceptions.GWFlowException.ConfigurationException;
import org.gwflow.reparameterisations.ReflectiveReparameterisation.Bound;
import org.gwflow.utils.Utils;
import org.gwflow.utils.mcmc.ParameterDescriptor;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Chooses a reparameterisation for every physical parameter of a gravitational-wave analysis.
 *
 * <p>
 *     Well-known parameter names (matched case-insensitively) are mapped to a registry key and, for parameters
 *     that are transformed jointly, to the names of their partners.  Partners present among the parameters and
 *     not yet covered join the same reparameterisation.  Unrecognised parameters, and recognised parameters whose
 *     partners or prior bounds do not fit the catalog entry, fall back to a choice by topology.  Caller overrides
 *     replace the defaults for every parameter they consume.
 * </p>
 */
public final class DefaultReparameterisations {
    private static final Logger logger = LogManager.getLogger(DefaultReparameterisations.class);

    /**
     * Registry key and partner names for each well-known parameter.
     */
    public static final Map<String, Pair<String, List<String>>> ALIASES = ImmutableMap.<String, Pair<String, List<String>>>builder()
            .put("chirp_mass", alias("mass"))
            .put("mass_ratio", alias("mass_ratio"))
            .put("ra", alias("sky-ra-dec", "DEC", "dec", "Dec"))
            .put("dec", alias("sky-ra-dec", "RA", "ra"))
            .put("azimuth", alias("sky-az-zen", "zenith", "zen", "Zen", "Zenith"))
            .put("zenith", alias("sky-az-zen", "azimuth", "az", "Az", "Azimuth"))
            .put("theta_1", alias("angle-sine"))
            .put("theta_2", alias("angle-sine"))
            .put("tilt_1", alias("angle-sine"))
            .put("tilt_2", alias("angle-sine"))
            .put("theta_jn", alias("angle-sine"))
            .put("iota", alias("angle-sine"))
            .put("phi_jl", alias("angle-2pi"))
            .put("phi_12", alias("angle-2pi"))
            .put("phase", alias("angle-2pi"))
            .put("psi", alias("angle-pi"))
            .put("geocent_time", alias("time"))
            .put("time_jitter", alias("periodic"))
            .put("a_1", alias("default"))
            .put("a_2", alias("default"))
            .put("chi_1", alias("default"))
            .put("chi_2", alias("default"))
            .put("luminosity_distance", alias("distance"))
            .build();

    private DefaultReparameterisations() {}

    private static Pair<String, List<String>> alias(final String key, final String... partners) {
        return new ImmutablePair<>(key, ImmutableList.copyOf(partners));
    }

    /**
     * Builds the composite reparameterisation for {@code parameters}.
     *
     * @param parameters physical parameters, in order
     * @param overrides  parameter name to the reparameterisation that must consume it; one instance may be
     *                   listed under each of the parameters it consumes
     * @param registry   source of the catalog reparameterisations
     * @param rng        passed to factories of reparameterisations with a stochastic inverse
     * @throws ConfigurationException if an override does not consume the parameter it is listed under, a composite
     *                                parameter has no usable catalog entry, or the resulting composite is invalid
     */
    public static CompositeReparameterisation create(final List<ParameterDescriptor> parameters,
                                                     final Map<String, Reparameterisation> overrides,
                                                     final ReparameterisationRegistry registry,
                                                     final RandomGenerator rng) {
        Utils.nonEmpty(parameters, "List of parameters cannot be null or empty.");
        Utils.nonNull(overrides, "Map of overrides cannot be null.");
        Utils.nonNull(registry, "Reparameterisation registry cannot be null.");
        Utils.nonNull(rng, "Random generator cannot be null.");

        final Map<String, ParameterDescriptor> descriptors = new LinkedHashMap<>();
        parameters.forEach(d -> descriptors.put(d.name(), d));
        final List<Reparameterisation> members = new ArrayList<>();
        final Set<String> covered = new HashSet<>();

        for (final Map.Entry<String, Reparameterisation> override : overrides.entrySet()) {
            final Reparameterisation reparameterisation = Utils.nonNull(override.getValue(),
                    () -> "Override for " + override.getKey() + " cannot be null.");
            if (!reparameterisation.getInputParameters().contains(override.getKey())) {
                throw new ConfigurationException("Override " + reparameterisation + " is listed under " + override.getKey()
                        + " but does not consume it.");
            }
            if (members.stream().noneMatch(m -> m == reparameterisation)) {
                members.add(reparameterisation);
                covered.addAll(reparameterisation.getInputParameters());
                logger.info("Using override " + reparameterisation + " for " + reparameterisation.getInputParameters());
            }
        }

        for (final ParameterDescriptor descriptor : parameters) {
            if (covered.contains(descriptor.name())) {
                continue;
            }
            final Reparameterisation reparameterisation = chooseFromCatalog(descriptor, descriptors, covered, registry, rng)
                    .orElseGet(() -> chooseByTopology(descriptor));
            members.add(reparameterisation);
            covered.addAll(reparameterisation.getInputParameters());
        }
        return CompositeReparameterisation.ordered(parameters, members);
    }

    public static CompositeReparameterisation create(final List<ParameterDescriptor> parameters,
                                                     final Map<String, Reparameterisation> overrides,
                                                     final RandomGenerator rng) {
        return create(parameters, overrides, ReparameterisationRegistry.createDefault(), rng);
    }

    private static Optional<Reparameterisation> chooseFromCatalog(final ParameterDescriptor descriptor,
                                                                  final Map<String, ParameterDescriptor> descriptors,
                                                                  final Set<String> covered,
                                                                  final ReparameterisationRegistry registry,
                                                                  final RandomGenerator rng) {
        final Pair<String, List<String>> alias = ALIASES.get(descriptor.name().toLowerCase(Locale.ROOT));
        if (alias == null) {
            logger.debug(descriptor.name() + " is not a known gravitational-wave parameter");
            return Optional.empty();
        }
        final ReparameterisationRegistry.Entry entry = registry.get(alias.getLeft());
        final List<ParameterDescriptor> group = new ArrayList<>();
        group.add(descriptor);
        final Set<String> candidates = new LinkedHashSet<>(descriptor.partners());
        candidates.addAll(alias.getRight());
        candidates.stream()
                .filter(name -> descriptors.containsKey(name) && !covered.contains(name) && !name.equals(descriptor.name()))
                .map(descriptors::get)
                .forEach(group::add);
        final List<ParameterDescriptor> selected = entry.getNumParameters() == 0 || group.size() < entry.getNumParameters() ?
                group : group.subList(0, entry.getNumParameters());
        if (!entry.accepts(selected)) {
            logger.debug("Catalog entry " + entry.getKey() + " cannot be used for " + selected.stream()
                    .map(ParameterDescriptor::name).collect(Collectors.toList()) + "; falling back to its topology");
            return Optional.empty();
        }
        final Reparameterisation reparameterisation = entry.create(selected, rng);
        logger.info("Adding reparameterisation " + reparameterisation + " for " + reparameterisation.getInputParameters()
                + " with config: " + entry.getDefaults());
        return Optional.of(reparameterisation);
    }

    private static Reparameterisation chooseByTopology(final ParameterDescriptor descriptor) {
        final Reparameterisation reparameterisation;
        switch (descriptor.topology()) {
            case LINEAR:
                reparameterisation = new IdentityReparameterisation(descriptor);
                break;
            case BOUNDED:
                reparameterisation = new RescaleToBoundsReparameterisation(descriptor);
                break;
            case PERIODIC:
                reparameterisation = new PeriodicReparameterisation(descriptor);
                break;
            case REFLECTIVE:
                reparameterisation = new ReflectiveReparameterisation(descriptor, Bound.BOTH);
                break;
            case COMPOSITE:
                throw new ConfigurationException("Composite parameter " + descriptor.name() + " with partners "
                        + descriptor.partners() + " has no usable catalog entry; provide an override.");
            default:
                throw new ConfigurationException("Unknown topology " + descriptor.topology() + " for " + descriptor.name());
        }
        logger.info("Adding " + reparameterisation + " for " + descriptor.name() + " based on topology " + descriptor.topology());
        return reparameterisation;
    }
}
