package org.gwflow.reparameterisations;

import com.google.common.collect.Sets;
import org.apache.commons.collections4.ListUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.gwflow.exceptions.GWFlowException.ConfigurationException;
import org.gwflow.utils.Utils;
import org.gwflow.utils.mcmc.ParameterDescriptor;
import org.gwflow.utils.mcmc.Point;

import java.util.*;
import java.util.stream.Collectors;

/**
 * An ordered chain of {@link Reparameterisation}s acting together as one bidirectional map over the full physical
 * parameter vector.
 *
 * <p>
 *     Construction checks that every physical parameter is consumed by exactly one member, that output names are
 *     unique and do not shadow physical parameters owned by other members, and that members which read parameters
 *     they do not own are sequenced so those values are available in both directions:
 * </p>
 * <ul>
 *     <li>a member reading another member's output must come after it;</li>
 *     <li>a member reading another member's physical input must come before it, so that the input has already
 *     been recovered when inverting in reverse order.</li>
 * </ul>
 *
 * <p>
 *     The forward map applies members in order, each seeing the physical point overlaid with the outputs produced
 *     so far.  The inverse applies members in reverse order, each seeing the transformed point overlaid with the
 *     physical values recovered so far.  Log-Jacobians add.  {@link #ordered} builds a composite from an unordered
 *     collection of members with a stable topological sort.
 * </p>
 */
public final class CompositeReparameterisation implements Reparameterisation {
    private static final Logger logger = LogManager.getLogger(CompositeReparameterisation.class);

    private final List<ParameterDescriptor> parameters;
    private final List<String> parameterNames;
    private final List<Reparameterisation> members;
    private final List<String> outputNames;

    /**
     * @param parameters physical parameters, in the order physical points are returned by {@link #inverse}
     * @param members    reparameterisations, in application order
     * @throws ConfigurationException if coverage or ordering is inconsistent
     */
    public CompositeReparameterisation(final List<ParameterDescriptor> parameters, final List<Reparameterisation> members) {
        Utils.nonEmpty(parameters, "List of parameters cannot be null or empty.");
        Utils.nonEmpty(members, "List of reparameterisations cannot be null or empty.");
        Utils.containsNoNull(parameters, "List of parameters cannot contain nulls.");
        Utils.containsNoNull(members, "List of reparameterisations cannot contain nulls.");
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.parameterNames = Collections.unmodifiableList(parameters.stream().map(ParameterDescriptor::name).collect(Collectors.toList()));
        if (new HashSet<>(parameterNames).size() != parameterNames.size()) {
            throw new ConfigurationException("Physical parameter names must be unique: " + parameterNames);
        }
        this.members = Collections.unmodifiableList(new ArrayList<>(members));
        final Map<String, Integer> owners = validateCoverage(parameterNames, this.members);
        final Map<String, Integer> producers = validateOutputs(owners, this.members);
        for (int i = 0; i < this.members.size(); i++) {
            for (final String required : this.members.get(i).getRequiredParameters()) {
                validateDependency(i, required, owners, producers, this.members);
            }
        }
        this.outputNames = Collections.unmodifiableList(this.members.stream()
                .map(Reparameterisation::getOutputParameters)
                .reduce(Collections.emptyList(), ListUtils::union));
    }

    /**
     * Orders {@code members} so that every dependency is satisfied, keeping the given order wherever the
     * dependencies leave a choice.
     * @throws ConfigurationException if the dependencies are cyclic or coverage is inconsistent
     */
    public static CompositeReparameterisation ordered(final List<ParameterDescriptor> parameters,
                                                      final List<Reparameterisation> members) {
        Utils.nonEmpty(members, "List of reparameterisations cannot be null or empty.");
        Utils.containsNoNull(members, "List of reparameterisations cannot contain nulls.");
        final Map<String, Integer> owners = new HashMap<>();
        final Map<String, Integer> producers = new HashMap<>();
        for (int i = 0; i < members.size(); i++) {
            final int index = i;
            members.get(i).getInputParameters().forEach(name -> owners.putIfAbsent(name, index));
            members.get(i).getOutputParameters().forEach(name -> producers.putIfAbsent(name, index));
        }

        //edges point from a member to the members that must follow it
        final List<Set<Integer>> successors = new ArrayList<>();
        final int[] numPredecessors = new int[members.size()];
        members.forEach(m -> successors.add(new TreeSet<>()));
        for (int i = 0; i < members.size(); i++) {
            for (final String required : members.get(i).getRequiredParameters()) {
                final Integer producer = producers.get(required);
                final Integer owner = owners.get(required);
                if (producer != null && producer != i && successors.get(producer).add(i)) {
                    numPredecessors[i]++;
                } else if (owner != null && owner != i && successors.get(i).add(owner)) {
                    numPredecessors[owner]++;
                }
            }
        }

        final PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < members.size(); i++) {
            if (numPredecessors[i] == 0) {
                ready.add(i);
            }
        }
        final List<Reparameterisation> sorted = new ArrayList<>(members.size());
        while (!ready.isEmpty()) {
            final int next = ready.poll();
            sorted.add(members.get(next));
            for (final int successor : successors.get(next)) {
                if (--numPredecessors[successor] == 0) {
                    ready.add(successor);
                }
            }
        }
        if (sorted.size() != members.size()) {
            final List<Reparameterisation> cyclic = new ArrayList<>(members);
            cyclic.removeAll(sorted);
            throw new ConfigurationException("Reparameterisations have cyclic dependencies: " + cyclic);
        }
        return new CompositeReparameterisation(parameters, sorted);
    }

    private static Map<String, Integer> validateCoverage(final List<String> parameterNames,
                                                         final List<Reparameterisation> members) {
        final Map<String, Integer> owners = new HashMap<>();
        for (int i = 0; i < members.size(); i++) {
            for (final String input : members.get(i).getInputParameters()) {
                if (!parameterNames.contains(input)) {
                    throw new ConfigurationException("Reparameterisation " + members.get(i) + " consumes unknown parameter " + input + ".");
                }
                final Integer previous = owners.put(input, i);
                if (previous != null) {
                    throw new ConfigurationException("Parameter " + input + " is consumed by both " + members.get(previous)
                            + " and " + members.get(i) + ".");
                }
            }
        }
        final Set<String> missing = Sets.difference(new LinkedHashSet<>(parameterNames), owners.keySet());
        if (!missing.isEmpty()) {
            throw new ConfigurationException("No reparameterisation consumes parameters " + missing + ".");
        }
        return owners;
    }

    private static Map<String, Integer> validateOutputs(final Map<String, Integer> owners,
                                                        final List<Reparameterisation> members) {
        final Map<String, Integer> producers = new HashMap<>();
        for (int i = 0; i < members.size(); i++) {
            for (final String output : members.get(i).getOutputParameters()) {
                final Integer previous = producers.put(output, i);
                if (previous != null) {
                    throw new ConfigurationException("Output " + output + " is produced by both " + members.get(previous)
                            + " and " + members.get(i) + ".");
                }
                final Integer owner = owners.get(output);
                if (owner != null && owner != i) {
                    throw new ConfigurationException("Output " + output + " of " + members.get(i)
                            + " shadows a physical parameter consumed by " + members.get(owner) + ".");
                }
            }
        }
        return producers;
    }

    private static void validateDependency(final int index, final String required, final Map<String, Integer> owners,
                                           final Map<String, Integer> producers, final List<Reparameterisation> members) {
        final Integer producer = producers.get(required);
        final Integer owner = owners.get(required);
        if (producer != null && producer != index) {
            if (producer > index) {
                throw new ConfigurationException(members.get(index) + " requires output " + required + " of "
                        + members.get(producer) + ", which must therefore come first.");
            }
        } else if (owner != null && owner != index) {
            if (owner < index) {
                throw new ConfigurationException(members.get(index) + " requires physical parameter " + required
                        + " consumed by " + members.get(owner) + ", which must therefore come later.");
            }
        } else if (owner == null) {
            throw new ConfigurationException(members.get(index) + " requires " + required
                    + ", which is neither a physical parameter nor an output of another reparameterisation.");
        }
    }

    @Override
    public List<String> getInputParameters() {
        return parameterNames;
    }

    @Override
    public List<String> getOutputParameters() {
        return outputNames;
    }

    public List<ParameterDescriptor> getParameters() {
        return parameters;
    }

    public List<Reparameterisation> getMembers() {
        return members;
    }

    @Override
    public TransformResult forward(final Point physical) {
        Utils.nonNull(physical, "Physical point cannot be null.");
        Point context = physical;
        final Point.Builder outputs = Point.builder();
        double logJacobian = 0.;
        for (final Reparameterisation member : members) {
            final TransformResult result = member.forward(context);
            outputs.putAll(result.getPoint());
            context = context.overlay(result.getPoint());
            logJacobian += result.getLogJacobian();
        }
        return new TransformResult(outputs.build(), logJacobian);
    }

    @Override
    public TransformResult inverse(final Point transformed) {
        Utils.nonNull(transformed, "Transformed point cannot be null.");
        Point context = transformed;
        Point recovered = Point.empty();
        double logJacobian = 0.;
        for (int i = members.size() - 1; i >= 0; i--) {
            final TransformResult result = members.get(i).inverse(context);
            recovered = recovered.overlay(result.getPoint());
            context = context.overlay(result.getPoint());
            logJacobian += result.getLogJacobian();
        }
        return new TransformResult(recovered.subset(parameterNames), logJacobian);
    }

    /**
     * Every combination of the members' preimages.
     */
    @Override
    public List<Point> preimages(final Point transformed) {
        Utils.nonNull(transformed, "Transformed point cannot be null.");
        List<Point> preimages = Collections.singletonList(transformed);
        for (final Reparameterisation member : members) {
            preimages = preimages.stream()
                    .flatMap(p -> member.preimages(p).stream())
                    .collect(Collectors.toList());
        }
        return preimages;
    }

    @Override
    public boolean isOneToOne() {
        return members.stream().allMatch(Reparameterisation::isOneToOne);
    }

    @Override
    public boolean isFitted() {
        return members.stream().anyMatch(Reparameterisation::isFitted);
    }

    /**
     * Returns a new composite in which fitted members are refitted to {@code livePoints}; other members are shared.
     * This composite is left untouched.
     */
    @Override
    public CompositeReparameterisation fit(final List<Point> livePoints) {
        Utils.nonNull(livePoints, "List of live points cannot be null.");
        if (!isFitted()) {
            return this;
        }
        final List<Reparameterisation> fitted = members.stream()
                .map(m -> m.isFitted() ? m.fit(livePoints) : m)
                .collect(Collectors.toList());
        logger.debug("Refitted " + fitted.stream().filter(Reparameterisation::isFitted).count()
                + " reparameterisations to " + livePoints.size() + " live points.");
        return new CompositeReparameterisation(parameters, fitted);
    }

    @Override
    public String toString() {
        return members.stream().map(Object::toString).collect(Collectors.joining(", ", "CompositeReparameterisation[", "]"));
    }
}
