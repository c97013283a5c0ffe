package org.gwflow.reparameterisations;

import org.apache.commons.math3.random.RandomGenerator;
import org.gwflow.utils.mcmc.ParameterDescriptor;

import java.util.List;

/**
 * Creates a {@link Reparameterisation} for the given physical parameters.
 */
@FunctionalInterface
public interface ReparameterisationFactory {

    /**
     * @param descriptors parameters to consume, primary parameter first
     * @param rng         source of randomness for reparameterisations whose inverse is stochastic
     */
    Reparameterisation create(final List<ParameterDescriptor> descriptors, final RandomGenerator rng);
}
