package org.gwflow.reparameterisations;

import org.gwflow.exceptions.GWFlowException.ConfigurationException;
import org.gwflow.utils.mcmc.ParameterDescriptor;

/**
 * Maps a distance with a power-law prior {@code p(d) ~ d^alpha} on {@code [a, b]} to its prior cumulative
 * distribution {@code u = (d^(alpha+1) - a^(alpha+1)) / (b^(alpha+1) - a^(alpha+1))}, which is uniform under the
 * prior.  The default {@code alpha = 2} corresponds to a prior uniform in Euclidean volume; {@code alpha = 0}
 * reduces to a linear rescaling.  Only the upper bound may reflect.
 */
public final class DistanceReparameterisation extends ReflectiveReparameterisation {
    public static final double DEFAULT_POWER = 2.;

    private final double power;
    private final double lowerTerm;
    private final double normalisation;

    public DistanceReparameterisation(final ParameterDescriptor descriptor, final double power,
                                      final Bound reflectiveBounds, final boolean detectEdges) {
        super(descriptor, reflectiveBounds, detectEdges, Bound.UPPER);
        if (!(descriptor.lower() >= 0.)) {
            throw new ConfigurationException("Distance " + descriptor.name() + " must have a non-negative lower bound.");
        }
        if (!(power > -1.)) {
            throw new ConfigurationException("Power-law exponent for " + descriptor.name() + " must be greater than -1: " + power);
        }
        this.power = power;
        this.lowerTerm = Math.pow(descriptor.lower(), power + 1.);
        this.normalisation = Math.pow(descriptor.upper(), power + 1.) - lowerTerm;
    }

    public DistanceReparameterisation(final ParameterDescriptor descriptor) {
        this(descriptor, DEFAULT_POWER, Bound.UPPER, true);
    }

    @Override
    protected ReflectiveReparameterisation withReflectiveBounds(final Bound bounds) {
        return new DistanceReparameterisation(descriptor, power, bounds, isDetectEdges());
    }

    @Override
    protected double toUnit(final double value) {
        return (Math.pow(value, power + 1.) - lowerTerm) / normalisation;
    }

    @Override
    protected double fromUnit(final double unitValue) {
        return Math.pow(unitValue * normalisation + lowerTerm, 1. / (power + 1.));
    }

    @Override
    protected double logUnitJacobian(final double value) {
        return Math.log(power + 1.) + power * Math.log(value) - Math.log(normalisation);
    }

    public double getPower() {
        return power;
    }
}
