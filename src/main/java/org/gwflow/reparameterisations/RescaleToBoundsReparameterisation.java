package org.gwflow.reparameterisations;

import org.gwflow.exceptions.GWFlowException.ConfigurationException;
import org.gwflow.exceptions.GWFlowException.DomainException;
import org.gwflow.utils.Utils;
import org.gwflow.utils.mcmc.ParameterDescriptor;
import org.gwflow.utils.mcmc.Point;

import java.util.List;

/**
 * Linearly rescales a bounded parameter so that its scaling bounds map to [-1, 1].
 *
 * <p>
 *     With {@code offset}, the midpoint of the prior is subtracted before scaling, which keeps precision for
 *     parameters with large absolute values and small ranges (e.g. GPS times).  With {@code updateBounds}, the
 *     scaling bounds are refitted to the minimum and maximum of the live points on every {@link #fit}; the prior
 *     bounds remain the valid domain in both directions.
 * </p>
 */
public final class RescaleToBoundsReparameterisation extends ScalarReparameterisation {
    private final boolean offset;
    private final boolean updateBounds;
    private final double shift;
    private final double scaleLower;
    private final double scaleUpper;

    public RescaleToBoundsReparameterisation(final ParameterDescriptor descriptor, final boolean offset,
                                             final boolean updateBounds) {
        this(descriptor, offset, updateBounds, descriptor.lower(), descriptor.upper());
    }

    public RescaleToBoundsReparameterisation(final ParameterDescriptor descriptor) {
        this(descriptor, false, false);
    }

    private RescaleToBoundsReparameterisation(final ParameterDescriptor descriptor, final boolean offset,
                                              final boolean updateBounds, final double scaleLower,
                                              final double scaleUpper) {
        super(descriptor);
        if (!descriptor.hasFiniteBounds()) {
            throw new ConfigurationException("Cannot rescale parameter " + descriptor.name() + " without finite prior bounds.");
        }
        Utils.validateArg(scaleLower < scaleUpper, "Scaling bounds must satisfy lower < upper.");
        this.offset = offset;
        this.updateBounds = updateBounds;
        this.shift = offset ? 0.5 * (descriptor.lower() + descriptor.upper()) : 0.;
        this.scaleLower = scaleLower - shift;
        this.scaleUpper = scaleUpper - shift;
    }

    @Override
    protected double transform(final double value) {
        checkWithinBounds(value);
        return 2. * ((value - shift) - scaleLower) / (scaleUpper - scaleLower) - 1.;
    }

    @Override
    protected double inverseTransform(final double transformedValue) {
        final double value = scaleLower + 0.5 * (transformedValue + 1.) * (scaleUpper - scaleLower) + shift;
        if (value < descriptor.lower() || value > descriptor.upper()) {
            throw new DomainException(descriptor.name(), value, "rescaled value maps outside the prior bounds");
        }
        return value;
    }

    @Override
    protected double logJacobian(final double value) {
        return Math.log(2.) - Math.log(scaleUpper - scaleLower);
    }

    @Override
    public boolean isFitted() {
        return updateBounds;
    }

    @Override
    public Reparameterisation fit(final List<Point> livePoints) {
        Utils.nonNull(livePoints, "List of live points cannot be null.");
        if (!updateBounds || livePoints.size() < 2) {
            return this;
        }
        final double min = livePoints.stream().mapToDouble(p -> p.get(getName())).min().getAsDouble();
        final double max = livePoints.stream().mapToDouble(p -> p.get(getName())).max().getAsDouble();
        if (!(min < max)) {
            return this;
        }
        return new RescaleToBoundsReparameterisation(descriptor, offset, true, min, max);
    }

    /**
     * @return the current scaling bounds in physical units
     */
    public double[] getScalingBounds() {
        return new double[]{scaleLower + shift, scaleUpper + shift};
    }
}
