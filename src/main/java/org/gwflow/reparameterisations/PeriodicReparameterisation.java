package org.gwflow.reparameterisations;

import org.gwflow.exceptions.GWFlowException.ConfigurationException;
import org.gwflow.exceptions.GWFlowException.DomainException;
import org.gwflow.utils.MathUtils;
import org.gwflow.utils.Utils;
import org.gwflow.utils.mcmc.ParameterDescriptor;
import org.gwflow.utils.mcmc.Point;

import java.util.List;

/**
 * Maps a periodic parameter on {@code [lower, upper)} to the real line so that the wrap-around point (the pole)
 * maps to infinity and no density discontinuity is seen in the transformed space.
 *
 * <p>
 *     With period {@code P = upper - lower} and fractional position {@code phi = ((theta - pole) mod P) / P},
 *     the transformed value is {@code u = tan(pi (phi - 1/2))} and
 *     {@code log|du/dtheta| = log(pi / P) + log(1 + u^2)}.  The pole itself is excluded from the domain.
 * </p>
 *
 * <p>
 *     With {@code fitPole}, {@link #fit} moves the pole to the point opposite the circular mean of the live points,
 *     so that the bulk of the distribution sits far from the singularity.
 * </p>
 */
public final class PeriodicReparameterisation extends ScalarReparameterisation {
    private final double period;
    private final double pole;
    private final boolean fitPole;

    public PeriodicReparameterisation(final ParameterDescriptor descriptor, final boolean fitPole) {
        this(descriptor, fitPole, descriptor.lower());
    }

    public PeriodicReparameterisation(final ParameterDescriptor descriptor) {
        this(descriptor, false);
    }

    private PeriodicReparameterisation(final ParameterDescriptor descriptor, final boolean fitPole, final double pole) {
        super(descriptor);
        if (!descriptor.hasFiniteBounds()) {
            throw new ConfigurationException("Periodic parameter " + descriptor.name() + " requires finite bounds.");
        }
        this.period = descriptor.width();
        this.fitPole = fitPole;
        this.pole = pole;
    }

    @Override
    protected double transform(final double value) {
        if (value < descriptor.lower() || value >= descriptor.upper()) {
            throw new DomainException(descriptor.name(), value,
                    "value is outside the period [" + descriptor.lower() + ", " + descriptor.upper() + ")");
        }
        final double phi = fractionalPosition(value);
        if (phi == 0.) {
            throw new DomainException(descriptor.name(), value, "value coincides with the pole of the periodic map");
        }
        return Math.tan(Math.PI * (phi - 0.5));
    }

    @Override
    protected double inverseTransform(final double transformedValue) {
        if (Double.isInfinite(transformedValue)) {
            throw new DomainException(getOutputName(), transformedValue, "transformed value maps to the pole");
        }
        final double phi = Math.atan(transformedValue) / Math.PI + 0.5;
        final double value = MathUtils.wrap(pole + phi * period, descriptor.lower(), period);
        //large |u| rounds onto the pole itself
        if (phi == 0. || phi == 1. || fractionalPosition(value) == 0.) {
            throw new DomainException(getOutputName(), transformedValue, "transformed value maps to the pole");
        }
        return value;
    }

    @Override
    protected double logJacobian(final double value) {
        final double u = Math.tan(Math.PI * (fractionalPosition(value) - 0.5));
        return Math.log(Math.PI / period) + Math.log1p(u * u);
    }

    private double fractionalPosition(final double value) {
        return (MathUtils.wrap(value - pole, 0., period)) / period;
    }

    public double getPole() {
        return pole;
    }

    @Override
    public boolean isFitted() {
        return fitPole;
    }

    @Override
    public Reparameterisation fit(final List<Point> livePoints) {
        Utils.nonNull(livePoints, "List of live points cannot be null.");
        if (!fitPole || livePoints.isEmpty()) {
            return this;
        }
        double sumSin = 0.;
        double sumCos = 0.;
        for (final Point point : livePoints) {
            final double angle = MathUtils.TWO_PI * (point.get(getName()) - descriptor.lower()) / period;
            sumSin += Math.sin(angle);
            sumCos += Math.cos(angle);
        }
        if (sumSin == 0. && sumCos == 0.) {
            return this;
        }
        final double meanAngle = Math.atan2(sumSin, sumCos);
        final double mean = descriptor.lower() + meanAngle * period / MathUtils.TWO_PI;
        return new PeriodicReparameterisation(descriptor, true, MathUtils.wrap(mean + 0.5 * period, descriptor.lower(), period));
    }
}
