package org.gwflow.reparameterisations;

import org.gwflow.exceptions.GWFlowException.ConfigurationException;
import org.gwflow.exceptions.GWFlowException.DomainException;
import org.gwflow.utils.Utils;
import org.gwflow.utils.mcmc.ParameterDescriptor;
import org.gwflow.utils.mcmc.Point;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps a bounded parameter to the unit interval and folds transformed values that cross a reflective bound
 * back into range, so that the density model may place mass beyond a bound where the physical density is
 * largest.  Crossing a bound that is not reflective, or lying more than one reflection beyond a reflective
 * bound, is an error.  Each physical value therefore has one transformed image per reflective bound besides its
 * own, listed by {@link #preimages}.
 *
 * <p>
 *     With {@code detectEdges}, {@link #fit} histograms the live points (in unit coordinates) and enables
 *     reflection only at bounds whose edge bin holds at least the mean number of points per bin.  Bounds outside
 *     {@code allowedBounds} are never reflective.
 * </p>
 *
 * <p>Subclasses may replace the linear map to the unit interval by overriding {@link #toUnit},
 * {@link #fromUnit} and {@link #logUnitJacobian}.</p>
 */
public class ReflectiveReparameterisation extends ScalarReparameterisation {
    private static final Logger logger = LogManager.getLogger(ReflectiveReparameterisation.class);

    static final int EDGE_DETECTION_BINS = 10;

    /**
     * Which of the two bounds of a parameter a setting applies to.
     */
    public enum Bound {
        NONE(false, false),
        LOWER(true, false),
        UPPER(false, true),
        BOTH(true, true);

        private final boolean lower;
        private final boolean upper;

        Bound(final boolean lower, final boolean upper) {
            this.lower = lower;
            this.upper = upper;
        }

        public boolean includesLower() {
            return lower;
        }

        public boolean includesUpper() {
            return upper;
        }

        public static Bound of(final boolean lower, final boolean upper) {
            return lower ? (upper ? BOTH : LOWER) : (upper ? UPPER : NONE);
        }

        public Bound intersect(final Bound other) {
            return of(lower && other.lower, upper && other.upper);
        }
    }

    private final Bound reflectiveBounds;
    private final Bound allowedBounds;
    private final boolean detectEdges;

    /**
     * @param reflectiveBounds bounds reflective before any fit
     * @param detectEdges      whether {@link #fit} chooses the reflective bounds from the live points
     * @param allowedBounds    bounds that may ever be reflective
     */
    public ReflectiveReparameterisation(final ParameterDescriptor descriptor, final Bound reflectiveBounds,
                                        final boolean detectEdges, final Bound allowedBounds) {
        super(descriptor);
        if (!descriptor.hasFiniteBounds()) {
            throw new ConfigurationException("Reflective parameter " + descriptor.name() + " requires finite prior bounds.");
        }
        this.allowedBounds = Utils.nonNull(allowedBounds, "Allowed bounds cannot be null.");
        this.reflectiveBounds = Utils.nonNull(reflectiveBounds, "Reflective bounds cannot be null.").intersect(allowedBounds);
        this.detectEdges = detectEdges;
    }

    public ReflectiveReparameterisation(final ParameterDescriptor descriptor, final Bound reflectiveBounds) {
        this(descriptor, reflectiveBounds, false, Bound.BOTH);
    }

    /**
     * Returns a copy of this reparameterisation with different reflective bounds.  Subclasses with extra state
     * must override.
     */
    protected ReflectiveReparameterisation withReflectiveBounds(final Bound bounds) {
        return new ReflectiveReparameterisation(descriptor, bounds, detectEdges, allowedBounds);
    }

    protected double toUnit(final double value) {
        return (value - descriptor.lower()) / descriptor.width();
    }

    protected double fromUnit(final double unitValue) {
        return descriptor.lower() + unitValue * descriptor.width();
    }

    /**
     * Log |d toUnit / d value|.
     */
    protected double logUnitJacobian(final double value) {
        return -Math.log(descriptor.width());
    }

    @Override
    protected final double transform(final double value) {
        checkWithinBounds(value);
        return toUnit(value);
    }

    @Override
    protected final double inverseTransform(final double transformedValue) {
        return checkWithinBounds(fromUnit(fold(transformedValue)));
    }

    @Override
    protected final double logJacobian(final double value) {
        return logUnitJacobian(value);
    }

    /**
     * Folds a unit coordinate back into [0, 1] by a single reflection at a reflective bound.  Reflection is an
     * isometry, so it contributes nothing to the log-Jacobian.
     */
    double fold(final double unitValue) {
        if (unitValue >= 0. && unitValue <= 1.) {
            return unitValue;
        }
        if (unitValue < 0. && unitValue >= -1. && reflectiveBounds.includesLower()) {
            return -unitValue;
        }
        if (unitValue > 1. && unitValue <= 2. && reflectiveBounds.includesUpper()) {
            return 2. - unitValue;
        }
        throw new DomainException(getOutputName(), unitValue,
                "value is not within one reflection of a reflective bound (reflective bounds: " + reflectiveBounds + ")");
    }

    /**
     * The folded value followed by its mirror image across each reflective bound: {@code -u} at the lower bound
     * and {@code 2 - u} at the upper bound.
     */
    @Override
    public List<Point> preimages(final Point transformed) {
        final double folded = fold(transformed.get(getOutputName()));
        final List<Point> preimages = new ArrayList<>(3);
        preimages.add(transformed.with(getOutputName(), folded));
        if (reflectiveBounds.includesLower()) {
            preimages.add(transformed.with(getOutputName(), -folded));
        }
        if (reflectiveBounds.includesUpper()) {
            preimages.add(transformed.with(getOutputName(), 2. - folded));
        }
        return preimages;
    }

    public Bound getReflectiveBounds() {
        return reflectiveBounds;
    }

    public Bound getAllowedBounds() {
        return allowedBounds;
    }

    public boolean isDetectEdges() {
        return detectEdges;
    }

    @Override
    public boolean isFitted() {
        return detectEdges;
    }

    @Override
    public Reparameterisation fit(final List<Point> livePoints) {
        Utils.nonNull(livePoints, "List of live points cannot be null.");
        if (!detectEdges || livePoints.isEmpty()) {
            return this;
        }
        final int[] counts = new int[EDGE_DETECTION_BINS];
        for (final Point point : livePoints) {
            final double unitValue = toUnit(checkWithinBounds(point.get(getName())));
            counts[Math.min((int) (unitValue * EDGE_DETECTION_BINS), EDGE_DETECTION_BINS - 1)]++;
        }
        final double meanCount = (double) livePoints.size() / EDGE_DETECTION_BINS;
        final Bound detected = Bound.of(counts[0] >= meanCount, counts[EDGE_DETECTION_BINS - 1] >= meanCount)
                .intersect(allowedBounds);
        logger.debug("Detected reflective bounds " + detected + " for " + getName());
        return detected == reflectiveBounds ? this : withReflectiveBounds(detected);
    }
}
