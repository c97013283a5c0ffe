package org.gwflow.reparameterisations;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.gwflow.exceptions.GWFlowException.ConfigurationException;
import org.gwflow.exceptions.GWFlowException.DomainException;
import org.gwflow.utils.MathUtils;
import org.gwflow.utils.Utils;
import org.gwflow.utils.mcmc.ParameterDescriptor;
import org.gwflow.utils.mcmc.Point;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Jointly maps a longitude-like and a latitude-like angle (e.g. right ascension and declination) to the plane by
 * stereographic projection from the south pole: {@code rho = tan(pi/4 - delta/2)},
 * {@code (x, y) = rho (cos alpha, sin alpha)}, where {@code alpha} is the longitude scaled to [0, 2 pi) and
 * {@code delta} is the latitude.  The longitude wraps around without a discontinuity in the plane.
 *
 * <p>
 *     The log-Jacobian is the log |determinant| of the full 2x2 Jacobian matrix.  Both poles are excluded:
 *     the north pole has a vanishing Jacobian and the south pole maps to infinity.
 * </p>
 */
public final class AnglePairReparameterisation implements Reparameterisation {
    private static final double LATITUDE_TOLERANCE = 1E-8;

    /**
     * How the second angle measures latitude.
     */
    public enum Convention {
        /** latitude (declination) in [-pi/2, pi/2] */
        RA_DEC,
        /** zenith angle in [0, pi]; latitude = pi/2 - zenith */
        AZ_ZEN
    }

    private final ParameterDescriptor longitude;
    private final ParameterDescriptor latitude;
    private final Convention convention;
    private final double period;
    private final List<String> outputNames;

    public AnglePairReparameterisation(final ParameterDescriptor longitude, final ParameterDescriptor latitude,
                                       final Convention convention) {
        this.longitude = Utils.nonNull(longitude, "The longitude descriptor cannot be null.");
        this.latitude = Utils.nonNull(latitude, "The latitude descriptor cannot be null.");
        this.convention = Utils.nonNull(convention, "The angle convention cannot be null.");
        Utils.validateArg(!longitude.name().equals(latitude.name()), "Longitude and latitude must be distinct parameters.");
        if (!longitude.hasFiniteBounds() || !latitude.hasFiniteBounds()) {
            throw new ConfigurationException("Angle pair (" + longitude.name() + ", " + latitude.name() + ") requires finite prior bounds.");
        }
        final double latitudeMin = convention == Convention.RA_DEC ? -MathUtils.HALF_PI : 0.;
        final double latitudeMax = convention == Convention.RA_DEC ? MathUtils.HALF_PI : Math.PI;
        if (latitude.lower() < latitudeMin - LATITUDE_TOLERANCE || latitude.upper() > latitudeMax + LATITUDE_TOLERANCE) {
            throw new ConfigurationException("Prior bounds of " + latitude + " are incompatible with the " + convention + " convention.");
        }
        this.period = longitude.width();
        this.outputNames = Collections.unmodifiableList(Arrays.asList(
                longitude.name() + "_" + latitude.name() + "_x",
                longitude.name() + "_" + latitude.name() + "_y"));
    }

    @Override
    public List<String> getInputParameters() {
        return Collections.unmodifiableList(Arrays.asList(longitude.name(), latitude.name()));
    }

    @Override
    public List<String> getOutputParameters() {
        return outputNames;
    }

    @Override
    public TransformResult forward(final Point physical) {
        final double lon = physical.get(longitude.name());
        final double lat = physical.get(latitude.name());
        if (!(lon >= longitude.lower() && lon < longitude.upper())) {
            throw new DomainException(longitude.name(), lon, "value is outside the period [" + longitude.lower() + ", " + longitude.upper() + ")");
        }
        if (!(lat >= latitude.lower() && lat <= latitude.upper())) {
            throw new DomainException(latitude.name(), lat, "value is outside the prior bounds [" + latitude.lower() + ", " + latitude.upper() + "]");
        }
        final double delta = toLatitude(lat);
        if (Math.abs(delta) >= MathUtils.HALF_PI) {
            throw new DomainException(latitude.name(), lat, "value lies at a pole of the projection");
        }
        final double alpha = MathUtils.TWO_PI * (lon - longitude.lower()) / period;
        final double rho = Math.tan(0.25 * Math.PI - 0.5 * delta);
        final double logJacobian = checkLogJacobian(lat, logAbsDeterminant(alpha, rho));
        final Point transformed = Point.builder()
                .put(outputNames.get(0), rho * Math.cos(alpha))
                .put(outputNames.get(1), rho * Math.sin(alpha))
                .build();
        return new TransformResult(transformed, logJacobian);
    }

    @Override
    public TransformResult inverse(final Point transformed) {
        final double x = transformed.get(outputNames.get(0));
        final double y = transformed.get(outputNames.get(1));
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new DomainException(Double.isFinite(x) ? outputNames.get(1) : outputNames.get(0),
                    Double.isFinite(x) ? y : x, "value is not finite");
        }
        final double rho = Math.hypot(x, y);
        final double alpha = MathUtils.wrap(Math.atan2(y, x), 0., MathUtils.TWO_PI);
        final double delta = MathUtils.HALF_PI - 2. * Math.atan(rho);
        final double lat = convention == Convention.RA_DEC ? delta : MathUtils.HALF_PI - delta;
        if (!(lat >= latitude.lower() && lat <= latitude.upper())) {
            throw new DomainException(latitude.name(), lat, "value is outside the prior bounds [" + latitude.lower() + ", " + latitude.upper() + "]");
        }
        final double lon = MathUtils.wrap(longitude.lower() + alpha * period / MathUtils.TWO_PI, longitude.lower(), period);
        final double logJacobian = checkLogJacobian(lat, logAbsDeterminant(alpha, rho));
        return new TransformResult(Point.builder().put(longitude.name(), lon).put(latitude.name(), lat).build(), -logJacobian);
    }

    private double toLatitude(final double lat) {
        return convention == Convention.RA_DEC ? lat : MathUtils.HALF_PI - lat;
    }

    /**
     * Log |det| of d(x, y) / d(lon, lat) at the given projected polar coordinates.
     */
    private double logAbsDeterminant(final double alpha, final double rho) {
        final double dAlphaDLon = MathUtils.TWO_PI / period;
        final double dRhoDDelta = -0.5 * (1. + rho * rho);
        final double dRhoDLat = convention == Convention.RA_DEC ? dRhoDDelta : -dRhoDDelta;
        final RealMatrix jacobian = new Array2DRowRealMatrix(new double[][]{
                {-rho * Math.sin(alpha) * dAlphaDLon, Math.cos(alpha) * dRhoDLat},
                {rho * Math.cos(alpha) * dAlphaDLon, Math.sin(alpha) * dRhoDLat}});
        return Math.log(Math.abs(new LUDecomposition(jacobian).getDeterminant()));
    }

    private double checkLogJacobian(final double lat, final double logJacobian) {
        if (!Double.isFinite(logJacobian)) {
            throw new DomainException(latitude.name(), lat, "log-Jacobian is not finite at a pole");
        }
        return logJacobian;
    }

    public Convention getConvention() {
        return convention;
    }

    @Override
    public String toString() {
        return "AnglePairReparameterisation(" + longitude.name() + ", " + latitude.name() + ", " + convention + ")";
    }
}
