package org.gwflow.reparameterisations;

import org.gwflow.exceptions.GWFlowException.DomainException;
import org.gwflow.utils.MathUtils;
import org.gwflow.utils.Utils;
import org.gwflow.utils.mcmc.Point;

import java.util.*;

/**
 * Replaces the orbital phase with {@code delta_phase = phase + sign(cos(theta_jn)) * psi}, which removes the
 * leading phase/polarisation degeneracy.  The inverse is taken modulo 2 pi.  Reads the physical polarisation
 * and inclination without owning them; the Jacobian determinant is 1.
 */
public final class DeltaPhaseReparameterisation implements Reparameterisation {
    public static final String DEFAULT_PHASE = "phase";
    public static final String DEFAULT_PSI = "psi";
    public static final String DEFAULT_THETA_JN = "theta_jn";
    public static final String OUTPUT_NAME = "delta_phase";

    private final String phase;
    private final String psi;
    private final String thetaJn;

    public DeltaPhaseReparameterisation(final String phase, final String psi, final String thetaJn) {
        this.phase = Utils.nonEmpty(phase, "The phase parameter name cannot be null or empty.");
        this.psi = Utils.nonEmpty(psi, "The polarisation parameter name cannot be null or empty.");
        this.thetaJn = Utils.nonEmpty(thetaJn, "The inclination parameter name cannot be null or empty.");
        Utils.validateArg(new HashSet<>(Arrays.asList(phase, psi, thetaJn)).size() == 3,
                "Phase, polarisation and inclination must be distinct parameters.");
    }

    public DeltaPhaseReparameterisation(final String phase) {
        this(phase, DEFAULT_PSI, DEFAULT_THETA_JN);
    }

    public DeltaPhaseReparameterisation() {
        this(DEFAULT_PHASE);
    }

    @Override
    public List<String> getInputParameters() {
        return Collections.singletonList(phase);
    }

    @Override
    public List<String> getOutputParameters() {
        return Collections.singletonList(OUTPUT_NAME);
    }

    @Override
    public Set<String> getRequiredParameters() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(psi, thetaJn)));
    }

    @Override
    public TransformResult forward(final Point physical) {
        final double value = checkFinite(phase, physical.get(phase));
        final double deltaPhase = value + signedPolarisation(physical);
        return new TransformResult(Point.builder().put(OUTPUT_NAME, deltaPhase).build(), 0.);
    }

    @Override
    public TransformResult inverse(final Point transformed) {
        final double deltaPhase = checkFinite(OUTPUT_NAME, transformed.get(OUTPUT_NAME));
        final double value = MathUtils.wrap(deltaPhase - signedPolarisation(transformed), 0., MathUtils.TWO_PI);
        return new TransformResult(Point.builder().put(phase, value).build(), 0.);
    }

    private double signedPolarisation(final Point context) {
        return Math.signum(Math.cos(checkFinite(thetaJn, context.get(thetaJn)))) * checkFinite(psi, context.get(psi));
    }

    private static double checkFinite(final String name, final double value) {
        if (!Double.isFinite(value)) {
            throw new DomainException(name, value, "value is not finite");
        }
        return value;
    }

    @Override
    public String toString() {
        return "DeltaPhaseReparameterisation(" + phase + " -> " + OUTPUT_NAME + " | " + psi + ", " + thetaJn + ")";
    }
}
