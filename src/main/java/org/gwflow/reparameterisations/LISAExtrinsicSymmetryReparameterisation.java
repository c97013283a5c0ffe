package org.gwflow.reparameterisations;

import com.google.common.collect.ImmutableSet;
import org.apache.commons.math3.distribution.EnumeratedIntegerDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.gwflow.exceptions.GWFlowException.ConfigurationException;
import org.gwflow.exceptions.GWFlowException.DomainException;
import org.gwflow.utils.MathUtils;
import org.gwflow.utils.Utils;
import org.gwflow.utils.mcmc.ParameterDescriptor;
import org.gwflow.utils.mcmc.Point;
import org.gwflow.utils.param.ParamUtils;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Folds the LISA extrinsic parameter space onto a single symmetry mode.
 *
 * <p>
 *     The ecliptic longitude is split into four quadrants and the ecliptic latitude into two hemispheres; when a
 *     phase parameter is present its range is also split in two, giving 8 or 16 modes.  The forward map moves
 *     every point into the mode with longitude in [0, pi/2), non-negative latitude and phase in [0, pi),
 *     transforming polarisation and inclination consistently.  Outputs are named {@code <name>_folded}.
 * </p>
 *
 * <p>
 *     With {@code includeModeIndex}, a discrete {@code mode_index} output is added and the map is one-to-one with
 *     unit Jacobian.  Otherwise the inverse draws a mode, uniformly or with weights estimated from live points by
 *     {@link #fit}, and the log-Jacobian of the inverse is {@code -log w_mode} (the forward map carries
 *     {@code +log w_mode}), so that densities account for the choice of mode.
 * </p>
 */
public final class LISAExtrinsicSymmetryReparameterisation implements Reparameterisation {
    private static final Logger logger = LogManager.getLogger(LISAExtrinsicSymmetryReparameterisation.class);

    public static final String MODE_INDEX = "mode_index";
    public static final String FOLDED_SUFFIX = "_folded";

    private static final double BOUNDS_TOLERANCE = 1E-8;
    private static final double QUARTER_TURN = MathUtils.HALF_PI;

    static final Set<String> KNOWN_LAMBDA_PARAMETERS = ImmutableSet.of("eclipticlongitude", "lambda");
    static final Set<String> KNOWN_BETA_PARAMETERS = ImmutableSet.of("eclipticlatitude", "beta");
    static final Set<String> KNOWN_PSI_PARAMETERS = ImmutableSet.of("polarization", "psi");
    static final Set<String> KNOWN_IOTA_PARAMETERS = ImmutableSet.of("iota", "inclination");
    static final Set<String> KNOWN_PHASE_PARAMETERS = ImmutableSet.of("phase", "coa_phase");

    private final String lambda;
    private final String beta;
    private final String psi;
    private final String iota;
    private final String phase;
    private final List<String> inputNames;
    private final List<String> outputNames;
    private final boolean includeModeIndex;
    private final boolean estimateModeWeights;
    private final double minimumModeWeight;
    private final double[] modeWeights;
    private final RandomGenerator rng;

    private LISAExtrinsicSymmetryReparameterisation(final Builder builder, final double[] modeWeights) {
        this.lambda = builder.lambda;
        this.beta = builder.beta;
        this.psi = builder.psi;
        this.iota = builder.iota;
        this.phase = builder.phase;
        this.inputNames = builder.inputNames;
        this.includeModeIndex = builder.includeModeIndex;
        this.estimateModeWeights = builder.estimateModeWeights;
        this.minimumModeWeight = builder.minimumModeWeight;
        this.rng = builder.rng;
        this.modeWeights = modeWeights;
        final List<String> outputs = inputNames.stream().map(n -> n + FOLDED_SUFFIX).collect(Collectors.toList());
        if (includeModeIndex) {
            outputs.add(MODE_INDEX);
        }
        this.outputNames = Collections.unmodifiableList(outputs);
    }

    /**
     * Identifies the longitude, latitude, polarisation, inclination and (optional) phase among a set of descriptors,
     * either by explicit name or by the conventional names used for LISA sources.
     */
    public static final class Builder {
        private final Map<String, ParameterDescriptor> descriptors = new LinkedHashMap<>();
        private final RandomGenerator rng;
        private String lambda;
        private String beta;
        private String psi;
        private String iota;
        private String phase;
        private boolean includeModeIndex = false;
        private boolean estimateModeWeights = false;
        private double minimumModeWeight = 0.;
        private List<String> inputNames;

        public Builder(final List<ParameterDescriptor> descriptors, final RandomGenerator rng) {
            Utils.nonEmpty(descriptors, "List of descriptors cannot be null or empty.");
            descriptors.forEach(d -> this.descriptors.put(Utils.nonNull(d).name(), d));
            Utils.validateArg(this.descriptors.size() == descriptors.size(), "Descriptors must have distinct names.");
            this.rng = Utils.nonNull(rng, "Random generator cannot be null.");
        }

        public Builder lambdaParameter(final String name) {
            this.lambda = name;
            return this;
        }

        public Builder betaParameter(final String name) {
            this.beta = name;
            return this;
        }

        public Builder psiParameter(final String name) {
            this.psi = name;
            return this;
        }

        public Builder iotaParameter(final String name) {
            this.iota = name;
            return this;
        }

        public Builder phaseParameter(final String name) {
            this.phase = name;
            return this;
        }

        public Builder includeModeIndex(final boolean includeModeIndex) {
            this.includeModeIndex = includeModeIndex;
            return this;
        }

        public Builder estimateModeWeights(final boolean estimateModeWeights) {
            this.estimateModeWeights = estimateModeWeights;
            return this;
        }

        public Builder minimumModeWeight(final double minimumModeWeight) {
            this.minimumModeWeight = ParamUtils.isPositiveOrZero(minimumModeWeight, "Minimum mode weight must be non-negative.");
            return this;
        }

        public LISAExtrinsicSymmetryReparameterisation build() {
            if (estimateModeWeights && includeModeIndex) {
                throw new ConfigurationException("Cannot estimate mode weights when the mode index is included.");
            }
            lambda = checkBounds(determineParameter(lambda, KNOWN_LAMBDA_PARAMETERS, true), 0., MathUtils.TWO_PI);
            beta = checkBounds(determineParameter(beta, KNOWN_BETA_PARAMETERS, true), -MathUtils.HALF_PI, MathUtils.HALF_PI);
            psi = checkBounds(determineParameter(psi, KNOWN_PSI_PARAMETERS, true), 0., Math.PI);
            iota = checkBounds(determineParameter(iota, KNOWN_IOTA_PARAMETERS, true), 0., Math.PI);
            phase = determineParameter(phase, KNOWN_PHASE_PARAMETERS, false);
            if (phase != null) {
                checkBounds(phase, 0., MathUtils.TWO_PI);
            }
            inputNames = new ArrayList<>(Arrays.asList(lambda, beta, psi, iota));
            if (phase != null) {
                inputNames.add(phase);
            }
            if (!descriptors.keySet().equals(new HashSet<>(inputNames))) {
                throw new ConfigurationException("LISA extrinsic symmetry consumes exactly " + inputNames
                        + " but was given " + descriptors.keySet() + ".");
            }
            inputNames = Collections.unmodifiableList(inputNames);
            final int numModes = phase == null ? 8 : 16;
            return new LISAExtrinsicSymmetryReparameterisation(this, uniformWeights(numModes));
        }

        private String determineParameter(final String explicit, final Set<String> known, final boolean required) {
            if (explicit != null) {
                if (!descriptors.containsKey(explicit)) {
                    throw new ConfigurationException("Parameter " + explicit + " is not among " + descriptors.keySet() + ".");
                }
                return explicit;
            }
            final List<String> matches = descriptors.keySet().stream().filter(known::contains).collect(Collectors.toList());
            if (matches.size() > 1) {
                throw new ConfigurationException("Multiple parameters match " + known + ": " + matches);
            }
            if (matches.isEmpty()) {
                if (required) {
                    throw new ConfigurationException("No parameter matches " + known + " among " + descriptors.keySet() + ".");
                }
                return null;
            }
            return matches.get(0);
        }

        private String checkBounds(final String name, final double lower, final double upper) {
            final ParameterDescriptor descriptor = descriptors.get(name);
            if (Math.abs(descriptor.lower() - lower) > BOUNDS_TOLERANCE || Math.abs(descriptor.upper() - upper) > BOUNDS_TOLERANCE) {
                throw new ConfigurationException("Prior bounds of " + name + " must be [" + lower + ", " + upper
                        + "] for the LISA extrinsic symmetry but are [" + descriptor.lower() + ", " + descriptor.upper() + "].");
            }
            return name;
        }
    }

    private static double[] uniformWeights(final int numModes) {
        final double[] weights = new double[numModes];
        Arrays.fill(weights, 1. / numModes);
        return weights;
    }

    public int getNumModes() {
        return phase == null ? 8 : 16;
    }

    /**
     * @return a copy of the current mode weights
     */
    public double[] getModeWeights() {
        return modeWeights.clone();
    }

    @Override
    public List<String> getInputParameters() {
        return inputNames;
    }

    @Override
    public List<String> getOutputParameters() {
        return outputNames;
    }

    @Override
    public boolean isOneToOne() {
        return includeModeIndex;
    }

    @Override
    public boolean isFitted() {
        return estimateModeWeights;
    }

    /**
     * Mode of a physical point: longitude quadrant, latitude hemisphere and phase half, packed into one index.
     */
    int determineMode(final Point physical) {
        final int longitudeBin = bin(physical.get(lambda), 0., QUARTER_TURN, 4);
        final int latitudeBin = physical.get(beta) >= 0. ? 1 : 0;
        final int phaseBin = phase == null ? 0 : bin(physical.get(phase), 0., Math.PI, 2);
        return longitudeBin + 4 * latitudeBin + 8 * phaseBin;
    }

    private static int bin(final double value, final double lower, final double width, final int numBins) {
        return Math.max(0, Math.min((int) Math.floor((value - lower) / width), numBins - 1));
    }

    @Override
    public TransformResult forward(final Point physical) {
        for (final String name : inputNames) {
            final double value = physical.get(name);
            if (!Double.isFinite(value)) {
                throw new DomainException(name, value, "value is not finite");
            }
        }
        checkRange(lambda, physical.get(lambda), 0., MathUtils.TWO_PI);
        checkRange(beta, physical.get(beta), -MathUtils.HALF_PI, MathUtils.HALF_PI);
        checkRange(psi, physical.get(psi), 0., Math.PI);
        checkRange(iota, physical.get(iota), 0., Math.PI);
        if (phase != null) {
            checkRange(phase, physical.get(phase), 0., MathUtils.TWO_PI);
        }

        final int mode = determineMode(physical);
        final int longitudeBin = mode % 4;
        final boolean northern = (mode % 8) / 4 == 1;

        final double lambdaFolded = MathUtils.wrap(physical.get(lambda) - longitudeBin * QUARTER_TURN, 0., MathUtils.TWO_PI);
        final double betaFolded = northern ? physical.get(beta) : -physical.get(beta);
        final double psiShifted = MathUtils.wrap(physical.get(psi) - longitudeBin * QUARTER_TURN, 0., Math.PI);
        final double psiFolded = northern ? psiShifted : Math.PI - psiShifted;
        final double iotaFolded = northern ? physical.get(iota) : Math.PI - physical.get(iota);

        final Point.Builder folded = Point.builder()
                .put(lambda + FOLDED_SUFFIX, lambdaFolded)
                .put(beta + FOLDED_SUFFIX, betaFolded)
                .put(psi + FOLDED_SUFFIX, psiFolded)
                .put(iota + FOLDED_SUFFIX, iotaFolded);
        if (phase != null) {
            folded.put(phase + FOLDED_SUFFIX, MathUtils.wrap(physical.get(phase), 0., Math.PI));
        }
        if (includeModeIndex) {
            folded.put(MODE_INDEX, mode);
            return new TransformResult(folded.build(), 0.);
        }
        if (!(modeWeights[mode] > 0.)) {
            throw new DomainException(lambda, physical.get(lambda), "point lies in mode " + mode + ", which has zero weight");
        }
        return new TransformResult(folded.build(), Math.log(modeWeights[mode]));
    }

    @Override
    public TransformResult inverse(final Point transformed) {
        final int mode;
        if (includeModeIndex) {
            final double index = transformed.get(MODE_INDEX);
            if (!(index == Math.rint(index) && index >= 0 && index < getNumModes())) {
                throw new DomainException(MODE_INDEX, index, "value is not a valid mode index");
            }
            mode = (int) index;
        } else {
            mode = sampleMode();
        }
        final int phaseBin = mode / 8;
        final int longitudeBin = (mode - 8 * phaseBin) % 4;
        final boolean northern = (mode - 8 * phaseBin) / 4 == 1;

        for (final String name : inputNames) {
            final double value = transformed.get(name + FOLDED_SUFFIX);
            if (!Double.isFinite(value)) {
                throw new DomainException(name + FOLDED_SUFFIX, value, "value is not finite");
            }
        }
        final double lambdaFolded = transformed.get(lambda + FOLDED_SUFFIX);
        final double betaFolded = transformed.get(beta + FOLDED_SUFFIX);
        final double psiFolded = transformed.get(psi + FOLDED_SUFFIX);
        final double iotaFolded = transformed.get(iota + FOLDED_SUFFIX);

        final double psiUnfolded = northern ? psiFolded : Math.PI - psiFolded;
        final Point.Builder physical = Point.builder()
                .put(lambda, MathUtils.wrap(lambdaFolded + longitudeBin * QUARTER_TURN, 0., MathUtils.TWO_PI))
                .put(beta, checkRange(beta, northern ? betaFolded : -betaFolded, -MathUtils.HALF_PI, MathUtils.HALF_PI))
                .put(psi, MathUtils.wrap(psiUnfolded + longitudeBin * QUARTER_TURN, 0., Math.PI))
                .put(iota, checkRange(iota, northern ? iotaFolded : Math.PI - iotaFolded, 0., Math.PI));
        if (phase != null) {
            physical.put(phase, checkRange(phase, transformed.get(phase + FOLDED_SUFFIX) + phaseBin * Math.PI, 0., MathUtils.TWO_PI));
        }
        return new TransformResult(physical.build(), includeModeIndex ? 0. : -Math.log(modeWeights[mode]));
    }

    private int sampleMode() {
        if (!estimateModeWeights) {
            return rng.nextInt(getNumModes());
        }
        final int[] modes = IntStream.range(0, getNumModes()).toArray();
        return new EnumeratedIntegerDistribution(rng, modes, modeWeights).sample();
    }

    private static double checkRange(final String name, final double value, final double lower, final double upper) {
        if (value < lower || value > upper) {
            throw new DomainException(name, value, "value is outside [" + lower + ", " + upper + "]");
        }
        return value;
    }

    /**
     * With {@code estimateModeWeights}, returns a copy whose mode weights are the fraction of live points in each
     * mode, floored at the minimum mode weight and renormalised.
     */
    @Override
    public Reparameterisation fit(final List<Point> livePoints) {
        Utils.nonNull(livePoints, "List of live points cannot be null.");
        if (!estimateModeWeights || livePoints.isEmpty()) {
            return this;
        }
        final double[] weights = new double[getNumModes()];
        livePoints.forEach(p -> weights[determineMode(p)] += 1.);
        double total = 0.;
        for (int i = 0; i < weights.length; i++) {
            weights[i] = Math.max(weights[i] / livePoints.size(), minimumModeWeight);
            total += weights[i];
        }
        for (int i = 0; i < weights.length; i++) {
            weights[i] /= total;
        }
        logger.debug("Estimated LISA mode weights: " + Arrays.toString(weights));
        return new LISAExtrinsicSymmetryReparameterisation(this, weights);
    }

    private LISAExtrinsicSymmetryReparameterisation(final LISAExtrinsicSymmetryReparameterisation other, final double[] modeWeights) {
        this.lambda = other.lambda;
        this.beta = other.beta;
        this.psi = other.psi;
        this.iota = other.iota;
        this.phase = other.phase;
        this.inputNames = other.inputNames;
        this.outputNames = other.outputNames;
        this.includeModeIndex = other.includeModeIndex;
        this.estimateModeWeights = other.estimateModeWeights;
        this.minimumModeWeight = other.minimumModeWeight;
        this.rng = other.rng;
        this.modeWeights = modeWeights;
    }

    @Override
    public String toString() {
        return "LISAExtrinsicSymmetryReparameterisation(" + inputNames + ", modes = " + getNumModes()
                + ", includeModeIndex = " + includeModeIndex + ")";
    }
}
