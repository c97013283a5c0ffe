package org.gwflow.proposals;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.gwflow.utils.MathUtils;
import org.gwflow.utils.mcmc.Point;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Independent Gaussian in every transformed dimension; a standard normal until fitted.  Stands in for a
 * normalising flow in tests.
 */
final class GaussianBaseProposal implements BaseProposal {
    private final RandomGenerator rng;
    private final boolean trainable;
    private List<String> names;
    private double[] means;
    private double[] standardDeviations;
    private List<Point> lastTrainingPoints = null;
    private int numSampleCalls = 0;

    GaussianBaseProposal(final List<String> names, final RandomGenerator rng, final boolean trainable) {
        this.names = new ArrayList<>(names);
        this.rng = rng;
        this.trainable = trainable;
        this.means = new double[names.size()];
        this.standardDeviations = new double[names.size()];
        Arrays.fill(standardDeviations, 1.);
    }

    GaussianBaseProposal(final List<String> names, final RandomGenerator rng) {
        this(names, rng, true);
    }

    @Override
    public List<Point> sampleTransformed(final int n) {
        numSampleCalls++;
        final List<Point> samples = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            final double[] values = new double[names.size()];
            for (int j = 0; j < values.length; j++) {
                values[j] = means[j] + standardDeviations[j] * rng.nextGaussian();
            }
            samples.add(Point.fromArray(names, values));
        }
        return samples;
    }

    @Override
    public double logProbTransformed(final Point point) {
        final double[] standardised = new double[names.size()];
        double logNormalisation = 0.;
        for (int j = 0; j < standardised.length; j++) {
            standardised[j] = (point.get(names.get(j)) - means[j]) / standardDeviations[j];
            logNormalisation += Math.log(standardDeviations[j]);
        }
        return MathUtils.standardNormalLogDensity(standardised) - logNormalisation;
    }

    @Override
    public void fit(final List<Point> points) {
        lastTrainingPoints = new ArrayList<>(points);
        if (!trainable) {
            return;
        }
        names = new ArrayList<>(points.get(0).names());
        means = new double[names.size()];
        standardDeviations = new double[names.size()];
        for (int j = 0; j < names.size(); j++) {
            final String name = names.get(j);
            final double[] values = points.stream().mapToDouble(p -> p.get(name)).toArray();
            means[j] = new Mean().evaluate(values);
            standardDeviations[j] = new StandardDeviation().evaluate(values);
        }
    }

    List<Point> getLastTrainingPoints() {
        return lastTrainingPoints;
    }

    int getNumSampleCalls() {
        return numSampleCalls;
    }
}
