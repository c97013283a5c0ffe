package org.gwflow.reparameterisations;

import org.apache.commons.math3.distribution.CauchyDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.gwflow.exceptions.GWFlowException.DomainException;
import org.gwflow.utils.mcmc.ParameterDescriptor;
import org.gwflow.utils.mcmc.Point;
import org.gwflow.utils.test.BaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class PeriodicReparameterisationUnitTest extends BaseTest {
    private static final ParameterDescriptor PSI = ParameterDescriptor.periodic("psi", 0., Math.PI);

    private static Point psi(final double value) {
        return Point.builder().put("psi", value).build();
    }

    /**
     * A uniform density on the angle must map to the density {@code 1 / (pi (1 + u^2))} of a standard Cauchy
     * distribution, i.e. {@code log p(theta) - log|J| = log p_cauchy(u)}.
     */
    @Test
    public void testUniformDensityMapsToCauchy() {
        final PeriodicReparameterisation reparameterisation = new PeriodicReparameterisation(PSI);
        final CauchyDistribution cauchy = new CauchyDistribution(0., 1.);
        final RandomGenerator rng = createRandomGenerator(3);
        for (final Point point : uniformPoints(Collections.singletonList(PSI), 500, 1E-4, rng)) {
            final TransformResult forward = reparameterisation.forward(point);
            final double u = forward.getPoint().get("psi_prime");
            assertEqualsDoubleSmart(-Math.log(PSI.width()) - forward.getLogJacobian(), Math.log(cauchy.density(u)));
        }
    }

    @Test(expectedExceptions = DomainException.class)
    public void testPoleIsExcluded() {
        new PeriodicReparameterisation(PSI).forward(psi(0.));
    }

    @Test(expectedExceptions = DomainException.class)
    public void testUpperBoundIsExcluded() {
        new PeriodicReparameterisation(PSI).forward(psi(Math.PI));
    }

    @DataProvider(name = "roundsOntoPole")
    public Object[][] roundsOntoPole() {
        return new Object[][]{{1E17}, {-1E17}, {1E300}, {-Double.MAX_VALUE}};
    }

    @Test(dataProvider = "roundsOntoPole", expectedExceptions = DomainException.class)
    public void testInverseRejectsValuesRoundingOntoPole(final double transformedValue) {
        new PeriodicReparameterisation(PSI).inverse(Point.builder().put("psi_prime", transformedValue).build());
    }

    @Test
    public void testMidpointMapsToZero() {
        final TransformResult forward = new PeriodicReparameterisation(PSI).forward(psi(0.5 * Math.PI));
        assertEqualsDoubleSmart(forward.getPoint().get("psi_prime"), 0.);
        assertEqualsDoubleSmart(forward.getLogJacobian(), Math.log(Math.PI / PSI.width()));
    }

    @Test
    public void testInverseWraps() {
        final Point recovered = new PeriodicReparameterisation(PSI).inverse(Point.builder().put("psi_prime", 1E6).build()).getPoint();
        Assert.assertTrue(recovered.get("psi") >= 0. && recovered.get("psi") < Math.PI);
    }

    @Test
    public void testFitPolePlacesPoleOppositeMean() {
        final PeriodicReparameterisation reparameterisation = new PeriodicReparameterisation(PSI, true);
        Assert.assertTrue(reparameterisation.isFitted());
        final List<Point> livePoints = new ArrayList<>();
        final RandomGenerator rng = createRandomGenerator(4);
        //points clustered around the original pole at 0 (= pi)
        for (int i = 0; i < 200; i++) {
            livePoints.add(psi((0.1 * (rng.nextDouble() - 0.5) + Math.PI) % Math.PI));
        }
        final PeriodicReparameterisation fitted = (PeriodicReparameterisation) reparameterisation.fit(livePoints);
        Assert.assertEquals(reparameterisation.getPole(), 0., 0.);
        Assert.assertEquals(fitted.getPole(), 0.5 * Math.PI, 0.05);
        //the cluster now maps near the origin of the real line
        Assert.assertTrue(Math.abs(fitted.forward(psi(0.01)).getPoint().get("psi_prime")) < 0.1);
        final Point physical = psi(1.);
        assertPointsEqual(fitted.inverse(fitted.forward(physical).getPoint()).getPoint(), physical);
    }
}
