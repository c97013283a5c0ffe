package org.gwflow.reparameterisations;

import com.google.common.collect.ImmutableMap;
import org.apache.commons.math3.random.RandomGenerator;
import org.gwflow.exceptions.GWFlowException.ConfigurationException;
import org.gwflow.reparameterisations.ReflectiveReparameterisation.Bound;
import org.gwflow.utils.MathUtils;
import org.gwflow.utils.mcmc.ParameterDescriptor;
import org.gwflow.utils.mcmc.Point;
import org.gwflow.utils.test.BaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.*;

public final class DefaultReparameterisationsUnitTest extends BaseTest {
    private static final ParameterDescriptor RA = ParameterDescriptor.bounded("ra", 0., MathUtils.TWO_PI);
    private static final ParameterDescriptor DEC = ParameterDescriptor.bounded("dec", -MathUtils.HALF_PI, MathUtils.HALF_PI);
    private static final ParameterDescriptor DISTANCE = ParameterDescriptor.bounded("luminosity_distance", 100., 5000.);

    private static CompositeReparameterisation create(final List<ParameterDescriptor> parameters) {
        return DefaultReparameterisations.create(parameters, Collections.emptyMap(), createRandomGenerator(0));
    }

    private static Reparameterisation memberFor(final CompositeReparameterisation composite, final String name) {
        return composite.getMembers().stream()
                .filter(m -> m.getInputParameters().contains(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no member consumes " + name));
    }

    @Test
    public void testSkyAndDistance() {
        final Map<String, double[]> priorBounds = new LinkedHashMap<>();
        priorBounds.put("ra", new double[]{0., MathUtils.TWO_PI});
        priorBounds.put("dec", new double[]{-MathUtils.HALF_PI, MathUtils.HALF_PI});
        priorBounds.put("luminosity_distance", new double[]{100., 5000.});
        final List<ParameterDescriptor> parameters = ParameterDescriptor.fromPriorBounds(priorBounds);
        final CompositeReparameterisation composite = create(parameters);

        Assert.assertEquals(composite.getMembers().size(), 2);
        Assert.assertTrue(composite.getMembers().get(0) instanceof AnglePairReparameterisation);
        Assert.assertTrue(composite.getMembers().get(1) instanceof DistanceReparameterisation);
        Assert.assertEquals(composite.getOutputParameters(), Arrays.asList("ra_dec_x", "ra_dec_y", "luminosity_distance_prime"));

        for (final Point point : uniformPoints(parameters, 1000, 1E-3, createRandomGenerator(31))) {
            final TransformResult forward = composite.forward(point);
            Assert.assertTrue(forward.getPoint().isFinite());
            final TransformResult inverse = composite.inverse(forward.getPoint());
            assertPointsEqual(inverse.getPoint(), point);
            assertEqualsDoubleSmart(inverse.getLogJacobian(), -forward.getLogJacobian());
        }
    }

    @Test
    public void testSkyAndDistanceOverFullPrior() {
        final List<ParameterDescriptor> parameters = Arrays.asList(
                ParameterDescriptor.periodic("ra", 0., MathUtils.TWO_PI),
                ParameterDescriptor.bounded("dec", -MathUtils.HALF_PI, MathUtils.HALF_PI),
                ParameterDescriptor.bounded("luminosity_distance", 0., 1000.));
        final CompositeReparameterisation composite = create(parameters);
        Assert.assertEquals(composite.getOutputParameters(), Arrays.asList("ra_dec_x", "ra_dec_y", "luminosity_distance_prime"));

        //no margin: distances reach down towards the vanishing volume element at zero
        for (final Point point : uniformPoints(parameters, 1000, 0., createRandomGenerator(32))) {
            final TransformResult forward = composite.forward(point);
            Assert.assertTrue(forward.getPoint().isFinite(), "non-finite transform of " + point);
            Assert.assertTrue(Double.isFinite(forward.getLogJacobian()), "non-finite log-Jacobian at " + point);
            final TransformResult inverse = composite.inverse(forward.getPoint());
            assertPointsEqual(inverse.getPoint(), point);
            assertEqualsDoubleSmart(inverse.getLogJacobian(), -forward.getLogJacobian());
        }
    }

    @DataProvider(name = "catalog")
    public Object[][] catalog() {
        return new Object[][]{
                {ParameterDescriptor.bounded("chirp_mass", 10., 50.), RescaleToBoundsReparameterisation.class, true},
                {ParameterDescriptor.bounded("mass_ratio", 0.1, 1.), ReflectiveReparameterisation.class, true},
                {ParameterDescriptor.bounded("theta_jn", 0., Math.PI), AngleSineReparameterisation.class, false},
                {ParameterDescriptor.bounded("tilt_1", 0., Math.PI), AngleSineReparameterisation.class, false},
                {ParameterDescriptor.bounded("psi", 0., Math.PI), PeriodicReparameterisation.class, false},
                {ParameterDescriptor.bounded("phase", 0., MathUtils.TWO_PI), PeriodicReparameterisation.class, false},
                {ParameterDescriptor.bounded("geocent_time", 1126259462., 1126259463.), RescaleToBoundsReparameterisation.class, true},
                {ParameterDescriptor.bounded("a_1", 0., 0.99), RescaleToBoundsReparameterisation.class, false},
                {ParameterDescriptor.bounded("luminosity_distance", 100., 5000.), DistanceReparameterisation.class, true},
                {ParameterDescriptor.bounded("Chirp_Mass", 10., 50.), RescaleToBoundsReparameterisation.class, true},
                {ParameterDescriptor.linear("chirp_mass"), IdentityReparameterisation.class, false},
                {ParameterDescriptor.bounded("x", -1., 1.), RescaleToBoundsReparameterisation.class, false},
                {ParameterDescriptor.linear("x"), IdentityReparameterisation.class, false},
                {ParameterDescriptor.periodic("x", 0., 1.), PeriodicReparameterisation.class, false},
                {ParameterDescriptor.reflective("x", 0., 1.), ReflectiveReparameterisation.class, false},
        };
    }

    @Test(dataProvider = "catalog")
    public void testCatalogChoice(final ParameterDescriptor descriptor, final Class<?> expectedClass, final boolean fitted) {
        final CompositeReparameterisation composite = create(Collections.singletonList(descriptor));
        final Reparameterisation member = composite.getMembers().get(0);
        Assert.assertEquals(member.getClass(), expectedClass);
        Assert.assertEquals(member.isFitted(), fitted);
    }

    @Test
    public void testMassRatioReflectsOnlyAtDetectedEdges() {
        final ReflectiveReparameterisation massRatio = (ReflectiveReparameterisation)
                create(Collections.singletonList(ParameterDescriptor.bounded("mass_ratio", 0.1, 1.))).getMembers().get(0);
        Assert.assertEquals(massRatio.getReflectiveBounds(), Bound.NONE);
        Assert.assertTrue(massRatio.isDetectEdges());
        Assert.assertEquals(massRatio.getAllowedBounds(), Bound.BOTH);
    }

    @Test
    public void testSkyPairFoundFromEitherAngle() {
        final CompositeReparameterisation composite = create(Arrays.asList(DEC, DISTANCE, RA));
        final Reparameterisation sky = memberFor(composite, "dec");
        Assert.assertTrue(sky instanceof AnglePairReparameterisation);
        Assert.assertEquals(sky.getInputParameters(), Arrays.asList("ra", "dec"));
        Assert.assertSame(memberFor(composite, "ra"), sky);
    }

    @Test
    public void testPartnerNamesAreCaseInsensitive() {
        final ParameterDescriptor ra = ParameterDescriptor.bounded("RA", 0., MathUtils.TWO_PI);
        final ParameterDescriptor dec = ParameterDescriptor.bounded("DEC", -MathUtils.HALF_PI, MathUtils.HALF_PI);
        final CompositeReparameterisation composite = create(Arrays.asList(ra, dec));
        Assert.assertEquals(composite.getMembers().size(), 1);
        Assert.assertEquals(composite.getOutputParameters(), Arrays.asList("RA_DEC_x", "RA_DEC_y"));
    }

    @Test
    public void testDescriptorPartnersJoinCatalogEntry() {
        final ParameterDescriptor azimuth = ParameterDescriptor.composite("azimuth", 0., MathUtils.TWO_PI, "theta");
        final ParameterDescriptor theta = ParameterDescriptor.bounded("theta", 0., Math.PI);
        final CompositeReparameterisation composite = create(Arrays.asList(azimuth, theta));
        Assert.assertEquals(composite.getMembers().size(), 1);
        Assert.assertEquals(((AnglePairReparameterisation) composite.getMembers().get(0)).getConvention(),
                AnglePairReparameterisation.Convention.AZ_ZEN);
    }

    @Test
    public void testLonePairMemberFallsBackToTopology() {
        final CompositeReparameterisation composite = create(Arrays.asList(RA, DISTANCE));
        Assert.assertTrue(memberFor(composite, "ra") instanceof RescaleToBoundsReparameterisation);
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void testCompositeWithoutCatalogEntry() {
        create(Arrays.asList(ParameterDescriptor.composite("x", 0., 1., "y"), ParameterDescriptor.bounded("y", 0., 1.)));
    }

    @Test
    public void testOverrides() {
        final Reparameterisation distance = new RescaleToBoundsReparameterisation(DISTANCE);
        final Reparameterisation sky = new AnglePairReparameterisation(
                ParameterDescriptor.periodic("ra", 0., MathUtils.TWO_PI), DEC, AnglePairReparameterisation.Convention.RA_DEC);
        final Map<String, Reparameterisation> overrides = ImmutableMap.<String, Reparameterisation>of("luminosity_distance", distance, "ra", sky, "dec", sky);
        final CompositeReparameterisation composite = DefaultReparameterisations.create(Arrays.asList(RA, DEC, DISTANCE),
                overrides, createRandomGenerator(0));
        Assert.assertEquals(composite.getMembers().size(), 2);
        Assert.assertSame(memberFor(composite, "luminosity_distance"), distance);
        Assert.assertSame(memberFor(composite, "ra"), sky);
    }

    @Test
    public void testDeltaPhaseOverrideIsOrderedBeforeItsContext() {
        final List<ParameterDescriptor> parameters = Arrays.asList(
                ParameterDescriptor.periodic("phase", 0., MathUtils.TWO_PI),
                ParameterDescriptor.bounded("psi", 0., Math.PI),
                ParameterDescriptor.bounded("theta_jn", 0., Math.PI));
        final ReparameterisationRegistry registry = ReparameterisationRegistry.createDefault();
        final RandomGenerator rng = createRandomGenerator(0);
        final Reparameterisation deltaPhase = registry.create("delta_phase", parameters.subList(0, 1), rng);
        final CompositeReparameterisation composite = DefaultReparameterisations.create(parameters,
                ImmutableMap.<String, Reparameterisation>of("phase", deltaPhase), registry, rng);
        Assert.assertSame(composite.getMembers().get(0), deltaPhase);
        for (final Point point : uniformPoints(parameters, 100, 1E-3, createRandomGenerator(32))) {
            assertPointsEqual(composite.inverse(composite.forward(point).getPoint()).getPoint(), point);
        }
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void testOverrideListedUnderWrongName() {
        DefaultReparameterisations.create(Arrays.asList(RA, DEC, DISTANCE),
                ImmutableMap.<String, Reparameterisation>of("ra", new RescaleToBoundsReparameterisation(DISTANCE)), createRandomGenerator(0));
    }

    @Test
    public void testAliasTable() {
        Assert.assertEquals(DefaultReparameterisations.ALIASES.get("luminosity_distance").getLeft(), "distance");
        Assert.assertTrue(DefaultReparameterisations.ALIASES.get("ra").getRight().contains("dec"));
        final ReparameterisationRegistry registry = ReparameterisationRegistry.createDefault();
        DefaultReparameterisations.ALIASES.values().forEach(alias -> Assert.assertTrue(registry.lookup(alias.getLeft()).isPresent(), alias.getLeft()));
    }
}
