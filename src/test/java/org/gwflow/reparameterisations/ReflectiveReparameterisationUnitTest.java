package org.gwflow.reparameterisations;

import org.gwflow.exceptions.GWFlowException.DomainException;
import org.gwflow.reparameterisations.ReflectiveReparameterisation.Bound;
import org.gwflow.utils.mcmc.ParameterDescriptor;
import org.gwflow.utils.mcmc.Point;
import org.gwflow.utils.test.BaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class ReflectiveReparameterisationUnitTest extends BaseTest {
    private static final ParameterDescriptor Q = ParameterDescriptor.reflective("q", 0., 2.);

    private static Point prime(final double value) {
        return Point.builder().put("q_prime", value).build();
    }

    @DataProvider(name = "folding")
    public Object[][] folding() {
        return new Object[][]{
                {Bound.BOTH, 0.25, 0.5},
                {Bound.BOTH, -0.25, 0.5},
                {Bound.BOTH, 1.25, 1.5},
                {Bound.BOTH, 2., 0.},
                {Bound.BOTH, -1., 2.},
                {Bound.LOWER, -0.25, 0.5},
                {Bound.UPPER, 1.25, 1.5},
        };
    }

    @Test(dataProvider = "folding")
    public void testFolding(final Bound bound, final double unitValue, final double expected) {
        final ReflectiveReparameterisation reparameterisation = new ReflectiveReparameterisation(Q, bound);
        final TransformResult inverse = reparameterisation.inverse(prime(unitValue));
        assertEqualsDoubleSmart(inverse.getPoint().get("q"), expected);
        assertEqualsDoubleSmart(inverse.getLogJacobian(), Math.log(2.));
    }

    @DataProvider(name = "hardBounds")
    public Object[][] hardBounds() {
        return new Object[][]{
                {Bound.NONE, -0.1},
                {Bound.NONE, 1.1},
                {Bound.LOWER, 1.1},
                {Bound.LOWER, -1.1},
                {Bound.UPPER, -0.1},
                {Bound.UPPER, 2.1},
                //a single reflection at most
                {Bound.BOTH, 2.25},
                {Bound.BOTH, -1.25},
        };
    }

    @Test(dataProvider = "hardBounds", expectedExceptions = DomainException.class)
    public void testCrossingHardBound(final Bound bound, final double unitValue) {
        new ReflectiveReparameterisation(Q, bound).inverse(prime(unitValue));
    }

    @Test
    public void testPreimagesMirrorAcrossReflectiveBounds() {
        final Point transformed = Point.builder().put("q_prime", -0.25).put("other", 3.).build();
        final List<Point> preimages = new ReflectiveReparameterisation(Q, Bound.BOTH).preimages(transformed);
        Assert.assertEquals(preimages.size(), 3);
        assertEqualsDoubleSmart(preimages.get(0).get("q_prime"), 0.25);
        assertEqualsDoubleSmart(preimages.get(1).get("q_prime"), -0.25);
        assertEqualsDoubleSmart(preimages.get(2).get("q_prime"), 1.75);
        preimages.forEach(p -> assertEqualsDoubleSmart(p.get("other"), 3.));

        final List<Point> upperOnly = new ReflectiveReparameterisation(Q, Bound.UPPER).preimages(prime(1.25));
        Assert.assertEquals(upperOnly.size(), 2);
        assertEqualsDoubleSmart(upperOnly.get(0).get("q_prime"), 0.75);
        assertEqualsDoubleSmart(upperOnly.get(1).get("q_prime"), 1.25);

        Assert.assertEquals(new ReflectiveReparameterisation(Q, Bound.NONE).preimages(prime(0.4)),
                Collections.singletonList(prime(0.4)));
    }

    @Test(expectedExceptions = DomainException.class)
    public void testPreimagesBeyondHardBound() {
        new ReflectiveReparameterisation(Q, Bound.LOWER).preimages(prime(1.1));
    }

    @Test(expectedExceptions = DomainException.class)
    public void testPhysicalValueOutsideBounds() {
        new ReflectiveReparameterisation(Q, Bound.BOTH).forward(Point.builder().put("q", 2.5).build());
    }

    @Test
    public void testDetectEdges() {
        final ReflectiveReparameterisation reparameterisation = new ReflectiveReparameterisation(Q, Bound.NONE, true, Bound.BOTH);
        Assert.assertTrue(reparameterisation.isFitted());
        //density piles up at the lower bound only
        final List<Point> livePoints = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            livePoints.add(Point.builder().put("q", 2. * Math.pow(i / 100., 2.)).build());
        }
        final ReflectiveReparameterisation fitted = (ReflectiveReparameterisation) reparameterisation.fit(livePoints);
        Assert.assertEquals(fitted.getReflectiveBounds(), Bound.LOWER);
        Assert.assertEquals(reparameterisation.getReflectiveBounds(), Bound.NONE);
    }

    @Test
    public void testDetectEdgesRespectsAllowedBounds() {
        final ReflectiveReparameterisation reparameterisation = new ReflectiveReparameterisation(Q, Bound.BOTH, true, Bound.UPPER);
        Assert.assertEquals(reparameterisation.getReflectiveBounds(), Bound.UPPER);
        final List<Point> livePoints = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            livePoints.add(Point.builder().put("q", 0.01 * i).build());
        }
        //all points in the lower half: the lower bound is dense but not allowed, the upper bound is empty
        Assert.assertEquals(((ReflectiveReparameterisation) reparameterisation.fit(livePoints)).getReflectiveBounds(), Bound.NONE);
    }

    @Test
    public void testBoundIntersection() {
        Assert.assertEquals(Bound.BOTH.intersect(Bound.LOWER), Bound.LOWER);
        Assert.assertEquals(Bound.UPPER.intersect(Bound.LOWER), Bound.NONE);
        Assert.assertEquals(Bound.of(true, true), Bound.BOTH);
    }
}
