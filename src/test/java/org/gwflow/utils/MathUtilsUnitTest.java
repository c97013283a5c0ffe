package org.gwflow.utils;

import org.gwflow.utils.test.BaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class MathUtilsUnitTest extends BaseTest {

    @Test
    public void testLogSumExp() {
        assertEqualsDoubleSmart(MathUtils.logSumExp(Math.log(1.), Math.log(2.), Math.log(3.)), Math.log(6.));
        assertEqualsDoubleSmart(MathUtils.logSumExp(-1000., -1000.), -1000. + Math.log(2.));
        assertEqualsDoubleSmart(MathUtils.logSumExp(0., Double.NEGATIVE_INFINITY), 0.);
        Assert.assertEquals(MathUtils.logSumExp(Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY), Double.NEGATIVE_INFINITY);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testLogSumExpOfEmptyArray() {
        MathUtils.logSumExp();
    }

    @DataProvider(name = "wrap")
    public Object[][] wrapData() {
        return new Object[][]{
                {0.5, 0., 1., 0.5},
                {1.25, 0., 1., 0.25},
                {-0.25, 0., 1., 0.75},
                {1., 0., 1., 0.},
                {7., 2., 4., 3.},
                {-Math.PI, 0., MathUtils.TWO_PI, Math.PI}
        };
    }

    @Test(dataProvider = "wrap")
    public void testWrap(final double x, final double lower, final double period, final double expected) {
        final double wrapped = MathUtils.wrap(x, lower, period);
        assertEqualsDoubleSmart(wrapped, expected);
        Assert.assertTrue(wrapped >= lower && wrapped < lower + period);
    }

    @Test
    public void testStandardNormalLogDensity() {
        assertEqualsDoubleSmart(MathUtils.standardNormalLogDensity(new double[]{0.}), -0.5 * Math.log(MathUtils.TWO_PI));
        assertEqualsDoubleSmart(MathUtils.standardNormalLogDensity(new double[]{1., -1.}), -1. - Math.log(MathUtils.TWO_PI));
    }
}
