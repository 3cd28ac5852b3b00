package org.polycore.tools.core;

import org.polycore.exceptions.UserException;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class CoreThresholdsUnitTest {

    @DataProvider(name = "outOfRange")
    public Object[][] outOfRange() {
        return new Object[][]{
                {-0.1, 0.5, 0.0, 0},
                {1.1, 0.5, 0.0, 0},
                {0.5, Double.NaN, 0.0, 0},
                {0.5, 1.0001, 0.0, 0},
                {0.5, 0.5, -1e-3, 0},
                {0.5, 0.5, 0.0, -1},
        };
    }

    @Test(dataProvider = "outOfRange", expectedExceptions = UserException.ThresholdRange.class)
    public void testOutOfRange(final double gf, final double cf, final double pf, final int pn) {
        new CoreThresholds(gf, cf, pf, pn);
    }

    @Test
    public void testBoundariesAreAccepted() {
        new CoreThresholds(0.0, 0.0, 0.0, 0);
        new CoreThresholds(1.0, 1.0, 1.0, 1000);
    }

    @DataProvider(name = "called")
    public Object[][] called() {
        return new Object[][]{
                {0.9, 1, 1, true},
                {0.9, 0, 1, false},
                {0.5, 2, 4, true},
                {0.5, 1, 4, false},
                // products of fractions are compared with a tolerance
                {0.7, 7, 10, true},
                {1.0, 3, 3, true},
                {1.0, 2, 3, false},
                {0.0, 0, 2, true},
        };
    }

    @Test(dataProvider = "called")
    public void testIsCalled(final double gf, final int nonMissing, final int ploidy, final boolean expected) {
        Assert.assertEquals(new CoreThresholds(gf, 0.5, 0.0, 0).isCalled(nonMissing, ploidy), expected);
    }

    @DataProvider(name = "minCalled")
    public Object[][] minCalled() {
        return new Object[][]{
                {0.95, 10, 10, 0},
                {0.95, 20, 19, 1},
                {0.9, 10, 9, 1},
                {1.0, 3, 3, 0},
                {0.0, 3, 0, 3},
                {0.5, 3, 2, 1},
                {0.3, 10, 3, 7},
        };
    }

    @Test(dataProvider = "minCalled")
    public void testMinCalledAndBudget(final double cf, final int voting, final int expectedMin, final int expectedBudget) {
        final CoreThresholds thresholds = new CoreThresholds(0.5, cf, 0.0, 0);
        Assert.assertEquals(thresholds.minCalledSamples(voting), expectedMin);
        Assert.assertEquals(thresholds.missingBudget(voting), expectedBudget);
    }

    @Test
    public void testGenomeFraction() {
        final CoreThresholds thresholds = new CoreThresholds(0.9, 0.5, 0.0, 0);
        Assert.assertTrue(thresholds.passesGenomeFraction(0.9));
        Assert.assertTrue(thresholds.passesGenomeFraction(1.0));
        Assert.assertFalse(thresholds.passesGenomeFraction(0.89));
    }

    @Test
    public void testIsVariant() {
        final CoreThresholds thresholds = new CoreThresholds(0.5, 0.5, 0.2, 2);
        Assert.assertTrue(thresholds.isVariant(2, 0.2, 2));
        Assert.assertFalse(thresholds.isVariant(2, 0.19, 2));
        Assert.assertFalse(thresholds.isVariant(2, 0.5, 1));
        Assert.assertFalse(new CoreThresholds(0.5, 0.5, 0.0, 0).isVariant(0, 0.0, 0));
        Assert.assertTrue(new CoreThresholds(0.5, 0.5, 0.0, 0).isVariant(1, 0.01, 1));
    }
}
