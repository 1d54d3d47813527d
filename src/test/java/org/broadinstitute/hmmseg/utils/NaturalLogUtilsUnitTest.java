package org.broadinstitute.hmmseg.utils;

import org.broadinstitute.hmmseg.HmmSegBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class NaturalLogUtilsUnitTest extends HmmSegBaseTest {

    private static final double TOLERANCE = 1e-12;

    @DataProvider(name = "probabilities")
    public Object[][] probabilities() {
        return new Object[][] {
                {1.0}, {0.5}, {0.25}, {1e-300}, {0.999}
        };
    }

    @Test(dataProvider = "probabilities")
    public void testFromProbability(final double probability) {
        final double logProbability = NaturalLogUtils.fromProbability(probability);
        Assert.assertEquals(logProbability, Math.log(probability), TOLERANCE);
        Assert.assertTrue(NaturalLogUtils.isValidLogProbability(logProbability));
        Assert.assertEquals(NaturalLogUtils.toProbability(logProbability), probability, probability * 1e-9);
    }

    @Test
    public void testZeroProbabilityIsImpossible() {
        final double logProbability = NaturalLogUtils.fromProbability(0);
        Assert.assertEquals(logProbability, NaturalLogUtils.IMPOSSIBLE);
        Assert.assertTrue(NaturalLogUtils.isImpossible(logProbability));
        Assert.assertEquals(NaturalLogUtils.toProbability(logProbability), 0.0);
    }

    @DataProvider(name = "badProbabilities")
    public Object[][] badProbabilities() {
        return new Object[][] {
                {-0.1}, {1.0001}, {Double.NaN}, {Double.POSITIVE_INFINITY}, {Double.NEGATIVE_INFINITY}
        };
    }

    @Test(dataProvider = "badProbabilities", expectedExceptions = IllegalArgumentException.class)
    public void testFromProbabilityFailures(final double probability) {
        NaturalLogUtils.fromProbability(probability);
    }

    @Test
    public void testImpossibleIsAbsorbing() {
        Assert.assertEquals(NaturalLogUtils.product(NaturalLogUtils.IMPOSSIBLE, -3.0), NaturalLogUtils.IMPOSSIBLE);
        Assert.assertEquals(NaturalLogUtils.product(NaturalLogUtils.CERTAIN, NaturalLogUtils.IMPOSSIBLE), NaturalLogUtils.IMPOSSIBLE);
        Assert.assertEquals(NaturalLogUtils.product(NaturalLogUtils.IMPOSSIBLE, NaturalLogUtils.IMPOSSIBLE), NaturalLogUtils.IMPOSSIBLE);
        Assert.assertTrue(NaturalLogUtils.IMPOSSIBLE < -Double.MAX_VALUE);
    }

    @Test
    public void testProduct() {
        Assert.assertEquals(NaturalLogUtils.product(Math.log(0.5), Math.log(0.25)), Math.log(0.125), TOLERANCE);
        Assert.assertEquals(NaturalLogUtils.product(NaturalLogUtils.CERTAIN, -2.5), -2.5);
    }

    @Test
    public void testIsValidLogProbability() {
        Assert.assertTrue(NaturalLogUtils.isValidLogProbability(0.0));
        Assert.assertTrue(NaturalLogUtils.isValidLogProbability(-1000));
        Assert.assertTrue(NaturalLogUtils.isValidLogProbability(NaturalLogUtils.IMPOSSIBLE));
        Assert.assertFalse(NaturalLogUtils.isValidLogProbability(1e-9));
        Assert.assertFalse(NaturalLogUtils.isValidLogProbability(Double.NaN));
        Assert.assertFalse(NaturalLogUtils.isValidLogProbability(Double.POSITIVE_INFINITY));
    }

    @Test
    public void testLogSumExp() {
        Assert.assertEquals(NaturalLogUtils.logSumExp(Math.log(0.25), Math.log(0.25), Math.log(0.5)), 0.0, 1e-9);
        Assert.assertEquals(NaturalLogUtils.logSumExp(-1000, -1000), -1000 + Math.log(2), 1e-9);
        Assert.assertEquals(NaturalLogUtils.logSumExp(Math.log(0.3), NaturalLogUtils.IMPOSSIBLE), Math.log(0.3), 1e-9);
        Assert.assertEquals(NaturalLogUtils.logSumExp(NaturalLogUtils.IMPOSSIBLE, NaturalLogUtils.IMPOSSIBLE), NaturalLogUtils.IMPOSSIBLE);
        Assert.assertEquals(NaturalLogUtils.logSumExp(), NaturalLogUtils.IMPOSSIBLE);
    }
}
