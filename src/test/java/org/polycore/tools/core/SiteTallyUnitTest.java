package org.polycore.tools.core;

import org.testng.Assert;
import org.testng.annotations.Test;

public class SiteTallyUnitTest {

    private static final CoreThresholds THRESHOLDS = new CoreThresholds(0.5, 1.0, 0.0, 0);

    @Test
    public void testEmpty() {
        Assert.assertEquals(SiteTally.EMPTY.getSamples(), 0);
        Assert.assertEquals(SiteTally.EMPTY.getCalledSamples(), 0);
        Assert.assertEquals(SiteTally.EMPTY.getAlleleCopyCounts(), new int[4]);
    }

    @Test
    public void testObservationFromCopyRanks() {
        // tetraploid A/A/G/missing
        final SiteObservation observation = SiteObservation.fromCopyRanks(new int[]{0, 0, 2, -1}, 4, THRESHOLDS);
        Assert.assertEquals(observation.getPloidy(), 4);
        Assert.assertEquals(observation.getNonMissingCopies(), 3);
        Assert.assertEquals(observation.getAlleleCopies(0), 2);
        Assert.assertEquals(observation.getAlleleCopies(2), 1);
        Assert.assertTrue(observation.isCalled());
    }

    @Test
    public void testObservationFromGroupRanksMatchesCopyRanks() {
        final int[] groupRanks = {1, -1, 3};
        final SiteObservation fromGroups = SiteObservation.fromGroupRanks(new int[]{0, 2, 2, 1}, groupRanks, THRESHOLDS);
        final SiteObservation fromCopies = SiteObservation.fromCopyRanks(new int[]{1, 3, 3, -1}, 4, THRESHOLDS);
        Assert.assertEquals(SiteTally.update(SiteTally.EMPTY, fromGroups), SiteTally.update(SiteTally.EMPTY, fromCopies));
    }

    @Test
    public void testUncalledSampleOnlyCountsExpectedCopies() {
        // one of four copies is not enough at min-gf 0.5
        final SiteObservation uncalled = SiteObservation.fromCopyRanks(new int[]{3, -1, -1, -1}, 4, THRESHOLDS);
        Assert.assertFalse(uncalled.isCalled());
        final SiteTally tally = SiteTally.update(SiteTally.EMPTY, uncalled);
        Assert.assertEquals(tally.getSamples(), 1);
        Assert.assertEquals(tally.getCalledSamples(), 0);
        Assert.assertEquals(tally.getUncalledSamples(), 1);
        Assert.assertEquals(tally.getExpectedCopies(), 4);
        Assert.assertEquals(tally.getNonMissingCopies(), 1);
        Assert.assertEquals(tally.getCalledCopies(), 0);
        Assert.assertEquals(tally.getAlleleCopies(3), 0);
        Assert.assertEquals(tally.getAlleleSamples(3), 0);
    }

    @Test
    public void testUpdateAccumulatesAndDoesNotMutate() {
        final SiteTally first = SiteTally.update(SiteTally.EMPTY, SiteObservation.fromCopyRanks(new int[]{0}, 1, THRESHOLDS));
        final SiteTally second = SiteTally.update(first, SiteObservation.fromCopyRanks(new int[]{0, 1}, 2, THRESHOLDS));
        Assert.assertEquals(first.getAlleleCopies(0), 1);
        Assert.assertEquals(first.getSamples(), 1);

        Assert.assertEquals(second.getSamples(), 2);
        Assert.assertEquals(second.getCalledSamples(), 2);
        Assert.assertEquals(second.getExpectedCopies(), 3);
        Assert.assertEquals(second.getCalledCopies(), 3);
        Assert.assertEquals(second.getAlleleCopyCounts(), new int[]{2, 1, 0, 0});
        Assert.assertEquals(second.getAlleleSamples(0), 2);
        Assert.assertEquals(second.getAlleleSamples(1), 1);
        Assert.assertEquals(SiteTally.EMPTY.getSamples(), 0);
    }

    @Test
    public void testOrderIndependence() {
        final SiteObservation a = SiteObservation.fromCopyRanks(new int[]{0, 2}, 2, THRESHOLDS);
        final SiteObservation b = SiteObservation.fromCopyRanks(new int[]{-1, -1, 1}, 3, THRESHOLDS);
        final SiteObservation c = SiteObservation.fromCopyRanks(new int[]{3}, 1, THRESHOLDS);
        final SiteTally abc = SiteTally.update(SiteTally.update(SiteTally.update(SiteTally.EMPTY, a), b), c);
        final SiteTally cba = SiteTally.update(SiteTally.update(SiteTally.update(SiteTally.EMPTY, c), b), a);
        Assert.assertEquals(abc, cba);
        Assert.assertEquals(abc.hashCode(), cba.hashCode());
    }
}
