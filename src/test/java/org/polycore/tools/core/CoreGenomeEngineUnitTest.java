package org.polycore.tools.core;

import org.polycore.PolyCoreBaseTest;
import org.polycore.cmdline.argumentcollections.CoreGenomeArgumentCollection;
import org.polycore.exceptions.UserException;
import org.polycore.tools.core.distance.CopyAggregation;
import org.polycore.tools.core.distance.DistanceMatrix;
import org.polycore.tools.core.distance.DistanceSiteSelection;
import org.polycore.tools.core.distance.FixedMemoryBudgetProvider;
import org.polycore.tools.core.distance.MemoryBudgetProvider;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

public class CoreGenomeEngineUnitTest extends PolyCoreBaseTest {

    private static CoreGenomeResult run(final CoreGenomeArgumentCollection arguments, final Sample reference, final Sample... samples) {
        return new CoreGenomeEngine(arguments, MemoryBudgetProvider.absent(), 100, 1).run(reference, Arrays.asList(samples));
    }

    private static SampleSummary summary(final CoreGenomeResult result, final String id) {
        return result.getSummaries().stream().filter(s -> s.getId().equals(id)).findFirst()
                .orElseThrow(() -> new AssertionError("no summary for " + id));
    }

    @Test
    public void testSingleSubstitution() {
        final CoreGenomeResult result = run(arguments(1.0, 1.0, 0.0, 1), reference("AAAAAAAAAA"),
                unphased("s1", "AAAAAAAAAA"), unphased("s2", "AAAAAAAAAT"));

        Assert.assertEquals(result.getNumberOfCoreSites(), 10);
        Assert.assertEquals(result.getNumberOfVariantSites(), 1);
        Assert.assertEquals(result.getExpandedAlignment().getVariantSites(), new int[]{9});
        Assert.assertEquals(result.getVotingSampleIds(), Arrays.asList("s1", "s2"));
        Assert.assertEquals(result.getDistanceMatrix().getDistance(0, 1), 0.1, 1e-12);
        Assert.assertEquals(result.getConstantSiteComposition(), new long[]{9, 0, 0, 0});
        Assert.assertTrue(result.getWarnings().isEmpty());
        Assert.assertFalse(result.isProgressive());
        Assert.assertTrue(result.getTrajectory().isEmpty());
        // the reference and s1 share one sequence
        Assert.assertEquals(result.getExpandedAlignment().getCollapsedAlignment().getNumberOfGroups(), 2);
    }

    @Test
    public void testIdenticalSamples() {
        final CoreGenomeResult result = run(arguments(0.9, 0.95, 0.0, 0), reference("ACGTACGTAC"),
                unphased("s1", "ACGTTCGTAC"), unphased("s2", "ACGTTCGTAC"), unphased("s3", "ACGTTCGTAC"));
        final DistanceMatrix matrix = result.getDistanceMatrix();
        Assert.assertEquals(matrix.size(), 3);
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                Assert.assertEquals(matrix.getDistance(i, j), 0.0);
            }
        }
        // the substitution against the reference is a variant shared by every sample
        Assert.assertEquals(result.getNumberOfVariantSites(), 1);
    }

    @Test
    public void testLowGenomeFractionSampleIsExcluded() {
        final CoreGenomeResult result = run(new CoreGenomeArgumentCollection(), reference("AAAAAAAAAA"),
                unphased("s1", "AAAAAAAAAA"), unphased("s2", "AAAAAAAAAC"), unphased("s3", "AAAAANNNNN"));

        Assert.assertEquals(result.getVotingSampleIds(), Arrays.asList("s1", "s2"));
        Assert.assertEquals(result.getNumberOfCoreSites(), 10);
        Assert.assertEquals(result.getNumberOfVariantSites(), 1);
        Assert.assertEquals(result.getDistanceMatrix().getSampleIds(), Arrays.asList("s1", "s2"));
        Assert.assertEquals(result.getWarnings().size(), 1);
        assertContains(result.getWarnings().get(0), "s3");

        final SampleSummary low = summary(result, "s3");
        Assert.assertEquals(low.getStatus(), SampleSummary.Status.LOW_GENOME_FRACTION);
        Assert.assertEquals(low.getGenomeFraction(), 0.5, 1e-12);
        Assert.assertEquals(low.getMissing(), 5L);
        Assert.assertTrue(Double.isNaN(low.getCoreFraction()));
        Assert.assertEquals(low.getCalledSites(), 0);

        Assert.assertEquals(summary(result, "Reference").getStatus(), SampleSummary.Status.REFERENCE);
        final SampleSummary s2 = summary(result, "s2");
        Assert.assertEquals(s2.getStatus(), SampleSummary.Status.PASS);
        Assert.assertEquals(s2.getCalledSites(), 10);
        Assert.assertEquals(s2.getVariantSites(), 1);
        Assert.assertEquals(s2.getCoreFraction(), 1.0);
        Assert.assertEquals(summary(result, "s1").getVariantSites(), 0);
        Assert.assertEquals(result.getSummaries().size(), 4);
    }

    @Test
    public void testIncludeReference() {
        final CoreGenomeArgumentCollection arguments = arguments(0.9, 1.0, 0.0, 0);
        arguments.includeReference = true;
        final CoreGenomeResult result = run(arguments, reference("AAAT"), unphased("s1", "AAAA"));

        Assert.assertEquals(result.getVotingSamples(), new int[]{0, 1});
        Assert.assertEquals(result.getDistanceMatrix().getSampleIds(), Arrays.asList("Reference", "s1"));
        Assert.assertEquals(result.getDistanceMatrix().getDistance(0, 1), 0.25, 1e-12);
        Assert.assertEquals(summary(result, "Reference").getStatus(), SampleSummary.Status.PASS);
        Assert.assertEquals(result.getNumberOfVariantSites(), 1);
    }

    @Test
    public void testReferenceDoesNotVoteByDefault() {
        // the reference is missing at column 0 but only the sample votes
        final CoreGenomeResult result = run(arguments(0.9, 1.0, 0.0, 0), reference("NAAA"), unphased("s1", "CAAA"));
        Assert.assertEquals(result.getVotingSamples(), new int[]{1});
        Assert.assertEquals(result.getNumberOfCoreSites(), 3);
    }

    @DataProvider(name = "orders")
    public Object[][] orders() {
        return new Object[][]{
                {ProgressiveOrder.MISSINGNESS, Arrays.asList("s2", "s1", "s3"), new int[]{10, 9, 8}},
                {ProgressiveOrder.INPUT, Arrays.asList("s1", "s2", "s3"), new int[]{9, 9, 8}},
        };
    }

    @Test(dataProvider = "orders")
    public void testProgressive(final ProgressiveOrder order, final List<String> expectedOrder, final int[] expectedSites) {
        final CoreGenomeArgumentCollection arguments = arguments(0.9, 1.0, 0.0, 0);
        arguments.progressive = true;
        arguments.progressiveOrder = order;
        final CoreGenomeResult result = run(arguments, reference("AAAAAAAAAA"),
                unphased("s1", "AAAAAAAAAN"), unphased("s2", "AAAAAAAAAA"), unphased("s3", "NAAAAAAAAA"));

        Assert.assertTrue(result.isProgressive());
        final List<CoreTrajectoryPoint> trajectory = result.getTrajectory();
        Assert.assertEquals(trajectory.stream().map(CoreTrajectoryPoint::getSampleId).collect(Collectors.toList()), expectedOrder);
        Assert.assertEquals(trajectory.stream().mapToInt(CoreTrajectoryPoint::getCoreSites).toArray(), expectedSites);
        Assert.assertEquals(trajectory.get(2).getCoreFraction(), 0.8, 1e-12);
        Assert.assertEquals(result.getNumberOfCoreSites(), expectedSites[2]);
        for (int k = 0; k < trajectory.size(); k++) {
            Assert.assertEquals(summary(result, expectedOrder.get(k)).getCoreFraction(), expectedSites[k] / 10.0, 1e-12);
        }
    }

    @Test
    public void testProgressiveEndsAtTheCoreSet() {
        final Random random = new Random(5);
        final CoreGenomeArgumentCollection arguments = arguments(0.6, 0.7, 0.0, 0);
        arguments.progressive = true;
        final List<Sample> samples = randomSamples(random, 9, 150, 0.1);
        final CoreGenomeResult result = new CoreGenomeEngine(arguments, MemoryBudgetProvider.absent(), 100, 1)
                .run(reference(randomSequence(random, 150, 1, 0.0)), samples);
        final List<CoreTrajectoryPoint> trajectory = result.getTrajectory();
        Assert.assertEquals(trajectory.size(), result.getVotingSamples().length);
        if (!trajectory.isEmpty()) {
            Assert.assertEquals(trajectory.get(trajectory.size() - 1).getCoreSites(), result.getNumberOfCoreSites());
        }
    }

    @Test
    public void testConstantSiteCompositionUsesTheLargestPloidy() {
        final CoreGenomeResult result = run(arguments(0.9, 1.0, 0.0, 0), reference("ACGT"),
                unphased("s1", "ACGT"), unphased("s2", "RCGT"));
        Assert.assertEquals(result.getNumberOfVariantSites(), 1);
        Assert.assertEquals(result.getConstantSiteComposition(), new long[]{0, 2, 2, 2});
    }

    @Test
    public void testNoVotingSample() {
        final CoreGenomeResult result = run(arguments(0.9, 0.9, 0.0, 0), reference("AAAA"), unphased("s1", "NNNN"));
        Assert.assertEquals(result.getVotingSamples().length, 0);
        Assert.assertEquals(result.getNumberOfCoreSites(), 0);
        Assert.assertEquals(result.getDistanceMatrix().size(), 0);
        Assert.assertEquals(result.getWarnings().size(), 3);
        Assert.assertEquals(result.getConstantSiteComposition(), new long[]{0, 0, 0, 0});
    }

    @Test
    public void testIncomparablePairsAreReported() {
        final CoreGenomeResult result = run(arguments(0.0, 0.0, 0.0, 0), reference("AAAA"),
                unphased("s1", "AANN"), unphased("s2", "NNAA"));
        Assert.assertTrue(Double.isNaN(result.getDistanceMatrix().getDistance(0, 1)));
        Assert.assertEquals(result.getWarnings().size(), 1);
        assertContains(result.getWarnings().get(0), "no comparable site");
    }

    @DataProvider(name = "distanceSettings")
    public Object[][] distanceSettings() {
        return new Object[][]{
                {DistanceSiteSelection.CORE, CopyAggregation.DOSAGE, 0.1},
                {DistanceSiteSelection.VARIANT, CopyAggregation.DOSAGE, 1.0},
                {DistanceSiteSelection.CORE, CopyAggregation.MEAN_COPY_PAIRS, 0.1},
        };
    }

    @Test(dataProvider = "distanceSettings")
    public void testDistanceSettings(final DistanceSiteSelection sites, final CopyAggregation aggregation, final double expected) {
        final CoreGenomeArgumentCollection arguments = arguments(1.0, 1.0, 0.0, 1);
        arguments.distanceSites = sites;
        arguments.copyAggregation = aggregation;
        arguments.chunkSize = 3;
        arguments.threads = 2;
        final CoreGenomeResult result = run(arguments, reference("AAAAAAAAAA"),
                unphased("s1", "AAAAAAAAAA"), unphased("s2", "AAAAAAAAAT"));
        Assert.assertEquals(result.getDistanceMatrix().getDistance(0, 1), expected, 1e-12);
    }

    @Test
    public void testRunsAreDeterministic() {
        final Random random = new Random(17);
        final Sample reference = reference(randomSequence(random, 120, 1, 0.0));
        final List<Sample> samples = randomSamples(random, 8, 120, 0.05);
        final CoreGenomeArgumentCollection arguments = arguments(0.8, 0.9, 0.0, 0);
        final CoreGenomeResult first = new CoreGenomeEngine(arguments, MemoryBudgetProvider.absent(), 7, 1).run(reference, samples);
        arguments.threads = 3;
        final CoreGenomeResult second = new CoreGenomeEngine(arguments, MemoryBudgetProvider.absent(), 13, 1).run(reference, samples);
        Assert.assertEquals(second.getExpandedAlignment().getCoreSites(), first.getExpandedAlignment().getCoreSites());
        Assert.assertEquals(second.getDistanceMatrix().toLong().toString(), first.getDistanceMatrix().toLong().toString());
    }

    @Test(expectedExceptions = UserException.AlignmentLengthMismatch.class)
    public void testLengthMismatch() {
        run(new CoreGenomeArgumentCollection(), reference("AAAA"), unphased("s1", "AAA"));
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testDuplicateSampleId() {
        run(new CoreGenomeArgumentCollection(), reference("AAAA"), unphased("s1", "AAAA"), unphased("s1", "AAAC"));
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testInvalidThreads() {
        final CoreGenomeArgumentCollection arguments = new CoreGenomeArgumentCollection();
        arguments.threads = 0;
        run(arguments, reference("AAAA"), unphased("s1", "AAAA"));
    }

    @Test(expectedExceptions = UserException.EmptyAlignment.class)
    public void testEmptyAlignment() {
        new CoreGenomeEngine(new CoreGenomeArgumentCollection(), MemoryBudgetProvider.absent(), 100, 1)
                .run(reference(""), Collections.emptyList());
    }

    @DataProvider(name = "badThresholds")
    public Object[][] badThresholds() {
        return new Object[][]{
                {1.5, 0.9, 0.0, 0},
                {0.9, -0.1, 0.0, 0},
                {0.9, 0.9, 2.0, 0},
                {0.9, 0.9, 0.0, -1},
        };
    }

    @Test(dataProvider = "badThresholds", expectedExceptions = UserException.ThresholdRange.class)
    public void testThresholdsAreCheckedFirst(final double gf, final double cf, final double pf, final int pn) {
        // the length mismatch would be reported otherwise
        run(arguments(gf, cf, pf, pn), reference("AAAA"), unphased("s1", "AAA"));
    }

    @Test(expectedExceptions = UserException.InsufficientMemory.class)
    public void testInsufficientMemory() {
        new CoreGenomeEngine(new CoreGenomeArgumentCollection(), new FixedMemoryBudgetProvider(16), 100, 1)
                .run(reference("AAAA"), Arrays.asList(unphased("s1", "AAAA"), unphased("s2", "AAAA")));
    }
}
