package org.polycore.tools.core;

import org.polycore.PolyCoreBaseTest;
import org.polycore.exceptions.UserException;
import org.polycore.utils.Nucleotide;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

public class SiteClassifierUnitTest extends PolyCoreBaseTest {

    private static List<SiteStat> classify(final List<Sample> samples, final CoreThresholds thresholds,
                                           final boolean keepAmbiguous, final int... voting) {
        return new SiteClassifier(SequenceCollapser.collapse(samples), 0, voting, thresholds, keepAmbiguous).classify();
    }

    private static int[] allSamples(final List<Sample> samples) {
        return IntStream.range(1, samples.size()).toArray();
    }

    @Test
    public void testSingleSubstitution() {
        final List<Sample> samples = withReference(reference("AAAAAAAAAA"),
                unphased("s1", "AAAAAAAAAA"), unphased("s2", "AAAAAAAAAT"));
        final List<SiteStat> stats = classify(samples, new CoreThresholds(1.0, 1.0, 0.0, 1), false, 1, 2);

        Assert.assertEquals(stats.size(), 10);
        for (int column = 0; column < 9; column++) {
            Assert.assertEquals(stats.get(column).getSiteClass(), SiteClass.CORE_INVARIANT);
            Assert.assertNull(stats.get(column).getAlternate());
            Assert.assertEquals(stats.get(column).getAlternates(), Collections.emptyList());
        }
        final SiteStat variant = stats.get(9);
        Assert.assertEquals(variant.getColumn(), 9);
        Assert.assertEquals(variant.getSiteClass(), SiteClass.CORE_VARIANT);
        Assert.assertEquals(variant.getRef(), Nucleotide.A);
        Assert.assertEquals(variant.getAlternate(), Nucleotide.T);
        Assert.assertEquals(variant.getAlternates(), Collections.singletonList(Nucleotide.T));
        Assert.assertEquals(variant.getAlternateCopies(), 1);
        Assert.assertEquals(variant.getAlternateFraction(), 0.5, 1e-12);
        Assert.assertEquals(variant.getAlternateSamples(), 1);
        Assert.assertEquals(variant.getCalledSamples(), 2);
        Assert.assertEquals(variant.getVotingSamples(), 2);
        Assert.assertEquals(variant.getCoreFraction(), 1.0, 1e-12);
        Assert.assertEquals(variant.getGenomeFraction(), 1.0, 1e-12);
        Assert.assertEquals(variant.getCalledCopies(), 2);
        Assert.assertEquals(variant.getAlleleCopies(Nucleotide.A), 1);
    }

    @DataProvider(name = "coreFraction")
    public Object[][] coreFraction() {
        return new Object[][]{
                {1.0, SiteClass.EXCLUDED},
                {0.5, SiteClass.CORE_INVARIANT},
        };
    }

    @Test(dataProvider = "coreFraction")
    public void testMissingSampleAgainstCoreFraction(final double minCf, final SiteClass expected) {
        final List<Sample> samples = withReference(reference("ACGT"), unphased("s1", "ACGT"), unphased("s2", "AC-T"));
        final List<SiteStat> stats = classify(samples, new CoreThresholds(0.9, minCf, 0.0, 0), false, 1, 2);
        Assert.assertEquals(stats.get(2).getSiteClass(), expected);
        Assert.assertEquals(stats.get(2).getCalledSamples(), 1);
        Assert.assertEquals(stats.get(2).getCoreFraction(), 0.5, 1e-12);
        Assert.assertEquals(stats.get(2).getGenomeFraction(), 0.5, 1e-12);
        Assert.assertEquals(stats.get(0).getSiteClass(), SiteClass.CORE_INVARIANT);
    }

    @Test
    public void testAmbiguousReferenceColumn() {
        final List<Sample> samples = withReference(reference("ANGT"),
                unphased("s1", "ACGT"), unphased("s2", "AGGT"), unphased("s3", "ACGT"));
        final CoreThresholds thresholds = new CoreThresholds(0.9, 1.0, 0.0, 0);

        final List<SiteStat> dropped = classify(samples, thresholds, false, 1, 2, 3);
        Assert.assertEquals(dropped.get(1).getSiteClass(), SiteClass.EXCLUDED);
        Assert.assertEquals(dropped.get(1).getReferenceSymbol(), (byte) 'N');

        final List<SiteStat> kept = classify(samples, thresholds, true, 1, 2, 3);
        // REF falls back to the majority allele
        Assert.assertEquals(kept.get(1).getSiteClass(), SiteClass.CORE_VARIANT);
        Assert.assertEquals(kept.get(1).getRef(), Nucleotide.C);
        Assert.assertEquals(kept.get(1).getAlternate(), Nucleotide.G);
        Assert.assertEquals(kept.get(1).getAlternateCopies(), 1);
    }

    @Test
    public void testMajorityTieTakesLowestRank() {
        final List<Sample> samples = withReference(reference("N"), unphased("s1", "G"), unphased("s2", "C"));
        final SiteStat stat = classify(samples, new CoreThresholds(0.9, 1.0, 0.0, 0), true, 1, 2).get(0);
        Assert.assertEquals(stat.getRef(), Nucleotide.C);
        Assert.assertEquals(stat.getAlternate(), Nucleotide.G);
    }

    @Test
    public void testNothingCalledUnderAmbiguousReference() {
        final List<Sample> samples = withReference(reference("N"), unphased("s1", "N"));
        final SiteStat stat = classify(samples, new CoreThresholds(0.0, 1.0, 0.0, 0), true, 1).get(0);
        Assert.assertEquals(stat.getRef(), Nucleotide.N);
        Assert.assertEquals(stat.getSiteClass(), SiteClass.CORE_INVARIANT);
    }

    @Test
    public void testReferenceAlleleAbsentFromSamples() {
        final List<Sample> samples = withReference(reference("A"), unphased("s1", "C"), unphased("s2", "C"));
        final SiteStat stat = classify(samples, new CoreThresholds(0.9, 1.0, 0.0, 0), false, 1, 2).get(0);
        Assert.assertEquals(stat.getRef(), Nucleotide.A);
        Assert.assertEquals(stat.getAlternate(), Nucleotide.C);
        Assert.assertEquals(stat.getAlternateFraction(), 1.0, 1e-12);
        Assert.assertEquals(stat.getSiteClass(), SiteClass.CORE_VARIANT);
    }

    @DataProvider(name = "alleleThresholds")
    public Object[][] alleleThresholds() {
        return new Object[][]{
                {0.0, 0, SiteClass.CORE_VARIANT},
                {0.3, 1, SiteClass.CORE_VARIANT},
                {0.5, 0, SiteClass.CORE_INVARIANT},
                {0.0, 2, SiteClass.CORE_INVARIANT},
        };
    }

    @Test(dataProvider = "alleleThresholds")
    public void testPolyploidAlleleFraction(final double minPf, final int minPn, final SiteClass expected) {
        // s1 is diploid A/G at the second column, s2 haploid A: one G out of three called copies
        final List<Sample> samples = withReference(reference("AA"), unphased("s1", "AR"), unphased("s2", "AA"));
        final SiteStat stat = classify(samples, new CoreThresholds(0.9, 1.0, minPf, minPn), false, 1, 2).get(1);
        Assert.assertEquals(stat.getCalledCopies(), 3);
        Assert.assertEquals(stat.getAlternateFraction(), 1.0 / 3.0, 1e-12);
        Assert.assertEquals(stat.getAlternateSamples(), 1);
        Assert.assertEquals(stat.getSiteClass(), expected);
    }

    @Test
    public void testMultiAllelicSite() {
        final List<Sample> samples = withReference(reference("A"),
                unphased("s1", "G"), unphased("s2", "T"), unphased("s3", "T"), unphased("s4", "A"));
        final SiteStat stat = classify(samples, new CoreThresholds(0.9, 1.0, 0.0, 0), false, 1, 2, 3, 4).get(0);
        Assert.assertEquals(stat.getAlternates(), Arrays.asList(Nucleotide.G, Nucleotide.T));
        Assert.assertEquals(stat.getAlternate(), Nucleotide.T);
        Assert.assertEquals(stat.getAlternateCopies(), 2);
    }

    @Test
    public void testNoVotingSampleMeansNoCore() {
        final List<Sample> samples = withReference(reference("ACGT"), unphased("s1", "ACGT"));
        final List<SiteStat> stats = classify(samples, new CoreThresholds(0.9, 0.0, 0.0, 0), false);
        for (final SiteStat stat : stats) {
            Assert.assertEquals(stat.getSiteClass(), SiteClass.EXCLUDED);
        }
    }

    @Test
    public void testVotingReference() {
        final List<Sample> samples = withReference(reference("AC"), unphased("s1", "AT"));
        final List<SiteStat> stats = classify(samples, new CoreThresholds(0.9, 1.0, 0.0, 0), false, 0, 1);
        Assert.assertEquals(stats.get(1).getCalledSamples(), 2);
        Assert.assertEquals(stats.get(1).getAlleleCopies(Nucleotide.C), 1);
        Assert.assertEquals(stats.get(1).getSiteClass(), SiteClass.CORE_VARIANT);
    }

    @Test
    public void testColumnQueriesAgreeWithFullClassification() {
        final Random random = new Random(5);
        final List<Sample> samples = withReference(reference(randomSequence(random, 120, 1, 0.05)),
                randomSamples(random, 8, 120, 0.1));
        final SiteClassifier classifier = new SiteClassifier(SequenceCollapser.collapse(samples), 0, allSamples(samples),
                new CoreThresholds(0.6, 0.8, 0.1, 1), false);
        final List<SiteStat> stats = classifier.classify();
        for (int column = 0; column < stats.size(); column++) {
            final SiteStat single = classifier.classifyColumn(column);
            Assert.assertEquals(single.getSiteClass(), stats.get(column).getSiteClass());
            Assert.assertEquals(single.getCalledSamples(), stats.get(column).getCalledSamples());
            Assert.assertEquals(classifier.tallyColumn(column).getCalledSamples(), single.getCalledSamples());
        }
    }

    @Test
    public void testCoreFractionInvariant() {
        final Random random = new Random(11);
        final List<Sample> samples = withReference(reference(randomSequence(random, 150, 1, 0.0)),
                randomSamples(random, 10, 150, 0.15));
        final CoreThresholds thresholds = new CoreThresholds(0.5, 0.7, 0.0, 0);
        for (final SiteStat stat : classify(samples, thresholds, false, allSamples(samples))) {
            Assert.assertEquals(stat.isCore(), stat.getCalledSamples() >= thresholds.minCalledSamples(10),
                    "column " + stat.getColumn());
        }
    }

    @Test(expectedExceptions = UserException.EmptyAlignment.class)
    public void testEmptyAlignment() {
        classify(withReference(reference(""), unphased("s1", "")), new CoreThresholds(0.9, 0.9, 0.0, 0), false, 1);
    }
}
