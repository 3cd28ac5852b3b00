package org.polycore.tools.core;

import org.polycore.PolyCoreBaseTest;
import org.polycore.utils.Nucleotide;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;

public class ExpandedAlignmentUnitTest extends PolyCoreBaseTest {

    private static ExpandedAlignment expand(final List<Sample> samples, final CoreThresholds thresholds) {
        final CollapsedAlignment collapsed = SequenceCollapser.collapse(samples);
        final int[] voting = IntStream.range(1, samples.size()).toArray();
        final List<SiteStat> stats = new SiteClassifier(collapsed, 0, voting, thresholds, false).classify();
        return new ExpandedAlignment(collapsed, stats, thresholds);
    }

    private static int[] allColumns(final ExpandedAlignment alignment) {
        return IntStream.range(0, alignment.getCollapsedAlignment().length()).toArray();
    }

    private static String string(final byte[] row) {
        return new String(row, StandardCharsets.US_ASCII);
    }

    @Test
    public void testSampleRowReproducesUnphasedInput() {
        final ExpandedAlignment alignment = expand(withReference(reference("ACGTA"),
                unphased("s1", "ARYN-"), unphased("s2", "BCGTA"), unphased("s3", "ACGTA")), new CoreThresholds(0.5, 0.5, 0.0, 0));
        final int[] columns = allColumns(alignment);
        Assert.assertEquals(string(alignment.sampleRow(1, columns)), "ARYN-");
        Assert.assertEquals(string(alignment.sampleRow(2, columns)), "BCGTA");
        Assert.assertEquals(string(alignment.sampleRow(3, columns)), "ACGTA");
        Assert.assertEquals(string(alignment.sampleRow(1, new int[]{4, 1})), "-R");
    }

    @Test
    public void testSampleRowOfPhasedCopies() {
        final ExpandedAlignment alignment = expand(withReference(reference("ACGT"),
                phased("s1", "ACGN", "AGGT")), new CoreThresholds(0.5, 0.5, 0.0, 0));
        Assert.assertEquals(string(alignment.sampleRow(1, allColumns(alignment))), "ASGT");
        Assert.assertEquals(string(alignment.copyRow(1, 1, new int[]{1, 3})), "GT");
        Assert.assertEquals(alignment.symbol(1, 0, 3), (byte) 'N');
    }

    @Test
    public void testGenotypeAndCalledState() {
        final List<Sample> samples = withReference(reference("AAA"), phased("s1", "ANA", "GAN"), unphased("s2", "AAA"));

        final ExpandedAlignment lenient = expand(samples, new CoreThresholds(0.5, 0.5, 0.0, 0));
        Assert.assertEquals(lenient.genotype(1, 0), new Nucleotide[]{Nucleotide.A, Nucleotide.G});
        Assert.assertEquals(lenient.genotype(1, 1), new Nucleotide[]{null, Nucleotide.A});
        Assert.assertTrue(lenient.isCalled(1, 1));

        final ExpandedAlignment strict = expand(samples, new CoreThresholds(1.0, 0.5, 0.0, 0));
        Assert.assertEquals(strict.genotype(1, 1), new Nucleotide[]{null, null});
        Assert.assertFalse(strict.isCalled(1, 1));
        Assert.assertTrue(strict.isCalled(1, 0));
    }

    @Test
    public void testSiteListsAreCopies() {
        final ExpandedAlignment alignment = expand(withReference(reference("AAC"),
                unphased("s1", "AAC"), unphased("s2", "ATC")), new CoreThresholds(0.9, 1.0, 0.0, 0));
        Assert.assertEquals(alignment.getCoreSites(), new int[]{0, 1, 2});
        Assert.assertEquals(alignment.getVariantSites(), new int[]{1});
        alignment.getCoreSites()[0] = 42;
        Assert.assertEquals(alignment.getCoreSites()[0], 0);
        Assert.assertEquals(alignment.getSiteStat(1).getAlternate(), Nucleotide.T);
    }

    @Test
    public void testFillChunk() {
        // s1 diploid, s2 haploid; with min-gf 1.0 s1 is not called where a copy is missing
        final ExpandedAlignment alignment = expand(withReference(reference("ACGT"),
                phased("s1", "ACGT", "ANTT"), unphased("s2", "TCGA")), new CoreThresholds(1.0, 0.0, 0.0, 0));
        final int[] columns = {0, 1, 2, 3};
        final int width = 3;
        final byte[] symbols = new byte[3 * width];
        final byte[] counts = new byte[4 * 2 * width];
        alignment.fillChunk(new int[]{1, 2}, columns, 1, 4, symbols, counts);

        Assert.assertEquals(string(Arrays.copyOfRange(symbols, 0, 3)), "CGT");
        Assert.assertEquals(string(Arrays.copyOfRange(symbols, 3, 6)), "NTT");
        Assert.assertEquals(string(Arrays.copyOfRange(symbols, 6, 9)), "CGA");

        // s1: column 1 uncalled, column 2 G/T, column 3 T/T
        Assert.assertEquals(Arrays.copyOfRange(counts, 0, 4), new byte[]{0, 0, 0, 0});
        Assert.assertEquals(Arrays.copyOfRange(counts, 4, 8), new byte[]{0, 0, 1, 1});
        Assert.assertEquals(Arrays.copyOfRange(counts, 8, 12), new byte[]{0, 0, 0, 2});
        // s2: C, G, A
        Assert.assertEquals(Arrays.copyOfRange(counts, 12, 16), new byte[]{0, 1, 0, 0});
        Assert.assertEquals(Arrays.copyOfRange(counts, 16, 20), new byte[]{0, 0, 1, 0});
        Assert.assertEquals(Arrays.copyOfRange(counts, 20, 24), new byte[]{1, 0, 0, 0});
    }

    @Test
    public void testExpandGroupValues() {
        final ExpandedAlignment alignment = expand(withReference(reference("ACGT"),
                unphased("s1", "ACGT"), phased("s2", "ACGT", "ANNT")), new CoreThresholds(0.5, 0.5, 0.0, 0));
        final CollapsedAlignment collapsed = alignment.getCollapsedAlignment();
        final List<List<Integer>> missing = alignment.expandGroupValues(g -> collapsed.getGroup(g).getMissingCount());
        Assert.assertEquals(missing, Arrays.asList(Arrays.asList(0), Arrays.asList(0), Arrays.asList(0, 2)));
        final List<List<Integer>> ids = alignment.expandGroupValues(g -> g);
        Assert.assertEquals(ids.get(2), Arrays.asList(0, 1));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testStatsMustCoverEveryColumn() {
        final List<Sample> samples = withReference(reference("AC"), unphased("s1", "AC"));
        final CollapsedAlignment collapsed = SequenceCollapser.collapse(samples);
        final CoreThresholds thresholds = new CoreThresholds(0.5, 0.5, 0.0, 0);
        final List<SiteStat> stats = new SiteClassifier(collapsed, 0, new int[]{1}, thresholds, false).classify();
        new ExpandedAlignment(collapsed, stats.subList(0, 1), thresholds);
    }
}
