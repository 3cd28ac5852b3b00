package org.polycore.tools.core.formats;

import htsjdk.samtools.SAMSequenceDictionary;
import htsjdk.samtools.SAMSequenceRecord;
import htsjdk.samtools.util.RuntimeIOException;
import htsjdk.tribble.TribbleException;
import htsjdk.variant.variantcontext.Allele;
import htsjdk.variant.variantcontext.Genotype;
import htsjdk.variant.variantcontext.GenotypeBuilder;
import htsjdk.variant.variantcontext.VariantContext;
import htsjdk.variant.variantcontext.VariantContextBuilder;
import htsjdk.variant.variantcontext.writer.VariantContextWriter;
import htsjdk.variant.variantcontext.writer.VariantContextWriterBuilder;
import htsjdk.variant.vcf.VCFConstants;
import htsjdk.variant.vcf.VCFHeader;
import htsjdk.variant.vcf.VCFHeaderLine;
import htsjdk.variant.vcf.VCFHeaderLineType;
import htsjdk.variant.vcf.VCFInfoHeaderLine;
import htsjdk.variant.vcf.VCFStandardHeaderLines;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.polycore.exceptions.UserException;
import org.polycore.tools.core.ExpandedAlignment;
import org.polycore.tools.core.Sample;
import org.polycore.tools.core.SiteStat;
import org.polycore.utils.Nucleotide;
import org.polycore.utils.Utils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes the core variant sites as VCF, one record per site and one genotype per voting sample.
 *
 * <p>CHROM is the name of the first reference record and POS the 1-based alignment column. Genotypes have one
 * allele per copy; missing copies and samples that are not called at the site are no-calls. Genotypes of samples
 * loaded as phased copies are phased.</p>
 */
public final class CoreVariantVcfWriter {
    private static final Logger logger = LogManager.getLogger(CoreVariantVcfWriter.class);

    public static final String SOURCE = "PolyCore";
    public static final String CORE_FRACTION_KEY = "CF";
    public static final String GENOME_FRACTION_KEY = "GF";

    public static Set<VCFHeaderLine> headerLines() {
        final Set<VCFHeaderLine> lines = new LinkedHashSet<>();
        lines.add(new VCFHeaderLine("source", SOURCE));
        lines.add(VCFStandardHeaderLines.getFormatLine(VCFConstants.GENOTYPE_KEY));
        lines.add(VCFStandardHeaderLines.getInfoLine(VCFConstants.ALLELE_FREQUENCY_KEY));
        lines.add(VCFStandardHeaderLines.getInfoLine(VCFConstants.ALLELE_COUNT_KEY));
        lines.add(VCFStandardHeaderLines.getInfoLine(VCFConstants.ALLELE_NUMBER_KEY));
        lines.add(new VCFInfoHeaderLine(VCFConstants.SAMPLE_NUMBER_KEY, 1, VCFHeaderLineType.Integer,
                "Number of samples called at the site"));
        lines.add(new VCFInfoHeaderLine(CORE_FRACTION_KEY, 1, VCFHeaderLineType.Float,
                "Fraction of voting samples called at the site"));
        lines.add(new VCFInfoHeaderLine(GENOME_FRACTION_KEY, 1, VCFHeaderLineType.Float,
                "Fraction of non-missing allele copies of the voting samples at the site"));
        return lines;
    }

    /**
     * @param samples sample indexes of the genotype columns, in output order
     */
    public void write(final Path output, final ExpandedAlignment alignment, final int[] samples) {
        Utils.nonNull(output);
        Utils.nonNull(alignment);
        final Sample reference = alignment.getCollapsedAlignment().getSample(0);
        final List<String> sampleNames = new ArrayList<>(samples.length);
        for (final int sample : samples) {
            sampleNames.add(alignment.getCollapsedAlignment().getSample(sample).getId());
        }
        final VCFHeader header = new VCFHeader(headerLines(), sampleNames);
        header.setSequenceDictionary(new SAMSequenceDictionary(Collections.singletonList(
                new SAMSequenceRecord(reference.getContig(), reference.length()))));

        final int[] variantSites = alignment.getVariantSites();
        try (final VariantContextWriter writer = new VariantContextWriterBuilder()
                .clearOptions()
                .setOutputPath(output)
                .setOutputFileType(VariantContextWriterBuilder.OutputType.VCF)
                .build()) {
            writer.writeHeader(header);
            for (final int column : variantSites) {
                writer.add(toVariantContext(alignment, samples, reference.getContig(), column));
            }
        } catch (final TribbleException | RuntimeIOException e) {
            throw new UserException.CouldNotCreateOutputFile(output, e);
        }
        logger.info(String.format("Saved file -> %s (%,d variant sites, %d samples)", output.getFileName(), variantSites.length, samples.length));
    }

    static VariantContext toVariantContext(final ExpandedAlignment alignment, final int[] samples,
                                           final String contig, final int column) {
        final SiteStat stat = alignment.getSiteStat(column);
        final Allele[] alleleByRank = new Allele[Nucleotide.NUMBER_OF_ALLELES];
        final List<Allele> alleles = new ArrayList<>(1 + stat.getAlternates().size());
        final Allele ref = Allele.create(stat.getRef().encodeAsByte(), true);
        alleles.add(ref);
        alleleByRank[Nucleotide.STANDARD_BASES.indexOf(stat.getRef())] = ref;

        final List<Integer> counts = new ArrayList<>(stat.getAlternates().size());
        final List<Double> frequencies = new ArrayList<>(stat.getAlternates().size());
        for (final Nucleotide alternate : stat.getAlternates()) {
            final Allele allele = Allele.create(alternate.encodeAsByte(), false);
            alleles.add(allele);
            alleleByRank[Nucleotide.STANDARD_BASES.indexOf(alternate)] = allele;
            counts.add(stat.getAlleleCopies(alternate));
            frequencies.add(stat.getCalledCopies() == 0 ? 0.0 : stat.getAlleleCopies(alternate) / (double) stat.getCalledCopies());
        }

        final List<Genotype> genotypes = new ArrayList<>(samples.length);
        for (final int sample : samples) {
            final Sample s = alignment.getCollapsedAlignment().getSample(sample);
            final Nucleotide[] calls = alignment.genotype(sample, column);
            final Allele[] gt = new Allele[calls.length];
            for (int copy = 0; copy < calls.length; copy++) {
                gt[copy] = calls[copy] == null ? Allele.NO_CALL : alleleByRank[Nucleotide.STANDARD_BASES.indexOf(calls[copy])];
            }
            genotypes.add(new GenotypeBuilder(s.getId(), Arrays.asList(gt)).phased(s.isPhased()).make());
        }

        return new VariantContextBuilder(SOURCE, contig, column + 1, column + 1, alleles)
                .genotypes(genotypes)
                .attribute(VCFConstants.ALLELE_FREQUENCY_KEY, frequencies)
                .attribute(VCFConstants.ALLELE_COUNT_KEY, counts)
                .attribute(VCFConstants.ALLELE_NUMBER_KEY, (int) stat.getCalledCopies())
                .attribute(VCFConstants.SAMPLE_NUMBER_KEY, stat.getCalledSamples())
                .attribute(CORE_FRACTION_KEY, stat.getCoreFraction())
                .attribute(GENOME_FRACTION_KEY, stat.getGenomeFraction())
                .make();
    }
}
