package org.polycore.cmdline.programgroups;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;

/**
 * Tools that find and measure the core genome of aligned polyploid samples.
 */
public final class CoreGenomeProgramGroup implements CommandLineProgramGroup {
    public static final String NAME = "Core Genome Analysis";
    public static final String SUMMARY = "Tools that classify core sites of aligned samples of any ploidy and measure the variation inside the core";

    @Override
    public String getName() { return NAME; }
    @Override
    public String getDescription() { return SUMMARY; }
}
