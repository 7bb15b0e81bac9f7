package org.broadinstitute.msa.cmdline.programgroups;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;

/**
 * Program group for tools that work on multiple sequence alignments
 */
public class AlignmentProgramGroup implements CommandLineProgramGroup {
    public static final String NAME = "Multiple Sequence Alignment";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Tools that read, inspect and summarize multiple sequence alignments";
    }
}
