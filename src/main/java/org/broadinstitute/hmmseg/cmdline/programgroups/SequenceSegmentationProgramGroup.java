package org.broadinstitute.hmmseg.cmdline.programgroups;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;
import org.broadinstitute.hmmseg.utils.help.HelpConstants;

/**
 * Tools that decode hidden-state paths of symbol sequences to find segments such as CpG islands
 */
public final class SequenceSegmentationProgramGroup implements CommandLineProgramGroup {
    @Override
    public String getName() { return HelpConstants.DOC_CAT_SEGMENTATION; }

    @Override
    public String getDescription() { return HelpConstants.DOC_CAT_SEGMENTATION_SUMMARY; }
}
