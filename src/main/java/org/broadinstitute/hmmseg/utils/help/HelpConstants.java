package org.broadinstitute.hmmseg.utils.help;

/**
 * Names and summaries shared by the command-line usage output.
 */
public final class HelpConstants {

    private HelpConstants() {}

    public final static String DOC_CAT_SEGMENTATION = "Sequence Segmentation";
    public final static String DOC_CAT_SEGMENTATION_SUMMARY = "Tools that decode hidden state paths of sequences and report segments of interest";
}
