package org.broadinstitute.hmmseg.cmdline;

/**
 * A set of String constants in which the name of the constant (minus the _SHORT_NAME suffix)
 * is the standard long Option name, and the value of the constant is the standard shortName.
 */
public final class StandardArgumentDefinitions {

    private StandardArgumentDefinitions(){}

    public static final String INPUT_LONG_NAME = "input";
    public static final String OUTPUT_LONG_NAME = "output";
    public static final String MODEL_LONG_NAME = "model";
    public static final String VERBOSITY_NAME = "verbosity";

    public static final String INPUT_SHORT_NAME = "I";
    public static final String OUTPUT_SHORT_NAME = "O";
    public static final String MODEL_SHORT_NAME = "M";

    /**
     * The option specifying a main configuration file.
     * This is parsed out in {@link org.broadinstitute.hmmseg.Main} before the tool is created.
     */
    public static final String HMMSEG_CONFIG_FILE_OPTION = "hmmseg-config-file";

    public static final String QUIET_NAME = "QUIET";
}
