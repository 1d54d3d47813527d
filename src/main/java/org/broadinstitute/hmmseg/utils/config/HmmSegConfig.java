package org.broadinstitute.hmmseg.utils.config;

import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Config.LoadPolicy;
import org.aeonbits.owner.Config.LoadType;
import org.aeonbits.owner.Config.Sources;
import org.aeonbits.owner.Mutable;

/**
 * Settings of hmmseg, merged from the first source that defines each key:
 * <ol>
 *     <li>the file named by the {@value #CONFIG_FILE_VARIABLE_FILE_NAME} variable (set by {@code --hmmseg-config-file})</li>
 *     <li>{@code HmmSegConfig.properties} in the working directory</li>
 *     <li>the {@code HmmSegConfig.properties} bundled on the class path</li>
 *     <li>the {@code @DefaultValue} below</li>
 * </ol>
 */
@LoadPolicy(LoadType.MERGE)
@Sources({
        "file:${" + HmmSegConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
        "file:HmmSegConfig.properties",
        "classpath:org/broadinstitute/hmmseg/utils/config/HmmSegConfig.properties"
})
public interface HmmSegConfig extends Mutable, Accessible {

    /**
     * Path variable of the user configuration file.
     */
    String CONFIG_FILE_VARIABLE_FILE_NAME = "HmmSegConfig.pathToHmmSegConfig";

    // Errors

    /**
     * Print the stack trace of user errors as well as their message.
     */
    @SystemProperty
    @Key("hmmseg_stacktrace_on_user_exception")
    @DefaultValue("false")
    boolean hmmseg_stacktrace_on_user_exception();

    // Decoding

    /**
     * Number of positions between two progress messages of the Viterbi table fill (logged at DEBUG).
     * A value of 0 or less turns progress messages off.
     */
    @Key("viterbi_progress_log_interval")
    @DefaultValue("100000")
    int viterbi_progress_log_interval();

    // Input

    /**
     * Sequence file lines starting with this prefix are skipped (e.g. FASTA headers).
     */
    @Key("sequence_line_comment_prefix")
    @DefaultValue(">")
    String sequence_line_comment_prefix();
}
