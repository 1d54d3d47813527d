package org.broadinstitute.hmmseg.cmdline;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;

/**
 * Program group for use with internal test CommandLinePrograms only.
 */
public final class TestProgramGroup implements CommandLineProgramGroup {
    @Override
    public String getName() {
        return "Test";
    }

    @Override
    public String getDescription() {
        return "Test program group for internal test CommandLinePrograms";
    }
}
