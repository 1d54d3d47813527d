package org.broadinstitute.hmmseg;

import org.broadinstitute.hmmseg.testutils.CommandLineProgramTester;

import java.io.File;

/**
 * Base class of the tests that run a tool from the command line; the tool is named after the test class.
 */
public abstract class CommandLineProgramTest extends HmmSegBaseTest implements CommandLineProgramTester {

    /**
     * @return the directory holding the test data of the tools
     */
    public static File getTestDataDir() {
        return new File(toolsTestDir);
    }

    @Override
    public String getTestedToolName() {
        return getTestedClassName();
    }
}
