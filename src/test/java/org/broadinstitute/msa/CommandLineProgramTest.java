package org.broadinstitute.msa;

import org.broadinstitute.msa.testutils.CommandLineProgramTester;

/**
 * Utility class for command line program testing.
 */
public abstract class CommandLineProgramTest extends MSABaseTest implements CommandLineProgramTester {

    @Override
    public String getTestedToolName() {
        return getTestedClassName();
    }
}
