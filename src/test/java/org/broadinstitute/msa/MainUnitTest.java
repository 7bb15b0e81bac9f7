package org.broadinstitute.msa;

import org.broadinstitute.msa.alignment.MultipleSequenceAlignment;
import org.broadinstitute.msa.exceptions.UserException;
import org.broadinstitute.msa.tools.SummarizeStockholmAlignment;
import org.testng.Assert;
import org.testng.annotations.Test;

public final class MainUnitTest extends MSABaseTest {

    @Test
    public void testListsProgramsWithoutArguments() {
        final String stdout = captureStdout(() -> Assert.assertNull(new Main().instanceMain(new String[0])));
        assertContains(stdout, "USAGE: msa <program name>");
        assertContains(stdout, SummarizeStockholmAlignment.class.getSimpleName());
    }

    @Test
    public void testHelp() {
        final String stdout = captureStdout(() -> Assert.assertNull(new Main().instanceMain(new String[]{"--help"})));
        assertContains(stdout, "Summarize a Stockholm alignment");
    }

    @Test
    public void testUnknownProgram() {
        final String stderr = captureStderr(() -> {
            try {
                new Main().instanceMain(new String[]{"NoSuchTool"});
                Assert.fail("an unknown program name must be rejected");
            } catch (final UserException e) {
                assertContains(e.getMessage(), "'NoSuchTool' is not a valid command");
            }
        });
        assertContains(stderr, "Available Programs");
    }

    @Test
    public void testRunsProgramByName() {
        final Object result = new Main().instanceMain(new String[]{
                SummarizeStockholmAlignment.class.getSimpleName(),
                "-I", sampleStockholm,
                "-O", createTempFile("summary", ".txt").getAbsolutePath(),
                "--alphabet", "RNA",
                "--verbosity", "ERROR"});
        Assert.assertEquals(((MultipleSequenceAlignment) result).getColumnCount(), 23);
    }
}
