package org.broadinstitute.msa.codecs.stockholm;

import org.broadinstitute.msa.MSABaseTest;
import org.broadinstitute.msa.utils.io.StringLineReader;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;

public final class StockholmSnifferUnitTest extends MSABaseTest {

    @DataProvider(name = "inputs")
    public Object[][] inputs() {
        return new Object[][] {
                {"# STOCKHOLM 1.0\nseq1 ACGU\n//\n", true},
                {"# STOCKHOLM 1.0", true},
                {"# STOCKHOLM 1.0 with trailing text\n", true},
                {"# STOCKHOLM 1.01\n", true},
                {"# STOCKHOLM 1.\n", false},
                {"# STOCKHOLM\n", false},
                {"# stockholm 1.0\n", false},
                {" # STOCKHOLM 1.0\n", false},
                {"#STOCKHOLM 1.0\n", false},
                {"\n# STOCKHOLM 1.0\n", false},
                {">seq1\nACGT\n", false},
                {"", false},
        };
    }

    @Test(dataProvider = "inputs")
    public void testIsStockholm(final String text, final boolean expected) throws IOException {
        Assert.assertEquals(StockholmSniffer.isStockholm(new StringLineReader(text)), expected);
    }

    @Test
    public void testReadsOnlyFirstLine() throws IOException {
        final StringLineReader reader = new StringLineReader("# STOCKHOLM 1.0\nseq1 ACGU\n");
        Assert.assertTrue(StockholmSniffer.isStockholm(reader));
        Assert.assertEquals(reader.getLineNumber(), 1);
        Assert.assertEquals(reader.readLine(), "seq1 ACGU");
    }

    @Test
    public void testStartsWithSignature() {
        Assert.assertTrue(StockholmSniffer.startsWithSignature(StockholmSniffer.SIGNATURE));
        Assert.assertFalse(StockholmSniffer.startsWithSignature(null));
        Assert.assertFalse(StockholmSniffer.startsWithSignature(""));
    }

    @Test
    public void testCanDecode() {
        Assert.assertTrue(StockholmSniffer.canDecode(new File(sampleStockholm).toPath()));
        Assert.assertFalse(StockholmSniffer.canDecode(new File(stockholmTestDir, "not_stockholm.fasta").toPath()));
    }

    @Test
    public void testCanDecodeTrapsErrors() {
        final Path missing = getSafeNonExistentFile("missing.sto").toPath();
        Assert.assertFalse(StockholmSniffer.canDecode(missing));
        Assert.assertFalse(StockholmSniffer.canDecode(createTempDir("sniffer").toPath()));
        Assert.assertFalse(StockholmSniffer.canDecode(null));
    }
}
