package org.broadinstitute.msa.codecs.stockholm;

import org.broadinstitute.msa.MSABaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class StockholmLineTypeUnitTest extends MSABaseTest {

    @DataProvider(name = "lines")
    public Object[][] lines() {
        return new Object[][] {
                {"# STOCKHOLM 1.0", StockholmLineType.IGNORABLE},
                {"#=GF ID 5S_rRNA", StockholmLineType.GF},
                {"#=GS seq1 AC P12345", StockholmLineType.GS},
                {"#=GR seq1 SS  HHHH", StockholmLineType.GR},
                {"#=GC SS_cons  <<>>", StockholmLineType.GC},
                {"#=GX unknown markup", StockholmLineType.IGNORABLE},
                {"# free comment", StockholmLineType.IGNORABLE},
                {"#", StockholmLineType.IGNORABLE},
                {"//", StockholmLineType.TERMINATOR},
                {"// trailing text", StockholmLineType.TERMINATOR},
                {"", StockholmLineType.IGNORABLE},
                {"   \t ", StockholmLineType.IGNORABLE},
                {"seq1 ACGU", StockholmLineType.DATA},
                {"seq1", StockholmLineType.DATA},
                {"/single-slash ACGU", StockholmLineType.DATA},
                {" #=GF indented is data", StockholmLineType.DATA},
        };
    }

    @Test(dataProvider = "lines")
    public void testClassify(final String line, final StockholmLineType expected) {
        Assert.assertEquals(StockholmLineType.classify(line), expected);
    }

    @Test
    public void testMarkers() {
        Assert.assertEquals(StockholmLineType.GF.getMarker(), "#=GF");
        Assert.assertEquals(StockholmLineType.GC.getMarker(), "#=GC");
        Assert.assertNull(StockholmLineType.DATA.getMarker());
        Assert.assertTrue(StockholmLineType.GR.isMarkup());
        Assert.assertFalse(StockholmLineType.TERMINATOR.isMarkup());
        Assert.assertFalse(StockholmLineType.IGNORABLE.isMarkup());
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNullLine() {
        StockholmLineType.classify(null);
    }
}
