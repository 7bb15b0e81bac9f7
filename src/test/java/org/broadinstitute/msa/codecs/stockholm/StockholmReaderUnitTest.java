package org.broadinstitute.msa.codecs.stockholm;

import com.google.common.primitives.Chars;
import org.broadinstitute.msa.MSABaseTest;
import org.broadinstitute.msa.alignment.AlignedSequence;
import org.broadinstitute.msa.alignment.MultipleSequenceAlignment;
import org.broadinstitute.msa.alignment.SequenceAlphabet;
import org.broadinstitute.msa.exceptions.StockholmFormatException;
import org.broadinstitute.msa.exceptions.UserException;
import org.broadinstitute.msa.utils.io.PathLineReader;
import org.broadinstitute.msa.utils.io.StringLineReader;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.zip.GZIPOutputStream;

public final class StockholmReaderUnitTest extends MSABaseTest {

    private static final StockholmReaderOptions FIRST_LINE_ONLY =
            new StockholmReaderOptions().withGsPolicy(GsAnnotationPolicy.FIRST_LINE_ONLY);

    private static MultipleSequenceAlignment read(final String text) {
        return StockholmReader.forAlignedSequences(SequenceAlphabet.ANY, FIRST_LINE_ONLY).read(new StringLineReader(text));
    }

    private static String lines(final String... lines) {
        return String.join("\n", lines) + "\n";
    }

    @Test
    public void testSampleAlignment() {
        final MultipleSequenceAlignment alignment = StockholmReader.readAlignment(new File(sampleStockholm).toPath(), SequenceAlphabet.RNA);

        Assert.assertEquals(alignment.getIndex(),
                Arrays.asList("AP001509.1", "AE007476.1", "AF035635.1/619-641", "AF035636.1/2-24"));
        Assert.assertEquals(alignment.getSequenceCount(), 4);
        Assert.assertEquals(alignment.getColumnCount(), 23);
        Assert.assertEquals(alignment.getMetadata().size(), 2);
        Assert.assertEquals(alignment.getMetadata().get("RA"), "Griffiths-Jones SR");
        Assert.assertEquals(alignment.getMetadata().get("RL"), "Nucleic Acids Res 2003;31:439-441");

        final Map<String, ? extends List<Character>> columnMetadata = alignment.getPositionalMetadata().get();
        Assert.assertEquals(columnMetadata.keySet(), Collections.singleton("SS_cons"));
        Assert.assertEquals(columnMetadata.get("SS_cons").size(), 23);
        Assert.assertEquals(columnMetadata.get("SS_cons"), Chars.asList("...<<<<<<.......>>>>>>.".toCharArray()));

        final AlignedSequence last = alignment.getSequence("AF035636.1/2-24");
        Assert.assertEquals(last.getCharacters(), "--GAUUCUCGAUCUCUAAAAU..");
        Assert.assertTrue(last.getMetadata().isEmpty());
        Assert.assertTrue(last.getPositionalMetadata().isEmpty());
    }

    @Test
    public void testAnnotatedAlignment() {
        final MultipleSequenceAlignment alignment = StockholmReader.readAlignment(new File(annotatedStockholm).toPath(), SequenceAlphabet.PROTEIN);

        Assert.assertEquals(alignment.getIndex(), Arrays.asList("seq1", "seq2"));
        Assert.assertEquals(alignment.getMetadata().get("ID"), "example");
        Assert.assertEquals(alignment.getMetadata().get("CC"), "first part second part");

        final AlignedSequence seq1 = alignment.getSequence("seq1");
        Assert.assertEquals(seq1.getMetadata(), Collections.singletonMap("AC", "P12345"));
        Assert.assertEquals(seq1.getPositionalMetadata().get("SS"), Chars.asList("HHHH----".toCharArray()));

        final AlignedSequence seq2 = alignment.getSequence("seq2");
        Assert.assertEquals(seq2.getMetadata(), Collections.singletonMap("AC", "Q67890"));
        Assert.assertEquals(seq2.getPositionalMetadata().keySet(), Collections.singleton("SA"));
        Assert.assertEquals(alignment.getPositionalMetadata().get().get("SS_cons"), Chars.asList("<<....>>".toCharArray()));
    }

    @Test
    public void testAccumulatePolicyKeepsEveryGSLine() {
        final StockholmReaderOptions options = new StockholmReaderOptions().withGsPolicy(GsAnnotationPolicy.ACCUMULATE);
        final MultipleSequenceAlignment alignment;
        try (final PathLineReader reader = new PathLineReader(new File(annotatedStockholm).toPath())) {
            alignment = StockholmReader.forAlignedSequences(SequenceAlphabet.PROTEIN, options).read(reader);
        }
        final Map<String, String> metadata = alignment.getSequence("seq1").getMetadata();
        Assert.assertEquals(metadata.get("AC"), "P12345");
        Assert.assertEquals(metadata.get("DE"), "second annotation");
    }

    @Test
    public void testPaddedMarkupLines() {
        final MultipleSequenceAlignment alignment = read(lines(
                "# STOCKHOLM 1.0",
                "#=GF ID    CBS",
                "#=GF DE    CBS   domain",
                "#=GS Q8Y6M4_LISMO/1-133    AC Q8Y6M4.1",
                "#=GS Q8Y6M4_LISMO/1-133    DE Dropped under the default policy",
                "Q8Y6M4_LISMO/1-133         MKV-LA",
                "//"));

        Assert.assertEquals(alignment.getMetadata().get("ID"), "CBS");
        Assert.assertEquals(alignment.getMetadata().get("DE"), "CBS   domain");
        Assert.assertEquals(alignment.getSequence("Q8Y6M4_LISMO/1-133").getMetadata(),
                Collections.singletonMap("AC", "Q8Y6M4.1"));
    }

    @Test(expectedExceptions = StockholmFormatException.MalformedMarkupLine.class)
    public void testMarkupLineWithoutData() {
        read(lines("s1 AC", "#=GF ID "));
    }

    @Test
    public void testOrderFollowsDataLinesNotMarkup() {
        final MultipleSequenceAlignment alignment = read(lines(
                "# STOCKHOLM 1.0",
                "#=GS c DE third",
                "#=GR b SS ..",
                "#=GS a DE first",
                "c GG",
                "a AA",
                "b CC",
                "//"));
        Assert.assertEquals(alignment.getIndex(), Arrays.asList("c", "a", "b"));
        Assert.assertEquals(alignment.getSequences().get(0).getCharacters(), "GG");
        Assert.assertEquals(alignment.getSequence("a").getMetadata().get("DE"), "first");
    }

    @Test
    public void testGFConcatenation() {
        final MultipleSequenceAlignment alignment = read(lines("#=GF K a", "s1 AC", "#=GF K b"));
        Assert.assertEquals(alignment.getMetadata(), Collections.singletonMap("K", "a b"));
    }

    @Test
    public void testSignatureIsNotRequiredByTheReader() {
        final MultipleSequenceAlignment alignment = read(lines("s1 ACGU", "s2 AC-U"));
        Assert.assertEquals(alignment.getSequenceCount(), 2);
        Assert.assertTrue(alignment.getMetadata().isEmpty());
        Assert.assertFalse(alignment.getPositionalMetadata().isPresent());
    }

    @Test
    public void testLinesAfterTerminatorAreStillRead() {
        final MultipleSequenceAlignment alignment = read(lines("s1 ACGU", "//", "s2 GGGG", "#=GF ID after"));
        Assert.assertEquals(alignment.getIndex(), Arrays.asList("s1", "s2"));
        Assert.assertEquals(alignment.getMetadata().get("ID"), "after");
    }

    @Test
    public void testAbsentMetadataIsPassedAsEmpty() {
        final List<Optional<Map<String, String>>> seenMetadata = new ArrayList<>();
        final List<Optional<Map<String, List<Character>>>> seenPositional = new ArrayList<>();
        final List<Optional<Map<String, List<Character>>>> seenColumn = new ArrayList<>();
        final StockholmReader<String, List<String>> reader = new StockholmReader<>(
                (characters, metadata, positionalMetadata) -> {
                    seenMetadata.add(metadata);
                    seenPositional.add(positionalMetadata);
                    return characters;
                },
                (sequences, metadata, positionalMetadata, index) -> {
                    seenColumn.add(positionalMetadata);
                    return index;
                },
                FIRST_LINE_ONLY);

        final List<String> index = reader.read(new StringLineReader(lines("s1 AC", "s2 GU", "#=GS s2 DE two")));

        Assert.assertEquals(index, Arrays.asList("s1", "s2"));
        Assert.assertEquals(seenMetadata.get(0), Optional.empty());
        Assert.assertEquals(seenMetadata.get(1), Optional.of(Collections.singletonMap("DE", "two")));
        Assert.assertEquals(seenPositional, Arrays.asList(Optional.empty(), Optional.empty()));
        Assert.assertEquals(seenColumn, Collections.singletonList(Optional.empty()));
    }

    @Test
    public void testRereadingIsIdempotent() {
        final StockholmReader<AlignedSequence, MultipleSequenceAlignment> reader =
                StockholmReader.forAlignedSequences(SequenceAlphabet.RNA, FIRST_LINE_ONLY);
        try (final PathLineReader lineReader = new PathLineReader(new File(sampleStockholm).toPath())) {
            final MultipleSequenceAlignment first = reader.read(lineReader);
            final MultipleSequenceAlignment second = reader.read(lineReader);
            Assert.assertEquals(second, first);
        }
        final StringLineReader stringReader = new StringLineReader(lines("#=GF K a", "s1 AC", "#=GF K b"));
        Assert.assertEquals(reader.read(stringReader), reader.read(stringReader));
    }

    @Test
    public void testGzippedInput() throws IOException {
        final Path gzipped = createTempFile("sample", ".sto.gz").toPath();
        try (final OutputStream out = new GZIPOutputStream(Files.newOutputStream(gzipped))) {
            out.write(Files.readAllBytes(new File(sampleStockholm).toPath()));
        }
        final MultipleSequenceAlignment expected = StockholmReader.readAlignment(new File(sampleStockholm).toPath(), SequenceAlphabet.RNA);
        Assert.assertEquals(StockholmReader.readAlignment(gzipped, SequenceAlphabet.RNA), expected);
    }

    @Test
    public void testUnknownLabelFailsEvenIfNamedAgainLater() {
        try {
            StockholmReader.readAlignment(new File(stockholmTestDir, "undeclared_reference.sto").toPath(), SequenceAlphabet.RNA);
            Assert.fail("markup naming a sequence without a data line must fail");
        } catch (final StockholmFormatException.UndeclaredSequenceReference e) {
            assertContains(e.getMessage(), "undeclared_reference.sto");
            assertContains(e.getMessage(), "Markup line references nonexistent data 'seq3'");
            assertContains(e.getMessage(), "line 4");
        }
    }

    @Test
    public void testMarkupMayPrecedeItsDataLine() {
        final MultipleSequenceAlignment alignment = read(lines("#=GR s1 SS <>", "#=GS s1 DE early", "s1 AC"));
        Assert.assertEquals(alignment.getSequence("s1").getMetadata().get("DE"), "early");
        Assert.assertEquals(alignment.getSequence("s1").getPositionalMetadata().get("SS"), Arrays.asList('<', '>'));
    }

    @Test(expectedExceptions = StockholmFormatException.UndeclaredSequenceReference.class)
    public void testGSForUnknownLabel() {
        read(lines("s1 AC", "#=GS s2 DE missing"));
    }

    @Test(expectedExceptions = StockholmFormatException.DuplicateColumnFeature.class)
    public void testDuplicateGC() {
        read(lines("s1 AC", "#=GC SS_cons <>", "#=GC SS_cons .."));
    }

    @Test(expectedExceptions = StockholmFormatException.DuplicateSequenceLabel.class)
    public void testDuplicateDataLabel() {
        read(lines("s1 AC", "s2 GU", "s1 AC"));
    }

    @Test(expectedExceptions = StockholmFormatException.DuplicateSequenceColumnFeature.class)
    public void testDuplicateGR() {
        read(lines("s1 AC", "#=GR s1 SS ..", "#=GR s1 SS <>"));
    }

    @Test
    public void testEmptyAlignment() {
        try {
            StockholmReader.readAlignment(new File(stockholmTestDir, "no_data.sto").toPath(), SequenceAlphabet.ANY);
            Assert.fail("an input without data lines must fail");
        } catch (final StockholmFormatException.EmptyAlignment e) {
            assertContains(e.getMessage(), "No data present in file");
            assertContains(e.getMessage(), "no_data.sto");
        }
    }

    @Test(expectedExceptions = StockholmFormatException.EmptyAlignment.class)
    public void testEmptyInput() {
        read("");
    }

    @Test
    public void testSourceNameOption() {
        final StockholmReaderOptions options = FIRST_LINE_ONLY.withSourceName("family.sto");
        try {
            StockholmReader.forAlignedSequences(SequenceAlphabet.ANY, options).read(new StringLineReader("s1 AC\ns1 AC\n", "ignored"));
            Assert.fail("expected a duplicate label");
        } catch (final StockholmFormatException.DuplicateSequenceLabel e) {
            assertContains(e.getMessage(), "'family.sto'");
            Assert.assertFalse(e.getMessage().contains("ignored"));
        }
    }

    @Test
    public void testUnequalLengthsAreRejectedByTheAlignment() {
        try {
            read(lines("s1 ACGU", "s2 AC"));
            Assert.fail("sequences of different lengths must not form an alignment");
        } catch (final UserException.BadInput e) {
            assertContains(e.getMessage(), "sequence 's2' has length 2 but the alignment has 4 columns");
        }
    }

    @Test
    public void testInvalidCharactersAreRejectedByTheSequence() {
        try {
            StockholmReader.forAlignedSequences(SequenceAlphabet.DNA, FIRST_LINE_ONLY).read(new StringLineReader(lines("s1 ACGT", "s2 ACGU")));
            Assert.fail("U is not a DNA symbol");
        } catch (final UserException.BadInput e) {
            assertContains(e.getMessage(), "invalid sequence 's2'");
            assertContains(e.getMessage(), "invalid character 'U' at position 4");
        }
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testColumnAnnotationLengthMismatch() {
        read(lines("s1 ACGU", "#=GC SS_cons <>"));
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testSequenceAnnotationLengthMismatch() {
        read(lines("s1 ACGU", "#=GR s1 SS <>"));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNullReader() {
        StockholmReader.forAlignedSequences(SequenceAlphabet.ANY, FIRST_LINE_ONLY).read(null);
    }
}
