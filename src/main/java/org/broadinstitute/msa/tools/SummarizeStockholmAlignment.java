package org.broadinstitute.msa.tools;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.barclay.help.DocumentedFeature;
import org.broadinstitute.msa.alignment.AlignedSequence;
import org.broadinstitute.msa.alignment.MultipleSequenceAlignment;
import org.broadinstitute.msa.alignment.SequenceAlphabet;
import org.broadinstitute.msa.cmdline.CommandLineProgram;
import org.broadinstitute.msa.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.msa.cmdline.programgroups.AlignmentProgramGroup;
import org.broadinstitute.msa.codecs.stockholm.GsAnnotationPolicy;
import org.broadinstitute.msa.codecs.stockholm.StockholmReader;
import org.broadinstitute.msa.codecs.stockholm.StockholmReaderOptions;
import org.broadinstitute.msa.codecs.stockholm.StockholmSniffer;
import org.broadinstitute.msa.exceptions.UserException;
import org.broadinstitute.msa.utils.config.ConfigFactory;
import org.broadinstitute.msa.utils.io.PathLineReader;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a Stockholm multiple sequence alignment and prints a tab-separated summary of its content.
 *
 * <h3>Input</h3>
 * <ul>
 *     <li>A Stockholm file, optionally gzipped</li>
 * </ul>
 *
 * <h3>Output</h3>
 * <p>One record per line, first field naming the record kind:</p>
 * <ul>
 *     <li>{@code sequences} and {@code columns} with the alignment dimensions,</li>
 *     <li>{@code #=GF <feature> <text>} for each alignment-wide feature,</li>
 *     <li>{@code #=GC <feature>} for each per-column feature,</li>
 *     <li>{@code sequence <label> <ungapped length>} for each sequence, in input order, followed by its
 *     {@code #=GS <label> <feature> <text>} and {@code #=GR <label> <feature>} records.</li>
 * </ul>
 *
 * <h3>Example Usage</h3>
 * <pre>
 *   msa SummarizeStockholmAlignment \
 *     -I rfam_family.sto \
 *     --alphabet RNA \
 *     -O summary.txt
 * </pre>
 */
@DocumentedFeature
@CommandLineProgramProperties(
        summary = "Reads a Stockholm multiple sequence alignment and writes a tab-separated summary of its sequences " +
                "and annotations to a file or to standard output",
        oneLineSummary = "Summarize a Stockholm alignment",
        programGroup = AlignmentProgramGroup.class
)
public final class SummarizeStockholmAlignment extends CommandLineProgram {

    public static final String FIELD_SEPARATOR = "\t";

    private static final Joiner FIELD_JOINER = Joiner.on(FIELD_SEPARATOR);

    @Argument(
            doc = "Stockholm alignment to summarize.",
            fullName = StandardArgumentDefinitions.INPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.INPUT_SHORT_NAME
    )
    public File input;

    @Argument(
            doc = "File to write the summary to. Standard output is used if not given.",
            fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
            optional = true
    )
    public File output = null;

    @Argument(
            doc = "Alphabet the sequence characters are checked against.",
            fullName = StandardArgumentDefinitions.ALPHABET_LONG_NAME,
            optional = true
    )
    public SequenceAlphabet alphabet = ConfigFactory.getInstance().getStockholmConfig().defaultAlphabet();

    @Argument(
            doc = "How repeated #=GS lines of a sequence are handled.",
            fullName = StandardArgumentDefinitions.GS_POLICY_LONG_NAME,
            optional = true
    )
    public GsAnnotationPolicy gsPolicy = ConfigFactory.getInstance().getStockholmConfig().gsPolicy();

    @Argument(
            doc = "Read the input even if its first line is not the Stockholm signature.",
            fullName = StandardArgumentDefinitions.SKIP_SIGNATURE_CHECK_LONG_NAME,
            optional = true
    )
    public boolean skipSignatureCheck = false;

    @Override
    protected Object doWork() {
        final Path inputPath = input.toPath();
        final MultipleSequenceAlignment alignment;
        try (final PathLineReader reader = new PathLineReader(inputPath)) {
            if (!skipSignatureCheck) {
                checkSignature(reader, inputPath);
            }
            final StockholmReaderOptions options = new StockholmReaderOptions().withGsPolicy(gsPolicy);
            alignment = StockholmReader.forAlignedSequences(alphabet, options).read(reader);
        }
        logger.info(String.format("Read %d sequences over %d columns from %s",
                alignment.getSequenceCount(), alignment.getColumnCount(), inputPath));

        final List<String> summary = summarize(alignment);
        if (output == null) {
            final PrintStream out = System.out;
            summary.forEach(out::println);
        } else {
            writeSummary(summary, output.toPath());
        }
        return alignment;
    }

    private static void checkSignature(final PathLineReader reader, final Path inputPath) {
        final boolean isStockholm;
        try {
            isStockholm = StockholmSniffer.isStockholm(reader);
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(inputPath, e);
        }
        if (!isStockholm) {
            throw new UserException.BadInput(String.format("%s does not start with '%s'. Use --%s to read it anyway.",
                    inputPath, StockholmSniffer.SIGNATURE, StandardArgumentDefinitions.SKIP_SIGNATURE_CHECK_LONG_NAME));
        }
    }

    private static void writeSummary(final List<String> summary, final Path outputPath) {
        try (final BufferedWriter writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
            for (final String line : summary) {
                writer.write(line);
                writer.newLine();
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(outputPath, "the summary could not be written", e);
        }
    }

    @VisibleForTesting
    static List<String> summarize(final MultipleSequenceAlignment alignment) {
        final List<String> lines = new ArrayList<>();
        lines.add(join("sequences", alignment.getSequenceCount()));
        lines.add(join("columns", alignment.getColumnCount()));
        alignment.getMetadata().forEach((feature, value) -> lines.add(join("#=GF", feature, value)));
        alignment.getPositionalMetadata().ifPresent(columnMetadata ->
                columnMetadata.keySet().forEach(feature -> lines.add(join("#=GC", feature))));
        for (final String label : alignment.getIndex()) {
            final AlignedSequence sequence = alignment.getSequence(label);
            lines.add(join("sequence", label, ungappedLength(sequence)));
            sequence.getMetadata().forEach((feature, value) -> lines.add(join("#=GS", label, feature, value)));
            sequence.getPositionalMetadata().keySet().forEach(feature -> lines.add(join("#=GR", label, feature)));
        }
        return lines;
    }

    private static long ungappedLength(final AlignedSequence sequence) {
        return sequence.getCharacters().chars()
                .filter(c -> SequenceAlphabet.GAP_CHARACTERS.indexOf(c) < 0)
                .count();
    }

    private static String join(final Object... fields) {
        return FIELD_JOINER.join(fields);
    }
}
