package org.broadinstitute.msa.codecs.stockholm;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.msa.alignment.AlignedSequence;
import org.broadinstitute.msa.alignment.AlignmentFactory;
import org.broadinstitute.msa.alignment.MultipleSequenceAlignment;
import org.broadinstitute.msa.alignment.SequenceAlphabet;
import org.broadinstitute.msa.alignment.SequenceFactory;
import org.broadinstitute.msa.exceptions.MSAException;
import org.broadinstitute.msa.exceptions.StockholmFormatException;
import org.broadinstitute.msa.exceptions.UserException;
import org.broadinstitute.msa.utils.Utils;
import org.broadinstitute.msa.utils.io.PathLineReader;
import org.broadinstitute.msa.utils.io.RewindableLineReader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Reads a Stockholm-format multiple sequence alignment.
 * <h3>Format description</h3>
 * <p>
 * Data lines carry a sequence name followed by its aligned characters. Markup lines annotate the alignment:
 * <ul>
 *     <li>{@code #=GF <feature> <text>}: the alignment as a whole,</li>
 *     <li>{@code #=GS <seqname> <feature> <text>}: one sequence,</li>
 *     <li>{@code #=GR <seqname> <feature> <column chars>}: one sequence, column by column,</li>
 *     <li>{@code #=GC <feature> <column chars>}: all sequences, column by column.</li>
 * </ul>
 * Other lines starting with {@code #}, blank lines and the {@code //} terminator are ignored.
 * </p>
 * <h3>Reading</h3>
 * <p>
 * The input is read twice. The first pass collects one record per data line, in line order; the second pass
 * applies markup to the records collected. Markup may therefore precede the data it annotates, but it can only
 * name sequences that have a data line somewhere in the input. Each sequence is then built with the
 * {@link SequenceFactory} and the whole alignment with the {@link AlignmentFactory}.
 * </p>
 * <p>
 * Any structural problem aborts the read with a {@link StockholmFormatException}; there are no partial results.
 * A reader instance holds no per-read state and can be reused.
 * </p>
 *
 * @param <S> sequence type.
 * @param <A> alignment type.
 */
public final class StockholmReader<S, A> {

    private static final Logger logger = LogManager.getLogger(StockholmReader.class);

    /**
     * Stages of a single read, in order.
     */
    enum State {
        SCANNING_DATA,
        SCANNING_MARKUP,
        ASSEMBLING,
        DONE
    }

    private final SequenceFactory<S> sequenceFactory;

    private final AlignmentFactory<S, A> alignmentFactory;

    private final StockholmReaderOptions options;

    public StockholmReader(final SequenceFactory<S> sequenceFactory, final AlignmentFactory<S, A> alignmentFactory) {
        this(sequenceFactory, alignmentFactory, new StockholmReaderOptions());
    }

    public StockholmReader(final SequenceFactory<S> sequenceFactory,
                           final AlignmentFactory<S, A> alignmentFactory,
                           final StockholmReaderOptions options) {
        this.sequenceFactory = Utils.nonNull(sequenceFactory, "the sequence factory cannot be null");
        this.alignmentFactory = Utils.nonNull(alignmentFactory, "the alignment factory cannot be null");
        this.options = Utils.nonNull(options, "the options cannot be null");
    }

    /**
     * A reader producing {@link MultipleSequenceAlignment}s whose characters are checked against {@code alphabet}.
     */
    public static StockholmReader<AlignedSequence, MultipleSequenceAlignment> forAlignedSequences(
            final SequenceAlphabet alphabet, final StockholmReaderOptions options) {
        return new StockholmReader<>(AlignedSequence.factory(alphabet), MultipleSequenceAlignment.factory(), options);
    }

    /**
     * Reads a file (optionally gzipped) into a {@link MultipleSequenceAlignment}.
     */
    public static MultipleSequenceAlignment readAlignment(final Path path, final SequenceAlphabet alphabet) {
        try (final PathLineReader reader = new PathLineReader(path)) {
            return forAlignedSequences(alphabet, new StockholmReaderOptions()).read(reader);
        }
    }

    /**
     * Reads the whole input. The reader is rewound before each pass, so it can be at any position on entry; it is
     * left at the end of the input and is not closed.
     *
     * @throws StockholmFormatException if the input breaks a structural rule.
     * @throws UserException.CouldNotReadInputFile if the input cannot be read or rewound.
     * @throws UserException.BadInput if a sequence or the alignment as a whole is rejected by the factories.
     */
    public A read(final RewindableLineReader reader) {
        Utils.nonNull(reader, "the line reader cannot be null");
        final String sourceName = options.getSourceName() != null ? options.getSourceName() : reader.getSourceName();
        final ParseSession session = new ParseSession(sourceName, options.getGsPolicy());
        final StockholmLineParser lineParser = new StockholmLineParser(session);

        A result = null;
        State state = State.SCANNING_DATA;
        while (state != State.DONE) {
            switch (state) {
                case SCANNING_DATA:
                    scan(reader, sourceName, StockholmLineType.DATA, lineParser::parseDataLine);
                    logger.debug("Found {} sequences in {}", session.getRecordCount(), describe(sourceName));
                    state = State.SCANNING_MARKUP;
                    break;
                case SCANNING_MARKUP:
                    scan(reader, sourceName, null, lineParser::parseMarkupLine);
                    logger.debug("Found {} alignment features and {} column features in {}",
                            session.getMetadata().size(), session.getColumnMetadata().size(), describe(sourceName));
                    if (session.getDroppedGsLineCount() > 0) {
                        logger.debug("Dropped {} #=GS lines in {}", session.getDroppedGsLineCount(), describe(sourceName));
                    }
                    state = State.ASSEMBLING;
                    break;
                case ASSEMBLING:
                    result = assemble(session);
                    state = State.DONE;
                    break;
                default:
                    throw new MSAException.ShouldNeverReachHereException("unexpected reader state " + state);
            }
        }
        return result;
    }

    /**
     * Rewinds and feeds lines to {@code handler}: only lines of {@code type}, or every markup line if it is
     * {@code null}.
     */
    private static void scan(final RewindableLineReader reader, final String sourceName,
                             final StockholmLineType type, final Consumer<StockholmLine> handler) {
        try {
            reader.rewind();
            String text;
            while ((text = reader.readLine()) != null) {
                final StockholmLine line = new StockholmLine(sourceName, reader.getLineNumber(), text);
                if (type == null ? line.getType().isMarkup() : line.getType() == type) {
                    handler.accept(line);
                }
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(describe(sourceName), e.getMessage(), e);
        }
    }

    private A assemble(final ParseSession session) {
        if (session.getRecordCount() == 0) {
            throw new StockholmFormatException.EmptyAlignment(session.getSourceName());
        }
        final List<S> sequences = new ArrayList<>(session.getRecordCount());
        for (final SequenceRecord record : session.getRecords()) {
            final Optional<Map<String, String>> metadata = presentIfNotEmpty(record.getMetadata());
            final Optional<Map<String, List<Character>>> positionalMetadata = presentIfNotEmpty(record.getPositionalMetadata());
            try {
                sequences.add(sequenceFactory.create(record.getCharacters(), metadata, positionalMetadata));
            } catch (final IllegalArgumentException e) {
                throw new UserException.BadInput(String.format("invalid sequence '%s' in %s: %s",
                        record.getLabel(), describe(session.getSourceName()), e.getMessage()), e);
            }
        }
        try {
            return alignmentFactory.create(
                    sequences,
                    Collections.unmodifiableMap(new LinkedHashMap<>(session.getMetadata())),
                    presentIfNotEmpty(session.getColumnMetadata()),
                    session.getLabels());
        } catch (final IllegalArgumentException e) {
            throw new UserException.BadInput(String.format("invalid alignment in %s: %s",
                    describe(session.getSourceName()), e.getMessage()), e);
        }
    }

    /**
     * Absent is used for "nothing was recorded", so collaborators never see an empty map.
     */
    private static <K, V> Optional<Map<K, V>> presentIfNotEmpty(final Map<K, V> map) {
        return map.isEmpty() ? Optional.empty() : Optional.of(Collections.unmodifiableMap(new LinkedHashMap<>(map)));
    }

    private static String describe(final String sourceName) {
        return sourceName == null ? "anonymous input" : "'" + sourceName + "'";
    }
}
