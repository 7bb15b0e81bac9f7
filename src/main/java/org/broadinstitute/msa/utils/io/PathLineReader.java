package org.broadinstitute.msa.utils.io;

import htsjdk.samtools.SAMException;
import htsjdk.samtools.util.CloserUtil;
import htsjdk.samtools.util.IOUtil;
import org.broadinstitute.msa.exceptions.UserException;
import org.broadinstitute.msa.utils.Utils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Rewindable line reader over a UTF-8 file. Gzipped files (by extension) are decompressed on the fly.
 * <p>
 * Rewinding closes the current stream and opens the file again.
 * </p>
 */
public final class PathLineReader implements RewindableLineReader {

    private final Path path;

    private BufferedReader in;

    private int lineNumber;

    /**
     * @throws UserException.CouldNotReadInputFile if the file does not exist, is not a regular file or cannot be opened.
     */
    public PathLineReader(final Path path) {
        this.path = Utils.nonNull(path, "the input path cannot be null");
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new UserException.CouldNotReadInputFile(path, "it does not exist or is not a readable regular file");
        }
        this.in = open(path);
    }

    private static BufferedReader open(final Path path) {
        try {
            return new BufferedReader(new InputStreamReader(IOUtil.openFileForReading(path), StandardCharsets.UTF_8));
        } catch (final SAMException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        }
    }

    @Override
    public String readLine() throws IOException {
        final String line = in.readLine();
        if (line != null) {
            lineNumber++;
        }
        return line;
    }

    @Override
    public void rewind() {
        CloserUtil.close(in);
        in = open(path);
        lineNumber = 0;
    }

    @Override
    public int getLineNumber() {
        return lineNumber;
    }

    @Override
    public String getSourceName() {
        return path.toString();
    }

    public Path getPath() {
        return path;
    }

    @Override
    public void close() {
        CloserUtil.close(in);
    }
}
