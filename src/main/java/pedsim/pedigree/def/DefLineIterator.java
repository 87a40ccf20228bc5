package pedsim.pedigree.def;

import htsjdk.samtools.SAMException;
import htsjdk.samtools.util.BufferedLineReader;
import htsjdk.samtools.util.CloseableIterator;
import htsjdk.samtools.util.CloserUtil;
import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.RuntimeIOException;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.NoSuchElementException;

/**
 * Iterates over the meaningful lines of a def file. Blank lines and comments are skipped, but line numbers always
 * count every physical line of the input.
 */
public class DefLineIterator implements CloseableIterator<DefLine> {
    private final BufferedLineReader reader;
    private final String sourceName;
    private DefLine nextLine;

    public DefLineIterator(final InputStream in, final String sourceName) {
        this.reader = new BufferedLineReader(in);
        this.sourceName = sourceName;
        try {
            advance();
        } catch (final DefFileException e) {
            CloserUtil.close(reader);
            throw e;
        }
    }

    /** Opens a def file for reading; gzipped files are read transparently. */
    public static DefLineIterator fromFile(final File file) {
        try {
            IOUtil.assertFileIsReadable(file);
            return new DefLineIterator(IOUtil.openFileForReading(file), file.getAbsolutePath());
        } catch (final SAMException e) {
            throw new DefFileException(DefFileErrorKind.IO_ERROR, DefFileException.NO_LINE,
                    "could not open def file " + file.getAbsolutePath() + ": " + e.getMessage(), e);
        }
    }

    /** Iterates over def file text held in memory. */
    public static DefLineIterator fromString(final String text, final String sourceName) {
        return new DefLineIterator(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)), sourceName);
    }

    public String getSourceName() { return sourceName; }

    private void advance() {
        nextLine = null;
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                final String[] tokens = DefLineTokenizer.tokenize(line);
                if (tokens.length > 0) {
                    nextLine = new DefLine(reader.getLineNumber(), tokens);
                    return;
                }
            }
        } catch (final RuntimeIOException e) {
            throw new DefFileException(DefFileErrorKind.IO_ERROR, reader.getLineNumber(),
                    "error reading def file " + sourceName, e);
        }
    }

    @Override
    public boolean hasNext() {
        return nextLine != null;
    }

    @Override
    public DefLine next() {
        if (nextLine == null) throw new NoSuchElementException("No more lines in " + sourceName);
        final DefLine current = nextLine;
        advance();
        return current;
    }

    @Override
    public void close() {
        reader.close();
    }
}
