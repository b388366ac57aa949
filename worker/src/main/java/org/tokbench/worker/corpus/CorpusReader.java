package org.tokbench.worker.corpus;

import org.tokbench.common.Language;
import org.tokbench.common.Sentence;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Offsets are zero-based line numbers. Malformed UTF-8 raises {@link LoadException}
 * instead of being repaired.
 */
public class CorpusReader implements Closeable {

    private static final int BUFFER_SIZE = 1 << 16;

    private final InputStream in;
    private final Language language;
    private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    private final ByteArrayOutputStream line = new ByteArrayOutputStream(256);
    private long nextOffset;

    private CorpusReader(InputStream in, Language language) {
        this.in = in;
        this.language = language;
    }

    /** Opens the corpus positioned at {@code startOffset}. */
    public static CorpusReader open(Path corpus, Language language, long startOffset) throws IOException {
        CorpusReader reader = new CorpusReader(new BufferedInputStream(Files.newInputStream(corpus), BUFFER_SIZE), language);
        try {
            reader.skipLines(startOffset);
        } catch (IOException e) {
            reader.close();
            throw e;
        }
        return reader;
    }

    public static long countLines(Path corpus) throws IOException {
        try (CorpusReader reader = new CorpusReader(
                new BufferedInputStream(Files.newInputStream(corpus), BUFFER_SIZE), null)) {
            while (reader.readLine()) {
                reader.nextOffset++;
            }
            return reader.nextOffset;
        }
    }

    public long nextOffset() {
        return nextOffset;
    }

    /**
     * @return the next sentence, or {@code null} at end of file
     * @throws LoadException if the line is not valid UTF-8; the line is consumed
     */
    public Sentence next() {
        boolean found;
        try {
            found = readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read corpus at line " + nextOffset, e);
        }
        if (!found) {
            return null;
        }
        long offset = nextOffset++;
        try {
            String text = decoder.reset().decode(ByteBuffer.wrap(line.toByteArray())).toString();
            return new Sentence(text, language, offset);
        } catch (CharacterCodingException e) {
            throw new LoadException(offset, "malformed UTF-8", e);
        }
    }

    @Override
    public void close() throws IOException {
        in.close();
    }

    private void skipLines(long count) throws IOException {
        while (nextOffset < count) {
            int b = in.read();
            if (b == -1) {
                return;
            }
            if (b == '\n') {
                nextOffset++;
            }
        }
    }

    /** Fills {@link #line} with the next line without its terminator. */
    private boolean readLine() throws IOException {
        line.reset();
        int b = in.read();
        if (b == -1) {
            return false;
        }
        while (b != -1 && b != '\n') {
            line.write(b);
            b = in.read();
        }
        byte[] bytes = line.toByteArray();
        if (bytes.length > 0 && bytes[bytes.length - 1] == '\r') {
            line.reset();
            line.write(bytes, 0, bytes.length - 1);
        }
        return true;
    }
}
