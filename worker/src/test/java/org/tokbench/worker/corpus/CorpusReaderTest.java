package org.tokbench.worker.corpus;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tokbench.common.Language;
import org.tokbench.common.Sentence;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CorpusReaderTest {

    @TempDir
    Path dir;

    @Test
    void offsetsAreLineNumbers() throws Exception {
        Path corpus = write("پہلا\nدوسرا\n\nچوتھا\n");

        try (CorpusReader reader = CorpusReader.open(corpus, Language.UR, 0)) {
            assertSentence(reader.next(), "پہلا", 0);
            assertSentence(reader.next(), "دوسرا", 1);
            assertSentence(reader.next(), "", 2);
            assertSentence(reader.next(), "چوتھا", 3);
            assertNull(reader.next());
        }
    }

    @Test
    void opensAtStartOffset() throws Exception {
        Path corpus = write("a\nb\nc\nd");

        try (CorpusReader reader = CorpusReader.open(corpus, Language.UR, 2)) {
            assertEquals(2, reader.nextOffset());
            assertSentence(reader.next(), "c", 2);
            assertSentence(reader.next(), "d", 3);
            assertNull(reader.next());
        }
    }

    @Test
    void stripsCarriageReturns() throws Exception {
        Path corpus = write("我的\r\n电脑\r\n");

        try (CorpusReader reader = CorpusReader.open(corpus, Language.ZH, 0)) {
            assertSentence(reader.next(), "我的", 0);
            assertSentence(reader.next(), "电脑", 1);
        }
    }

    @Test
    void malformedLineIsReportedAndConsumed() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        bytes.write("पहला\n".getBytes(StandardCharsets.UTF_8));
        bytes.write(new byte[]{(byte) 0xC3, (byte) 0x28, '\n'});
        bytes.write("तीसरा\n".getBytes(StandardCharsets.UTF_8));
        Path corpus = dir.resolve("corpus.txt");
        Files.write(corpus, bytes.toByteArray());

        try (CorpusReader reader = CorpusReader.open(corpus, Language.HI, 0)) {
            assertSentence(reader.next(), "पहला", 0);
            LoadException e = assertThrows(LoadException.class, reader::next);
            assertEquals(1, e.getOffset());
            assertSentence(reader.next(), "तीसरा", 2);
        }
    }

    @Test
    void countsLinesWithAndWithoutTrailingNewline() throws Exception {
        assertEquals(3, CorpusReader.countLines(write("a\nb\nc\n")));
        assertEquals(3, CorpusReader.countLines(write("a\nb\nc")));
        assertEquals(0, CorpusReader.countLines(write("")));
    }

    private Path write(String content) throws Exception {
        Path corpus = Files.createTempFile(dir, "corpus", ".txt");
        Files.writeString(corpus, content, StandardCharsets.UTF_8);
        return corpus;
    }

    private static void assertSentence(Sentence sentence, String text, long offset) {
        assertEquals(text, sentence.text());
        assertEquals(offset, sentence.offset());
    }
}
