package com.repo.timeline.output;

import com.repo.timeline.core.ChangeAction;
import com.repo.timeline.core.ChangeEvent;
import com.repo.timeline.sort.EventStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GourceLogWriterTest {

    @TempDir
    Path tempDir;

    private static EventStream streamOf(List<ChangeEvent> events) {
        Iterator<ChangeEvent> it = events.iterator();
        return new EventStream() {
            @Override
            public boolean hasNext() {
                return it.hasNext();
            }

            @Override
            public ChangeEvent next() {
                return it.next();
            }

            @Override
            public void close() {
            }
        };
    }

    @Test
    void testFormatLine() {
        assertEquals("1700000000|Jane Doe|A|src/Main.java",
                GourceLogWriter.formatLine(new ChangeEvent(1700000000, "Jane Doe", "", "src/Main.java",
                        ChangeAction.ADDED)));
        assertEquals("5|bob|D|repoA/old.txt",
                GourceLogWriter.formatLine(new ChangeEvent(5, "bob", "repoA", "old.txt", ChangeAction.DELETED)));
    }

    @Test
    void testEscapeQuotesOnlyWhenNeeded() {
        assertEquals("plain/path.txt", GourceLogWriter.escape("plain/path.txt"));
        assertEquals("\"a|b.txt\"", GourceLogWriter.escape("a|b.txt"));
        assertEquals("\"say \"\"hi\"\".txt\"", GourceLogWriter.escape("say \"hi\".txt"));
        assertEquals("\"line\nbreak\"", GourceLogWriter.escape("line\nbreak"));
    }

    @Test
    void testWritesStreamInOrder() throws IOException {
        StringWriter target = new StringWriter();
        List<ChangeEvent> events = List.of(
                new ChangeEvent(1, "a", "r", "x", ChangeAction.ADDED),
                new ChangeEvent(2, "b", "r", "y", ChangeAction.MODIFIED));

        try (GourceLogWriter writer = new GourceLogWriter(target, "memory", true)) {
            assertEquals(2, writer.write(streamOf(events)));
            assertEquals(2, writer.linesWritten());
        }

        assertEquals("1|a|A|r/x\n2|b|M|r/y\n", target.toString());
    }

    @Test
    void testEmptyStreamWritesNothing() throws IOException {
        Path file = tempDir.resolve("empty.log");
        try (GourceLogWriter writer = GourceLogWriter.toFile(file)) {
            assertEquals(0, writer.write(streamOf(List.of())));
        }

        assertEquals(0, Files.size(file));
    }

    @Test
    void testFileOutputIsUtf8() throws IOException {
        Path file = tempDir.resolve("out.log");
        try (GourceLogWriter writer = GourceLogWriter.toFile(file)) {
            writer.write(streamOf(List.of(new ChangeEvent(3, "Zoë", "", "café.txt", ChangeAction.MODIFIED))));
        }

        assertEquals("3|Zoë|M|café.txt\n", Files.readString(file, StandardCharsets.UTF_8));
    }

    @Test
    void testUnopenableFileIsOutputError() {
        assertThrows(OutputException.class, () -> GourceLogWriter.toFile(tempDir.resolve("missing/dir/out.log")));
    }

    @Test
    void testBrokenTargetIsOutputError() {
        Writer broken = new Writer() {
            @Override
            public void write(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("Broken pipe");
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        GourceLogWriter writer = new GourceLogWriter(broken, "pipe", false);

        assertThrows(OutputException.class,
                () -> writer.writeLine(new ChangeEvent(1, "a", "", "x", ChangeAction.ADDED)));
    }
}
