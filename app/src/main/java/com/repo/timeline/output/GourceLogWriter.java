package com.repo.timeline.output;

import com.repo.timeline.core.ChangeEvent;
import com.repo.timeline.sort.EventStream;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the ordered event stream in Gource's custom log format:
 * {@code timestamp|author|A|M|D|path}, one line per event.
 * Lines are written as they are pulled, nothing is collected first.
 */
public class GourceLogWriter implements Closeable {

    private static final char DELIMITER = '|';
    private static final int BUFFER_SIZE = 1 << 16;

    private final Writer out;
    private final String destination;
    private final boolean closeTarget;
    private long linesWritten;

    public GourceLogWriter(Writer out, String destination, boolean closeTarget) {
        this.out = out;
        this.destination = destination;
        this.closeTarget = closeTarget;
    }

    public static GourceLogWriter toFile(Path file) throws OutputException {
        try {
            return new GourceLogWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8), file.toString(), true);
        } catch (IOException e) {
            throw new OutputException("Cannot open output file " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Write to the raw stdout descriptor. Unlike System.out, a closed pipe
     * surfaces as an error here.
     */
    public static GourceLogWriter toStdout() {
        Writer writer = new BufferedWriter(
                new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8),
                BUFFER_SIZE);
        return new GourceLogWriter(writer, "standard output", false);
    }

    /**
     * Drain the stream into the destination.
     *
     * @return number of lines written
     * @throws OutputException if the destination rejects a write; read errors
     *                         from the stream propagate unchanged
     */
    public long write(EventStream events) throws IOException {
        long count = 0;
        while (events.hasNext()) {
            writeLine(events.next());
            count++;
        }
        flush();
        return count;
    }

    public void writeLine(ChangeEvent event) throws OutputException {
        try {
            out.write(formatLine(event));
            out.write('\n');
            linesWritten++;
        } catch (IOException e) {
            throw new OutputException("Failed writing to " + destination + ": " + e.getMessage(), e);
        }
    }

    public void flush() throws OutputException {
        try {
            out.flush();
        } catch (IOException e) {
            throw new OutputException("Failed writing to " + destination + ": " + e.getMessage(), e);
        }
    }

    public long linesWritten() {
        return linesWritten;
    }

    /**
     * Author is already escaped (or an operator supplied alias) and written
     * as is. Paths get CSV quoting when they contain the delimiter, a quote or
     * a line break.
     */
    static String formatLine(ChangeEvent event) {
        return event.timestamp()
                + String.valueOf(DELIMITER) + event.author()
                + DELIMITER + event.action().code()
                + DELIMITER + escape(event.displayPath());
    }

    static String escape(String field) {
        if (field.indexOf(DELIMITER) < 0 && field.indexOf('"') < 0
                && field.indexOf('\n') < 0 && field.indexOf('\r') < 0) {
            return field;
        }
        return "\"" + field.replace("\"", "\"\"") + "\"";
    }

    @Override
    public void close() throws IOException {
        try {
            if (closeTarget) {
                out.close();
            } else {
                out.flush();
            }
        } catch (IOException e) {
            throw new OutputException("Failed closing " + destination + ": " + e.getMessage(), e);
        }
    }
}
