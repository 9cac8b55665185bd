package com.repo.timeline.sort;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import com.repo.timeline.core.ChangeEvent;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Binary encoding of chunk files: a plain sequence of CBOR maps, one per
 * event. Only readable by the same run.
 */
public class ChunkCodec {

    private static final int BUFFER_SIZE = 1 << 16;

    private final ObjectWriter writer;
    private final ObjectReader reader;

    public ChunkCodec() {
        CBORMapper mapper = new CBORMapper();
        this.writer = mapper.writerFor(ChangeEvent.class);
        this.reader = mapper.readerFor(ChangeEvent.class);
    }

    /**
     * Write already sorted events to a new file.
     */
    public void write(Path file, List<ChangeEvent> sorted) throws IOException {
        try (ChunkWriter out = openWriter(file)) {
            for (ChangeEvent event : sorted) {
                out.write(event);
            }
        }
    }

    public ChunkWriter openWriter(Path file) throws IOException {
        OutputStream stream;
        try {
            stream = new BufferedOutputStream(
                    Files.newOutputStream(file, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE),
                    BUFFER_SIZE);
        } catch (IOException e) {
            throw new TempStorageException(file.getParent(), "Cannot create chunk file " + file, e);
        }
        try {
            return new ChunkWriter(file, writer.writeValues(stream));
        } catch (IOException e) {
            stream.close();
            throw new ChunkEncodingException(file, "cannot start encoding", e);
        }
    }

    /**
     * Open a chunk for sequential reading, positioned on its first event.
     *
     * @param index position of the chunk, used to break ties between equal heads
     */
    public ChunkCursor openCursor(Path file, int index) throws IOException {
        InputStream stream;
        try {
            stream = new BufferedInputStream(Files.newInputStream(file), BUFFER_SIZE);
        } catch (IOException e) {
            throw new ChunkEncodingException(file, "cannot open for merge", e);
        }
        MappingIterator<ChangeEvent> events;
        try {
            events = reader.readValues(stream);
        } catch (IOException e) {
            stream.close();
            throw new ChunkEncodingException(file, "unreadable header", e);
        }
        ChunkCursor cursor = new ChunkCursor(file, index, events);
        try {
            cursor.advance();
        } catch (IOException e) {
            events.close();
            throw e;
        }
        return cursor;
    }

    /**
     * Streaming writer for one chunk file.
     */
    public static final class ChunkWriter implements Closeable {

        private final Path file;
        private final SequenceWriter sequence;
        private long count;

        private ChunkWriter(Path file, SequenceWriter sequence) {
            this.file = file;
            this.sequence = sequence;
        }

        public void write(ChangeEvent event) throws IOException {
            try {
                sequence.write(event);
                count++;
            } catch (JsonProcessingException e) {
                throw new ChunkEncodingException(file, "cannot encode event " + count, e);
            } catch (IOException e) {
                throw new TempStorageException(file.getParent(), "Failed writing chunk " + file.getFileName(), e);
            }
        }

        public long count() {
            return count;
        }

        public Path file() {
            return file;
        }

        @Override
        public void close() throws IOException {
            try {
                sequence.close();
            } catch (JsonProcessingException e) {
                throw new ChunkEncodingException(file, "cannot finish encoding", e);
            } catch (IOException e) {
                throw new TempStorageException(file.getParent(), "Failed writing chunk " + file.getFileName(), e);
            }
        }
    }
}
