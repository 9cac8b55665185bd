package com.repo.timeline.sort;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A spilled chunk could not be encoded or decoded. The merged order can no
 * longer be trusted, so this is always fatal.
 */
public class ChunkEncodingException extends IOException {

    public ChunkEncodingException(Path chunk, String message, Throwable cause) {
        super("Chunk " + chunk.getFileName() + ": " + message, cause);
    }
}
