package com.repo.timeline.sort;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The temporary directory could not be created or written (typically a full
 * disk). Fatal; the directory may have to be removed by hand.
 */
public class TempStorageException extends IOException {

    private final Path directory;

    public TempStorageException(Path directory, String message, Throwable cause) {
        super(message + " (temporary files in " + directory.toAbsolutePath()
                + " may need to be removed manually)", cause);
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }
}
