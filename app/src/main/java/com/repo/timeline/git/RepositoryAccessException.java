package com.repo.timeline.git;

import java.io.IOException;

/**
 * A repository could not be opened or produced unreadable history.
 * Scoped to one repository: the run skips it and continues.
 */
public class RepositoryAccessException extends IOException {

    private final String repository;

    public RepositoryAccessException(String repository, String message) {
        super(repository + ": " + message);
        this.repository = repository;
    }

    public RepositoryAccessException(String repository, String message, Throwable cause) {
        super(repository + ": " + message, cause);
        this.repository = repository;
    }

    public String getRepository() {
        return repository;
    }
}
