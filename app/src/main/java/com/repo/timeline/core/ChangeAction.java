package com.repo.timeline.core;

import java.util.Optional;

/**
 * File-level action recorded in the Gource log.
 * Declaration order is part of the event sort key.
 */
public enum ChangeAction {
    ADDED("A"),
    MODIFIED("M"),
    DELETED("D");

    private final String code;

    ChangeAction(String code) {
        this.code = code;
    }

    /**
     * Single-letter code written to the log.
     */
    public String code() {
        return code;
    }

    /**
     * Map a single-path git --name-status letter ("A", "M", "D", "T") to an action.
     * Type changes count as modifications. Renames and copies name two paths
     * and are split by the log parser. Unmerged and unknown statuses yield nothing.
     */
    public static Optional<ChangeAction> fromGitStatus(String status) {
        if (status == null || status.isEmpty()) {
            return Optional.empty();
        }
        return switch (status.charAt(0)) {
            case 'A' -> Optional.of(ADDED);
            case 'D' -> Optional.of(DELETED);
            case 'M', 'T' -> Optional.of(MODIFIED);
            default -> Optional.empty();
        };
    }
}
