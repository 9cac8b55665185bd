package com.repo.timeline.git;

import com.repo.timeline.core.ChangeAction;

/**
 * One changed path within a commit.
 */
public record FileChange(ChangeAction action, String path) {
}
