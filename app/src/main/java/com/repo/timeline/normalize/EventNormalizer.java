package com.repo.timeline.normalize;

import com.repo.timeline.core.AliasTable;
import com.repo.timeline.core.ChangeEvent;
import com.repo.timeline.git.CommitRecord;
import com.repo.timeline.git.FileChange;

import java.io.IOException;
import java.util.OptionalInt;

/**
 * Turns commits into change events.
 * Drops oversized changesets (merges, tag pushes, bulk CI commits) and maps
 * author names through the alias table. Stateless apart from its settings, so
 * one instance serves every worker.
 */
public class EventNormalizer {

    private final AliasTable aliases;
    private final OptionalInt maxChangesetSize;

    public EventNormalizer(AliasTable aliases, OptionalInt maxChangesetSize) {
        this.aliases = aliases;
        this.maxChangesetSize = maxChangesetSize;
    }

    /**
     * Emit one event per changed file of an accepted commit.
     *
     * @return number of events pushed, 0 when the commit was filtered out
     */
    public int normalize(CommitRecord commit, String repositoryId, EventSink sink) throws IOException {
        if (isFiltered(commit)) {
            return 0;
        }

        String author = aliases.resolve(commit.author());
        for (FileChange change : commit.changes()) {
            sink.push(new ChangeEvent(commit.timestamp(), author, repositoryId, change.path(), change.action()));
        }
        return commit.changesetSize();
    }

    public boolean isFiltered(CommitRecord commit) {
        return maxChangesetSize.isPresent() && commit.changesetSize() > maxChangesetSize.getAsInt();
    }
}
