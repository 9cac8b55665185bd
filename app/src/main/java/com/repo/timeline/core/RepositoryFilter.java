package com.repo.timeline.core;

import java.util.Collection;
import java.util.Set;

/**
 * Include-list or exclude-list of repository directory names.
 * Having neither accepts every repository.
 */
public final class RepositoryFilter {

    private static final RepositoryFilter ALL = new RepositoryFilter(Set.of(), Set.of());

    private final Set<String> include;
    private final Set<String> exclude;

    private RepositoryFilter(Set<String> include, Set<String> exclude) {
        this.include = include;
        this.exclude = exclude;
    }

    public static RepositoryFilter all() {
        return ALL;
    }

    /**
     * @throws ConfigurationException if both lists are non-empty
     */
    public static RepositoryFilter of(Collection<String> include, Collection<String> exclude) {
        if (!include.isEmpty() && !exclude.isEmpty()) {
            throw new ConfigurationException("--include and --exclude cannot be used together");
        }
        return new RepositoryFilter(Set.copyOf(include), Set.copyOf(exclude));
    }

    public boolean accepts(String repositoryName) {
        if (!include.isEmpty()) {
            return include.contains(repositoryName);
        }
        return !exclude.contains(repositoryName);
    }

    public boolean isAcceptAll() {
        return include.isEmpty() && exclude.isEmpty();
    }
}
