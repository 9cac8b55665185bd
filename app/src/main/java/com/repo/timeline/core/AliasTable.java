package com.repo.timeline.core;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps raw git author names to the names shown in the visualization.
 * Immutable once built; shared by every worker without locking.
 */
public final class AliasTable {

    public static final String SEPARATOR = "::";

    private static final AliasTable EMPTY = new AliasTable(Map.of());

    private final Map<String, String> aliases;

    private AliasTable(Map<String, String> aliases) {
        this.aliases = aliases;
    }

    public static AliasTable empty() {
        return EMPTY;
    }

    /**
     * Build a table from raw -> display pairs. Pipes in the raw names are
     * escaped so lookups match escaped author names.
     */
    public static AliasTable of(Map<String, String> rawToDisplay) {
        Map<String, String> escaped = new LinkedHashMap<>();
        rawToDisplay.forEach((raw, display) -> escaped.put(escapeDelimiter(raw), display));
        return new AliasTable(Map.copyOf(escaped));
    }

    /**
     * Build a table from "RAW::DISPLAY" strings as given on the command line.
     */
    public static AliasTable parse(Collection<String> entries) {
        Map<String, String> map = new LinkedHashMap<>();
        for (String entry : entries) {
            String[] pair = parseAlias(entry);
            map.put(pair[0], pair[1]);
        }
        return of(map);
    }

    /**
     * Split one "RAW::DISPLAY" string.
     *
     * @return two-element array {raw, display}
     * @throws ConfigurationException if the string is not exactly two non-empty parts
     */
    public static String[] parseAlias(String entry) {
        if (entry == null) {
            throw new ConfigurationException("Alias must not be null");
        }
        String[] parts = entry.split(SEPARATOR, -1);
        if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            throw new ConfigurationException(
                    "Invalid alias '" + entry + "', expected <GIT_USERNAME>::<GOURCE_USERNAME>");
        }
        return parts;
    }

    /**
     * The log uses '|' as field delimiter, so it may never appear in a name.
     */
    public static String escapeDelimiter(String identity) {
        return identity.replace('|', '#');
    }

    /**
     * Escape the raw identity and substitute its alias when one exists.
     * The alias itself is returned verbatim.
     */
    public String resolve(String rawIdentity) {
        String escaped = escapeDelimiter(rawIdentity);
        return aliases.getOrDefault(escaped, escaped);
    }

    public int size() {
        return aliases.size();
    }

    public boolean isEmpty() {
        return aliases.isEmpty();
    }
}
