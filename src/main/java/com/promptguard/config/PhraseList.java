package com.promptguard.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Case-insensitive phrase set used for the blacklist and whitelist. Plain
 * entries match as substrings; entries prefixed with {@code re:} are regular
 * expressions matched anywhere in the text.
 */
public final class PhraseList {

    public static final String REGEX_PREFIX = "re:";

    private static final PhraseList EMPTY = new PhraseList(Set.of(), List.of(), List.of());

    private final Set<String> entries;
    private final List<String> substrings;
    private final List<Pattern> patterns;

    private PhraseList(Set<String> entries, List<String> substrings, List<Pattern> patterns) {
        this.entries = entries;
        this.substrings = substrings;
        this.patterns = patterns;
    }

    public static PhraseList empty() { return EMPTY; }

    /**
     * @throws ConfigurationException for blank entries or regexes that do not compile
     */
    public static PhraseList of(Collection<String> rawEntries) {
        if (rawEntries == null || rawEntries.isEmpty()) {
            return EMPTY;
        }
        Set<String> entries = new LinkedHashSet<>();
        List<String> substrings = new ArrayList<>();
        List<Pattern> patterns = new ArrayList<>();
        for (String raw : rawEntries) {
            if (raw == null || raw.isBlank()) {
                throw new ConfigurationException("Phrase list entries must not be blank");
            }
            String entry = raw.trim();
            if (!entries.add(entry)) {
                continue;
            }
            if (entry.startsWith(REGEX_PREFIX)) {
                String regex = entry.substring(REGEX_PREFIX.length());
                if (regex.isBlank()) {
                    throw new ConfigurationException("Empty regex in phrase list entry: " + entry);
                }
                try {
                    patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
                } catch (PatternSyntaxException e) {
                    throw new ConfigurationException("Malformed regex in phrase list entry '" + entry
                            + "': " + e.getDescription(), e);
                }
            } else {
                substrings.add(entry.toLowerCase(Locale.ROOT));
            }
        }
        return new PhraseList(Collections.unmodifiableSet(entries), List.copyOf(substrings), List.copyOf(patterns));
    }

    /**
     * Parses a comma-separated list, ignoring empty segments.
     */
    public static PhraseList parse(String commaSeparated) {
        if (commaSeparated == null || commaSeparated.isBlank()) {
            return EMPTY;
        }
        List<String> parts = Arrays.stream(commaSeparated.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        return of(parts);
    }

    public boolean matches(String text) {
        return firstMatch(text).isPresent();
    }

    /**
     * Returns the first entry found in {@code text}: substrings before regexes.
     */
    public Optional<String> firstMatch(String text) {
        if (text == null || text.isEmpty() || entries.isEmpty()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String substring : substrings) {
            if (lower.contains(substring)) {
                return Optional.of(substring);
            }
        }
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                return Optional.of(REGEX_PREFIX + pattern.pattern());
            }
        }
        return Optional.empty();
    }

    public Set<String> entries() { return entries; }

    public boolean isEmpty() { return entries.isEmpty(); }

    public int size() { return entries.size(); }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof PhraseList other && entries.equals(other.entries));
    }

    @Override
    public int hashCode() { return entries.hashCode(); }

    @Override
    public String toString() { return "PhraseList" + entries; }
}
