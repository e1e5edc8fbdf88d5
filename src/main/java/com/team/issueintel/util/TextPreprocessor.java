package com.team.issueintel.util;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Text normalization shared by embedding, keyword similarity and ticket classification.
 */
public final class TextPreprocessor {

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern ALPHABETIC = Pattern.compile("^[a-z]+$");
    private static final int MIN_KEYWORD_LENGTH = 3;

    static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "are", "but", "not", "you", "all", "can", "had",
            "her", "was", "one", "our", "out", "day", "get", "has", "him", "his",
            "how", "its", "may", "new", "now", "old", "see", "two", "who", "boy",
            "did", "she", "use", "way", "will", "with"
    );

    private TextPreprocessor() {
    }

    /**
     * Replaces punctuation with spaces and collapses whitespace.
     */
    public static String clean(String text) {
        if (text == null) return "";
        String stripped = PUNCTUATION.matcher(text).replaceAll(" ");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    /**
     * Lowercase alphabetic tokens longer than two characters, minus stop words.
     */
    public static Set<String> keywords(String text) {
        String clean = clean(text).toLowerCase(Locale.ROOT);
        Set<String> keywords = new LinkedHashSet<>();
        if (clean.isEmpty()) return keywords;

        Arrays.stream(WHITESPACE.split(clean))
                .filter(word -> word.length() >= MIN_KEYWORD_LENGTH)
                .filter(word -> !STOP_WORDS.contains(word))
                .filter(word -> ALPHABETIC.matcher(word).matches())
                .forEach(keywords::add);
        return keywords;
    }

    /**
     * Lowercase words of the text, without length or stop-word filtering.
     */
    public static Set<String> words(String text) {
        String clean = clean(text).toLowerCase(Locale.ROOT);
        Set<String> words = new LinkedHashSet<>();
        if (!clean.isEmpty()) {
            words.addAll(Arrays.asList(WHITESPACE.split(clean)));
        }
        return words;
    }

    public static boolean containsAny(Set<String> words, Collection<String> candidates) {
        return candidates.stream().anyMatch(words::contains);
    }
}
