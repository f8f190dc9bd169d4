package com.entity.network.dedup;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Casing style of a surface name, ranked from most to least preferred as a display form.
 *
 * <p>Minor words ("of", "the", "and", ...) may stay lowercase after the first word without
 * breaking title case, so "Department of Justice" counts as {@link #TITLE_CASE}.</p>
 */
public enum CapitalizationStyle {
    /** Every word capitalized, the rest of each word lowercase: "The Federal Bureau". */
    TITLE_CASE(4),
    /** Every word starts uppercase but some words carry more capitals: "The FBI", "McDonald". */
    CAPITALIZED_WORDS(3),
    /** Anything else mixing cases, or names without letters. */
    MIXED(2),
    LOWERCASE(1),
    UPPERCASE(0);

    private static final Set<String> MINOR_WORDS = Set.of(
            "a", "an", "and", "at", "by", "de", "del", "der", "di", "du", "for", "in",
            "la", "le", "of", "on", "or", "the", "to", "van", "von");

    private final int rank;

    CapitalizationStyle(int rank) {
        this.rank = rank;
    }

    /**
     * Higher is better.
     */
    public int getRank() {
        return rank;
    }

    public static CapitalizationStyle classify(String surfaceName) {
        if (surfaceName == null) {
            return MIXED;
        }
        boolean hasUpper = false;
        boolean hasLower = false;
        for (int i = 0; i < surfaceName.length(); i++) {
            char c = surfaceName.charAt(i);
            if (Character.isUpperCase(c)) hasUpper = true;
            if (Character.isLowerCase(c)) hasLower = true;
        }
        if (!hasUpper && !hasLower) {
            return MIXED;
        }
        if (!hasLower) {
            return UPPERCASE;
        }
        if (!hasUpper) {
            return LOWERCASE;
        }

        List<String> words = letterWords(surfaceName);
        boolean allCapitalized = true;
        boolean allStrict = true;
        for (int i = 0; i < words.size(); i++) {
            String word = words.get(i);
            int first = firstLetterIndex(word);
            char initial = word.charAt(first);
            if (Character.isLowerCase(initial)) {
                if (i > 0 && MINOR_WORDS.contains(word.toLowerCase(Locale.ROOT))) {
                    continue;
                }
                allCapitalized = false;
                allStrict = false;
                break;
            }
            if (!restIsLowercase(word, first + 1)) {
                allStrict = false;
            }
        }
        if (allStrict) {
            return TITLE_CASE;
        }
        return allCapitalized ? CAPITALIZED_WORDS : MIXED;
    }

    private static List<String> letterWords(String name) {
        List<String> words = new ArrayList<>();
        for (String token : name.split("[\\s\\-]+")) {
            if (firstLetterIndex(token) >= 0) {
                words.add(token);
            }
        }
        return words;
    }

    private static int firstLetterIndex(String word) {
        for (int i = 0; i < word.length(); i++) {
            if (Character.isLetter(word.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private static boolean restIsLowercase(String word, int from) {
        for (int i = from; i < word.length(); i++) {
            if (Character.isUpperCase(word.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
