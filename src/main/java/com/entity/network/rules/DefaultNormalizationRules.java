package com.entity.network.rules;

import java.util.List;

/**
 * Built-in rules producing the matching key for entity names.
 *
 * <p>The same rules apply to every entity kind, so a name classified under two kinds
 * normalizes to the same key and shows up as a type conflict.</p>
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getCommonRules());
        return engine;
    }

    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                // Every Unicode space separator counts as whitespace
                NormalizationRule.builder()
                        .name("common-unicode-whitespace")
                        .pattern("[\\s\\p{Z}]+")
                        .replacement(" ")
                        .priority(10)
                        .build(),

                // "Epstein's", "Jones'" at the end of the name
                NormalizationRule.builder()
                        .name("common-trailing-possessive")
                        .pattern("(['\\u2019]s|(?<=s)['\\u2019])(?=[^\\p{L}\\p{N}]*$)")
                        .replacement("")
                        .priority(20)
                        .build(),

                // Apostrophes and periods are dropped without a gap: O'Brien, U.S.A.
                NormalizationRule.builder()
                        .name("common-apostrophes-periods")
                        .pattern("['\\u2018\\u2019.]")
                        .replacement("")
                        .priority(30)
                        .build(),

                NormalizationRule.builder()
                        .name("common-punctuation")
                        .pattern("[,;:!?\"\\u201C\\u201D()\\[\\]{}/\\\\*#@&_`|<>~+\\u2013\\u2014]")
                        .replacement(" ")
                        .priority(40)
                        .build(),

                // Hyphens survive only between two letters or digits (compound surnames)
                NormalizationRule.builder()
                        .name("common-dangling-hyphen")
                        .pattern("(?<![\\p{L}\\p{N}])-|-(?![\\p{L}\\p{N}])")
                        .replacement(" ")
                        .priority(50)
                        .build()
        );
    }
}
