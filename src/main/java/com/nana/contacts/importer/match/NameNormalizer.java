package com.nana.contacts.importer.match;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * NameNormalizer - Canonical name form and token-overlap similarity.
 */
public final class NameNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_WORD   = Pattern.compile("[^\\w\\s]");

    private NameNormalizer() {
        throw new UnsupportedOperationException(
                "NameNormalizer is a static utility class.");
    }

    /**
     * Lowercases, trims, collapses whitespace runs to one space, then
     * strips every character that is not a letter, digit, underscore or
     * whitespace.
     *
     * @param name raw name, may be null
     * @return the normalized name, empty when nothing is left
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String collapsed = WHITESPACE.matcher(name.toLowerCase().trim()).replaceAll(" ");
        return NON_WORD.matcher(collapsed).replaceAll("");
    }

    /**
     * Similarity of two normalized names in {@code [0, 1]}.
     *
     * <p>When the longer name contains the shorter one the score is
     * {@code shorter.length / longer.length}. Otherwise it is the number of
     * tokens of {@code first} that also occur in {@code second}, divided by
     * the larger token count.
     *
     * @param first  normalized name
     * @param second normalized name
     * @return similarity score
     */
    public static double similarity(String first, String second) {
        String longer  = first.length() > second.length() ? first : second;
        String shorter = first.length() > second.length() ? second : first;

        if (longer.isEmpty()) {
            return 1.0;
        }
        if (longer.contains(shorter)) {
            return (double) shorter.length() / longer.length();
        }

        List<String> words1 = tokens(first);
        List<String> words2 = tokens(second);
        if (words1.isEmpty() || words2.isEmpty()) {
            return 0.0;
        }

        int common = 0;
        for (String word : words1) {
            if (words2.contains(word)) {
                common++;
            }
        }
        return (double) common / Math.max(words1.size(), words2.size());
    }

    private static List<String> tokens(String name) {
        List<String> result = new ArrayList<>();
        for (String token : WHITESPACE.split(name)) {
            if (!token.isEmpty()) {
                result.add(token);
            }
        }
        return result;
    }
}
