package com.codesniff.index;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Shared by indexing and querying so both sides agree on terms. Identifiers are split on
 * camelCase and snake_case boundaries: {@code authenticateUser} and {@code authenticate_user} both
 * yield {@code authenticate}, {@code user}.
 */
public final class CodeTokenizer {
    private static final Pattern LOWER_UPPER = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern ACRONYM_WORD = Pattern.compile("([A-Z]+)([A-Z][a-z])");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
    private static final String[] SUFFIXES = {
            "tion", "sion", "ment", "ness", "able", "ible", "ing", "ed", "er", "est", "ly", "es", "s"
    };

    static final Set<String> STOPWORDS = Set.of(
            "self", "def", "class", "return", "if", "else", "elif", "for", "while", "try", "except",
            "finally", "with", "as", "import", "from", "in", "is", "not", "and", "or", "none", "true",
            "false", "the", "a", "an", "of", "to", "that", "this", "it", "be", "are", "const", "let",
            "var", "function", "null", "undefined", "new");

    /**
     * Every lower-cased identifier component, stopwords included.
     */
    public List<String> components(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        String split = ACRONYM_WORD.matcher(text).replaceAll("$1 $2");
        split = LOWER_UPPER.matcher(split).replaceAll("$1 $2");
        List<String> out = new ArrayList<>();
        for (String token : NON_ALPHANUMERIC.split(split.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                out.add(token);
            }
        }
        return out;
    }

    /**
     * Index and query terms: components minus stopwords and single characters.
     */
    public List<String> tokenize(String text) {
        List<String> terms = new ArrayList<>();
        for (String token : components(text)) {
            if (token.length() >= 2 && !STOPWORDS.contains(token)) {
                terms.add(token);
            }
        }
        return terms;
    }

    public static String stem(String word) {
        for (String suffix : SUFFIXES) {
            if (word.endsWith(suffix) && word.length() - suffix.length() >= 3) {
                return word.substring(0, word.length() - suffix.length());
            }
        }
        return word;
    }
}
