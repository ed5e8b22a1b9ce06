package com.codesniff.completion;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Offline stand-in for a language model: answers with the cited code lines that mention the
 * question's keywords. Used when no completion endpoint is configured.
 */
public class ExtractiveCompletionService implements CompletionService {
    private final int maxWords;

    public ExtractiveCompletionService(int maxWords) {
        this.maxWords = maxWords;
    }

    @Override
    public String complete(String prompt, List<ChatMessage> history) {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("Prompt must not be blank");
        }
        int contextStart = prompt.indexOf(PromptBuilder.CONTEXT_MARKER);
        if (!prompt.startsWith(PromptBuilder.QUESTION_MARKER) || contextStart < 0) {
            return "No indexed code matched this question; index the codebase or rephrase the question.";
        }
        String question = prompt.substring(PromptBuilder.QUESTION_MARKER.length(), contextStart).strip();
        String context = prompt.substring(contextStart + PromptBuilder.CONTEXT_MARKER.length()).strip();
        Set<String> keywords = keywords(question);

        StringBuilder answer = new StringBuilder("Relevant code for: ").append(question);
        for (String line : context.split("\n")) {
            String stripped = line.strip();
            if (stripped.startsWith("[") && stripped.contains("] File: ")) {
                answer.append('\n').append(stripped);
            } else if (!stripped.isEmpty() && keywords.stream().anyMatch(stripped.toLowerCase(Locale.ROOT)::contains)) {
                answer.append("\n    ").append(stripped);
            }
        }
        return truncateByWords(answer.toString(), maxWords);
    }

    private static Set<String> keywords(String input) {
        return Arrays.stream(input.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
                .filter(token -> token.length() > 2)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static String truncateByWords(String text, int maxWords) {
        if (maxWords <= 0) {
            return text;
        }
        String[] words = text.split(" ");
        if (words.length <= maxWords) {
            return text;
        }
        return String.join(" ", Arrays.copyOf(words, maxWords));
    }
}
