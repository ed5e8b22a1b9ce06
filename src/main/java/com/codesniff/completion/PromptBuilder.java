package com.codesniff.completion;

import java.util.ArrayList;
import java.util.List;

import com.codesniff.context.AssembledContext;

public final class PromptBuilder {
    static final String SYSTEM_PROMPT = """
            You are a code assistant for a semantic code search engine.
            Help developers understand, debug and navigate the indexed codebase.
            Be concise and practical. Reference the provided code by its [n] citation when it is relevant.
            If the provided code does not answer the question, say so instead of guessing.""";

    static final String QUESTION_MARKER = "Question:";
    static final String CONTEXT_MARKER = "Relevant code from the codebase:";

    private PromptBuilder() {
    }

    /**
     * The user turn sent to the model: the bare question when there is no grounding, otherwise the
     * question followed by the assembled code context.
     */
    public static String userTurn(String question, AssembledContext context) {
        if (!context.grounded()) {
            return question;
        }
        return QUESTION_MARKER + " " + question + "\n\n"
                + CONTEXT_MARKER + "\n"
                + context.text() + "\n\n"
                + "Please answer the question using the code context above when relevant.";
    }

    /**
     * Drops the oldest user/assistant pairs until the history fits {@code maxWords}.
     */
    public static List<ChatMessage> trimHistory(List<ChatMessage> history, int maxWords) {
        List<ChatMessage> trimmed = new ArrayList<>(history);
        while (trimmed.size() > 2 && wordCount(trimmed) > maxWords) {
            trimmed.remove(0);
            trimmed.remove(0);
        }
        return trimmed;
    }

    private static int wordCount(List<ChatMessage> history) {
        return history.stream()
                .mapToInt(message -> message.content().isBlank() ? 0 : message.content().strip().split("\\s+").length)
                .sum();
    }
}
