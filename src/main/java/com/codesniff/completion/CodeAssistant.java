package com.codesniff.completion;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codesniff.context.AssembledContext;
import com.codesniff.context.Citation;
import com.codesniff.context.ContextAssembler;
import com.codesniff.search.SearchException;

/**
 * Retrieval-augmented question answering. Citations come from the assembled context, not from the
 * model output. When retrieval fails the question is still answered, ungrounded.
 */
public class CodeAssistant {
    private static final Logger log = LoggerFactory.getLogger(CodeAssistant.class);

    private final ContextAssembler contextAssembler;
    private final CompletionService completionService;
    private final int maxHistoryWords;

    public CodeAssistant(ContextAssembler contextAssembler, CompletionService completionService, int maxHistoryWords) {
        this.contextAssembler = contextAssembler;
        this.completionService = completionService;
        this.maxHistoryWords = maxHistoryWords;
    }

    public record Answer(String text, List<Citation> citations, boolean usedRetrieval) {
    }

    /**
     * @throws com.codesniff.error.ProviderException when the completion service fails
     */
    public Answer ask(String question, List<ChatMessage> history) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("Question must not be blank");
        }
        AssembledContext context;
        try {
            context = contextAssembler.assemble(question);
        } catch (SearchException e) {
            log.warn("assistant.retrieval.failed reason={}", e.getMessage());
            context = AssembledContext.empty();
        }
        String prompt = PromptBuilder.userTurn(question, context);
        String answer = completionService.complete(prompt, PromptBuilder.trimHistory(history, maxHistoryWords));
        log.info("assistant.answer grounded={} citations={} answerChars={}",
                context.grounded(), context.citations().size(), answer.length());
        return new Answer(answer, context.citations(), context.grounded());
    }
}
