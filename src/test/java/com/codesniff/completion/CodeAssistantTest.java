package com.codesniff.completion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.codesniff.ScriptedEmbeddingService;
import com.codesniff.context.ContextAssembler;
import com.codesniff.corpus.Corpus;
import com.codesniff.corpus.IndexingPipeline;
import com.codesniff.index.LexicalIndex;
import com.codesniff.index.LocalVectorIndex;
import com.codesniff.ingest.ParsedSymbol;
import com.codesniff.ingest.SymbolKind;
import com.codesniff.search.HybridRanker;

class CodeAssistantTest {
    private static final int DIMENSION = 64;

    private ScriptedEmbeddingService embedder;
    private ContextAssembler assembler;
    private final List<String> prompts = new ArrayList<>();
    private final CompletionService recording = (prompt, history) -> {
        prompts.add(prompt);
        return "answer " + history.size();
    };

    @BeforeEach
    void setUp() {
        Corpus corpus = new Corpus(DIMENSION, new LexicalIndex(), new LocalVectorIndex(DIMENSION, LocalVectorIndex.Options.exact()));
        embedder = new ScriptedEmbeddingService(DIMENSION);
        new IndexingPipeline(corpus, embedder, 8, 2, 1).index(List.of(
                new ParsedSymbol("authenticate_user", SymbolKind.FUNCTION, "auth/session.py", 1, 3,
                        "def authenticate_user(name, password):\n    return check_password(name, password)\n",
                        "Validates user credentials."),
                new ParsedSymbol("connect_db", SymbolKind.FUNCTION, "db/pool.py", 1, 2,
                        "def connect_db(url):\n    return Pool(url)\n", "Opens the database pool.")));
        assembler = new ContextAssembler(new HybridRanker(corpus, embedder, 0.7, 3, 50), 5, 0.0, 6000);
    }

    @Test
    void shouldGroundQuestionAndCiteRetrievedCode() {
        CodeAssistant assistant = new CodeAssistant(assembler, recording, 100);

        CodeAssistant.Answer answer = assistant.ask("how is the user password checked?", List.of());

        assertTrue(answer.usedRetrieval());
        assertFalse(answer.citations().isEmpty());
        assertTrue(prompts.get(0).startsWith(PromptBuilder.QUESTION_MARKER));
        assertTrue(prompts.get(0).contains("authenticate_user"));
    }

    @Test
    void shouldAnswerUngroundedWhenRetrievalFails() {
        embedder.failWhen(text -> true);
        CodeAssistant assistant = new CodeAssistant(assembler, recording, 100);

        CodeAssistant.Answer answer = assistant.ask("how is the user password checked?", List.of());

        assertFalse(answer.usedRetrieval());
        assertTrue(answer.citations().isEmpty());
        assertEquals("how is the user password checked?", prompts.get(0));
    }

    @Test
    void shouldPassTrimmedHistoryToCompletionService() {
        CodeAssistant assistant = new CodeAssistant(assembler, recording, 3);
        List<ChatMessage> history = List.of(
                ChatMessage.user("first long question here"), ChatMessage.assistant("first answer"),
                ChatMessage.user("second"), ChatMessage.assistant("answer"));

        assertEquals("answer 2", assistant.ask("database?", history).text());
    }

    @Test
    void shouldRejectBlankQuestion() {
        CodeAssistant assistant = new CodeAssistant(assembler, recording, 100);

        assertThrows(IllegalArgumentException.class, () -> assistant.ask(" ", List.of()));
    }

    @Test
    void shouldAnswerOfflineWithCitedLines() {
        CodeAssistant assistant = new CodeAssistant(assembler, new ExtractiveCompletionService(500), 100);

        CodeAssistant.Answer answer = assistant.ask("where is the password checked", List.of());

        assertTrue(answer.text().startsWith("Relevant code for: where is the password checked"));
        assertTrue(answer.text().contains("[1] File: "));
        assertTrue(answer.text().contains("return check_password(name, password)"));
    }

    @Test
    void shouldTellUserWhenNothingWasRetrieved() {
        String answer = new ExtractiveCompletionService(500).complete("what is this?", List.of());

        assertTrue(answer.startsWith("No indexed code matched"));
    }
}
