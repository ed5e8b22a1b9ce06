package com.codesniff;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codesniff.completion.ChatMessage;
import com.codesniff.completion.CodeAssistant;
import com.codesniff.completion.CompletionServices;
import com.codesniff.context.AssembledContext;
import com.codesniff.context.Citation;
import com.codesniff.corpus.CorpusStats;
import com.codesniff.corpus.RunStats;
import com.codesniff.corpus.SymbolFailure;
import com.codesniff.error.CodeSniffException;
import com.codesniff.ingest.EmbeddingServices;
import com.codesniff.ingest.Symbol;
import com.codesniff.ingest.SymbolKind;
import com.codesniff.runtime.AppConfig;
import com.codesniff.search.SearchException;
import com.codesniff.search.SearchRequest;
import com.codesniff.search.SearchResult;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(
        name = "codesniff",
        mixinStandardHelpOptions = true,
        version = "codesniff 0.1.0",
        description = "Hybrid semantic and lexical search over code symbols.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    private static final int MAX_HISTORY_WORDS = 1500;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "stats")
    Mode mode;

    @Parameters(index = "0", arity = "0..1", description = "Optional shortcut for --mode (e.g. search)")
    String commandAlias;

    @Option(names = "--data-dir", description = "Corpus directory; defaults to corpus.dataDir from the config")
    Path dataDir;

    @Option(names = "--source", description = "Directory to scan in index mode")
    Path source;

    @Option(names = { "-q", "--query" }, description = "Query text for search and context modes")
    String query;

    @Option(names = "--limit", description = "Maximum results; defaults to search.defaultLimit")
    Integer limit;

    @Option(names = "--min-score", description = "Minimum fused score; defaults to search.minScore")
    Double minScore;

    @Option(names = "--kind", description = "Restrict results to function, class or method")
    String kind;

    @Option(names = "--file", description = "Restrict results to file paths containing this text")
    String fileFilter;

    @Option(names = "--name", description = "Symbol name for lookup mode")
    String name;

    @Option(names = "--code", description = "Code snippet for similar mode")
    String code;

    @Option(names = "--code-file", description = "File holding the code snippet for similar mode")
    Path codeFile;

    private final OkHttpClient httpClient = new OkHttpClient();
    private final PrintStream out;
    private final InputStream in;

    enum Mode {
        index,
        search,
        similar,
        lookup,
        context,
        chat,
        stats,
        clear
    }

    public Main() {
        this(System.out, System.in);
    }

    Main(PrintStream out, InputStream in) {
        this.out = out;
        this.in = in;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        if (commandAlias != null) {
            try {
                mode = Mode.valueOf(commandAlias.toLowerCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                log.error("Unknown command {}", commandAlias);
                return 2;
            }
        }

        AppConfig config = AppConfig.load(Path.of(configPath));
        Path corpusDir = dataDir != null ? dataDir : Path.of(config.getCorpus().getDataDir());
        log.info("Starting codesniff mode={} config={} dataDir={}", mode, configPath, corpusDir);

        CodeSearchEngine engine;
        try {
            engine = CodeSearchEngine.open(corpusDir, config, EmbeddingServices.fromConfig(config, httpClient));
        } catch (CodeSniffException e) {
            log.error("Unable to open corpus at {}: {}", corpusDir, e.getMessage());
            return 1;
        }

        try {
            return switch (mode) {
                case index -> runIndex(engine, corpusDir);
                case search -> runSearch(engine, config);
                case similar -> runSimilar(engine, config);
                case lookup -> runLookup(engine);
                case context -> runContext(engine);
                case chat -> runChat(engine, config);
                case stats -> runStats(engine);
                case clear -> runClear(engine, corpusDir);
            };
        } catch (SearchException e) {
            log.error("Search failed: {}", e.getMessage());
            return 1;
        }
    }

    private int runIndex(CodeSearchEngine engine, Path corpusDir) throws IOException {
        if (source == null || !Files.isDirectory(source)) {
            log.error("--source must point to an existing directory in index mode");
            return 2;
        }
        RunStats stats = engine.indexDirectory(source);
        engine.persist(corpusDir);
        out.printf("Indexed %d symbols (%d unchanged, %d failed, %d removed) from %d files, %d lines in %d ms%n",
                stats.processed(), stats.skipped(), stats.failed(), stats.removed(), stats.files(),
                stats.totalLines(), stats.elapsed().toMillis());
        stats.countsByKind().forEach((symbolKind, count) -> out.printf("  %s: %d%n", symbolKind.label(), count));
        for (SymbolFailure failure : stats.failures()) {
            if (failure.category() == SymbolFailure.Category.PARSE) {
                out.printf("  unparsed %s: %s%n", failure.filePath(), failure.message());
            } else {
                out.printf("  failed #%d %s (%s): %s%n", failure.position(), failure.symbol(), failure.category(), failure.message());
            }
        }
        return 0;
    }

    private int runSearch(CodeSearchEngine engine, AppConfig config) {
        if (query == null || query.isBlank()) {
            log.error("--query is required in search mode");
            return 2;
        }
        Optional<SymbolKind> symbolKind = Optional.empty();
        if (kind != null) {
            symbolKind = SymbolKind.fromLabel(kind);
            if (symbolKind.isEmpty()) {
                log.error("--kind must be one of function, class, method");
                return 2;
            }
        }
        SearchRequest request = new SearchRequest(
                query,
                limit != null ? limit : config.getSearch().getDefaultLimit(),
                minScore != null ? minScore : config.getSearch().getMinScore(),
                symbolKind,
                Optional.empty()).withFilePathFilter(fileFilter);
        printResults(engine.search(request));
        return 0;
    }

    private int runSimilar(CodeSearchEngine engine, AppConfig config) throws IOException {
        String snippet = codeFile != null ? Files.readString(codeFile, StandardCharsets.UTF_8) : code;
        if (snippet == null || snippet.isBlank()) {
            log.error("--code or --code-file is required in similar mode");
            return 2;
        }
        printResults(engine.ranker().findSimilar(
                snippet,
                limit != null ? limit : config.getSearch().getDefaultLimit(),
                minScore != null ? minScore : config.getSearch().getMinScore()));
        return 0;
    }

    private int runLookup(CodeSearchEngine engine) {
        if (name == null || name.isBlank()) {
            log.error("--name is required in lookup mode");
            return 2;
        }
        List<Symbol> symbols = engine.ranker().findByName(name, Optional.ofNullable(fileFilter));
        if (symbols.isEmpty()) {
            out.println("No symbol named " + name);
            return 1;
        }
        for (Symbol symbol : symbols) {
            out.printf("%s %s %s:%d-%d%n", symbol.kind().label(), symbol.name(), symbol.filePath(),
                    symbol.startLine(), symbol.endLine());
        }
        return 0;
    }

    private int runContext(CodeSearchEngine engine) {
        if (query == null || query.isBlank()) {
            log.error("--query is required in context mode");
            return 2;
        }
        AssembledContext context = engine.buildContext(query);
        if (!context.grounded()) {
            out.println("No grounding available for this query.");
            return 0;
        }
        out.println(context.text());
        printCitations(context.citations());
        return 0;
    }

    private int runChat(CodeSearchEngine engine, AppConfig config) throws IOException {
        CodeAssistant assistant = new CodeAssistant(
                engine.contextAssembler(), CompletionServices.fromConfig(config, httpClient), MAX_HISTORY_WORDS);
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        List<ChatMessage> history = new ArrayList<>();
        List<Citation> lastSources = List.of();

        out.println("codesniff chat ready. End multiline input with a single '.' line. Type /help for commands.");
        while (true) {
            out.print("you> ");
            out.flush();
            String question = readMultilinePrompt(reader);
            if (question == null || "/exit".equals(question) || "/quit".equals(question)) {
                break;
            }
            if (question.isBlank()) {
                continue;
            }
            if ("/help".equals(question)) {
                out.println("Commands: /help, /reset, /source, /exit. End multiline with '.'");
                continue;
            }
            if ("/reset".equals(question)) {
                history.clear();
                lastSources = List.of();
                out.println("Conversation reset.");
                continue;
            }
            if ("/source".equals(question)) {
                if (lastSources.isEmpty()) {
                    out.println("No retrieval sources for the last answer.");
                } else {
                    printCitations(lastSources);
                }
                continue;
            }

            CodeAssistant.Answer answer;
            try {
                answer = assistant.ask(question, history);
            } catch (CodeSniffException e) {
                log.warn("chat.failed reason={}", e.getMessage());
                out.println("assistant> The completion service failed: " + e.getMessage());
                continue;
            }
            out.println("assistant> " + answer.text());
            if (!answer.usedRetrieval()) {
                out.println("(answered without code context)");
            }
            lastSources = answer.citations();
            history.add(ChatMessage.user(question));
            history.add(ChatMessage.assistant(answer.text()));
        }
        return 0;
    }

    private int runStats(CodeSearchEngine engine) {
        CorpusStats stats = engine.stats();
        out.printf("symbols=%d files=%d vectors=%d terms=%d avgDocLength=%.2f dimension=%d version=%d ready=%s%n",
                stats.totalSymbols(), stats.totalFiles(), stats.vectorCount(), stats.uniqueTerms(),
                stats.averageDocumentLength(), stats.dimension(), stats.version(), stats.ready());
        stats.countsByKind().forEach((symbolKind, count) -> out.printf("  %s: %d%n", symbolKind.label(), count));
        return 0;
    }

    private int runClear(CodeSearchEngine engine, Path corpusDir) throws IOException {
        engine.clear();
        engine.persist(corpusDir);
        out.println("Corpus cleared.");
        return 0;
    }

    private void printResults(List<SearchResult> results) {
        if (results.isEmpty()) {
            out.println("No results.");
            return;
        }
        for (int i = 0; i < results.size(); i++) {
            SearchResult result = results.get(i);
            Symbol symbol = result.symbol();
            out.printf(Locale.ROOT, "#%d %.3f (semantic=%.3f lexical=%.3f) %s %s %s:%d-%d%s%n",
                    i + 1, result.score(), result.similarity(), result.lexical(),
                    symbol.kind().label(), symbol.name(), symbol.filePath(), symbol.startLine(), symbol.endLine(),
                    result.matchedTerms().isEmpty() ? "" : " matched=" + result.matchedTerms());
        }
    }

    private void printCitations(List<Citation> citations) {
        for (int i = 0; i < citations.size(); i++) {
            Citation citation = citations.get(i);
            out.printf(Locale.ROOT, "[%d] %s %s (%.0f%%)%n", i + 1, citation.symbol(), citation.location(),
                    citation.similarity() * 100);
        }
    }

    private static String readMultilinePrompt(BufferedReader reader) throws IOException {
        StringBuilder builder = new StringBuilder();
        while (true) {
            String line = reader.readLine();
            if (line == null) {
                return builder.length() == 0 ? null : builder.toString().trim();
            }
            if (".".equals(line)) {
                break;
            }
            if (builder.length() > 0) {
                builder.append('\n');
            }
            builder.append(line);
            if (builder.toString().startsWith("/")) {
                break;
            }
        }
        return builder.toString().trim();
    }
}
