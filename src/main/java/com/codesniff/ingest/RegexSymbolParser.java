package com.codesniff.ingest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented symbol extraction. Python blocks are delimited by indentation, JavaScript and
 * TypeScript blocks by brace depth.
 */
public class RegexSymbolParser implements SymbolParser {
    private static final Pattern PY_DEF = Pattern.compile("^(\\s*)(?:async\\s+)?def\\s+([A-Za-z_]\\w*)\\s*\\(");
    private static final Pattern PY_CLASS = Pattern.compile("^(\\s*)class\\s+([A-Za-z_]\\w*)\\s*[(:]");

    private static final Pattern JS_FUNCTION = Pattern.compile(
            "^\\s*(?:export\\s+)?(?:default\\s+)?(?:async\\s+)?function\\s*\\*?\\s*([A-Za-z_$][\\w$]*)\\s*[(<]");
    private static final Pattern JS_CLASS = Pattern.compile(
            "^\\s*(?:export\\s+)?(?:default\\s+)?(?:abstract\\s+)?class\\s+([A-Za-z_$][\\w$]*)");
    private static final Pattern JS_ARROW = Pattern.compile(
            "^\\s*(?:export\\s+)?(?:const|let|var)\\s+([A-Za-z_$][\\w$]*)\\s*(?::[^=]+)?=\\s*(?:async\\s+)?"
                    + "(?:function\\b|\\([^)]*\\)\\s*(?::[^=]+)?=>|[A-Za-z_$][\\w$]*\\s*=>)");
    private static final Pattern JS_METHOD = Pattern.compile(
            "^\\s*(?:(?:public|private|protected|static|async|readonly|override|get|set)\\s+)*\\*?"
                    + "([A-Za-z_$][\\w$]*)\\s*(?:<[^>]*>)?\\s*\\([^)]*\\)\\s*(?::\\s*[^{]+)?\\{");
    private static final Set<String> JS_KEYWORDS = Set.of(
            "if", "for", "while", "switch", "catch", "function", "return", "with", "do", "else", "new");

    public enum BlockStyle {
        INDENTATION,
        BRACES
    }

    private final List<String> extensions;
    private final BlockStyle blockStyle;

    public RegexSymbolParser(List<String> extensions, BlockStyle blockStyle) {
        this.extensions = extensions;
        this.blockStyle = blockStyle;
    }

    public static List<SymbolParser> defaults() {
        return List.of(
                new RegexSymbolParser(List.of(".py"), BlockStyle.INDENTATION),
                new RegexSymbolParser(List.of(".js", ".jsx", ".mjs", ".ts", ".tsx"), BlockStyle.BRACES));
    }

    @Override
    public boolean supports(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(fileName::endsWith);
    }

    @Override
    public List<ParsedSymbol> parse(Path path, String relativePath) throws IOException {
        if (!supports(path)) {
            return List.of();
        }
        // malformed bytes decode to U+FFFD instead of failing the file
        String content = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        String[] lines = content.split("\\R", -1);
        return switch (blockStyle) {
            case INDENTATION -> parseIndented(lines, relativePath);
            case BRACES -> parseBraced(lines, relativePath);
        };
    }

    private List<ParsedSymbol> parseIndented(String[] lines, String relativePath) {
        List<ParsedSymbol> symbols = new ArrayList<>();
        Deque<int[]> classScopes = new ArrayDeque<>();
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank()) {
                continue;
            }
            int indent = indentOf(line);
            while (!classScopes.isEmpty() && indent <= classScopes.peek()[0]) {
                classScopes.pop();
            }

            Matcher classMatcher = PY_CLASS.matcher(line);
            Matcher defMatcher = PY_DEF.matcher(line);
            SymbolKind kind;
            String name;
            if (classMatcher.find()) {
                kind = SymbolKind.CLASS;
                name = classMatcher.group(2);
            } else if (defMatcher.find()) {
                name = defMatcher.group(2);
                boolean directlyInClass = !classScopes.isEmpty() && classScopes.peek()[1] == 1;
                kind = directlyInClass ? SymbolKind.METHOD : SymbolKind.FUNCTION;
            } else {
                continue;
            }

            int end = indentedBlockEnd(lines, i, indent);
            String code = String.join("\n", java.util.Arrays.copyOfRange(lines, i, end + 1));
            symbols.add(new ParsedSymbol(name, kind, relativePath, i + 1, end + 1, code, pythonDocstring(lines, i, end)));

            if (kind == SymbolKind.CLASS) {
                classScopes.push(new int[] {indent, 1});
            } else if (!classScopes.isEmpty()) {
                // defs nested inside a method are plain functions
                classScopes.push(new int[] {indent, 0});
            }
        }
        return symbols;
    }

    private static int indentedBlockEnd(String[] lines, int start, int indent) {
        int end = headerEnd(lines, start);
        for (int i = end + 1; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank()) {
                continue;
            }
            if (indentOf(line) <= indent) {
                break;
            }
            end = i;
        }
        return end;
    }

    /**
     * Last line of a possibly multi-line signature, found by balancing parentheses.
     */
    private static int headerEnd(String[] lines, int start) {
        int balance = 0;
        for (int i = start; i < lines.length; i++) {
            for (char ch : lines[i].toCharArray()) {
                if (ch == '(' || ch == '[') {
                    balance++;
                } else if (ch == ')' || ch == ']') {
                    balance--;
                }
            }
            if (balance <= 0) {
                return i;
            }
        }
        return lines.length - 1;
    }

    private static String pythonDocstring(String[] lines, int start, int end) {
        int first = headerEnd(lines, start) + 1;
        while (first <= end && lines[first].isBlank()) {
            first++;
        }
        if (first > end) {
            return "";
        }
        String opening = lines[first].strip();
        String quote = opening.startsWith("\"\"\"") ? "\"\"\"" : opening.startsWith("'''") ? "'''" : null;
        if (quote == null) {
            return "";
        }
        String rest = opening.substring(3);
        int close = rest.indexOf(quote);
        if (close >= 0) {
            return rest.substring(0, close).strip();
        }
        StringBuilder doc = new StringBuilder(rest.strip());
        for (int i = first + 1; i <= end; i++) {
            String line = lines[i].strip();
            int idx = line.indexOf(quote);
            if (idx >= 0) {
                appendLine(doc, line.substring(0, idx));
                break;
            }
            appendLine(doc, line);
        }
        return doc.toString().strip();
    }

    private List<ParsedSymbol> parseBraced(String[] lines, String relativePath) {
        int[] depthAtStart = new int[lines.length + 1];
        int depth = 0;
        for (int i = 0; i < lines.length; i++) {
            depthAtStart[i] = depth;
            depth += braceDelta(lines[i]);
        }
        depthAtStart[lines.length] = depth;

        List<ParsedSymbol> symbols = new ArrayList<>();
        List<int[]> classRanges = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            SymbolKind kind = null;
            String name = null;

            Matcher matcher = JS_CLASS.matcher(line);
            if (matcher.find()) {
                kind = SymbolKind.CLASS;
                name = matcher.group(1);
            } else if ((matcher = JS_FUNCTION.matcher(line)).find() || (matcher = JS_ARROW.matcher(line)).find()) {
                kind = SymbolKind.FUNCTION;
                name = matcher.group(1);
            } else if (insideClassBody(classRanges, depthAtStart, i)) {
                matcher = JS_METHOD.matcher(line);
                if (matcher.find() && !JS_KEYWORDS.contains(matcher.group(1))) {
                    kind = SymbolKind.METHOD;
                    name = matcher.group(1);
                }
            }
            if (kind == null) {
                continue;
            }

            int end = bracedBlockEnd(lines, depthAtStart, i);
            if (kind == SymbolKind.CLASS) {
                classRanges.add(new int[] {i, end});
            }
            String code = String.join("\n", java.util.Arrays.copyOfRange(lines, i, end + 1));
            symbols.add(new ParsedSymbol(name, kind, relativePath, i + 1, end + 1, code, jsDoc(lines, i)));
        }
        return symbols;
    }

    private static boolean insideClassBody(List<int[]> classRanges, int[] depthAtStart, int line) {
        for (int[] range : classRanges) {
            if (line > range[0] && line <= range[1] && depthAtStart[line] == depthAtStart[range[0]] + 1) {
                return true;
            }
        }
        return false;
    }

    private static int bracedBlockEnd(String[] lines, int[] depthAtStart, int start) {
        int base = depthAtStart[start];
        boolean opened = false;
        for (int i = start; i < lines.length; i++) {
            if (lines[i].indexOf('{') >= 0) {
                opened = true;
            }
            if (opened && depthAtStart[i + 1] <= base) {
                return i;
            }
            if (!opened && i > start && lines[i].isBlank()) {
                // expression-bodied arrow function without braces
                return i - 1;
            }
            if (!opened && lines[i].stripTrailing().endsWith(";")) {
                return i;
            }
        }
        return lines.length - 1;
    }

    private static int braceDelta(String line) {
        int delta = 0;
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (quote != 0) {
                if (ch == '\\') {
                    i++;
                } else if (ch == quote) {
                    quote = 0;
                }
                continue;
            }
            if (ch == '/' && i + 1 < line.length() && line.charAt(i + 1) == '/') {
                break;
            }
            if (ch == '"' || ch == '\'' || ch == '`') {
                quote = ch;
            } else if (ch == '{') {
                delta++;
            } else if (ch == '}') {
                delta--;
            }
        }
        return delta;
    }

    private static String jsDoc(String[] lines, int start) {
        int i = start - 1;
        while (i >= 0 && lines[i].isBlank()) {
            i--;
        }
        if (i < 0 || !lines[i].strip().endsWith("*/")) {
            return "";
        }
        int close = i;
        while (i >= 0 && !lines[i].strip().startsWith("/**")) {
            i--;
        }
        if (i < 0) {
            return "";
        }
        StringBuilder doc = new StringBuilder();
        for (int j = i; j <= close; j++) {
            String line = lines[j].strip()
                    .replaceFirst("^/\\*\\*", "")
                    .replaceFirst("\\*/$", "")
                    .replaceFirst("^\\*", "")
                    .strip();
            if (line.startsWith("@")) {
                continue;
            }
            appendLine(doc, line);
        }
        return doc.toString().strip();
    }

    private static void appendLine(StringBuilder builder, String line) {
        if (line.isBlank()) {
            return;
        }
        if (builder.length() > 0) {
            builder.append(' ');
        }
        builder.append(line.strip());
    }

    private static int indentOf(String line) {
        int indent = 0;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == ' ') {
                indent++;
            } else if (ch == '\t') {
                indent += 4;
            } else {
                break;
            }
        }
        return indent;
    }
}
