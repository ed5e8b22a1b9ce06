package com.codesniff.search;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.codesniff.index.CodeTokenizer;

/**
 * Turns a query into weighted lexical terms: the query's own tokens at full weight, their stems
 * slightly lower and domain synonyms lower still. A term reached several ways keeps its highest
 * weight.
 */
public class QueryExpander {
    static final double STEM_WEIGHT = 0.85;
    static final double SYNONYM_WEIGHT = 0.7;

    private static final Map<String, List<String>> SYNONYMS = Map.ofEntries(
            Map.entry("audio", List.of("sound", "wav", "mp3", "music", "speaker", "volume")),
            Map.entry("animation", List.of("animate", "animated", "motion", "transition")),
            Map.entry("database", List.of("db", "sql", "sqlite", "postgres", "mysql", "query")),
            Map.entry("db", List.of("database", "sql", "sqlite")),
            Map.entry("auth", List.of("authentication", "authorize", "login", "credential")),
            Map.entry("authentication", List.of("auth", "login", "credential", "password", "user")),
            Map.entry("login", List.of("auth", "signin", "authentication")),
            Map.entry("error", List.of("exception", "fail", "invalid", "problem")),
            Map.entry("exception", List.of("error", "raise", "catch", "handle")),
            Map.entry("config", List.of("configuration", "settings", "options", "preferences")),
            Map.entry("configuration", List.of("config", "settings", "setup")),
            Map.entry("http", List.of("request", "response", "api", "rest", "web")),
            Map.entry("api", List.of("endpoint", "route", "http", "rest")),
            Map.entry("file", List.of("path", "directory", "folder", "io")),
            Map.entry("parse", List.of("parser", "parsing", "extract", "analyze")),
            Map.entry("parser", List.of("parse", "parsing", "tokenize")),
            Map.entry("test", List.of("testing", "unittest", "pytest")),
            Map.entry("valid", List.of("validate", "validation", "validator", "check")),
            Map.entry("validate", List.of("valid", "validation", "validator", "verify")),
            Map.entry("connect", List.of("connection", "connected", "connecting", "link")),
            Map.entry("connection", List.of("connect", "connected", "link", "socket")),
            Map.entry("index", List.of("indexer", "indexing", "indexed")),
            Map.entry("search", List.of("find", "query", "lookup", "match")),
            Map.entry("user", List.of("account", "profile", "member")),
            Map.entry("create", List.of("make", "add", "insert", "generate")),
            Map.entry("delete", List.of("remove", "destroy", "drop")),
            Map.entry("update", List.of("modify", "change", "edit", "patch")),
            Map.entry("get", List.of("fetch", "retrieve", "read", "obtain")),
            Map.entry("load", List.of("read", "import", "fetch", "retrieve")),
            Map.entry("save", List.of("write", "store", "export", "persist")),
            Map.entry("send", List.of("transmit", "emit", "dispatch", "post")),
            Map.entry("process", List.of("handle", "execute", "run", "perform")),
            Map.entry("handle", List.of("process", "manage")),
            Map.entry("cache", List.of("store", "buffer", "memory")),
            Map.entry("encrypt", List.of("encryption", "hash", "secure", "crypto")),
            Map.entry("decrypt", List.of("decryption", "decode")));

    private final CodeTokenizer tokenizer;

    public QueryExpander(CodeTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    List<String> terms(String query) {
        return tokenizer.tokenize(query);
    }

    public Map<String, Double> expand(String query) {
        Map<String, Double> weighted = new LinkedHashMap<>();
        for (String token : tokenizer.tokenize(query)) {
            put(weighted, token, 1.0);
            String stem = CodeTokenizer.stem(token);
            put(weighted, stem, STEM_WEIGHT);
            addSynonyms(weighted, token);
            if (!stem.equals(token)) {
                addSynonyms(weighted, stem);
            }
        }
        return weighted;
    }

    private static void addSynonyms(Map<String, Double> weighted, String token) {
        for (String synonym : SYNONYMS.getOrDefault(token, List.of())) {
            put(weighted, synonym, SYNONYM_WEIGHT);
            put(weighted, CodeTokenizer.stem(synonym), SYNONYM_WEIGHT);
        }
    }

    private static void put(Map<String, Double> weighted, String term, double weight) {
        weighted.merge(term, weight, Math::max);
    }
}
