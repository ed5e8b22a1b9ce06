package com.codesniff.corpus;

import java.util.Map;
import java.util.TreeMap;

import com.codesniff.index.CodeTokenizer;
import com.codesniff.ingest.Symbol;

/**
 * Term frequencies for the lexical index. Name terms count three times and doc terms twice so a
 * symbol is found by what it is called and what it says it does before what its body mentions.
 */
public final class TermVectors {
    static final int NAME_WEIGHT = 3;
    static final int DOC_WEIGHT = 2;
    static final int CODE_WEIGHT = 1;

    private final CodeTokenizer tokenizer;

    public TermVectors(CodeTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    public Map<String, Integer> of(Symbol symbol) {
        Map<String, Integer> terms = new TreeMap<>();
        add(terms, symbol.name(), NAME_WEIGHT);
        add(terms, symbol.docText(), DOC_WEIGHT);
        add(terms, symbol.codeText(), CODE_WEIGHT);
        // kind labels are stopwords for code text but still useful as a term
        terms.merge(symbol.kind().label(), 1, Integer::sum);
        return terms;
    }

    private void add(Map<String, Integer> terms, String text, int weight) {
        for (String term : tokenizer.tokenize(text)) {
            terms.merge(term, weight, Integer::sum);
        }
    }
}
