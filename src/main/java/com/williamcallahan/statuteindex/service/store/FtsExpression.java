package com.williamcallahan.statuteindex.service.store;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.index.Term;
import org.apache.lucene.queries.spans.SpanMultiTermQueryWrapper;
import org.apache.lucene.queries.spans.SpanNearQuery;
import org.apache.lucene.queries.spans.SpanQuery;
import org.apache.lucene.queries.spans.SpanTermQuery;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.MultiTermQuery;
import org.apache.lucene.search.PhraseQuery;
import org.apache.lucene.search.PrefixQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.TermQuery;

/**
 * Translates the full-text expression subset produced by the query normalizer into a Lucene query.
 *
 * <p>Whitespace-separated terms must all match, {@code OR} separates alternatives, {@code NOT}
 * excludes the following term, double quotes delimit a phrase, and a trailing {@code *} turns the
 * last word of a term into a prefix match. Term text is analyzed with the same analyzer as the
 * indexed provisions.</p>
 */
final class FtsExpression {

    private static final Pattern ALTERNATIVE_SEPARATOR = Pattern.compile("\\s+OR\\s+");
    private static final Pattern TERM_TOKEN = Pattern.compile("\"([^\"]*)\"(\\*?)|(\\S+)");
    private static final String AND_KEYWORD = "AND";
    private static final String NOT_KEYWORD = "NOT";
    private static final String PREFIX_MARKER = "*";
    private static final String ANALYSIS_FIELD = "expression";
    private static final int MAX_PREFIX_EXPANSIONS = 128;

    private final List<List<Clause>> alternatives;

    private FtsExpression(List<List<Clause>> alternatives) {
        this.alternatives = alternatives;
    }

    static FtsExpression parse(String expression, Analyzer analyzer) {
        Objects.requireNonNull(analyzer, "analyzer");
        List<List<Clause>> alternatives = new ArrayList<>();
        if (expression == null || expression.isBlank()) {
            return new FtsExpression(alternatives);
        }
        String normalized = expression.replace('\u201C', '"').replace('\u201D', '"').trim();
        for (String alternative : ALTERNATIVE_SEPARATOR.split(normalized)) {
            List<Clause> clauses = parseClauses(alternative, analyzer);
            if (clauses.stream().anyMatch(clause -> !clause.negated())) {
                alternatives.add(clauses);
            }
        }
        return new FtsExpression(alternatives);
    }

    /**
     * Splits text into the tokens the analyzer would index.
     */
    static List<String> analyze(Analyzer analyzer, String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        try (TokenStream tokenStream = analyzer.tokenStream(ANALYSIS_FIELD, text)) {
            CharTermAttribute termAttribute = tokenStream.addAttribute(CharTermAttribute.class);
            tokenStream.reset();
            while (tokenStream.incrementToken()) {
                tokens.add(termAttribute.toString());
            }
            tokenStream.end();
        } catch (IOException ioException) {
            throw new IllegalStateException("Failed to analyze search expression", ioException);
        }
        return tokens;
    }

    boolean isEmpty() {
        return alternatives.isEmpty();
    }

    /**
     * Builds the query over one text field; an alternative matches when all its positive clauses
     * match and none of its negated ones do.
     */
    Query toQuery(String field) {
        BooleanQuery.Builder anyAlternative = new BooleanQuery.Builder();
        for (List<Clause> clauses : alternatives) {
            BooleanQuery.Builder allClauses = new BooleanQuery.Builder();
            for (Clause clause : clauses) {
                allClauses.add(clause.toQuery(field),
                        clause.negated() ? BooleanClause.Occur.MUST_NOT : BooleanClause.Occur.MUST);
            }
            anyAlternative.add(allClauses.build(), BooleanClause.Occur.SHOULD);
        }
        return anyAlternative.build();
    }

    private static List<Clause> parseClauses(String alternative, Analyzer analyzer) {
        List<Clause> clauses = new ArrayList<>();
        boolean negateNext = false;
        Matcher matcher = TERM_TOKEN.matcher(alternative);
        while (matcher.find()) {
            List<String> words;
            boolean prefix;
            if (matcher.group(1) != null) {
                words = analyze(analyzer, matcher.group(1));
                prefix = !matcher.group(2).isEmpty();
            } else {
                String token = matcher.group(3);
                if (AND_KEYWORD.equals(token)) {
                    continue;
                }
                if (NOT_KEYWORD.equals(token)) {
                    negateNext = true;
                    continue;
                }
                prefix = token.endsWith(PREFIX_MARKER);
                words = analyze(analyzer, token);
            }
            if (!words.isEmpty()) {
                clauses.add(new Clause(List.copyOf(words), prefix, negateNext));
            }
            negateNext = false;
        }
        return clauses;
    }

    /**
     * One word or phrase; a prefix clause matches its last word by prefix.
     */
    private record Clause(List<String> words, boolean prefix, boolean negated) {

        Query toQuery(String field) {
            if (words.size() == 1) {
                return prefix ? prefixQuery(field, words.get(0)) : new TermQuery(new Term(field, words.get(0)));
            }
            if (!prefix) {
                return new PhraseQuery(field, words.toArray(String[]::new));
            }
            SpanQuery[] positions = new SpanQuery[words.size()];
            for (int i = 0; i < words.size() - 1; i++) {
                positions[i] = new SpanTermQuery(new Term(field, words.get(i)));
            }
            positions[words.size() - 1] = new SpanMultiTermQueryWrapper<>(prefixQuery(field, words.get(words.size() - 1)));
            return new SpanNearQuery(positions, 0, true);
        }

        private static PrefixQuery prefixQuery(String field, String word) {
            // scoring rewrite so provisions with more occurrences rank higher
            return new PrefixQuery(
                    new Term(field, word), new MultiTermQuery.TopTermsScoringBooleanQueryRewrite(MAX_PREFIX_EXPANSIONS));
        }
    }
}
