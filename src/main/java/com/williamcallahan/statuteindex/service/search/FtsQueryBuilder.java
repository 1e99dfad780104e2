package com.williamcallahan.statuteindex.service.search;

import com.williamcallahan.statuteindex.domain.search.FtsQueryVariants;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Normalizes free-text search input into full-text expressions.
 *
 * <p>Plain queries become a strict expression (every token as a quoted prefix term, all required)
 * with a loose fallback (any token as a prefix). Queries that already use expression syntax
 * (quotes, boolean operators, a trailing wildcard) are passed through untouched.</p>
 */
@Component
public class FtsQueryBuilder {

    private static final Pattern EXPLICIT_SYNTAX = Pattern.compile("[\"\u201C\u201D]|\\bAND\\b|\\bOR\\b|\\bNOT\\b|\\*$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TOKEN_NOISE = Pattern.compile("[^\\w\\s-]");

    /**
     * Builds the query variants.
     *
     * @param query free-text query (may be null)
     * @return strict expression plus optional fallback
     */
    public FtsQueryVariants build(String query) {
        String trimmed = query == null ? "" : query.trim();
        if (EXPLICIT_SYNTAX.matcher(trimmed).find()) {
            return FtsQueryVariants.primaryOnly(trimmed);
        }

        List<String> tokens = new ArrayList<>();
        for (String rawToken : WHITESPACE.split(trimmed)) {
            String token = TOKEN_NOISE.matcher(rawToken).replaceAll("");
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        if (tokens.isEmpty()) {
            return FtsQueryVariants.primaryOnly(trimmed);
        }

        List<String> strictTerms = new ArrayList<>(tokens.size());
        List<String> looseTerms = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            strictTerms.add("\"" + token + "\"*");
            looseTerms.add(token + "*");
        }
        return new FtsQueryVariants(String.join(" ", strictTerms), String.join(" OR ", looseTerms));
    }
}
