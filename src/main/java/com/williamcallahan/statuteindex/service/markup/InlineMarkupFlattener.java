package com.williamcallahan.statuteindex.service.markup;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Rewrites inline legislative markup into plain text before the document is parsed structurally.
 *
 * <p>Amendment and cross-reference markup sits in the middle of sentences:
 * {@code <p>Most processing is subject to the <ins>UK GDPR</ins>.</p>}. Tree-based extraction
 * detaches such inline text from its surrounding prose, so the inline elements are flattened to
 * their text content first:</p>
 * <ul>
 *   <li>{@code noteRef}, {@code marker} and self-closing {@code ref}: removed entirely</li>
 *   <li>{@code ins}, {@code del}, {@code ref}, {@code authorialNote}: replaced by their inner text</li>
 * </ul>
 *
 * <p>All other structure is left untouched and inline markup that does not match these shapes is
 * left as-is. Paired elements are unwrapped until nothing changes, so flattening flattened text is a
 * no-op.</p>
 */
@Component
public class InlineMarkupFlattener {

    private static final Pattern SELF_CLOSING_INLINE =
            Pattern.compile("<(?:noteRef|marker|ref)\\b[^>]*/>");
    private static final Pattern PAIRED_INLINE =
            Pattern.compile("<(ins|del|ref|authorialNote)\\b[^>]*(?<!/)>(.*?)</\\1\\s*>", Pattern.DOTALL);
    private static final int MAX_UNWRAP_PASSES = 16;

    /**
     * Flattens inline elements in a markup document.
     *
     * @param markup raw markup text (may be null)
     * @return markup with inline elements flattened, or empty string if null
     */
    public String flatten(String markup) {
        if (markup == null || markup.isEmpty()) {
            return "";
        }
        String flattened = SELF_CLOSING_INLINE.matcher(markup).replaceAll("");
        for (int pass = 0; pass < MAX_UNWRAP_PASSES; pass++) {
            String unwrapped = unwrapPairedElements(flattened);
            if (unwrapped.equals(flattened)) {
                break;
            }
            flattened = unwrapped;
        }
        // Self-closing references that were inside an unwrapped element.
        return SELF_CLOSING_INLINE.matcher(flattened).replaceAll("");
    }

    private static String unwrapPairedElements(String markup) {
        Matcher matcher = PAIRED_INLINE.matcher(markup);
        StringBuilder rewritten = new StringBuilder(markup.length());
        while (matcher.find()) {
            matcher.appendReplacement(rewritten, Matcher.quoteReplacement(matcher.group(2)));
        }
        matcher.appendTail(rewritten);
        return rewritten.toString();
    }
}
