package com.pagesmith.orchestrator.generation;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a raw model reply into an HTML document, or rejects it.
 *
 * Models like to wrap pages in markdown fences and chat around them, so we:
 *   1. drop ``` fences (with or without an "html" label)
 *   2. cut everything before the first {@code <!DOCTYPE} / {@code <html}
 *   3. cut everything after the last {@code </html>}
 *   4. prepend {@code <!DOCTYPE html>} when it is missing
 *
 * A reply that still lacks an {@code <html>...</html>} pair, or is too short to
 * be a real page, is rejected and the caller falls back to the template page.
 */
public final class HtmlResponseParser {

    /** Anything shorter cannot be a useful page. */
    static final int MIN_DOCUMENT_LENGTH = 100;

    private static final Pattern FENCE = Pattern.compile("```[a-zA-Z]*[ \\t]*\\r?\\n?");

    private static final Pattern DOC_START = Pattern.compile(
            "<!DOCTYPE[^>]*>|<html[\\s>]", Pattern.CASE_INSENSITIVE);

    private static final Pattern HTML_OPEN  = Pattern.compile("<html[\\s>]", Pattern.CASE_INSENSITIVE);
    private static final Pattern HTML_CLOSE = Pattern.compile("</html\\s*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern DOCTYPE    = Pattern.compile("^<!DOCTYPE", Pattern.CASE_INSENSITIVE);

    private HtmlResponseParser() {}

    /**
     * Extract the HTML document from a model reply.
     *
     * @return the cleaned document, or empty if the reply is not a usable page
     */
    public static Optional<String> extractDocument(String response) {
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }
        String text = FENCE.matcher(response).replaceAll("");

        Matcher start = DOC_START.matcher(text);
        if (!start.find()) {
            return Optional.empty();
        }
        text = text.substring(start.start());

        int end = lastMatchEnd(HTML_CLOSE, text);
        if (end < 0) {
            return Optional.empty();
        }
        text = text.substring(0, end).strip();

        if (!DOCTYPE.matcher(text).find()) {
            text = "<!DOCTYPE html>\n" + text;
        }
        return isDocument(text) ? Optional.of(text) : Optional.empty();
    }

    /** True for text that starts with a doctype and has an {@code <html>...</html>} pair. */
    public static boolean isDocument(String html) {
        if (html == null || html.length() < MIN_DOCUMENT_LENGTH) {
            return false;
        }
        Matcher open = HTML_OPEN.matcher(html);
        if (!DOCTYPE.matcher(html.stripLeading()).find() || !open.find()) {
            return false;
        }
        return lastMatchEnd(HTML_CLOSE, html) > open.start();
    }

    private static int lastMatchEnd(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int end = -1;
        while (m.find()) {
            end = m.end();
        }
        return end;
    }
}
