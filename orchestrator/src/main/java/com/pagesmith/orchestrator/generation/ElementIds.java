package com.pagesmith.orchestrator.generation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the element ids a page is expected to contain.
 *
 * Sources, in order of first appearance:
 *   - {@code tag#id} in the brief (e.g. "h1#title", "button#btn"), which also
 *     tells us which tag to render
 *   - bare {@code #id} in the brief
 *   - {@code #id}, {@code getElementById('id')} and {@code querySelector('#id')} in checks
 */
public final class ElementIds {

    /** Tags the fallback page is willing to render for a {@code tag#id} mention. */
    static final Set<String> RENDERABLE_TAGS = Set.of(
            "h1", "h2", "h3", "h4", "h5", "h6", "p", "div", "span", "section", "article",
            "main", "header", "footer", "nav", "button", "pre", "code", "ul", "ol",
            "table", "form", "input", "select", "textarea", "output", "label", "a", "canvas");

    private static final Pattern TAG_AND_ID = Pattern.compile(
            "(?<![\\w-])([a-zA-Z][a-zA-Z0-9]*)#([A-Za-z][\\w-]*)");

    private static final Pattern HASH_ID = Pattern.compile("(?<![\\w&])#([A-Za-z][\\w-]*)");

    private static final Pattern BY_ID_CALL = Pattern.compile(
            "getElementById\\(\\s*['\"]([\\w-]+)['\"]");

    private ElementIds() {}

    /**
     * Required ids mapped to the tag they should be rendered as; ids without a
     * usable tag hint map to {@code "div"}.
     */
    public static Map<String, String> required(String brief, List<String> checks) {
        Map<String, String> ids = new LinkedHashMap<>();
        String text = brief == null ? "" : brief;

        Matcher tagged = TAG_AND_ID.matcher(text);
        while (tagged.find()) {
            String tag = tagged.group(1).toLowerCase(Locale.ROOT);
            ids.putIfAbsent(tagged.group(2), RENDERABLE_TAGS.contains(tag) ? tag : "div");
        }
        collect(HASH_ID, text, ids);

        for (String check : checks == null ? List.<String>of() : checks) {
            if (check == null) continue;
            collect(HASH_ID, check, ids);
            collect(BY_ID_CALL, check, ids);
        }
        return ids;
    }

    private static void collect(Pattern pattern, String text, Map<String, String> ids) {
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            ids.putIfAbsent(m.group(1), "div");
        }
    }
}
