package com.graphkit.dot.core;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns arbitrary values into valid DOT ID tokens.
 *
 * <p>
 * Applied in this order:
 * <ol>
 * <li>DOT keywords (any case) are quoted verbatim.</li>
 * <li>Booleans become {@code true} / {@code false}.</li>
 * <li>In HTML-aware mode, strings containing {@code </} or {@code />} are wrapped
 * in angle brackets as HTML-like labels.</li>
 * <li>Identifiers and numerals are emitted bare.</li>
 * <li>Everything else is double-quoted, with line breaks turned into {@code \n}
 * and embedded quotes escaped.</li>
 * </ol>
 */
public final class IdentifierEscaper {
    private static final Set<String> KEYWORDS = Set.of("node", "edge", "graph", "digraph", "subgraph", "strict");
    private static final Set<String> LABEL_KEYS = Set.of("label", "headlabel", "taillabel");
    private static final Pattern BARE_ID = Pattern
            .compile("[a-zA-Z_][a-zA-Z_0-9]*|-?(\\.[0-9]+|[0-9]+(\\.[0-9]*)?)");
    private static final Pattern LINE_BREAK = Pattern.compile("\r\n|\n|\r");

    private IdentifierEscaper() {
        // Utility class
    }

    public static String escape(Object value) {
        return escape(value, false);
    }

    /**
     * @param value     the value to emit; null is treated as the empty string.
     * @param htmlAware whether HTML-like content may be passed through as
     *                  {@code <...>}.
     */
    public static String escape(Object value, boolean htmlAware) {
        String s = value == null ? "" : value.toString();

        if (KEYWORDS.contains(s.toLowerCase(Locale.ROOT)))
            return '"' + s + '"';

        if (value instanceof Boolean b)
            return b ? "true" : "false";

        if (htmlAware && (s.contains("</") || s.contains("/>")))
            return '<' + s + '>';

        if (BARE_ID.matcher(s).matches())
            return s;

        return '"' + LINE_BREAK.matcher(s).replaceAll("\\\\n").replace("\"", "\\\"") + '"';
    }

    /**
     * Escapes an attribute map. Label keys stay bare and their values are escaped
     * HTML-aware; every other key and value is escaped plainly.
     */
    public static Map<String, String> escapeArray(Map<String, ?> attributes) {
        Map<String, String> out = new LinkedHashMap<>();
        if (attributes == null)
            return out;
        for (Map.Entry<String, ?> e : attributes.entrySet())
            out.put(escapeKey(e.getKey()), escapeValue(e.getKey(), e.getValue()));
        return out;
    }

    static String escapeKey(String key) {
        return LABEL_KEYS.contains(key) ? key : escape(key);
    }

    static String escapeValue(String key, Object value) {
        return escape(value, LABEL_KEYS.contains(key));
    }
}
