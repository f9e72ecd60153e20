package com.scoutengine.core.rule;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders {@code {placeholder}} templates used for opportunity titles,
 * descriptions and recommended actions. Unknown placeholders are kept
 * verbatim.
 *
 * @since 1.0.0
 */
public final class MessageTemplate {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-zA-Z0-9_]+)}");

    private MessageTemplate() {
        // utility class - not instantiable
    }

    /**
     * @param template  template text; {@code null} renders as {@code null}
     * @param variables placeholder values
     * @return rendered text
     */
    public static String render(String template, Map<String, String> variables) {
        if (template == null) {
            return null;
        }
        Objects.requireNonNull(variables, "variables must not be null");
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String replacement = variables.get(m.group(1));
            m.appendReplacement(out, Matcher.quoteReplacement(replacement != null ? replacement : m.group()));
        }
        m.appendTail(out);
        return out.toString();
    }
}
