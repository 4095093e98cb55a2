package io.vaultkit.endpoint.processor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import javax.lang.model.SourceVersion;

/**
 * A parsed endpoint path template such as {@code /auth/{self.mount}/role/{self.role}}.
 *
 * <p>A placeholder is either {@code {self.name}} or {@code {name}}; both refer to the
 * record component {@code name}. Literal text is kept verbatim.
 */
final class PathTemplate {

    private static final String SELF_PREFIX = "self.";

    private final String template;
    private final List<Segment> segments;

    private PathTemplate(String template, List<Segment> segments) {
        this.template = template;
        this.segments = Collections.unmodifiableList(segments);
    }

    /**
     * One piece of a template: either literal text or the name of a component.
     *
     * @param placeholder true when {@code text} is a component name
     * @param text        the literal text or the component name
     */
    record Segment(boolean placeholder, String text) {
    }

    /**
     * Parses a template.
     *
     * @param template the raw template
     * @return the parsed template
     * @throws IllegalArgumentException if braces are unbalanced or a placeholder is malformed
     */
    static PathTemplate parse(String template) {
        if (template == null || template.isBlank()) {
            throw new IllegalArgumentException("Path template cannot be blank");
        }

        List<Segment> segments = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c == '}') {
                throw new IllegalArgumentException(
                        "Unbalanced '}' at index " + i + " in path template '" + template + "'");
            }
            if (c != '{') {
                literal.append(c);
                i++;
                continue;
            }

            int close = template.indexOf('}', i + 1);
            int nested = template.indexOf('{', i + 1);
            if (close < 0 || (nested >= 0 && nested < close)) {
                throw new IllegalArgumentException(
                        "Unclosed '{' at index " + i + " in path template '" + template + "'");
            }
            if (literal.length() > 0) {
                segments.add(new Segment(false, literal.toString()));
                literal.setLength(0);
            }
            segments.add(new Segment(true, placeholderName(template, template.substring(i + 1, close))));
            i = close + 1;
        }
        if (literal.length() > 0) {
            segments.add(new Segment(false, literal.toString()));
        }
        return new PathTemplate(template, segments);
    }

    private static String placeholderName(String template, String expression) {
        String name = expression.trim();
        if (name.startsWith(SELF_PREFIX)) {
            name = name.substring(SELF_PREFIX.length());
        }
        if (name.isEmpty() || name.indexOf('.') >= 0 || !SourceVersion.isIdentifier(name)) {
            throw new IllegalArgumentException(
                    "Invalid placeholder '{" + expression + "}' in path template '" + template
                            + "'; expected {self.name} or {name}");
        }
        return name;
    }

    List<Segment> segments() {
        return segments;
    }

    /**
     * Returns the distinct component names referenced by placeholders, in order.
     */
    Set<String> placeholders() {
        Set<String> names = new LinkedHashSet<>();
        for (Segment segment : segments) {
            if (segment.placeholder()) {
                names.add(segment.text());
            }
        }
        return names;
    }

    @Override
    public String toString() {
        return template;
    }
}
