package io.trialmesh.workflow;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

final class Templates {
    static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_.]*)\\}");

    private Templates() {
    }

    /**
     * Replaces every placeholder once; substituted text is not scanned again.
     */
    static String render(String template, Function<String, String> lookup) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder(template.length());
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(lookup.apply(m.group(1))));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    static Set<String> placeholders(String template) {
        Set<String> out = new LinkedHashSet<>();
        Matcher m = PLACEHOLDER.matcher(template);
        while (m.find()) {
            out.add(m.group(1));
        }
        return out;
    }
}
