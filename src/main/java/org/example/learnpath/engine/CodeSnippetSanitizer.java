package org.example.learnpath.engine;

import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Unwraps markdown fenced code blocks that LLMs put around code snippets.
 */
@Component
public class CodeSnippetSanitizer {

    // Any language tag; the closing fence sits on its own line or ends the input.
    private static final Pattern FENCED_BLOCK = Pattern.compile(
            "```[\\w+#.-]*[ \\t]*\\r?\\n(.*?)(?:\\r?\\n```|```\\s*$)",
            Pattern.DOTALL);
    private static final Pattern LEADING_FENCE_LINE = Pattern.compile("^```.*?\\n", Pattern.MULTILINE);
    private static final Pattern TRAILING_FENCE_LINE = Pattern.compile("\\n```$", Pattern.MULTILINE);

    public String sanitize(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        Matcher matcher = FENCED_BLOCK.matcher(raw);
        if (!matcher.find()) {
            return raw.strip();
        }
        String inner = matcher.group(1);
        inner = LEADING_FENCE_LINE.matcher(inner).replaceAll("");
        inner = TRAILING_FENCE_LINE.matcher(inner).replaceAll("");
        return inner.strip();
    }
}
