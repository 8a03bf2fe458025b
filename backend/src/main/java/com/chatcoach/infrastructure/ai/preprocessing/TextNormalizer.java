package com.chatcoach.infrastructure.ai.preprocessing;

import com.chatcoach.domain.reply.model.DialogEntry;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Cleans chat message text before it is hashed or sent to a model:
 * NFC normalization, removal of invisible and control characters, and whitespace collapsing.
 */
@Component
public class TextNormalizer {

    // Zero-width, BOM, soft hyphen, word joiner, bidi marks
    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\u200B\\u200C\\u200D\\u200E\\u200F\\uFEFF\\u00AD\\u2060\\u180E]"
    );

    // Control characters except \n, \r, \t
    private static final Pattern CONTROL_CHARS = Pattern.compile(
            "[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]"
    );

    private static final Pattern HORIZONTAL_RUNS = Pattern.compile("[ \\t\\u00A0\\u3000]{2,}");

    private static final Pattern BLANK_LINE_RUNS = Pattern.compile("\\n{3,}");

    /**
     * @param text raw message text, may be null
     * @return normalized text, never null
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String result = Normalizer.normalize(text, Normalizer.Form.NFC);
        result = INVISIBLE_CHARS.matcher(result).replaceAll("");
        result = CONTROL_CHARS.matcher(result).replaceAll("");
        result = result.replace("\r\n", "\n").replace('\r', '\n');
        result = HORIZONTAL_RUNS.matcher(result).replaceAll(" ");
        result = BLANK_LINE_RUNS.matcher(result).replaceAll("\n\n");
        return result.strip();
    }

    public DialogEntry normalize(DialogEntry entry) {
        return entry.withText(normalize(entry.text()));
    }
}
