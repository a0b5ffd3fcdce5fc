package me.christianrobert.convertifier.translator.format;

import me.christianrobert.convertifier.translator.context.SourceLanguage;
import me.christianrobert.convertifier.translator.context.TranslatorOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-indents generated code for display.
 *
 * <p>Python output is only trimmed; its indentation is significant and is not touched.
 * C++ output is re-indented from scratch by counting braces:
 * <pre>
 * for each line:
 *   trim; a blank line stays an empty line
 *   a line starting with '}' closes a level before it is indented (never below 0)
 *   emit indentWidth * level spaces + line
 *   a line ending with '{' opens a level after it
 * </pre>
 * Formatting already formatted C++ returns the same text.
 */
public class CodeFormatter {

    private static final Logger log = LoggerFactory.getLogger(CodeFormatter.class);

    private final int indentWidth;

    public CodeFormatter(int indentWidth) {
        if (indentWidth < 0 || indentWidth > TranslatorOptions.MAX_INDENT_WIDTH) {
            throw new IllegalArgumentException("Indent width must be between 0 and "
                    + TranslatorOptions.MAX_INDENT_WIDTH + ": " + indentWidth);
        }
        this.indentWidth = indentWidth;
    }

    public CodeFormatter() {
        this(TranslatorOptions.DEFAULT_INDENT_WIDTH);
    }

    /**
     * Formats code for the given language. Never throws; on failure the input is returned unchanged.
     */
    public String format(String code, SourceLanguage language) {
        if (code == null) {
            return "";
        }
        try {
            if (language == SourceLanguage.CPP) {
                return formatCpp(code);
            }
            return code.trim();
        } catch (RuntimeException e) {
            log.error("Failed to format {} code, returning it unchanged", language, e);
            return code;
        }
    }

    private String formatCpp(String code) {
        String[] lines = code.split("\\r?\\n", -1);
        StringBuilder result = new StringBuilder();
        String indentUnit = " ".repeat(indentWidth);
        int level = 0;

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (i > 0) {
                result.append('\n');
            }
            if (line.isEmpty()) {
                continue;
            }

            if (line.startsWith("}")) {
                level = Math.max(0, level - 1);
            }
            result.append(indentUnit.repeat(level)).append(line);
            if (line.endsWith("{")) {
                level++;
            }
        }
        return result.toString();
    }

    public int getIndentWidth() {
        return indentWidth;
    }
}
