package me.christianrobert.convertifier.translator.python;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits C++ source into logical lines so that one-line programs such as
 * {@code int main() { int x = 5; return 0; }} can be rewritten line by line.
 *
 * <p>Break points, all only at parenthesis depth zero and outside literals and comments:
 * <ul>
 *   <li>after {@code ;}</li>
 *   <li>after an opening brace</li>
 *   <li>before a closing brace</li>
 *   <li>after a closing brace, unless {@code ;} or {@code else} follows it</li>
 *   <li>at every physical newline</li>
 * </ul>
 * A {@code //} comment that follows code on the same line becomes its own line.
 * A block comment between statements becomes one {@code //} line per physical line;
 * one inside an unfinished statement is dropped.
 * Returned lines are trimmed and never blank.
 */
public class CppLineSplitter {

    public static List<String> split(String source) {
        List<String> lines = new ArrayList<>();
        if (source == null || source.isEmpty()) {
            return lines;
        }

        StringBuilder current = new StringBuilder();
        StringBuilder comment = new StringBuilder();
        boolean inString = false;      // "..."
        boolean inChar = false;        // '...'
        boolean inLineComment = false; // // ...
        boolean inBlockComment = false;
        boolean keepBlockComment = false;
        int parenDepth = 0;

        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            char next = (i + 1 < source.length()) ? source.charAt(i + 1) : '\0';

            if (c == '\n' || c == '\r') {
                if (inBlockComment) {
                    if (keepBlockComment) {
                        flushComment(lines, comment);
                    }
                    continue;
                }
                inLineComment = false;
                inString = false;
                inChar = false;
                flush(lines, current);
                continue;
            }

            if (inLineComment) {
                current.append(c);
                continue;
            }

            if (inBlockComment) {
                if (c == '*' && next == '/') {
                    i++;
                    inBlockComment = false;
                    if (keepBlockComment) {
                        flushComment(lines, comment);
                    } else {
                        // The comment collapses to a single space
                        if (!Character.isWhitespace(current.charAt(current.length() - 1))) {
                            current.append(' ');
                        }
                        while (i + 1 < source.length() && (source.charAt(i + 1) == ' ' || source.charAt(i + 1) == '\t')) {
                            i++;
                        }
                    }
                } else if (keepBlockComment) {
                    comment.append(c);
                }
                continue;
            }

            if (inString || inChar) {
                current.append(c);
                if (c == '\\' && next != '\0' && next != '\n') {
                    current.append(next);
                    i++;
                } else if ((inString && c == '"') || (inChar && c == '\'')) {
                    inString = false;
                    inChar = false;
                }
                continue;
            }

            if (c == '/' && next == '/') {
                // Code before a trailing comment stays on its own line
                flush(lines, current);
                inLineComment = true;
                current.append(c);
                continue;
            }
            if (c == '/' && next == '*') {
                inBlockComment = true;
                keepBlockComment = current.toString().isBlank();
                i++;
                continue;
            }

            switch (c) {
                case '"' -> {
                    inString = true;
                    current.append(c);
                }
                case '\'' -> {
                    inChar = true;
                    current.append(c);
                }
                case '(' -> {
                    parenDepth++;
                    current.append(c);
                }
                case ')' -> {
                    parenDepth = Math.max(0, parenDepth - 1);
                    current.append(c);
                }
                case ';', '{' -> {
                    current.append(c);
                    if (parenDepth == 0) {
                        flush(lines, current);
                    }
                }
                case '}' -> {
                    if (parenDepth == 0) {
                        flush(lines, current);
                    }
                    current.append(c);
                    if (parenDepth == 0 && !continuesClosingBrace(source, i + 1)) {
                        flush(lines, current);
                    }
                }
                default -> current.append(c);
            }
        }
        flush(lines, current);
        return lines;
    }

    // "};" and "} else" stay on the brace's line
    private static boolean continuesClosingBrace(String source, int from) {
        int i = from;
        while (i < source.length() && (source.charAt(i) == ' ' || source.charAt(i) == '\t')) {
            i++;
        }
        if (i < source.length() && source.charAt(i) == ';') {
            return true;
        }
        return source.startsWith("else", i)
                && (i + 4 == source.length() || !Character.isJavaIdentifierPart(source.charAt(i + 4)));
    }

    private static void flushComment(List<String> lines, StringBuilder comment) {
        String text = comment.toString().trim();
        // Leading asterisks of continuation lines
        while (text.startsWith("*")) {
            text = text.substring(1).trim();
        }
        if (!text.isEmpty()) {
            lines.add("// " + text);
        }
        comment.setLength(0);
    }

    private static void flush(List<String> lines, StringBuilder current) {
        String line = current.toString().trim();
        if (!line.isEmpty()) {
            lines.add(line);
        }
        current.setLength(0);
    }
}
