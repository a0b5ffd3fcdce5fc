package me.christianrobert.convertifier.translator.builder;

import me.christianrobert.convertifier.antlr.PythonParser;
import me.christianrobert.convertifier.translator.semantic.expression.Literal;
import org.antlr.v4.runtime.tree.TerminalNode;

/**
 * Static helper that decodes Python string literals into their content.
 *
 * <p>Handles the quote styles ({@code '...'}, {@code "..."}, triple-quoted), prefixes
 * ({@code r}, {@code b}, {@code u}, {@code f} and combinations) and implicit
 * concatenation of adjacent literals ({@code "a" "b"} is {@code "ab"}).
 * Raw literals keep their backslashes. f-string fields are not interpreted.
 */
public class VisitStringLiteral {

    public static Literal v(PythonParser.StringAtomContext ctx, SemanticTreeBuilder b) {
        StringBuilder content = new StringBuilder();
        for (TerminalNode token : ctx.STRING()) {
            content.append(decode(token.getText()));
        }
        return Literal.string(content.toString());
    }

    /**
     * Decodes one STRING token; {@code r'a\d'} keeps its backslash, {@code 'a\n'} gets a real newline.
     */
    static String decode(String token) {
        int quoteStart = 0;
        while (quoteStart < token.length() && token.charAt(quoteStart) != '\'' && token.charAt(quoteStart) != '"') {
            quoteStart++;
        }
        String prefix = token.substring(0, quoteStart).toLowerCase();
        String quoted = token.substring(quoteStart);

        int quoteLength = quoted.startsWith("\"\"\"") || quoted.startsWith("'''") ? 3 : 1;
        if (quoted.length() < 2 * quoteLength) {
            return "";
        }
        String body = quoted.substring(quoteLength, quoted.length() - quoteLength);

        if (prefix.contains("r")) {
            return body;
        }
        return unescape(body);
    }

    private static String unescape(String body) {
        StringBuilder result = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                result.append(c);
                i++;
                continue;
            }

            char next = body.charAt(i + 1);
            switch (next) {
                case 'n' -> result.append('\n');
                case 't' -> result.append('\t');
                case 'r' -> result.append('\r');
                case '0' -> result.append('\0');
                case '\\' -> result.append('\\');
                case '\'' -> result.append('\'');
                case '"' -> result.append('"');
                case '\n' -> {
                    // backslash-newline is a line continuation inside the literal
                }
                case 'x' -> {
                    if (isHex(body, i + 2, 2)) {
                        result.append((char) Integer.parseInt(body.substring(i + 2, i + 4), 16));
                        i += 4;
                        continue;
                    }
                    result.append(c).append(next);
                }
                case 'u' -> {
                    if (isHex(body, i + 2, 4)) {
                        result.append((char) Integer.parseInt(body.substring(i + 2, i + 6), 16));
                        i += 6;
                        continue;
                    }
                    result.append(c).append(next);
                }
                default -> result.append(c).append(next);
            }
            i += 2;
        }
        return result.toString();
    }

    private static boolean isHex(String text, int from, int length) {
        if (from + length > text.length()) {
            return false;
        }
        for (int i = from; i < from + length; i++) {
            if (Character.digit(text.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }
}
