package me.christianrobert.convertifier.translator.python;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a stream chain ({@code a << "x<<y" << f(b << 1)}) at its top-level operators.
 * Operators inside string literals, char literals and parentheses are not split points.
 */
final class StreamOperands {

    private StreamOperands() {
    }

    static List<String> split(String chain, String operator) {
        List<String> operands = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        char quote = 0;

        for (int i = 0; i < chain.length(); i++) {
            char c = chain.charAt(i);

            if (quote != 0) {
                current.append(c);
                if (c == '\\' && i + 1 < chain.length()) {
                    current.append(chain.charAt(++i));
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }

            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
            } else if (depth == 0 && chain.startsWith(operator, i)) {
                add(operands, current);
                i += operator.length() - 1;
                continue;
            }
            current.append(c);
        }
        add(operands, current);
        return operands;
    }

    private static void add(List<String> operands, StringBuilder current) {
        String operand = current.toString().trim();
        if (!operand.isEmpty()) {
            operands.add(operand);
        }
        current.setLength(0);
    }
}
