package me.christianrobert.convertifier.translator.python;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites a {@code cin} chain into {@code input()} assignments.
 *
 * <pre>
 * std::cin &gt;&gt; x;        x = input();
 * std::cin &gt;&gt; a &gt;&gt; b;   a, b = input().split();
 * </pre>
 */
public class InputStreamRule implements ConversionRule {

    private static final Pattern CIN = Pattern.compile("^(?:std::)?cin\\s*>>\\s*(.*?)\\s*(;?)\\s*$");

    @Override
    public String getName() {
        return "input-stream";
    }

    @Override
    public String apply(String line) {
        Matcher matcher = CIN.matcher(line);
        if (!matcher.matches()) {
            return line;
        }

        List<String> targets = StreamOperands.split(matcher.group(1), ">>");
        if (targets.isEmpty()) {
            return "input()" + matcher.group(2);
        }
        if (targets.size() == 1) {
            return targets.get(0) + " = input()" + matcher.group(2);
        }
        return String.join(", ", targets) + " = input().split()" + matcher.group(2);
    }
}
