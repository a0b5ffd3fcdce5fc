package me.christianrobert.convertifier.translator.python;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites a {@code cout} chain into a {@code print} call.
 *
 * <pre>
 * std::cout &lt;&lt; a &lt;&lt; b &lt;&lt; std::endl;   print(a + b);
 * std::cout &lt;&lt; "x";                  print("x", end="");
 * cout &lt;&lt; x &lt;&lt; endl;                 print(x);
 * </pre>
 *
 * <p>Chained operands are joined with {@code +}. A chain counts as ending the line
 * when its last operand is {@code endl}, {@code std::endl} or a newline literal.
 */
public class OutputStreamRule implements ConversionRule {

    private static final Pattern COUT = Pattern.compile("^(.*?)\\b(?:std::)?cout\\s*<<\\s*(.*?)\\s*(;?)\\s*$");
    private static final Pattern LINE_END = Pattern.compile("(?:std::)?endl|\"\\\\n\"|'\\\\n'");

    @Override
    public String getName() {
        return "output-stream";
    }

    @Override
    public String apply(String line) {
        Matcher matcher = COUT.matcher(line);
        if (!matcher.matches()) {
            return line;
        }

        List<String> operands = StreamOperands.split(matcher.group(2), "<<");
        boolean newline = false;
        if (!operands.isEmpty() && LINE_END.matcher(operands.get(operands.size() - 1)).matches()) {
            newline = true;
            operands = operands.subList(0, operands.size() - 1);
        }

        StringBuilder result = new StringBuilder(matcher.group(1));
        result.append("print(").append(String.join(" + ", operands));
        if (!newline) {
            result.append(operands.isEmpty() ? "end=\"\"" : ", end=\"\"");
        }
        return result.append(')').append(matcher.group(3)).toString();
    }
}
