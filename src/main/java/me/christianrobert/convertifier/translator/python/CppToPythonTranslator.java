package me.christianrobert.convertifier.translator.python;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Translates C++ source to Python line by line, without parsing C++.
 *
 * <p>Steps per logical line (see {@link CppLineSplitter}):
 * <ol>
 *   <li>drop preprocessor directives, {@code using namespace} lines and lone braces</li>
 *   <li>drop the {@code main} wrapper: its signature, its closing brace and a
 *       {@code return 0;} directly inside it; the statements it wraps are kept</li>
 *   <li>turn {@code //} comment lines (block comments arrive split into these) into {@code #} comments</li>
 *   <li>run the remaining lines through the {@link ConversionRuleTable}</li>
 * </ol>
 * Lines keep their order and no indentation is rebuilt.
 *
 * <p>Never throws: an unexpected failure yields {@code Error converting C++ to Python: <message>}.
 */
public class CppToPythonTranslator {

    private static final Logger log = LoggerFactory.getLogger(CppToPythonTranslator.class);

    public static final String ERROR_PREFIX = "Error converting C++ to Python: ";

    private static final Pattern ENTRY_POINT = Pattern.compile("\\b(?:int|void)\\s+main\\s*\\(");
    private static final Pattern USING_NAMESPACE = Pattern.compile("^using\\s+namespace\\s+[\\w:]+\\s*;$");
    private static final Pattern SUCCESS_RETURN = Pattern.compile("^return\\s+(?:0|EXIT_SUCCESS)\\s*;$");
    private static final Pattern LONE_BRACE = Pattern.compile("^(?:\\{|\\}\\s*;?)$");

    private final ConversionRuleTable rules;

    public CppToPythonTranslator(ConversionRuleTable rules) {
        this.rules = rules != null ? rules : ConversionRuleTable.defaultTable();
    }

    public CppToPythonTranslator() {
        this(ConversionRuleTable.defaultTable());
    }

    public String translate(String cppSource) {
        try {
            List<String> output = new ArrayList<>();

            // Entry-point wrapper state
            boolean inEntryPoint = false;
            boolean awaitingOpenBrace = false;
            int depth = 0;

            for (String line : CppLineSplitter.split(cppSource)) {
                if (line.startsWith("#") || USING_NAMESPACE.matcher(line).matches()) {
                    continue;
                }

                if (!inEntryPoint && ENTRY_POINT.matcher(line).find()) {
                    inEntryPoint = true;
                    depth = braceBalance(line);
                    awaitingOpenBrace = depth == 0;
                    continue;
                }

                if (inEntryPoint) {
                    if (awaitingOpenBrace && line.equals("{")) {
                        awaitingOpenBrace = false;
                        depth = 1;
                        continue;
                    }
                    awaitingOpenBrace = false;
                    depth += braceBalance(line);
                    if (depth <= 0) {
                        // Closing brace of the wrapper
                        inEntryPoint = false;
                        continue;
                    }
                    if (depth == 1 && SUCCESS_RETURN.matcher(line).matches()) {
                        continue;
                    }
                }

                if (LONE_BRACE.matcher(line).matches()) {
                    continue;
                }

                String converted = convertLine(line);
                if (!converted.isBlank()) {
                    output.add(converted);
                }
            }

            log.debug("Translated {} C++ characters to {} Python lines",
                    cppSource == null ? 0 : cppSource.length(), output.size());
            return String.join("\n", output);
        } catch (Exception e) {
            log.error("C++ to Python translation failed", e);
            return ERROR_PREFIX + e.getMessage();
        }
    }

    private String convertLine(String line) {
        if (line.startsWith("//")) {
            return "# " + line.substring(2).trim();
        }
        return rules.apply(line).trim();
    }

    // Split lines carry at most one structural brace, but strings may hold more
    private static int braceBalance(String line) {
        int balance = 0;
        boolean inString = false;
        boolean inChar = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (inString || inChar) {
                if (c == '\\') {
                    i++;
                } else if ((inString && c == '"') || (inChar && c == '\'')) {
                    inString = false;
                    inChar = false;
                }
                continue;
            }
            if (c == '/' && i + 1 < line.length() && line.charAt(i + 1) == '/') {
                break;
            }
            switch (c) {
                case '"' -> inString = true;
                case '\'' -> inChar = true;
                case '{' -> balance++;
                case '}' -> balance--;
                default -> {
                }
            }
        }
        return balance;
    }
}
