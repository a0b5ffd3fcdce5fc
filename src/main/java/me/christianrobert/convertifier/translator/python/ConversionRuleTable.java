package me.christianrobert.convertifier.translator.python;

import java.util.List;

/**
 * Ordered rule list for the C++ to Python line rewrite. Rules run top to bottom on
 * every line, each seeing the output of the previous one, so the order is part of
 * the contract:
 *
 * <ol>
 *   <li>{@code type-declaration}: {@code int x = 5;} to {@code x = 5;}</li>
 *   <li>{@code output-stream}: {@code std::cout << a << std::endl;} to {@code print(a);}</li>
 *   <li>{@code input-stream}: {@code std::cin >> x;} to {@code x = input();}</li>
 *   <li>{@code function-signature}: {@code int add(int a, int b)} with optional brace to {@code def add(int a, int b):}</li>
 *   <li>{@code boolean-literals}: {@code true}/{@code false} to {@code True}/{@code False}</li>
 *   <li>{@code logical-operators}: {@code &&}/{@code ||} to {@code and}/{@code or}</li>
 *   <li>{@code equality-operators}: {@code ==}/{@code !=} kept as they are</li>
 *   <li>{@code string-construction}: {@code std::string("abc")} to {@code "abc"}</li>
 *   <li>{@code statement-terminator}: trailing {@code ;} removed</li>
 * </ol>
 *
 * <p>Type stripping runs before the stream rules so that {@code auto n = ...} is already
 * a plain assignment; the terminator goes last because the stream rules key on it.
 *
 * <p>Some steps are split into several rules sharing one name (one per literal or operator).
 *
 * <p>Immutable and shared by all translations.
 */
public class ConversionRuleTable {

    private static final String TYPE_NAME = "(?:std::)?(?:int|long|short|float|double|char|string|bool|auto)";

    private static final ConversionRuleTable DEFAULT = new ConversionRuleTable(List.of(
            new RegexConversionRule("type-declaration",
                    "^(?:const\\s+)?(?:unsigned\\s+|signed\\s+)?" + TYPE_NAME + "\\s+(\\w+)\\s*=(?!=)\\s*",
                    "$1 = "),
            new OutputStreamRule(),
            new InputStreamRule(),
            new RegexConversionRule("function-signature",
                    "^(?:static\\s+|inline\\s+)*(?:const\\s+)?(?:unsigned\\s+)?(?:std::)?"
                            + "(?:int|long|short|float|double|char|string|bool|void|auto)\\s+(\\w+)\\s*\\(([^)]*)\\)\\s*\\{?\\s*$",
                    "def $1($2):"),
            new RegexConversionRule("boolean-literals", "\\btrue\\b", "True"),
            new RegexConversionRule("boolean-literals", "\\bfalse\\b", "False"),
            new RegexConversionRule("logical-operators", "\\s*&&\\s*", " and "),
            new RegexConversionRule("logical-operators", "\\s*\\|\\|\\s*", " or "),
            new RegexConversionRule("equality-operators", "==", "=="),
            new RegexConversionRule("equality-operators", "!=", "!="),
            new RegexConversionRule("string-construction",
                    "(?<![\\w:])(?:std::)?string\\s*\\(\\s*\"([^\"]*)\"\\s*\\)", "\"$1\""),
            new RegexConversionRule("statement-terminator", ";\\s*$", "")));

    private final List<ConversionRule> rules;

    public ConversionRuleTable(List<ConversionRule> rules) {
        if (rules == null) {
            throw new IllegalArgumentException("Rule list cannot be null");
        }
        this.rules = List.copyOf(rules);
    }

    public static ConversionRuleTable defaultTable() {
        return DEFAULT;
    }

    /**
     * Runs every rule over the line in table order.
     */
    public String apply(String line) {
        String result = line;
        for (ConversionRule rule : rules) {
            result = rule.apply(result);
        }
        return result;
    }

    public List<ConversionRule> getRules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }
}
