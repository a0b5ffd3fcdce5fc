package me.christianrobert.convertifier.translator.cpp;

import me.christianrobert.convertifier.translator.builder.SemanticTreeBuilder;
import me.christianrobert.convertifier.translator.context.TranslationException;
import me.christianrobert.convertifier.translator.context.TranslatorOptions;
import me.christianrobert.convertifier.translator.parser.AntlrParser;
import me.christianrobert.convertifier.translator.parser.ParseResult;
import me.christianrobert.convertifier.translator.semantic.Module;
import me.christianrobert.convertifier.translator.semantic.PyNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Translates Python source to C++ source.
 *
 * <p>Pipeline:
 * <pre>
 * Python source → AntlrParser → SemanticTreeBuilder → Module
 *     → IncludeCollector (headers) → StatementEmitter (body) → entry-point stub
 * </pre>
 *
 * <p>Output layout:
 * <pre>
 * #include &lt;iostream&gt;
 * #include &lt;string&gt;
 *
 * &lt;translated statements&gt;
 *
 * int main() {
 * // Your code will be executed here
 * return 0;
 * }
 * </pre>
 * The stub is left out when the body already defines a function named {@code main}.
 *
 * <p>Never throws: any failure, including a syntax error when the caller skipped
 * validation, yields the single line {@code Error converting Python to C++: <message>}.
 */
public class CppStatementTranslator {

    private static final Logger log = LoggerFactory.getLogger(CppStatementTranslator.class);

    public static final String ERROR_PREFIX = "Error converting Python to C++: ";

    static final List<String> ENTRY_POINT_STUB = List.of(
            "int main() {",
            "// Your code will be executed here",
            "return 0;",
            "}");

    // Function header whose name is exactly main; comments and calls do not count
    private static final Pattern ENTRY_POINT_HEADER =
            Pattern.compile("^(?!//)[\\w:<>&*\\s]*\\bmain\\s*\\(.*\\)\\s*\\{\\s*$");

    private final AntlrParser parser;
    private final TranslatorOptions options;

    public CppStatementTranslator(AntlrParser parser, TranslatorOptions options) {
        this.parser = parser;
        this.options = options != null ? options : TranslatorOptions.defaults();
    }

    /**
     * Parses and translates Python source.
     */
    public String translate(String pythonSource) {
        try {
            ParseResult parseResult = parser.parseModule(pythonSource);
            if (parseResult.hasErrors()) {
                throw new TranslationException("Invalid Python code: " + parseResult.getErrorMessage());
            }
            PyNode root = new SemanticTreeBuilder().visit(parseResult.getTree());
            return translate((Module) root);
        } catch (Exception e) {
            log.error("Python to C++ translation failed", e);
            return ERROR_PREFIX + e.getMessage();
        }
    }

    /**
     * Translates an already built semantic tree.
     */
    public String translate(Module module) {
        try {
            IncludeCollector includes = new IncludeCollector();
            includes.collect(module.getBody());

            CppExpressionTranslator expressions = new CppExpressionTranslator(options);
            List<String> body = new StatementEmitter(expressions, options).emitModule(module.getBody());

            List<String> output = new ArrayList<>(includes.includeLines());
            output.add("");
            output.addAll(body);

            if (options.isEntryPointStub() && body.stream().noneMatch(this::definesEntryPoint)) {
                if (!output.get(output.size() - 1).isEmpty()) {
                    output.add("");
                }
                output.addAll(ENTRY_POINT_STUB);
            }

            log.debug("Translated Python module with {} statements to {} C++ lines", module.getBody().size(), output.size());
            return String.join("\n", output);
        } catch (Exception e) {
            log.error("Python to C++ translation failed", e);
            return ERROR_PREFIX + e.getMessage();
        }
    }

    private boolean definesEntryPoint(String line) {
        return ENTRY_POINT_HEADER.matcher(line.trim()).matches();
    }
}
