package me.christianrobert.convertifier.translator.service;

import me.christianrobert.convertifier.config.service.ConfigService;
import me.christianrobert.convertifier.translator.context.SourceLanguage;
import me.christianrobert.convertifier.translator.context.TranslationResult;
import me.christianrobert.convertifier.translator.context.TranslatorOptions;
import me.christianrobert.convertifier.translator.parser.AntlrParser;
import me.christianrobert.convertifier.translator.validation.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for the translation pipeline: validate, translate, format.
 */
class TranslationServiceTest {

    private TranslationService service;
    private ConfigService configService;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
        service = new TranslationService();
        service.parser = new AntlrParser();
        service.configService = configService;
    }

    private String convertOk(String source, SourceLanguage language) {
        TranslationResult result = service.convert(source, language);
        assertTrue(result.isSuccess(), "Translation should succeed: " + result.getErrorMessage());
        assertNull(result.getErrorMessage());
        return result.getTranslatedCode();
    }

    private static long count(String text, char c) {
        return text.chars().filter(ch -> ch == c).count();
    }

    private static int occurrences(String text, String needle) {
        return text.split(java.util.regex.Pattern.quote(needle), -1).length - 1;
    }

    // ========== Python to C++ ==========

    @Test
    void printStatement() {
        String cpp = convertOk("print(1 + 2)", SourceLanguage.PYTHON);

        String expected = String.join("\n",
                "#include <iostream>",
                "#include <string>",
                "",
                "std::cout << (1 + 2) << std::endl;",
                "",
                "int main() {",
                "    // Your code will be executed here",
                "    return 0;",
                "}");
        assertEquals(expected, cpp);
    }

    @Test
    void functionDefinition() {
        String cpp = convertOk("def add(a, b): return a + b", SourceLanguage.PYTHON);

        assertTrue(cpp.contains("void add(auto a, auto b) {\n    return (a + b);\n}"), cpp);
        assertEquals(1, occurrences(cpp, "main("), cpp);
    }

    @Test
    void structuredProgramIsBalancedAndIndented() {
        String source = """
            import math

            def hypotenuse(a: float, b: float) -> float:
                return math.sqrt(a ** 2 + b ** 2)

            def describe(n):
                if n > 10:
                    print("big")
                elif n > 5:
                    print("medium")
                else:
                    print("small")

            for i in range(3):
                describe(i)
            """;

        String cpp = convertOk(source, SourceLanguage.PYTHON);

        assertEquals(count(cpp, '{'), count(cpp, '}'), cpp);
        assertEquals(1, occurrences(cpp, "main("), cpp);
        assertTrue(cpp.contains("#include <cmath>"));
        assertTrue(cpp.contains("double hypotenuse(double a, double b) {"), cpp);
        assertTrue(cpp.contains("    return math.sqrt((std::pow(a, 2) + std::pow(b, 2)));"), cpp);
        assertTrue(cpp.contains("    if (n > 10) {\n        std::cout << \"big\" << std::endl;\n    } else if (n > 5) {"), cpp);
        assertTrue(cpp.contains("for (int i = 0; i < 3; i++) {\n    describe(i);\n}"), cpp);
    }

    @Test
    void invalidPythonIsRejected() {
        TranslationResult result = service.convert("def broken(:\n", SourceLanguage.PYTHON);

        assertTrue(result.isFailure());
        assertNull(result.getTranslatedCode());
        assertTrue(result.getErrorMessage().startsWith("Invalid Python code:"), result.getErrorMessage());
    }

    @Test
    void emptyInputIsRejected() {
        TranslationResult python = service.convert("  ", SourceLanguage.PYTHON);
        TranslationResult cpp = service.convert(null, SourceLanguage.CPP);

        assertEquals("Python code cannot be empty", python.getErrorMessage());
        assertEquals("C++ code cannot be empty", cpp.getErrorMessage());
    }

    @Test
    void missingLanguageIsRejected() {
        TranslationResult result = service.convert("x = 1", null);

        assertTrue(result.isFailure());
        assertEquals("Source language is required", result.getErrorMessage());
    }

    @Test
    void parseTreeIsAttachedOnRequest() {
        TranslationResult result = service.convert("x = 1\n", SourceLanguage.PYTHON, true);

        assertTrue(result.isSuccess());
        assertTrue(result.hasAstTree());
        assertTrue(result.getAstTree().startsWith("File_input"), result.getAstTree());
        assertFalse(service.convert("x = 1\n", SourceLanguage.PYTHON).hasAstTree());
    }

    @Test
    void resultReportsLanguages() {
        TranslationResult result = service.convert("x = 1\n", SourceLanguage.PYTHON);

        assertEquals(SourceLanguage.PYTHON, result.getSourceLanguage());
        assertEquals(SourceLanguage.CPP, result.getTargetLanguage());
        assertEquals("x = 1\n", result.getSourceCode());
    }

    // ========== C++ to Python ==========

    @Test
    void oneLineCppProgram() {
        String python = convertOk("int main() { int x = 5; std::cout << x << std::endl; return 0; }", SourceLanguage.CPP);

        assertEquals("x = 5\nprint(x)", python);
    }

    @Test
    void invalidCppIsRejected() {
        TranslationResult result = service.convert("print(1 + 2)", SourceLanguage.CPP);

        assertTrue(result.isFailure());
        assertEquals("Invalid C++ code: Missing required element ';'", result.getErrorMessage());
    }

    @Test
    void generatedCppTranslatesBack() {
        String cpp = convertOk("print(1 + 2)", SourceLanguage.PYTHON);

        String python = convertOk(cpp, SourceLanguage.CPP);

        assertTrue(python.contains("print((1 + 2))"), python);
        assertFalse(python.contains("#include"), python);
        assertFalse(python.contains("main("), python);
    }

    // ========== Configuration ==========

    @Test
    void defaultParameterTypeFromConfiguration() {
        configService.setConfigValue(ConfigService.DEFAULT_PARAMETER_TYPE, "int");

        String cpp = convertOk("def add(a, b): return a + b", SourceLanguage.PYTHON);

        assertTrue(cpp.contains("void add(int a, int b) {"), cpp);
    }

    @Test
    void entryPointStubCanBeSwitchedOff() {
        configService.setConfigValue(ConfigService.ENTRY_POINT_STUB, false);

        String cpp = convertOk("print(1)", SourceLanguage.PYTHON);

        assertFalse(cpp.contains("main("), cpp);
    }

    @Test
    void indentWidthFromConfiguration() {
        configService.setConfigValue(ConfigService.INDENT_WIDTH, 2);

        String cpp = convertOk("def f():\n    return 1\n", SourceLanguage.PYTHON);

        assertTrue(cpp.contains("void f() {\n  return 1;\n}"), cpp);
    }

    @Test
    void optionsFallBackToDefaultsWithoutConfiguration() {
        service.configService = null;

        TranslatorOptions options = service.currentOptions();

        assertEquals(TranslatorOptions.DEFAULT_PARAMETER_TYPE, options.getDefaultParameterType());
        assertEquals(TranslatorOptions.DEFAULT_INDENT_WIDTH, options.getIndentWidth());
        assertTrue(options.isEntryPointStub());
    }

    // ========== Validate and format ==========

    @Test
    void validateDelegatesToValidator() {
        ValidationResult valid = service.validate("x = 1", SourceLanguage.PYTHON);
        ValidationResult invalid = service.validate("x = 1", SourceLanguage.CPP);

        assertTrue(valid.isValid());
        assertFalse(invalid.isValid());
    }

    @Test
    void formatReindentsCpp() {
        String formatted = service.format("int main() {\nreturn 0;\n}", SourceLanguage.CPP);

        assertEquals("int main() {\n    return 0;\n}", formatted);
    }

    @Test
    void formatTrimsPython() {
        assertEquals("x = 1", service.format("\n x = 1 \n", SourceLanguage.PYTHON).trim());
        assertEquals("x = 1", service.format("\nx = 1\n\n", SourceLanguage.PYTHON));
    }
}
