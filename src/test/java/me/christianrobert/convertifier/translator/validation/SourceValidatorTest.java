package me.christianrobert.convertifier.translator.validation;

import me.christianrobert.convertifier.translator.context.SourceLanguage;
import me.christianrobert.convertifier.translator.parser.AntlrParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for pre-translation input checks: structural parse for Python,
 * required punctuation for C++.
 */
class SourceValidatorTest {

    private SourceValidator validator;

    @BeforeEach
    void setUp() {
        validator = new SourceValidator(new AntlrParser());
    }

    // ========== Common ==========

    @Test
    void emptyInputIsRejected() {
        ValidationResult python = validator.validate("   \n\t", SourceLanguage.PYTHON);
        ValidationResult cpp = validator.validate("", SourceLanguage.CPP);

        assertFalse(python.isValid());
        assertEquals("Python code cannot be empty", python.getMessage());
        assertFalse(cpp.isValid());
        assertEquals("C++ code cannot be empty", cpp.getMessage());
    }

    @Test
    void nullInputIsRejected() {
        assertFalse(validator.validate(null, SourceLanguage.PYTHON).isValid());
    }

    @Test
    void missingLanguageIsRejected() {
        ValidationResult result = validator.validate("x = 1", null);

        assertFalse(result.isValid());
        assertEquals("Source language is required", result.getMessage());
    }

    // ========== Python ==========

    @Test
    void validPython() {
        ValidationResult result = validator.validate("def add(a, b): return a + b", SourceLanguage.PYTHON);

        assertTrue(result.isValid(), result.getMessage());
        assertEquals("Valid Python code", result.getMessage());
    }

    @Test
    void pythonSyntaxErrorCarriesParserMessage() {
        ValidationResult result = validator.validate("total = (1 +)\nprint(total)\n", SourceLanguage.PYTHON);

        assertFalse(result.isValid());
        assertTrue(result.getMessage().startsWith("Invalid Python code: Line 1:"), result.getMessage());
    }

    @Test
    void generatorsAreValidPython() {
        ValidationResult result = validator.validate(
                "def g():\n    yield 1\n    yield from range(3)\n    sent = yield\n", SourceLanguage.PYTHON);

        assertTrue(result.isValid(), result.getMessage());
    }

    @Test
    void asyncCodeIsValidPython() {
        String source = "async def fetch(url):\n"
                + "    async with session(url) as response:\n"
                + "        data = await response.read()\n"
                + "    async for chunk in stream():\n"
                + "        pass\n"
                + "    return data\n";

        ValidationResult result = validator.validate(source, SourceLanguage.PYTHON);

        assertTrue(result.isValid(), result.getMessage());
    }

    @Test
    void assignmentExpressionIsValidPython() {
        ValidationResult result = validator.validate(
                "if (n := len(items)) > 10:\n    print(n)\n", SourceLanguage.PYTHON);

        assertTrue(result.isValid(), result.getMessage());
    }

    @Test
    void matchStatementIsValidPython() {
        String source = "match point:\n"
                + "    case (0, 0):\n"
                + "        print('origin')\n"
                + "    case {'x': x, **rest} if x > 0:\n"
                + "        print(x)\n"
                + "    case Point(x=0) | None:\n"
                + "        pass\n"
                + "    case _:\n"
                + "        pass\n";

        ValidationResult result = validator.validate(source, SourceLanguage.PYTHON);

        assertTrue(result.isValid(), result.getMessage());
    }

    @Test
    void cppIsNotValidPython() {
        assertFalse(validator.validate("int main() { return 0; }", SourceLanguage.PYTHON).isValid());
    }

    // ========== C++ ==========

    @Test
    void validCpp() {
        ValidationResult result = validator.validate("int main() { int x = 5; return 0; }", SourceLanguage.CPP);

        assertTrue(result.isValid());
        assertEquals("Valid C++ code", result.getMessage());
    }

    @Test
    void cppMissingElementsAreReportedInOrder() {
        assertEquals("Invalid C++ code: Missing required element ';'",
                validator.validate("int main() { }", SourceLanguage.CPP).getMessage());
        assertEquals("Invalid C++ code: Missing required element '{'",
                validator.validate("int x = 1;", SourceLanguage.CPP).getMessage());
        assertEquals("Invalid C++ code: Missing required element '}'",
                validator.validate("int main() { return 0;", SourceLanguage.CPP).getMessage());
    }

    @Test
    void pythonSourceIsNotValidCpp() {
        assertFalse(validator.validate("print(1 + 2)", SourceLanguage.CPP).isValid());
    }
}
