package me.christianrobert.convertifier.translator.format;

import me.christianrobert.convertifier.translator.context.SourceLanguage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CodeFormatterTest {

    private CodeFormatter formatter;

    @BeforeEach
    void setUp() {
        formatter = new CodeFormatter();
    }

    @Test
    void indentsByBraceDepth() {
        String code = "int main() {\nint x = 1;\nif (x) {\nx++;\n}\nreturn 0;\n}";

        String result = formatter.format(code, SourceLanguage.CPP);

        assertEquals("int main() {\n    int x = 1;\n    if (x) {\n        x++;\n    }\n    return 0;\n}", result);
    }

    @Test
    void elseLineDedentsAndIndents() {
        String code = "if (a) {\nx();\n} else if (b) {\ny();\n} else {\nz();\n}";

        String result = formatter.format(code, SourceLanguage.CPP);

        assertEquals("if (a) {\n    x();\n} else if (b) {\n    y();\n} else {\n    z();\n}", result);
    }

    @Test
    void existingIndentationIsReplaced() {
        String code = "void f() {\n\t\t  return;\n      }";

        assertEquals("void f() {\n    return;\n}", formatter.format(code, SourceLanguage.CPP));
    }

    @Test
    void blankLinesStayEmpty() {
        String code = "a {\n   \n  b;\n}\n";

        assertEquals("a {\n\n    b;\n}\n", formatter.format(code, SourceLanguage.CPP));
    }

    @Test
    void unbalancedClosingBracesClampAtZero() {
        assertEquals("}\n}\nx;", formatter.format("}\n  }\n    x;", SourceLanguage.CPP));
    }

    @Test
    void formattingIsIdempotent() {
        String code = "#include <iostream>\n\nvoid f(auto a) {\nif (a) {\nreturn;\n}\n}\n\nint main() {\nreturn 0;\n}";

        String once = formatter.format(code, SourceLanguage.CPP);
        String twice = formatter.format(once, SourceLanguage.CPP);

        assertEquals(once, twice);
    }

    @Test
    void customIndentWidth() {
        CodeFormatter narrow = new CodeFormatter(2);

        assertEquals("f() {\n  g();\n}", narrow.format("f() {\ng();\n}", SourceLanguage.CPP));
        assertEquals(2, narrow.getIndentWidth());
    }

    @Test
    void indentWidthOutsideRangeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new CodeFormatter(-1));
        assertThrows(IllegalArgumentException.class, () -> new CodeFormatter(1_000_000_000));
        assertEquals(16, new CodeFormatter(16).getIndentWidth());
    }

    @Test
    void pythonIsOnlyTrimmed() {
        String code = "\n\nx = 1\nif x:\n    y = 2\n\n";

        assertEquals("x = 1\nif x:\n    y = 2", formatter.format(code, SourceLanguage.PYTHON));
    }

    @Test
    void nullCodeFormatsToEmpty() {
        assertEquals("", formatter.format(null, SourceLanguage.CPP));
        assertEquals("", formatter.format(null, SourceLanguage.PYTHON));
    }
}
