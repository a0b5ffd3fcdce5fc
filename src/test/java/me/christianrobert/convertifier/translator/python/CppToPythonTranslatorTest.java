package me.christianrobert.convertifier.translator.python;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the line-oriented C++ to Python translation, including removal
 * of preprocessor lines and of the {@code main} wrapper.
 */
class CppToPythonTranslatorTest {

    private CppToPythonTranslator translator;

    @BeforeEach
    void setUp() {
        translator = new CppToPythonTranslator();
    }

    // ========== Entry point ==========

    @Test
    void oneLineMainProgram() {
        String result = translator.translate("int main() { int x = 5; std::cout << x << std::endl; return 0; }");

        assertEquals("x = 5\nprint(x)", result);
    }

    @Test
    void completeProgram() {
        String source = """
            #include <iostream>
            using namespace std;

            int add(int a, int b) {
                return a + b;
            }

            int main() {
                bool ok = true && false;
                cout << "sum: " << add(1, 2) << endl;
                return 0;
            }
            """;

        String result = translator.translate(source);

        assertEquals(String.join("\n",
                "def add(int a, int b):",
                "return a + b",
                "ok = True and False",
                "print(\"sum: \" + add(1, 2))"), result);
    }

    @Test
    void mainWithBraceOnNextLine() {
        String result = translator.translate("int main()\n{\n    int x = 1;\n    return 0;\n}\n");

        assertEquals("x = 1", result);
    }

    @Test
    void mainWithArguments() {
        String result = translator.translate("int main(int argc, char** argv) {\n    run();\n    return EXIT_SUCCESS;\n}");

        assertEquals("run()", result);
    }

    @Test
    void nestedReturnInsideMainIsKept() {
        String source = "int main() {\n    if (x) {\n        return 0;\n    }\n    return 0;\n}";

        String result = translator.translate(source);

        assertEquals("if (x) {\nreturn 0", result);
    }

    @Test
    void codeAfterMainIsTranslated() {
        String source = "int main() {\n    return 0;\n}\nint y = 2;";

        assertEquals("y = 2", translator.translate(source));
    }

    @Test
    void oneLineMainWithLoopDropsSuccessReturn() {
        String result = translator.translate(
                "int main() { for (int i = 0; i < 3; i++) { x += i; } return 0; }");

        assertEquals("for (int i = 0; i < 3; i++) {\nx += i", result);
    }

    @Test
    void functionFollowingOneLineMainIsTranslated() {
        String result = translator.translate("int main() { return 0; } int other() { return 1; }");

        assertEquals("def other():\nreturn 1", result);
    }

    // ========== Line handling ==========

    @Test
    void preprocessorAndNamespaceLinesAreDropped() {
        String result = translator.translate("#include <iostream>\n#define MAX 10\nusing namespace std;\nint x = 1;");

        assertEquals("x = 1", result);
    }

    @Test
    void commentsBecomePythonComments() {
        String result = translator.translate("// header\nint x = 1; // one");

        assertEquals("# header\nx = 1\n# one", result);
    }

    @Test
    void blockCommentsBecomePythonComments() {
        String source = "/* Adds\n * two numbers */\nint x = 1; /* inline */ int y = 2;\nint z /* odd */ = 3;";

        assertEquals("# Adds\n# two numbers\nx = 1\n# inline\ny = 2\nz = 3", translator.translate(source));
    }

    @Test
    void inputStatement() {
        assertEquals("a, b = input().split()", translator.translate("std::cin >> a >> b;"));
    }

    @Test
    void loneClosingBracesAreDropped() {
        String source = "void greet() {\n    std::cout << \"hi\" << std::endl;\n}\n};";

        assertEquals("def greet():\nprint(\"hi\")", translator.translate(source));
    }

    @Test
    void loneOpeningBracesAreDropped() {
        String source = "int add(int a, int b)\n{\n    return a + b;\n}\n";

        assertEquals("def add(int a, int b):\nreturn a + b", translator.translate(source));
    }

    @Test
    void emptyAndNullSource() {
        assertEquals("", translator.translate(""));
        assertEquals("", translator.translate(null));
    }

    @Test
    void failingRuleYieldsSingleErrorLine() {
        ConversionRule failing = new ConversionRule() {
            @Override
            public String getName() {
                return "failing";
            }

            @Override
            public String apply(String line) {
                throw new IllegalStateException("rule failed");
            }
        };
        CppToPythonTranslator broken = new CppToPythonTranslator(new ConversionRuleTable(List.of(failing)));

        assertEquals("Error converting C++ to Python: rule failed", broken.translate("int x = 1;"));
    }
}
