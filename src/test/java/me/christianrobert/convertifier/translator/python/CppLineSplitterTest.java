package me.christianrobert.convertifier.translator.python;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CppLineSplitterTest {

    @Test
    void splitsOneLineProgram() {
        List<String> lines = CppLineSplitter.split("int main() { int x = 5; return 0; }");

        assertEquals(List.of("int main() {", "int x = 5;", "return 0;", "}"), lines);
    }

    @Test
    void semicolonsInsideParenthesesDoNotSplit() {
        List<String> lines = CppLineSplitter.split("for (int i = 0; i < 3; i++) { x++; }");

        assertEquals(List.of("for (int i = 0; i < 3; i++) {", "x++;", "}"), lines);
    }

    @Test
    void literalsAreOpaque() {
        assertEquals(List.of("std::cout << \"a;{b}\" << std::endl;"),
                CppLineSplitter.split("std::cout << \"a;{b}\" << std::endl;"));
        assertEquals(List.of("char c = ';';"), CppLineSplitter.split("char c = ';';"));
        assertEquals(List.of("s = \"say \\\"hi;\\\"\";"), CppLineSplitter.split("s = \"say \\\"hi;\\\"\";"));
    }

    @Test
    void closingBraceStaysWithElse() {
        List<String> lines = CppLineSplitter.split("if (a) { x(); } else { y(); }");

        assertEquals(List.of("if (a) {", "x();", "} else {", "y();", "}"), lines);
    }

    @Test
    void codeAfterClosingBraceStartsNewLine() {
        assertEquals(List.of("int main() {", "for (int i = 0; i < 3; i++) {", "x += i;", "}", "return 0;", "}"),
                CppLineSplitter.split("int main() { for (int i = 0; i < 3; i++) { x += i; } return 0; }"));
        assertEquals(List.of("int main() {", "return 0;", "}", "int other() {", "return 1;", "}"),
                CppLineSplitter.split("int main() { return 0; } int other() { return 1; }"));
    }

    @Test
    void semicolonStaysWithClosingBrace() {
        assertEquals(List.of("struct P {", "int x;", "};", "int y;"),
                CppLineSplitter.split("struct P { int x; }; int y;"));
    }

    @Test
    void blockCommentBetweenStatementsBecomesLineComments() {
        List<String> lines = CppLineSplitter.split("/**\n * Entry {point};\n */\nint x = 1;");

        assertEquals(List.of("// Entry {point};", "int x = 1;"), lines);
    }

    @Test
    void blockCommentInsideStatementIsDropped() {
        assertEquals(List.of("int x = 5;"), CppLineSplitter.split("int x /* width; */ = 5;"));
    }

    @Test
    void trailingCommentBecomesItsOwnLine() {
        List<String> lines = CppLineSplitter.split("int x = 1; // the answer\nx++;");

        assertEquals(List.of("int x = 1;", "// the answer", "x++;"), lines);
    }

    @Test
    void braceInsideCommentIsIgnored() {
        List<String> lines = CppLineSplitter.split("// {not a block;}\nreturn 0;");

        assertEquals(List.of("// {not a block;}", "return 0;"), lines);
    }

    @Test
    void blankLinesAndIndentationAreDropped() {
        List<String> lines = CppLineSplitter.split("\n\n    int x = 1;\r\n\t\n   }\n");

        assertEquals(List.of("int x = 1;", "}"), lines);
    }

    @Test
    void nullOrEmptySource() {
        assertTrue(CppLineSplitter.split(null).isEmpty());
        assertTrue(CppLineSplitter.split("").isEmpty());
    }
}
