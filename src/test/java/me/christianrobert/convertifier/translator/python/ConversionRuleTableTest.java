package me.christianrobert.convertifier.translator.python;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the ordered C++ to Python line rewriting rules.
 * Each test applies the full default table to a single logical line.
 */
class ConversionRuleTableTest {

    private final ConversionRuleTable table = ConversionRuleTable.defaultTable();

    // ========== Table shape ==========

    @Test
    void defaultTableIsShared() {
        assertSame(ConversionRuleTable.defaultTable(), ConversionRuleTable.defaultTable());
    }

    @Test
    void rulesRunInDeclaredOrder() {
        List<String> names = table.getRules().stream()
                .map(ConversionRule::getName)
                .distinct()
                .collect(Collectors.toList());

        assertEquals(List.of(
                "type-declaration",
                "output-stream",
                "input-stream",
                "function-signature",
                "boolean-literals",
                "logical-operators",
                "equality-operators",
                "string-construction",
                "statement-terminator"), names);
        assertEquals(12, table.size());
    }

    @Test
    void nullRuleListIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ConversionRuleTable(null));
    }

    // ========== Declarations ==========

    @Test
    void typedDeclarationsLoseTheirType() {
        assertEquals("x = 5", table.apply("int x = 5;"));
        assertEquals("ratio = 0.5", table.apply("double ratio = 0.5;"));
        assertEquals("n = 3", table.apply("const unsigned int n = 3;"));
        assertEquals("y = compute()", table.apply("auto y = compute();"));
        assertEquals("name = \"Bob\"", table.apply("std::string name = \"Bob\";"));
    }

    @Test
    void comparisonIsNotMistakenForDeclaration() {
        assertEquals("int x == 5", table.apply("int x == 5;"));
    }

    @Test
    void stringConstructionIsUnwrapped() {
        assertEquals("s = \"abc\"", table.apply("std::string s = std::string(\"abc\");"));
    }

    // ========== Streams ==========

    @Test
    void outputWithLineEnd() {
        assertEquals("print(x)", table.apply("std::cout << x << std::endl;"));
        assertEquals("print(\"sum: \" + total)", table.apply("cout << \"sum: \" << total << endl;"));
        assertEquals("print(\"done\")", table.apply("std::cout << \"done\" << \"\\n\";"));
    }

    @Test
    void outputWithoutLineEnd() {
        assertEquals("print(x, end=\"\")", table.apply("std::cout << x;"));
        assertEquals("print(\"> \", end=\"\")", table.apply("std::cout << \"> \";"));
    }

    @Test
    void bareLineEndPrintsEmptyLine() {
        assertEquals("print()", table.apply("std::cout << std::endl;"));
    }

    @Test
    void outputOperatorInsideStringIsNotSplit() {
        assertEquals("print(\"a << b\")", table.apply("std::cout << \"a << b\" << std::endl;"));
    }

    @Test
    void outputAfterCondition() {
        assertEquals("if (ok) print(x)", table.apply("if (ok) std::cout << x << std::endl;"));
    }

    @Test
    void inputSingleAndMultipleTargets() {
        assertEquals("x = input()", table.apply("std::cin >> x;"));
        assertEquals("a, b = input().split()", table.apply("cin >> a >> b;"));
    }

    // ========== Signatures and operators ==========

    @Test
    void functionSignature() {
        assertEquals("def add(int a, int b):", table.apply("int add(int a, int b) {"));
        assertEquals("def greet(std::string name):", table.apply("void greet(std::string name) {"));
        assertEquals("def tick():", table.apply("static void tick()"));
    }

    @Test
    void booleanLiteralsUseWordBoundaries() {
        assertEquals("flag = True", table.apply("bool flag = true;"));
        assertEquals("truex = False", table.apply("truex = false;"));
    }

    @Test
    void logicalOperators() {
        assertEquals("ok = a and b or c", table.apply("ok = a && b || c;"));
    }

    @Test
    void equalityOperatorsAreKept() {
        assertEquals("if (a == b and c != d) {", table.apply("if (a == b && c != d) {"));
    }

    @Test
    void onlyTrailingSemicolonIsRemoved() {
        assertEquals("x = \"a;b\"", table.apply("x = \"a;b\";"));
        assertEquals("return total", table.apply("return total;"));
    }

    @Test
    void customTable() {
        ConversionRuleTable custom = new ConversionRuleTable(List.of(
                new RegexConversionRule("null-pointer", "\\bnullptr\\b", "None")));

        assertEquals("p = None;", custom.apply("p = nullptr;"));
        assertEquals(1, custom.size());
    }
}
