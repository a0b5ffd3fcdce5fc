package me.christianrobert.convertifier.translator.cpp;

import me.christianrobert.convertifier.translator.semantic.expression.*;
import me.christianrobert.convertifier.translator.semantic.statement.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for deriving the include block from imports and operators.
 */
class IncludeCollectorTest {

    @Test
    void alwaysIncludesStreamsAndStrings() {
        IncludeCollector collector = new IncludeCollector();

        Set<String> headers = collector.collect(List.of());

        assertEquals(Set.of("iostream", "string"), headers);
    }

    @Test
    void knownModulesMapToHeaders() {
        IncludeCollector collector = new IncludeCollector();

        collector.collect(List.of(
                new Import(List.of("time", "sys")),
                new ImportFrom("random", List.of("randint"))));

        assertEquals(List.of(
                "#include <ctime>",
                "#include <iostream>",
                "#include <random>",
                "#include <string>"), collector.includeLines());
    }

    @Test
    void submoduleAndRelativeImportsUseTopLevelName() {
        IncludeCollector collector = new IncludeCollector();

        Set<String> headers = collector.collect(List.of(
                new Import(List.of("math.extra")),
                new ImportFrom("..time", List.of("*"))));

        assertTrue(headers.contains("cmath"));
        assertTrue(headers.contains("ctime"));
    }

    @Test
    void powerInsideNestedBodiesAddsCmath() {
        Expression pow = new BinaryOp(new Name("x"), BinaryOperator.POW, Literal.number("2"));
        FunctionDef def = new FunctionDef("square", List.of(new Parameter("x")), null,
                List.of(new Return(pow)), "def square(x):");

        Set<String> headers = new IncludeCollector().collect(List.of(def));

        assertTrue(headers.contains("cmath"));
    }

    @Test
    void powerAugmentedAssignmentAddsCmath() {
        AugAssign aug = new AugAssign(new Name("x"), BinaryOperator.POW, Literal.number("3"));

        assertTrue(new IncludeCollector().collect(List.of(aug)).contains("cmath"));
    }
}
