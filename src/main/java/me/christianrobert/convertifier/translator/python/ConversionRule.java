package me.christianrobert.convertifier.translator.python;

/**
 * One step of the line-oriented C++ to Python rewrite.
 * Implementations are pure and stateless; a rule that does not match returns the line unchanged.
 */
public interface ConversionRule {

    /**
     * Short identifier used in logs and tests, e.g. {@code type-declaration}.
     */
    String getName();

    String apply(String line);
}
