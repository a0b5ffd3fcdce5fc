package me.christianrobert.convertifier.translator.validation;

import me.christianrobert.convertifier.translator.context.SourceLanguage;
import me.christianrobert.convertifier.translator.parser.AntlrParser;
import me.christianrobert.convertifier.translator.parser.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Checks that submitted source is acceptable for its declared language before translation.
 *
 * <ul>
 *   <li>Python: must parse without errors under the Python grammar.</li>
 *   <li>C++: smoke test only; the text must contain a {@code ;}, an opening and a
 *       closing brace. Nothing else about C++ grammar is checked.</li>
 * </ul>
 *
 * <p>Never throws; empty input and null arguments give an invalid result.
 */
public class SourceValidator {

    private static final Logger log = LoggerFactory.getLogger(SourceValidator.class);

    static final List<String> CPP_REQUIRED_ELEMENTS = List.of(";", "{", "}");

    private final AntlrParser parser;

    public SourceValidator(AntlrParser parser) {
        this.parser = parser;
    }

    public ValidationResult validate(String source, SourceLanguage language) {
        if (language == null) {
            return ValidationResult.invalid("Source language is required");
        }
        if (source == null || source.isBlank()) {
            return ValidationResult.invalid(language.getDisplayName() + " code cannot be empty");
        }

        try {
            return language == SourceLanguage.PYTHON ? validatePython(source) : validateCpp(source);
        } catch (Exception e) {
            log.error("Validation of {} code failed", language.getDisplayName(), e);
            return ValidationResult.invalid("Invalid " + language.getDisplayName() + " code: " + e.getMessage());
        }
    }

    private ValidationResult validatePython(String source) {
        ParseResult result = parser.parseModule(source);
        if (result.hasErrors()) {
            return ValidationResult.invalid("Invalid Python code: " + result.getErrorMessage());
        }
        return ValidationResult.valid("Valid Python code");
    }

    private ValidationResult validateCpp(String source) {
        for (String element : CPP_REQUIRED_ELEMENTS) {
            if (!source.contains(element)) {
                return ValidationResult.invalid("Invalid C++ code: Missing required element '" + element + "'");
            }
        }
        return ValidationResult.valid("Valid C++ code");
    }
}
