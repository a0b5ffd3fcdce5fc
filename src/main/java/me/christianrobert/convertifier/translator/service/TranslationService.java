package me.christianrobert.convertifier.translator.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.convertifier.antlr.PythonLexer;
import me.christianrobert.convertifier.config.service.ConfigService;
import me.christianrobert.convertifier.translator.context.SourceDocument;
import me.christianrobert.convertifier.translator.context.SourceLanguage;
import me.christianrobert.convertifier.translator.context.TranslationResult;
import me.christianrobert.convertifier.translator.context.TranslatorOptions;
import me.christianrobert.convertifier.translator.cpp.CppStatementTranslator;
import me.christianrobert.convertifier.translator.format.CodeFormatter;
import me.christianrobert.convertifier.translator.parser.AntlrParser;
import me.christianrobert.convertifier.translator.parser.ParseResult;
import me.christianrobert.convertifier.translator.python.ConversionRuleTable;
import me.christianrobert.convertifier.translator.python.CppToPythonTranslator;
import me.christianrobert.convertifier.translator.util.AstTreeFormatter;
import me.christianrobert.convertifier.translator.validation.SourceValidator;
import me.christianrobert.convertifier.translator.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for all translations between Python and C++.
 *
 * <p>Architecture:
 * <pre>
 * source → SourceValidator ──invalid──→ failure(validator message)
 *              │ valid
 *              ├─ Python → CppStatementTranslator (ANTLR parse + semantic tree) ─┐
 *              └─ C++    → CppToPythonTranslator (line rules)                  ─┴→ CodeFormatter → success
 * </pre>
 *
 * <p>No method throws. Invalid input and unexpected faults come back as failed
 * {@link TranslationResult}s; a translator's own diagnostic line
 * ({@code Error converting ...}) is a successful best-effort result.
 *
 * <p>Each call takes a {@link TranslatorOptions} snapshot from {@link ConfigService} and
 * builds fresh translators; the only shared state is read-only.
 */
@ApplicationScoped
public class TranslationService {

    private static final Logger log = LoggerFactory.getLogger(TranslationService.class);

    @Inject
    AntlrParser parser;

    @Inject
    ConfigService configService;

    /**
     * Translates source code to the other language.
     *
     * @param source Source code
     * @param language Language of the source code
     * @return TranslationResult with the formatted translation, or the reason it was rejected
     */
    public TranslationResult convert(String source, SourceLanguage language) {
        return convert(source, language, false);
    }

    /**
     * Translates source code to the other language, optionally with a parse tree dump.
     *
     * @param source Source code
     * @param language Language of the source code
     * @param includeParseTree Attach the ANTLR parse tree of Python input (ignored for C++)
     * @return TranslationResult with the formatted translation, or the reason it was rejected
     */
    public TranslationResult convert(String source, SourceLanguage language, boolean includeParseTree) {
        if (language == null) {
            return TranslationResult.failure(source, null, "Source language is required");
        }
        log.info("Translating {} to {}", language.getDisplayName(), language.target().getDisplayName());

        try {
            SourceDocument document = new SourceDocument(source, language);
            ValidationResult validation = new SourceValidator(parser).validate(document.getText(), language);
            if (!validation.isValid()) {
                log.warn("Rejected {} input: {}", language.getDisplayName(), validation.getMessage());
                return TranslationResult.failure(source, language, validation.getMessage());
            }

            TranslatorOptions options = currentOptions();
            String translated = translate(document, options);
            String formatted = new CodeFormatter(options.getIndentWidth()).format(translated, document.getTargetLanguage());

            if (includeParseTree && language == SourceLanguage.PYTHON) {
                ParseResult parseResult = parser.parseModule(document.getText());
                String tree = AstTreeFormatter.format(parseResult.getTree(), PythonLexer.VOCABULARY);
                return TranslationResult.successWithAst(source, language, formatted, tree);
            }

            log.debug("Translation finished: {} characters", formatted.length());
            return TranslationResult.success(source, language, formatted);

        } catch (Exception e) {
            log.error("Unexpected error during {} translation", language.getDisplayName(), e);
            return TranslationResult.failure(source, language, "Unexpected error: " + e.getMessage());
        }
    }

    /**
     * Checks that source code is acceptable for its declared language.
     */
    public ValidationResult validate(String source, SourceLanguage language) {
        try {
            return new SourceValidator(parser).validate(source, language);
        } catch (Exception e) {
            log.error("Unexpected error during validation", e);
            return ValidationResult.invalid("Unexpected error: " + e.getMessage());
        }
    }

    /**
     * Formats arbitrary text for the given target language. Used for text produced
     * outside the translators, so nothing is validated or translated.
     */
    public String format(String text, SourceLanguage targetLanguage) {
        try {
            return new CodeFormatter(currentOptions().getIndentWidth()).format(text, targetLanguage);
        } catch (Exception e) {
            log.error("Unexpected error during formatting", e);
            return text;
        }
    }

    private String translate(SourceDocument document, TranslatorOptions options) {
        if (document.getLanguage() == SourceLanguage.PYTHON) {
            return new CppStatementTranslator(parser, options).translate(document.getText());
        }
        return new CppToPythonTranslator(ConversionRuleTable.defaultTable()).translate(document.getText());
    }

    /**
     * Snapshot of the current configuration. Missing or unusable values fall back to defaults.
     */
    TranslatorOptions currentOptions() {
        if (configService == null) {
            return TranslatorOptions.defaults();
        }

        String parameterType = configService.getConfigValueAsString(ConfigService.DEFAULT_PARAMETER_TYPE);
        String placeholder = configService.getConfigValueAsString(ConfigService.INPUT_PLACEHOLDER);
        Boolean stub = configService.getConfigValueAsBoolean(ConfigService.ENTRY_POINT_STUB);
        Integer indent = configService.getConfigValueAsInteger(ConfigService.INDENT_WIDTH);

        return new TranslatorOptions(
                isBlank(parameterType) ? TranslatorOptions.DEFAULT_PARAMETER_TYPE : parameterType,
                isBlank(placeholder) ? TranslatorOptions.DEFAULT_INPUT_PLACEHOLDER : placeholder,
                stub == null || stub,
                indent == null || indent < 0 || indent > TranslatorOptions.MAX_INDENT_WIDTH
                        ? TranslatorOptions.DEFAULT_INDENT_WIDTH : indent);
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
