package me.christianrobert.convertifier.translator.context;

/**
 * Result of a translation run.
 * Contains either the translated code or an error message, never both.
 * Optionally includes a parse tree dump for debugging (Python sources only).
 *
 * <p>A best-effort translation that contains fallback renderings or a diagnostic line
 * is still a success; only rejected input and unexpected faults are failures.
 */
public class TranslationResult {

    private final boolean success;
    private final String sourceCode;
    private final SourceLanguage sourceLanguage;
    private final String translatedCode;
    private final String errorMessage;
    private final String astTree;  // Optional parse tree representation (null by default)

    private TranslationResult(boolean success, String sourceCode, SourceLanguage sourceLanguage,
                              String translatedCode, String errorMessage, String astTree) {
        this.success = success;
        this.sourceCode = sourceCode;
        this.sourceLanguage = sourceLanguage;
        this.translatedCode = translatedCode;
        this.errorMessage = errorMessage;
        this.astTree = astTree;
    }

    /**
     * Creates a successful translation result.
     */
    public static TranslationResult success(String sourceCode, SourceLanguage sourceLanguage, String translatedCode) {
        return new TranslationResult(true, sourceCode, sourceLanguage, translatedCode, null, null);
    }

    /**
     * Creates a successful translation result with a parse tree dump.
     */
    public static TranslationResult successWithAst(String sourceCode, SourceLanguage sourceLanguage,
                                                   String translatedCode, String astTree) {
        return new TranslationResult(true, sourceCode, sourceLanguage, translatedCode, null, astTree);
    }

    /**
     * Creates a failed translation result.
     */
    public static TranslationResult failure(String sourceCode, SourceLanguage sourceLanguage, String errorMessage) {
        return new TranslationResult(false, sourceCode, sourceLanguage, null, errorMessage, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public String getSourceCode() {
        return sourceCode;
    }

    public SourceLanguage getSourceLanguage() {
        return sourceLanguage;
    }

    public SourceLanguage getTargetLanguage() {
        return sourceLanguage != null ? sourceLanguage.target() : null;
    }

    public String getTranslatedCode() {
        return translatedCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getAstTree() {
        return astTree;
    }

    public boolean hasAstTree() {
        return astTree != null;
    }

    @Override
    public String toString() {
        if (success) {
            return "TranslationResult{success=true, sourceLanguage=" + sourceLanguage
                    + ", translatedCode='" + translatedCode + "'"
                    + (astTree != null ? ", hasAstTree=true" : "") + "}";
        } else {
            return "TranslationResult{success=false, sourceLanguage=" + sourceLanguage
                    + ", error='" + errorMessage + "'}";
        }
    }
}
