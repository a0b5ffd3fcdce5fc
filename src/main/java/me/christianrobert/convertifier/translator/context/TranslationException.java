package me.christianrobert.convertifier.translator.context;

/**
 * Exception thrown inside the translators when a source cannot be parsed or walked.
 *
 * <p>Never crosses the {@code TranslationService} boundary: each directional translator
 * catches it and turns it into a diagnostic line.
 */
public class TranslationException extends RuntimeException {

    public TranslationException(String message) {
        super(message);
    }

    public TranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
