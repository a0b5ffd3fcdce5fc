package me.christianrobert.convertifier.translator.context;

/**
 * Immutable snapshot of the translator settings used for one translation run.
 *
 * <p>Built from {@code ConfigService} at the start of each request so that a
 * configuration change never affects a run that is already in progress.
 */
public class TranslatorOptions {

    public static final String DEFAULT_PARAMETER_TYPE = "auto";
    public static final String DEFAULT_INPUT_PLACEHOLDER = "input_var";
    public static final int DEFAULT_INDENT_WIDTH = 4;
    public static final int MAX_INDENT_WIDTH = 16;

    private final String defaultParameterType;
    private final String inputPlaceholder;
    private final boolean entryPointStub;
    private final int indentWidth;

    public TranslatorOptions(String defaultParameterType, String inputPlaceholder,
                             boolean entryPointStub, int indentWidth) {
        if (defaultParameterType == null || defaultParameterType.trim().isEmpty()) {
            throw new IllegalArgumentException("Default parameter type cannot be null or empty");
        }
        if (inputPlaceholder == null || inputPlaceholder.trim().isEmpty()) {
            throw new IllegalArgumentException("Input placeholder cannot be null or empty");
        }
        if (indentWidth < 0 || indentWidth > MAX_INDENT_WIDTH) {
            throw new IllegalArgumentException("Indent width must be between 0 and " + MAX_INDENT_WIDTH + ": " + indentWidth);
        }
        this.defaultParameterType = defaultParameterType.trim();
        this.inputPlaceholder = inputPlaceholder.trim();
        this.entryPointStub = entryPointStub;
        this.indentWidth = indentWidth;
    }

    public static TranslatorOptions defaults() {
        return new TranslatorOptions(DEFAULT_PARAMETER_TYPE, DEFAULT_INPUT_PLACEHOLDER, true, DEFAULT_INDENT_WIDTH);
    }

    /**
     * C++ type used for a Python parameter without an annotation.
     */
    public String getDefaultParameterType() {
        return defaultParameterType;
    }

    /**
     * Variable name read by {@code std::cin} when {@code input()} has no argument.
     */
    public String getInputPlaceholder() {
        return inputPlaceholder;
    }

    /**
     * Whether a trivial {@code int main()} is appended when the output has none.
     */
    public boolean isEntryPointStub() {
        return entryPointStub;
    }

    /**
     * Spaces per indent level when formatting C++ output.
     */
    public int getIndentWidth() {
        return indentWidth;
    }

    @Override
    public String toString() {
        return "TranslatorOptions{defaultParameterType='" + defaultParameterType + "'"
                + ", inputPlaceholder='" + inputPlaceholder + "'"
                + ", entryPointStub=" + entryPointStub
                + ", indentWidth=" + indentWidth + "}";
    }
}
