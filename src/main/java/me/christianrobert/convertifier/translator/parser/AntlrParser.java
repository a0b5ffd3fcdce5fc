package me.christianrobert.convertifier.translator.parser;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.convertifier.antlr.PythonLexer;
import me.christianrobert.convertifier.antlr.PythonParser;
import me.christianrobert.convertifier.translator.context.TranslationException;
import org.antlr.v4.runtime.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Thin wrapper around the ANTLR PythonParser.
 * Handles lexer/parser instantiation and error collection.
 *
 * This is the only class that directly instantiates ANTLR parsers.
 */
@ApplicationScoped
public class AntlrParser {

    private static final Logger log = LoggerFactory.getLogger(AntlrParser.class);

    /**
     * Parses a complete Python module (entry rule: file_input).
     *
     * <p>An empty source parses to an empty module; callers that reject empty
     * input must check before parsing.
     *
     * @param source Python source code
     * @return ParseResult containing the parse tree and any errors
     */
    public ParseResult parseModule(String source) {
        if (source == null) {
            throw new TranslationException("Python source cannot be null");
        }

        log.debug("Parsing Python module: {}", source.substring(0, Math.min(100, source.length())));

        try {
            // Collect errors from both lexer and parser
            List<String> errors = new ArrayList<>();
            BaseErrorListener collector = new BaseErrorListener() {
                @Override
                public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                        int line, int charPositionInLine, String msg,
                                        RecognitionException e) {
                    String error = String.format("Line %d:%d - %s", line, charPositionInLine, msg);
                    errors.add(error);
                    log.warn("Parse error: {}", error);
                }
            };

            PythonLexer lexer = new PythonLexer(CharStreams.fromString(source));
            lexer.removeErrorListeners(); // Remove default console error listener
            lexer.addErrorListener(collector);

            CommonTokenStream tokens = new CommonTokenStream(lexer);
            PythonParser parser = new PythonParser(tokens);
            parser.removeErrorListeners();
            parser.addErrorListener(collector);

            PythonParser.File_inputContext tree = parser.file_input();

            return new ParseResult(tree, errors);

        } catch (Exception e) {
            log.error("Failed to parse Python source", e);
            throw new TranslationException("Failed to parse Python source: " + e.getMessage(), e);
        }
    }
}
