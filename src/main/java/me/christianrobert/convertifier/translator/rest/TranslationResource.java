package me.christianrobert.convertifier.translator.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.convertifier.translator.context.SourceLanguage;
import me.christianrobert.convertifier.translator.context.TranslationResult;
import me.christianrobert.convertifier.translator.service.TranslationService;
import me.christianrobert.convertifier.translator.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * REST endpoint for Python ↔ C++ translation.
 *
 * <p>Usage:
 * <pre>
 * # Python to C++
 * curl -X POST "http://localhost:8080/api/translation/convert?source=python" \
 *   -H "Content-Type: text/plain" \
 *   --data-binary $'def add(a, b):\n    return a + b\n'
 *
 * # C++ to Python
 * curl -X POST "http://localhost:8080/api/translation/convert?source=cpp" \
 *   -H "Content-Type: text/plain" \
 *   --data "int main() { int x = 5; std::cout << x << std::endl; return 0; }"
 * </pre>
 *
 * <p>Response format (JSON):
 * <pre>
 * {
 *   "success": true,
 *   "sourceLanguage": "CPP",
 *   "targetLanguage": "PYTHON",
 *   "translatedCode": "x = 5\nprint(x)",
 *   "errorMessage": null
 * }
 * </pre>
 *
 * <p>Note: /convert and /validate always return HTTP 200. Check the "success"/"valid" field.
 * Rejected input is a valid business outcome, not an HTTP error.
 */
@Path("/api/translation")
@Produces(MediaType.APPLICATION_JSON)
public class TranslationResource {

    private static final Logger log = LoggerFactory.getLogger(TranslationResource.class);

    @Inject
    TranslationService translationService;

    /**
     * Translates source code to the other language.
     *
     * @param source Source language: python, py, cpp or c++
     * @param showAst Include the parse tree of Python input (for debugging)
     * @param code Source code (text/plain body)
     * @return TranslationResult as JSON (always HTTP 200)
     */
    @POST
    @Path("/convert")
    @Consumes(MediaType.TEXT_PLAIN)
    public TranslationResult convert(
            @QueryParam("source") @DefaultValue("python") String source,
            @QueryParam("showAst") @DefaultValue("false") boolean showAst,
            String code
    ) {
        log.info("Translation request received: source={}, showAst={}", source, showAst);
        log.trace("Source code: {}", code);

        SourceLanguage language;
        try {
            language = SourceLanguage.fromName(source);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid source language: {}", source);
            return TranslationResult.failure(code, null, e.getMessage());
        }

        TranslationResult result = translationService.convert(code, language, showAst);
        if (result.isSuccess()) {
            log.info("{} translation succeeded", language.getDisplayName());
        } else {
            log.warn("{} translation failed: {}", language.getDisplayName(), result.getErrorMessage());
        }
        return result;
    }

    /**
     * Validates source code without translating it.
     *
     * @return ValidationResult as JSON (always HTTP 200)
     */
    @POST
    @Path("/validate")
    @Consumes(MediaType.TEXT_PLAIN)
    public ValidationResult validate(
            @QueryParam("source") @DefaultValue("python") String source,
            String code
    ) {
        log.debug("Validation request received: source={}", source);

        try {
            return translationService.validate(code, SourceLanguage.fromName(source));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid source language: {}", source);
            return ValidationResult.invalid(e.getMessage());
        }
    }

    /**
     * Formats code for a target language (e.g. code produced by an external assistant).
     *
     * @param language Target language: python, py, cpp or c++
     * @param code Code to format (text/plain body)
     * @return Formatted code as text/plain, or 400 for an unknown language
     */
    @POST
    @Path("/format")
    @Consumes(MediaType.TEXT_PLAIN)
    @Produces(MediaType.TEXT_PLAIN)
    public Response format(
            @QueryParam("language") String language,
            String code
    ) {
        log.debug("Format request received: language={}", language);

        SourceLanguage target;
        try {
            target = SourceLanguage.fromName(language);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid format language: {}", language);
            return Response.status(Response.Status.BAD_REQUEST)
                    .type(MediaType.APPLICATION_JSON)
                    .entity(Map.of("error", e.getMessage()))
                    .build();
        }

        return Response.ok(translationService.format(code, target)).build();
    }
}
