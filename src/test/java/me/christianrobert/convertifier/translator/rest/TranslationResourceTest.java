package me.christianrobert.convertifier.translator.rest;

import jakarta.ws.rs.core.Response;
import me.christianrobert.convertifier.translator.context.SourceLanguage;
import me.christianrobert.convertifier.translator.context.TranslationResult;
import me.christianrobert.convertifier.translator.service.TranslationService;
import me.christianrobert.convertifier.translator.validation.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for request parameter handling in the translation endpoints.
 * The service is mocked; translation itself is covered elsewhere.
 */
class TranslationResourceTest {

    private TranslationResource resource;
    private TranslationService translationService;

    @BeforeEach
    void setUp() {
        translationService = mock(TranslationService.class);
        resource = new TranslationResource();
        resource.translationService = translationService;
    }

    @Test
    void convertResolvesLanguageAliases() {
        TranslationResult expected = TranslationResult.success("int x = 1;", SourceLanguage.CPP, "x = 1");
        when(translationService.convert("int x = 1;", SourceLanguage.CPP, false)).thenReturn(expected);

        TranslationResult result = resource.convert("C++", false, "int x = 1;");

        assertSame(expected, result);
        verify(translationService).convert("int x = 1;", SourceLanguage.CPP, false);
    }

    @Test
    void convertPassesParseTreeFlag() {
        when(translationService.convert(anyString(), any(), anyBoolean()))
                .thenReturn(TranslationResult.success("x = 1", SourceLanguage.PYTHON, "auto x = 1;"));

        resource.convert("py", true, "x = 1");

        verify(translationService).convert("x = 1", SourceLanguage.PYTHON, true);
    }

    @Test
    void convertWithUnknownLanguageFailsWithoutCallingService() {
        TranslationResult result = resource.convert("java", false, "class A {}");

        assertTrue(result.isFailure());
        assertTrue(result.getErrorMessage().contains("Unsupported language: java"), result.getErrorMessage());
        verifyNoInteractions(translationService);
    }

    @Test
    void validateWithUnknownLanguageIsInvalid() {
        ValidationResult result = resource.validate("rust", "fn main() {}");

        assertFalse(result.isValid());
        verifyNoInteractions(translationService);
    }

    @Test
    void validateDelegates() {
        when(translationService.validate("x = 1", SourceLanguage.PYTHON)).thenReturn(ValidationResult.valid("Valid Python code"));

        ValidationResult result = resource.validate("python", "x = 1");

        assertTrue(result.isValid());
    }

    @Test
    void formatReturnsPlainText() {
        when(translationService.format("f() {\ng();\n}", SourceLanguage.CPP)).thenReturn("f() {\n    g();\n}");

        Response response = resource.format("cpp", "f() {\ng();\n}");

        assertEquals(200, response.getStatus());
        assertEquals("f() {\n    g();\n}", response.getEntity());
    }

    @Test
    void formatWithUnknownLanguageIsBadRequest() {
        Response response = resource.format("cobol", "x");

        assertEquals(400, response.getStatus());
        verifyNoInteractions(translationService);
    }
}
