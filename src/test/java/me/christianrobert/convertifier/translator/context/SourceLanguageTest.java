package me.christianrobert.convertifier.translator.context;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceLanguageTest {

    @Test
    void namesAreCaseInsensitive() {
        assertEquals(SourceLanguage.PYTHON, SourceLanguage.fromName("Python"));
        assertEquals(SourceLanguage.PYTHON, SourceLanguage.fromName(" py "));
        assertEquals(SourceLanguage.CPP, SourceLanguage.fromName("CPP"));
        assertEquals(SourceLanguage.CPP, SourceLanguage.fromName("c++"));
    }

    @Test
    void unknownOrMissingNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> SourceLanguage.fromName("java"));
        assertThrows(IllegalArgumentException.class, () -> SourceLanguage.fromName(""));
        assertThrows(IllegalArgumentException.class, () -> SourceLanguage.fromName(null));
    }

    @Test
    void targetIsTheOtherLanguage() {
        assertEquals(SourceLanguage.CPP, SourceLanguage.PYTHON.target());
        assertEquals(SourceLanguage.PYTHON, SourceLanguage.CPP.target());
    }

    @Test
    void translationOptionsRejectUnusableValues() {
        assertThrows(IllegalArgumentException.class, () -> new TranslatorOptions(" ", "input_var", true, 4));
        assertThrows(IllegalArgumentException.class, () -> new TranslatorOptions("auto", "input_var", true, -1));
    }
}
