package me.christianrobert.convertifier.config.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    private ConfigService configService;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
    }

    @Test
    void defaults() {
        assertEquals("auto", configService.getConfigValueAsString(ConfigService.DEFAULT_PARAMETER_TYPE));
        assertEquals("input_var", configService.getConfigValueAsString(ConfigService.INPUT_PLACEHOLDER));
        assertEquals(Boolean.TRUE, configService.getConfigValueAsBoolean(ConfigService.ENTRY_POINT_STUB));
        assertEquals(4, configService.getConfigValueAsInteger(ConfigService.INDENT_WIDTH));
        assertEquals(ConfigService.KNOWN_KEYS, configService.getAllConfiguration().keySet());
    }

    @Test
    void valuesFromJsonAreCoerced() {
        configService.setConfigValue(ConfigService.INDENT_WIDTH, "2");
        configService.setConfigValue(ConfigService.ENTRY_POINT_STUB, "false");

        assertEquals(2, configService.getConfigValueAsInteger(ConfigService.INDENT_WIDTH));
        assertEquals(Boolean.FALSE, configService.getConfigValueAsBoolean(ConfigService.ENTRY_POINT_STUB));

        configService.setConfigValue(ConfigService.INDENT_WIDTH, 8L);
        assertEquals(8, configService.getConfigValueAsInteger(ConfigService.INDENT_WIDTH));
    }

    @Test
    void unknownKeyIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> configService.setConfigValue("oracle.url", "x"));
        assertFalse(configService.hasConfigKey("oracle.url"));
    }

    @Test
    void unusableValuesAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> configService.setConfigValue(ConfigService.INDENT_WIDTH, -1));
        assertThrows(IllegalArgumentException.class,
                () -> configService.setConfigValue(ConfigService.INDENT_WIDTH, 1_000_000_000));
        assertThrows(IllegalArgumentException.class,
                () -> configService.setConfigValue(ConfigService.INDENT_WIDTH, "17"));
        assertThrows(IllegalArgumentException.class,
                () -> configService.setConfigValue(ConfigService.INDENT_WIDTH, "wide"));
        assertThrows(IllegalArgumentException.class,
                () -> configService.setConfigValue(ConfigService.ENTRY_POINT_STUB, "maybe"));
        assertThrows(IllegalArgumentException.class,
                () -> configService.setConfigValue(ConfigService.DEFAULT_PARAMETER_TYPE, " "));
    }

    @Test
    void rejectedBulkUpdateChangesNothing() {
        Map<String, Object> update = new LinkedHashMap<>();
        update.put(ConfigService.DEFAULT_PARAMETER_TYPE, "int");
        update.put(ConfigService.INDENT_WIDTH, -3);

        assertThrows(IllegalArgumentException.class, () -> configService.updateConfiguration(update));
        assertEquals("auto", configService.getConfigValueAsString(ConfigService.DEFAULT_PARAMETER_TYPE));
    }

    @Test
    void resetRestoresDefaults() {
        configService.setConfigValue(ConfigService.DEFAULT_PARAMETER_TYPE, "double");

        configService.resetToDefaults();

        assertEquals("auto", configService.getConfigValueAsString(ConfigService.DEFAULT_PARAMETER_TYPE));
    }
}
