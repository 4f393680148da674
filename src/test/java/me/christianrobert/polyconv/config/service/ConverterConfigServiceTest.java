package me.christianrobert.polyconv.config.service;

import me.christianrobert.polyconv.context.EmitterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConverterConfigServiceTest {

    private ConverterConfigService configService;

    @BeforeEach
    void setUp() {
        configService = new ConverterConfigService();
    }

    @Test
    void defaults() {
        assertEquals("r", configService.getConfigValueAsString(ConverterConfigService.QUERY_ROOT_NAMES));
        assertTrue(configService.getConfigValueAsBoolean(ConverterConfigService.JAVA_SMART_BRACKET));
        assertTrue(configService.getConfigValueAsBoolean(ConverterConfigService.JAVA_CAST_NULLS));

        EmitterConfig config = configService.toEmitterConfig();
        assertEquals("r", config.getDefaultRootName());
        assertTrue(config.isSmartBracket());
        assertTrue(config.isCastNulls());
        assertNull(config.getDeclaredType());
    }

    @Test
    void rootNamesAreCommaSeparated() {
        configService.setConfigValue(ConverterConfigService.QUERY_ROOT_NAMES, " r , rr ,, ");

        assertEquals(List.of("r", "rr"), configService.getConfigValueAsStringList(ConverterConfigService.QUERY_ROOT_NAMES));

        EmitterConfig config = configService.toEmitterConfig();
        assertTrue(config.isQueryRoot("rr"));
        assertEquals("r", config.getDefaultRootName());
    }

    @Test
    void booleanFlagsAcceptStrings() {
        configService.updateConfiguration(Map.of(
                ConverterConfigService.JAVA_SMART_BRACKET, "false",
                ConverterConfigService.JAVA_CAST_NULLS, false));

        EmitterConfig config = configService.toEmitterConfig();
        assertFalse(config.isSmartBracket());
        assertFalse(config.isCastNulls());
    }

    @Test
    void emptyRootNamesFallBackToDefault() {
        configService.setConfigValue(ConverterConfigService.QUERY_ROOT_NAMES, "  ");

        assertEquals("r", configService.toEmitterConfig().getDefaultRootName());
    }

    @Test
    void resetRestoresDefaults() {
        configService.setConfigValue("custom.key", 42);
        configService.setConfigValue(ConverterConfigService.JAVA_CAST_NULLS, false);

        configService.resetToDefaults();

        assertFalse(configService.hasConfigKey("custom.key"));
        assertTrue(configService.getConfigValueAsBoolean(ConverterConfigService.JAVA_CAST_NULLS));
        assertEquals(3, configService.getAllConfiguration().size());
    }
}
