package me.christianrobert.polyconv.naming;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CaseConverterTest {

    // ========== titleJoin ==========

    @Test
    void titleJoinSnakeCase() {
        assertEquals("FooBar", CaseConverter.titleJoin("foo_bar"));
    }

    @Test
    void titleJoinKeepsTrailingUnderscore() {
        assertEquals("FooBar_", CaseConverter.titleJoin("foo_bar_"));
    }

    @Test
    void titleJoinCamelCaseOnlyRaisesFirstLetter() {
        assertEquals("FooBar", CaseConverter.titleJoin("fooBar"));
    }

    @Test
    void titleJoinUpperSnakeCase() {
        assertEquals("GetField", CaseConverter.titleJoin("GET_FIELD"));
    }

    @Test
    void titleJoinCapitalizesAfterDigits() {
        assertEquals("Iso8601Z", CaseConverter.titleJoin("iso8601z"));
    }

    // ========== leadLower ==========

    @Test
    void leadLowerSnakeCase() {
        assertEquals("fooBar", CaseConverter.leadLower("foo_bar"));
    }

    @Test
    void leadLowerCamelCaseOnlyLowersFirstLetter() {
        assertEquals("fooBar", CaseConverter.leadLower("FooBar"));
    }

    @Test
    void leadLowerUpperSnakeCase() {
        assertEquals("getField", CaseConverter.leadLower("GET_FIELD"));
    }

    @Test
    void leadLowerKeepsTrailingUnderscore() {
        assertEquals("or_", CaseConverter.leadLower("or_"));
        assertEquals("toIso8601", CaseConverter.leadLower("to_iso8601"));
    }

    @Test
    void singleWordIsUnchanged() {
        assertEquals("table", CaseConverter.leadLower("table"));
        assertEquals("Table", CaseConverter.titleJoin("table"));
    }

    // ========== Edge cases ==========

    @Test
    void emptyAndNullAreReturnedUnchanged() {
        assertEquals("", CaseConverter.titleJoin(""));
        assertEquals("", CaseConverter.leadLower(""));
        assertNull(CaseConverter.leadLower(null));
    }

    @Test
    void snakeCaseClassification() {
        assertTrue(CaseConverter.isSnakeCase("foo_bar"));
        assertTrue(CaseConverter.isSnakeCase("FOO_BAR"));
        assertFalse(CaseConverter.isSnakeCase("fooBar"));
        assertFalse(CaseConverter.isSnakeCase("_private"));
    }
}
