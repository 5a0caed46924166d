package com.ddm.mnemosyne.defined;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValueTypeTest {

    @Test
    void testParse() {
        assertEquals(new BigDecimal("0.95"), ValueType.NUMBER.parse("0.95"));
        assertEquals(Boolean.TRUE, ValueType.BOOLEAN.parse("1"));
        assertEquals(Boolean.FALSE, ValueType.BOOLEAN.parse("false"));
        assertEquals(Map.of("a", List.of(1, 2)), ValueType.JSON.parse("{\"a\":[1,2]}"));
        assertEquals("sk-abc", ValueType.SECRET.parse("sk-abc"));
        assertNull(ValueType.NUMBER.parse(""));
        assertNull(ValueType.STRING.parse(null));
    }

    @Test
    void testSerialize() {
        assertEquals("0.95", ValueType.NUMBER.serialize(0.95));
        assertEquals("100", ValueType.NUMBER.serialize(new BigDecimal("1E+2")));
        assertEquals("true", ValueType.BOOLEAN.serialize("1"));
        assertEquals("{\"a\":1}", ValueType.JSON.serialize(Map.of("a", 1)));
        assertEquals("{\"a\": 1}", ValueType.JSON.serialize("{\"a\": 1}"));
        assertEquals("", ValueType.STRING.serialize(null));
    }

    @Test
    void testSecretDefinitionMustBeEncrypted() {
        assertThrows(IllegalArgumentException.class, () -> new ConfigDefinition("k", null, null, null,
                ValueType.SECRET, null, "", null, null, null, Boolean.FALSE, null));
        assertTrue(ConfigDefinition.of("k", ValueType.SECRET, "").isEncrypted());
        assertFalse(ConfigDefinition.of("k", ValueType.STRING, "").isEncrypted());
    }
}
