package com.ddm.mnemosyne.validation;

import com.ddm.mnemosyne.defined.ConfigCategory;
import com.ddm.mnemosyne.defined.ConfigEntry;
import com.ddm.mnemosyne.defined.EffectType;
import com.ddm.mnemosyne.defined.ValidationRules;
import com.ddm.mnemosyne.defined.ValueType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link DefaultValidator} 的单元测试。
 */
class DefaultValidatorTest {

    private final DefaultValidator validator = new DefaultValidator();

    private final ValidationRules unitRange = ValidationRules.range(0, 1);

    @Test
    void testNumberRange_Boundaries() {
        assertTrue(validator.validate("0", ValueType.NUMBER, unitRange).isOk());
        assertTrue(validator.validate("1", ValueType.NUMBER, unitRange).isOk());
        assertTrue(validator.validate(0.95, ValueType.NUMBER, unitRange).isOk());
        assertTrue(validator.validate(new BigDecimal("0.95"), ValueType.NUMBER, unitRange).isOk());
    }

    @Test
    void testNumberRange_OutOfBounds() {
        Validation below = validator.validate(-0.01, ValueType.NUMBER, unitRange);
        assertEquals(Validation.Outcome.VIOLATION, below.outcome());
        assertEquals("Minimum value is 0", below.reason());

        Validation above = validator.validate("1.01", ValueType.NUMBER, unitRange);
        assertFalse(above.isOk());
        assertEquals("Maximum value is 1", above.reason());
    }

    @Test
    void testNumber_NotANumber() {
        Validation v = validator.validate("abc", ValueType.NUMBER, ValidationRules.none());
        assertEquals("Must be a valid number", v.reason());
        assertFalse(validator.validate(Double.NaN, ValueType.NUMBER, null).isOk());
    }

    @Test
    void testRequired() {
        ValidationRules required = ValidationRules.none().asRequired();

        assertEquals("Value is required", validator.validate("", ValueType.STRING, required).reason());
        assertEquals("Value is required", validator.validate(null, ValueType.NUMBER, required).reason());
        assertTrue(validator.validate("", ValueType.NUMBER, unitRange).isOk(), "empty passes when not required");
    }

    @Test
    void testStringLengthAndPattern() {
        ValidationRules rules = ValidationRules.length(3, 8).withPattern("^sk-.*");

        assertTrue(validator.validate("sk-12345", ValueType.SECRET, rules).isOk());
        assertEquals("Minimum length is 3", validator.validate("sk", ValueType.STRING, rules).reason());
        assertEquals("Maximum length is 8", validator.validate("sk-123456", ValueType.STRING, rules).reason());
        assertEquals("Value does not match the required format",
                validator.validate("pk-1", ValueType.STRING, rules).reason());
    }

    @Test
    void testPattern_MatchesAnywhere() {
        ValidationRules unanchored = ValidationRules.none().withPattern("sk-");

        assertTrue(validator.validate("sk-abc123", ValueType.STRING, unanchored).isOk());
        assertTrue(validator.validate("key=sk-abc", ValueType.STRING, unanchored).isOk());
        assertFalse(validator.validate("pk-abc123", ValueType.STRING, unanchored).isOk());

        // 需要整体匹配时由规则自身锚定
        ValidationRules anchored = ValidationRules.none().withPattern("^[a-z]+$");
        assertFalse(validator.validate("abc1", ValueType.STRING, anchored).isOk());
    }

    @Test
    void testFirstFailureWins() {
        ValidationRules rules = ValidationRules.length(5, null).withPattern("^x+$");
        assertEquals("Minimum length is 5", validator.validate("ab", ValueType.STRING, rules).reason());
    }

    @Test
    void testEnumOptions() {
        ValidationRules levels = ValidationRules.options("LOW", "MEDIUM", "HIGH");

        assertTrue(validator.validate("HIGH", ValueType.ENUM, levels).isOk());
        assertEquals("Must be one of: LOW, MEDIUM, HIGH",
                validator.validate("URGENT", ValueType.ENUM, levels).reason());
        assertFalse(validator.validate("LOW", ValueType.ENUM, ValidationRules.none()).isOk());
    }

    @Test
    void testOptionsOnOtherTypes() {
        ValidationRules sizes = new ValidationRules(null, null, null, null, null, List.of("10", "20"), null);

        assertTrue(validator.validate(20, ValueType.NUMBER, sizes).isOk());
        assertFalse(validator.validate(30, ValueType.NUMBER, sizes).isOk());
    }

    @Test
    void testBoolean() {
        for (Object ok : new Object[]{true, false, "true", "FALSE", "1", "0"}) {
            assertTrue(validator.validate(ok, ValueType.BOOLEAN, null).isOk(), String.valueOf(ok));
        }
        assertEquals("Must be true or false", validator.validate("yes", ValueType.BOOLEAN, null).reason());
    }

    @Test
    void testJson() {
        assertTrue(validator.validate("{\"a\":[1,2]}", ValueType.JSON, null).isOk());
        assertTrue(validator.validate(Map.of("a", 1), ValueType.JSON, null).isOk());
        assertEquals("Malformed JSON", validator.validate("{\"a\":", ValueType.JSON, null).reason());
    }

    @Test
    void testReadOnlyCheckedBeforeRules() {
        ConfigEntry readOnly = new ConfigEntry("system.region", null, null, ConfigCategory.SYSTEM,
                ValueType.NUMBER, EffectType.IMMEDIATE, "0.5", "0.5", unitRange, null, 0,
                false, true, 1, null, null);

        Validation v = validator.validate(readOnly, "not-a-number");
        assertEquals(Validation.Outcome.READ_ONLY, v.outcome());
        assertFalse(v.isOk());
    }
}
