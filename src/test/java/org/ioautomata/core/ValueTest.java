package org.ioautomata.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValueTest {

    @Test
    @DisplayName("布尔值与标识符是两个不同的变体")
    void testVariants() {
        Value bool = Value.of(true);
        Value identifier = Value.identifier("x");

        assertAll(
                () -> assertTrue(bool.isBool()),
                () -> assertFalse(bool.isIdentifier()),
                () -> assertTrue(identifier.isIdentifier()),
                () -> assertEquals(Value.TRUE, bool),
                () -> assertEquals(Value.identifier("x"), identifier),
                () -> assertNotEquals(Value.identifier("true"), Value.TRUE),
                () -> assertEquals("x", identifier.toString()),
                () -> assertEquals("false", Value.FALSE.toString())
        );
    }

    @Test
    @DisplayName("标识符名称不能为空")
    void testEmptyIdentifier_ShouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> Value.identifier(""));
    }

    @Test
    @DisplayName("Evaluation 只有 TRUE/FALSE 能转换为布尔值")
    void testEvaluation() {
        assertAll(
                () -> assertEquals(Evaluation.TRUE, Evaluation.of(true)),
                () -> assertTrue(Evaluation.TRUE.asBoolean()),
                () -> assertEquals(Value.FALSE, Evaluation.FALSE.toValue()),
                () -> assertTrue(Evaluation.VOID.isVoid()),
                () -> assertThrows(IllegalStateException.class, Evaluation.VOID::asBoolean)
        );
    }
}
