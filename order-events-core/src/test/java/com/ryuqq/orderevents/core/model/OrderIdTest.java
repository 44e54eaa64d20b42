package com.ryuqq.orderevents.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OrderId 테스트.
 *
 * @author Order Events Team
 * @since 1.0.0
 */
class OrderIdTest {

    @Test
    void of_ValidValue_CreatesInstance() {
        // When
        OrderId orderId = OrderId.of("O1");

        // Then
        assertEquals("O1", orderId.getValue());
        assertEquals("OrderId{O1}", orderId.toString());
    }

    @Test
    void of_NullValue_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> OrderId.of(null)
        );
        assertTrue(exception.getMessage().contains("null or blank"));
    }

    @Test
    void of_BlankValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> OrderId.of("   "));
    }

    @Test
    void of_WhitespaceInside_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> OrderId.of("O 1")
        );
        assertTrue(exception.getMessage().contains("whitespace"));
    }

    @Test
    void of_TooLong_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> OrderId.of("a".repeat(256)));
        assertDoesNotThrow(() -> OrderId.of("a".repeat(255)));
    }

    @Test
    void equals_SameValue_AreEqual() {
        OrderId first = OrderId.of("O1");
        OrderId second = OrderId.of("O1");

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, OrderId.of("O2"));
    }
}
