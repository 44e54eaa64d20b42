package com.ryuqq.orderevents.core.exception;

import com.ryuqq.orderevents.core.model.OrderId;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class OrderEventExceptionTest {

    @Test
    void errorCodesAndRetryability() {
        assertCode(new MalformedEventException("x"), "MALFORMED_EVENT", false);
        assertCode(new InvalidPayloadException("x"), "INVALID_PAYLOAD", false);
        assertCode(new InvalidTransitionException("x"), "INVALID_TRANSITION", false);
        assertCode(new UnsupportedEventException("OrderCreated", "x"), "UNSUPPORTED_EVENT", false);
        assertCode(new StoreException("x"), "STORE_WRITE_FAILED", true);
        assertCode(new ConcurrentUpdateException("x"), "CONCURRENT_UPDATE", true);
        assertCode(new PublishException("x"), "PUBLISH_FAILED", true);
    }

    @Test
    void orderNotFound_RetryabilityIsConfigurable() {
        OrderNotFoundException retryable = new OrderNotFoundException(OrderId.of("O1"), true);
        OrderNotFoundException permanent = new OrderNotFoundException(OrderId.of("O1"), false);

        assertCode(retryable, "ORDER_NOT_FOUND", true);
        assertCode(permanent, "ORDER_NOT_FOUND", false);
        assertEquals(OrderId.of("O1"), retryable.getOrderId());
        assertTrue(retryable.getMessage().contains("O1"));
    }

    @Test
    void cause_IsKept() {
        IOException cause = new IOException("timeout");

        PublishException exception = new PublishException("bus unreachable", cause);

        assertSame(cause, exception.getCause());
    }

    private static void assertCode(OrderEventException exception, String code, boolean retryable) {
        assertEquals(code, exception.getErrorCode());
        assertEquals(retryable, exception.isRetryable());
    }
}
