package com.example.adaptivestream.api.response;

import com.example.adaptivestream.common.exception.BusinessException;
import com.example.adaptivestream.common.logging.AccessLogFilter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class ApiResponseTest {

    @AfterEach
    void tearDown() {
        MDC.remove(AccessLogFilter.MDC_REQUEST_ID);
    }

    @Test
    void shouldCarryRequestIdAsTraceId() {
        MDC.put(AccessLogFilter.MDC_REQUEST_ID, "req-42");

        ApiResponse<String> response = ApiResponse.acknowledged("DISPOSED");

        Assertions.assertTrue(response.isSuccessful());
        Assertions.assertEquals("DISPOSED", response.getData());
        Assertions.assertEquals("req-42", response.getTraceId());
    }

    @Test
    void shouldMapBusinessExceptionToFailure() {
        BusinessException e = new BusinessException("SESSION_LIMIT_REACHED", "Too many active sessions", "Retry later");

        ApiResponse<Void> response = ApiResponse.fail(e);

        Assertions.assertFalse(response.isSuccessful());
        Assertions.assertEquals("SESSION_LIMIT_REACHED", response.getCode());
        Assertions.assertEquals("Retry later", response.getUserAction());
        Assertions.assertNull(response.getTraceId());
    }
}
