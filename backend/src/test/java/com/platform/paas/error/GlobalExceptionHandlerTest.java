package com.platform.paas.error;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class GlobalExceptionHandlerTest {

    @Test
    void shouldMapLookupAndAdmissionCodesToClientStatuses() {
        assertEquals(HttpStatus.NOT_FOUND, GlobalExceptionHandler.mapErrorCodeToStatus(ErrorCode.WORKLOAD_NOT_FOUND));
        assertEquals(HttpStatus.NOT_FOUND, GlobalExceptionHandler.mapErrorCodeToStatus(ErrorCode.TASK_NOT_FOUND));
        assertEquals(HttpStatus.BAD_REQUEST, GlobalExceptionHandler.mapErrorCodeToStatus(ErrorCode.NAME_RESERVED));
        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY,
            GlobalExceptionHandler.mapErrorCodeToStatus(ErrorCode.QUOTA_EXCEEDED));
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE,
            GlobalExceptionHandler.mapErrorCodeToStatus(ErrorCode.QUEUE_UNAVAILABLE));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR,
            GlobalExceptionHandler.mapErrorCodeToStatus(ErrorCode.CONFIGURATION_ERROR));
    }

    @Test
    void shouldKeepCodesUnique() {
        List<String> codes = Arrays.stream(ErrorCode.values()).map(ErrorCode::getCode).toList();

        assertEquals(codes.size(), codes.stream().distinct().count());
    }

    @Test
    void shouldDescribeMissingWorkloadByItsPath() {
        ResourceNotFoundException e = ResourceNotFoundException.workload("acme", "shop", "web");

        assertEquals(ErrorCode.WORKLOAD_NOT_FOUND, e.getErrorCode());
        assertEquals("Workload not found: acme/shop/web", e.getMessage());
        assertEquals("acme/shop/web", e.getResourceId());
    }
}
