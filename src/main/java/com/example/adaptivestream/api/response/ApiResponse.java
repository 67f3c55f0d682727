package com.example.adaptivestream.api.response;

import com.example.adaptivestream.common.exception.BusinessException;
import com.example.adaptivestream.common.logging.AccessLogFilter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.MDC;

/**
 * Envelope for every API answer. {@code code} is "0" on success, otherwise the business
 * error code; {@code traceId} echoes the request id of the access log.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    public static final String SUCCESS_CODE = "0";

    private String code;
    private String message;
    private T data;
    private String userAction;
    private String traceId;

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(SUCCESS_CODE, "OK", data, null, currentTraceId());
    }

    /**
     * Answer for commands that only report the state the resource moved to.
     */
    public static ApiResponse<String> acknowledged(String state) {
        return new ApiResponse<>(SUCCESS_CODE, "OK", state, null, currentTraceId());
    }

    public static <T> ApiResponse<T> fail(String code, String message) {
        return new ApiResponse<>(code, message, null, null, currentTraceId());
    }

    public static <T> ApiResponse<T> fail(String code, String message, String userAction) {
        return new ApiResponse<>(code, message, null, userAction, currentTraceId());
    }

    public static <T> ApiResponse<T> fail(BusinessException e) {
        return fail(e.getCode(), e.getMessage(), e.getUserAction());
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return SUCCESS_CODE.equals(code);
    }

    private static String currentTraceId() {
        return MDC.get(AccessLogFilter.MDC_REQUEST_ID);
    }
}
