package com.alphaguard.api.dto.response;

import com.alphaguard.audit.GovernanceAuditLogger;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import lombok.Getter;
import org.slf4j.MDC;

/**
 * Success envelope for governance API responses. Carries the request's trace id,
 * when there is one, so a caller can find the matching audit entries.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private final boolean success;
    private final T data;
    private final String traceId;
    private final Instant timestamp;

    private ApiResponse(T data, String traceId) {
        this.success = true;
        this.data = data;
        this.traceId = traceId;
        this.timestamp = Instant.now();
    }

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(data, MDC.get(GovernanceAuditLogger.TRACE_ID_MDC_KEY));
    }
}
