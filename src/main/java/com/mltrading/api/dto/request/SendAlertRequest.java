package com.mltrading.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for raising an alert through the operator API.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SendAlertRequest {

    @NotBlank
    private String title;

    @NotBlank
    private String message;

    /** Severity name, case-insensitive (e.g. "high"). */
    @NotBlank
    private String severity;

    /** Category key or name (e.g. "trading_errors"); general when absent. */
    private String category;

    private String component;

    private Map<String, Object> metadata;
}
