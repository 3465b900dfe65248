package com.tradefeed.common.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private int status;
    private String error;
    private String message;
    private String path;

    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime timestamp;

    // Error code for categorizing errors (VALIDATION_FAILED, INSUFFICIENT_STOCK, ...)
    private String errorCode;

    private String correlationId;

    // Only set for INSUFFICIENT_STOCK
    private List<StockShortfall> shortfalls;

    // Only set for ILLEGAL_TRANSITION
    private String currentStatus;
    private String targetStatus;
}
