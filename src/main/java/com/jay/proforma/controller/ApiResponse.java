package com.jay.proforma.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;

@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    private boolean success;
    private int status;
    private String message;
    private T data;
    private List<String> errors;
    private OffsetDateTime timestamp;

    public ApiResponse(boolean success, int status, String message, T data) {
        this.success = success;
        this.status = status;
        this.message = message;
        this.data = data;
        this.timestamp = OffsetDateTime.now();
    }

    public ApiResponse(boolean success, int status, String message, List<String> errors) {
        this.success = success;
        this.status = status;
        this.message = message;
        this.errors = errors;
        this.timestamp = OffsetDateTime.now();
    }
}
