package com.optionsterminal.api.dto.response;

import lombok.Getter;

@Getter
public class ApiResponse<T> {

    private final boolean success;
    private final T data;

    /** Epoch seconds. */
    private final double timestamp;

    private ApiResponse(T data) {
        this.success = true;
        this.data = data;
        this.timestamp = System.currentTimeMillis() / 1000.0;
    }

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(data);
    }
}
