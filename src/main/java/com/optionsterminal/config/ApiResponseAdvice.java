package com.optionsterminal.config;

import com.optionsterminal.api.dto.response.ApiErrorResponse;
import com.optionsterminal.api.dto.response.ApiResponse;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Wraps every gateway REST body (order results, option chains, quotes, rate status, health)
 * as {@code {success: true, data, timestamp}} so the terminal UI reads one envelope shape.
 *
 * <p>Scoped to the gateway's own controllers, so Spring's error controller and the actuator
 * endpoints are left as they are. A broker rejection of an order is still a successful
 * envelope here: its {@code success=false} lives inside {@code data}. Failures raised as
 * exceptions never reach this advice; {@link com.optionsterminal.exception.GlobalExceptionHandler}
 * renders them as {@link ApiErrorResponse}.
 */
@RestControllerAdvice(basePackages = "com.optionsterminal.api.controller")
public class ApiResponseAdvice implements ResponseBodyAdvice<Object> {

    @Override
    public boolean supports(MethodParameter returnType, Class<? extends HttpMessageConverter<?>> converterType) {
        return true;
    }

    @Override
    public Object beforeBodyWrite(
            Object body,
            MethodParameter returnType,
            MediaType selectedContentType,
            Class<? extends HttpMessageConverter<?>> selectedConverterType,
            ServerHttpRequest request,
            ServerHttpResponse response) {

        if (body instanceof ApiResponse<?> || body instanceof ApiErrorResponse) {
            return body;
        }

        // StringHttpMessageConverter can't serialize ApiResponse
        if (StringHttpMessageConverter.class.isAssignableFrom(selectedConverterType)) {
            return body;
        }

        return ApiResponse.of(body);
    }
}
