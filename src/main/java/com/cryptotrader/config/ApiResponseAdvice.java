package com.cryptotrader.config;

import com.cryptotrader.api.controller.RiskController;
import com.cryptotrader.api.dto.response.ApiErrorResponse;
import com.cryptotrader.api.dto.response.ApiResponse;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Wraps the bodies of the risk and scheduler controllers in {@link ApiResponse}. Actuator
 * and other framework endpoints are left alone; error bodies pass through as they are.
 */
@RestControllerAdvice(basePackageClasses = RiskController.class)
public class ApiResponseAdvice implements ResponseBodyAdvice<Object> {

    /** String bodies go through the plain-text converter and cannot carry the envelope. */
    @Override
    public boolean supports(MethodParameter returnType, Class<? extends HttpMessageConverter<?>> converterType) {
        return !StringHttpMessageConverter.class.isAssignableFrom(converterType);
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
        return ApiResponse.of(body);
    }
}
