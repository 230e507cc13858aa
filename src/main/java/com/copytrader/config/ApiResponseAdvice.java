package com.copytrader.config;

import com.copytrader.api.dto.response.ApiErrorResponse;
import com.copytrader.api.dto.response.ApiResponse;
import java.util.List;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Wraps every body returned by the engine's REST controllers in {@link ApiResponse}.
 * Actuator, the STOMP handshake and the servlet error page keep their native format.
 */
@RestControllerAdvice
public class ApiResponseAdvice implements ResponseBodyAdvice<Object> {

    private static final List<String> PASSTHROUGH_PREFIXES = List.of("/actuator", "/ws", "/error");

    @Override
    public boolean supports(MethodParameter returnType, Class<? extends HttpMessageConverter<?>> converterType) {
        // a String body would need to be re-encoded as JSON by hand
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
        if (body instanceof ApiResponse<?> || body instanceof ApiErrorResponse || isPassthrough(request)) {
            return body;
        }
        return ApiResponse.of(body);
    }

    private static boolean isPassthrough(ServerHttpRequest request) {
        String path = request.getURI().getPath();
        return PASSTHROUGH_PREFIXES.stream().anyMatch(path::startsWith);
    }
}
