package com.project.recall.backend.exception_handling;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.project.recall.backend.response.ApiResponse;
import com.project.recall.backend.response.ResponseMessage;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

import java.io.IOException;

//no or wrong basic credentials; no WWW-Authenticate header so browsers do not pop up a login dialog
@Slf4j
public class CustomBasicAuthenticationEntryPoint implements AuthenticationEntryPoint {
    private final ObjectMapper objectMapper;

    public CustomBasicAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException) throws IOException {
        log.warn("{} for {}: {}", ResponseMessage.AUTHENTICATION_FAILED, request.getRequestURI(), authException.getMessage());

        response.setContentType("application/json;charset=UTF-8");
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        objectMapper.writeValue(response.getWriter(),
                new ApiResponse(ResponseMessage.AUTHENTICATION_FAILED + ": " + authException.getMessage()));
    }
}
