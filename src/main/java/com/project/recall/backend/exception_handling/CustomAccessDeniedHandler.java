package com.project.recall.backend.exception_handling;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.project.recall.backend.response.ApiResponse;
import com.project.recall.backend.response.ResponseMessage;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;

import java.io.IOException;

//authenticated, but the route is not open to the user
@Slf4j
public class CustomAccessDeniedHandler implements AccessDeniedHandler {
    private final ObjectMapper objectMapper;

    public CustomAccessDeniedHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response, AccessDeniedException accessDeniedException) throws IOException {
        String user = request.getUserPrincipal() == null ? "anonymous" : request.getUserPrincipal().getName();
        log.warn("{} for {} on {}: {}", ResponseMessage.ACCESS_DENIED, user, request.getRequestURI(), accessDeniedException.getMessage());

        response.setContentType("application/json;charset=UTF-8");
        response.setStatus(HttpServletResponse.SC_FORBIDDEN);
        objectMapper.writeValue(response.getWriter(), new ApiResponse(ResponseMessage.ACCESS_DENIED));
    }
}
