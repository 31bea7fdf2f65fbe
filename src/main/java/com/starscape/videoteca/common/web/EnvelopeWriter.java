package com.starscape.videoteca.common.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.videoteca.common.api.ApiResponse;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Writes an error envelope straight to the servlet response, for stages that run before MVC.
 */
@Component
public class EnvelopeWriter {
    
    private final ObjectMapper objectMapper;
    
    public EnvelopeWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }
    
    public void write(HttpServletResponse response, HttpStatus status, String message) throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        response.getWriter().write(objectMapper.writeValueAsString(ApiResponse.error(status, message)));
    }
}
