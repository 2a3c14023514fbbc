package com.flairbit.calls.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flairbit.calls.dto.Error;
import jakarta.servlet.http.HttpServletResponse;
import lombok.experimental.UtilityClass;
import org.springframework.http.MediaType;

import java.io.IOException;
import java.time.Instant;

@UtilityClass
public final class ErrorUtility {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public static void printError(int status, String message, HttpServletResponse response) throws IOException {
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        Error error = Error.builder()
                .status(status)
                .code("unauthorized")
                .message(message)
                .timestamp(Instant.now())
                .build();
        MAPPER.writeValue(response.getOutputStream(), error);
    }
}
