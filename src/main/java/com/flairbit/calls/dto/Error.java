package com.flairbit.calls.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Error {
    private int status;
    private String code;
    private String message;
    private Instant timestamp;
}
