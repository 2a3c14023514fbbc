package com.flairbit.calls.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Optional free-text reason for end, flag and drop. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReasonRequest {
    @Size(max = 255)
    private String reason;
}
