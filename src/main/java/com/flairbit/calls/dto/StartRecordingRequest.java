package com.flairbit.calls.dto;

import com.flairbit.calls.models.MediaFormat;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StartRecordingRequest {
    @NotNull
    private UUID callId;
    private MediaFormat format;
}
