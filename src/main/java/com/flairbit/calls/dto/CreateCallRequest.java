package com.flairbit.calls.dto;

import com.flairbit.calls.models.CallType;
import com.flairbit.calls.models.MediaFormat;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Body of {@code POST /api/calls} and of messages on {@code calls.request.queue}. Over REST the
 * initiator is the authenticated caller and {@code initiatorId} is ignored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateCallRequest {
    private UUID initiatorId;
    @NotNull
    private UUID counterpartId;
    private CallType callType;
    private MediaFormat mode;
    @Size(max = 255)
    private String context;
}
