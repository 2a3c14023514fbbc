package com.flairbit.calls.dto;

import com.flairbit.calls.models.AccessPermission;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GrantRequest {
    @NotNull
    private UUID recordingId;
    @NotNull
    private UUID granteeId;
    private AccessPermission permission;
    private Instant expiresAt;
}
