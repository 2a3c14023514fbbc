package com.flairbit.calls.models;

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
public class AccessGrant {
    private UUID id;
    private UUID recordingId;
    private UUID granteeId;
    private AccessPermission permission;
    private UUID grantedBy;
    private Instant grantedAt;
    private Instant expiresAt;

    public boolean isActiveAt(Instant now) {
        return expiresAt == null || expiresAt.isAfter(now);
    }
}
