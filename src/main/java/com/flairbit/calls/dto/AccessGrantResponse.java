package com.flairbit.calls.dto;

import com.flairbit.calls.models.AccessGrant;
import com.flairbit.calls.models.AccessPermission;
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
public class AccessGrantResponse {
    private UUID id;
    private UUID recordingId;
    private UUID granteeId;
    private AccessPermission permission;
    private UUID grantedBy;
    private Instant grantedAt;
    private Instant expiresAt;

    public static AccessGrantResponse from(AccessGrant g) {
        return AccessGrantResponse.builder()
                .id(g.getId())
                .recordingId(g.getRecordingId())
                .granteeId(g.getGranteeId())
                .permission(g.getPermission())
                .grantedBy(g.getGrantedBy())
                .grantedAt(g.getGrantedAt())
                .expiresAt(g.getExpiresAt())
                .build();
    }
}
