package com.flairbit.calls.controller;

import com.flairbit.calls.dto.AccessGrantResponse;
import com.flairbit.calls.dto.AccessLogResponse;
import com.flairbit.calls.dto.GrantRequest;
import com.flairbit.calls.dto.LegalHoldRequest;
import com.flairbit.calls.dto.RecordingResponse;
import com.flairbit.calls.models.AccessGrant;
import com.flairbit.calls.models.Recording;
import com.flairbit.calls.security.CurrentActor;
import com.flairbit.calls.service.access.AccessControlService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Grant management, legal holds and audit trail. Admin only.
 */
@RestController
@RequestMapping("/api/access")
@RequiredArgsConstructor
@Validated
public class AccessController {

    private final AccessControlService accessControlService;

    @PostMapping(value = "/grants", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AccessGrantResponse> grant(@Valid @RequestBody GrantRequest req) {
        AccessGrant grant = accessControlService.grant(
                req.getRecordingId(), req.getGranteeId(), req.getPermission(), req.getExpiresAt(), CurrentActor.get());
        return ResponseEntity.status(HttpStatus.CREATED).body(AccessGrantResponse.from(grant));
    }

    @DeleteMapping(value = "/grants/{grantId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AccessGrantResponse> revoke(@PathVariable UUID grantId) {
        return ResponseEntity.ok(AccessGrantResponse.from(accessControlService.revoke(grantId, CurrentActor.get())));
    }

    @PutMapping(value = "/legal-holds/{recordingId}", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RecordingResponse> placeHold(@PathVariable UUID recordingId,
                                                       @Valid @RequestBody LegalHoldRequest req,
                                                       HttpServletRequest request) {
        Recording recording = accessControlService.setLegalHold(
                recordingId, CurrentActor.get(), true, req.getReason(), request.getRemoteAddr());
        return ResponseEntity.ok(RecordingResponse.from(recording));
    }

    @DeleteMapping(value = "/legal-holds/{recordingId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RecordingResponse> releaseHold(@PathVariable UUID recordingId, HttpServletRequest request) {
        Recording recording = accessControlService.setLegalHold(
                recordingId, CurrentActor.get(), false, null, request.getRemoteAddr());
        return ResponseEntity.ok(RecordingResponse.from(recording));
    }

    @GetMapping(value = "/recordings/{recordingId}/grants", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<AccessGrantResponse>> grants(@PathVariable UUID recordingId) {
        return ResponseEntity.ok(accessControlService.listGrants(recordingId, CurrentActor.get()).stream()
                .map(AccessGrantResponse::from).toList());
    }

    @GetMapping(value = "/recordings/{recordingId}/log", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<AccessLogResponse>> log(@PathVariable UUID recordingId,
                                                       @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
        return ResponseEntity.ok(accessControlService.accessLog(recordingId, CurrentActor.get(), limit).stream()
                .map(AccessLogResponse::from).toList());
    }
}
