package com.flairbit.calls.controller;

import com.flairbit.calls.dto.ConsentRequest;
import com.flairbit.calls.dto.RecordingConsentResponse;
import com.flairbit.calls.dto.RecordingResponse;
import com.flairbit.calls.dto.SegmentResponse;
import com.flairbit.calls.dto.StartRecordingRequest;
import com.flairbit.calls.models.AccessAction;
import com.flairbit.calls.models.Recording;
import com.flairbit.calls.models.RecordingConsent;
import com.flairbit.calls.security.Actor;
import com.flairbit.calls.security.CurrentActor;
import com.flairbit.calls.service.access.AccessControlService;
import com.flairbit.calls.service.recording.RecordingService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/recordings")
@RequiredArgsConstructor
@Validated
@Slf4j
public class RecordingController {

    private final RecordingService recordingService;
    private final AccessControlService accessControlService;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RecordingResponse> start(@Valid @RequestBody StartRecordingRequest req) {
        Recording recording = recordingService.start(req.getCallId(), CurrentActor.get().getId(), req.getFormat());
        return ResponseEntity.status(HttpStatus.CREATED).body(RecordingResponse.from(recording));
    }

    @PostMapping(value = "/calls/{callId}/consent", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RecordingConsentResponse> consent(@PathVariable UUID callId,
                                                            @Valid @RequestBody ConsentRequest req,
                                                            HttpServletRequest request) {
        RecordingConsent consent = recordingService.recordConsent(callId, CurrentActor.get(), req.getGiven(), request.getRemoteAddr());
        return ResponseEntity.status(HttpStatus.CREATED).body(RecordingConsentResponse.from(consent));
    }

    @GetMapping(value = "/calls/{callId}/consent", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<RecordingConsentResponse>> consentHistory(@PathVariable UUID callId) {
        return ResponseEntity.ok(recordingService.consentHistory(callId, CurrentActor.get()).stream()
                .map(RecordingConsentResponse::from).toList());
    }

    @PostMapping(value = "/{recordingId}/pause", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RecordingResponse> pause(@PathVariable UUID recordingId) {
        return ResponseEntity.ok(RecordingResponse.from(recordingService.pause(recordingId, CurrentActor.get())));
    }

    @PostMapping(value = "/{recordingId}/resume", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RecordingResponse> resume(@PathVariable UUID recordingId) {
        return ResponseEntity.ok(RecordingResponse.from(recordingService.resume(recordingId, CurrentActor.get())));
    }

    @PostMapping(value = "/{recordingId}/stop", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RecordingResponse> stop(@PathVariable UUID recordingId) {
        return ResponseEntity.ok(RecordingResponse.from(recordingService.stop(recordingId, CurrentActor.get())));
    }

    @GetMapping(value = "/{recordingId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RecordingResponse> status(@PathVariable UUID recordingId, HttpServletRequest request) {
        accessControlService.authorize(recordingId, CurrentActor.get(), AccessAction.VIEW, request.getRemoteAddr());
        return ResponseEntity.ok(RecordingResponse.from(recordingService.getRecordingStatus(recordingId)));
    }

    @GetMapping(value = "/by-call/{callId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RecordingResponse> byCall(@PathVariable UUID callId, HttpServletRequest request) {
        Recording recording = recordingService.findByCall(callId);
        accessControlService.authorize(recording.getId(), CurrentActor.get(), AccessAction.VIEW, request.getRemoteAddr());
        return ResponseEntity.ok(RecordingResponse.from(recording));
    }

    @GetMapping(value = "/{recordingId}/segments", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<SegmentResponse>> segments(@PathVariable UUID recordingId, HttpServletRequest request) {
        accessControlService.authorize(recordingId, CurrentActor.get(), AccessAction.VIEW, request.getRemoteAddr());
        return ResponseEntity.ok(recordingService.listSegments(recordingId).stream().map(SegmentResponse::from).toList());
    }

    @GetMapping(value = "/{recordingId}/segments/{sequenceNumber}/content", produces = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    public ResponseEntity<byte[]> segmentContent(@PathVariable UUID recordingId,
                                                 @PathVariable @Min(0) int sequenceNumber,
                                                 HttpServletRequest request) {
        Actor actor = CurrentActor.get();
        byte[] data = accessControlService.openSegment(recordingId, sequenceNumber, actor, request.getRemoteAddr());
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .body(data);
    }

    @GetMapping(value = "/accessible", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<RecordingResponse>> accessible() {
        List<Recording> recordings = accessControlService.listAccessibleRecordings(CurrentActor.get().getId());
        return ResponseEntity.ok(recordings.stream().map(RecordingResponse::from).toList());
    }
}
