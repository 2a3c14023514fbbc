package com.flairbit.calls.controller;

import com.flairbit.calls.dto.CallSessionResponse;
import com.flairbit.calls.dto.CreateCallRequest;
import com.flairbit.calls.dto.ReasonRequest;
import com.flairbit.calls.dto.RelaySignalRequest;
import com.flairbit.calls.dto.SignalResponse;
import com.flairbit.calls.models.CallSession;
import com.flairbit.calls.models.SignalingMessage;
import com.flairbit.calls.security.Actor;
import com.flairbit.calls.security.CurrentActor;
import com.flairbit.calls.service.calls.CallSessionService;
import com.flairbit.calls.service.calls.SignalingRelay;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/calls")
@RequiredArgsConstructor
@Validated
@Slf4j
public class CallController {

    private final CallSessionService callSessionService;
    private final SignalingRelay signalingRelay;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CallSessionResponse> create(@Valid @RequestBody CreateCallRequest req) {
        Actor actor = CurrentActor.get();
        CallSession session = callSessionService.create(
                actor.getId(), req.getCounterpartId(), req.getCallType(), req.getMode(), req.getContext());
        return ResponseEntity.status(HttpStatus.CREATED).body(CallSessionResponse.from(session));
    }

    @GetMapping(value = "/{callId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CallSessionResponse> status(@PathVariable UUID callId) {
        return ResponseEntity.ok(CallSessionResponse.from(callSessionService.getCallStatus(callId, CurrentActor.get())));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<CallSessionResponse>> list(@RequestParam(defaultValue = "50") @Min(1) @Max(200) int limit) {
        List<CallSession> calls = callSessionService.listCalls(CurrentActor.get().getId(), limit);
        return ResponseEntity.ok(calls.stream().map(CallSessionResponse::from).toList());
    }

    @PostMapping(value = "/{callId}/signals", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SignalResponse> signal(@PathVariable UUID callId, @Valid @RequestBody RelaySignalRequest req) {
        SignalingMessage msg = callSessionService.relaySignal(callId, CurrentActor.get().getId(), req.getKind(), req.getPayload());
        return ResponseEntity.status(HttpStatus.CREATED).body(SignalResponse.from(msg));
    }

    /**
     * Long poll. Completes as soon as a message for the caller is pending, or with an empty list after
     * {@code waitMs}.
     */
    @GetMapping(value = "/{callId}/signals/poll", produces = MediaType.APPLICATION_JSON_VALUE)
    public CompletableFuture<List<SignalResponse>> poll(@PathVariable UUID callId,
                                                        @RequestParam(defaultValue = "20000") @Min(0) long waitMs) {
        UUID recipient = CurrentActor.get().getId();
        return callSessionService.pollSignals(callId, recipient, Duration.ofMillis(waitMs))
                .thenApply(msgs -> msgs.stream().map(SignalResponse::from).toList());
    }

    @GetMapping(value = "/{callId}/signals", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<SignalResponse>> signalHistory(@PathVariable UUID callId) {
        callSessionService.getCallStatus(callId, CurrentActor.get());
        return ResponseEntity.ok(signalingRelay.history(callId).stream().map(SignalResponse::from).toList());
    }

    @PostMapping("/{callId}/heartbeat")
    public ResponseEntity<Void> heartbeat(@PathVariable UUID callId) {
        callSessionService.heartbeat(callId, CurrentActor.get().getId());
        return ResponseEntity.noContent().build();
    }

    @PostMapping(value = "/{callId}/end", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CallSessionResponse> end(@PathVariable UUID callId,
                                                   @Valid @RequestBody(required = false) ReasonRequest req) {
        CallSession session = callSessionService.end(callId, CurrentActor.get(), reason(req));
        return ResponseEntity.ok(CallSessionResponse.from(session));
    }

    @PostMapping(value = "/{callId}/flag", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CallSessionResponse> flag(@PathVariable UUID callId,
                                                    @Valid @RequestBody(required = false) ReasonRequest req) {
        CallSession session = callSessionService.flag(callId, CurrentActor.get(), reason(req));
        return ResponseEntity.ok(CallSessionResponse.from(session));
    }

    @PostMapping(value = "/{callId}/drop", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CallSessionResponse> drop(@PathVariable UUID callId,
                                                    @Valid @RequestBody(required = false) ReasonRequest req) {
        CallSession session = callSessionService.monitorDrop(callId, CurrentActor.get(), reason(req));
        return ResponseEntity.ok(CallSessionResponse.from(session));
    }

    private static String reason(ReasonRequest req) {
        return Objects.isNull(req) ? null : req.getReason();
    }
}
