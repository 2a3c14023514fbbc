package com.flairbit.calls.controller;

import com.flairbit.calls.dto.EscalationEventResponse;
import com.flairbit.calls.dto.EscalationRuleRequest;
import com.flairbit.calls.dto.EscalationRuleResponse;
import com.flairbit.calls.dto.NotificationDispatchResponse;
import com.flairbit.calls.security.CurrentActor;
import com.flairbit.calls.service.escalation.EscalationService;
import jakarta.validation.Valid;
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
@RequestMapping("/api/escalations")
@RequiredArgsConstructor
@Validated
@Slf4j
public class EscalationController {

    private final EscalationService escalationService;

    @GetMapping(value = "/calls/{callId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<EscalationEventResponse>> forCall(@PathVariable UUID callId) {
        return ResponseEntity.ok(escalationService.listEscalations(callId, CurrentActor.get()).stream()
                .map(EscalationEventResponse::from).toList());
    }

    @PostMapping(value = "/{eventId}/acknowledge", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<EscalationEventResponse> acknowledge(@PathVariable UUID eventId) {
        return ResponseEntity.ok(EscalationEventResponse.from(escalationService.acknowledge(eventId, CurrentActor.get())));
    }

    @GetMapping(value = "/{eventId}/dispatches", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<NotificationDispatchResponse>> dispatches(@PathVariable UUID eventId) {
        return ResponseEntity.ok(escalationService.listDispatches(eventId, CurrentActor.get()).stream()
                .map(NotificationDispatchResponse::from).toList());
    }

    @GetMapping(value = "/rules", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<EscalationRuleResponse>> rules() {
        return ResponseEntity.ok(escalationService.listRules(CurrentActor.get()).stream()
                .map(EscalationRuleResponse::from).toList());
    }

    @PostMapping(value = "/rules", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<EscalationRuleResponse> createRule(@Valid @RequestBody EscalationRuleRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(EscalationRuleResponse.from(escalationService.createRule(req, CurrentActor.get())));
    }

    @PutMapping(value = "/rules/{ruleId}", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<EscalationRuleResponse> updateRule(@PathVariable UUID ruleId,
                                                             @Valid @RequestBody EscalationRuleRequest req) {
        return ResponseEntity.ok(EscalationRuleResponse.from(escalationService.updateRule(ruleId, req, CurrentActor.get())));
    }

    @DeleteMapping(value = "/rules/{ruleId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<EscalationRuleResponse> deactivateRule(@PathVariable UUID ruleId) {
        return ResponseEntity.ok(EscalationRuleResponse.from(escalationService.deactivateRule(ruleId, CurrentActor.get())));
    }
}
