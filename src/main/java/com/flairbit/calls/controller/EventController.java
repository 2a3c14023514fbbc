package com.flairbit.calls.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.flairbit.calls.dto.CallEventMessage;
import com.flairbit.calls.exceptions.UnauthorizedException;
import com.flairbit.calls.models.CallEventOutbox;
import com.flairbit.calls.repo.CallEventOutboxJDBCRepository;
import com.flairbit.calls.scheduler.OutboxPublisher;
import com.flairbit.calls.security.Actor;
import com.flairbit.calls.security.CurrentActor;
import com.flairbit.calls.service.calls.CallSessionService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Replay of lifecycle events by cursor, for consumers that missed broker deliveries.
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
@Validated
public class EventController {

    private final CallEventOutboxJDBCRepository outboxRepo;
    private final OutboxPublisher outboxPublisher;
    private final CallSessionService callSessionService;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<CallEventMessage>> after(@RequestParam(defaultValue = "0") @Min(0) long after,
                                                        @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
        Actor actor = CurrentActor.get();
        if (!actor.isAdmin()) {
            throw new UnauthorizedException("Event replay is admin only");
        }
        return ResponseEntity.ok(toMessages(outboxRepo.findAfter(after, limit)));
    }

    @GetMapping(value = "/calls/{callId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<CallEventMessage>> forCall(@PathVariable UUID callId) {
        callSessionService.getCallStatus(callId, CurrentActor.get());
        return ResponseEntity.ok(toMessages(outboxRepo.findByCall(callId)));
    }

    private List<CallEventMessage> toMessages(List<CallEventOutbox> rows) {
        List<CallEventMessage> out = new ArrayList<>(rows.size());
        for (CallEventOutbox row : rows) {
            try {
                out.add(outboxPublisher.toMessage(row));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Corrupt event payload at cursor " + row.getCursor(), e);
            }
        }
        return out;
    }
}
