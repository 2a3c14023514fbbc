package com.flairbit.calls.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flairbit.calls.exceptions.GlobalExceptionHandler;
import com.flairbit.calls.exceptions.InvalidParticipantsException;
import com.flairbit.calls.exceptions.SessionClosedException;
import com.flairbit.calls.exceptions.UnauthorizedException;
import com.flairbit.calls.models.CallSession;
import com.flairbit.calls.models.CallStatus;
import com.flairbit.calls.models.CallType;
import com.flairbit.calls.models.MediaFormat;
import com.flairbit.calls.models.SignalKind;
import com.flairbit.calls.models.SignalingMessage;
import com.flairbit.calls.security.Actor;
import com.flairbit.calls.service.calls.CallSessionService;
import com.flairbit.calls.service.calls.SignalingRelay;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class CallControllerTest {

    private final UUID alice = UUID.randomUUID();
    private final UUID bob = UUID.randomUUID();
    private final Instant now = Instant.parse("2024-05-01T10:00:00Z");

    private CallSessionService callService;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        callService = mock(CallSessionService.class);
        SignalingRelay relay = mock(SignalingRelay.class);
        ObjectMapper json = new ObjectMapper().findAndRegisterModules();
        mvc = MockMvcBuilders.standaloneSetup(new CallController(callService, relay))
                .setControllerAdvice(new GlobalExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(json))
                .build();
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken(alice.toString(), null, List.of(new SimpleGrantedAuthority("USER"))));
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    private CallSession session(CallStatus status) {
        return CallSession.builder()
                .id(UUID.randomUUID())
                .initiatorId(alice)
                .counterpartId(bob)
                .status(status)
                .callType(CallType.CONSULTATION)
                .mode(MediaFormat.VIDEO)
                .createdAt(now)
                .build();
    }

    @Test
    void createUsesAuthenticatedCallerAsInitiator() throws Exception {
        CallSession created = session(CallStatus.INITIATED);
        when(callService.create(eq(alice), eq(bob), eq(CallType.CONSULTATION), eq(MediaFormat.VIDEO), isNull()))
                .thenReturn(created);

        mvc.perform(post("/api/calls")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"counterpartId\":\"" + bob + "\",\"callType\":\"consultation\",\"mode\":\"video\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(created.getId().toString()))
                .andExpect(jsonPath("$.status").value("initiated"));
    }

    @Test
    void missingCounterpartIsValidationError() throws Exception {
        mvc.perform(post("/api/calls")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"callType\":\"consultation\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("validation_failed"));
    }

    @Test
    void invalidParticipantsMapTo422() throws Exception {
        when(callService.create(any(), any(), any(), any(), any()))
                .thenThrow(new InvalidParticipantsException("Cannot call yourself"));

        mvc.perform(post("/api/calls")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"counterpartId\":\"" + alice + "\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("invalid_participants"));
    }

    @Test
    void outsiderGets403() throws Exception {
        UUID callId = UUID.randomUUID();
        when(callService.getCallStatus(eq(callId), any(Actor.class))).thenThrow(new UnauthorizedException("not part of call"));

        mvc.perform(get("/api/calls/" + callId))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("unauthorized"));
    }

    @Test
    void pollCompletesAsynchronously() throws Exception {
        UUID callId = UUID.randomUUID();
        SignalingMessage offer = SignalingMessage.builder()
                .id(UUID.randomUUID())
                .callId(callId)
                .senderId(bob)
                .recipientId(alice)
                .kind(SignalKind.OFFER)
                .payload("{\"sdp\":\"x\"}")
                .createdAt(now)
                .build();
        when(callService.pollSignals(callId, alice, Duration.ofMillis(1500)))
                .thenReturn(CompletableFuture.completedFuture(List.of(offer)));

        MvcResult started = mvc.perform(get("/api/calls/" + callId + "/signals/poll").param("waitMs", "1500"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mvc.perform(asyncDispatch(started))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].kind").value("offer"))
                .andExpect(jsonPath("$[0].senderId").value(bob.toString()));
    }

    @Test
    void pollRejectedByBusyDrainPoolIs503() throws Exception {
        UUID callId = UUID.randomUUID();
        when(callService.pollSignals(eq(callId), eq(alice), any(Duration.class)))
                .thenReturn(CompletableFuture.failedFuture(new CompletionException(new RejectedExecutionException("drain pool full"))));

        MvcResult started = mvc.perform(get("/api/calls/" + callId + "/signals/poll"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mvc.perform(asyncDispatch(started))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("busy"));
    }

    @Test
    void pollOnClosedSessionIs409() throws Exception {
        UUID callId = UUID.randomUUID();
        when(callService.pollSignals(eq(callId), eq(alice), any(Duration.class)))
                .thenReturn(CompletableFuture.failedFuture(new SessionClosedException("Call " + callId + " is ended")));

        MvcResult started = mvc.perform(get("/api/calls/" + callId + "/signals/poll"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mvc.perform(asyncDispatch(started))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("session_closed"));
    }

    @Test
    void endPassesOptionalReason() throws Exception {
        CallSession ended = session(CallStatus.ENDED);
        when(callService.end(any(UUID.class), any(Actor.class), eq("network drop"))).thenReturn(ended);

        mvc.perform(post("/api/calls/" + ended.getId() + "/end")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"network drop\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ended"));

        verify(callService).end(eq(ended.getId()), eq(new Actor(alice, false)), eq("network drop"));
    }
}
