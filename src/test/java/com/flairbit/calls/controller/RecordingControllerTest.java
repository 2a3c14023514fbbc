package com.flairbit.calls.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flairbit.calls.exceptions.ConsentRequiredException;
import com.flairbit.calls.exceptions.GlobalExceptionHandler;
import com.flairbit.calls.models.MediaFormat;
import com.flairbit.calls.models.Recording;
import com.flairbit.calls.models.RecordingConsent;
import com.flairbit.calls.models.RecordingStatus;
import com.flairbit.calls.security.Actor;
import com.flairbit.calls.service.access.AccessControlService;
import com.flairbit.calls.service.recording.RecordingService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class RecordingControllerTest {

    private final UUID alice = UUID.randomUUID();
    private final UUID callId = UUID.randomUUID();
    private final Instant now = Instant.parse("2024-05-01T10:00:00Z");

    private RecordingService recordingService;
    private AccessControlService accessControl;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        recordingService = mock(RecordingService.class);
        accessControl = mock(AccessControlService.class);
        ObjectMapper json = new ObjectMapper().findAndRegisterModules();
        mvc = MockMvcBuilders.standaloneSetup(
                        new RecordingController(recordingService, accessControl),
                        new AccessController(accessControl))
                .setControllerAdvice(new GlobalExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(json))
                .build();
        authenticate("USER");
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    private void authenticate(String... authorities) {
        SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(alice.toString(), null,
                Arrays.stream(authorities).map(SimpleGrantedAuthority::new).toList()));
    }

    private Recording recording(boolean held) {
        return Recording.builder()
                .id(UUID.randomUUID())
                .callId(callId)
                .status(RecordingStatus.READY)
                .format(MediaFormat.AUDIO)
                .createdAt(now)
                .legalHold(held)
                .legalHoldReason(held ? "case 2024-117" : null)
                .build();
    }

    @Test
    void consentIsRecordedForTheCaller() throws Exception {
        when(recordingService.recordConsent(eq(callId), eq(Actor.user(alice)), eq(true), anyString()))
                .thenReturn(RecordingConsent.builder()
                        .entryId(1L)
                        .callId(callId)
                        .userId(alice)
                        .given(true)
                        .recordedAt(now)
                        .build());

        mvc.perform(post("/api/recordings/calls/" + callId + "/consent")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"given\":true}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.userId").value(alice.toString()))
                .andExpect(jsonPath("$.given").value(true));
    }

    @Test
    void consentAnswerIsRequired() throws Exception {
        mvc.perform(post("/api/recordings/calls/" + callId + "/consent")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("validation_failed"));
        verifyNoInteractions(recordingService);
    }

    @Test
    void startWithoutConsentIs412() throws Exception {
        when(recordingService.start(callId, alice, null))
                .thenThrow(new ConsentRequiredException("Recording call " + callId + " needs consent"));

        mvc.perform(post("/api/recordings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"callId\":\"" + callId + "\"}"))
                .andExpect(status().isPreconditionFailed())
                .andExpect(jsonPath("$.code").value("consent_required"));
    }

    @Test
    void legalHoldIsPlacedAndReleased() throws Exception {
        authenticate("USER", "ADMIN");
        Recording held = recording(true);
        Recording released = recording(false);
        when(accessControl.setLegalHold(eq(held.getId()), any(Actor.class), eq(true), eq("case 2024-117"), anyString()))
                .thenReturn(held);
        when(accessControl.setLegalHold(eq(released.getId()), any(Actor.class), eq(false), isNull(), anyString()))
                .thenReturn(released);

        mvc.perform(put("/api/access/legal-holds/" + held.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"case 2024-117\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.legalHold").value(true))
                .andExpect(jsonPath("$.legalHoldReason").value("case 2024-117"));

        mvc.perform(delete("/api/access/legal-holds/" + released.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.legalHold").value(false));
    }

    @Test
    void legalHoldNeedsReason() throws Exception {
        authenticate("USER", "ADMIN");

        mvc.perform(put("/api/access/legal-holds/" + UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"\"}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(accessControl);
    }

    @Test
    void consentHistoryIsListed() throws Exception {
        when(recordingService.consentHistory(callId, Actor.user(alice))).thenReturn(List.of());

        mvc.perform(get("/api/recordings/calls/" + callId + "/consent"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }
}
