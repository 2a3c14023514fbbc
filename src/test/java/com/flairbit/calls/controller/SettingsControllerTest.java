package com.flairbit.calls.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flairbit.calls.exceptions.BadRequestException;
import com.flairbit.calls.exceptions.GlobalExceptionHandler;
import com.flairbit.calls.security.CurrentActor;
import com.flairbit.calls.service.CallSettingsService;
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

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class SettingsControllerTest {

    private final UUID userId = UUID.randomUUID();
    private CallSettingsService settings;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        settings = mock(CallSettingsService.class);
        when(settings.effective()).thenReturn(Map.of(CallSettingsService.RETENTION_DAYS, "90"));
        mvc = MockMvcBuilders.standaloneSetup(new SettingsController(settings))
                .setControllerAdvice(new GlobalExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(new ObjectMapper().findAndRegisterModules()))
                .build();
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    private void authenticate(String... authorities) {
        List<SimpleGrantedAuthority> granted = Arrays.stream(authorities).map(SimpleGrantedAuthority::new).toList();
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken(userId.toString(), null, granted));
    }

    @Test
    void regularUsersCannotReadOrChangeSettings() throws Exception {
        authenticate("USER");

        mvc.perform(get("/api/settings")).andExpect(status().isForbidden());
        mvc.perform(put("/api/settings/" + CallSettingsService.RETENTION_DAYS)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\":\"7\"}"))
                .andExpect(status().isForbidden());

        verify(settings, never()).update(anyString(), anyString(), any());
    }

    @Test
    void adminUpdatesSetting() throws Exception {
        authenticate("USER", CurrentActor.ADMIN_AUTHORITY);

        mvc.perform(put("/api/settings/" + CallSettingsService.RETENTION_DAYS)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\":\"7\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['recording.retention-days']").value("90"));

        verify(settings).update(CallSettingsService.RETENTION_DAYS, "7", userId);
    }

    @Test
    void invalidValueIsBadRequest() throws Exception {
        authenticate("USER", CurrentActor.ADMIN_AUTHORITY);
        doThrow(new BadRequestException("Setting upload.max-attempts must be positive"))
                .when(settings).update(eq(CallSettingsService.UPLOAD_MAX_ATTEMPTS), eq("0"), any());

        mvc.perform(put("/api/settings/" + CallSettingsService.UPLOAD_MAX_ATTEMPTS)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\":\"0\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("bad_request"));
    }
}
