package com.flairbit.calls.controller;

import com.flairbit.calls.dto.SettingUpdateRequest;
import com.flairbit.calls.exceptions.UnauthorizedException;
import com.flairbit.calls.security.Actor;
import com.flairbit.calls.security.CurrentActor;
import com.flairbit.calls.service.CallSettingsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/settings")
@RequiredArgsConstructor
@Validated
public class SettingsController {

    private final CallSettingsService settingsService;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, String>> effective() {
        requireAdmin(CurrentActor.get());
        return ResponseEntity.ok(settingsService.effective());
    }

    @PutMapping(value = "/{key}", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, String>> update(@PathVariable String key, @Valid @RequestBody SettingUpdateRequest req) {
        Actor actor = CurrentActor.get();
        requireAdmin(actor);
        settingsService.update(key, req.getValue(), actor.getId());
        return ResponseEntity.ok(settingsService.effective());
    }

    private static void requireAdmin(Actor actor) {
        if (!actor.isAdmin()) {
            throw new UnauthorizedException("Settings are admin only");
        }
    }
}
