package com.flairbit.calls.service;

import com.flairbit.calls.client.FlairBitClient;
import com.flairbit.calls.dto.ParticipantDto;
import com.flairbit.calls.exceptions.StorageUnavailableException;
import com.github.benmanes.caffeine.cache.Cache;
import feign.FeignException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.UUID;

/**
 * Participant directory lookups against the FlairBit platform.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ParticipantService {

    private final FlairBitClient flairBitClient;
    private final Cache<UUID, ParticipantDto> participantCache;

    /**
     * @return true when the directory knows the user and the account is active
     * @throws StorageUnavailableException when the directory cannot be reached
     */
    public boolean exists(UUID userId) {
        if (Objects.isNull(userId)) return false;
        ParticipantDto cached = participantCache.getIfPresent(userId);
        if (cached != null) return cached.isActive();

        try {
            ParticipantDto participant = flairBitClient.getParticipant(userId);
            if (participant == null) return false;
            participantCache.put(userId, participant);
            return participant.isActive();
        } catch (FeignException.NotFound e) {
            log.info("Participant {} unknown to directory", userId);
            return false;
        } catch (FeignException e) {
            log.warn("Participant directory lookup failed for {}: {}", userId, e.getMessage());
            throw new StorageUnavailableException("Participant directory unavailable", e);
        } catch (CallNotPermittedException e) {
            throw new StorageUnavailableException("Participant directory circuit open", e);
        }
    }
}
