package com.flairbit.calls.client;

import com.flairbit.calls.dto.ParticipantDto;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

import java.util.UUID;


@FeignClient(name = "flairbit", url = "${flairbit.base-url:http://flairbit:8081}")
@CircuitBreaker(name = "flairbit")
public interface FlairBitClient {

    @GetMapping("/internal/call-service/participants/{userId}")
    ParticipantDto getParticipant(@PathVariable UUID userId);
}
