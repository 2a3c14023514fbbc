package com.flairbit.calls.client;

import com.flairbit.calls.dto.SmsRequest;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;

@FeignClient(name = "sms", url = "${calls.notifications.sms.base-url:http://localhost:9}")
@CircuitBreaker(name = "sms")
public interface SmsGatewayClient {

    @PostMapping(value = "/v1/messages/role", consumes = MediaType.APPLICATION_JSON_VALUE)
    void sendToRole(@RequestHeader("X-Api-Key") String apiKey, @RequestBody SmsRequest request);
}
