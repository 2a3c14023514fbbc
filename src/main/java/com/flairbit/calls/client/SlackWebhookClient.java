package com.flairbit.calls.client;

import com.flairbit.calls.dto.SlackMessage;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

@FeignClient(name = "slack", url = "${calls.notifications.slack.webhook-url:http://localhost:9}")
@CircuitBreaker(name = "slack")
public interface SlackWebhookClient {

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    void post(@RequestBody SlackMessage message);
}
