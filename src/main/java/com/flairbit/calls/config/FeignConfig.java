package com.flairbit.calls.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flairbit.calls.client.ServiceAuthClient;
import feign.RequestInterceptor;
import feign.codec.Decoder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StreamUtils;

import java.nio.charset.StandardCharsets;

@Configuration
public class FeignConfig {

    public static final String FLAIRBIT_CLIENT = "flairbit";

    @Bean
    public RequestInterceptor serviceAuthInterceptor(ServiceAuthClient authClient,
                                                     @Value("${flairbit.auth.audience:FlairBit}") String audience) {
        return template -> {
            // webhook and gateway clients authenticate with their own credentials
            if (template.feignTarget() == null || !FLAIRBIT_CLIENT.equals(template.feignTarget().name())) {
                return;
            }
            String token = authClient.createToken(audience);
            template.header(HttpHeaders.AUTHORIZATION, "Bearer " + token);
        };
    }

    @Bean
    public Decoder feignDecoder(ObjectMapper mapper) {
        return (response, type) -> {
            if (response.body() == null) {
                return null;
            }
            String body = StreamUtils.copyToString(response.body().asInputStream(), StandardCharsets.UTF_8);
            if (body.isBlank()) {
                return null;
            }
            return mapper.readValue(body, mapper.constructType(type));
        };
    }
}
