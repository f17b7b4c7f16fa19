package com.example.mltranslation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "jwt")
public class JwtProperties {

    /**
     * Base64 encoded HMAC key, at least 256 bits.
     */
    private String secret;

    private Duration accessTokenValidity = Duration.ofMinutes(60);
}
