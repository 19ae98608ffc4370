package dev.univer.kuberan.service;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "backend")
@Getter @Setter
public class BackendProperties {
    private String baseUrl = "http://api:8080";
    private String internalSecret;
    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(10);
    private Duration activityTimeout = Duration.ofSeconds(5);
}
