package dev.univer.kuberan.service;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "bot")
@Getter @Setter
public class BotProperties {
    private String username;
    private String token;
    /** Used when the backend has no default currency for the user. */
    private String defaultCurrency = "MYR";
    private Duration linkTimeout = Duration.ofSeconds(120);
    private Duration transactionTimeout = Duration.ofSeconds(300);
    private int dispatcherThreads = 4;
    /** Milliseconds between idle-session sweeps. */
    private long sweepInterval = 15_000;
    /** Off in environments that must not talk to Telegram. */
    private boolean pollingEnabled = true;
}
