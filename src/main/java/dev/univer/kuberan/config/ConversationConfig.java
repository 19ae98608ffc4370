package dev.univer.kuberan.config;

import dev.univer.kuberan.service.BotProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
@RequiredArgsConstructor
public class ConversationConfig {

    private final BotProperties props;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Shared by all chats; ordering per chat user is kept by the dispatcher. */
    @Bean
    public ThreadPoolTaskExecutor conversationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getDispatcherThreads());
        executor.setMaxPoolSize(props.getDispatcherThreads());
        executor.setThreadNamePrefix("conversation-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
