package dev.univer.kuberan.service;

import dev.univer.kuberan.conversation.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class SessionSweeper {

    private final SessionStore store;

    // lookups expire sessions too; this only frees the ones nobody touches again
    @Scheduled(fixedDelayString = "${bot.sweep-interval:15000}")
    public void tick() {
        int evicted = store.evictExpired();
        if (evicted > 0) log.debug("Evicted {} idle sessions, {} left", evicted, store.size());
    }
}
