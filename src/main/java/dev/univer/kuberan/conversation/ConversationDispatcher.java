package dev.univer.kuberan.conversation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Runs events of one chat user strictly in arrival order while different users proceed
 * in parallel on the shared pool. Each key keeps only the tail of its chain.
 */
@Component
@Slf4j
public class ConversationDispatcher {

    private final Executor executor;
    private final Map<ChatUser, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public ConversationDispatcher(@Qualifier("conversationExecutor") Executor executor) {
        this.executor = executor;
    }

    public CompletableFuture<Void> submit(ChatUser key, Runnable task) {
        CompletableFuture<Void> next = tails.compute(key, (k, tail) -> {
            CompletableFuture<Void> previous = tail == null ? CompletableFuture.completedFuture(null) : tail;
            return previous.exceptionally(ex -> null).thenRunAsync(() -> runLogged(k, task), executor);
        });
        // the returned stage completes only after the tail entry is released
        return next.whenComplete((r, ex) -> tails.remove(key, next));
    }

    int pendingKeys() {
        return tails.size();
    }

    private static void runLogged(ChatUser key, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Error processing event for chat {} user {}", key.chatId(), key.userId(), e);
        }
    }
}
