package dev.univer.kuberan.conversation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory sessions, at most one per chat, user and flow family. Expired sessions are
 * dropped when looked up and by the periodic sweep; either way exactly one
 * {@link SessionExpiredEvent} is published per expired session.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionStore {

    private final Clock clock;
    private final ApplicationEventPublisher publisher;

    private final Map<SessionKey, Session> sessions = new ConcurrentHashMap<>();

    /** Stores the session, replacing any session of the same family. */
    public void put(Session session) {
        session.touch(clock.instant());
        Session previous = sessions.put(session.getKey(), session);
        if (previous != null && previous != session) {
            log.debug("Replaced {} session of user {} (was {})",
                    session.getKey().family(), session.getKey().userId(), previous.getState());
        }
    }

    public Optional<Session> find(SessionKey key) {
        Session s = sessions.get(key);
        if (s == null || expire(s)) return Optional.empty();
        return Optional.of(s);
    }

    /** Live sessions of the pair, one per family at most. */
    public List<Session> findAll(ChatUser who) {
        List<Session> result = new ArrayList<>();
        for (FlowFamily family : FlowFamily.values()) {
            find(SessionKey.of(who, family)).ifPresent(result::add);
        }
        return result;
    }

    public void touch(Session session) {
        session.touch(clock.instant());
    }

    /** Removes exactly this session; false when it was already gone or replaced. */
    public boolean remove(Session session) {
        return sessions.remove(session.getKey(), session);
    }

    public int evictExpired() {
        int evicted = 0;
        for (Session s : List.copyOf(sessions.values())) {
            if (expire(s)) evicted++;
        }
        return evicted;
    }

    public int size() {
        return sessions.size();
    }

    private boolean expire(Session s) {
        if (!s.isExpired(clock.instant())) return false;
        if (sessions.remove(s.getKey(), s)) {
            log.info("Session {} of user {} expired in {}", s.getKey().family(), s.getKey().userId(), s.getState());
            publisher.publishEvent(new SessionExpiredEvent(s));
        }
        return true;
    }
}
