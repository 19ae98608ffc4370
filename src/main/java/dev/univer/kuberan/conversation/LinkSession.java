package dev.univer.kuberan.conversation;

import lombok.Getter;

import java.time.Duration;

/** Waiting for the default currency before a link code is redeemed. */
@Getter
public class LinkSession extends Session {

    private final String linkCode;
    private final String username;
    private final String firstName;

    public LinkSession(SessionKey key, Duration timeout, String linkCode, String username, String firstName) {
        super(key, ConversationState.LINK_AWAITING_CURRENCY, timeout);
        this.linkCode = linkCode;
        this.username = username;
        this.firstName = firstName;
    }

    public long telegramUserId() {
        return getKey().userId();
    }
}
