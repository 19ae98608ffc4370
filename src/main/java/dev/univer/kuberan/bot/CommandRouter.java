package dev.univer.kuberan.bot;

import dev.univer.kuberan.bot.command.BotCommandHandler;
import dev.univer.kuberan.conversation.InboundEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Command name to handler, fixed at startup. Menu order follows the handlers' {@code @Order}. */
@Component
@Slf4j
public class CommandRouter {

    private final Map<String, BotCommandHandler> handlers = new LinkedHashMap<>();

    public CommandRouter(List<BotCommandHandler> handlers) {
        for (BotCommandHandler h : handlers) {
            BotCommandHandler previous = this.handlers.put(h.command().toLowerCase(Locale.ROOT), h);
            if (previous != null) {
                throw new IllegalStateException("Command /" + h.command() + " registered twice: "
                        + previous.getClass().getSimpleName() + " and " + h.getClass().getSimpleName());
            }
        }
        log.info("Registered commands: {}", this.handlers.keySet());
    }

    /** @return false when no handler knows the command */
    public boolean dispatch(InboundEvent event) {
        BotCommandHandler h = handlers.get(event.command());
        if (h == null) {
            log.debug("Unknown command /{} from user {}", event.command(), event.userId());
            return false;
        }
        h.handle(event);
        return true;
    }

    public List<BotCommandHandler> menu() {
        return List.copyOf(handlers.values());
    }
}
