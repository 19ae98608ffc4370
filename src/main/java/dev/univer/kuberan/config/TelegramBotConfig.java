package dev.univer.kuberan.config;

import dev.univer.kuberan.bot.CommandRouter;
import dev.univer.kuberan.service.BotProperties;
import dev.univer.kuberan.service.TelegramWrapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.BotSession;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

/** Long polling against the Bot API. Off with {@code bot.polling-enabled=false}. */
@Configuration
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "bot", name = "polling-enabled", havingValue = "true", matchIfMissing = true)
public class TelegramBotConfig {

    private final BotProperties props;

    @Bean
    public TelegramBotsApi telegramBotsApi() throws TelegramApiException {
        return new TelegramBotsApi(DefaultBotSession.class);
    }

    /** Updates reach {@code UpdateRouter} as application events once this session runs. */
    @Bean(destroyMethod = "stop")
    public BotSession botSession(TelegramBotsApi api, TelegramWrapper bot, CommandRouter commands) {
        if (props.getToken() == null || props.getToken().isBlank()) {
            throw new IllegalStateException("bot.token is not set (TELEGRAM_BOT_TOKEN)");
        }
        try {
            BotSession session = api.registerBot(bot);
            bot.installCommands(commands.menu());
            log.info("Polling as @{} with {} commands", props.getUsername(), commands.menu().size());
            return session;
        } catch (TelegramApiException e) {
            throw new IllegalStateException("Failed to register Telegram bot", e);
        }
    }
}
