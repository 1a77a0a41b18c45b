package io.notify4j.telegram;

import io.notify4j.NotificationDispatcher;
import io.notify4j.core.DispatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.bots.DefaultAbsSender;
import org.telegram.telegrambots.bots.DefaultBotOptions;
import org.telegram.telegrambots.meta.api.methods.ParseMode;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;

import java.util.Locale;
import java.util.Objects;

/**
 * Sends notification text to a Telegram chat through the Bot API.
 *
 * <p>Text is sent as HTML. When Telegram rejects the markup (400, can't parse entities) the same text
 * is retried once without a parse mode. Every other failure is raised after a single attempt.
 */
public class TelegramNotificationDispatcher extends DefaultAbsSender implements NotificationDispatcher {
    private static final Logger log = LoggerFactory.getLogger(TelegramNotificationDispatcher.class);

    private static final String PARSE_ERROR = "can't parse entities";

    public TelegramNotificationDispatcher(String botToken) {
        this(new DefaultBotOptions(), botToken);
    }

    public TelegramNotificationDispatcher(DefaultBotOptions options, String botToken) {
        super(options, requireToken(botToken));
    }

    @Override
    public void send(String chatId, String text) throws DispatchException {
        Objects.requireNonNull(chatId, "chatId must not be null");

        SendMessage message = toSendMessage(chatId, text);
        try {
            execute(message);
        } catch (TelegramApiException e) {
            if (!isRejectedMarkup(e)) {
                throw new DispatchException(chatId, "Telegram send failed: " + e.getMessage(), e);
            }
            log.warn("HTML send failed chatId={} msg={}; retrying as plain text", chatId, e.getMessage());
            message.setParseMode(null);
            try {
                execute(message);
            } catch (TelegramApiException ex) {
                throw new DispatchException(chatId, "Telegram send failed: " + ex.getMessage(), ex);
            }
        }
    }

    /**
     * Only a 400 "can't parse entities" answer means Telegram refused the message itself.
     * Anything else (timeouts included) may already have been delivered and is not resent.
     */
    static boolean isRejectedMarkup(TelegramApiException e) {
        if (!(e instanceof TelegramApiRequestException)) {
            return false;
        }
        TelegramApiRequestException request = (TelegramApiRequestException) e;
        Integer code = request.getErrorCode();
        String text = request.getMessage();
        return code != null && code == 400
                && text != null && text.toLowerCase(Locale.ROOT).contains(PARSE_ERROR);
    }

    static SendMessage toSendMessage(String chatId, String text) {
        SendMessage message = new SendMessage();
        message.setChatId(chatId);
        message.setText(text);
        message.setParseMode(ParseMode.HTML);
        message.setDisableWebPagePreview(true);
        return message;
    }

    private static String requireToken(String botToken) {
        if (botToken == null || botToken.isBlank()) {
            throw new IllegalArgumentException("notifier.telegram.bot-token must not be blank");
        }
        return botToken.trim();
    }
}
