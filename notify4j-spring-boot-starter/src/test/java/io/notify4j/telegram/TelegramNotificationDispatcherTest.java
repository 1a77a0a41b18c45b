package io.notify4j.telegram;

import io.notify4j.core.DispatchException;
import org.junit.jupiter.api.Test;
import org.telegram.telegrambots.meta.api.methods.ParseMode;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TelegramNotificationDispatcherTest {

    @Test
    void messageShouldBeSentAsHtml() {
        SendMessage message = TelegramNotificationDispatcher.toSendMessage("42", "<b>hi</b>");

        assertThat(message.getChatId()).isEqualTo("42");
        assertThat(message.getText()).isEqualTo("<b>hi</b>");
        assertThat(message.getParseMode()).isEqualTo(ParseMode.HTML);
    }

    @Test
    void blankTokenShouldBeRejected() {
        assertThatThrownBy(() -> new TelegramNotificationDispatcher(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectedMarkupShouldBeRetriedAsPlainText() throws Exception {
        TelegramNotificationDispatcher dispatcher = spy(new TelegramNotificationDispatcher("123456:TEST"));
        TelegramApiRequestException rejected =
                apiError(400, "Bad Request: can't parse entities: Unsupported start tag \"b\"");
        List<String> parseModes = new ArrayList<>();
        doAnswer(inv -> {
            SendMessage m = inv.getArgument(0);
            parseModes.add(m.getParseMode());
            if (m.getParseMode() != null) {
                throw rejected;
            }
            return null;
        }).when(dispatcher).execute(any(SendMessage.class));

        dispatcher.send("42", "<b>broken");

        assertThat(parseModes).containsExactly(ParseMode.HTML, null);
    }

    @Test
    void forbiddenShouldSurfaceAsDispatchExceptionAfterOneAttempt() throws Exception {
        TelegramNotificationDispatcher dispatcher = spy(new TelegramNotificationDispatcher("123456:TEST"));
        doThrow(apiError(403, "Forbidden: bot was blocked by the user"))
                .when(dispatcher).execute(any(SendMessage.class));

        assertThatThrownBy(() -> dispatcher.send("42", "hi"))
                .isInstanceOf(DispatchException.class)
                .hasMessageContaining("Forbidden");
        verify(dispatcher, times(1)).execute(any(SendMessage.class));
    }

    @Test
    void timeoutShouldNotBeResent() throws Exception {
        TelegramNotificationDispatcher dispatcher = spy(new TelegramNotificationDispatcher("123456:TEST"));
        doThrow(new TelegramApiException("Unable to execute sendmessage method: Read timed out"))
                .when(dispatcher).execute(any(SendMessage.class));

        assertThatThrownBy(() -> dispatcher.send("42", "<b>hi</b>"))
                .isInstanceOf(DispatchException.class)
                .hasMessageContaining("Read timed out");
        verify(dispatcher, times(1)).execute(any(SendMessage.class));
    }

    @Test
    void onlyBadRequestParseErrorsCountAsRejectedMarkup() {
        assertThat(TelegramNotificationDispatcher.isRejectedMarkup(
                apiError(400, "Bad Request: can't parse entities"))).isTrue();
        assertThat(TelegramNotificationDispatcher.isRejectedMarkup(
                apiError(400, "Bad Request: chat not found"))).isFalse();
        assertThat(TelegramNotificationDispatcher.isRejectedMarkup(
                apiError(429, "Too Many Requests: can't parse entities"))).isFalse();
        assertThat(TelegramNotificationDispatcher.isRejectedMarkup(
                new TelegramApiException("Read timed out"))).isFalse();
    }

    private static TelegramApiRequestException apiError(int code, String message) {
        TelegramApiRequestException e = mock(TelegramApiRequestException.class);
        when(e.getErrorCode()).thenReturn(code);
        when(e.getMessage()).thenReturn(message);
        return e;
    }
}
