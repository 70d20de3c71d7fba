package com.example.guestcode.service.impl;

import com.example.guestcode.service.exception.ReportDeliveryException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.bots.AbsSender;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TelegramReportSinkTest {

    @Test
    void shouldPostSubjectAndBodyToChat() throws TelegramApiException {
        AbsSender sender = Mockito.mock(AbsSender.class);
        TelegramReportSink sink = new TelegramReportSink(sender, "-100200");

        sink.deliver("OK - Report", "[OK] A");

        ArgumentCaptor<SendMessage> captor = ArgumentCaptor.forClass(SendMessage.class);
        verify(sender).execute(captor.capture());
        assertThat(captor.getValue().getChatId()).isEqualTo("-100200");
        assertThat(captor.getValue().getText()).isEqualTo("OK - Report\n\n[OK] A");
    }

    @Test
    void shouldWrapApiFailure() throws TelegramApiException {
        AbsSender sender = Mockito.mock(AbsSender.class);
        when(sender.execute(any(SendMessage.class))).thenThrow(new TelegramApiException("chat not found"));

        assertThatThrownBy(() -> new TelegramReportSink(sender, "1").deliver("s", "b"))
                .isInstanceOf(ReportDeliveryException.class)
                .hasMessageContaining("chat not found");
    }

    @Test
    void shouldSplitLongReportAtParagraphs() {
        String first = "a".repeat(3000);
        String second = "b".repeat(3000);

        List<String> chunks = TelegramReportSink.split(first + "\n\n" + second);

        assertThat(chunks).containsExactly(first, second);
    }

    @Test
    void shouldHardCutParagraphLongerThanLimit() {
        List<String> chunks = TelegramReportSink.split("x".repeat(5000));

        assertThat(chunks).hasSize(2);
        assertThat(chunks.get(0)).hasSize(TelegramReportSink.MAX_MESSAGE_LENGTH);
    }
}
