package com.example.guestcode.service.impl;

import com.example.guestcode.config.MailConfig;
import com.example.guestcode.service.exception.ReportDeliveryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class MailReportSinkTest {

    private JavaMailSender mailSender;
    private MailConfig mailConfig;
    private MailReportSink sink;

    @BeforeEach
    void setUp() {
        mailSender = Mockito.mock(JavaMailSender.class);
        mailConfig = new MailConfig();
        mailConfig.setHost("smtp.example.org");
        mailConfig.setUsername("reports@example.org");
        mailConfig.setTo("host@example.org, cleaning@example.org");
        sink = new MailReportSink(mailSender, mailConfig);
    }

    @Test
    void shouldMailReportToAllRecipients() {
        sink.deliver("OK - Report - 05.06.2025", "[OK] A");

        ArgumentCaptor<SimpleMailMessage> captor = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(mailSender).send(captor.capture());
        SimpleMailMessage message = captor.getValue();
        assertThat(message.getTo()).containsExactly("host@example.org", "cleaning@example.org");
        assertThat(message.getFrom()).isEqualTo("reports@example.org");
        assertThat(message.getSubject()).isEqualTo("OK - Report - 05.06.2025");
        assertThat(message.getText()).isEqualTo("[OK] A");
    }

    @Test
    void shouldSkipWithoutRecipient() {
        mailConfig.setTo(" ");

        sink.deliver("subject", "body");

        verify(mailSender, never()).send(any(SimpleMailMessage.class));
    }

    @Test
    void shouldWrapSendFailure() {
        doThrow(new MailSendException("connection refused")).when(mailSender).send(any(SimpleMailMessage.class));

        assertThatThrownBy(() -> sink.deliver("subject", "body"))
                .isInstanceOf(ReportDeliveryException.class)
                .hasMessageContaining("connection refused");
    }
}
