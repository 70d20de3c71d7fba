package com.example.guestcode.service.impl;

import com.example.guestcode.config.MailConfig;
import com.example.guestcode.service.ReportSink;
import com.example.guestcode.service.exception.ReportDeliveryException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;

import java.util.Arrays;

@Slf4j
@Service
@RequiredArgsConstructor
public class MailReportSink implements ReportSink {

    private final JavaMailSender mailSender;
    private final MailConfig mailConfig;

    @Override
    public String name() {
        return "mail";
    }

    @Override
    public void deliver(String subject, String body) {
        if (isBlank(mailConfig.getHost()) || isBlank(mailConfig.getTo())) {
            log.debug("Mail report disabled, SMTP host or recipient not set");
            return;
        }

        String[] recipients = Arrays.stream(mailConfig.getTo().split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toArray(String[]::new);

        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(mailConfig.sender());
        message.setTo(recipients);
        message.setSubject(subject);
        message.setText(body);

        try {
            mailSender.send(message);
            log.info("Report '{}' mailed to {}", subject, String.join(", ", recipients));
        } catch (MailException e) {
            throw new ReportDeliveryException("Mail to " + mailConfig.getTo() + " failed: " + e.getMessage(), e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
