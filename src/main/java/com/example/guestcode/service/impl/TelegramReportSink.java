package com.example.guestcode.service.impl;

import com.example.guestcode.service.ReportSink;
import com.example.guestcode.service.exception.ReportDeliveryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.telegram.telegrambots.bots.DefaultAbsSender;
import org.telegram.telegrambots.bots.DefaultBotOptions;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.bots.AbsSender;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.ArrayList;
import java.util.List;

/** Posts the report into one Telegram chat. */
@Slf4j
@Service
@ConditionalOnProperty(name = "report.telegram.enabled", havingValue = "true")
public class TelegramReportSink implements ReportSink {

    static final int MAX_MESSAGE_LENGTH = 4096;

    private final AbsSender sender;
    private final String chatId;

    @Autowired
    public TelegramReportSink(@Value("${report.telegram.bot-token}") String botToken,
                              @Value("${report.telegram.chat-id}") String chatId) {
        this(new ReportBotSender(botToken), chatId);
    }

    TelegramReportSink(AbsSender sender, String chatId) {
        this.sender = sender;
        this.chatId = chatId;
    }

    @Override
    public String name() {
        return "telegram";
    }

    @Override
    public void deliver(String subject, String body) {
        try {
            for (String chunk : split(subject + "\n\n" + body)) {
                sender.execute(new SendMessage(chatId, chunk));
            }
            log.info("Report '{}' posted to chat {}", subject, chatId);
        } catch (TelegramApiException e) {
            throw new ReportDeliveryException("Telegram post to chat " + chatId + " failed: " + e.getMessage(), e);
        }
    }

    /** Telegram rejects longer texts, cut at paragraph borders where possible. */
    static List<String> split(String text) {
        List<String> chunks = new ArrayList<>();
        String rest = text;
        while (rest.length() > MAX_MESSAGE_LENGTH) {
            int cut = rest.lastIndexOf("\n\n", MAX_MESSAGE_LENGTH);
            if (cut <= 0) {
                cut = MAX_MESSAGE_LENGTH;
            }
            chunks.add(rest.substring(0, cut));
            rest = rest.substring(cut).stripLeading();
        }
        if (!rest.isEmpty()) {
            chunks.add(rest);
        }
        return chunks;
    }

    private static class ReportBotSender extends DefaultAbsSender {

        ReportBotSender(String botToken) {
            super(new DefaultBotOptions(), botToken);
        }
    }
}
