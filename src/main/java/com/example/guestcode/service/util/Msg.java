package com.example.guestcode.service.util;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.MessageSource;
import org.springframework.stereotype.Component;

import java.util.Locale;

/** Report texts in the configured report language. */
@Component
public class Msg {

    private final MessageSource messageSource;
    private final Locale locale;

    public Msg(MessageSource messageSource, @Value("${report.locale}") Locale locale) {
        this.messageSource = messageSource;
        this.locale = locale;
    }

    public String get(String key, Object... args) {
        return messageSource.getMessage(key, args, locale);
    }
}
