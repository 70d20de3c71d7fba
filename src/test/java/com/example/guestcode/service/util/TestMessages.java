package com.example.guestcode.service.util;

import org.springframework.context.support.ResourceBundleMessageSource;

import java.util.Locale;

public final class TestMessages {

    private TestMessages() {
    }

    public static Msg english() {
        return of(Locale.ENGLISH);
    }

    public static Msg of(Locale locale) {
        ResourceBundleMessageSource source = new ResourceBundleMessageSource();
        source.setBasename("messages");
        source.setDefaultEncoding("UTF-8");
        source.setFallbackToSystemLocale(false);
        return new Msg(source, locale);
    }
}
