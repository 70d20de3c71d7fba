package com.example.guestcode.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;

import java.util.Properties;

@Configuration
@Data
public class MailConfig {

    private static final int SMTPS_PORT = 465;
    private static final String TIMEOUT_MS = "30000";

    @Value("${report.mail.host}")
    String host;

    @Value("${report.mail.port}")
    int port;

    @Value("${report.mail.username}")
    String username;

    @Value("${report.mail.password}")
    String password;

    @Value("${report.mail.starttls}")
    boolean starttls;

    @Value("${report.mail.from}")
    String from;

    @Value("${report.mail.to}")
    String to;

    /**
     * SMTPS on port 465, plain SMTP with optional STARTTLS everywhere else.
     */
    @Bean
    public JavaMailSender reportMailSender() {
        JavaMailSenderImpl sender = new JavaMailSenderImpl();
        sender.setHost(host);
        sender.setPort(port);
        sender.setDefaultEncoding("UTF-8");
        if (username != null && !username.isBlank()) {
            sender.setUsername(username);
            sender.setPassword(password);
        }

        Properties props = sender.getJavaMailProperties();
        boolean smtps = port == SMTPS_PORT;
        sender.setProtocol(smtps ? "smtps" : "smtp");
        String prefix = smtps ? "mail.smtps." : "mail.smtp.";
        props.put(prefix + "auth", String.valueOf(username != null && !username.isBlank()));
        props.put(prefix + "connectiontimeout", TIMEOUT_MS);
        props.put(prefix + "timeout", TIMEOUT_MS);
        props.put(prefix + "writetimeout", TIMEOUT_MS);
        if (!smtps) {
            props.put("mail.smtp.starttls.enable", String.valueOf(starttls));
        }
        return sender;
    }

    /** Sender address, falls back to the SMTP user. */
    public String sender() {
        if (from != null && !from.isBlank()) {
            return from;
        }
        if (username != null && !username.isBlank()) {
            return username;
        }
        return "noreply@example.com";
    }
}
