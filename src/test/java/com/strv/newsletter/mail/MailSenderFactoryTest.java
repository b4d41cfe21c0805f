package com.strv.newsletter.mail;

import com.strv.newsletter.config.MailConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MailSenderFactoryTest {

    private static MailConfig config(String provider) {
        Map<String, Object> smtp = new HashMap<>();
        smtp.put("password", "app-password");

        Map<String, Object> resend = new HashMap<>();
        resend.put("apiKey", "re_key");

        Map<String, Object> map = new HashMap<>();
        map.put("provider", provider);
        map.put("from", "newsletter@example.com");
        map.put("smtp", smtp);
        map.put("resend", resend);
        return new MailConfig(map);
    }

    @Test
    void createSmtp() {
        assertInstanceOf(SmtpMailSender.class, MailSenderFactory.createMailSender(config("smtp")));
    }

    @Test
    void createResend() {
        assertInstanceOf(ResendMailSender.class, MailSenderFactory.createMailSender(config("Resend ")));
    }

    @Test
    void createConsole() {
        assertInstanceOf(ConsoleMailSender.class, MailSenderFactory.createMailSender(config("console")));
        assertInstanceOf(ConsoleMailSender.class, MailSenderFactory.createMailSender(new MailConfig(new HashMap<>())),
                "Console should be the default");
    }

    @Test
    void unknownFallsBackToConsole() {
        assertInstanceOf(ConsoleMailSender.class, MailSenderFactory.createMailSender(config("carrier-pigeon")));
    }

    @Test
    void smtpWithoutPasswordFails() {
        Map<String, Object> map = new HashMap<>();
        map.put("provider", "smtp");
        map.put("from", "newsletter@example.com");
        assertThrows(IllegalArgumentException.class, () -> MailSenderFactory.createMailSender(new MailConfig(map)));
    }

    @Test
    void consoleSendsWithoutError() {
        assertDoesNotThrow(() -> new ConsoleMailSender().send(Duration.ofSeconds(1), "a@example.com", "S", "B"));
    }
}
