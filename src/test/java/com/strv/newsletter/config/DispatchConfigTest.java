package com.strv.newsletter.config;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DispatchConfigTest {

    private static DispatchConfig config;

    @BeforeAll
    static void before() throws IOException {
        System.setProperty("DISPATCH_TEST_RESEND_KEY", "re_from_property");
        config = new DispatchConfig("src/test/resources/cfg/dispatch.json5");
    }

    @AfterAll
    static void after() {
        System.clearProperty("DISPATCH_TEST_RESEND_KEY");
    }

    @Test
    void getWorker() {
        WorkerConfig worker = config.getWorker();
        assertEquals(3, worker.getCount());
        assertEquals(25, worker.getQueueCapacity());
        assertEquals(Duration.ofSeconds(2), worker.getSendTimeout());
        assertEquals(Duration.ofSeconds(10), worker.getShutdownTimeout());
    }

    @Test
    void getMail() {
        MailConfig mail = config.getMail();
        assertEquals("resend", mail.getProvider());
        assertEquals("newsletter@example.com", mail.getFrom());
        assertEquals("smtp.example.com", mail.getSmtpHost());
        assertEquals(2525, mail.getSmtpPort());
        assertEquals("http://localhost:9999/", mail.getResendBaseUrl());
    }

    @Test
    void magicVariables() {
        assertEquals("re_from_property", config.getMail().getResendApiKey(), "System property should be substituted");
        assertEquals("", config.getMail().getSmtpPassword(), "Unknown variable should become empty");
    }

    @Test
    void getAppBaseUrl() {
        assertEquals("https://news.example.com", config.getAppBaseUrl(), "Trailing slash should be stripped");
    }

    @Test
    void getMetrics() {
        assertTrue(config.getMetrics().getBooleanProperty("enabled"));
        assertEquals(9191L, config.getMetrics().getLongProperty("port"));
    }

    @Test
    void defaults() {
        DispatchConfig empty = new DispatchConfig();
        assertEquals(5, empty.getWorker().getCount());
        assertEquals(100, empty.getWorker().getQueueCapacity());
        assertEquals(Duration.ofSeconds(30), empty.getWorker().getSendTimeout());
        assertEquals(Duration.ZERO, empty.getWorker().getShutdownTimeout());
        assertEquals("console", empty.getMail().getProvider());
        assertEquals("smtp.gmail.com", empty.getMail().getSmtpHost());
        assertEquals(587, empty.getMail().getSmtpPort());
        assertEquals("https://api.resend.com", empty.getMail().getResendBaseUrl());
        assertEquals("http://localhost:8080", empty.getAppBaseUrl());
        assertFalse(empty.getMetrics().getBooleanProperty("enabled"));
    }

    @Test
    void missingFile() {
        assertThrows(NoSuchFileException.class, () -> new DispatchConfig("src/test/resources/cfg/missing.json5"));
    }
}
