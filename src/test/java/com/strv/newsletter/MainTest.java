package com.strv.newsletter;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Options;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @Test
    void parseConfigOption() {
        Main main = new Main(new String[]{"--config", "cfg/dispatch.json5"});
        Optional<CommandLine> cmd = main.parseArgs(main.options());

        assertTrue(cmd.isPresent());
        assertEquals("cfg/dispatch.json5", cmd.get().getOptionValue("config"));
    }

    @Test
    void parseUnknownOption() {
        Main main = new Main(new String[]{"--bogus"});
        assertTrue(main.parseArgs(main.options()).isEmpty(), "Unknown option should fail parsing");
    }

    @Test
    void helpDoesNotStartService() {
        Main main = new Main(new String[]{"--help"});
        Options options = main.options();
        assertTrue(options.hasOption("help"));
        assertTimeoutPreemptively(Duration.ofSeconds(5), main::run, "Help should return immediately");
    }
}
