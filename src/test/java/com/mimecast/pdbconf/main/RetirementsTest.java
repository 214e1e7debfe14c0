package com.mimecast.pdbconf.main;

import com.mimecast.pdbconf.LogCapture;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RetirementsTest {

    @Test
    void nothingRetired() {
        Retirements retirements = Retirements.check(Map.of("database", Map.of("subname", "x")));
        assertTrue(retirements.getWarnings().isEmpty());
        assertFalse(retirements.isFatal());
    }

    @Test
    void retiredSettingsWarned() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("command-processing", Map.of("memory-usage", 10L));
        document.put("database", Map.of("classname", "org.postgresql.Driver"));
        document.put("database \"primary\"", Map.of("conn-keep-alive", 45L));

        Retirements retirements;
        try (LogCapture capture = LogCapture.open()) {
            retirements = Retirements.check(document);
            assertTrue(capture.hasWarning("The [database] classname config option has been retired and will be ignored."));
        }

        assertEquals(List.of(
                "The [command-processing] memory-usage config option has been retired and will be ignored.",
                "The [database] classname config option has been retired and will be ignored.",
                "The [database \"primary\"] conn-keep-alive config option has been retired and will be ignored."),
                retirements.getWarnings());
        assertFalse(retirements.isFatal());
    }

    @Test
    void replBlock() {
        Retirements retirements = Retirements.check(Map.of("repl", Map.of("enabled", true)));
        assertEquals(1, retirements.getWarnings().size());
        assertTrue(retirements.getWarnings().get(0).startsWith("The configuration block [repl] is now retired"));
    }

    @Test
    void urlPrefixFatal() {
        Retirements retirements = Retirements.check(Map.of("global", Map.of("url-prefix", "/pdb")));
        assertTrue(retirements.isFatal());
        assertEquals(1, retirements.getFatalIssues().size());
        assertTrue(retirements.getFatalIssues().get(0).contains("`url-prefix`"));
    }

    @Test
    void nullUrlPrefixIgnored() {
        Map<String, Object> global = new HashMap<>();
        global.put("url-prefix", null);

        assertFalse(Retirements.check(Map.of("global", global)).isFatal());
    }
}
