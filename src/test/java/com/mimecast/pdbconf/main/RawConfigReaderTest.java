package com.mimecast.pdbconf.main;

import com.mimecast.pdbconf.config.ConfigException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RawConfigReaderTest {

    @Test
    void json5() {
        Map<String, Object> document = RawConfigReader.parse(String.join("\n",
                "// comment",
                "{",
                "  database: {subname: '//localhost/pdb', 'maximum-pool-size': 10, stats: false},",
                "  'database \"primary\"': {\"conn-max-age\": 1.5}",
                "}"));

        assertEquals(List.of("database", "database \"primary\""), List.copyOf(document.keySet()));
        Map<?, ?> database = (Map<?, ?>) document.get("database");
        assertEquals("//localhost/pdb", database.get("subname"));
        assertEquals(10L, database.get("maximum-pool-size"));
        assertEquals(Boolean.FALSE, database.get("stats"));
        assertEquals(1.5d, ((Map<?, ?>) document.get("database \"primary\"")).get("conn-max-age"));
    }

    @Test
    void empty() {
        assertTrue(RawConfigReader.parse("").isEmpty());
    }

    @Test
    void notADocument() {
        ConfigException e = assertThrows(ConfigException.class, () -> RawConfigReader.parse("[1, 2]"));
        assertEquals(ConfigException.Kind.STRUCTURE, e.getKind());
    }

    @Test
    void duplicateKeys() {
        ConfigException e = assertThrows(ConfigException.class,
                () -> RawConfigReader.parse("{database: {}, database: {}}"));
        assertEquals(ConfigException.Kind.STRUCTURE, e.getKind());
    }

    @Test
    void readFile() throws IOException {
        Map<String, Object> document = RawConfigReader.read(Path.of("src/test/resources/cfg/pdbconf.json5"));
        assertTrue(document.containsKey("database \"replica\""));
        assertEquals(2L, ((Map<?, ?>) document.get("command-processing")).get("threads"));
    }

    @Test
    void missingFile() {
        assertThrows(IOException.class, () -> RawConfigReader.read(Path.of("src/test/resources/cfg/missing.json5")));
    }
}
