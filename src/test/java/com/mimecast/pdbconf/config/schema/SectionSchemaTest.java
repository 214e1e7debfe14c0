package com.mimecast.pdbconf.config.schema;

import com.mimecast.pdbconf.config.ConfigException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static com.mimecast.pdbconf.config.schema.Setting.defaulted;
import static com.mimecast.pdbconf.config.schema.Setting.optional;
import static com.mimecast.pdbconf.config.schema.Setting.required;
import static com.mimecast.pdbconf.config.schema.SettingTypes.*;
import static org.junit.jupiter.api.Assertions.*;

class SectionSchemaTest {

    private static final SectionSchema BASE = SectionSchema.builder("base")
            .add(required("host", STRING))
            .add(defaulted("port", INTEGER, 5432L))
            .build();

    @Test
    void unknownKeys() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("host", "db");
        data.put("colour", "blue");
        data.put("size", 3L);

        assertEquals(Set.of("colour", "size"), BASE.unknownKeys(data));
        assertEquals(Map.of("host", "db"), BASE.stripUnknownKeys(data));
        assertEquals(3, data.size());
    }

    @Test
    void extend() {
        SectionSchema extended = BASE.extend("extended")
                .add(optional("ttl", PERIOD))
                .remove("port")
                .build();

        assertEquals("extended", extended.getName());
        assertTrue(extended.declares("host"));
        assertTrue(extended.declares("ttl"));
        assertFalse(extended.declares("port"));
        assertTrue(BASE.declares("port"));
        assertFalse(BASE.declares("ttl"));
    }

    @Test
    void validateIncomingCollectsErrors() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("port", "high");

        ConfigException e = assertThrows(ConfigException.class, () -> BASE.validateIncoming("base", data));
        assertEquals(ConfigException.Kind.SCHEMA, e.getKind());
        assertEquals("Invalid [base] config: missing required key `host`; `port` must be of type integer, got String high",
                e.getMessage());
    }

    @Test
    void validateOutgoing() {
        SectionSchema out = SectionSchema.builder("out")
                .add(required("port", INTEGER).constrained(value -> (Long) value > 0, "must be positive"))
                .build();

        out.validateOutgoing("out", Map.of("port", 5432L));

        ConfigException unexpected = assertThrows(ConfigException.class,
                () -> out.validateOutgoing("out", Map.of("port", 1L, "host", "db")));
        assertTrue(unexpected.getMessage().contains("unexpected key `host`"));

        ConfigException type = assertThrows(ConfigException.class, () -> out.validateOutgoing("out", Map.of("port", "1")));
        assertTrue(type.getMessage().contains("`port` must be of type integer"));

        ConfigException constraint = assertThrows(ConfigException.class, () -> out.validateOutgoing("out", Map.of("port", 0L)));
        assertTrue(constraint.getMessage().contains("`port` must be positive"));
    }

    @Test
    void computedDefault() {
        int[] calls = {0};
        Setting setting = defaulted("threads", INTEGER, () -> ++calls[0]);

        assertEquals(1, setting.getDefault().orElseThrow());
        assertEquals(2, setting.getDefault().orElseThrow());
        assertFalse(setting.isRequired());
    }
}
