package com.mimecast.pdbconf.main;

import com.mimecast.pdbconf.config.ResolvedConfig;
import com.mimecast.pdbconf.config.server.HostDefaults;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigTest {

    @AfterEach
    void tearDown() {
        Config.clear();
    }

    @Test
    void notInitialised() {
        assertFalse(Config.isInitialised());
        assertThrows(IllegalStateException.class, Config::get);
    }

    @Test
    void initOnce() {
        ResolvedConfig config = resolve();
        Config.init(config);

        assertTrue(Config.isInitialised());
        assertSame(config, Config.get());
        assertThrows(IllegalStateException.class, () -> Config.init(resolve()));
        assertSame(config, Config.get());
    }

    private static ResolvedConfig resolve() {
        return new ConfigResolver(new HostDefaults(2, 1024L * 1024))
                .resolve(Map.of("database", Map.of("subname", "//localhost/pdb", "user", "pdb")))
                .getConfig()
                .orElseThrow();
    }
}
