package com.memorybox.runtime;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppConfigDefaultsTest {

    @Test
    void shouldDefaultToLocalModeAndWideFirstPass() {
        AppConfig config = new AppConfig();

        assertTrue(config.getLibrary().isLocalMode());
        assertEquals(200, config.getLibrary().getBatchSize());
        assertEquals(".memorybox", config.getLibrary().getDataFolder());
        assertTrue(config.getLibrary().getExclusions().contains(".DS_Store"));
        assertEquals(20, config.getRetrieval().getRetrievalMultiplier());
        assertEquals(50, config.getRetrieval().getClusters());
        assertEquals(6379, config.getRedis().getPort());
    }

    @Test
    void shouldReadPartialYamlAndKeepDefaultsForMissingSections() throws Exception {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig config = mapper.readValue("""
                library:
                  localMode: false
                  batchSize: 50
                retrieval:
                  retrievalMultiplier: 5
                unknownSection:
                  ignored: true
                """, AppConfig.class);

        assertEquals(false, config.getLibrary().isLocalMode());
        assertEquals(50, config.getLibrary().getBatchSize());
        assertEquals(5, config.getRetrieval().getRetrievalMultiplier());
        assertEquals(4, config.getRetrieval().getProbes());
        assertNotNull(config.getRedis());
        assertEquals("memorybox", config.getRedis().getKeyPrefix());
    }
}
