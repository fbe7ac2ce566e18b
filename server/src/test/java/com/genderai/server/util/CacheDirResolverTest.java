package com.genderai.server.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class CacheDirResolverTest {

    private static final Map<String, String> ENV =
            Collections.singletonMap(CacheDirResolver.ENV_VARIABLE, "/from/env");

    @AfterEach
    public void tearDown() {
        System.clearProperty(CacheDirResolver.SYSTEM_PROPERTY);
    }

    @Test
    public void testSystemPropertyWins() {
        System.setProperty(CacheDirResolver.SYSTEM_PROPERTY, "/from/property");
        assertEquals(Paths.get("/from/property"), CacheDirResolver.resolveCacheDirectory("/configured", ENV));
    }

    @Test
    public void testConfiguredBeforeEnvironment() {
        assertEquals(Paths.get("/configured"), CacheDirResolver.resolveCacheDirectory(" /configured ", ENV));
        assertEquals(Paths.get("/from/env"), CacheDirResolver.resolveCacheDirectory("  ", ENV));
    }

    @Test
    public void testDefaultWhenNothingIsSet() {
        assertEquals(Paths.get("./model"),
                CacheDirResolver.resolveCacheDirectory(null, Collections.<String, String>emptyMap()));
    }
}
