package com.genderai.server.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

public class CacheDirResolver {

    public static final String SYSTEM_PROPERTY = "gender.cache.dir";
    public static final String ENV_VARIABLE = "MODEL_CACHE_DIR";
    public static final String DEFAULT_DIR = "./model";

    public static Path resolveCacheDirectory(String configured) {
        return resolveCacheDirectory(configured, System.getenv());
    }

    static Path resolveCacheDirectory(String configured, Map<String, String> env) {
        // 1. Check System Property
        String sysProp = System.getProperty(SYSTEM_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return Paths.get(sysProp);
        }

        // 2. Check application config
        if (configured != null && !configured.isBlank()) {
            return Paths.get(configured.trim());
        }

        // 3. Check environment
        String fromEnv = env.get(ENV_VARIABLE);
        if (fromEnv != null && !fromEnv.isEmpty()) {
            return Paths.get(fromEnv);
        }

        // 4. Default
        return Paths.get(DEFAULT_DIR);
    }
}
