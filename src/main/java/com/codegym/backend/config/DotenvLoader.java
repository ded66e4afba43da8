package com.codegym.backend.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a local {@code .env} file into system properties so that
 * {@code ${DB_URL}} style placeholders in application.yml resolve during
 * development. Keys already set in the environment or as system properties
 * are left alone.
 */
public final class DotenvLoader {

    private static final Logger log = LoggerFactory.getLogger(DotenvLoader.class);

    private DotenvLoader() {
    }

    public static void loadIfPresent(String fileName) {
        Path envPath = Path.of(fileName);
        if (!Files.isRegularFile(envPath)) {
            return;
        }

        try {
            Map<String, String> entries = parse(Files.readAllLines(envPath, StandardCharsets.UTF_8));
            int applied = 0;
            for (Map.Entry<String, String> entry : entries.entrySet()) {
                if (isDefined(System.getenv(entry.getKey())) || isDefined(System.getProperty(entry.getKey()))) {
                    continue;
                }
                System.setProperty(entry.getKey(), entry.getValue());
                applied++;
            }
            if (applied > 0) {
                log.info("[DotenvLoader] Applied {} keys from {}", applied, envPath.toAbsolutePath());
            }
        } catch (IOException e) {
            log.warn("[DotenvLoader] Could not read {}: {}", envPath, e.getMessage());
        }
    }

    /**
     * Parses {@code KEY=value} lines. Comments, blank lines, lines without a
     * key and empty values are skipped; surrounding quotes are removed.
     */
    static Map<String, String> parse(List<String> lines) {
        Map<String, String> result = new LinkedHashMap<>();
        for (String raw : lines) {
            if (raw == null) continue;
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            if (line.startsWith("export ")) {
                line = line.substring("export ".length()).trim();
            }

            int idx = line.indexOf('=');
            if (idx <= 0) continue;

            String key = line.substring(0, idx).trim();
            String value = unquote(line.substring(idx + 1).trim());
            if (key.isEmpty() || value.isEmpty()) continue;

            result.put(key, value);
        }
        return result;
    }

    private static String unquote(String value) {
        if (value.length() >= 2
                && ((value.startsWith("\"") && value.endsWith("\"")) || (value.startsWith("'") && value.endsWith("'")))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    private static boolean isDefined(String value) {
        return value != null && !value.isBlank();
    }
}
