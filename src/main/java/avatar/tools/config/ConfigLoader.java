package avatar.tools.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Loads an {@link AnalyzerConfig} from a JSON file. Properties present in the
 * file replace the defaults; missing properties keep them.
 * <pre>
 * {
 *   "sourceRoots": [".", "vmm"],
 *   "includeDirs": ["include"],
 *   "guestAllowedFiles": ["guest_manifests.c"]
 * }
 * </pre>
 */
public final class ConfigLoader {

    private final ObjectMapper mapper;

    public ConfigLoader() {
        this.mapper = new ObjectMapper();
    }

    public AnalyzerConfig load(Path configFile) throws IOException {
        Objects.requireNonNull(configFile, "configFile");
        if (!Files.isRegularFile(configFile)) {
            throw new IOException("Config file not found: " + configFile);
        }
        final JsonNode root;
        try {
            root = mapper.readTree(configFile.toFile());
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Malformed config " + configFile + ": " + ex.getOriginalMessage(), ex);
        }
        return merge(AnalyzerConfig.defaults(), root);
    }

    AnalyzerConfig merge(AnalyzerConfig base, JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Config must be a JSON object");
        }

        List<String> sourceRoots = base.sourceRoots();
        List<String> includeDirs = base.includeDirs();
        List<String> excludedDirs = base.excludedDirs();
        List<String> systemPrefixes = base.systemPrefixes();
        String guestRoot = base.guestRoot();
        List<String> guestAllowedFiles = base.guestAllowedFiles();
        List<String> guestAllowedSubdirs = base.guestAllowedSubdirs();
        String appRoot = base.appRoot();
        List<String> appExcludedFiles = base.appExcludedFiles();

        final Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            final var e = fields.next();
            final String key = e.getKey();
            final JsonNode value = e.getValue();
            switch (key) {
                case "sourceRoots" -> sourceRoots = stringList(key, value);
                case "includeDirs" -> includeDirs = stringList(key, value);
                case "excludedDirs" -> excludedDirs = stringList(key, value);
                case "systemPrefixes" -> systemPrefixes = stringList(key, value);
                case "guestRoot" -> guestRoot = string(key, value);
                case "guestAllowedFiles" -> guestAllowedFiles = stringList(key, value);
                case "guestAllowedSubdirs" -> guestAllowedSubdirs = stringList(key, value);
                case "appRoot" -> appRoot = string(key, value);
                case "appExcludedFiles" -> appExcludedFiles = stringList(key, value);
                default -> throw new IllegalArgumentException("Unknown config property: " + key);
            }
        }

        return new AnalyzerConfig(sourceRoots, includeDirs, excludedDirs, systemPrefixes, guestRoot,
                guestAllowedFiles, guestAllowedSubdirs, appRoot, appExcludedFiles);
    }

    private static List<String> stringList(String key, JsonNode value) {
        if (!value.isArray()) {
            throw new IllegalArgumentException("Config property '" + key + "' must be an array of strings");
        }
        final List<String> out = new ArrayList<>(value.size());
        for (JsonNode item : value) {
            out.add(string(key, item));
        }
        return out;
    }

    private static String string(String key, JsonNode value) {
        if (!value.isTextual()) {
            throw new IllegalArgumentException("Config property '" + key + "' must contain strings");
        }
        return value.asText();
    }
}
