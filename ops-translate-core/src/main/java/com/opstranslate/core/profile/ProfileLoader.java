package com.opstranslate.core.profile;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads environment profiles from YAML files.
 *
 * <p>A missing file is not an error: the run proceeds with an empty profile and every
 * profile-dependent task becomes a blocked stub. A file that exists but is not a YAML
 * mapping raises {@link ProfileException}.
 */
public class ProfileLoader {

    private static final Logger log = LoggerFactory.getLogger(ProfileLoader.class);

    private final ObjectMapper yamlMapper;

    public ProfileLoader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    /**
     * Loads a profile from a file.
     *
     * @param path YAML file
     * @return profile named after the file, or an empty profile if the file does not exist
     * @throws ProfileException if the file cannot be parsed
     */
    public Profile load(Path path) {
        String name = profileName(path);
        if (!Files.exists(path)) {
            log.warn("Profile file not found: {}. Profile-dependent tasks will be blocked.", path);
            return Profile.empty(name);
        }
        try {
            return parse(Files.readString(path), name);
        } catch (IOException e) {
            throw new ProfileException("Failed to read profile " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses profile YAML.
     *
     * @param yaml YAML content
     * @param name profile name
     * @return profile
     * @throws ProfileException if the content is not a mapping
     */
    public Profile parse(String yaml, String name) {
        if (yaml == null || yaml.isBlank()) {
            log.warn("Profile {} is empty", name);
            return Profile.empty(name);
        }
        try {
            JsonNode root = yamlMapper.readTree(yaml);
            if (root == null || root.isNull() || root.isMissingNode()) {
                return Profile.empty(name);
            }
            if (!root.isObject()) {
                throw new ProfileException("Profile " + name + " must be a YAML mapping");
            }
            Map<String, Object> values = yamlMapper.convertValue(root,
                new TypeReference<LinkedHashMap<String, Object>>() { });
            log.debug("Loaded profile {} with top-level keys {}", name, values.keySet());
            return new Profile(name, values);
        } catch (IOException e) {
            throw new ProfileException("Failed to parse profile " + name + ": " + e.getMessage(), e);
        }
    }

    private static String profileName(Path path) {
        String fileName = path.getFileName() == null ? path.toString() : path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
