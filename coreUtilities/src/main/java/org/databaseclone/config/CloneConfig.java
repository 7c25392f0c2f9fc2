package org.databaseclone.config;

import java.io.FileInputStream;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Optional YAML configuration file.  Everything here has a command line or built-in default, so
 * any section may be left out.
 * <pre>
 * unique_identifier_fields:
 *   packaging_records: waybill_number
 * batch_size: 100
 * snapshot_path: .database-clone-cache.json
 * readiness_timeout_policy: fail
 * attribute_poll:
 *   max_attempts: 30
 *   interval_millis: 1000
 * index_poll:
 *   max_attempts: 60
 *   interval_millis: 1000
 * </pre>
 */
public class CloneConfig {
    public Map<String, String> unique_identifier_fields = new LinkedHashMap<>();
    public Integer batch_size;
    public String snapshot_path;
    public String readiness_timeout_policy;
    public PollSettings attribute_poll;
    public PollSettings index_poll;

    public static class PollSettings {
        public Integer max_attempts;
        public Long interval_millis;
    }

    public static CloneConfig loadFrom(String path) throws IOException {
        var yaml = new Yaml(new Constructor(CloneConfig.class, new LoaderOptions()));
        try (var inputStream = new FileInputStream(path)) {
            CloneConfig loaded = yaml.load(inputStream);
            return loaded == null ? new CloneConfig() : loaded.withDefaults();
        }
    }

    private CloneConfig withDefaults() {
        if (unique_identifier_fields == null) {
            unique_identifier_fields = new LinkedHashMap<>();
        }
        return this;
    }
}
