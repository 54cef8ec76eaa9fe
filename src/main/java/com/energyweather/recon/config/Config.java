package com.energyweather.recon.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * 模块说明：Config（class）。
 * 主要职责：按 默认值 -> classpath config.properties -> 工作目录 config.properties -> 命令行覆盖 的顺序合并配置。
 * 使用建议：进程启动时构造一次，并按引用传给各组件，不要在组件内部再读取全局状态。
 */
public final class Config {
    private static final String FILE_NAME = "config.properties";

    /** Configuration layers, highest precedence first. */
    enum Layer {
        CLI("cli"),
        OVERRIDE("override"),
        RESOURCE("resource");

        private final String label;

        Layer(String label) {
            this.label = label;
        }
    }

    private static final Map<String, String> DEFAULTS = pipelineDefaults();

    private final Map<Layer, Properties> layers = new EnumMap<>(Layer.class);
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
        for (Layer layer : Layer.values()) {
            layers.put(layer, new Properties());
        }
    }

    /** Reads the bundled {@code config.properties}, then the one in {@code workingDir} if present. */
    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);
        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(FILE_NAME)) {
            if (in != null) {
                config.layers.get(Layer.RESOURCE).load(in);
            }
        } catch (IOException e) {
            log().warn("Failed to read bundled {}: {}", FILE_NAME, e.getMessage());
        }

        Path local = workingDir.resolve(FILE_NAME);
        if (Files.isRegularFile(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.layers.get(Layer.OVERRIDE).load(in);
            } catch (IOException e) {
                log().warn("Failed to read {}: {}", local, e.getMessage());
            }
        }
        return config;
    }

    /**
     * Builds a Config from nested maps, e.g. {@code Map.of("paths", Map.of("raw_dir", "in"))}.
     * Leaves become dotted keys in the override layer; list leaves are joined with commas.
     */
    public static Config fromConfigurationProperties(Path workingDir, Map<String, ?> nested) {
        Config config = new Config(workingDir);
        Properties target = config.layers.get(Layer.OVERRIDE);
        flatten("", nested, target);
        return config;
    }

    /** Returns a copy where the given keys win over every file and default value. */
    public Config withOverrides(Map<String, String> overrides) {
        Config copy = new Config(workingDir);
        for (Layer layer : Layer.values()) {
            copy.layers.get(layer).putAll(layers.get(layer));
        }
        if (overrides == null) {
            return copy;
        }
        Properties cli = copy.layers.get(Layer.CLI);
        overrides.forEach((key, value) -> {
            if (key != null && !key.isBlank() && value != null) {
                cli.setProperty(key.trim(), value);
            }
        });
        return copy;
    }

    /** Trimmed value from the highest layer that sets it, the built-in default, or "". */
    public String getString(String key) {
        for (Layer layer : Layer.values()) {
            String value = trimmed(layers.get(layer).getProperty(key));
            if (!value.isEmpty()) {
                return value;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        return value.isEmpty() ? fallback : value;
    }

    public boolean getBoolean(String key) {
        switch (getString(key).toLowerCase(Locale.ROOT)) {
            case "true":
            case "yes":
            case "y":
            case "1":
                return true;
            default:
                return false;
        }
    }

    public boolean getBoolean(String key, boolean fallback) {
        return getString(key).isEmpty() ? fallback : getBoolean(key);
    }

    public int getInt(String key) {
        return getInt(key, 0);
    }

    public int getInt(String key, int fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log().warn("Config {}={} is not an integer, using {}", key, value, fallback);
            return fallback;
        }
    }

    /** Resolves the value against the working directory; an unset key yields the working directory. */
    public Path getPath(String key) {
        String value = getString(key);
        return value.isEmpty() ? workingDir : workingDir.resolve(value).normalize();
    }

    /** Comma- or semicolon-separated list, blanks removed. */
    public List<String> getList(String key) {
        List<String> out = new ArrayList<>();
        for (String token : getString(key).split("[,;]")) {
            if (!token.isBlank()) {
                out.add(token.trim());
            }
        }
        return out;
    }

    public String requireString(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("missing required config: " + key);
        }
        return value;
    }

    /** Which layer supplied the value: "cli", "override", "resource" or "default". */
    public String sourceOf(String key) {
        if (key != null && !key.isBlank()) {
            for (Layer layer : Layer.values()) {
                if (!trimmed(layers.get(layer).getProperty(key)).isEmpty()) {
                    return layer.label;
                }
            }
        }
        return "default";
    }

    private static void flatten(String prefix, Object node, Properties target) {
        if (node == null) {
            return;
        }
        if (node instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String segment = entry.getKey() == null ? "" : entry.getKey().toString().trim();
                if (!segment.isEmpty()) {
                    flatten(prefix.isEmpty() ? segment : prefix + "." + segment, entry.getValue(), target);
                }
            }
        } else if (!prefix.isEmpty()) {
            if (node instanceof List<?> list) {
                List<String> parts = new ArrayList<>(list.size());
                for (Object item : list) {
                    parts.add(item == null ? "" : String.valueOf(item));
                }
                target.setProperty(prefix, String.join(",", parts));
            } else {
                target.setProperty(prefix, String.valueOf(node));
            }
        }
    }

    // Config is read before log routing is installed, so the logger is looked up per call.
    private static Logger log() {
        return LogManager.getLogger(Config.class);
    }

    private static String trimmed(String raw) {
        return raw == null ? "" : raw.trim();
    }

    private static Map<String, String> pipelineDefaults() {
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put("outputs.dir", "outputs");

        defaults.put("paths.raw_dir", "data/raw");
        defaults.put("paths.processed_dir", "data/processed");
        defaults.put("paths.report_dir", "data/reports");

        defaults.put("ingest.order", "lexical");
        defaults.put("ingest.extensions", "csv,json");
        defaults.put("join.mode", "inner");

        defaults.put("quality.freshness.default_days", "2");
        defaults.put("quality.freshness.energy_days", "2");
        defaults.put("quality.freshness.weather_days", "2");
        defaults.put("quality.temperature_columns", "temp_min_F,temp_max_F");
        defaults.put("quality.demand_column", "energy_demand_MW");
        defaults.put("quality.date_column", "date");
        defaults.put("report.date_zone", "UTC");

        defaults.put("processed.write_dated_copy", "true");
        defaults.put("processed.write_backup", "true");
        return Collections.unmodifiableMap(defaults);
    }
}
