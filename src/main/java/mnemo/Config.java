package mnemo;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import mnemo.utils.Log;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.Locale;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Config {
    public static final int DEFAULT_PORT = 6379;

    public int port = DEFAULT_PORT;
    public String bind = "0.0.0.0";
    public int workerThreads = 0; // 0 = Netty default (2 * cores)

    // Protocol limits
    public long maxBulkLength = 512L * 1024 * 1024;
    public int maxInlineLength = 64 * 1024;
    public int maxMultibulkLength = 1024 * 1024;

    public String logLevel = "INFO";

    public Config() {
        // Default constructor for Jackson
    }

    public static Config load(String filename) {
        File f = new File(filename);
        if (!f.exists()) {
            // Try looking for .yaml extension if .conf was passed
            if (filename.endsWith(".conf")) {
                File yamlFile = new File(filename.substring(0, filename.length() - ".conf".length()) + ".yaml");
                if (yamlFile.exists()) f = yamlFile;
            }
        }

        Config config = new Config();

        if (!f.exists()) {
            Log.warn("Config file not found: " + filename + ". Using defaults.");
            return config;
        }

        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            Config parsed = mapper.readValue(f, Config.class);
            if (parsed == null) {
                // empty document
                return config;
            }
            config = parsed;
        } catch (IOException e) {
            Log.warn("Failed to load config as YAML (" + e.getMessage() + "). Attempting legacy parse...");
            config = loadLegacy(f, new Config());
        }

        return config.checkLimits();
    }

    /**
     * Resets every protocol limit that is not positive to its default.
     */
    Config checkLimits() {
        Config defaults = new Config();
        if (maxBulkLength <= 0) {
            Log.warn("Ignoring maxBulkLength=" + maxBulkLength + ": must be positive");
            maxBulkLength = defaults.maxBulkLength;
        }
        if (maxInlineLength <= 0) {
            Log.warn("Ignoring maxInlineLength=" + maxInlineLength + ": must be positive");
            maxInlineLength = defaults.maxInlineLength;
        }
        if (maxMultibulkLength <= 0) {
            Log.warn("Ignoring maxMultibulkLength=" + maxMultibulkLength + ": must be positive");
            maxMultibulkLength = defaults.maxMultibulkLength;
        }
        return this;
    }

    /**
     * Applies the MNEMO_PORT override, if set.
     */
    public Config withEnvironment(Map<String, String> env) {
        String port = env.get("MNEMO_PORT");
        if (port != null && !port.isBlank()) {
            try {
                this.port = Integer.parseInt(port.trim());
            } catch (NumberFormatException e) {
                Log.warn("Ignoring MNEMO_PORT=" + port + ": not a number");
            }
        }
        return this;
    }

    static Config loadLegacy(File f, Config config) {
        try (BufferedReader br = new BufferedReader(new FileReader(f))) {
            String line;
            int lineNo = 0;
            while ((line = br.readLine()) != null) {
                lineNo++;
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] parts = line.split("\\s+", 2);
                if (parts.length < 2) continue;

                String key = parts[0].toLowerCase(Locale.ROOT);
                String val = parts[1].trim();

                try {
                    switch (key) {
                        case "port": config.port = Integer.parseInt(val); break;
                        case "bind": config.bind = val; break;
                        case "worker-threads": config.workerThreads = Integer.parseInt(val); break;
                        case "proto-max-bulk-len": config.maxBulkLength = parseMemory(val); break;
                        case "proto-max-inline-len": config.maxInlineLength = Math.toIntExact(parseMemory(val)); break;
                        case "proto-max-multibulk-len": config.maxMultibulkLength = Integer.parseInt(val); break;
                        case "loglevel": config.logLevel = val; break;
                        default:
                            Log.warn("Unknown config directive '" + key + "' at line " + lineNo);
                    }
                } catch (NumberFormatException | ArithmeticException e) {
                    Log.warn("Bad value for '" + key + "' at line " + lineNo + ": " + val);
                }
            }
            Log.info("Loaded legacy config.");
        } catch (IOException e) {
            Log.error("Error loading legacy config: " + e.getMessage());
        }
        return config;
    }

    static long parseMemory(String val) {
        val = val.toUpperCase(Locale.ROOT);
        long factor = 1;
        if (val.endsWith("GB")) { factor = 1024 * 1024 * 1024L; val = val.substring(0, val.length() - 2); }
        else if (val.endsWith("MB")) { factor = 1024 * 1024L; val = val.substring(0, val.length() - 2); }
        else if (val.endsWith("KB")) { factor = 1024L; val = val.substring(0, val.length() - 2); }
        return Long.parseLong(val.trim()) * factor;
    }
}
