package org.carball.xtd.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Slf4j
public class ConfigurationLoader {

    static final String ENV_MAX_COLUMNS = "XTD_ETC";
    static final String ENV_HEADER = "XTD_HEADER";

    private static final Set<String> VALUE_OPTIONS = Set.of(
            "--input", "--output", "--header", "--etc", "--isvalid", "--config");
    private static final Set<Character> FLAG_OPTIONS = Set.of('a', 'b', 'g');

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > config file > defaults
     *
     * @throws IllegalArgumentException if an argument is unknown, repeated or malformed
     * @throws IOException              if the configuration file cannot be read
     */
    public XtdConfig loadConfiguration(String[] args) throws IOException {
        log.debug("Loading configuration");
        Map<String, String> options = parseOptions(args);

        XtdConfig config = XtdConfig.defaults();

        // 1. Apply configuration file
        if (options.containsKey("--config")) {
            applyConfigFile(config, Paths.get(options.get("--config")));
        }

        // 2. Apply environment variables
        applyEnvironmentVariables(config);

        // 3. Apply CLI arguments (highest priority)
        applyCLIArguments(config, options);

        if (config.getMaxColumnsThreshold() != null && config.getFinalizationMode() == FinalizationMode.DEFAULT) {
            config.setFinalizationMode(FinalizationMode.MAX_COLUMNS);
        }
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    /**
     * Whether the arguments ask for the usage text.
     *
     * @throws IllegalArgumentException if the arguments are malformed or combine
     *                                  {@code --help} with other options
     */
    public boolean isHelpRequested(String[] args) {
        return parseOptions(args).containsKey("--help");
    }

    /**
     * Splits the arguments into options and their values. Value options accept both
     * {@code --name=value} and {@code --name value}; short flags may be combined.
     */
    Map<String, String> parseOptions(String[] args) {
        Map<String, String> options = new LinkedHashMap<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];

            if (arg.equals("--help")) {
                putOnce(options, arg, null);
            } else if (arg.startsWith("--")) {
                int separator = arg.indexOf('=');
                String name = separator < 0 ? arg : arg.substring(0, separator);
                if (!VALUE_OPTIONS.contains(name)) {
                    throw new IllegalArgumentException("Unknown option: " + name);
                }
                String value;
                if (separator >= 0) {
                    value = arg.substring(separator + 1);
                } else if (i + 1 < args.length) {
                    value = args[++i];
                } else {
                    throw new IllegalArgumentException("Value for " + name + " not specified");
                }
                putOnce(options, name, value);
            } else if (arg.startsWith("-") && arg.length() > 1) {
                for (char flag : arg.substring(1).toCharArray()) {
                    if (!FLAG_OPTIONS.contains(flag)) {
                        throw new IllegalArgumentException("Unknown option: -" + flag);
                    }
                    putOnce(options, "-" + flag, null);
                }
            } else {
                throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        if (options.containsKey("--help") && options.size() > 1) {
            throw new IllegalArgumentException("--help cannot be combined with other options");
        }
        return options;
    }

    private static void putOnce(Map<String, String> options, String name, String value) {
        if (options.containsKey(name)) {
            throw new IllegalArgumentException("Duplicate argument " + name);
        }
        options.put(name, value);
    }

    private void applyConfigFile(XtdConfig config, Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            throw new IllegalArgumentException("Configuration file not found: " + configPath);
        }

        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        ConfigFile file = Files.size(configPath) == 0
                ? null
                : mapper.readValue(configPath.toFile(), ConfigFile.class);
        if (file == null) {
            log.warn("Configuration file {} is empty, ignoring it", configPath);
            return;
        }

        if (Boolean.TRUE.equals(file.getDuplicateKeys())) {
            config.setFinalizationMode(FinalizationMode.DUPLICATE_KEYS);
        }
        if (file.getMaxColumns() != null) {
            config.setMaxColumnsThreshold(file.getMaxColumns());
        }
        if (file.getSkipColumns() != null) {
            config.setSkipColumns(file.getSkipColumns());
        }
        if (file.getHeader() != null) {
            config.setHeader(file.getHeader());
        }
        if (Boolean.TRUE.equals(file.getRelations())) {
            config.setOutputFormat(OutputFormat.RELATIONS);
        }
        log.info("Loaded configuration file: {}", configPath);
    }

    private void applyEnvironmentVariables(XtdConfig config) {
        if (environment.containsKey(ENV_MAX_COLUMNS)) {
            config.setMaxColumnsThreshold(parseThreshold(environment.get(ENV_MAX_COLUMNS), ENV_MAX_COLUMNS));
            if (config.getFinalizationMode() == FinalizationMode.DUPLICATE_KEYS) {
                log.info("{} overrides duplicate keys from the configuration file", ENV_MAX_COLUMNS);
                config.setFinalizationMode(FinalizationMode.DEFAULT);
            }
        }
        if (environment.containsKey(ENV_HEADER)) {
            config.setHeader(environment.get(ENV_HEADER));
        }
    }

    private void applyCLIArguments(XtdConfig config, Map<String, String> options) {
        for (Map.Entry<String, String> entry : options.entrySet()) {
            String option = entry.getKey();
            String value = entry.getValue();
            switch (option) {
                case "--input":
                    config.setInputFile(Paths.get(value));
                    break;
                case "--output":
                    config.setOutputFile(Paths.get(value));
                    break;
                case "--header":
                    config.setHeader(value);
                    break;
                case "--etc":
                    config.setMaxColumnsThreshold(parseThreshold(value, option));
                    break;
                case "--isvalid":
                    config.setValidationFile(Paths.get(value));
                    break;
                case "-a":
                    config.setSkipColumns(true);
                    break;
                case "-b":
                    config.setFinalizationMode(FinalizationMode.DUPLICATE_KEYS);
                    break;
                case "-g":
                    config.setOutputFormat(OutputFormat.RELATIONS);
                    break;
                default:
                    // --config and --help are handled elsewhere
                    break;
            }
        }

        // -b and --etc replace each other when inherited from a lower-priority source
        boolean duplicateKeys = options.containsKey("-b");
        boolean threshold = options.containsKey("--etc");
        if (duplicateKeys && !threshold) {
            config.setMaxColumnsThreshold(null);
        }
        if (threshold && !duplicateKeys && config.getFinalizationMode() == FinalizationMode.DUPLICATE_KEYS) {
            config.setFinalizationMode(FinalizationMode.DEFAULT);
        }
    }

    private static int parseThreshold(String value, String source) {
        int threshold;
        try {
            threshold = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Please enter an integer value for " + source + ": " + value);
        }
        if (threshold < 0) {
            throw new IllegalArgumentException("Negative value for " + source + ": " + threshold);
        }
        return threshold;
    }

    public static String getUsage() {
        return """
            Usage: java -jar xtd.jar [options]

            Options:
              --help              Print this help
              --input=FILE        Input XML file, UTF-8 (default: stdin)
              --output=FILE       Output file, UTF-8 (default: stdout)
              --header=TEXT       Header written as a comment on the first line
              --etc=NUM           Use at most NUM foreign key columns per child element
              --isvalid=FILE      Fail unless FILE can be stored in the inferred schema
              --config=FILE       YAML file with default options
              -a                  Do not generate columns from attributes
              -b                  One key per relation, placed on the child (not with --etc)
              -g                  Print table relations as XML instead of DDL

            Environment Variables:
              XTD_ETC             Same as --etc
              XTD_HEADER          Same as --header

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Configuration file
              4. Built-in defaults
            """;
    }
}
