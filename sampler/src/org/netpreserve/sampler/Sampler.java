package org.netpreserve.sampler;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.sampler.archive.ArchiveHttpClient;
import org.netpreserve.sampler.config.ConfigException;
import org.netpreserve.sampler.config.SamplerConfig;
import org.netpreserve.sampler.output.WriteException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class Sampler {
    private static final org.slf4j.Logger log = LoggerFactory.getLogger(Sampler.class);
    static final int EXIT_OK = 0;
    static final int EXIT_INTERRUPTED = 1;
    static final int EXIT_CONFIG_ERROR = 2;
    static final int EXIT_WRITE_ERROR = 3;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        Options options;
        SamplerConfig config;
        List<UrlTask> tasks = List.of();
        try {
            options = Options.parse(args);
            if (options.help) {
                printUsage();
                return EXIT_OK;
            }
            if (options.traceHttp != null) startHttpTraceFile(options.traceHttp);
            config = loadConfig(options.configFile, options.overrides);
            if (options.dumpConfig) {
                System.out.println(yamlMapper().writeValueAsString(config));
                return EXIT_OK;
            }
            if (!options.fromCache) {
                if (options.inputPath == null) throw new ConfigException("--input-path is required");
                tasks = readInput(options.inputPath, config);
            }
        } catch (ConfigException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println("Try --help for usage.");
            return EXIT_CONFIG_ERROR;
        } catch (JsonProcessingException e) {
            System.err.println("Error: failed to print config: " + e.getOriginalMessage());
            return EXIT_CONFIG_ERROR;
        }

        SamplingJob job;
        try {
            job = new SamplingJob(config);
        } catch (IOException e) {
            System.err.println("Error: failed to prepare output: " + e.getMessage());
            return EXIT_WRITE_ERROR;
        }
        Thread shutdownHook = new Thread(() -> {
            try {
                job.close();
            } catch (Exception e) {
                System.err.println("Error shutting down: " + e.getMessage());
                e.printStackTrace(System.err);
            }
        }, "shutdown-hook");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        try {
            RunSummary summary = options.fromCache ? job.exportCache() : job.run(tasks);
            System.out.println(summary.describe());
            return EXIT_OK;
        } catch (WriteException e) {
            log.error("Run aborted", e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_WRITE_ERROR;
        } catch (IOException e) {
            log.error("Failed to read snapshot cache", e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_WRITE_ERROR;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Interrupted");
            return EXIT_INTERRUPTED;
        } finally {
            job.close();
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                log.debug("Shutdown already in progress");
            }
        }
    }

    private static List<UrlTask> readInput(Path inputPath, SamplerConfig config) throws ConfigException {
        if (!Files.isReadable(inputPath)) throw new ConfigException("Cannot read input file " + inputPath);
        List<UrlTask> tasks;
        try {
            tasks = UrlListReader.read(inputPath, config.siteType());
        } catch (IOException e) {
            throw new ConfigException("Cannot read input file " + inputPath + ": " + e.getMessage(), e);
        }
        if (tasks.isEmpty()) log.warn("No URLs found in {}", inputPath);
        return tasks;
    }

    static ObjectMapper yamlMapper() {
        return new ObjectMapper(new YAMLFactory())
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Builds the effective config from the built-in defaults, an optional YAML file and command-line overrides,
     * in increasing order of precedence.
     */
    static SamplerConfig loadConfig(@Nullable Path configFile, JsonNode overrides) throws ConfigException {
        var mapper = yamlMapper();
        JsonNode configTree;
        try (InputStream defaults = Sampler.class.getResourceAsStream("config/defaults.yaml")) {
            if (defaults == null) throw new ConfigException("Built-in config/defaults.yaml is missing");
            configTree = mapper.readTree(defaults);
        } catch (IOException e) {
            throw new ConfigException("Failed to read built-in defaults: " + e.getMessage(), e);
        }
        if (configFile != null) {
            if (!Files.exists(configFile)) throw new ConfigException("Config file not found: " + configFile);
            try {
                configTree = deepMerge(configTree, mapper.readTree(configFile.toFile()));
            } catch (IOException e) {
                throw new ConfigException("Failed to read config file " + configFile + ": " + e.getMessage(), e);
            }
        }
        configTree = deepMerge(configTree, overrides);
        try {
            return mapper.treeToValue(configTree, SamplerConfig.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ConfigException("Invalid configuration: " + describe(e), e);
        }
    }

    private static String describe(Exception e) {
        for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof IllegalArgumentException || cause instanceof IOException) return cause.getMessage();
        }
        return e instanceof JsonProcessingException jpe ? jpe.getOriginalMessage() : e.getMessage();
    }

    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (!base.isObject() || !override.isObject()) {
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            JsonNode baseValue = merged.get(key);
            merged.set(key, baseValue == null ? entry.getValue() : deepMerge(baseValue, entry.getValue()));
        });
        return merged;
    }

    /**
     * Writes a trace of every archive request to a separate file. The console keeps the level it had before.
     */
    static void startHttpTraceFile(Path file) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        var encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %msg%n");
        encoder.start();

        var fileAppender = new FileAppender<ILoggingEvent>();
        fileAppender.setContext(context);
        fileAppender.setEncoder(encoder);
        fileAppender.setName("http-trace-file");
        fileAppender.setFile(file.toString());
        fileAppender.start();

        var logger = (Logger) LoggerFactory.getLogger(ArchiveHttpClient.class);
        logger.addAppender(fileAppender);
        if (logger.getEffectiveLevel().toInteger() != Level.TRACE_INT) {
            ThresholdFilter filter = new ThresholdFilter();
            filter.setLevel(logger.getEffectiveLevel().toString());
            filter.start();
            var stdoutAppender = context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender("STDOUT");
            if (stdoutAppender != null) {
                stdoutAppender.stop();
                stdoutAppender.addFilter(filter);
                stdoutAppender.start();
            }
            logger.setLevel(Level.TRACE);
        }
    }

    private static void printUsage() {
        System.out.println("Usage: sampler [options] --input-path FILE");
        System.out.println("Options:");
        System.out.println("  -h, --help");
        System.out.println("  -i, --input-path FILE        CSV or text file of URLs to sample");
        System.out.println("  -c, --config FILE            YAML config merged over the built-in defaults");
        System.out.println("  -o, --output-json-path FILE  Base path of the JSON output chunks");
        System.out.println("      --start-date YYYYMMDD    First day of the sampling range");
        System.out.println("      --end-date YYYYMMDD      Last day of the sampling range");
        System.out.println("      --frequency FREQ         daily, monthly or annually");
        System.out.println("      --site-type TYPE         tos, robots or main");
        System.out.println("  -w, --num-workers N          Number of URLs processed concurrently");
        System.out.println("      --snapshots-path DIR     Snapshot cache directory");
        System.out.println("      --stats-path DIR         Directory for change-rate records");
        System.out.println("      --failure-log FILE       Log of failed requests");
        System.out.println("      --max-chunk-size MB      Approximate size of each output chunk");
        System.out.println("      --count-changes          Count content changes per URL");
        System.out.println("      --save-snapshots         Keep raw snapshots in the snapshot cache");
        System.out.println("      --process-to-json        Write snapshot content to the JSON output");
        System.out.println("      --from-cache             Build the JSON output from the snapshot cache only");
        System.out.println("      --trace-http FILE        Write a trace of archive requests to FILE");
        System.out.println("      --dump-config            Print the effective config and exit");
    }

    static class Options {
        final ObjectNode overrides = JsonNodeFactory.instance.objectNode();
        @Nullable Path inputPath;
        @Nullable Path configFile;
        @Nullable Path traceHttp;
        boolean dumpConfig;
        boolean fromCache;
        boolean help;

        static Options parse(String[] args) throws ConfigException {
            var options = new Options();
            ObjectNode overrides = options.overrides;
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--help", "-h" -> options.help = true;
                    case "--dump-config" -> options.dumpConfig = true;
                    case "--input-path", "-i" -> options.inputPath = Path.of(value(args, ++i, arg));
                    case "--config", "-c" -> options.configFile = Path.of(value(args, ++i, arg));
                    case "--trace-http" -> options.traceHttp = Path.of(value(args, ++i, arg));
                    case "--output-json-path", "-o" -> section(overrides, "output").put("jsonPath", value(args, ++i, arg));
                    case "--start-date" -> overrides.put("startDate", value(args, ++i, arg));
                    case "--end-date" -> overrides.put("endDate", value(args, ++i, arg));
                    case "--frequency" -> overrides.put("frequency", value(args, ++i, arg));
                    case "--site-type" -> overrides.put("siteType", value(args, ++i, arg));
                    case "--num-workers", "-w" -> overrides.put("workers", intValue(args, ++i, arg));
                    case "--snapshots-path" -> section(overrides, "output").put("snapshotsPath", value(args, ++i, arg));
                    case "--stats-path" -> section(overrides, "output").put("statsPath", value(args, ++i, arg));
                    case "--failure-log" -> section(overrides, "output").put("failureLog", value(args, ++i, arg));
                    case "--max-chunk-size" -> {
                        int megabytes = intValue(args, ++i, arg);
                        if (megabytes <= 0) throw new ConfigException(arg + " must be positive");
                        section(overrides, "output").put("chunkSize", megabytes + "MB");
                    }
                    case "--count-changes" -> overrides.put("countChanges", true);
                    case "--save-snapshots" -> overrides.put("saveSnapshots", true);
                    case "--process-to-json" -> overrides.put("processToJson", true);
                    case "--from-cache" -> {
                        options.fromCache = true;
                        overrides.put("processToJson", true);
                    }
                    default -> throw new ConfigException("Unknown option: " + arg);
                }
            }
            return options;
        }

        private static ObjectNode section(ObjectNode root, String name) {
            JsonNode node = root.get(name);
            return node instanceof ObjectNode objectNode ? objectNode : root.putObject(name);
        }

        private static String value(String[] args, int i, String option) throws ConfigException {
            if (i >= args.length) throw new ConfigException(option + " requires a value");
            return args[i];
        }

        private static int intValue(String[] args, int i, String option) throws ConfigException {
            String value = value(args, i, option);
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new ConfigException(option + " expects a number, got: " + value);
            }
        }
    }
}
