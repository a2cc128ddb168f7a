package ch.so.agi.gretlreclass;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

import ch.so.agi.gretlreclass.logging.Level;
import ch.so.agi.gretlreclass.logging.LogEnvironment;
import ch.so.agi.gretlreclass.logging.ReclassLogger;
import ch.so.agi.gretlreclass.utils.ReclassifyException;

/**
 * Immutable engine configuration.
 * <p>
 * {@link #load()} reads {@value #RESOURCE} from the classpath and lets system
 * properties prefixed with {@value #PROPERTY_PREFIX} override single keys, e.g.
 * {@code -Dgretl.reclassify.block.height=512}. Missing keys keep their defaults.
 * </p>
 */
public final class ReclassifySettings {

    public static final String RESOURCE = "gretl-reclassify.properties";
    public static final String PROPERTY_PREFIX = "gretl.reclassify.";

    public static final int DEFAULT_BLOCK_HEIGHT = 256;
    public static final long DEFAULT_BLOCK_MAX_PIXELS = 4L * 1024 * 1024;
    public static final String DEFAULT_OUTPUT_COLUMN = "reclass";
    public static final String DEFAULT_COMPRESSION = "Deflate";
    public static final String NO_COMPRESSION = "none";
    public static final Duration DEFAULT_ENUMERATE_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_SUBMIT_TIMEOUT = Duration.ofSeconds(120);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(5);

    static final String BLOCK_HEIGHT = "block.height";
    static final String BLOCK_MAX_PIXELS = "block.max.pixels";
    static final String OUTPUT_COLUMN = "output.column";
    static final String OUTPUT_COMPRESSION = "output.compression";
    static final String ENUMERATE_TIMEOUT = "remote.enumerate.timeout.seconds";
    static final String SUBMIT_TIMEOUT = "remote.submit.timeout.seconds";
    static final String POLL_INTERVAL = "remote.poll.interval.seconds";
    static final String STRICT = "strict";
    static final String AOI_ENFORCE = "aoi.enforce";
    static final String LOG_LEVEL = "log.level";

    private final int blockHeight;
    private final long blockMaxPixels;
    private final String outputColumn;
    private final String compression;
    private final Duration enumerateTimeout;
    private final Duration submitTimeout;
    private final Duration pollInterval;
    private final boolean strict;
    private final boolean enforceAreaOfInterest;
    private final Level logLevel;

    private ReclassifySettings(Builder b) {
        if (b.blockHeight < 1) {
            throw new IllegalArgumentException(BLOCK_HEIGHT + " must be positive: " + b.blockHeight);
        }
        if (b.blockMaxPixels < 1) {
            throw new IllegalArgumentException(BLOCK_MAX_PIXELS + " must be positive: " + b.blockMaxPixels);
        }
        if (b.outputColumn == null || b.outputColumn.isBlank()) {
            throw new IllegalArgumentException(OUTPUT_COLUMN + " must not be blank");
        }
        this.blockHeight = b.blockHeight;
        this.blockMaxPixels = b.blockMaxPixels;
        this.outputColumn = b.outputColumn.trim();
        this.compression = b.compression;
        this.enumerateTimeout = b.enumerateTimeout;
        this.submitTimeout = b.submitTimeout;
        this.pollInterval = b.pollInterval;
        this.strict = b.strict;
        this.enforceAreaOfInterest = b.enforceAreaOfInterest;
        this.logLevel = b.logLevel;
    }

    public static ReclassifySettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Settings from the classpath resource (if present) overridden by system properties.
     */
    public static ReclassifySettings load() {
        Properties properties = new Properties();
        try (InputStream in = ReclassifySettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new ReclassifyException("Could not load configuration properties " + RESOURCE, e);
        }
        return fromProperties(properties, System.getProperties());
    }

    /**
     * @param properties base configuration with unprefixed keys
     * @param overrides  entries whose keys start with {@value #PROPERTY_PREFIX} replace base keys
     */
    public static ReclassifySettings fromProperties(Properties properties, Map<?, ?> overrides) {
        ReclassLogger log = LogEnvironment.getLogger(ReclassifySettings.class);
        Properties merged = new Properties();
        merged.putAll(properties);
        for (Map.Entry<?, ?> entry : overrides.entrySet()) {
            String key = String.valueOf(entry.getKey()).toLowerCase(Locale.ROOT);
            if (key.startsWith(PROPERTY_PREFIX)) {
                key = key.substring(PROPERTY_PREFIX.length());
                String value = String.valueOf(entry.getValue());
                log.info("Setting configuration key " + key + " to '" + value + "' from system properties");
                merged.setProperty(key, value);
            }
        }

        Builder b = builder();
        b.blockHeight(intProp(merged, BLOCK_HEIGHT, DEFAULT_BLOCK_HEIGHT));
        b.blockMaxPixels(longProp(merged, BLOCK_MAX_PIXELS, DEFAULT_BLOCK_MAX_PIXELS));
        b.outputColumn(merged.getProperty(OUTPUT_COLUMN, DEFAULT_OUTPUT_COLUMN));
        b.compression(merged.getProperty(OUTPUT_COMPRESSION, DEFAULT_COMPRESSION));
        b.enumerateTimeout(Duration.ofSeconds(longProp(merged, ENUMERATE_TIMEOUT, DEFAULT_ENUMERATE_TIMEOUT.toSeconds())));
        b.submitTimeout(Duration.ofSeconds(longProp(merged, SUBMIT_TIMEOUT, DEFAULT_SUBMIT_TIMEOUT.toSeconds())));
        b.pollInterval(Duration.ofSeconds(longProp(merged, POLL_INTERVAL, DEFAULT_POLL_INTERVAL.toSeconds())));
        b.strict(boolProp(merged, STRICT));
        b.enforceAreaOfInterest(boolProp(merged, AOI_ENFORCE));
        String level = merged.getProperty(LOG_LEVEL);
        if (level != null) {
            b.logLevel(Level.parse(level));
        }
        return b.build();
    }

    private static int intProp(Properties p, String key, int fallback) {
        long value = longProp(p, key, fallback);
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw new IllegalArgumentException("Value of configuration option '" + key + "' is out of range: " + value);
        }
        return (int) value;
    }

    private static long longProp(Properties p, String key, long fallback) {
        String value = p.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Value of configuration option '" + key + "' could not be parsed as an integer: " + value, e);
        }
    }

    private static boolean boolProp(Properties p, String key) {
        String value = p.getProperty(key);
        if (value == null || value.isBlank()) {
            return false;
        }
        String v = value.trim();
        if ("true".equalsIgnoreCase(v) || "yes".equalsIgnoreCase(v)) {
            return true;
        } else if ("false".equalsIgnoreCase(v) || "no".equalsIgnoreCase(v)) {
            return false;
        }
        throw new IllegalArgumentException("Value of configuration option '" + key + "' could not be parsed as a boolean: " + value);
    }

    public int getBlockHeight() {
        return blockHeight;
    }

    public long getBlockMaxPixels() {
        return blockMaxPixels;
    }

    public String getOutputColumn() {
        return outputColumn;
    }

    /**
     * @return TIFF compression type name, or {@code null} for uncompressed output
     */
    public String getCompression() {
        return compression == null || NO_COMPRESSION.equalsIgnoreCase(compression) ? null : compression;
    }

    public Duration getEnumerateTimeout() {
        return enumerateTimeout;
    }

    public Duration getSubmitTimeout() {
        return submitTimeout;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * @return {@code true} if every run and enumeration must name an area of interest
     */
    public boolean isEnforceAreaOfInterest() {
        return enforceAreaOfInterest;
    }

    public Level getLogLevel() {
        return logLevel;
    }

    public Builder toBuilder() {
        return builder().blockHeight(blockHeight).blockMaxPixels(blockMaxPixels).outputColumn(outputColumn)
                .compression(compression).enumerateTimeout(enumerateTimeout).submitTimeout(submitTimeout)
                .pollInterval(pollInterval).strict(strict).enforceAreaOfInterest(enforceAreaOfInterest)
                .logLevel(logLevel);
    }

    @Override
    public String toString() {
        return "ReclassifySettings{blockHeight=" + blockHeight + ", blockMaxPixels=" + blockMaxPixels
                + ", outputColumn=" + outputColumn + ", compression=" + compression + ", enumerateTimeout="
                + enumerateTimeout + ", submitTimeout=" + submitTimeout + ", pollInterval=" + pollInterval
                + ", strict=" + strict + ", enforceAreaOfInterest=" + enforceAreaOfInterest + ", logLevel="
                + logLevel + "}";
    }

    public static final class Builder {
        private int blockHeight = DEFAULT_BLOCK_HEIGHT;
        private long blockMaxPixels = DEFAULT_BLOCK_MAX_PIXELS;
        private String outputColumn = DEFAULT_OUTPUT_COLUMN;
        private String compression = DEFAULT_COMPRESSION;
        private Duration enumerateTimeout = DEFAULT_ENUMERATE_TIMEOUT;
        private Duration submitTimeout = DEFAULT_SUBMIT_TIMEOUT;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private boolean strict = false;
        private boolean enforceAreaOfInterest = false;
        private Level logLevel = Level.LIFECYCLE;

        private Builder() {}

        public Builder blockHeight(int blockHeight) {
            this.blockHeight = blockHeight;
            return this;
        }

        public Builder blockMaxPixels(long blockMaxPixels) {
            this.blockMaxPixels = blockMaxPixels;
            return this;
        }

        public Builder outputColumn(String outputColumn) {
            this.outputColumn = outputColumn;
            return this;
        }

        public Builder compression(String compression) {
            this.compression = compression;
            return this;
        }

        public Builder enumerateTimeout(Duration enumerateTimeout) {
            this.enumerateTimeout = enumerateTimeout;
            return this;
        }

        public Builder submitTimeout(Duration submitTimeout) {
            this.submitTimeout = submitTimeout;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder enforceAreaOfInterest(boolean enforceAreaOfInterest) {
            this.enforceAreaOfInterest = enforceAreaOfInterest;
            return this;
        }

        public Builder logLevel(Level logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public ReclassifySettings build() {
            return new ReclassifySettings(this);
        }
    }
}
