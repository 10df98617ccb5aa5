package org.sensorvault.storage.compression;

import com.typesafe.config.Config;

/**
 * Creates compression codecs from configuration and detects them from file names.
 * <p>
 * Configuration:
 * <pre>
 * compression {
 *   enabled = true
 *   codec = "gzip"
 *   level = 6
 * }
 * </pre>
 */
public final class CompressionCodecFactory {

    private static final NoneCodec NONE = new NoneCodec();
    private static final GzipCodec GZIP = new GzipCodec();

    private CompressionCodecFactory() {
    }

    /**
     * Creates the codec described by the {@code compression} block of the given options.
     * Missing block or {@code enabled = false} yields the pass-through codec.
     *
     * @param options storage options
     * @return configured codec
     * @throws IllegalArgumentException for an unknown codec name
     */
    public static ICompressionCodec create(Config options) {
        if (!options.hasPath("compression")) {
            return NONE;
        }
        Config compression = options.getConfig("compression");
        if (compression.hasPath("enabled") && !compression.getBoolean("enabled")) {
            return NONE;
        }
        String codec = compression.hasPath("codec") ? compression.getString("codec") : "gzip";
        switch (codec.toLowerCase()) {
            case "gzip":
                return compression.hasPath("level") ? new GzipCodec(compression.getInt("level")) : GZIP;
            case "none":
                return NONE;
            default:
                throw new IllegalArgumentException("Unknown compression codec: " + codec);
        }
    }

    /**
     * Returns the codec that can read a file, judged by its extension.
     *
     * @param fileName file name or path
     * @return gzip codec for {@code .gz} files, the pass-through codec otherwise
     */
    public static ICompressionCodec detectFromExtension(String fileName) {
        if (fileName.endsWith(GZIP.getFileExtension())) {
            return GZIP;
        }
        return NONE;
    }
}
