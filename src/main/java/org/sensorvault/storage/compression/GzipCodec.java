package org.sensorvault.storage.compression;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.zip.Deflater;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Gzip codec. Files carry the {@code .gz} extension.
 */
public class GzipCodec implements ICompressionCodec {

    private static final int BUFFER_SIZE = 64 * 1024;

    private final int level;

    public GzipCodec() {
        this(Deflater.DEFAULT_COMPRESSION);
    }

    /**
     * @param level deflate level 1-9, or -1 for the library default
     */
    public GzipCodec(int level) {
        if (level != Deflater.DEFAULT_COMPRESSION && (level < Deflater.BEST_SPEED || level > Deflater.BEST_COMPRESSION)) {
            throw new IllegalArgumentException("gzip level must be between 1 and 9 (or -1), got " + level);
        }
        this.level = level;
    }

    @Override
    public String getName() {
        return "gzip";
    }

    @Override
    public String getFileExtension() {
        return ".gz";
    }

    public int getLevel() {
        return level;
    }

    @Override
    public OutputStream wrapOutputStream(OutputStream out) throws IOException {
        return new GZIPOutputStream(out, BUFFER_SIZE) {
            {
                def.setLevel(level);
            }
        };
    }

    @Override
    public InputStream wrapInputStream(InputStream in) throws IOException {
        return new GZIPInputStream(in, BUFFER_SIZE);
    }
}
