package org.sensorvault.storage.compression;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Stream compression used for sealed device file segments.
 */
public interface ICompressionCodec {

    /**
     * Returns the codec name as used in configuration ({@code "gzip"}, {@code "none"}).
     */
    String getName();

    /**
     * Returns the file extension appended to compressed files, including the dot, or an empty
     * string for uncompressed files.
     */
    String getFileExtension();

    /**
     * Wraps a raw output stream so that everything written to the returned stream is compressed.
     * Closing the returned stream finishes the compressed data and closes {@code out}.
     *
     * @param out destination stream
     * @return compressing stream
     * @throws IOException if the stream header cannot be written
     */
    OutputStream wrapOutputStream(OutputStream out) throws IOException;

    /**
     * Wraps a raw input stream of compressed data.
     *
     * @param in compressed source
     * @return decompressing stream
     * @throws IOException if the stream header is invalid
     */
    InputStream wrapInputStream(InputStream in) throws IOException;
}
