package org.sensorvault.storage.compression;

import java.io.InputStream;
import java.io.OutputStream;

/**
 * Pass-through codec for uncompressed files.
 */
public class NoneCodec implements ICompressionCodec {

    @Override
    public String getName() {
        return "none";
    }

    @Override
    public String getFileExtension() {
        return "";
    }

    @Override
    public OutputStream wrapOutputStream(OutputStream out) {
        return out;
    }

    @Override
    public InputStream wrapInputStream(InputStream in) {
        return in;
    }
}
