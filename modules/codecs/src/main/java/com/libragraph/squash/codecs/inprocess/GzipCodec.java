package com.libragraph.squash.codecs.inprocess;

import com.libragraph.squash.types.CodecKind;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipParameters;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * GZIP (.gz) via Apache Commons Compress.
 */
public class GzipCodec implements InProcessCodec {

    @Override
    public CodecKind codecKind() {
        return CodecKind.GZIP;
    }

    @Override
    public OutputStream encoder(OutputStream sink, int level) throws IOException {
        GzipParameters parameters = new GzipParameters();
        parameters.setCompressionLevel(level);
        return new GzipCompressorOutputStream(sink, parameters);
    }

    @Override
    public InputStream decoder(InputStream source) throws IOException {
        return new GzipCompressorInputStream(source, true);
    }
}
