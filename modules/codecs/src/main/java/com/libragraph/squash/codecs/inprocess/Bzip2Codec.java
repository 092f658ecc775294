package com.libragraph.squash.codecs.inprocess;

import com.libragraph.squash.types.CodecKind;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorOutputStream;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * BZIP2 (.bz2) via Apache Commons Compress.
 * The compression level is the block size in units of 100k, as with {@code bzip2 -1..-9}.
 */
public class Bzip2Codec implements InProcessCodec {

    @Override
    public CodecKind codecKind() {
        return CodecKind.BZIP2;
    }

    @Override
    public OutputStream encoder(OutputStream sink, int level) throws IOException {
        return new BZip2CompressorOutputStream(sink, level);
    }

    @Override
    public InputStream decoder(InputStream source) throws IOException {
        return new BZip2CompressorInputStream(source, true);
    }
}
