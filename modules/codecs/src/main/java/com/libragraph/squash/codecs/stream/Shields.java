package com.libragraph.squash.codecs.stream;

import java.io.FilterInputStream;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Wrappers that keep a codec stream from closing an endpoint it does not own.
 */
final class Shields {

    private Shields() {
    }

    static OutputStream noClose(OutputStream out) {
        return new FilterOutputStream(out) {
            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                out.write(b, off, len);
            }

            @Override
            public void close() throws IOException {
                flush();
            }
        };
    }

    static InputStream noClose(InputStream in) {
        return new FilterInputStream(in) {
            @Override
            public void close() {
                // endpoint belongs to the caller
            }
        };
    }
}
