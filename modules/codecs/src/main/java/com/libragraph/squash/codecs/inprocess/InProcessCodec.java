package com.libragraph.squash.codecs.inprocess;

import com.libragraph.squash.codecs.api.CodecDescriptor;
import com.libragraph.squash.codecs.api.ParallelDecode;
import com.libragraph.squash.types.CodecKind;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * A codec implemented inside the JVM, used when no external tool is installed.
 *
 * <p>In-process codecs are single-threaded and rank below every external tool.
 */
public interface InProcessCodec {

    CodecKind codecKind();

    /**
     * Wraps {@code sink} in an encoder. Closing the encoder finishes the stream
     * and closes {@code sink}.
     *
     * @param level compression level, already validated against {@link CodecKind#checkLevel(int)}
     */
    OutputStream encoder(OutputStream sink, int level) throws IOException;

    /**
     * Wraps {@code source} in a decoder that yields the plain bytes.
     * Concatenated streams are decoded as one, like the command-line tools do.
     */
    InputStream decoder(InputStream source) throws IOException;

    default CodecDescriptor descriptor() {
        return new CodecDescriptor(codecKind(), "in-process:" + codecKind().label(), null,
                ParallelDecode.NONE, false, false, CodecDescriptor.PRIORITY_IN_PROCESS);
    }
}
