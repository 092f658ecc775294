package com.libragraph.squash.chksum.engine;

import com.libragraph.squash.chksum.api.ChecksumComputationFailedException;
import com.libragraph.squash.chksum.api.DigestDescriptor;
import com.libragraph.squash.chksum.api.Digester;
import com.libragraph.squash.types.DigestKind;
import com.libragraph.squash.util.DigestValue;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * One pass over a source feeding one or more digesters.
 * Failures surface as {@link ChecksumComputationFailedException} naming the kind involved.
 */
final class DigestTask implements Callable<Map<DigestKind, DigestValue>> {

    private final ChecksumSource source;
    private final List<DigestDescriptor> descriptors;
    private final int bufferSize;

    DigestTask(ChecksumSource source, List<DigestDescriptor> descriptors, int bufferSize) {
        this.source = source;
        this.descriptors = List.copyOf(descriptors);
        this.bufferSize = bufferSize;
    }

    /** Kind reported when the failure is not tied to a single digester. */
    DigestKind primaryKind() {
        return descriptors.get(0).digestKind();
    }

    @Override
    public Map<DigestKind, DigestValue> call() {
        List<Digester> digesters = new ArrayList<>(descriptors.size());
        for (DigestDescriptor d : descriptors) {
            try {
                digesters.add(d.newDigester());
            } catch (RuntimeException e) {
                throw new ChecksumComputationFailedException(d.digestKind(), e);
            }
        }

        try (InputStream in = source.open()) {
            byte[] buf = new byte[bufferSize];
            int n;
            while ((n = in.read(buf)) != -1) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedIOException("Checksum task cancelled");
                }
                for (int i = 0; i < digesters.size(); i++) {
                    try {
                        digesters.get(i).update(buf, 0, n);
                    } catch (RuntimeException e) {
                        throw new ChecksumComputationFailedException(descriptors.get(i).digestKind(), e);
                    }
                }
            }
        } catch (ChecksumComputationFailedException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new ChecksumComputationFailedException(primaryKind(), e);
        }

        Map<DigestKind, DigestValue> values = new EnumMap<>(DigestKind.class);
        for (int i = 0; i < digesters.size(); i++) {
            try {
                values.put(descriptors.get(i).digestKind(), digesters.get(i).digest());
            } catch (RuntimeException e) {
                throw new ChecksumComputationFailedException(descriptors.get(i).digestKind(), e);
            }
        }
        return values;
    }
}
