package com.libragraph.squash.chksum.api;

import com.libragraph.squash.types.DigestKind;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * The implementation chosen for one digest kind.
 *
 * @param digestKind            what it computes
 * @param source                where the implementation comes from
 * @param releasesExclusiveLock whether the implementation runs outside Java code (JCA
 *                              provider or intrinsic); informational, every kind gets its own worker
 * @param implementationName    class or JCA algorithm name, for logs and health output
 * @param factory               creates a fresh digester per call
 */
public record DigestDescriptor(
        DigestKind digestKind,
        ImplementationSource source,
        boolean releasesExclusiveLock,
        String implementationName,
        Supplier<Digester> factory
) {
    public DigestDescriptor {
        Objects.requireNonNull(digestKind, "digestKind cannot be null");
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(implementationName, "implementationName cannot be null");
        Objects.requireNonNull(factory, "factory cannot be null");
    }

    public Digester newDigester() {
        return factory.get();
    }

    @Override
    public String toString() {
        return digestKind.label() + "/" + implementationName + " (" + source + ")";
    }
}
