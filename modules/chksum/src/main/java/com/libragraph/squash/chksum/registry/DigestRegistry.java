package com.libragraph.squash.chksum.registry;

import com.libragraph.squash.chksum.api.DigestDescriptor;
import com.libragraph.squash.chksum.api.UnsupportedDigestException;
import com.libragraph.squash.types.DigestKind;
import org.jboss.logging.Logger;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Picks the best available implementation for each digest kind.
 *
 * <p>Candidates are probed once, on first use; the winner per kind is fixed for
 * the life of the registry. Native accelerated implementations win over native
 * standard ones, which win over pure-Java fallbacks.
 */
public class DigestRegistry {

    private static final Logger log = Logger.getLogger(DigestRegistry.class);

    private final List<DigestCandidate> candidates;
    private volatile Map<DigestKind, DigestDescriptor> resolved;

    public DigestRegistry() {
        this(DigestCandidate.defaults());
    }

    public DigestRegistry(List<DigestCandidate> candidates) {
        this.candidates = List.copyOf(candidates);
    }

    /**
     * @throws UnsupportedDigestException if no candidate for {@code kind} works here
     */
    public DigestDescriptor resolve(DigestKind kind) {
        DigestDescriptor descriptor = probed().get(kind);
        if (descriptor == null) {
            throw new UnsupportedDigestException(kind);
        }
        return descriptor;
    }

    /**
     * Resolves every kind up front, so an unsupported one fails the whole request.
     *
     * @return descriptors in the iteration order of {@code kinds}
     */
    public Map<DigestKind, DigestDescriptor> resolveAll(Collection<DigestKind> kinds) {
        Map<DigestKind, DigestDescriptor> result = new LinkedHashMap<>();
        for (DigestKind kind : kinds) {
            result.put(kind, resolve(kind));
        }
        return result;
    }

    public Set<DigestKind> supportedKinds() {
        Map<DigestKind, DigestDescriptor> map = probed();
        return map.isEmpty() ? EnumSet.noneOf(DigestKind.class) : EnumSet.copyOf(map.keySet());
    }

    private Map<DigestKind, DigestDescriptor> probed() {
        Map<DigestKind, DigestDescriptor> result = resolved;
        if (result == null) {
            synchronized (this) {
                result = resolved;
                if (result == null) {
                    result = probe();
                    resolved = result;
                }
            }
        }
        return result;
    }

    private Map<DigestKind, DigestDescriptor> probe() {
        Map<DigestKind, DigestCandidate> best = new EnumMap<>(DigestKind.class);
        for (DigestCandidate candidate : candidates) {
            DigestCandidate current = best.get(candidate.digestKind());
            if (current != null && !candidate.source().preferredOver(current.source())) {
                continue;
            }
            if (isUsable(candidate)) {
                best.put(candidate.digestKind(), candidate);
            }
        }

        Map<DigestKind, DigestDescriptor> result = new EnumMap<>(DigestKind.class);
        best.forEach((kind, candidate) -> result.put(kind, candidate.toDescriptor()));
        for (DigestKind kind : DigestKind.values()) {
            DigestDescriptor d = result.get(kind);
            if (d == null) {
                log.infof("No implementation for %s", kind.label());
            } else {
                log.infof("Digest %s -> %s", kind.label(), d);
            }
        }
        return Collections.unmodifiableMap(result);
    }

    private static boolean isUsable(DigestCandidate candidate) {
        try {
            candidate.factory().get();
            return true;
        } catch (RuntimeException e) {
            log.debugf("%s unavailable for %s: %s", candidate.implementationName(),
                    candidate.digestKind().label(), e.getMessage());
            return false;
        }
    }
}
