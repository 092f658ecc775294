package com.libragraph.squash.codecs.registry;

import com.libragraph.squash.codecs.api.BackendUnavailableException;
import com.libragraph.squash.codecs.api.CodecDescriptor;
import com.libragraph.squash.codecs.inprocess.InProcessCodec;
import com.libragraph.squash.codecs.inprocess.InProcessCodecs;
import com.libragraph.squash.types.CodecKind;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Discovers which compression backends exist on this host and picks one per request.
 *
 * <p>The host is probed once, on first use, and the result is frozen for the
 * life of the registry. Tools installed or removed later are not noticed until
 * the process restarts.
 *
 * <p>Selection rules:
 * <ul>
 *   <li>parallel wanted: highest {@link CodecDescriptor#priority()}, so a tool
 *       that parallel-decodes any archive beats one that only parallel-decodes its
 *       own, which beats single-threaded tools and in-process codecs</li>
 *   <li>serial wanted: a single-threaded backend (the canonical tool first, then
 *       other tools, then in-process); if none exists, the canonical tool, else the
 *       most capable one</li>
 * </ul>
 */
public class BackendRegistry {

    private static final Logger log = Logger.getLogger(BackendRegistry.class);

    private static final Comparator<CodecDescriptor> BY_PRIORITY =
            Comparator.comparingInt(CodecDescriptor::priority).reversed();

    private final ToolLocator locator;
    private final Map<CodecKind, InProcessCodec> inProcessCodecs = new EnumMap<>(CodecKind.class);

    private volatile Map<CodecKind, List<CodecDescriptor>> descriptors;

    /**
     * @param inProcessCodecs fallback codecs to register; empty disables the in-process fallback
     */
    public BackendRegistry(ToolLocator locator, List<InProcessCodec> inProcessCodecs) {
        this.locator = locator;
        for (InProcessCodec codec : inProcessCodecs) {
            this.inProcessCodecs.put(codec.codecKind(), codec);
        }
    }

    /**
     * Registry over {@code PATH} with the bundled in-process codecs.
     */
    public static BackendRegistry withDefaults() {
        return new BackendRegistry(ToolLocator.fromEnvironment(), InProcessCodecs.defaults());
    }

    /**
     * Picks the backend for {@code kind}.
     *
     * @throws BackendUnavailableException if nothing on this host handles the codec
     */
    public CodecDescriptor resolve(CodecKind kind, boolean wantParallel) {
        List<CodecDescriptor> candidates = descriptors(kind);
        if (candidates.isEmpty()) {
            throw new BackendUnavailableException(kind);
        }
        CodecDescriptor chosen = wantParallel ? candidates.get(0) : selectSerial(candidates);
        log.debugf("Resolved %s (parallel=%s) -> %s", kind.label(), wantParallel, chosen);
        return chosen;
    }

    /**
     * All backends probed for {@code kind}, highest priority first.
     */
    public List<CodecDescriptor> descriptors(CodecKind kind) {
        return probed().getOrDefault(kind, List.of());
    }

    public Set<CodecKind> availableKinds() {
        Set<CodecKind> kinds = EnumSet.noneOf(CodecKind.class);
        probed().forEach((kind, list) -> {
            if (!list.isEmpty()) kinds.add(kind);
        });
        return kinds;
    }

    /**
     * The in-process codec registered for {@code kind}, if the fallback is enabled.
     */
    public Optional<InProcessCodec> inProcessCodec(CodecKind kind) {
        return Optional.ofNullable(inProcessCodecs.get(kind));
    }

    public List<Path> searchPath() {
        return locator.searchPath();
    }

    private static CodecDescriptor selectSerial(List<CodecDescriptor> candidates) {
        CodecDescriptor canonical = null;
        CodecDescriptor serialTool = null;
        CodecDescriptor serialInProcess = null;
        for (CodecDescriptor d : candidates) {
            if (d.canonical() && canonical == null) {
                canonical = d;
            }
            if (!d.supportsParallelEncode()) {
                if (d.isInProcess()) {
                    if (serialInProcess == null) serialInProcess = d;
                } else if (serialTool == null || (d.canonical() && !serialTool.canonical())) {
                    serialTool = d;
                }
            }
        }
        if (serialTool != null) return serialTool;
        if (serialInProcess != null) return serialInProcess;
        if (canonical != null) return canonical;
        return candidates.get(0);
    }

    private Map<CodecKind, List<CodecDescriptor>> probed() {
        Map<CodecKind, List<CodecDescriptor>> result = descriptors;
        if (result == null) {
            synchronized (this) {
                result = descriptors;
                if (result == null) {
                    result = probe();
                    descriptors = result;
                }
            }
        }
        return result;
    }

    private Map<CodecKind, List<CodecDescriptor>> probe() {
        Map<CodecKind, List<CodecDescriptor>> result = new EnumMap<>(CodecKind.class);
        for (CodecKind kind : CodecKind.values()) {
            List<CodecDescriptor> found = new ArrayList<>();
            for (KnownTool tool : KnownTool.forCodec(kind)) {
                locator.find(tool.executable())
                        .map(tool::describe)
                        .ifPresent(found::add);
            }
            InProcessCodec inProcess = inProcessCodecs.get(kind);
            if (inProcess != null) {
                found.add(inProcess.descriptor());
            }
            // stable sort keeps table order among equal priorities
            found.sort(BY_PRIORITY);
            result.put(kind, Collections.unmodifiableList(found));

            if (found.isEmpty()) {
                log.infof("No backend for %s", kind.label());
            } else {
                log.infof("Backends for %s: %s", kind.label(), found);
            }
        }
        return Collections.unmodifiableMap(result);
    }
}
