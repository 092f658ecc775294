package com.libragraph.squash.util;

import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Detects how many independent cores the host offers, ignoring hyperthread siblings.
 *
 * <p>External compressors and digest loops are throughput-bound per core;
 * running a second thread on a sibling adds CPU time without adding speed, so
 * worker pools are sized from physical cores rather than logical processors.
 */
public final class CpuTopology {

    private static final Logger log = Logger.getLogger(CpuTopology.class);

    private static final Path CPUINFO = Path.of("/proc/cpuinfo");

    private static volatile Integer cached;

    private CpuTopology() {
    }

    /**
     * Number of physical cores usable by this process, always {@code >= 1}.
     * Computed once per process.
     */
    public static int availableParallelism() {
        Integer result = cached;
        if (result == null) {
            synchronized (CpuTopology.class) {
                result = cached;
                if (result == null) {
                    result = detect(CPUINFO, Runtime.getRuntime().availableProcessors());
                    cached = result;
                }
            }
        }
        return result;
    }

    /**
     * Reads {@code cpuinfo} and returns the physical core count capped at
     * {@code logical}, or {@code logical} when the topology is unknown.
     */
    static int detect(Path cpuinfo, int logical) {
        int fallback = Math.max(1, logical);
        if (!Files.isReadable(cpuinfo)) {
            log.debugf("%s not readable, using %d logical processors", cpuinfo, fallback);
            return fallback;
        }
        try {
            OptionalInt cores = physicalCores(Files.readAllLines(cpuinfo, StandardCharsets.UTF_8));
            if (cores.isEmpty()) {
                log.debugf("No core topology in %s, using %d logical processors", cpuinfo, fallback);
                return fallback;
            }
            int result = Math.min(cores.getAsInt(), fallback);
            log.debugf("Detected %d physical cores (%d logical processors)", cores.getAsInt(), fallback);
            return result;
        } catch (IOException e) {
            log.debugf("Failed to read %s (%s), using %d logical processors", cpuinfo, e.getMessage(), fallback);
            return fallback;
        }
    }

    /**
     * Counts distinct (physical id, core id) pairs in {@code /proc/cpuinfo} content.
     * Empty when any processor block lacks either id.
     */
    public static OptionalInt physicalCores(List<String> cpuinfoLines) {
        Set<String> cores = new HashSet<>();
        String physicalId = null;
        String coreId = null;
        boolean inBlock = false;

        for (String raw : cpuinfoLines) {
            String line = raw.strip();
            if (line.isEmpty()) {
                if (inBlock) {
                    if (physicalId == null || coreId == null) {
                        return OptionalInt.empty();
                    }
                    cores.add(physicalId + ":" + coreId);
                }
                physicalId = null;
                coreId = null;
                inBlock = false;
                continue;
            }
            int colon = line.indexOf(':');
            if (colon < 0) {
                continue;
            }
            String key = line.substring(0, colon).strip();
            String value = line.substring(colon + 1).strip();
            switch (key) {
                case "processor" -> inBlock = true;
                case "physical id" -> physicalId = value;
                case "core id" -> coreId = value;
                default -> { }
            }
        }
        if (inBlock) {
            if (physicalId == null || coreId == null) {
                return OptionalInt.empty();
            }
            cores.add(physicalId + ":" + coreId);
        }
        return cores.isEmpty() ? OptionalInt.empty() : OptionalInt.of(cores.size());
    }
}
