package com.libragraph.squash.checksum;

import com.libragraph.squash.chksum.engine.ChecksumEngine;
import com.libragraph.squash.chksum.registry.DigestRegistry;
import com.libragraph.squash.util.CpuTopology;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Optional;

@ApplicationScoped
public class ChecksumProducer {

    @ConfigProperty(name = "squash.parallelism.max-workers")
    Optional<Integer> maxWorkers;

    @ConfigProperty(name = "squash.checksum.buffer-size", defaultValue = "65536")
    int bufferSize;

    private ChecksumEngine engine;

    @Produces
    @Singleton
    public DigestRegistry digestRegistry() {
        return new DigestRegistry();
    }

    @Produces
    @Singleton
    public ChecksumEngine checksumEngine(DigestRegistry registry) {
        int cores = CpuTopology.availableParallelism();
        engine = new ChecksumEngine(registry, Math.min(cores, maxWorkers.orElse(cores)), bufferSize);
        return engine;
    }

    @PreDestroy
    void shutdown() {
        if (engine != null) engine.close();
    }
}
