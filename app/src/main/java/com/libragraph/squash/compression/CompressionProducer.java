package com.libragraph.squash.compression;

import com.libragraph.squash.codecs.inprocess.InProcessCodecs;
import com.libragraph.squash.codecs.registry.BackendRegistry;
import com.libragraph.squash.codecs.registry.ToolLocator;
import com.libragraph.squash.codecs.stream.CompressionService;
import com.libragraph.squash.util.CpuTopology;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class CompressionProducer {

    @ConfigProperty(name = "squash.tools.search-path")
    Optional<String> searchPath;

    @ConfigProperty(name = "squash.tools.in-process-fallback", defaultValue = "true")
    boolean inProcessFallback;

    @ConfigProperty(name = "squash.parallelism.max-workers")
    Optional<Integer> maxWorkers;

    @Produces
    @Singleton
    public BackendRegistry backendRegistry() {
        ToolLocator locator = searchPath
                .map(ToolLocator::fromPathString)
                .orElseGet(ToolLocator::fromEnvironment);
        return new BackendRegistry(locator, inProcessFallback ? InProcessCodecs.defaults() : List.of());
    }

    @Produces
    @Singleton
    public CompressionService compressionService(BackendRegistry registry) {
        return new CompressionService(registry, maxWorkers.orElse(CpuTopology.availableParallelism()));
    }
}
