package com.libragraph.squash.health;

import com.libragraph.squash.chksum.registry.DigestRegistry;
import com.libragraph.squash.codecs.api.BackendUnavailableException;
import com.libragraph.squash.codecs.registry.BackendRegistry;
import com.libragraph.squash.types.CodecKind;
import com.libragraph.squash.types.DigestKind;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * Reports the backend picked for each codec and the implementation picked for
 * each digest. Down only when no codec can be handled at all.
 */
@Readiness
@ApplicationScoped
public class BackendHealthCheck implements HealthCheck {

    static final String NAME = "squash-backends";

    @Inject
    BackendRegistry backends;

    @Inject
    DigestRegistry digests;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.named(NAME);
        for (CodecKind kind : CodecKind.values()) {
            try {
                builder.withData(kind.label(), backends.resolve(kind, true).toolName());
            } catch (BackendUnavailableException e) {
                builder.withData(kind.label(), "unavailable");
            }
        }
        for (DigestKind kind : digests.supportedKinds()) {
            builder.withData("digest." + kind.label(), digests.resolve(kind).implementationName());
        }
        return backends.availableKinds().isEmpty()
                ? builder.down().build()
                : builder.up().build();
    }
}
