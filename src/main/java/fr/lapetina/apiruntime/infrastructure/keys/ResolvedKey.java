package fr.lapetina.apiruntime.infrastructure.keys;

import fr.lapetina.apiruntime.domain.auth.TokenVerifier;
import fr.lapetina.apiruntime.domain.model.KeyDescriptor;

import java.util.Objects;

/**
 * A ready-to-install verifier and the description of the key it was built from.
 */
public record ResolvedKey(TokenVerifier verifier, KeyDescriptor descriptor) {

    public ResolvedKey {
        Objects.requireNonNull(verifier, "Verifier is required");
        Objects.requireNonNull(descriptor, "Descriptor is required");
    }
}
