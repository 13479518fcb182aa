package com.sandkev.tradevol.credential;

import com.sandkev.tradevol.domain.Credential;
import com.sandkev.tradevol.domain.Platform;

import java.util.Optional;

/** Source of decrypted, active credentials. Failures here are infrastructure outages and propagate. */
public interface CredentialProvider {
    Optional<Credential> credentialFor(Platform platform);
}
