package com.sandkev.tradevol.credential;

import com.sandkev.tradevol.config.CredentialProperties;
import com.sandkev.tradevol.domain.Credential;
import com.sandkev.tradevol.domain.Platform;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * Credentials bound from {@code credentials.<platform>.*}, normally fed from environment
 * variables. A bundle counts as active when it has an API key, an account address or a JWT.
 */
@RequiredArgsConstructor
public class PropertiesCredentialProvider implements CredentialProvider {

    private final CredentialProperties props;

    @Override
    public Optional<Credential> credentialFor(Platform platform) {
        if (props.platforms() == null) return Optional.empty();
        var bundle = props.platforms().get(platform.id());
        if (bundle == null || !bundle.isActive()) return Optional.empty();
        return Optional.of(new Credential(
                platform,
                blankToNull(bundle.apiKey()),
                blankToNull(bundle.apiSecret()),
                blankToNull(bundle.accountAddress()),
                blankToNull(bundle.privateKey()),
                blankToNull(bundle.jwt())));
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
