package com.altrii.mdm.modules.profile.application;

import java.util.Optional;

import com.altrii.mdm.global.plist.PropertyListCodec;
import com.altrii.mdm.modules.profile.domain.ConfigurationProfile;
import com.altrii.mdm.modules.profile.domain.ProfileDocument;
import com.altrii.mdm.modules.profile.domain.ProfileSigningException;
import com.altrii.mdm.modules.profile.domain.Signer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Serializes a profile to an XML property list and signs it when a signing identity is
 * configured. Falls back to an unsigned document rather than failing generation.
 */
@Component
public class ProfileSigner {

    private static final Logger log = LoggerFactory.getLogger(ProfileSigner.class);

    private final PropertyListCodec codec;
    private final Optional<Signer> signer;

    public ProfileSigner(PropertyListCodec codec, Optional<Signer> signer) {
        this.codec = codec;
        this.signer = signer;
    }

    public ProfileDocument sign(ConfigurationProfile profile) {
        byte[] xml = codec.encode(profile.document());
        if (signer.isEmpty()) {
            log.warn("No signing identity configured; serving {} unsigned", profile.identifier());
            return new ProfileDocument.Unsigned(xml, "no signing identity configured");
        }
        try {
            return new ProfileDocument.Signed(signer.get().sign(xml));
        } catch (ProfileSigningException ex) {
            log.warn("Signing {} failed; serving it unsigned", profile.identifier(), ex);
            return new ProfileDocument.Unsigned(xml, ex.getMessage());
        }
    }

    public boolean signingAvailable() {
        return signer.isPresent();
    }
}
