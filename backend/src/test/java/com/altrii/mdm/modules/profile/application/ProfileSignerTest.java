package com.altrii.mdm.modules.profile.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.altrii.mdm.global.plist.PropertyListCodec;
import com.altrii.mdm.modules.profile.domain.ConfigurationProfile;
import com.altrii.mdm.modules.profile.domain.ProfileDocument;
import com.altrii.mdm.modules.profile.domain.ProfileSigningException;
import com.altrii.mdm.modules.profile.domain.SecurityLevel;
import com.altrii.mdm.modules.profile.domain.Signer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ProfileSignerTest {

    @Mock
    private Signer signer;

    private final PropertyListCodec codec = new PropertyListCodec();

    @Test
    @DisplayName("without a signing identity the XML plist is served unsigned")
    void noSigner_unsigned() {
        ProfileSigner profileSigner = new ProfileSigner(codec, Optional.empty());

        ProfileDocument document = profileSigner.sign(profile());

        assertThat(document).isInstanceOf(ProfileDocument.Unsigned.class);
        assertThat(document.signed()).isFalse();
        assertThat(new String(document.bytes(), StandardCharsets.UTF_8))
                .contains("<plist")
                .contains("com.altriirecovery.supervision.device-1");
        assertThat(codec.decode(document.bytes())).containsEntry("PayloadVersion", 1L);
        assertThat(profileSigner.signingAvailable()).isFalse();
    }

    @Test
    @DisplayName("a configured signer wraps the serialized document")
    void signer_signs() {
        byte[] signature = {0x30, 0x01, 0x02};
        when(signer.sign(any())).thenReturn(signature);
        ProfileSigner profileSigner = new ProfileSigner(codec, Optional.of(signer));

        ProfileDocument document = profileSigner.sign(profile());

        assertThat(document).isInstanceOf(ProfileDocument.Signed.class);
        assertThat(document.bytes()).isEqualTo(signature);
        assertThat(profileSigner.signingAvailable()).isTrue();
    }

    @Test
    @DisplayName("a signing failure degrades to an unsigned document with the reason")
    void signerFailure_fallsBack() {
        when(signer.sign(any())).thenThrow(new ProfileSigningException("key rejected", new IllegalStateException()));
        ProfileSigner profileSigner = new ProfileSigner(codec, Optional.of(signer));

        ProfileDocument document = profileSigner.sign(profile());

        assertThat(document).isInstanceOfSatisfying(ProfileDocument.Unsigned.class,
                unsigned -> assertThat(unsigned.reason()).isEqualTo("key rejected"));
    }

    private static ConfigurationProfile profile() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("PayloadType", "Configuration");
        document.put("PayloadVersion", 1);
        document.put("PayloadIdentifier", "com.altriirecovery.supervision.device-1");
        document.put(ConfigurationProfile.PAYLOAD_CONTENT, List.of());
        return new ConfigurationProfile("com.altriirecovery.supervision.device-1", UUID.randomUUID(),
                "Supervision", SecurityLevel.WEB_FILTER, document);
    }
}
