package com.altrii.mdm.modules.profile.infrastructure.signing;

import java.io.IOException;
import java.nio.file.Path;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.List;

import com.altrii.mdm.global.config.MdmProperties;
import com.altrii.mdm.global.crypto.PemReader;
import com.altrii.mdm.modules.profile.domain.Signer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SigningConfig {

    private static final Logger log = LoggerFactory.getLogger(SigningConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "mdm.signing", name = {"certificate-path", "key-path"})
    public Signer profileSigningIdentity(MdmProperties properties) throws IOException {
        MdmProperties.SigningConfig signing = properties.getSigning();
        List<X509Certificate> chain = PemReader.readCertificates(Path.of(signing.getCertificatePath()));
        PrivateKey key = PemReader.readPrivateKey(Path.of(signing.getKeyPath()));
        log.info("Loaded profile signing identity {}", chain.get(0).getSubjectX500Principal());
        return new CmsSigner(chain, key);
    }
}
