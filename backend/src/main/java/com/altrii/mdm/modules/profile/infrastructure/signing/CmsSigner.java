package com.altrii.mdm.modules.profile.infrastructure.signing;

import java.io.IOException;
import java.security.PrivateKey;
import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;
import java.util.List;

import com.altrii.mdm.modules.profile.domain.ProfileSigningException;
import com.altrii.mdm.modules.profile.domain.Signer;

import org.bouncycastle.cert.jcajce.JcaCertStore;
import org.bouncycastle.cms.CMSException;
import org.bouncycastle.cms.CMSProcessableByteArray;
import org.bouncycastle.cms.CMSSignedData;
import org.bouncycastle.cms.CMSSignedDataGenerator;
import org.bouncycastle.cms.jcajce.JcaSignerInfoGeneratorBuilder;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.bouncycastle.operator.jcajce.JcaDigestCalculatorProviderBuilder;

public class CmsSigner implements Signer {

    private final X509Certificate certificate;
    private final PrivateKey privateKey;
    private final List<X509Certificate> certificateChain;

    public CmsSigner(List<X509Certificate> certificateChain, PrivateKey privateKey) {
        if (certificateChain == null || certificateChain.isEmpty()) {
            throw new IllegalArgumentException("Signing certificate is required");
        }
        this.certificate = certificateChain.get(0);
        this.privateKey = privateKey;
        this.certificateChain = List.copyOf(certificateChain);
    }

    @Override
    public byte[] sign(byte[] content) {
        try {
            ContentSigner contentSigner = new JcaContentSignerBuilder(signatureAlgorithm()).build(privateKey);
            CMSSignedDataGenerator generator = new CMSSignedDataGenerator();
            generator.addSignerInfoGenerator(
                    new JcaSignerInfoGeneratorBuilder(new JcaDigestCalculatorProviderBuilder().build())
                            .build(contentSigner, certificate));
            generator.addCertificates(new JcaCertStore(certificateChain));
            CMSSignedData signedData = generator.generate(new CMSProcessableByteArray(content), true);
            return signedData.getEncoded();
        } catch (OperatorCreationException | CertificateEncodingException | CMSException | IOException ex) {
            throw new ProfileSigningException("Unable to sign profile with " + certificate.getSubjectX500Principal(), ex);
        }
    }

    public X509Certificate getCertificate() {
        return certificate;
    }

    private String signatureAlgorithm() {
        return switch (privateKey.getAlgorithm()) {
            case "EC", "ECDSA" -> "SHA256withECDSA";
            default -> "SHA256withRSA";
        };
    }
}
