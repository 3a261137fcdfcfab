package com.altrii.mdm.global.crypto;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.PrivateKey;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;

public final class PemReader {

    private PemReader() {
    }

    public static List<X509Certificate> readCertificates(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return readCertificates(reader);
        }
    }

    public static List<X509Certificate> readCertificates(Reader source) throws IOException {
        JcaX509CertificateConverter converter = new JcaX509CertificateConverter();
        List<X509Certificate> certificates = new ArrayList<>();
        try (PEMParser parser = new PEMParser(source)) {
            Object entry;
            while ((entry = parser.readObject()) != null) {
                if (entry instanceof X509CertificateHolder holder) {
                    certificates.add(converter.getCertificate(holder));
                }
            }
        } catch (CertificateException ex) {
            throw new IOException("Unreadable certificate in PEM input", ex);
        }
        if (certificates.isEmpty()) {
            throw new IOException("No certificate found in PEM input");
        }
        return certificates;
    }

    public static PrivateKey readPrivateKey(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return readPrivateKey(reader);
        }
    }

    public static PrivateKey readPrivateKey(Reader source) throws IOException {
        JcaPEMKeyConverter converter = new JcaPEMKeyConverter();
        try (PEMParser parser = new PEMParser(source)) {
            Object entry;
            while ((entry = parser.readObject()) != null) {
                if (entry instanceof PEMKeyPair keyPair) {
                    return converter.getKeyPair(keyPair).getPrivate();
                }
                if (entry instanceof PrivateKeyInfo keyInfo) {
                    return converter.getPrivateKey(keyInfo);
                }
            }
        }
        throw new IOException("No unencrypted private key found in PEM input");
    }
}
