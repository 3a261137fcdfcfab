package com.altrii.mdm.modules.profile.domain;

public interface Signer {

    /**
     * @return DER-encoded CMS SignedData encapsulating {@code content}
     * @throws ProfileSigningException when the signature cannot be produced
     */
    byte[] sign(byte[] content);
}
