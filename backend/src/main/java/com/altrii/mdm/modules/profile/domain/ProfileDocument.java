package com.altrii.mdm.modules.profile.domain;

/**
 * Serialized profile ready for download. Callers can tell a signed document from one served
 * without a signature.
 */
public sealed interface ProfileDocument permits ProfileDocument.Signed, ProfileDocument.Unsigned {

    byte[] bytes();

    boolean signed();

    record Signed(byte[] bytes) implements ProfileDocument {

        @Override
        public boolean signed() {
            return true;
        }
    }

    record Unsigned(byte[] bytes, String reason) implements ProfileDocument {

        @Override
        public boolean signed() {
            return false;
        }
    }
}
