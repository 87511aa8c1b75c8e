package com.llmgateway.security;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CredentialVaultTest {

    private final CredentialVault vault = new CredentialVault("unit-test-encryption-key");

    @Test
    void shouldRoundTripSecret() {
        String secret = "sk-proj-abcdefghijklmnopqrstuvwxyz012345";

        String encrypted = vault.encrypt(secret);

        assertNotEquals(secret, encrypted);
        assertTrue(vault.isEncrypted(encrypted));
        assertEquals(secret, vault.decrypt(encrypted));
    }

    @Test
    void shouldUseFreshIvPerEncryption() {
        String first = vault.encrypt("same-secret");
        String second = vault.encrypt("same-secret");

        assertNotEquals(first, second);
        assertEquals(32, first.indexOf(':'));
        assertEquals("same-secret", vault.decrypt(first));
        assertEquals("same-secret", vault.decrypt(second));
    }

    @Test
    void shouldPassLegacyPlaintextThrough() {
        assertEquals("sk-plaintext-without-separator", vault.decrypt("sk-plaintext-without-separator"));
        assertNull(vault.decrypt(null));
    }

    @Test
    void shouldReturnInputWhenCiphertextIsMalformed() {
        assertEquals("zz:not-hex", vault.decrypt("zz:not-hex"));
        assertEquals(":abc", vault.decrypt(":abc"));
    }

    @Test
    void shouldAcceptExact32ByteKey() {
        CredentialVault exact = new CredentialVault("0123456789abcdef0123456789abcdef");

        assertEquals("secret", exact.decrypt(exact.encrypt("secret")));
    }

    @Test
    void shouldMaskSecrets() {
        assertEquals("sk-p****2345", CredentialVault.mask("sk-proj-abcdefghij012345"));
        assertEquals("****", CredentialVault.mask("short"));
        assertEquals("<none>", CredentialVault.mask(null));
    }
}
