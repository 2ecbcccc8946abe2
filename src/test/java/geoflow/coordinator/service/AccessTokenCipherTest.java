package geoflow.coordinator.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AccessTokenCipherTest {

    @Test
    void decryptsWhatItEncrypts() {
        AccessTokenCipher cipher = new AccessTokenCipher("s3cret");

        String encrypted = cipher.encrypt("user-token");

        assertNotEquals("user-token", encrypted);
        assertEquals("user-token", cipher.decrypt(encrypted));
    }

    @Test
    void sameSecretSharesTheKey() {
        String encrypted = new AccessTokenCipher("s3cret").encrypt("user-token");

        assertEquals("user-token", new AccessTokenCipher("s3cret").decrypt(encrypted));
    }

    @Test
    void differentSecretCannotDecrypt() {
        String encrypted = new AccessTokenCipher("s3cret").encrypt("user-token");

        assertThrows(IllegalStateException.class, () -> new AccessTokenCipher("other").decrypt(encrypted));
    }

    @Test
    void freshIvPerEncryption() {
        AccessTokenCipher cipher = new AccessTokenCipher("s3cret");
        assertNotEquals(cipher.encrypt("token"), cipher.encrypt("token"));
    }

    @Test
    void nullPassesThrough() {
        AccessTokenCipher cipher = new AccessTokenCipher(null);
        assertNull(cipher.encrypt(null));
        assertNull(cipher.decrypt(null));
    }
}
