package org.security.qkd;

import org.junit.Test;

import static org.junit.Assert.*;

public class MessageCipherTest {

    private static final int[] SIFTED = {1, 0, 1, 1, 0};

    @Test
    public void encryptsAndDecryptsHi() throws Exception {
        EncryptedMessage encrypted = MessageCipher.encryptMessage("HI", SIFTED);

        assertEquals(16, encrypted.getBitLength());
        assertArrayEquals(KeyExpansion.expand(SIFTED, 16), encrypted.getExpandedKey());
        // 0100100001001001 xor 1011010110101101
        assertArrayEquals(new int[]{1, 1, 1, 1, 1, 1, 0, 1, 1, 1, 1, 0, 0, 1, 0, 0}, encrypted.getCipherBits());
        assertEquals("HI", MessageCipher.decryptBits(encrypted.getCipherBits(), encrypted.getExpandedKey()));
    }

    @Test
    public void emptyMessageGivesEmptyCipher() throws Exception {
        EncryptedMessage encrypted = MessageCipher.encryptMessage("", SIFTED);

        assertEquals(0, encrypted.getCipherBits().length);
        assertEquals("", MessageCipher.decrypt(encrypted));
    }

    @Test
    public void emptySiftedKeyCannotEncrypt() {
        assertThrows(KeyExpansionException.class, () -> MessageCipher.encryptMessage("HI", new int[0]));
    }

    @Test
    public void decryptRejectsShortKey() {
        EncryptedMessage encrypted = MessageCipher.encryptMessage("HI", SIFTED);
        assertThrows(LengthMismatchException.class,
                () -> MessageCipher.decryptBits(encrypted.getCipherBits(), new int[]{1, 0, 1}));
    }

    @Test
    public void decryptRejectsPartialCharacter() {
        int[] cipher = {1, 0, 1, 1, 0, 0, 1, 0, 1, 1};
        int[] key = KeyExpansion.expand(SIFTED, cipher.length);
        assertThrows(MalformedBitLengthException.class, () -> MessageCipher.decryptBits(cipher, key));
    }

    @Test
    public void latinOneTextRoundTrips() throws Exception {
        String message = "Quantum café © 2024";
        EncryptedMessage encrypted = MessageCipher.encryptMessage(message, new int[]{0, 1, 1});
        assertEquals(message, MessageCipher.decrypt(encrypted));
    }
}
