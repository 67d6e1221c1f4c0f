// File: MessageCipher.java
package org.security.qkd;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encrypts text under a sifted key and decrypts it again:
 * codec, then key expansion to the message's bit length, then XOR.
 */
public final class MessageCipher {
    private static final Logger log = LoggerFactory.getLogger(MessageCipher.class);

    private MessageCipher() {}

    /**
     * @throws KeyExpansionException if {@code siftedKey} is empty
     * @throws IllegalArgumentException if the message has characters above U+00FF
     */
    public static EncryptedMessage encryptMessage(String message, int[] siftedKey) {
        int[] plain = BitCodec.encode(message);
        int[] expanded = KeyExpansion.expand(siftedKey, plain.length);
        int[] cipher = StreamCipher.transform(plain, expanded);
        log.debug("Encrypted {} characters into {} bits", message.length(), cipher.length);
        return new EncryptedMessage(cipher, expanded);
    }

    /**
     * @throws MalformedBitLengthException if the bit count is not a multiple of 8
     * @throws LengthMismatchException if the key length differs from the cipher length
     */
    public static String decryptBits(int[] cipherBits, int[] expandedKey) throws MalformedBitLengthException {
        int[] plain = StreamCipher.transform(cipherBits, expandedKey);
        return BitCodec.decode(plain);
    }

    public static String decrypt(EncryptedMessage encrypted) throws MalformedBitLengthException {
        return decryptBits(encrypted.getCipherBits(), encrypted.getExpandedKey());
    }
}
