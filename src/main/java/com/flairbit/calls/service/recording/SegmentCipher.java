package com.flairbit.calls.service.recording;

import com.flairbit.calls.config.CallsProperties;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.util.encoders.Base64;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.UUID;

/**
 * AES-256-GCM encryption of recording segments.
 * <p>
 * Each recording gets its own key, derived with HKDF-SHA256 from the configured master secret
 * using the recording's key reference as info. Only the reference is persisted. The sealed
 * form is {@code nonce(12) || ciphertext || tag(16)}; the AAD binds the bytes to their
 * recording and sequence number so segments cannot be swapped.
 */
@Component
public class SegmentCipher {

    public static final String KEY_REF_PREFIX = "hkdf-sha256:v1:";

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int NONCE_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;
    private static final int KEY_LENGTH = 32;

    private final byte[] masterKey;
    private final SecureRandom secureRandom = new SecureRandom();
    private final BouncyCastleProvider provider = new BouncyCastleProvider();

    public SegmentCipher(CallsProperties properties) {
        String encoded = properties.getRecording().getMasterKey();
        if (encoded == null || encoded.isBlank()) {
            throw new IllegalStateException("calls.recording.master-key must be configured");
        }
        this.masterKey = Base64.decode(encoded.trim());
        if (masterKey.length < KEY_LENGTH) {
            throw new IllegalStateException("calls.recording.master-key must decode to at least 32 bytes");
        }
    }

    public String keyRefFor(UUID recordingId) {
        return KEY_REF_PREFIX + recordingId;
    }

    public byte[] encrypt(String keyRef, UUID recordingId, int sequenceNumber, byte[] plaintext) {
        byte[] nonce = new byte[NONCE_LENGTH];
        secureRandom.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION, provider);
            cipher.init(Cipher.ENCRYPT_MODE, deriveKey(keyRef), new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
            cipher.updateAAD(aad(recordingId, sequenceNumber));
            byte[] sealed = cipher.doFinal(plaintext);
            return ByteBuffer.allocate(NONCE_LENGTH + sealed.length).put(nonce).put(sealed).array();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Segment encryption failed for " + recordingId + "#" + sequenceNumber, e);
        }
    }

    public byte[] decrypt(String keyRef, UUID recordingId, int sequenceNumber, byte[] sealed) {
        if (sealed.length < NONCE_LENGTH) {
            throw new IllegalArgumentException("Sealed segment too short");
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION, provider);
            cipher.init(Cipher.DECRYPT_MODE, deriveKey(keyRef),
                    new GCMParameterSpec(TAG_LENGTH_BITS, Arrays.copyOfRange(sealed, 0, NONCE_LENGTH)));
            cipher.updateAAD(aad(recordingId, sequenceNumber));
            return cipher.doFinal(sealed, NONCE_LENGTH, sealed.length - NONCE_LENGTH);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Segment decryption failed for " + recordingId + "#" + sequenceNumber, e);
        }
    }

    /** Lowercase hex SHA-256 of the stored (encrypted) bytes. */
    public String checksum(byte[] data) {
        SHA256Digest digest = new SHA256Digest();
        digest.update(data, 0, data.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return Hex.toHexString(out);
    }

    private SecretKeySpec deriveKey(String keyRef) {
        HKDFBytesGenerator hkdf = new HKDFBytesGenerator(new SHA256Digest());
        hkdf.init(new HKDFParameters(masterKey, null, keyRef.getBytes(StandardCharsets.UTF_8)));
        byte[] key = new byte[KEY_LENGTH];
        hkdf.generateBytes(key, 0, KEY_LENGTH);
        return new SecretKeySpec(key, "AES");
    }

    private byte[] aad(UUID recordingId, int sequenceNumber) {
        return (recordingId + ":" + sequenceNumber).getBytes(StandardCharsets.UTF_8);
    }
}
