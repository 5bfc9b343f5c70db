/*
 * Cloakfund - Confidential Crowdfunding Settlement via Verifiable Reveals
 *
 * Copyright 2016-2017 Ethan Cecchetti, Fan Zhang and Yan Ji
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package cloakfund.zkproofs;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.math.BigInteger;
import java.util.Objects;

import org.bouncycastle.crypto.ec.ECPair;
import org.bouncycastle.math.ec.ECPoint;

import cloakfund.io.SerialHelpers;
import cloakfund.io.SerialWriter;
import cloakfund.util.EncryptionParams;

/**
 * A non-interactive Chaum-Pedersen proof that an El Gamal ciphertext
 * {@code (X, Y)} decrypts to {@code amount * G} under a given public key. It
 * proves that {@code log_G(publicKey) = log_Y(X - amount * G)} without
 * revealing the secret key, so anyone holding the ciphertext can check a
 * revealed amount.
 *
 * @author ethan@cs.cornell.edu
 */
public class DecryptionProof implements SerialWriter {
    private final EncryptionParams m_params;
    private final BigInteger m_c;
    private final BigInteger m_s;

    private DecryptionProof(EncryptionParams params, BigInteger c, BigInteger s) {
        m_params = params;
        m_c = c;
        m_s = s;
    }

    /**
     * Generates a zero-knowledge proof that {@code cipher} is an encryption of
     * {@code amount} under {@code publicKey}.
     *
     * NOTE: If {@code amount} is not the true plaintext or {@code secretKey}
     * does not match {@code publicKey}, the resulting proof will not verify.
     * For efficiency, this method performs no verification itself.
     *
     * @param params The public encryption parameters
     * @param cipher The ciphertext that was decrypted
     * @param amount The claimed plaintext amount
     * @param publicKey The public encryption key used to encrypt the ciphertext.
     * @param secretKey The secret decryption key for {@code publicKey}.
     * @return a zk proof of correct decryption.
     */
    public static DecryptionProof buildProof(EncryptionParams params, ECPair cipher, long amount, ECPoint publicKey,
            BigInteger secretKey) {
        BigInteger e = params.getRandomIndex();
        ECPoint cipherChallengePoint = cipher.getY().multiply(e);
        ECPoint keyChallengePoint = params.getGenerator().multiply(e);

        BigInteger c = _challenge(params, cipher, amount, publicKey, cipherChallengePoint, keyChallengePoint);
        BigInteger s = e.subtract(c.multiply(secretKey)).mod(params.getGroupSize());

        return new DecryptionProof(params, c, s);
    }

    public static DecryptionProof serialReadIn(InputStream inStream, EncryptionParams params) throws IOException {
        BigInteger c = SerialHelpers.readBigInteger(inStream);
        BigInteger s = SerialHelpers.readBigInteger(inStream);
        return new DecryptionProof(params, c, s);
    }

    /**
     * Checks that {@code cipher} decrypts to {@code amount} under
     * {@code publicKey}.
     *
     * @param cipher the ciphertext that was revealed.
     * @param amount the revealed amount.
     * @param publicKey the oracle's public encryption key.
     * @return whether the proof verifies.
     */
    public boolean verify(ECPair cipher, long amount, ECPoint publicKey) {
        if (amount < 0) return false;

        ECPoint residue = cipher.getX().subtract(m_params.getGenerator().multiply(BigInteger.valueOf(amount)));
        ECPoint cipherChallengePoint = residue.multiply(m_c).add(cipher.getY().multiply(m_s));
        ECPoint keyChallengePoint = publicKey.multiply(m_c).add(m_params.getGenerator().multiply(m_s));

        BigInteger newC = _challenge(m_params, cipher, amount, publicKey, cipherChallengePoint, keyChallengePoint);
        return newC.equals(m_c);
    }

    private static BigInteger _challenge(EncryptionParams params, ECPair cipher, long amount, ECPoint publicKey,
            ECPoint cipherChallengePoint, ECPoint keyChallengePoint) {
        ECPoint amountPoint = params.getGenerator().multiply(BigInteger.valueOf(amount));
        return params.hash(cipher.getX(), cipher.getY(), amountPoint, publicKey, cipherChallengePoint,
                keyChallengePoint);
    }

    @Override
    public void serialWriteOut(OutputStream outStream, boolean compressPoints) throws IOException {
        SerialHelpers.writeBigInteger(outStream, m_c);
        SerialHelpers.writeBigInteger(outStream, m_s);
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) return true;
        if (!(o instanceof DecryptionProof)) return false;

        DecryptionProof pf = (DecryptionProof) o;
        return Objects.equals(m_c, pf.m_c) && Objects.equals(m_s, pf.m_s);
    }

    @Override
    public int hashCode() {
        return Objects.hash(m_c, m_s);
    }
}
