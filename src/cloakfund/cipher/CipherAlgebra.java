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

package cloakfund.cipher;

import java.math.BigInteger;

import org.bouncycastle.crypto.ec.ECPair;
import org.bouncycastle.math.ec.ECPoint;

import cloakfund.util.EncryptionParams;
import cloakfund.util.Encryptor;

/**
 * The homomorphic operations the platform is allowed to perform on amounts:
 * encrypt, add two ciphertexts, and multiply a ciphertext by a plaintext
 * scalar. All ciphertexts are exponential El Gamal encryptions under the
 * reveal oracle's public key, so the platform can combine them but never
 * read them.
 *
 * @author ethan@cs.cornell.edu
 */
public class CipherAlgebra {
    private final EncryptionParams m_params;
    private final Encryptor m_encryptor;

    /**
     * @param params the system encryption parameters.
     * @param oraclePublicKey the reveal oracle's public encryption key.
     */
    public CipherAlgebra(EncryptionParams params, ECPoint oraclePublicKey) {
        m_params = params;
        m_encryptor = params.getEncryptor(oraclePublicKey);
    }

    /**
     * @return the public key every ciphertext is encrypted under.
     */
    public ECPoint getPublicKey() {
        return m_encryptor.getPublicKey();
    }

    /**
     * @return a fresh encryption of zero.
     */
    public ECPair encryptZero() {
        return m_encryptor.encryptZero();
    }

    /**
     * @param amount a non-negative amount the oracle can reveal.
     * @return a fresh encryption of {@code amount}.
     * @throws IllegalArgumentException if {@code amount} is negative or not
     *             revealable.
     */
    public ECPair encrypt(long amount) {
        return m_encryptor.encryptAmount(amount);
    }

    /**
     * @return an encryption of the sum of the plaintexts of {@code a} and
     *         {@code b}.
     */
    public ECPair add(ECPair a, ECPair b) {
        return new ECPair(a.getX().add(b.getX()).normalize(), a.getY().add(b.getY()).normalize());
    }

    /**
     * @param cipher the ciphertext to scale.
     * @param scalar a positive plaintext multiplier.
     * @return an encryption of {@code scalar} times the plaintext of
     *         {@code cipher}.
     */
    public ECPair mul(ECPair cipher, long scalar) {
        if (scalar <= 0) throw new IllegalArgumentException("Scalar must be positive: " + scalar);
        BigInteger k = BigInteger.valueOf(scalar);
        return new ECPair(cipher.getX().multiply(k).normalize(), cipher.getY().multiply(k).normalize());
    }

    /**
     * @return the encryption parameters backing this algebra.
     */
    public EncryptionParams getParams() {
        return m_params;
    }
}
