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

package cloakfund.util;

import java.math.BigInteger;

import org.bouncycastle.crypto.ec.ECPair;
import org.bouncycastle.math.ec.ECPoint;

/**
 * Decrypts El Gamal ciphertexts using a given secret key. Only the reveal
 * oracle constructs one of these; the platform never holds a decryption key.
 * Decryption can optionally be blinded for side channel resistance at roughly
 * twice the cost.
 *
 * @author ethan@cs.cornell.edu
 */
public class Decryptor {
    private final EncryptionParams m_params;
    private final BigInteger m_secretKey;

    private final boolean m_blindDecryption;

    /**
     * Constructs a new {@code Decryptor} object for a specific secret key.
     *
     * @param params the {@link cloakfund.util.EncryptionParams} currently in
     *            use.
     * @param secretKey the secret decryption key to use for decryption.
     * @param blindDecryption whether or not to blind decryptions.
     */
    public Decryptor(EncryptionParams params, BigInteger secretKey, boolean blindDecryption) {
        m_params = params;
        m_secretKey = secretKey;
        m_blindDecryption = blindDecryption;

        if (secretKey.compareTo(BigInteger.ONE) <= 0 || secretKey.compareTo(m_params.getGroupSize()) >= 0) {
            throw new IllegalArgumentException("Must specify a secret key between (1, groupSize)");
        }
    }

    /**
     * Decrypts the specified encryption to an elliptic curve point.
     *
     * @param encryption the encryption to decrypt
     * @return the decrypted elliptic curve point
     */
    public ECPoint decryptPoint(ECPair encryption) {
        if (m_blindDecryption) {
            BigInteger blindFactor = m_params.getRandomIndex();
            return encryption.getX().subtract(encryption.getY().multiply(blindFactor.add(m_secretKey)))
                    .add(encryption.getY().multiply(blindFactor)).normalize();
        } else {
            return encryption.getX().subtract(encryption.getY().multiply(m_secretKey)).normalize();
        }
    }

    /**
     * Decrypts the specified encryption down to an amount by decrypting to a
     * point and looking up its discrete log.
     *
     * @param encryption the encryption to decrypt
     * @return the amount encrypted by {@code encryption}.
     * @throws IllegalArgumentException if the amount is negative or too big
     *             to find in the lookup table.
     */
    public long decryptAmount(ECPair encryption) {
        long amount = m_params.lookupDiscreteLog(decryptPoint(encryption));
        if (amount < 0) throw new IllegalArgumentException("Decrypted a negative amount: " + amount);
        return amount;
    }
}
