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
 * This class provides a skeletal implementation of the
 * {@link cloakfund.util.Encryptor Encryptor} interface based on the
 * {@link #encryptZero encryptZero} method. All other methods are implemented
 * in terms of that one or static values.
 *
 * @see cloakfund.util.Encryptor
 * @author ethan@cs.cornell.edu
 */
public abstract class AbstractEncryptor implements Encryptor {
    protected final EncryptionParams m_params;
    protected final ECPoint m_publicKey;
    protected final boolean m_normalize;

    public AbstractEncryptor(EncryptionParams params, ECPoint publicKey, boolean normalize) {
        m_params = params;
        m_publicKey = publicKey;
        m_normalize = normalize;
    }

    @Override
    public ECPoint getPublicKey() {
        return m_publicKey;
    }

    /**
     * Generates a fresh encryption of zero. Thread-safe, and itself a valid
     * implementation of {@link #encryptZero() encryptZero}.
     *
     * @return an encryption of zero.
     */
    protected ECPair generateZeroEncryption() {
        BigInteger r = m_params.getRandomIndex();
        return _maybeNormalize(m_publicKey.multiply(r), m_params.getGenerator().multiply(r));
    }

    /**
     * Defines how encryptions of zero are produced. Every other encryption is
     * derived from one of these.
     *
     * @see cloakfund.util.Encryptor#encryptZero
     */
    @Override
    abstract public ECPair encryptZero();

    @Override
    public ECPair encryptPoint(ECPoint point) {
        ECPair zeroEnc = encryptZero();
        return _maybeNormalize(point.add(zeroEnc.getX()), zeroEnc.getY());
    }

    @Override
    public ECPair encryptValue(BigInteger v) {
        if (BigInteger.ZERO.equals(v)) {
            return encryptZero();
        } else {
            return encryptPoint(m_params.getGenerator().multiply(v));
        }
    }

    @Override
    public ECPair encryptAmount(long amount) {
        if (!m_params.isDecryptable(amount))
            throw new IllegalArgumentException("Amount is outside of the revealable range: " + amount);
        return encryptValue(BigInteger.valueOf(amount));
    }

    /**
     * Re-randomizes by homomorphically adding a fresh encryption of zero.
     *
     * @see cloakfund.util.Encryptor#reencrypt(ECPair)
     */
    @Override
    public ECPair reencrypt(ECPair encryption) {
        ECPair zeroEnc = encryptZero();
        return _maybeNormalize(encryption.getX().add(zeroEnc.getX()), encryption.getY().add(zeroEnc.getY()));
    }

    private ECPair _maybeNormalize(ECPoint x, ECPoint y) {
        if (m_normalize) {
            return new ECPair(x.normalize(), y.normalize());
        } else {
            return new ECPair(x, y);
        }
    }
}
