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
import java.security.MessageDigest;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Supplier;

import org.bouncycastle.crypto.ec.ECPair;
import org.bouncycastle.jce.spec.ECNamedCurveParameterSpec;
import org.bouncycastle.math.ec.ECPoint;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * This class provides the cryptographic configuration shared by the platform
 * and the reveal oracle. It specifies the source of randomness, the elliptic
 * curve used for El Gamal ciphertexts, and the hash function used for proofs
 * and signatures. It also holds the discrete log lookup table that bounds the
 * largest amount the oracle can reveal.
 *
 * This class (not including the builder) is thread-safe. All (non-builder)
 * operations on mutable state are internally synchronized.
 *
 * @author ethan@cs.cornell.edu
 */
public class EncryptionParams {
    public static final int VERSION_ID = 0x00000002;

    private static final List<Byte> DEFAULT_HASH_INDEX = ImmutableList.of((byte) 0);

    /**
     * (THIS IS FOR TESTING ONLY) Constructs a new {@code EncryptionParams}
     * object with the specified randomness, curve, and digest, a fast test
     * encryptor and a lookup table able to reveal values up to
     * {@code maxRevealable}.
     *
     * @param rand the source of randomness
     * @param curveSpec the elliptic curve
     * @param digestSupplier a constructor for a hash algorithm
     * @param maxRevealable the largest value the lookup table must contain
     * @return a fresh {@code EncryptionParams} object with the specified
     *         configuration.
     */
    public static EncryptionParams newTestParams(Random rand, ECNamedCurveParameterSpec curveSpec,
            Supplier<MessageDigest> digestSupplier, long maxRevealable) {
        return new Builder(rand, curveSpec, digestSupplier).setMaxDiscreteLog(maxRevealable).setLookupTableGap(16)
                .useFastTestEncryptor().forTesting().build();
    }

    private final Random m_random;
    private final ECNamedCurveParameterSpec m_curveSpec;
    private final ECPoint m_infinity;
    private final Supplier<MessageDigest> m_digestSupplier;

    private final long m_maxDiscreteLog;
    private final int m_discreteLogTableGap;

    private final boolean m_fastTestEncryptor;
    private final int m_encryptorThreads;
    private final int m_encryptorQueueSize;

    private final boolean m_normalizePoints;
    private final boolean m_compressSerializedPoints;
    private final boolean m_blindDecryption;

    private final Map<ECPoint, Long> m_discreteLogMap;

    private final Map<ECPoint, Encryptor> m_encryptorCache;

    private EncryptionParams(Builder builder) {
        m_random = builder.m_random;
        m_curveSpec = builder.m_curveSpec;
        m_infinity = m_curveSpec.getCurve().getInfinity().normalize();
        m_digestSupplier = builder.m_digestSupplier;

        m_maxDiscreteLog = builder.m_maxDiscreteLog;
        m_discreteLogTableGap = builder.m_discreteLogTableGap;

        m_fastTestEncryptor = builder.m_fastTestEncryptor;
        m_encryptorThreads = builder.m_encryptorThreads;
        m_encryptorQueueSize = builder.m_encryptorQueueSize;

        m_normalizePoints = builder.m_normalizePoints;
        m_compressSerializedPoints = builder.m_compressSerializedPoints;
        m_blindDecryption = builder.m_blindDecryption;

        m_discreteLogMap = _buildDiscreteLogMap();

        m_encryptorCache = new HashMap<>();
    }

    private Map<ECPoint, Long> _buildDiscreteLogMap() {
        ImmutableMap.Builder<ECPoint, Long> discreteLogMapBuilder = ImmutableMap.builder();
        if (m_maxDiscreteLog < 0) return discreteLogMapBuilder.build();

        ECPoint genMultiple = getGenerator().multiply(BigInteger.valueOf(m_discreteLogTableGap));
        ECPoint currentPoint = getInfinity();
        for (long i = 0; i <= m_maxDiscreteLog; i += m_discreteLogTableGap, currentPoint = currentPoint.add(genMultiple)
                .normalize()) {
            discreteLogMapBuilder.put(currentPoint, i);
        }
        // The maximum must be present so lookups never need to search past
        // the end of the table.
        if (m_maxDiscreteLog % m_discreteLogTableGap != 0) {
            discreteLogMapBuilder.put(getGenerator().multiply(BigInteger.valueOf(m_maxDiscreteLog)).normalize(),
                    m_maxDiscreteLog);
        }

        return discreteLogMapBuilder.build();
    }

    /**
     * Returns the common name of the elliptic curve used for encryption.
     *
     * @return the common name of the elliptic curve used for encryption.
     */
    public String getCurveName() {
        return m_curveSpec.getName();
    }

    /**
     * Returns the name of the hash algorithm being used.
     *
     * @return the name of the hash algorithm being used.
     */
    public String getHashAlgorithm() {
        return m_digestSupplier.get().getAlgorithm();
    }

    /**
     * Returns whether or not the specified non-negative amount can be
     * recovered from a decrypted point using the lookup table.
     *
     * @param amount an amount that may or may not be revealable.
     * @return whether {@code 0 <= amount <= getMaxDiscreteLog()}.
     */
    public boolean isDecryptable(long amount) {
        return amount >= 0 && amount <= m_maxDiscreteLog;
    }

    /**
     * Returns the largest discrete log in the lookup table, which is the
     * largest amount the reveal oracle can disclose.
     *
     * @return the largest discrete log in the lookup table.
     */
    public long getMaxDiscreteLog() {
        return m_maxDiscreteLog;
    }

    /**
     * Returns the size of the elliptic curve group used for encryption.
     *
     * @return the size of the elliptic curve group used for encryption.
     */
    public BigInteger getGroupSize() {
        return m_curveSpec.getN();
    }

    /**
     * Returns "infinity", the identity point of the elliptic curve.
     *
     * @return "infinity", the identity point of the elliptic curve.
     */
    public ECPoint getInfinity() {
        return m_infinity;
    }

    /**
     * Returns the generator of the elliptic curve group used for encryption.
     *
     * @return the generator of the elliptic curve group used for encryption.
     */
    public ECPoint getGenerator() {
        return m_curveSpec.getG();
    }

    /**
     * Returns whether or not elliptic curve points should be serialized in a
     * compressed representation.
     *
     * @return whether or not elliptic curve points should be serialized in a
     *         compressed representation.
     */
    public boolean compressSerializedPoints() {
        return m_compressSerializedPoints;
    }

    /**
     * Returns the {@code ECPoint} obtained by decoding the specified buffer
     * with the current curve's {@code decodePoint} method.
     *
     * @param buffer the byte array to decode.
     * @return the decoded point.
     * @see org.bouncycastle.math.ec.ECCurve#decodePoint(byte[])
     */
    public ECPoint decodePoint(byte[] buffer) {
        return m_curveSpec.getCurve().decodePoint(buffer);
    }

    /**
     * Returns the public key (identity) corresponding to a secret key.
     *
     * @param secretKey a secret scalar in (1, groupSize).
     * @return {@code secretKey * G}, normalized.
     */
    public ECPoint derivePublicKey(BigInteger secretKey) {
        return getGenerator().multiply(secretKey).normalize();
    }

    /**
     * Returns the source of randomness used within this instance.
     *
     * @return the source of randomness used within this instance.
     */
    public Random getRandomSource() {
        return m_random;
    }

    /**
     * Returns a random integer in the range (0, N) where N is the size of the
     * elliptic curve group (as returned by {@link #getGroupSize()
     * getGroupSize}).
     *
     * @return a random integer in the range (0, N).
     */
    public BigInteger getRandomIndex() {
        BigInteger r;
        r = new BigInteger(getGroupSize().bitLength(), m_random);
        while (r.compareTo(getGroupSize()) >= 0 || r.compareTo(BigInteger.ONE) < 0) {
            r = new BigInteger(getGroupSize().bitLength(), m_random);
        }
        return r;
    }

    /**
     * Hashes any number of {@code ECPoint}s into an integer between 0 and the
     * group size using the hashing algorithm specified on construction. The
     * same hash function must be used by the platform and the oracle for
     * proofs to verify.
     *
     * @param points any number of {@code ECPoint} objects to encode and hash.
     * @return the combined hash of all specified points.
     */
    public BigInteger hash(ECPoint... points) {
        return hashEachIndexWithAllPoints(DEFAULT_HASH_INDEX, points).get(0);
    }

    /**
     * Flattens the two-dimensional byte array of data, encodes each of the
     * provided points, and hashes the result into a {@code BigInteger} between
     * 0 and the size of the elliptic curve group. This is the hash used by
     * signatures and by the obfuscation multiplier derivation.
     *
     * @param data a two dimensional array of {@code bytes} to flatten and
     *            include in the hash.
     * @param points any number of elliptic curve points to include in the hash.
     * @return the combined hash of all data and points provided.
     */
    public BigInteger hashDataAndPoints(byte[][] data, ECPoint... points) {
        MessageDigest digest = m_digestSupplier.get();
        for (byte[] d : data)
            digest.update(d);
        for (ECPoint point : points)
            digest.update(point.getEncoded(true));
        return new BigInteger(digest.digest()).mod(getGroupSize());
    }

    /**
     * Takes a list of byte indices and any number of {@code ECPoint}s and
     * produces a hash for each index including that index and all points in
     * the hash arguments.
     *
     * @param indices a list of bytes to prepend to the encoded points with each
     *            hash.
     * @param points any number of points to encode and hash in the order
     *            provided
     * @return a list of numbers between 0 and the group size, one for each byte
     *         in {@code indices}.
     */
    public List<BigInteger> hashEachIndexWithAllPoints(List<Byte> indices, ECPoint... points) {
        byte[][] encodings = new byte[points.length][];
        for (int i = 0; i < points.length; i++)
            encodings[i] = points[i].getEncoded(true);

        MessageDigest digest = m_digestSupplier.get();
        ImmutableList.Builder<BigInteger> hashesBuilder = new ImmutableList.Builder<>();
        for (byte index : indices) {
            digest.update(index);
            for (byte[] d : encodings)
                digest.update(d);
            hashesBuilder.add(new BigInteger(digest.digest()).mod(getGroupSize()));
        }
        return hashesBuilder.build();
    }

    /**
     * Returns an El Gamal Encryptor corresponding to the given public key. This
     * function will cache {@code Encryptor} objects for a given public key and
     * return the same object on future invocations with the same key.
     *
     * @param publicKey the El Gamal public key to get an
     *            {@link cloakfund.util.Encryptor Encryptor} for.
     * @return an {@link cloakfund.util.Encryptor Encryptor} object associated
     *         with the given public key.
     */
    public Encryptor getEncryptor(ECPoint publicKey) {
        synchronized (m_encryptorCache) {
            Encryptor encryptor = m_encryptorCache.get(publicKey);
            if (encryptor == null) {
                if (m_fastTestEncryptor) {
                    final BigInteger r = getRandomIndex();
                    final ECPoint pubKeyPoint = publicKey.multiply(r).normalize();
                    final ECPoint genPoint = getGenerator().multiply(r).normalize();
                    encryptor = new AbstractEncryptor(this, publicKey, m_normalizePoints) {
                        @Override
                        public ECPair encryptZero() {
                            return new ECPair(pubKeyPoint, genPoint);
                        }
                    };
                } else {
                    encryptor = new OnlineEncryptor(this, publicKey, m_normalizePoints, m_encryptorThreads,
                            m_encryptorQueueSize);
                }
                m_encryptorCache.put(publicKey, encryptor);
            }
            return encryptor;
        }
    }

    /**
     * Constructs an El Gamal {@link cloakfund.util.Decryptor Decryptor} object
     * with the specified secret key. Only the reveal oracle holds such a key.
     *
     * @param secretKey the secret decryption key to use for decryption.
     * @return an El Gamal Decryptor corresponding to the given secret key.
     */
    public Decryptor getDecryptor(BigInteger secretKey) {
        return new Decryptor(this, secretKey, m_blindDecryption);
    }

    /**
     * Uses the lookup table to find the discrete log of the given point. Only
     * non-negative values up to {@link #getMaxDiscreteLog()} can be found.
     *
     * @param point The elliptic curve point to find the discrete log of.
     * @return the discrete log of the point relative to {@link #getGenerator()}.
     * @throws IllegalArgumentException if the discrete log cannot be found.
     */
    public long lookupDiscreteLog(ECPoint point) {
        point = point.normalize();
        for (int i = 0; i < m_discreteLogTableGap; i++) {
            Long lookup = m_discreteLogMap.get(point);
            if (lookup != null) {
                return lookup.longValue() - i;
            }
            point = point.add(getGenerator()).normalize();
        }

        throw new IllegalArgumentException("Attempted to lookup decryption that is not in table.");
    }

    /**
     * A builder class to construct an {@code EncryptionParams} object. The
     * builder requires a source of randomness, a curve specification, and a
     * hash algorithm.
     */
    public static class Builder {
        private final Random m_random;
        private final ECNamedCurveParameterSpec m_curveSpec;
        private final Supplier<MessageDigest> m_digestSupplier;

        private boolean m_normalizePoints = false;
        private boolean m_compressSerializedPoints = true;
        private boolean m_blindDecryption = false;

        private long m_maxDiscreteLog = -1;
        private int m_discreteLogTableGap = 1;

        private boolean m_fastTestEncryptor = false;
        private int m_encryptorThreads = 0;
        private int m_encryptorQueueSize = 10000;

        private boolean m_forTesting = false;

        private boolean m_isBuilt;

        /**
         * Constructs a new {@code Builder} object with the three mandatory
         * values that have no defaults: a source of randomness, an elliptic
         * curve, and a hash function (specified as a constructor so each
         * thread can hold its own copy).
         *
         * @param rand the source of randomness
         * @param curveSpec the elliptic curve
         * @param digestSupplier a constructor for a hash algorithm
         */
        public Builder(Random rand, ECNamedCurveParameterSpec curveSpec, Supplier<MessageDigest> digestSupplier) {
            m_random = rand;
            m_curveSpec = curveSpec;
            m_digestSupplier = digestSupplier;

            m_isBuilt = false;
        }

        /**
         * Specifies that all encryptions should be normalized.
         *
         * @return this {@code Builder} object.
         * @throws IllegalStateException if {@link #build()} has already been
         *             invoked.
         */
        public Builder normalizePoints() {
            if (m_isBuilt) throw new IllegalStateException("Cannot set parameters after building.");
            m_normalizePoints = true;
            return this;
        }

        /**
         * Specifies whether or not serialized points should be compressed.
         * Default: true
         *
         * @param compress whether or not to compress elliptic curve points
         * @return this {@code Builder} object.
         * @throws IllegalStateException if {@link #build()} has already been
         *             invoked.
         */
        public Builder setCompressSerializedPoints(boolean compress) {
            if (m_isBuilt) throw new IllegalStateException("Cannot set parameters after building.");
            m_compressSerializedPoints = compress;
            return this;
        }

        /**
         * Specifies that the oracle's decryptions should be blinded.
         *
         * @return this {@code Builder} object.
         * @throws IllegalStateException if {@link #build()} has already been
         *             invoked.
         */
        public Builder blindDecryption() {
            if (m_isBuilt) throw new IllegalStateException("Cannot set parameters after building.");
            m_blindDecryption = true;
            return this;
        }

        /**
         * Sets the maximum discrete log in the lookup table, i.e. the largest
         * amount the oracle can reveal. Must be set unless testing.
         *
         * @param maxLog the maximum discrete log value to include in the lookup
         *            table.
         * @return this {@code Builder} object.
         * @throws IllegalArgumentException if {@code maxLog < 0}
         * @throws IllegalStateException if {@link #build()} has already been
         *             invoked.
         */
        public Builder setMaxDiscreteLog(long maxLog) {
            if (m_isBuilt) throw new IllegalStateException("Cannot set parameters after building.");
            if (maxLog < 0)
                throw new IllegalArgumentException("Must specify a non-negative maximum value for discrete log table.");

            m_maxDiscreteLog = maxLog;
            return this;
        }

        /**
         * Sets the gap between entries in the discrete log lookup table. Larger
         * values shrink the table but slow down reveals. Default: 1
         *
         * @param gap the number of discrete log values between each saved
         *            value.
         * @return this {@code Builder} object.
         * @throws IllegalArgumentException if {@code gap < 1}
         * @throws IllegalStateException if {@link #build()} has already been
         *             invoked.
         */
        public Builder setLookupTableGap(int gap) {
            if (m_isBuilt) throw new IllegalStateException("Cannot set parameters after building.");
            if (gap < 1) throw new IllegalArgumentException("Discrete log table gap must be positive.");

            m_discreteLogTableGap = gap;
            return this;
        }

        /**
         * (THIS IS FOR TESTING ONLY!) Every encryptor reuses a single
         * randomization factor, so ciphertexts of equal values are equal.
         *
         * @return this {@code Builder} object.
         * @throws IllegalStateException if {@link #build()} has already been
         *             invoked.
         */
        public Builder useFastTestEncryptor() {
            if (m_isBuilt) throw new IllegalStateException("Cannot set parameters after building.");
            m_fastTestEncryptor = true;
            return this;
        }

        /**
         * Sets the number of background threads used for generating
         * randomization factors. If this value is 0, all randomization is
         * generated upon request. Default: 0
         *
         * @param threads the number of background threads to use for each
         *            {@link cloakfund.util.Encryptor Encryptor} object.
         * @return this {@code Builder} object.
         * @throws IllegalArgumentException if {@code threads < 0}
         * @throws IllegalStateException if {@link #build()} has already been
         *             invoked.
         */
        public Builder setEncryptorThreads(int threads) {
            if (m_isBuilt) throw new IllegalStateException("Cannot set parameters after building.");
            if (threads < 0)
                throw new IllegalArgumentException("Cannot specify a negative number of background threads");

            m_encryptorThreads = threads;
            return this;
        }

        /**
         * Sets the maximum buffer size for background-generated randomization
         * factors. Default: 10000
         *
         * @param queueSize the queue size for each encryptor.
         * @return this {@code Builder} object.
         * @throws IllegalArgumentException if {@code queueSize < 1}
         * @throws IllegalStateException if {@link #build()} has already been
         *             invoked.
         */
        public Builder setEncryptorQueueSize(int queueSize) {
            if (m_isBuilt) throw new IllegalStateException("Cannot set parameters after building.");
            if (queueSize < 1) throw new IllegalArgumentException("Encryptor buffer size must be positive");

            m_encryptorQueueSize = queueSize;
            return this;
        }

        /**
         * (THIS IS FOR TESTING ONLY!) Skips validation upon building.
         *
         * @return this {@code Builder} object.
         */
        public Builder forTesting() {
            if (m_isBuilt) throw new IllegalStateException("Cannot set parameters after building.");
            m_forTesting = true;
            return this;
        }

        /**
         * Constructs an {@code EncryptionParams} object from the values set in
         * this {@code Builder}. This method can only be invoked once.
         *
         * @return a new {@link cloakfund.util.EncryptionParams
         *         EncryptionParams} object.
         * @throws IllegalStateException if {@code build()} has already been
         *             invoked or if a required argument was not set.
         */
        public EncryptionParams build() {
            if (m_isBuilt) throw new IllegalStateException("Cannot build the same params twice.");
            if (!m_forTesting) {
                if (m_maxDiscreteLog < 0)
                    throw new IllegalStateException("Must specify a max discrete log when not for testing.");
                if (m_fastTestEncryptor)
                    throw new IllegalStateException("Cannot use fast test encryptor except while testing.");
            }

            m_isBuilt = true;
            return new EncryptionParams(this);
        }
    }
}
