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

package cloakfund.protocol;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.HashSet;
import java.util.Set;

import org.bouncycastle.crypto.ec.ECPair;
import org.bouncycastle.math.ec.ECPoint;

import cloakfund.cipher.CipherAlgebra;
import cloakfund.errors.StateException;
import cloakfund.util.EncryptionParams;

/**
 * Derives each campaign's obfuscation multiplier and the obfuscated target
 * {@code target * multiplier}.
 *
 * The multiplier is a hash of the current time, a fresh beacon value, the
 * creator's identity, the campaign id and a sequence number, reduced into the
 * configured range. Because the beacon value is unknown until creation, no
 * single party controlling the other inputs can predict it. Within one time
 * step no two campaigns receive the same multiplier: a collision is rehashed
 * with an incremented probe counter.
 *
 * @author ethan@cs.cornell.edu
 */
public class ObfuscationGenerator {
    public static class Obfuscation {
        private final long m_multiplier;
        private final ECPair m_obfuscatedTarget;

        private Obfuscation(long multiplier, ECPair obfuscatedTarget) {
            m_multiplier = multiplier;
            m_obfuscatedTarget = obfuscatedTarget;
        }

        public long getMultiplier() {
            return m_multiplier;
        }

        public ECPair getObfuscatedTarget() {
            return m_obfuscatedTarget;
        }
    }

    private final EncryptionParams m_params;
    private final CipherAlgebra m_algebra;
    private final RandomnessBeacon m_beacon;
    private final long m_minMultiplier;
    private final long m_rangeSize;

    private long m_currentTimeStep = Long.MIN_VALUE;
    private final Set<Long> m_usedThisStep = new HashSet<>();

    public ObfuscationGenerator(PlatformConfig config, CipherAlgebra algebra, RandomnessBeacon beacon) {
        m_params = algebra.getParams();
        m_algebra = algebra;
        m_beacon = beacon;
        m_minMultiplier = config.getMinMultiplier();
        m_rangeSize = config.getMaxMultiplier() - config.getMinMultiplier();
    }

    public synchronized Obfuscation derive(long campaignId, ECPoint creator, long sequenceNumber, ECPair target,
            long now) {
        if (now != m_currentTimeStep) {
            m_currentTimeStep = now;
            m_usedThisStep.clear();
        }
        if (m_usedThisStep.size() >= m_rangeSize)
            throw new StateException("Multiplier range exhausted for time step " + now);

        byte[] beaconValue = m_beacon.nextValue();
        long multiplier;
        int probe = 0;
        do {
            multiplier = _mix(now, beaconValue, creator, campaignId, sequenceNumber, probe++);
        } while (m_usedThisStep.contains(multiplier));
        m_usedThisStep.add(multiplier);

        return new Obfuscation(multiplier, m_algebra.mul(target, multiplier));
    }

    private long _mix(long now, byte[] beaconValue, ECPoint creator, long campaignId, long sequenceNumber,
            int probe) {
        byte[] numbers = ByteBuffer.allocate(3 * Long.BYTES + Integer.BYTES).putLong(now).putLong(campaignId)
                .putLong(sequenceNumber).putInt(probe).array();
        BigInteger mixed = m_params.hashDataAndPoints(new byte[][] { numbers, beaconValue }, creator);
        return m_minMultiplier + mixed.mod(BigInteger.valueOf(m_rangeSize)).longValueExact();
    }
}
