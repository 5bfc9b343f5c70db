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

import java.util.Random;

import cloakfund.util.CryptoConstants;

/**
 * A {@link RandomnessBeacon} that draws 32 bytes at a time from a local
 * pseudo-random generator.
 */
public class PrngBeacon implements RandomnessBeacon {
    private final Random m_random;

    public PrngBeacon() {
        this(CryptoConstants.buildPrng());
    }

    public PrngBeacon(Random random) {
        m_random = random;
    }

    @Override
    public byte[] nextValue() {
        byte[] value = new byte[32];
        synchronized (m_random) {
            m_random.nextBytes(value);
        }
        return value;
    }
}
