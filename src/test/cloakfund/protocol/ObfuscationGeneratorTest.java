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

package test.cloakfund.protocol;

import java.math.BigInteger;
import java.util.HashSet;
import java.util.Set;

import org.bouncycastle.crypto.ec.ECPair;
import org.bouncycastle.math.ec.ECPoint;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import cloakfund.cipher.CipherAlgebra;
import cloakfund.errors.StateException;
import cloakfund.protocol.ObfuscationGenerator;
import cloakfund.protocol.PlatformConfig;
import cloakfund.util.Decryptor;
import cloakfund.util.EncryptionParams;

import test.util.TestUtils;

public class ObfuscationGeneratorTest {
    private static final long NOW = 1_700_000_000L;

    @Rule
    public ExpectedException thrown = ExpectedException.none();

    private EncryptionParams m_params;
    private CipherAlgebra m_algebra;
    private Decryptor m_decryptor;
    private ECPoint m_creator;

    @Before
    public void init() {
        m_params = TestUtils.sharedParams();
        BigInteger secretKey = m_params.getRandomIndex();
        m_algebra = new CipherAlgebra(m_params, m_params.derivePublicKey(secretKey));
        m_decryptor = m_params.getDecryptor(secretKey);
        m_creator = m_params.derivePublicKey(m_params.getRandomIndex());
    }

    private ObfuscationGenerator _generator(long min, long max) {
        PlatformConfig config = new PlatformConfig.Builder().setMultiplierRange(min, max).build();
        return new ObfuscationGenerator(config, m_algebra, () -> new byte[] { 1, 2, 3 });
    }

    @Test
    public void testObfuscatedTarget() {
        ObfuscationGenerator generator = _generator(1000, 2000);
        ECPair target = m_algebra.encrypt(25);

        ObfuscationGenerator.Obfuscation obfuscation = generator.derive(1, m_creator, 1, target, NOW);

        long multiplier = obfuscation.getMultiplier();
        Assert.assertTrue(multiplier >= 1000 && multiplier < 2000);
        Assert.assertEquals(25 * multiplier, m_decryptor.decryptAmount(obfuscation.getObfuscatedTarget()));
    }

    @Test
    public void testDistinctWithinTimeStep() {
        ObfuscationGenerator generator = _generator(1000, 1004);
        ECPair target = m_algebra.encrypt(1);

        Set<Long> multipliers = new HashSet<>();
        for (long id = 1; id <= 4; id++) {
            long multiplier = generator.derive(id, m_creator, id, target, NOW).getMultiplier();
            Assert.assertTrue(multiplier >= 1000 && multiplier < 1004);
            multipliers.add(multiplier);
        }
        Assert.assertEquals(4, multipliers.size());

        thrown.expect(StateException.class);
        generator.derive(5, m_creator, 5, target, NOW);
    }

    @Test
    public void testNewTimeStepResets() {
        ObfuscationGenerator generator = _generator(1000, 1002);
        ECPair target = m_algebra.encrypt(1);

        generator.derive(1, m_creator, 1, target, NOW);
        generator.derive(2, m_creator, 2, target, NOW);
        long multiplier = generator.derive(3, m_creator, 3, target, NOW + 1).getMultiplier();

        Assert.assertTrue(multiplier == 1000 || multiplier == 1001);
    }
}
