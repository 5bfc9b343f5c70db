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

package test.cloakfund.cipher;

import java.math.BigInteger;
import java.util.Random;

import org.bouncycastle.crypto.ec.ECPair;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import cloakfund.cipher.CipherAlgebra;
import cloakfund.util.Decryptor;
import cloakfund.util.EncryptionParams;

import test.util.TestUtils;

public class CipherAlgebraTest {
    @Rule
    public ExpectedException thrown = ExpectedException.none();

    private final EncryptionParams m_params = TestUtils.sharedParams();
    private final BigInteger m_secretKey = m_params.getRandomIndex();
    private final CipherAlgebra m_algebra = new CipherAlgebra(m_params, m_params.derivePublicKey(m_secretKey));
    private final Decryptor m_decryptor = m_params.getDecryptor(m_secretKey);

    @Test
    public void testHomomorphicSum() {
        Random rand = new Random(TestUtils.RANDOM_SEED);
        ECPair sum = m_algebra.encryptZero();
        long expected = 0;
        for (int i = 0; i < 20; i++) {
            long amount = 1 + rand.nextInt(1000);
            sum = m_algebra.add(sum, m_algebra.encrypt(amount));
            expected += amount;
            Assert.assertEquals(expected, m_decryptor.decryptAmount(sum));
        }
    }

    @Test
    public void testScalarMultiplication() {
        ECPair cipher = m_algebra.encrypt(37);
        Assert.assertEquals(37 * 1500, m_decryptor.decryptAmount(m_algebra.mul(cipher, 1500)));
        Assert.assertEquals(37, m_decryptor.decryptAmount(m_algebra.mul(cipher, 1)));
    }

    @Test
    public void testEncryptZero() {
        Assert.assertEquals(0, m_decryptor.decryptAmount(m_algebra.encryptZero()));
        Assert.assertEquals(m_params.derivePublicKey(m_secretKey), m_algebra.getPublicKey());
    }

    @Test
    public void testNonPositiveScalar() {
        thrown.expect(IllegalArgumentException.class);
        m_algebra.mul(m_algebra.encrypt(5), 0);
    }

    @Test
    public void testUnrevealableAmount() {
        thrown.expect(IllegalArgumentException.class);
        m_algebra.encrypt(TestUtils.MAX_REVEALABLE + 1);
    }
}
