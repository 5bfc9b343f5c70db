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

package test.cloakfund.zkproofs;

import java.math.BigInteger;

import org.bouncycastle.math.ec.ECPoint;
import org.junit.Assert;
import org.junit.Test;

import com.google.common.base.Charsets;

import cloakfund.util.EncryptionParams;
import cloakfund.zkproofs.SchnorrSignature;

import test.util.TestUtils;

public class SchnorrSignatureTest {
    private final EncryptionParams m_params = TestUtils.sharedParams();
    private final BigInteger m_signingKey = m_params.getRandomIndex();
    private final ECPoint m_verificationKey = m_params.derivePublicKey(m_signingKey);

    private static byte[] _bytes(String s) {
        return s.getBytes(Charsets.UTF_8);
    }

    @Test
    public void testSignAndVerify() {
        SchnorrSignature sig = SchnorrSignature.sign(m_params, m_signingKey, _bytes("request"), _bytes("values"));

        Assert.assertTrue(sig.verify(m_verificationKey, _bytes("request"), _bytes("values")));
        TestUtils.testSerialization(sig, SchnorrSignature::serialReadIn, m_params);
    }

    @Test
    public void testAlteredMessage() {
        SchnorrSignature sig = SchnorrSignature.sign(m_params, m_signingKey, _bytes("request"), _bytes("values"));

        Assert.assertFalse(sig.verify(m_verificationKey, _bytes("request"), _bytes("valueZ")));
        Assert.assertFalse(sig.verify(m_verificationKey, _bytes("request")));
    }

    @Test
    public void testWrongKey() {
        SchnorrSignature sig = SchnorrSignature.sign(m_params, m_signingKey, _bytes("message"));
        ECPoint otherKey = m_params.derivePublicKey(m_params.getRandomIndex());

        Assert.assertFalse(sig.verify(otherKey, _bytes("message")));
    }
}
