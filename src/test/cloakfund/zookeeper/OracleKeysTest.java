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

package test.cloakfund.zookeeper;

import org.junit.Assert;
import org.junit.Test;

import com.google.common.collect.ImmutableList;

import cloakfund.cipher.CipherAlgebra;
import cloakfund.reveal.RevealOracle;
import cloakfund.reveal.RevealTicket;
import cloakfund.util.EncryptionParams;
import cloakfund.zookeeper.OracleKeys;

import test.util.TestUtils;

public class OracleKeysTest {
    @Test
    public void testSerialization() {
        EncryptionParams params = TestUtils.sharedParams();
        TestUtils.testSerialization(OracleKeys.of(RevealOracle.generate(params)), OracleKeys::serialReadIn, params);
    }

    @Test
    public void testPublishedKeysVerifyOracle() {
        EncryptionParams params = TestUtils.sharedParams();
        RevealOracle oracle = RevealOracle.generate(params);
        OracleKeys keys = OracleKeys.of(oracle);

        Assert.assertEquals(oracle.getEncryptionKey(), keys.getEncryptionKey());
        Assert.assertEquals(oracle.getVerificationKey(), keys.getVerificationKey());

        RevealTicket ticket = new RevealTicket(5,
                ImmutableList.of(new CipherAlgebra(params, keys.getEncryptionKey()).encrypt(77)), new byte[] { 1 });
        Assert.assertTrue(keys.buildVerifier(params).verify(ticket, oracle.answer(ticket)));
        Assert.assertFalse(OracleKeys.of(RevealOracle.generate(params)).buildVerifier(params).verify(ticket,
                oracle.answer(ticket)));
    }
}
