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

package test.cloakfund.reveal;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

import org.bouncycastle.crypto.ec.ECPair;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableList;

import cloakfund.cipher.CipherAlgebra;
import cloakfund.reveal.RevealOracle;
import cloakfund.reveal.RevealPayload;
import cloakfund.reveal.RevealProof;
import cloakfund.reveal.RevealResponse;
import cloakfund.reveal.RevealTicket;
import cloakfund.reveal.RevealVerifier;
import cloakfund.util.EncryptionParams;
import cloakfund.zkproofs.DecryptionProof;
import cloakfund.zkproofs.SchnorrSignature;

import test.util.TestUtils;

public class RevealVerifierTest {
    private static final byte[] CONTEXT = new byte[] { 7, 7, 7 };

    private EncryptionParams m_params;
    private RevealOracle m_oracle;
    private RevealVerifier m_verifier;
    private CipherAlgebra m_algebra;

    private RevealTicket m_ticket;
    private RevealResponse m_response;

    @Before
    public void init() {
        m_params = TestUtils.sharedParams();
        m_oracle = RevealOracle.generate(m_params);
        m_verifier = m_oracle.buildVerifier();
        m_algebra = new CipherAlgebra(m_params, m_oracle.getEncryptionKey());

        m_ticket = new RevealTicket(42, ImmutableList.of(m_algebra.encrypt(1100), m_algebra.encrypt(1000)), CONTEXT);
        m_response = m_oracle.answer(m_ticket);
    }

    @Test
    public void testHonestResponse() throws Exception {
        Assert.assertTrue(m_verifier.verify(m_ticket, m_response));
        Assert.assertEquals(ImmutableList.of(1100L, 1000L), RevealPayload.decode(m_response.getPlaintexts(), 2));
        Assert.assertArrayEquals(CONTEXT, m_response.getContext());
    }

    @Test
    public void testSerialization() {
        TestUtils.testSerialization(m_ticket, RevealTicket::serialReadIn, m_params);
        TestUtils.testSerialization(m_response, RevealResponse::serialReadIn, m_params);
    }

    @Test
    public void testAlteredPlaintexts() {
        RevealResponse forged = new RevealResponse(42, RevealPayload.encode(ImmutableList.of(1000L, 1000L)),
                m_response.getProof(), CONTEXT);
        Assert.assertFalse(m_verifier.verify(m_ticket, forged));
    }

    @Test
    public void testReplayedUnderAnotherId() {
        RevealTicket other = new RevealTicket(43, m_ticket.getCiphertexts(), CONTEXT);
        RevealResponse replayed = new RevealResponse(43, m_response.getPlaintexts(), m_response.getProof(), CONTEXT);

        Assert.assertFalse(m_verifier.verify(other, m_response));
        Assert.assertFalse(m_verifier.verify(other, replayed));
    }

    @Test
    public void testAlteredContext() {
        RevealResponse forged = new RevealResponse(42, m_response.getPlaintexts(), m_response.getProof(),
                new byte[] { 8 });
        RevealTicket matching = new RevealTicket(42, m_ticket.getCiphertexts(), new byte[] { 8 });

        Assert.assertFalse(m_verifier.verify(m_ticket, forged));
        Assert.assertFalse(m_verifier.verify(matching, forged));
    }

    @Test
    public void testDifferentCiphertexts() {
        RevealTicket other = new RevealTicket(42, ImmutableList.of(m_algebra.encrypt(1200), m_algebra.encrypt(1000)),
                CONTEXT);
        Assert.assertFalse(m_verifier.verify(other, m_response));
    }

    @Test
    public void testImpostorOracle() {
        // A different oracle signs correct values, but not with the expected key.
        RevealOracle impostor = new RevealOracle(m_params, m_params.getRandomIndex(), m_params.getRandomIndex());
        RevealTicket ticket = new RevealTicket(42,
                ImmutableList.of(new CipherAlgebra(m_params, impostor.getEncryptionKey()).encrypt(5)), CONTEXT);
        Assert.assertFalse(m_verifier.verify(ticket, impostor.answer(ticket)));
    }

    @Test
    public void testSignedButUnproven() {
        // Correctly signed plaintexts with a decryption proof for the wrong value.
        List<ECPair> ciphers = m_ticket.getCiphertexts();
        BigInteger signingKey = m_params.getRandomIndex();
        RevealVerifier verifier = new RevealVerifier(m_params, m_oracle.getEncryptionKey(),
                m_params.derivePublicKey(signingKey));

        byte[] payload = RevealPayload.encode(ImmutableList.of(2000L, 1000L));
        ImmutableList<DecryptionProof> proofs = ImmutableList.of(
                DecryptionProof.buildProof(m_params, ciphers.get(0), 2000, m_oracle.getEncryptionKey(),
                        m_params.getRandomIndex()),
                DecryptionProof.buildProof(m_params, ciphers.get(1), 1000, m_oracle.getEncryptionKey(),
                        m_params.getRandomIndex()));
        byte[] idBytes = new byte[] { 0, 0, 0, 0, 0, 0, 0, 42 };
        SchnorrSignature sig = SchnorrSignature.sign(m_params, signingKey, idBytes, payload, CONTEXT);
        RevealResponse forged = new RevealResponse(42, payload, new RevealProof(proofs, sig).toByteArray(), CONTEXT);

        Assert.assertFalse(verifier.verify(m_ticket, forged));
    }

    @Test
    public void testMalformedProof() {
        byte[] proof = m_response.getProof();
        RevealResponse truncated = new RevealResponse(42, m_response.getPlaintexts(),
                Arrays.copyOf(proof, proof.length / 2), CONTEXT);
        RevealResponse malformedPayload = new RevealResponse(42, new byte[] { 1, 2, 3 }, proof, CONTEXT);

        Assert.assertFalse(m_verifier.verify(m_ticket, truncated));
        Assert.assertFalse(m_verifier.verify(m_ticket, malformedPayload));
    }
}
