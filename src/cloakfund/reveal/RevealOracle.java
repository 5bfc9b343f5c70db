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

package cloakfund.reveal;

import java.math.BigInteger;
import java.util.List;
import java.util.logging.Logger;

import org.bouncycastle.crypto.ec.ECPair;
import org.bouncycastle.math.ec.ECPoint;

import com.google.common.collect.ImmutableList;

import cloakfund.util.Decryptor;
import cloakfund.util.EncryptionParams;
import cloakfund.zkproofs.DecryptionProof;
import cloakfund.zkproofs.SchnorrSignature;

/**
 * The decryption oracle. It holds the El Gamal secret key that every
 * contribution and target is encrypted under, plus a separate signing key, and
 * answers each {@link RevealTicket} with the plaintexts and a proof that
 * {@link RevealVerifier} will accept.
 *
 * @author ethan@cs.cornell.edu
 */
public class RevealOracle {
    private static final Logger LOGGER = Logger.getLogger("cloakfund.oracle");

    private final EncryptionParams m_params;
    private final BigInteger m_decryptionKey;
    private final ECPoint m_encryptionKey;
    private final BigInteger m_signingKey;
    private final ECPoint m_verificationKey;
    private final Decryptor m_decryptor;

    public RevealOracle(EncryptionParams params, BigInteger decryptionKey, BigInteger signingKey) {
        m_params = params;
        m_decryptionKey = decryptionKey;
        m_encryptionKey = params.derivePublicKey(decryptionKey);
        m_signingKey = signingKey;
        m_verificationKey = params.derivePublicKey(signingKey);
        m_decryptor = params.getDecryptor(decryptionKey);
    }

    /**
     * Generates a fresh oracle with random keys.
     */
    public static RevealOracle generate(EncryptionParams params) {
        return new RevealOracle(params, params.getRandomIndex(), params.getRandomIndex());
    }

    public ECPoint getEncryptionKey() {
        return m_encryptionKey;
    }

    public ECPoint getVerificationKey() {
        return m_verificationKey;
    }

    /**
     * Builds a verifier that accepts exactly the responses this oracle signs.
     */
    public RevealVerifier buildVerifier() {
        return new RevealVerifier(m_params, m_encryptionKey, m_verificationKey);
    }

    /**
     * Decrypts every ciphertext in the ticket and proves each decryption.
     *
     * @throws IllegalArgumentException if some ciphertext does not decrypt to a
     *             value within the lookup table.
     */
    public RevealResponse answer(RevealTicket ticket) {
        ImmutableList.Builder<Long> values = ImmutableList.builder();
        ImmutableList.Builder<DecryptionProof> proofs = ImmutableList.builder();
        for (ECPair cipher : ticket.getCiphertexts()) {
            long value = m_decryptor.decryptAmount(cipher);
            values.add(value);
            proofs.add(DecryptionProof.buildProof(m_params, cipher, value, m_encryptionKey, m_decryptionKey));
        }
        List<Long> plaintexts = values.build();

        byte[] payload = RevealPayload.encode(plaintexts);
        SchnorrSignature signature = SchnorrSignature.sign(m_params, m_signingKey,
                RevealProof.signedParts(ticket.getRequestId(), payload, ticket.getContext()));
        RevealProof proof = new RevealProof(proofs.build(), signature);

        LOGGER.fine("Answered reveal request " + ticket.getRequestId() + " with " + plaintexts.size() + " values");
        return new RevealResponse(ticket.getRequestId(), payload, proof.toByteArray(), ticket.getContext());
    }
}
