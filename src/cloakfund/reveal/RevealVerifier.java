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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import org.bouncycastle.math.ec.ECPoint;

import cloakfund.util.EncryptionParams;

/**
 * Checks an oracle response against the ticket it claims to answer. A response
 * verifies only if it names the ticket's request id, returns the ticket's
 * context unchanged, carries a valid oracle signature over both of those and
 * the plaintexts, and includes a valid decryption proof for every ciphertext in
 * the ticket.
 *
 * @author ethan@cs.cornell.edu
 */
public class RevealVerifier {
    private final EncryptionParams m_params;
    private final ECPoint m_oracleEncryptionKey;
    private final ECPoint m_oracleVerificationKey;

    public RevealVerifier(EncryptionParams params, ECPoint oracleEncryptionKey, ECPoint oracleVerificationKey) {
        m_params = params;
        m_oracleEncryptionKey = oracleEncryptionKey;
        m_oracleVerificationKey = oracleVerificationKey;
    }

    public boolean verify(RevealTicket ticket, RevealResponse response) {
        if (ticket.getRequestId() != response.getRequestId()) return false;
        if (!Arrays.equals(ticket.getContext(), response.getContext())) return false;

        RevealProof proof;
        List<Long> values;
        try {
            proof = RevealProof.serialReadIn(new ByteArrayInputStream(response.getProof()), m_params);
            values = RevealPayload.decode(response.getPlaintexts(), ticket.getCiphertexts().size());
        } catch (IOException e) {
            return false;
        }

        byte[][] signedParts = RevealProof.signedParts(response.getRequestId(), response.getPlaintexts(),
                response.getContext());
        if (!proof.getSignature().verify(m_oracleVerificationKey, signedParts)) return false;

        if (proof.getDecryptionProofs().size() != values.size()) return false;
        for (int i = 0; i < values.size(); i++) {
            if (!proof.getDecryptionProofs().get(i).verify(ticket.getCiphertexts().get(i), values.get(i),
                    m_oracleEncryptionKey))
                return false;
        }
        return true;
    }
}
