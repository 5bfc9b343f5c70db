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

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

import cloakfund.io.SerialHelpers;
import cloakfund.io.SerialWriter;
import cloakfund.util.EncryptionParams;
import cloakfund.zkproofs.DecryptionProof;
import cloakfund.zkproofs.SchnorrSignature;

/**
 * The proof attached to a {@link RevealResponse}: one {@link DecryptionProof}
 * per revealed ciphertext, plus the oracle's {@link SchnorrSignature} over the
 * request id, the encoded plaintexts and the context.
 */
public class RevealProof implements SerialWriter {
    private final List<DecryptionProof> m_decryptionProofs;
    private final SchnorrSignature m_signature;

    public RevealProof(List<DecryptionProof> decryptionProofs, SchnorrSignature signature) {
        m_decryptionProofs = ImmutableList.copyOf(decryptionProofs);
        m_signature = signature;
    }

    public List<DecryptionProof> getDecryptionProofs() {
        return m_decryptionProofs;
    }

    public SchnorrSignature getSignature() {
        return m_signature;
    }

    public static RevealProof serialReadIn(InputStream inStream, EncryptionParams params) throws IOException {
        int count = inStream.read();
        if (count < 0) throw new IOException("Missing proof count");

        ImmutableList.Builder<DecryptionProof> proofs = ImmutableList.builder();
        for (int i = 0; i < count; i++)
            proofs.add(DecryptionProof.serialReadIn(inStream, params));
        SchnorrSignature signature = SchnorrSignature.serialReadIn(inStream, params);
        return new RevealProof(proofs.build(), signature);
    }

    @Override
    public void serialWriteOut(OutputStream outStream, boolean compressPoints) throws IOException {
        if (m_decryptionProofs.size() > 0xff) throw new IllegalStateException("Too many decryption proofs");
        outStream.write(m_decryptionProofs.size());
        for (DecryptionProof proof : m_decryptionProofs)
            proof.serialWriteOut(outStream, compressPoints);
        m_signature.serialWriteOut(outStream, compressPoints);
    }

    /**
     * The message parts covered by the oracle's signature.
     */
    static byte[][] signedParts(long requestId, byte[] plaintexts, byte[] context) {
        byte[] idBytes = new byte[8];
        for (int i = 0; i < 8; i++)
            idBytes[i] = (byte) (requestId >>> (56 - 8 * i));
        return new byte[][] { idBytes, plaintexts, context };
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) return true;
        if (!(o instanceof RevealProof)) return false;

        RevealProof proof = (RevealProof) o;
        return m_decryptionProofs.equals(proof.m_decryptionProofs) && m_signature.equals(proof.m_signature);
    }

    @Override
    public int hashCode() {
        return Objects.hash(m_decryptionProofs, m_signature);
    }
}
