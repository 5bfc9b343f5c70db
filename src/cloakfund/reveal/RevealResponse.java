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
import java.util.Arrays;
import java.util.Objects;

import cloakfund.io.SerialHelpers;
import cloakfund.io.SerialWriter;
import cloakfund.util.EncryptionParams;

/**
 * The oracle's answer to a {@link RevealTicket}: the encoded plaintexts (see
 * {@link RevealPayload}), a serialized {@link RevealProof}, and the ticket's
 * context returned unchanged. Nothing in a response is trusted until
 * {@link RevealVerifier} accepts it.
 */
public class RevealResponse implements SerialWriter {
    private final long m_requestId;
    private final byte[] m_plaintexts;
    private final byte[] m_proof;
    private final byte[] m_context;

    public RevealResponse(long requestId, byte[] plaintexts, byte[] proof, byte[] context) {
        m_requestId = requestId;
        m_plaintexts = plaintexts.clone();
        m_proof = proof.clone();
        m_context = context.clone();
    }

    public long getRequestId() {
        return m_requestId;
    }

    public byte[] getPlaintexts() {
        return m_plaintexts.clone();
    }

    public byte[] getProof() {
        return m_proof.clone();
    }

    public byte[] getContext() {
        return m_context.clone();
    }

    public static RevealResponse serialReadIn(InputStream inStream, EncryptionParams params) throws IOException {
        long requestId = SerialHelpers.readLong(inStream);
        byte[] plaintexts = SerialHelpers.readBytes(inStream);
        byte[] proof = SerialHelpers.readBytes(inStream);
        byte[] context = SerialHelpers.readBytes(inStream);
        return new RevealResponse(requestId, plaintexts, proof, context);
    }

    @Override
    public void serialWriteOut(OutputStream outStream, boolean compressPoints) throws IOException {
        SerialHelpers.writeLong(outStream, m_requestId);
        SerialHelpers.writeBytes(outStream, m_plaintexts);
        SerialHelpers.writeBytes(outStream, m_proof);
        SerialHelpers.writeBytes(outStream, m_context);
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) return true;
        if (!(o instanceof RevealResponse)) return false;

        RevealResponse resp = (RevealResponse) o;
        return m_requestId == resp.m_requestId && Arrays.equals(m_plaintexts, resp.m_plaintexts)
                && Arrays.equals(m_proof, resp.m_proof) && Arrays.equals(m_context, resp.m_context);
    }

    @Override
    public int hashCode() {
        return Objects.hash(m_requestId, Arrays.hashCode(m_plaintexts), Arrays.hashCode(m_proof),
                Arrays.hashCode(m_context));
    }
}
