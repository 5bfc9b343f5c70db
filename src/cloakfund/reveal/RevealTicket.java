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
import java.util.List;
import java.util.Objects;

import org.bouncycastle.crypto.ec.ECPair;

import com.google.common.collect.ImmutableList;

import cloakfund.io.SerialHelpers;
import cloakfund.io.SerialWriter;
import cloakfund.util.EncryptionParams;

/**
 * A request for the oracle to reveal a list of ciphertexts. The request id is
 * assigned by the platform and never reused. The context is opaque to the
 * oracle and is returned unchanged in its response, which lets the platform
 * correlate a refund reveal with the contributor who asked for it.
 *
 * @author ethan@cs.cornell.edu
 */
public class RevealTicket implements SerialWriter {
    private final long m_requestId;
    private final List<ECPair> m_ciphertexts;
    private final byte[] m_context;

    public RevealTicket(long requestId, List<ECPair> ciphertexts, byte[] context) {
        if (ciphertexts.isEmpty()) throw new IllegalArgumentException("Must reveal at least one ciphertext");
        m_requestId = requestId;
        m_ciphertexts = ImmutableList.copyOf(ciphertexts);
        m_context = context.clone();
    }

    public long getRequestId() {
        return m_requestId;
    }

    public List<ECPair> getCiphertexts() {
        return m_ciphertexts;
    }

    public byte[] getContext() {
        return m_context.clone();
    }

    public static RevealTicket serialReadIn(InputStream inStream, EncryptionParams params) throws IOException {
        long requestId = SerialHelpers.readLong(inStream);
        List<ECPair> ciphertexts = SerialHelpers.readECPairList(inStream, params);
        byte[] context = SerialHelpers.readBytes(inStream);
        if (ciphertexts.isEmpty()) throw new IOException("Ticket without ciphertexts");
        return new RevealTicket(requestId, ciphertexts, context);
    }

    @Override
    public void serialWriteOut(OutputStream outStream, boolean compressPoints) throws IOException {
        SerialHelpers.writeLong(outStream, m_requestId);
        SerialHelpers.writeECPairList(outStream, m_ciphertexts, compressPoints);
        SerialHelpers.writeBytes(outStream, m_context);
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) return true;
        if (!(o instanceof RevealTicket)) return false;

        RevealTicket ticket = (RevealTicket) o;
        return m_requestId == ticket.m_requestId && m_ciphertexts.equals(ticket.m_ciphertexts)
                && Arrays.equals(m_context, ticket.m_context);
    }

    @Override
    public int hashCode() {
        return Objects.hash(m_requestId, m_ciphertexts, Arrays.hashCode(m_context));
    }

    @Override
    public String toString() {
        return "RevealTicket[" + m_requestId + ", " + m_ciphertexts.size() + " ciphertexts]";
    }
}
