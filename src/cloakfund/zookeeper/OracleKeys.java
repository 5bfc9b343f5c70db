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

package cloakfund.zookeeper;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import org.bouncycastle.math.ec.ECPoint;

import cloakfund.io.SerialHelpers;
import cloakfund.io.SerialWriter;
import cloakfund.reveal.RevealOracle;
import cloakfund.reveal.RevealVerifier;
import cloakfund.util.EncryptionParams;

/**
 * The oracle's public keys as published to ZooKeeper: the El Gamal key that
 * backers encrypt under and the key that verifies the oracle's signatures.
 */
public class OracleKeys implements SerialWriter {
    private final ECPoint m_encryptionKey;
    private final ECPoint m_verificationKey;

    public OracleKeys(ECPoint encryptionKey, ECPoint verificationKey) {
        m_encryptionKey = encryptionKey;
        m_verificationKey = verificationKey;
    }

    public static OracleKeys of(RevealOracle oracle) {
        return new OracleKeys(oracle.getEncryptionKey(), oracle.getVerificationKey());
    }

    public ECPoint getEncryptionKey() {
        return m_encryptionKey;
    }

    public ECPoint getVerificationKey() {
        return m_verificationKey;
    }

    public RevealVerifier buildVerifier(EncryptionParams params) {
        return new RevealVerifier(params, m_encryptionKey, m_verificationKey);
    }

    public static OracleKeys serialReadIn(InputStream inStream, EncryptionParams params) throws IOException {
        ECPoint encryptionKey = SerialHelpers.readECPoint(inStream, params);
        ECPoint verificationKey = SerialHelpers.readECPoint(inStream, params);
        return new OracleKeys(encryptionKey, verificationKey);
    }

    @Override
    public void serialWriteOut(OutputStream outStream, boolean compressPoints) throws IOException {
        SerialHelpers.writeECPoint(outStream, m_encryptionKey, compressPoints);
        SerialHelpers.writeECPoint(outStream, m_verificationKey, compressPoints);
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) return true;
        if (!(o instanceof OracleKeys)) return false;

        OracleKeys keys = (OracleKeys) o;
        return m_encryptionKey.equals(keys.m_encryptionKey) && m_verificationKey.equals(keys.m_verificationKey);
    }

    @Override
    public int hashCode() {
        return 31 * m_encryptionKey.hashCode() + m_verificationKey.hashCode();
    }
}
