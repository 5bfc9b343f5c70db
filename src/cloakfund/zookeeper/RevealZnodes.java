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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.apache.zookeeper.CreateMode;
import org.apache.zookeeper.KeeperException;
import org.apache.zookeeper.ZooDefs;
import org.apache.zookeeper.ZooKeeper;

import cloakfund.io.SerialHelpers;
import cloakfund.io.SerialReader;
import cloakfund.io.SerialWriter;
import cloakfund.util.EncryptionParams;

/**
 * The znode layout shared by the platform's reveal channel and the oracle
 * worker, and the framing of every znode's data: the parameter headers
 * followed by one serialized object.
 */
class RevealZnodes {
    enum CommonDir {
        ROOT("/cloakfund"), ORACLE_KEYS("/cloakfund/oracle-keys"), TICKET("/cloakfund/tickets"), RESPONSE(
                "/cloakfund/responses");

        private final Path m_path;

        private CommonDir(String pathStr) {
            m_path = Paths.get(pathStr);
        }

        public Path getPath() {
            return m_path;
        }

        public String resolveToString(String filename) {
            return m_path.resolve(filename).toString();
        }

        @Override
        public String toString() {
            return m_path.toString();
        }
    }

    static final int SESSION_TIMEOUT = 12000; // in ms

    /**
     * Znode names sort in request order.
     */
    static String nodeName(long requestId) {
        return String.format("%019d", requestId);
    }

    static byte[] encode(EncryptionParams params, SerialWriter value) {
        try {
            ByteArrayOutputStream outStream = new ByteArrayOutputStream();
            SerialHelpers.writeHeaders(outStream, params);
            value.serialWriteOut(outStream, params.compressSerializedPoints());
            return outStream.toByteArray();
        } catch (IOException e) {
            // There's no real IO here.
            throw new RuntimeException(e);
        }
    }

    static <T> T decode(EncryptionParams params, byte[] data, SerialReader<T> reader) throws IOException {
        InputStream inStream = new ByteArrayInputStream(data);
        if (!SerialHelpers.verifyHeaders(inStream, params))
            throw new IOException("Znode data was written with different parameters");
        return reader.serialReadIn(inStream, params);
    }

    static void createDirs(ZooKeeper zk) throws KeeperException, InterruptedException {
        for (CommonDir dir : CommonDir.values()) {
            try {
                zk.create(dir.toString(), new byte[0], ZooDefs.Ids.OPEN_ACL_UNSAFE, CreateMode.PERSISTENT);
            } catch (KeeperException e) {
                // Someone else already created it.
                if (e.code() != KeeperException.Code.NODEEXISTS) throw e;
            }
        }
    }

    static void deleteIfPresent(ZooKeeper zk, String path) throws KeeperException, InterruptedException {
        try {
            zk.delete(path, -1);
        } catch (KeeperException e) {
            if (e.code() != KeeperException.Code.NONODE) throw e;
        }
    }

    private RevealZnodes() {}
}
