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

package cloakfund.applications;

import java.io.IOException;
import java.math.BigInteger;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import cloakfund.reveal.RevealOracle;
import cloakfund.util.CryptoConstants;
import cloakfund.util.EncryptionParams;
import cloakfund.util.ThreadLogFormatter;
import cloakfund.zookeeper.ZooKeeperOracleWorker;

/**
 * Runs a reveal oracle that answers tickets posted to ZooKeeper.
 *
 * Usage: {@code OracleNode <connectString> [<decryptionKey> <signingKey>]}.
 * Without keys, fresh random keys are generated and published.
 */
public class OracleNode {
    static final long MAX_REVEALABLE = 1L << 20;
    static final int LOOKUP_TABLE_GAP = 64;
    static final int ENCRYPTOR_THREADS = 2;
    static final int ENCRYPTOR_QUEUE_SIZE = 1000;

    private OracleNode() {}

    static EncryptionParams buildParams() {
        return new EncryptionParams.Builder(CryptoConstants.buildPrng(), CryptoConstants.CURVE, CryptoConstants.DIGEST)
                .normalizePoints().setMaxDiscreteLog(MAX_REVEALABLE).setLookupTableGap(LOOKUP_TABLE_GAP)
                .setEncryptorThreads(ENCRYPTOR_THREADS).setEncryptorQueueSize(ENCRYPTOR_QUEUE_SIZE).build();
    }

    public static void main(String[] args) throws IOException, InterruptedException {
        if (args.length != 1 && args.length != 3) {
            System.out.println("Usage: OracleNode <connectString> [<decryptionKey> <signingKey>]");
            System.exit(-1);
        }
        Logger logger = ThreadLogFormatter.installOn("cloakfund.oracle", Level.INFO);

        EncryptionParams params = buildParams();
        RevealOracle oracle = args.length == 3
                ? new RevealOracle(params, new BigInteger(args[1]), new BigInteger(args[2]))
                : RevealOracle.generate(params);

        try (ZooKeeperOracleWorker worker = new ZooKeeperOracleWorker(params, oracle, args[0])) {
            Thread workerThread = new Thread(worker, "OracleWorker");
            workerThread.start();
            Runtime.getRuntime().addShutdownHook(new Thread(worker::shutdown));

            logger.info("Oracle running against " + args[0]);
            while (!worker.awaitTermination(1, TimeUnit.MINUTES)) {
                logger.fine("Oracle still running");
            }
            workerThread.join();
        }
    }
}
