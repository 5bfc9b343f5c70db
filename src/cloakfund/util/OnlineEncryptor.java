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

package cloakfund.util;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.bouncycastle.crypto.ec.ECPair;
import org.bouncycastle.math.ec.ECPoint;

/**
 * An {@link cloakfund.util.AbstractEncryptor AbstractEncryptor} that computes
 * randomization factors online or in the background. Background threads fill a
 * bounded queue; when the queue is empty the factor is computed in the calling
 * thread instead. With no threads, every factor is computed on demand.
 *
 * @see cloakfund.util.Encryptor
 * @author ethan@cs.cornell.edu
 */
public class OnlineEncryptor extends AbstractEncryptor {
    private final BlockingQueue<ECPair> m_encryptionQueue;

    /**
     * Constructs a new encryptor.
     *
     * @param params configuration parameters specifying the elliptic curve
     *            group and randomization source to use for encryption.
     * @param publicKey the public key to encrypt under.
     * @param normalize whether or not to normalize points.
     * @param workerThreads the number of daemon threads computing
     *            randomization factors in the background.
     * @param queueSize the maximum number of precomputed randomization
     *            factors.
     */
    public OnlineEncryptor(EncryptionParams params, ECPoint publicKey, boolean normalize, int workerThreads,
            int queueSize) {
        super(params, publicKey, normalize);

        m_encryptionQueue = new ArrayBlockingQueue<>(queueSize);

        if (workerThreads > 0) {
            ExecutorService service = Executors.newFixedThreadPool(workerThreads,
                    new DaemonThreadFactory("EncryptorBG"));
            for (int i = 0; i < workerThreads; i++) {
                service.execute(() -> {
                    while (true) {
                        _queueEncryption(super.generateZeroEncryption());
                    }
                });
            }
            service.shutdown();
        }
    }

    private void _queueEncryption(ECPair encryption) {
        try {
            m_encryptionQueue.put(encryption);
        } catch (InterruptedException e) {
            throw new RuntimeException("Interrupted attempting to queue encryption", e);
        }
    }

    @Override
    public ECPair encryptZero() {
        // Never block on the background threads.
        ECPair encryption = m_encryptionQueue.poll();
        if (encryption == null) {
            encryption = super.generateZeroEncryption();
        }
        return encryption;
    }
}
