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
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.zookeeper.CreateMode;
import org.apache.zookeeper.KeeperException;
import org.apache.zookeeper.WatchedEvent;
import org.apache.zookeeper.Watcher;
import org.apache.zookeeper.ZooDefs;
import org.apache.zookeeper.ZooKeeper;

import cloakfund.reveal.RevealOracle;
import cloakfund.reveal.RevealResponse;
import cloakfund.reveal.RevealTicket;
import cloakfund.util.EncryptionParams;

import cloakfund.zookeeper.RevealZnodes.CommonDir;

/**
 * The oracle's side of the ZooKeeper transport. On start it publishes the
 * oracle's public keys, then answers every ticket znode with a response znode
 * of the same name.
 *
 * @author ethan@cs.cornell.edu
 */
public class ZooKeeperOracleWorker implements Runnable, Watcher, AutoCloseable {
    private final Logger m_logger = Logger.getLogger("cloakfund.oracle");

    private final EncryptionParams m_params;
    private final RevealOracle m_oracle;
    private final ZooKeeper m_zk;
    private final Set<String> m_answered = ConcurrentHashMap.newKeySet();
    private final Object m_processLock = new Object();
    private final CountDownLatch m_runningLatch = new CountDownLatch(1);

    public ZooKeeperOracleWorker(EncryptionParams params, RevealOracle oracle, String connectString)
            throws IOException {
        m_params = params;
        m_oracle = oracle;
        m_zk = new ZooKeeper(connectString, RevealZnodes.SESSION_TIMEOUT, this);
    }

    /**
     * Publishes the oracle keys, answers waiting tickets and then blocks until
     * {@link #shutdown()} is called. New tickets are answered from ZooKeeper's
     * event thread.
     */
    @Override
    public void run() {
        try {
            RevealZnodes.createDirs(m_zk);
            m_zk.setData(CommonDir.ORACLE_KEYS.toString(),
                    RevealZnodes.encode(m_params, OracleKeys.of(m_oracle)), -1);
            m_logger.info("Published oracle keys");

            _processTickets();
            m_runningLatch.await();
        } catch (KeeperException | InterruptedException e) {
            throw new RuntimeException("Oracle worker failed", e);
        }
    }

    public void shutdown() {
        m_runningLatch.countDown();
    }

    public boolean awaitTermination(long duration, TimeUnit unit) throws InterruptedException {
        return m_runningLatch.await(duration, unit);
    }

    @Override
    public void process(WatchedEvent event) {
        try {
            if (event.getType() == Watcher.Event.EventType.None) {
                if (event.getState() == Watcher.Event.KeeperState.Expired) {
                    m_logger.severe("ZooKeeper session expired");
                    shutdown();
                }
            } else if (event.getType() == Watcher.Event.EventType.NodeChildrenChanged) {
                if (CommonDir.TICKET.toString().equals(event.getPath())) {
                    _processTickets();
                } else {
                    m_logger.severe("Watch triggered for child change of unexpected path: " + event.getPath());
                }
            }
        } catch (KeeperException | InterruptedException e) {
            m_logger.log(Level.SEVERE, "Failed to process reveal tickets", e);
        }
    }

    private void _processTickets() throws KeeperException, InterruptedException {
        synchronized (m_processLock) {
            for (String name : m_zk.getChildren(CommonDir.TICKET.toString(), this)) {
                if (!m_answered.add(name)) continue;

                byte[] data;
                try {
                    data = m_zk.getData(CommonDir.TICKET.resolveToString(name), null, null);
                } catch (KeeperException e) {
                    // The platform already consumed the response and cleaned up.
                    if (e.code() == KeeperException.Code.NONODE) continue;
                    throw e;
                }

                RevealResponse response;
                try {
                    RevealTicket ticket = RevealZnodes.decode(m_params, data, RevealTicket::serialReadIn);
                    response = m_oracle.answer(ticket);
                } catch (IOException | IllegalArgumentException e) {
                    m_logger.log(Level.WARNING, "Cannot answer reveal ticket " + name, e);
                    continue;
                }

                try {
                    m_zk.create(CommonDir.RESPONSE.resolveToString(name), RevealZnodes.encode(m_params, response),
                            ZooDefs.Ids.OPEN_ACL_UNSAFE, CreateMode.PERSISTENT);
                } catch (KeeperException e) {
                    if (e.code() != KeeperException.Code.NODEEXISTS) throw e;
                }
            }
        }
    }

    @Override
    public void close() throws InterruptedException {
        shutdown();
        m_zk.close();
    }
}
