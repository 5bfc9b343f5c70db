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

import cloakfund.reveal.RevealCapability;
import cloakfund.reveal.RevealResponse;
import cloakfund.reveal.RevealResponseHandler;
import cloakfund.reveal.RevealTicket;
import cloakfund.util.EncryptionParams;

import cloakfund.zookeeper.RevealZnodes.CommonDir;

/**
 * The platform's side of a ZooKeeper-backed reveal oracle. Each submitted
 * ticket is written to a znode under the ticket directory; the channel watches
 * the response directory and hands every response it finds to the registered
 * handler, then removes both znodes.
 *
 * Responses that the handler rejects are logged and discarded. They have no
 * synchronous caller to report to, and a stalled request is recovered by a
 * timeout check.
 *
 * @author ethan@cs.cornell.edu
 */
public class ZooKeeperRevealChannel implements RevealCapability, Watcher, AutoCloseable {
    private final Logger m_logger = Logger.getLogger("cloakfund");

    private final EncryptionParams m_params;
    private final ZooKeeper m_zk;
    private final Set<String> m_handledResponses = ConcurrentHashMap.newKeySet();
    private final Object m_processLock = new Object();

    private volatile RevealResponseHandler m_handler;

    /**
     * Connects to ZooKeeper. No znodes are touched until {@link #start()}.
     *
     * @param connectString the string to pass to
     *            {@code org.apache.zookeeper.ZooKeeper} to connect to the
     *            service.
     * @throws IOException if an error occurs connecting to ZooKeeper.
     */
    public ZooKeeperRevealChannel(EncryptionParams params, String connectString) throws IOException {
        m_params = params;
        m_zk = new ZooKeeper(connectString, RevealZnodes.SESSION_TIMEOUT, this);
    }

    @Override
    public void setResponseHandler(RevealResponseHandler handler) {
        m_handler = handler;
    }

    /**
     * Creates the shared directories if needed and processes any responses
     * already waiting.
     */
    public void start() {
        try {
            RevealZnodes.createDirs(m_zk);
            _processResponses();
        } catch (KeeperException | InterruptedException e) {
            throw new RuntimeException("Failed to start reveal channel", e);
        }
    }

    /**
     * Blocks until an oracle has published its keys.
     *
     * @return the published keys, or {@code null} if none appeared in time.
     */
    public OracleKeys awaitOracleKeys(long duration, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(duration);
        String path = CommonDir.ORACLE_KEYS.toString();
        try {
            while (true) {
                byte[] data = m_zk.getData(path, null, null);
                if (data.length > 0) return RevealZnodes.decode(m_params, data, OracleKeys::serialReadIn);

                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) return null;
                final CountDownLatch latch = new CountDownLatch(1);
                m_zk.exists(path, (x) -> latch.countDown());
                // The watch does not always fire, so poll as well.
                latch.await(Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(250)), TimeUnit.NANOSECONDS);
            }
        } catch (KeeperException | IOException e) {
            throw new RuntimeException("Failed to read oracle keys", e);
        }
    }

    @Override
    public void submit(RevealTicket ticket) {
        String path = CommonDir.TICKET.resolveToString(RevealZnodes.nodeName(ticket.getRequestId()));
        try {
            m_zk.create(path, RevealZnodes.encode(m_params, ticket), ZooDefs.Ids.OPEN_ACL_UNSAFE,
                    CreateMode.PERSISTENT);
            m_logger.fine("Posted reveal ticket " + ticket.getRequestId());
        } catch (KeeperException | InterruptedException e) {
            throw new RuntimeException("Failed to post reveal ticket " + ticket.getRequestId(), e);
        }
    }

    @Override
    public void process(WatchedEvent event) {
        try {
            if (event.getType() == Watcher.Event.EventType.None) {
                switch (event.getState()) {
                    case SyncConnected:
                        break;
                    case Disconnected:
                    case Expired:
                        m_logger.warning("Lost connection to ZooKeeper: " + event.getState());
                        break;
                    default:
                        m_logger.warning("Unexpected state from watched event: " + event.getState());
                        break;
                }
            } else if (event.getType() == Watcher.Event.EventType.NodeChildrenChanged) {
                if (CommonDir.RESPONSE.toString().equals(event.getPath())) {
                    _processResponses();
                } else {
                    m_logger.severe("Watch triggered for child change of unexpected path: " + event.getPath());
                }
            }
        } catch (KeeperException | InterruptedException e) {
            m_logger.log(Level.SEVERE, "Failed to process reveal responses", e);
        }
    }

    private void _processResponses() throws KeeperException, InterruptedException {
        synchronized (m_processLock) {
            for (String name : m_zk.getChildren(CommonDir.RESPONSE.toString(), this)) {
                if (!m_handledResponses.add(name)) continue;

                String responsePath = CommonDir.RESPONSE.resolveToString(name);
                byte[] data = m_zk.getData(responsePath, null, null);
                try {
                    RevealResponse response = RevealZnodes.decode(m_params, data, RevealResponse::serialReadIn);
                    RevealResponseHandler handler = m_handler;
                    if (handler == null) throw new IllegalStateException("No response handler registered");
                    handler.deliver(response);
                    m_logger.fine("Delivered reveal response " + response.getRequestId());
                } catch (IOException | RuntimeException e) {
                    m_logger.log(Level.WARNING, "Discarding reveal response " + name, e);
                }

                RevealZnodes.deleteIfPresent(m_zk, responsePath);
                RevealZnodes.deleteIfPresent(m_zk, CommonDir.TICKET.resolveToString(name));
            }
        }
    }

    @Override
    public void close() throws InterruptedException {
        m_zk.close();
    }
}
