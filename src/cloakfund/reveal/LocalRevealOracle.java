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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;

/**
 * An in-process {@link RevealCapability} backed directly by a
 * {@link RevealOracle}.
 *
 * Without an executor, submitted tickets queue up until the host calls
 * {@link #deliverNext()} or {@link #deliverPending()}, which lets simulations
 * and tests withhold, reorder, drop, or replay responses. With an executor,
 * every ticket is answered and delivered asynchronously.
 */
public class LocalRevealOracle implements RevealCapability {
    private static final Logger LOGGER = Logger.getLogger("cloakfund.oracle");

    private final RevealOracle m_oracle;
    private final Executor m_executor;
    private final Deque<RevealTicket> m_pending = new ArrayDeque<>();

    private volatile RevealResponseHandler m_handler;

    public LocalRevealOracle(RevealOracle oracle) {
        this(oracle, null);
    }

    public LocalRevealOracle(RevealOracle oracle, Executor executor) {
        m_oracle = oracle;
        m_executor = executor;
    }

    public RevealOracle getOracle() {
        return m_oracle;
    }

    @Override
    public void setResponseHandler(RevealResponseHandler handler) {
        m_handler = handler;
    }

    @Override
    public void submit(RevealTicket ticket) {
        if (m_executor == null) {
            synchronized (m_pending) {
                m_pending.addLast(ticket);
            }
            return;
        }

        m_executor.execute(() -> {
            try {
                _handler().deliver(m_oracle.answer(ticket));
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Reveal response " + ticket.getRequestId() + " was rejected", e);
            }
        });
    }

    /**
     * @return the tickets submitted but not yet answered, oldest first.
     */
    public List<RevealTicket> getPendingTickets() {
        synchronized (m_pending) {
            return ImmutableList.copyOf(m_pending);
        }
    }

    /**
     * Answers and delivers the oldest pending ticket. Any exception thrown by
     * the handler propagates to the caller.
     *
     * @return the response that was delivered.
     * @throws IllegalStateException if there are no pending tickets.
     */
    public RevealResponse deliverNext() {
        RevealTicket ticket;
        synchronized (m_pending) {
            ticket = m_pending.pollFirst();
        }
        if (ticket == null) throw new IllegalStateException("No pending reveal tickets");

        RevealResponse response = m_oracle.answer(ticket);
        _handler().deliver(response);
        return response;
    }

    /**
     * Answers and delivers every pending ticket in submission order.
     *
     * @return the number of responses delivered.
     */
    public int deliverPending() {
        int delivered = 0;
        while (!getPendingTickets().isEmpty()) {
            deliverNext();
            delivered++;
        }
        return delivered;
    }

    /**
     * Discards every pending ticket, simulating an unresponsive oracle.
     *
     * @return the number of tickets dropped.
     */
    public int dropPending() {
        synchronized (m_pending) {
            int dropped = m_pending.size();
            m_pending.clear();
            return dropped;
        }
    }

    /**
     * Hands an arbitrary response to the handler, as a network adversary could.
     */
    public void replay(RevealResponse response) {
        _handler().deliver(response);
    }

    private RevealResponseHandler _handler() {
        RevealResponseHandler handler = m_handler;
        if (handler == null) throw new IllegalStateException("No response handler registered");
        return handler;
    }
}
