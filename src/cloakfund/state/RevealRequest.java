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

package cloakfund.state;

import org.bouncycastle.math.ec.ECPoint;

import cloakfund.reveal.RevealTicket;

/**
 * Bookkeeping for a single reveal request. A request is created once and then
 * either completes (a verified response arrived) or times out (it was
 * superseded by a retry or abandoned). Request ids are never reused.
 */
public class RevealRequest {
    public static enum Kind {
        /** Reveals a campaign's (raised, target) pair. */
        SETTLEMENT,
        /** Reveals one backer's contribution so it can be refunded. */
        REFUND
    }

    private final long m_requestId;
    private final long m_campaignId;
    private final Kind m_kind;
    private final ECPoint m_requester;
    private final ECPoint m_subject;
    private final long m_issuedAt;
    private final RevealTicket m_ticket;

    private boolean m_completed = false;
    private boolean m_timedOut = false;

    /**
     * @param subject the contributor whose amount is revealed for a refund
     *            request; {@code null} for settlement requests.
     */
    public RevealRequest(long requestId, long campaignId, Kind kind, ECPoint requester, ECPoint subject,
            long issuedAt, RevealTicket ticket) {
        if (ticket.getRequestId() != requestId) throw new IllegalArgumentException("Ticket id mismatch");
        if ((kind == Kind.REFUND) != (subject != null))
            throw new IllegalArgumentException("Refund requests, and only refund requests, name a subject");

        m_requestId = requestId;
        m_campaignId = campaignId;
        m_kind = kind;
        m_requester = requester;
        m_subject = subject;
        m_issuedAt = issuedAt;
        m_ticket = ticket;
    }

    public long getRequestId() {
        return m_requestId;
    }

    public long getCampaignId() {
        return m_campaignId;
    }

    public Kind getKind() {
        return m_kind;
    }

    public ECPoint getRequester() {
        return m_requester;
    }

    public ECPoint getSubject() {
        return m_subject;
    }

    public long getIssuedAt() {
        return m_issuedAt;
    }

    public RevealTicket getTicket() {
        return m_ticket;
    }

    public synchronized boolean isCompleted() {
        return m_completed;
    }

    public synchronized boolean isTimedOut() {
        return m_timedOut;
    }

    public synchronized boolean isActive() {
        return !m_completed && !m_timedOut;
    }

    public synchronized void markCompleted() {
        if (!isActive()) throw new IllegalStateException("Request " + m_requestId + " is no longer active");
        m_completed = true;
    }

    public synchronized void markTimedOut() {
        if (!isActive()) throw new IllegalStateException("Request " + m_requestId + " is no longer active");
        m_timedOut = true;
    }

    @Override
    public String toString() {
        return m_kind + " request " + m_requestId + " for campaign " + m_campaignId;
    }
}
