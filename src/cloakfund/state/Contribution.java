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

import org.bouncycastle.crypto.ec.ECPair;
import org.bouncycastle.math.ec.ECPoint;

/**
 * One backer's stake in one campaign. The encrypted amount only grows until a
 * refund is requested, and nothing changes once the contribution is refunded.
 * Callers must hold the owning {@link Campaign}'s monitor.
 */
public class Contribution {
    private final long m_campaignId;
    private final ECPoint m_contributor;
    private final long m_firstContributedAt;

    private ECPair m_amount;
    private String m_message;

    private boolean m_refundRequested = false;
    private long m_refundRequestedAt = -1;
    private long m_refundRequestId = -1;
    private boolean m_refunded = false;
    private long m_refundedAmount = 0;

    public Contribution(long campaignId, ECPoint contributor, ECPair amount, String message, long now) {
        m_campaignId = campaignId;
        m_contributor = contributor;
        m_amount = amount;
        m_message = message;
        m_firstContributedAt = now;
    }

    public long getCampaignId() {
        return m_campaignId;
    }

    public ECPoint getContributor() {
        return m_contributor;
    }

    public ECPair getAmount() {
        return m_amount;
    }

    public String getMessage() {
        return m_message;
    }

    public long getFirstContributedAt() {
        return m_firstContributedAt;
    }

    public boolean isRefundRequested() {
        return m_refundRequested;
    }

    public long getRefundRequestedAt() {
        return m_refundRequestedAt;
    }

    /**
     * @return the id of the reveal request currently disclosing this
     *         contribution, or -1 if none was issued.
     */
    public long getRefundRequestId() {
        return m_refundRequestId;
    }

    public boolean isRefunded() {
        return m_refunded;
    }

    public long getRefundedAmount() {
        return m_refundedAmount;
    }

    /**
     * Replaces the running encrypted amount after another payment from the
     * same backer. The latest non-empty message wins.
     */
    public void accumulate(ECPair newAmount, String message) {
        if (m_refundRequested || m_refunded)
            throw new IllegalStateException("Cannot add to a contribution after requesting a refund");
        m_amount = newAmount;
        if (!message.isEmpty()) m_message = message;
    }

    public void markRefundRequested(long now) {
        if (m_refundRequested) throw new IllegalStateException("Refund already requested");
        m_refundRequested = true;
        m_refundRequestedAt = now;
    }

    public void setRefundRequestId(long requestId) {
        m_refundRequestId = requestId;
    }

    public void markRefunded(long amount) {
        if (m_refunded) throw new IllegalStateException("Contribution already refunded");
        m_refunded = true;
        m_refundedAmount = amount;
    }
}
