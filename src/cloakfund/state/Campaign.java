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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;

import org.bouncycastle.crypto.ec.ECPair;
import org.bouncycastle.math.ec.ECPoint;

/**
 * The per-campaign record. Every operation that reads and then mutates a
 * campaign must do so while holding the campaign's monitor, which stands in
 * for the serialized single-writer execution of a hosting ledger.
 *
 * The ciphertext fields are only ever produced by homomorphic operations: the
 * running {@code raised} total is the sum of all non-refunded contributions and
 * the obfuscated target is fixed at creation.
 *
 * @author ethan@cs.cornell.edu
 */
public class Campaign {
    private final long m_id;
    private final ECPoint m_creator;
    private final CampaignMetadata m_metadata;
    private final ECPair m_target;
    private final ECPair m_obfuscatedTarget;
    private final long m_multiplier;
    private final long m_createdAt;
    private final long m_deadline;

    private final Map<ECPoint, Contribution> m_contributions = new LinkedHashMap<>();

    private ECPair m_raised;
    private CampaignStatus m_status = CampaignStatus.ACTIVE;
    private boolean m_withdrawn = false;
    private boolean m_paused = false;

    private long m_requestId = -1;
    private long m_requestedAt = -1;
    private int m_retryCount = 0;

    private Long m_revealedRaised = null;
    private Long m_revealedTarget = null;

    private int m_refundedCount = 0;

    public Campaign(long id, ECPoint creator, CampaignMetadata metadata, ECPair target, ECPair obfuscatedTarget,
            long multiplier, ECPair zero, long createdAt, long deadline) {
        m_id = id;
        m_creator = creator;
        m_metadata = metadata;
        m_target = target;
        m_obfuscatedTarget = obfuscatedTarget;
        m_multiplier = multiplier;
        m_raised = zero;
        m_createdAt = createdAt;
        m_deadline = deadline;
    }

    public long getId() {
        return m_id;
    }

    public ECPoint getCreator() {
        return m_creator;
    }

    public CampaignMetadata getMetadata() {
        return m_metadata;
    }

    public ECPair getTarget() {
        return m_target;
    }

    public ECPair getObfuscatedTarget() {
        return m_obfuscatedTarget;
    }

    public long getMultiplier() {
        return m_multiplier;
    }

    public long getCreatedAt() {
        return m_createdAt;
    }

    public long getDeadline() {
        return m_deadline;
    }

    public synchronized ECPair getRaised() {
        return m_raised;
    }

    public synchronized void setRaised(ECPair raised) {
        m_raised = raised;
    }

    public synchronized CampaignStatus getStatus() {
        return m_status;
    }

    /**
     * Moves the campaign along the status lattice.
     *
     * @return the previous status.
     * @throws IllegalStateException if the transition is not allowed.
     */
    public synchronized CampaignStatus transitionTo(CampaignStatus next) {
        if (!m_status.canTransitionTo(next))
            throw new IllegalStateException("Illegal transition " + m_status + " -> " + next);
        CampaignStatus previous = m_status;
        m_status = next;
        if (next == CampaignStatus.WITHDRAWN) m_withdrawn = true;
        return previous;
    }

    public synchronized boolean isWithdrawn() {
        return m_withdrawn;
    }

    /**
     * @return whether the platform owner has halted contributions and
     *         finalization.
     */
    public synchronized boolean isPaused() {
        return m_paused;
    }

    public synchronized void setPaused(boolean paused) {
        m_paused = paused;
    }

    /**
     * @return the id of the current (or last) settlement reveal request, or -1
     *         if finalization was never requested.
     */
    public synchronized long getRequestId() {
        return m_requestId;
    }

    public synchronized long getRequestedAt() {
        return m_requestedAt;
    }

    public synchronized int getRetryCount() {
        return m_retryCount;
    }

    public synchronized void setPendingRequest(long requestId, long requestedAt) {
        m_requestId = requestId;
        m_requestedAt = requestedAt;
    }

    public synchronized int incrementRetryCount() {
        return ++m_retryCount;
    }

    public synchronized OptionalLong getRevealedRaised() {
        return m_revealedRaised == null ? OptionalLong.empty() : OptionalLong.of(m_revealedRaised);
    }

    public synchronized OptionalLong getRevealedTarget() {
        return m_revealedTarget == null ? OptionalLong.empty() : OptionalLong.of(m_revealedTarget);
    }

    public synchronized void cacheRevealedValues(long raised, long target) {
        if (m_revealedRaised != null) throw new IllegalStateException("Revealed values already cached");
        m_revealedRaised = raised;
        m_revealedTarget = target;
    }

    public synchronized Contribution getContribution(ECPoint contributor) {
        return m_contributions.get(contributor);
    }

    public synchronized void addContribution(Contribution contribution) {
        if (m_contributions.containsKey(contribution.getContributor()))
            throw new IllegalStateException("Contribution already recorded");
        m_contributions.put(contribution.getContributor(), contribution);
    }

    public synchronized Collection<Contribution> getContributions() {
        return Collections.unmodifiableCollection(m_contributions.values());
    }

    public synchronized int getBackerCount() {
        return m_contributions.size();
    }

    public synchronized int getRefundedCount() {
        return m_refundedCount;
    }

    /**
     * @return the number of backers who have not yet been refunded.
     */
    public synchronized int getEligibleBackerCount() {
        return m_contributions.size() - m_refundedCount;
    }

    public synchronized void recordRefund() {
        m_refundedCount++;
    }

    @Override
    public String toString() {
        return "Campaign " + m_id + " " + m_metadata;
    }
}
