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

import java.util.OptionalLong;

import org.bouncycastle.math.ec.ECPoint;

/**
 * An immutable snapshot of a campaign for reporting. Revealed values are only
 * present once a settlement reveal has been verified.
 */
public class CampaignView {
    private final long m_id;
    private final ECPoint m_creator;
    private final CampaignMetadata m_metadata;
    private final CampaignStatus m_status;
    private final long m_createdAt;
    private final long m_deadline;
    private final int m_backerCount;
    private final long m_multiplier;
    private final int m_retryCount;
    private final boolean m_withdrawn;
    private final boolean m_paused;
    private final OptionalLong m_revealedRaised;
    private final OptionalLong m_revealedTarget;

    public CampaignView(Campaign campaign) {
        synchronized (campaign) {
            m_id = campaign.getId();
            m_creator = campaign.getCreator();
            m_metadata = campaign.getMetadata();
            m_status = campaign.getStatus();
            m_createdAt = campaign.getCreatedAt();
            m_deadline = campaign.getDeadline();
            m_backerCount = campaign.getBackerCount();
            m_multiplier = campaign.getMultiplier();
            m_retryCount = campaign.getRetryCount();
            m_withdrawn = campaign.isWithdrawn();
            m_paused = campaign.isPaused();
            m_revealedRaised = campaign.getRevealedRaised();
            m_revealedTarget = campaign.getRevealedTarget();
        }
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

    public CampaignStatus getStatus() {
        return m_status;
    }

    public long getCreatedAt() {
        return m_createdAt;
    }

    public long getDeadline() {
        return m_deadline;
    }

    public int getBackerCount() {
        return m_backerCount;
    }

    public long getMultiplier() {
        return m_multiplier;
    }

    public int getRetryCount() {
        return m_retryCount;
    }

    public boolean isWithdrawn() {
        return m_withdrawn;
    }

    public boolean isPaused() {
        return m_paused;
    }

    public OptionalLong getRevealedRaised() {
        return m_revealedRaised;
    }

    public OptionalLong getRevealedTarget() {
        return m_revealedTarget;
    }
}
