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

import java.util.EnumMap;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * Platform-wide campaign counters. Each instance is an immutable snapshot; the
 * live counts are kept by {@link PlatformStats.Tracker}, which is updated on
 * every status transition instead of re-scanning all campaigns.
 */
public class PlatformStats {
    private final long m_total;
    private final Map<CampaignStatus, Long> m_byStatus;

    private PlatformStats(long total, Map<CampaignStatus, Long> byStatus) {
        m_total = total;
        m_byStatus = ImmutableMap.copyOf(byStatus);
    }

    public long getTotalCampaigns() {
        return m_total;
    }

    public long getCount(CampaignStatus status) {
        return m_byStatus.getOrDefault(status, 0L);
    }

    public long getActiveCampaigns() {
        return getCount(CampaignStatus.ACTIVE);
    }

    public long getPendingCampaigns() {
        return getCount(CampaignStatus.DECRYPTION_PENDING);
    }

    public long getSuccessfulCampaigns() {
        return getCount(CampaignStatus.SUCCESSFUL);
    }

    public long getFailedCampaigns() {
        return getCount(CampaignStatus.FAILED);
    }

    public long getDecryptionFailedCampaigns() {
        return getCount(CampaignStatus.DECRYPTION_FAILED);
    }

    public long getWithdrawnCampaigns() {
        return getCount(CampaignStatus.WITHDRAWN);
    }

    @Override
    public String toString() {
        return "PlatformStats[total=" + m_total + ", " + m_byStatus + "]";
    }

    public static class Tracker {
        private final EnumMap<CampaignStatus, Long> m_counts = new EnumMap<>(CampaignStatus.class);
        private long m_total = 0;

        public synchronized void onCreated() {
            m_total++;
            m_counts.merge(CampaignStatus.ACTIVE, 1L, Long::sum);
        }

        public synchronized void onTransition(CampaignStatus from, CampaignStatus to) {
            m_counts.merge(from, -1L, Long::sum);
            m_counts.merge(to, 1L, Long::sum);
        }

        public synchronized PlatformStats snapshot() {
            return new PlatformStats(m_total, m_counts);
        }
    }
}
