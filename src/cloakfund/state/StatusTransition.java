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

public class StatusTransition {
    private final long m_campaignId;
    private final CampaignStatus m_from;
    private final CampaignStatus m_to;
    private final long m_time;
    private final String m_operation;

    public StatusTransition(long campaignId, CampaignStatus from, CampaignStatus to, long time, String operation) {
        m_campaignId = campaignId;
        m_from = from;
        m_to = to;
        m_time = time;
        m_operation = operation;
    }

    public long getCampaignId() {
        return m_campaignId;
    }

    /**
     * @return the status before the transition, or {@code null} for the
     *         creation record.
     */
    public CampaignStatus getFrom() {
        return m_from;
    }

    public CampaignStatus getTo() {
        return m_to;
    }

    public long getTime() {
        return m_time;
    }

    public String getOperation() {
        return m_operation;
    }

    @Override
    public String toString() {
        return "[" + m_time + "] campaign " + m_campaignId + ": " + m_from + " -> " + m_to + " (" + m_operation + ")";
    }
}
