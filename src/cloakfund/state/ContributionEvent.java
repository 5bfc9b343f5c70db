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

public class ContributionEvent {
    public static enum Kind {
        CONTRIBUTED, REFUND_REQUESTED, REFUNDED, EMERGENCY_REFUNDED
    }

    private final long m_campaignId;
    private final ECPoint m_contributor;
    private final Kind m_kind;
    private final long m_time;

    public ContributionEvent(long campaignId, ECPoint contributor, Kind kind, long time) {
        m_campaignId = campaignId;
        m_contributor = contributor;
        m_kind = kind;
        m_time = time;
    }

    public long getCampaignId() {
        return m_campaignId;
    }

    public ECPoint getContributor() {
        return m_contributor;
    }

    public Kind getKind() {
        return m_kind;
    }

    public long getTime() {
        return m_time;
    }
}
