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

/**
 * The encrypted amounts of a campaign at one point in time. Only the campaign
 * creator and the platform owner may obtain these.
 */
public class CampaignAmounts {
    private final long m_campaignId;
    private final ECPair m_raised;
    private final ECPair m_target;
    private final ECPair m_obfuscatedTarget;

    public CampaignAmounts(long campaignId, ECPair raised, ECPair target, ECPair obfuscatedTarget) {
        m_campaignId = campaignId;
        m_raised = raised;
        m_target = target;
        m_obfuscatedTarget = obfuscatedTarget;
    }

    public long getCampaignId() {
        return m_campaignId;
    }

    public ECPair getRaised() {
        return m_raised;
    }

    public ECPair getTarget() {
        return m_target;
    }

    public ECPair getObfuscatedTarget() {
        return m_obfuscatedTarget;
    }
}
