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

/**
 * The campaign status lattice. No transition is reversible.
 *
 * <pre>
 * ACTIVE -&gt; DECRYPTION_PENDING -&gt; SUCCESSFUL -&gt; WITHDRAWN
 *                              -&gt; FAILED
 *                              -&gt; DECRYPTION_FAILED
 * </pre>
 */
public enum CampaignStatus {
    ACTIVE, DECRYPTION_PENDING, SUCCESSFUL, FAILED, DECRYPTION_FAILED, WITHDRAWN;

    /**
     * @return whether backers of a campaign in this status may ask for their
     *         contributions back.
     */
    public boolean isRefundEligible() {
        return this == FAILED || this == DECRYPTION_FAILED;
    }

    public boolean canTransitionTo(CampaignStatus next) {
        switch (this) {
        case ACTIVE:
            return next == DECRYPTION_PENDING;
        case DECRYPTION_PENDING:
            return next == SUCCESSFUL || next == FAILED || next == DECRYPTION_FAILED;
        case SUCCESSFUL:
            return next == WITHDRAWN;
        default:
            return false;
        }
    }
}
