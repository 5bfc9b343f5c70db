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

package cloakfund.protocol;

import java.util.logging.Logger;

import org.bouncycastle.math.ec.ECPoint;

import cloakfund.errors.AuthorizationException;
import cloakfund.errors.StateException;
import cloakfund.state.Campaign;
import cloakfund.state.CampaignStatus;
import cloakfund.state.Contribution;
import cloakfund.state.RevealRequest;

/**
 * Abandons reveal requests the oracle has not answered in time.
 *
 * Each timeout check counts one timeout against the campaign. While the count
 * stays below the configured maximum the same ciphertexts are resubmitted
 * under a new request id, superseding the old request. The check that reaches
 * the maximum moves the campaign to {@code DECRYPTION_FAILED} instead.
 *
 * @author ethan@cs.cornell.edu
 */
public class TimeoutRetryController {
    private static final Logger LOGGER = Logger.getLogger("cloakfund");

    private final PlatformConfig m_config;
    private final CampaignLedger m_ledger;
    private final RevealRequestManager m_requestManager;

    public TimeoutRetryController(PlatformConfig config, CampaignLedger ledger, RevealRequestManager requestManager) {
        m_config = config;
        m_ledger = ledger;
        m_requestManager = requestManager;
    }

    /**
     * Anyone may call this once the campaign's pending request has timed out.
     *
     * @return the resulting status, either {@code DECRYPTION_PENDING} with a
     *         fresh request or {@code DECRYPTION_FAILED}.
     * @throws StateException if no settlement request is pending or it has
     *             not timed out yet.
     */
    public CampaignStatus onTimeoutCheck(long campaignId, ECPoint caller, long now) {
        Campaign campaign = m_ledger.getCampaign(campaignId);
        RevealRequest retry = null;
        CampaignStatus result;
        synchronized (campaign) {
            if (campaign.getStatus() != CampaignStatus.DECRYPTION_PENDING)
                throw new StateException("No reveal request is pending");
            if (now < campaign.getRequestedAt() + m_config.getRevealTimeout())
                throw new StateException("Reveal request has not timed out");

            RevealRequest stalled = m_requestManager.getRequest(campaign.getRequestId());
            if (stalled == null || !stalled.isActive()) throw new StateException("Reveal request already completed");

            int timeouts = campaign.incrementRetryCount();
            stalled.markTimedOut();
            if (timeouts < m_config.getMaxRetries()) {
                retry = m_requestManager.issueSettlementRequest(campaign, caller, now);
                LOGGER.info("Campaign " + campaignId + ": " + stalled + " timed out, retry " + timeouts + " of "
                        + (m_config.getMaxRetries() - 1));
            } else {
                m_ledger.transition(campaign, CampaignStatus.DECRYPTION_FAILED, now, "onTimeoutCheck");
            }
            result = campaign.getStatus();
        }

        if (retry != null) m_requestManager.submit(retry);
        return result;
    }

    /**
     * Reissues a refund reveal that the oracle has not answered in time. The
     * new request supersedes the old one.
     *
     * @return the id of the new reveal request.
     * @throws AuthorizationException if {@code contributor} never backed the
     *             campaign.
     * @throws StateException if there is no outstanding refund reveal for the
     *             contributor or it has not timed out yet.
     */
    public long retryRefundReveal(long campaignId, ECPoint contributor, long now) {
        Campaign campaign = m_ledger.getCampaign(campaignId);
        RevealRequest retry;
        synchronized (campaign) {
            Contribution contribution = campaign.getContribution(contributor);
            if (contribution == null) throw new AuthorizationException("Caller has no contribution to this campaign");
            if (contribution.isRefunded()) throw new StateException("Contribution already refunded");

            RevealRequest stalled = m_requestManager.getRequest(contribution.getRefundRequestId());
            if (stalled == null || !stalled.isActive()) throw new StateException("No refund reveal is pending");
            if (now < stalled.getIssuedAt() + m_config.getRevealTimeout())
                throw new StateException("Refund reveal has not timed out");

            stalled.markTimedOut();
            retry = m_requestManager.issueRefundRequest(campaignId, contributor, contribution.getAmount(), now);
            contribution.setRefundRequestId(retry.getRequestId());
            LOGGER.info("Campaign " + campaignId + ": " + stalled + " timed out, reissued as "
                    + retry.getRequestId());
        }

        m_requestManager.submit(retry);
        return retry.getRequestId();
    }
}
