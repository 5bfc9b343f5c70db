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

import cloakfund.custody.FundCustody;
import cloakfund.errors.AuthorizationException;
import cloakfund.errors.InsufficientFundsException;
import cloakfund.errors.ProofVerificationException;
import cloakfund.errors.StateException;
import cloakfund.reveal.RevealResponse;
import cloakfund.state.Campaign;
import cloakfund.state.CampaignStatus;
import cloakfund.state.Contribution;
import cloakfund.state.ContributionEvent;
import cloakfund.state.RevealRequest;

/**
 * The only component that moves money out of custody. Every transfer happens
 * after the state change that forbids repeating it, and only after a balance
 * check, so a blocked transfer leaves the campaign untouched and can be
 * retried.
 *
 * @author ethan@cs.cornell.edu
 */
public class SettlementEngine {
    private static final Logger LOGGER = Logger.getLogger("cloakfund");

    private final PlatformConfig m_config;
    private final CampaignLedger m_ledger;
    private final RevealRequestManager m_requestManager;
    private final FundCustody m_custody;

    public SettlementEngine(PlatformConfig config, CampaignLedger ledger, RevealRequestManager requestManager,
            FundCustody custody) {
        m_config = config;
        m_ledger = ledger;
        m_requestManager = requestManager;
        m_custody = custody;
    }

    /**
     * Pays the verified raised total to the creator of a successful campaign.
     *
     * @return the amount transferred.
     */
    public long withdraw(long campaignId, ECPoint caller, long now) {
        Campaign campaign = m_ledger.getCampaign(campaignId);
        synchronized (campaign) {
            if (!caller.equals(campaign.getCreator())) throw new AuthorizationException("Only the creator may withdraw");
            if (campaign.isWithdrawn()) throw new StateException("Funds already withdrawn");
            if (campaign.getStatus() != CampaignStatus.SUCCESSFUL) throw new StateException("Campaign did not succeed");
            if (!campaign.getRevealedRaised().isPresent()) throw new StateException("No verified reveal");

            long amount = campaign.getRevealedRaised().getAsLong();
            _checkBalance(campaignId, amount);

            m_ledger.transition(campaign, CampaignStatus.WITHDRAWN, now, "withdraw");
            m_custody.release(campaignId, campaign.getCreator(), amount);
            LOGGER.info("Campaign " + campaignId + ": creator withdrew " + amount);
            return amount;
        }
    }

    /**
     * Records a backer's refund request. From {@code FAILED} this also asks the
     * oracle to reveal the backer's own contribution; from
     * {@code DECRYPTION_FAILED} the backer settles through
     * {@link #emergencyRefund}.
     *
     * @return the id of the issued refund reveal, or -1 if none was issued.
     */
    public long requestRefund(long campaignId, ECPoint caller, long now) {
        Campaign campaign = m_ledger.getCampaign(campaignId);
        RevealRequest request = null;
        synchronized (campaign) {
            if (!campaign.getStatus().isRefundEligible())
                throw new StateException("Campaign is not eligible for refunds");
            Contribution contribution = _contributionOf(campaign, caller);
            if (contribution.isRefundRequested()) throw new StateException("Refund already requested");

            contribution.markRefundRequested(now);
            if (campaign.getStatus() == CampaignStatus.FAILED) {
                request = m_requestManager.issueRefundRequest(campaignId, caller, contribution.getAmount(), now);
                contribution.setRefundRequestId(request.getRequestId());
            }
            m_ledger.recordEvent(campaignId, caller, ContributionEvent.Kind.REFUND_REQUESTED, now);
        }

        if (request == null) return -1;
        m_requestManager.submit(request);
        return request.getRequestId();
    }

    /**
     * Applies a verified refund reveal by paying the revealed amount to the
     * contributor named in the request.
     *
     * @return the amount transferred.
     * @throws ProofVerificationException if the response does not verify.
     * @throws StateException if the request was superseded or already applied.
     */
    public long onRefundReveal(RevealResponse response, long now) {
        RevealRequest request = m_requestManager.verifiedRequest(response);
        if (request.getKind() != RevealRequest.Kind.REFUND)
            throw new StateException(request + " is not a refund request");

        Campaign campaign = m_ledger.getCampaign(request.getCampaignId());
        synchronized (campaign) {
            Contribution contribution = campaign.getContribution(request.getSubject());
            if (!request.isActive() || contribution == null || contribution.isRefunded()
                    || contribution.getRefundRequestId() != request.getRequestId())
                throw new StateException("Stale refund reveal for " + request);

            long amount = m_requestManager.decode(request, response).get(0);
            _checkBalance(campaign.getId(), amount);

            request.markCompleted();
            contribution.markRefunded(amount);
            campaign.recordRefund();
            m_ledger.recomputeRaised(campaign);
            m_ledger.recordEvent(campaign.getId(), contribution.getContributor(), ContributionEvent.Kind.REFUNDED,
                    now);
            m_custody.release(campaign.getId(), contribution.getContributor(), amount);
            LOGGER.info("Campaign " + campaign.getId() + ": refunded " + amount);
            return amount;
        }
    }

    /**
     * Pays an equal share of the campaign's remaining balance to a backer of a
     * campaign whose reveal permanently failed. The share is the remaining
     * balance divided by the number of backers not yet refunded, so the last
     * backer receives whatever is left.
     *
     * @return the amount transferred.
     */
    public long emergencyRefund(long campaignId, ECPoint caller, long now) {
        Campaign campaign = m_ledger.getCampaign(campaignId);
        synchronized (campaign) {
            if (campaign.getStatus() != CampaignStatus.DECRYPTION_FAILED)
                throw new StateException("Emergency refunds require a failed decryption");
            if (now < campaign.getRequestedAt() + 2 * m_config.getRevealTimeout())
                throw new StateException("Emergency refund window has not opened");
            Contribution contribution = _contributionOf(campaign, caller);

            long share = m_custody.heldBalance(campaignId) / campaign.getEligibleBackerCount();

            contribution.markRefunded(share);
            campaign.recordRefund();
            m_ledger.recomputeRaised(campaign);
            m_ledger.recordEvent(campaignId, caller, ContributionEvent.Kind.EMERGENCY_REFUNDED, now);
            m_custody.release(campaignId, caller, share);
            LOGGER.info("Campaign " + campaignId + ": emergency refund of " + share);
            return share;
        }
    }

    private Contribution _contributionOf(Campaign campaign, ECPoint caller) {
        Contribution contribution = campaign.getContribution(caller);
        if (contribution == null) throw new AuthorizationException("Caller has no contribution to this campaign");
        if (contribution.isRefunded()) throw new StateException("Contribution already refunded");
        return contribution;
    }

    private void _checkBalance(long campaignId, long amount) {
        if (m_custody.heldBalance(campaignId) < amount)
            throw new InsufficientFundsException("Campaign " + campaignId + " cannot cover a transfer of " + amount);
    }
}
