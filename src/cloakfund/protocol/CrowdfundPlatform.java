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

import java.util.List;
import java.util.function.LongSupplier;
import java.util.logging.Logger;

import org.bouncycastle.math.ec.ECPoint;

import cloakfund.cipher.CipherAlgebra;
import cloakfund.custody.FundCustody;
import cloakfund.errors.InsufficientFundsException;
import cloakfund.errors.ProofVerificationException;
import cloakfund.errors.StateException;
import cloakfund.errors.ValidationException;
import cloakfund.reveal.RevealCapability;
import cloakfund.reveal.RevealResponse;
import cloakfund.reveal.RevealResponseHandler;
import cloakfund.reveal.RevealVerifier;
import cloakfund.state.AuditLog;
import cloakfund.state.CampaignAmounts;
import cloakfund.state.CampaignMetadata;
import cloakfund.state.CampaignStatus;
import cloakfund.state.CampaignView;
import cloakfund.state.PlatformStats;
import cloakfund.state.RevealRequest;

/**
 * The confidential crowdfunding platform. This wires together the campaign
 * ledger, the obfuscation generator, the reveal request manager, the timeout
 * controller and the settlement engine, and is the response handler for the
 * reveal capability it is given.
 *
 * Every operation takes the current time in epoch seconds from its caller.
 * Responses delivered asynchronously through {@link #deliver(RevealResponse)}
 * are timestamped with the clock supplied at construction.
 *
 * @author ethan@cs.cornell.edu
 */
public class CrowdfundPlatform implements RevealResponseHandler {
    private static final Logger LOGGER = Logger.getLogger("cloakfund");

    private final CipherAlgebra m_algebra;
    private final LongSupplier m_clock;

    private final CampaignLedger m_ledger;
    private final RevealRequestManager m_requestManager;
    private final TimeoutRetryController m_timeoutController;
    private final SettlementEngine m_settlementEngine;

    public CrowdfundPlatform(PlatformConfig config, ECPoint owner, CipherAlgebra algebra, RevealVerifier verifier,
            RevealCapability capability, FundCustody custody, RandomnessBeacon beacon, LongSupplier clock) {
        if (!algebra.getParams().isDecryptable(config.getMaxCampaignBalance())
                || !algebra.getParams().isDecryptable(config.getMaxTarget()))
            throw new IllegalArgumentException("Campaign balances and targets must stay within the revealable range");

        m_algebra = algebra;
        m_clock = clock;

        ObfuscationGenerator obfuscator = new ObfuscationGenerator(config, algebra, beacon);
        m_ledger = new CampaignLedger(config, owner, algebra, obfuscator, custody);
        m_requestManager = new RevealRequestManager(config, m_ledger, capability, verifier);
        m_timeoutController = new TimeoutRetryController(config, m_ledger, m_requestManager);
        m_settlementEngine = new SettlementEngine(config, m_ledger, m_requestManager, custody);

        capability.setResponseHandler(this);
    }

    public CipherAlgebra getAlgebra() {
        return m_algebra;
    }

    public ECPoint getOwner() {
        return m_ledger.getOwner();
    }

    public long createCampaign(ECPoint creator, CampaignMetadata metadata, long target, long fundingDuration,
            long now) {
        return m_ledger.createCampaign(creator, metadata, target, fundingDuration, now);
    }

    public void recordContribution(long campaignId, ECPoint contributor, long amount, String message, long now) {
        m_ledger.recordContribution(campaignId, contributor, amount, message, now);
    }

    public long requestFinalization(long campaignId, ECPoint caller, long now) {
        return m_requestManager.requestFinalization(campaignId, caller, now);
    }

    /**
     * Routes an oracle response to the settlement or refund path according to
     * the request it answers. Rejected responses are logged and rethrown.
     *
     * @throws ProofVerificationException if the response is forged or
     *             malformed.
     * @throws StateException if the response is stale.
     * @throws InsufficientFundsException if custody cannot cover a refund.
     */
    public void onRevealResponse(RevealResponse response, long now) {
        try {
            RevealRequest request = m_requestManager.getRequest(response.getRequestId());
            if (request != null && request.getKind() == RevealRequest.Kind.REFUND) {
                m_settlementEngine.onRefundReveal(response, now);
            } else {
                m_requestManager.onRevealResponse(response, now);
            }
        } catch (ProofVerificationException | StateException e) {
            LOGGER.warning("Rejected reveal response " + response.getRequestId() + ": " + e.getMessage());
            throw e;
        }
    }

    @Override
    public void deliver(RevealResponse response) {
        onRevealResponse(response, m_clock.getAsLong());
    }

    public CampaignStatus onTimeoutCheck(long campaignId, ECPoint caller, long now) {
        return m_timeoutController.onTimeoutCheck(campaignId, caller, now);
    }

    public long retryRefundReveal(long campaignId, ECPoint contributor, long now) {
        return m_timeoutController.retryRefundReveal(campaignId, contributor, now);
    }

    public long withdraw(long campaignId, ECPoint caller, long now) {
        return m_settlementEngine.withdraw(campaignId, caller, now);
    }

    public long requestRefund(long campaignId, ECPoint caller, long now) {
        return m_settlementEngine.requestRefund(campaignId, caller, now);
    }

    public long emergencyRefund(long campaignId, ECPoint caller, long now) {
        return m_settlementEngine.emergencyRefund(campaignId, caller, now);
    }

    /**
     * @throws ValidationException if there is no such campaign.
     */
    public void emergencyPause(long campaignId, ECPoint caller, long now) {
        m_ledger.emergencyPause(campaignId, caller, now);
    }

    public void liftPause(long campaignId, ECPoint caller, long now) {
        m_ledger.liftPause(campaignId, caller, now);
    }

    public CampaignAmounts getCampaignAmounts(long campaignId, ECPoint caller) {
        return m_ledger.getCampaignAmounts(campaignId, caller);
    }

    public CampaignView getCampaign(long campaignId) {
        return new CampaignView(m_ledger.getCampaign(campaignId));
    }

    public List<Long> getCreatorCampaigns(ECPoint creator) {
        return m_ledger.getCreatorCampaigns(creator);
    }

    public List<Long> getBackerCampaigns(ECPoint backer) {
        return m_ledger.getBackerCampaigns(backer);
    }

    public PlatformStats getPlatformStats() {
        return m_ledger.getPlatformStats();
    }

    public long campaignCounter() {
        return m_ledger.campaignCounter();
    }

    public AuditLog getAuditLog() {
        return m_ledger.getAuditLog();
    }

    /**
     * Exposes internal records to tests and simulations in this package tree.
     */
    public CampaignLedger getLedger() {
        return m_ledger;
    }

    public RevealRequestManager getRequestManager() {
        return m_requestManager;
    }
}
