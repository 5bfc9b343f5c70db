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

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

import org.bouncycastle.crypto.ec.ECPair;
import org.bouncycastle.math.ec.ECPoint;

import com.google.common.collect.ImmutableList;

import cloakfund.errors.AuthorizationException;
import cloakfund.errors.ProofVerificationException;
import cloakfund.errors.StateException;
import cloakfund.reveal.RevealCapability;
import cloakfund.reveal.RevealPayload;
import cloakfund.reveal.RevealResponse;
import cloakfund.reveal.RevealTicket;
import cloakfund.reveal.RevealVerifier;
import cloakfund.state.Campaign;
import cloakfund.state.CampaignStatus;
import cloakfund.state.RevealRequest;

/**
 * Issues reveal requests to the oracle and accepts their responses.
 *
 * Every request gets a fresh id and a {@link RevealRequest} record. A response
 * is only trusted after {@link RevealVerifier} accepts it against the ticket
 * that was actually sent, and only applied if its request is still the
 * campaign's current active one. Responses to requests superseded by a retry
 * are rejected as stale.
 *
 * Tickets are handed to the oracle only after the campaign's state has been
 * updated and its monitor released, so a synchronous oracle sees the request
 * as active.
 *
 * @author ethan@cs.cornell.edu
 */
public class RevealRequestManager {
    private static final Logger LOGGER = Logger.getLogger("cloakfund");

    private static final byte[] NO_CONTEXT = new byte[0];

    private final PlatformConfig m_config;
    private final CampaignLedger m_ledger;
    private final RevealCapability m_capability;
    private final RevealVerifier m_verifier;

    private final Map<Long, RevealRequest> m_requests = new ConcurrentHashMap<>();
    private final AtomicLong m_requestCounter = new AtomicLong(0);

    public RevealRequestManager(PlatformConfig config, CampaignLedger ledger, RevealCapability capability,
            RevealVerifier verifier) {
        m_config = config;
        m_ledger = ledger;
        m_capability = capability;
        m_verifier = verifier;
    }

    /**
     * Closes funding and asks the oracle to reveal {@code (raised, target)}.
     * The creator may do this as soon as the deadline passes; anyone may once
     * the grace period has also elapsed.
     *
     * @return the id of the issued reveal request.
     * @throws StateException if the campaign is not active, is paused, or the
     *             deadline has not been reached.
     * @throws AuthorizationException if a non-creator calls within the grace
     *             period.
     */
    public long requestFinalization(long campaignId, ECPoint caller, long now) {
        Campaign campaign = m_ledger.getCampaign(campaignId);
        RevealRequest request;
        synchronized (campaign) {
            if (campaign.getStatus() != CampaignStatus.ACTIVE) throw new StateException("Campaign is not active");
            if (campaign.isPaused()) throw new StateException("Campaign is paused");
            if (now < campaign.getDeadline()) throw new StateException("Funding period has not ended");
            if (!caller.equals(campaign.getCreator()) && now < campaign.getDeadline() + m_config.getGracePeriod())
                throw new AuthorizationException("Only the creator may finalize during the grace period");

            request = issueSettlementRequest(campaign, caller, now);
            m_ledger.transition(campaign, CampaignStatus.DECRYPTION_PENDING, now, "requestFinalization");
        }
        submit(request);
        return request.getRequestId();
    }

    /**
     * Applies a verified settlement reveal: caches the revealed values and
     * moves the campaign to {@code SUCCESSFUL} or {@code FAILED}.
     *
     * @throws ProofVerificationException if the response is forged, malformed
     *             or names no known request. Nothing changes.
     * @throws StateException if the request is no longer the campaign's
     *             active settlement request. Nothing changes.
     */
    public void onRevealResponse(RevealResponse response, long now) {
        RevealRequest request = verifiedRequest(response);
        if (request.getKind() != RevealRequest.Kind.SETTLEMENT)
            throw new StateException(request + " is not a settlement request");

        Campaign campaign = m_ledger.getCampaign(request.getCampaignId());
        synchronized (campaign) {
            if (!request.isActive() || campaign.getRequestId() != request.getRequestId()
                    || campaign.getStatus() != CampaignStatus.DECRYPTION_PENDING)
                throw new StateException("Stale reveal response for " + request);

            List<Long> values = decode(request, response);
            long raised = values.get(0);
            long target = values.get(1);

            request.markCompleted();
            campaign.cacheRevealedValues(raised, target);
            m_ledger.transition(campaign, raised >= target ? CampaignStatus.SUCCESSFUL : CampaignStatus.FAILED, now,
                    "onRevealResponse");
        }
    }

    /**
     * Creates and records a settlement request for the campaign's current
     * {@code (raised, target)} pair and makes it the campaign's active request.
     * The caller must hold the campaign's monitor and must {@link #submit} the
     * request once the monitor is released.
     */
    RevealRequest issueSettlementRequest(Campaign campaign, ECPoint requester, long now) {
        RevealRequest request = _issue(campaign.getId(), RevealRequest.Kind.SETTLEMENT, requester, null,
                ImmutableList.of(campaign.getRaised(), campaign.getTarget()), NO_CONTEXT, now);
        campaign.setPendingRequest(request.getRequestId(), now);
        return request;
    }

    /**
     * Creates and records a request revealing one contribution. The
     * contributor's identity travels as the ticket's context. The caller must
     * hold the campaign's monitor and must {@link #submit} the request once
     * the monitor is released.
     */
    RevealRequest issueRefundRequest(long campaignId, ECPoint contributor, ECPair amount, long now) {
        return _issue(campaignId, RevealRequest.Kind.REFUND, contributor, contributor, ImmutableList.of(amount),
                contributor.getEncoded(true), now);
    }

    private RevealRequest _issue(long campaignId, RevealRequest.Kind kind, ECPoint requester, ECPoint subject,
            List<ECPair> ciphertexts, byte[] context, long now) {
        long requestId = m_requestCounter.incrementAndGet();
        RevealTicket ticket = new RevealTicket(requestId, ciphertexts, context);
        RevealRequest request = new RevealRequest(requestId, campaignId, kind, requester, subject, now, ticket);
        m_requests.put(requestId, request);
        LOGGER.fine("Issued " + request);
        return request;
    }

    void submit(RevealRequest request) {
        m_capability.submit(request.getTicket());
    }

    /**
     * @return the request record, or {@code null} if no request has that id.
     */
    public RevealRequest getRequest(long requestId) {
        return m_requests.get(requestId);
    }

    /**
     * Looks up the request a response claims to answer and verifies the
     * response against the ticket that was sent.
     *
     * @throws ProofVerificationException if the request is unknown or the
     *             response does not verify.
     */
    public RevealRequest verifiedRequest(RevealResponse response) {
        RevealRequest request = m_requests.get(response.getRequestId());
        if (request == null)
            throw new ProofVerificationException("No reveal request with id " + response.getRequestId());
        if (!m_verifier.verify(request.getTicket(), response))
            throw new ProofVerificationException("Reveal response for " + request + " failed verification");
        LOGGER.fine("Verified reveal response for " + request);
        return request;
    }

    /**
     * Decodes the revealed values of a response, one per ciphertext in the
     * request's ticket.
     *
     * @throws ProofVerificationException if the plaintexts do not have the
     *             expected shape.
     */
    List<Long> decode(RevealRequest request, RevealResponse response) {
        try {
            return RevealPayload.decode(response.getPlaintexts(), request.getTicket().getCiphertexts().size());
        } catch (IOException e) {
            throw new ProofVerificationException("Malformed reveal payload for " + request, e);
        }
    }
}
