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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

import org.bouncycastle.crypto.ec.ECPair;
import org.bouncycastle.math.ec.ECPoint;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;

import cloakfund.cipher.CipherAlgebra;
import cloakfund.custody.FundCustody;
import cloakfund.errors.AuthorizationException;
import cloakfund.errors.StateException;
import cloakfund.errors.ValidationException;
import cloakfund.state.AuditLog;
import cloakfund.state.Campaign;
import cloakfund.state.CampaignAmounts;
import cloakfund.state.CampaignMetadata;
import cloakfund.state.CampaignStatus;
import cloakfund.state.Contribution;
import cloakfund.state.ContributionEvent;
import cloakfund.state.PlatformStats;
import cloakfund.state.StatusTransition;

/**
 * Owns every campaign and contribution record. Campaigns are created here and
 * contributions are recorded here; all later mutation happens in the request
 * manager, the timeout controller and the settlement engine, each of which
 * moves a campaign along its status lattice through
 * {@link #transition(Campaign, CampaignStatus, long, String)} so the audit log
 * and the platform counters stay in step.
 *
 * @author ethan@cs.cornell.edu
 */
public class CampaignLedger {
    private static final Logger LOGGER = Logger.getLogger("cloakfund");

    private final PlatformConfig m_config;
    private final ECPoint m_owner;
    private final CipherAlgebra m_algebra;
    private final ObfuscationGenerator m_obfuscator;
    private final FundCustody m_custody;

    private final Map<Long, Campaign> m_campaigns = new ConcurrentHashMap<>();
    private final AtomicLong m_campaignCounter = new AtomicLong(0);

    private final Map<ECPoint, List<Long>> m_creatorCampaigns = new HashMap<>();
    private final Map<ECPoint, List<Long>> m_backerCampaigns = new HashMap<>();

    private final AuditLog m_auditLog = new AuditLog();
    private final PlatformStats.Tracker m_stats = new PlatformStats.Tracker();

    public CampaignLedger(PlatformConfig config, ECPoint owner, CipherAlgebra algebra, ObfuscationGenerator obfuscator,
            FundCustody custody) {
        m_config = config;
        m_owner = owner;
        m_algebra = algebra;
        m_obfuscator = obfuscator;
        m_custody = custody;
    }

    /**
     * Registers a new campaign in {@code ACTIVE} status.
     *
     * @param fundingDuration the funding period in seconds.
     * @return the new campaign's id.
     * @throws ValidationException if the metadata, target or duration is out
     *             of bounds.
     */
    public long createCampaign(ECPoint creator, CampaignMetadata metadata, long target, long fundingDuration,
            long now) {
        _validateMetadata(metadata);
        if (fundingDuration < m_config.getMinDuration()) throw new ValidationException("Funding period too short");
        if (fundingDuration > m_config.getMaxDuration()) throw new ValidationException("Funding period too long");
        if (target <= 0) throw new ValidationException("Target must be positive");
        if (target > m_config.getMaxTarget()) throw new ValidationException("Target exceeds maximum");

        ECPair encryptedTarget = m_algebra.encrypt(target);

        Campaign campaign;
        synchronized (this) {
            // The id is only taken once the multiplier has been derived.
            long id = m_campaignCounter.get() + 1;
            ObfuscationGenerator.Obfuscation obfuscation = m_obfuscator.derive(id, creator, id, encryptedTarget, now);
            campaign = new Campaign(id, creator, metadata, encryptedTarget, obfuscation.getObfuscatedTarget(),
                    obfuscation.getMultiplier(), m_algebra.encryptZero(), now, now + fundingDuration);

            m_campaignCounter.set(id);
            m_stats.onCreated();
            m_auditLog.append(new StatusTransition(id, null, CampaignStatus.ACTIVE, now, "createCampaign"));
            m_campaigns.put(id, campaign);
            m_creatorCampaigns.computeIfAbsent(creator, k -> new ArrayList<>()).add(id);
        }

        LOGGER.info("Created campaign " + campaign.getId() + " " + metadata + ", deadline " + campaign.getDeadline());
        return campaign.getId();
    }

    /**
     * Adds a payment into the contributor's running contribution and the
     * campaign's raised total. The plaintext amount is deposited into custody;
     * only its encryption is kept on the campaign.
     *
     * @throws ValidationException if the amount or message is out of bounds.
     * @throws StateException if the campaign is not active or its deadline has
     *             passed.
     */
    public void recordContribution(long campaignId, ECPoint contributor, long amount, String message, long now) {
        if (message == null) message = "";
        if (amount <= 0) throw new ValidationException("Contribution must be positive");
        if (amount > m_config.getMaxContribution()) throw new ValidationException("Contribution exceeds maximum");
        if (_byteLength(message) > m_config.getMaxMessageBytes()) throw new ValidationException("Message too long");

        Campaign campaign = getCampaign(campaignId);
        ECPair encrypted = m_algebra.encrypt(amount);
        synchronized (campaign) {
            if (campaign.getStatus() != CampaignStatus.ACTIVE) throw new StateException("Campaign is not active");
            if (campaign.isPaused()) throw new StateException("Campaign is paused");
            if (now >= campaign.getDeadline()) throw new StateException("Funding period has ended");
            if (m_custody.heldBalance(campaignId) > m_config.getMaxCampaignBalance() - amount)
                throw new ValidationException("Contribution would exceed the campaign's maximum balance");

            m_custody.deposit(campaignId, contributor, amount);

            Contribution contribution = campaign.getContribution(contributor);
            if (contribution == null) {
                campaign.addContribution(new Contribution(campaignId, contributor, encrypted, message, now));
                synchronized (this) {
                    m_backerCampaigns.computeIfAbsent(contributor, k -> new ArrayList<>()).add(campaignId);
                }
            } else {
                contribution.accumulate(m_algebra.add(contribution.getAmount(), encrypted), message);
            }
            campaign.setRaised(m_algebra.add(campaign.getRaised(), encrypted));
        }

        recordEvent(campaignId, contributor, ContributionEvent.Kind.CONTRIBUTED, now);
        LOGGER.fine("Recorded contribution to campaign " + campaignId);
    }

    /**
     * @throws ValidationException if there is no such campaign.
     */
    public Campaign getCampaign(long campaignId) {
        Campaign campaign = m_campaigns.get(campaignId);
        if (campaign == null) throw new ValidationException("Campaign does not exist");
        return campaign;
    }

    public ECPoint getOwner() {
        return m_owner;
    }

    /**
     * Halts contributions to and finalization of an active campaign until the
     * owner lifts the pause.
     *
     * @throws AuthorizationException if {@code caller} is not the platform
     *             owner.
     * @throws StateException if the campaign is not active or already paused.
     */
    public void emergencyPause(long campaignId, ECPoint caller, long now) {
        Campaign campaign = getCampaign(campaignId);
        synchronized (campaign) {
            if (!caller.equals(m_owner)) throw new AuthorizationException("Only the platform owner may pause");
            if (campaign.getStatus() != CampaignStatus.ACTIVE) throw new StateException("Campaign is not active");
            if (campaign.isPaused()) throw new StateException("Campaign is already paused");
            campaign.setPaused(true);
        }
        LOGGER.warning("Campaign " + campaignId + " paused by the platform owner at " + now);
    }

    /**
     * @throws AuthorizationException if {@code caller} is not the platform
     *             owner.
     * @throws StateException if the campaign is not paused.
     */
    public void liftPause(long campaignId, ECPoint caller, long now) {
        Campaign campaign = getCampaign(campaignId);
        synchronized (campaign) {
            if (!caller.equals(m_owner)) throw new AuthorizationException("Only the platform owner may lift a pause");
            if (!campaign.isPaused()) throw new StateException("Campaign is not paused");
            campaign.setPaused(false);
        }
        LOGGER.info("Campaign " + campaignId + " resumed at " + now);
    }

    /**
     * @return the campaign's current encrypted amounts.
     * @throws AuthorizationException if {@code caller} is neither the creator
     *             nor the platform owner.
     */
    public CampaignAmounts getCampaignAmounts(long campaignId, ECPoint caller) {
        Campaign campaign = getCampaign(campaignId);
        if (!caller.equals(campaign.getCreator()) && !caller.equals(m_owner))
            throw new AuthorizationException("Only the creator or the platform owner may view encrypted amounts");
        synchronized (campaign) {
            return new CampaignAmounts(campaignId, campaign.getRaised(), campaign.getTarget(),
                    campaign.getObfuscatedTarget());
        }
    }

    public long campaignCounter() {
        return m_campaignCounter.get();
    }

    public synchronized List<Long> getCreatorCampaigns(ECPoint creator) {
        return ImmutableList.copyOf(m_creatorCampaigns.getOrDefault(creator, ImmutableList.of()));
    }

    public synchronized List<Long> getBackerCampaigns(ECPoint backer) {
        return ImmutableList.copyOf(m_backerCampaigns.getOrDefault(backer, ImmutableList.of()));
    }

    public PlatformStats getPlatformStats() {
        return m_stats.snapshot();
    }

    public AuditLog getAuditLog() {
        return m_auditLog;
    }

    /**
     * Moves a campaign to {@code next}, recording the transition. The caller
     * must hold the campaign's monitor.
     */
    public void transition(Campaign campaign, CampaignStatus next, long now, String operation) {
        CampaignStatus previous = campaign.transitionTo(next);
        m_stats.onTransition(previous, next);
        m_auditLog.append(new StatusTransition(campaign.getId(), previous, next, now, operation));
        LOGGER.info("Campaign " + campaign.getId() + ": " + previous + " -> " + next + " (" + operation + ")");
    }

    public void recordEvent(long campaignId, ECPoint contributor, ContributionEvent.Kind kind, long now) {
        m_auditLog.append(new ContributionEvent(campaignId, contributor, kind, now));
    }

    /**
     * Rebuilds the raised total from the contributions that have not been
     * refunded. The caller must hold the campaign's monitor.
     */
    public void recomputeRaised(Campaign campaign) {
        ECPair raised = m_algebra.encryptZero();
        for (Contribution c : campaign.getContributions()) {
            if (!c.isRefunded()) raised = m_algebra.add(raised, c.getAmount());
        }
        campaign.setRaised(raised);
    }

    private void _validateMetadata(CampaignMetadata metadata) {
        int title = _byteLength(metadata.getTitle());
        int category = _byteLength(metadata.getCategory());
        if (title == 0) throw new ValidationException("Title required");
        if (title > m_config.getMaxTitleBytes()) throw new ValidationException("Title too long");
        if (_byteLength(metadata.getDescription()) > m_config.getMaxDescriptionBytes())
            throw new ValidationException("Description too long");
        if (category == 0) throw new ValidationException("Category required");
        if (category > m_config.getMaxCategoryBytes()) throw new ValidationException("Category too long");
        if (_byteLength(metadata.getContentRef()) > m_config.getMaxContentRefBytes())
            throw new ValidationException("Content reference too long");
    }

    private static int _byteLength(String s) {
        return s.getBytes(Charsets.UTF_8).length;
    }
}
