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

package test.cloakfund.protocol;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import cloakfund.errors.AuthorizationException;
import cloakfund.errors.StateException;
import cloakfund.errors.ValidationException;
import cloakfund.protocol.PlatformConfig;
import cloakfund.state.CampaignAmounts;
import cloakfund.state.CampaignMetadata;
import cloakfund.state.CampaignStatus;
import cloakfund.state.CampaignView;
import cloakfund.state.ContributionEvent;
import cloakfund.state.PlatformStats;
import cloakfund.state.StatusTransition;

import test.util.PlatformHarness;
import test.util.TestUtils;

public class CampaignLedgerTest {
    @Rule
    public ExpectedException thrown = ExpectedException.none();

    private PlatformHarness m_harness;

    @Before
    public void init() {
        m_harness = new PlatformHarness();
    }

    private void _expectInvalid(String message, Runnable action) {
        try {
            action.run();
            Assert.fail("Expected ValidationException: " + message);
        } catch (ValidationException e) {
            Assert.assertEquals(message, e.getMessage());
        }
    }

    private long _create(CampaignMetadata metadata, long target, long duration) {
        return m_harness.platform.createCampaign(m_harness.creator, metadata, target, duration, m_harness.now());
    }

    @Test
    public void testCreateCampaign() {
        long id = _create(PlatformHarness.metadata("Solar kiln"), 1000, PlatformHarness.DURATION);

        CampaignView view = m_harness.platform.getCampaign(id);
        Assert.assertEquals(1, id);
        Assert.assertEquals(CampaignStatus.ACTIVE, view.getStatus());
        Assert.assertEquals(m_harness.creator, view.getCreator());
        Assert.assertEquals("Solar kiln", view.getMetadata().getTitle());
        Assert.assertEquals(m_harness.now(), view.getCreatedAt());
        Assert.assertEquals(m_harness.now() + PlatformHarness.DURATION, view.getDeadline());
        Assert.assertEquals(0, view.getBackerCount());
        Assert.assertFalse(view.getRevealedRaised().isPresent());
        Assert.assertTrue(view.getMultiplier() >= m_harness.config.getMinMultiplier());
        Assert.assertTrue(view.getMultiplier() < m_harness.config.getMaxMultiplier());

        Assert.assertEquals(1, m_harness.platform.campaignCounter());
        Assert.assertEquals(ImmutableList.of(id), m_harness.platform.getCreatorCampaigns(m_harness.creator));
        Assert.assertEquals(0, m_harness.decrypt(m_harness.platform.getLedger().getCampaign(id).getRaised()));
        Assert.assertEquals(1000, m_harness.decrypt(m_harness.platform.getLedger().getCampaign(id).getTarget()));

        StatusTransition created = m_harness.platform.getAuditLog().getTransitions(id).get(0);
        Assert.assertNull(created.getFrom());
        Assert.assertEquals(CampaignStatus.ACTIVE, created.getTo());
        Assert.assertEquals("createCampaign", created.getOperation());
    }

    @Test
    public void testIdsAreSequential() {
        long first = _create(PlatformHarness.metadata("One"), 1000, PlatformHarness.DURATION);
        long second = _create(PlatformHarness.metadata("Two"), 1000, PlatformHarness.DURATION);

        Assert.assertEquals(first + 1, second);
        Assert.assertEquals(2, m_harness.platform.campaignCounter());
        Assert.assertEquals(ImmutableList.of(first, second),
                m_harness.platform.getCreatorCampaigns(m_harness.creator));
        Assert.assertEquals(ImmutableList.of(), m_harness.platform.getCreatorCampaigns(m_harness.alice));
    }

    @Test
    public void testMetadataValidation() {
        _expectInvalid("Title required",
                () -> _create(new CampaignMetadata("", "d", "art", ""), 1000, PlatformHarness.DURATION));
        _expectInvalid("Category required",
                () -> _create(new CampaignMetadata("t", "d", "", ""), 1000, PlatformHarness.DURATION));
        _expectInvalid("Title too long", () -> _create(
                new CampaignMetadata(Strings.repeat("x", 101), "d", "art", ""), 1000, PlatformHarness.DURATION));
        _expectInvalid("Description too long", () -> _create(
                new CampaignMetadata("t", Strings.repeat("x", 1001), "art", ""), 1000, PlatformHarness.DURATION));

        // Bounds count UTF-8 bytes, not characters.
        _expectInvalid("Category too long", () -> _create(
                new CampaignMetadata("t", "d", Strings.repeat("é", 26), ""), 1000, PlatformHarness.DURATION));

        Assert.assertEquals(0, m_harness.platform.campaignCounter());
    }

    @Test
    public void testDurationAndTargetValidation() {
        CampaignMetadata metadata = PlatformHarness.metadata("Bounds");
        _expectInvalid("Funding period too short", () -> _create(metadata, 1000, 7 * PlatformHarness.DAY - 1));
        _expectInvalid("Funding period too long", () -> _create(metadata, 1000, 90 * PlatformHarness.DAY + 1));
        _expectInvalid("Target must be positive", () -> _create(metadata, 0, PlatformHarness.DURATION));
        _expectInvalid("Target exceeds maximum",
                () -> _create(metadata, TestUtils.MAX_REVEALABLE + 1, PlatformHarness.DURATION));

        _create(metadata, 1000, 7 * PlatformHarness.DAY);
        _create(metadata, TestUtils.MAX_REVEALABLE, 90 * PlatformHarness.DAY);
        Assert.assertEquals(2, m_harness.platform.campaignCounter());
    }

    @Test
    public void testUnknownCampaign() {
        thrown.expect(ValidationException.class);
        thrown.expectMessage("Campaign does not exist");
        m_harness.platform.getCampaign(17);
    }

    @Test
    public void testContributionsAccumulate() {
        long id = m_harness.fundedCampaign(1000, 300, 200);
        m_harness.platform.recordContribution(id, m_harness.alice, 250, "again", m_harness.now() + 5);

        CampaignView view = m_harness.platform.getCampaign(id);
        Assert.assertEquals(2, view.getBackerCount());
        Assert.assertEquals(750, m_harness.decrypt(m_harness.platform.getLedger().getCampaign(id).getRaised()));
        Assert.assertEquals(550, m_harness.decrypt(
                m_harness.platform.getLedger().getCampaign(id).getContribution(m_harness.alice).getAmount()));
        Assert.assertEquals(750, m_harness.vault.heldBalance(id));

        Assert.assertEquals(ImmutableList.of(id), m_harness.platform.getBackerCampaigns(m_harness.alice));
        Assert.assertEquals(ImmutableList.of(), m_harness.platform.getBackerCampaigns(m_harness.carol));
        Assert.assertEquals(3, m_harness.platform.getAuditLog().getContributionEvents(id).size());
        Assert.assertEquals(ContributionEvent.Kind.CONTRIBUTED,
                m_harness.platform.getAuditLog().getContributionEvents(id).get(2).getKind());
    }

    @Test
    public void testContributionValidation() {
        long id = m_harness.fundedCampaign(1000);
        _expectInvalid("Contribution must be positive",
                () -> m_harness.platform.recordContribution(id, m_harness.alice, 0, "", m_harness.now()));
        _expectInvalid("Message too long", () -> m_harness.platform.recordContribution(id, m_harness.alice, 10,
                Strings.repeat("m", 281), m_harness.now()));

        m_harness.platform.recordContribution(id, m_harness.alice, TestUtils.MAX_REVEALABLE, null, m_harness.now());
        _expectInvalid("Contribution would exceed the campaign's maximum balance",
                () -> m_harness.platform.recordContribution(id, m_harness.bob, 1, "", m_harness.now()));
        Assert.assertEquals(TestUtils.MAX_REVEALABLE, m_harness.vault.heldBalance(id));
    }

    @Test
    public void testContributionWindow() {
        long id = m_harness.fundedCampaign(1000);
        long deadline = m_harness.platform.getCampaign(id).getDeadline();

        m_harness.platform.recordContribution(id, m_harness.alice, 100, "", deadline - 1);

        thrown.expect(StateException.class);
        m_harness.platform.recordContribution(id, m_harness.bob, 100, "", deadline);
    }

    @Test
    public void testContributionAfterFinalization() {
        long id = m_harness.fundedCampaign(1000, 100);
        m_harness.toDeadline(id);
        m_harness.platform.requestFinalization(id, m_harness.creator, m_harness.now());

        thrown.expect(StateException.class);
        m_harness.platform.recordContribution(id, m_harness.bob, 100, "", m_harness.now() - 10);
    }

    @Test
    public void testPlatformStats() {
        long first = m_harness.settledCampaign(1000, 600, 500);
        long second = m_harness.settledCampaign(1000, 100);
        m_harness.fundedCampaign(1000, 100);

        PlatformStats stats = m_harness.platform.getPlatformStats();
        Assert.assertEquals(3, stats.getTotalCampaigns());
        Assert.assertEquals(1, stats.getActiveCampaigns());
        Assert.assertEquals(1, stats.getSuccessfulCampaigns());
        Assert.assertEquals(1, stats.getFailedCampaigns());
        Assert.assertEquals(0, stats.getPendingCampaigns());

        m_harness.platform.withdraw(first, m_harness.creator, m_harness.now());
        stats = m_harness.platform.getPlatformStats();
        Assert.assertEquals(0, stats.getSuccessfulCampaigns());
        Assert.assertEquals(1, stats.getWithdrawnCampaigns());
        Assert.assertEquals(CampaignStatus.FAILED, m_harness.platform.getCampaign(second).getStatus());
    }

    @Test
    public void testExhaustedMultipliersLeaveNoTrace() {
        PlatformHarness harness = new PlatformHarness(TestUtils.sharedParams(),
                new PlatformConfig.Builder().setMultiplierRange(1000, 1002));
        long now = harness.now();
        Assert.assertEquals(1, harness.platform.createCampaign(harness.creator, PlatformHarness.metadata("A"), 100,
                PlatformHarness.DURATION, now));
        Assert.assertEquals(2, harness.platform.createCampaign(harness.creator, PlatformHarness.metadata("B"), 100,
                PlatformHarness.DURATION, now));
        try {
            harness.platform.createCampaign(harness.creator, PlatformHarness.metadata("C"), 100,
                    PlatformHarness.DURATION, now);
            Assert.fail("Expected the multiplier range to be exhausted");
        } catch (StateException e) {
            // expected
        }

        Assert.assertEquals(2, harness.platform.campaignCounter());
        Assert.assertEquals(ImmutableList.of(1L, 2L), harness.platform.getCreatorCampaigns(harness.creator));
        Assert.assertEquals(2, harness.platform.getPlatformStats().getTotalCampaigns());
        Assert.assertEquals(2, harness.platform.getAuditLog().getTransitions().size());

        Assert.assertEquals(3, harness.platform.createCampaign(harness.creator, PlatformHarness.metadata("C"), 100,
                PlatformHarness.DURATION, now + 1));
    }

    @Test
    public void testOwner() {
        Assert.assertEquals(m_harness.owner, m_harness.platform.getOwner());
    }

    @Test
    public void testPauseBlocksContributions() {
        long id = m_harness.fundedCampaign(1000, 100);
        m_harness.platform.emergencyPause(id, m_harness.owner, m_harness.now());
        Assert.assertTrue(m_harness.platform.getCampaign(id).isPaused());
        Assert.assertEquals(CampaignStatus.ACTIVE, m_harness.platform.getCampaign(id).getStatus());

        try {
            m_harness.platform.recordContribution(id, m_harness.bob, 200, "", m_harness.now() + 10);
            Assert.fail("Expected a paused campaign to reject contributions");
        } catch (StateException e) {
            Assert.assertEquals("Campaign is paused", e.getMessage());
        }
        Assert.assertEquals(1, m_harness.platform.getCampaign(id).getBackerCount());

        m_harness.platform.liftPause(id, m_harness.owner, m_harness.now() + 20);
        Assert.assertFalse(m_harness.platform.getCampaign(id).isPaused());
        m_harness.platform.recordContribution(id, m_harness.bob, 200, "", m_harness.now() + 30);
        Assert.assertEquals(2, m_harness.platform.getCampaign(id).getBackerCount());
    }

    @Test
    public void testOnlyOwnerMayPause() {
        long id = m_harness.fundedCampaign(1000, 100);
        try {
            m_harness.platform.emergencyPause(id, m_harness.creator, m_harness.now());
            Assert.fail("Expected the creator to be refused");
        } catch (AuthorizationException e) {
            // expected
        }
        Assert.assertFalse(m_harness.platform.getCampaign(id).isPaused());

        m_harness.platform.emergencyPause(id, m_harness.owner, m_harness.now());
        thrown.expect(AuthorizationException.class);
        m_harness.platform.liftPause(id, m_harness.mallory, m_harness.now());
    }

    @Test
    public void testPauseRequiresActiveUnpausedCampaign() {
        long id = m_harness.fundedCampaign(1000, 100);
        m_harness.platform.emergencyPause(id, m_harness.owner, m_harness.now());
        try {
            m_harness.platform.emergencyPause(id, m_harness.owner, m_harness.now());
            Assert.fail("Expected a second pause to fail");
        } catch (StateException e) {
            Assert.assertEquals("Campaign is already paused", e.getMessage());
        }
        m_harness.platform.liftPause(id, m_harness.owner, m_harness.now());
        try {
            m_harness.platform.liftPause(id, m_harness.owner, m_harness.now());
            Assert.fail("Expected lifting an unpaused campaign to fail");
        } catch (StateException e) {
            Assert.assertEquals("Campaign is not paused", e.getMessage());
        }

        long settled = m_harness.settledCampaign(1000, 1000);
        thrown.expect(StateException.class);
        m_harness.platform.emergencyPause(settled, m_harness.owner, m_harness.now());
    }

    @Test
    public void testCampaignAmounts() {
        long id = m_harness.fundedCampaign(1000, 250, 300);

        CampaignAmounts forCreator = m_harness.platform.getCampaignAmounts(id, m_harness.creator);
        Assert.assertEquals(id, forCreator.getCampaignId());
        Assert.assertEquals(550, m_harness.decrypt(forCreator.getRaised()));
        Assert.assertEquals(1000, m_harness.decrypt(forCreator.getTarget()));

        CampaignAmounts forOwner = m_harness.platform.getCampaignAmounts(id, m_harness.owner);
        Assert.assertEquals(550, m_harness.decrypt(forOwner.getRaised()));
        Assert.assertEquals(1000, m_harness.decrypt(forOwner.getTarget()));

        thrown.expect(AuthorizationException.class);
        m_harness.platform.getCampaignAmounts(id, m_harness.alice);
    }
}
