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

import org.bouncycastle.math.ec.ECPoint;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import cloakfund.errors.AuthorizationException;
import cloakfund.errors.InsufficientFundsException;
import cloakfund.errors.StateException;
import cloakfund.reveal.RevealResponse;
import cloakfund.reveal.RevealTicket;
import cloakfund.state.CampaignStatus;
import cloakfund.state.Contribution;
import cloakfund.state.ContributionEvent;

import test.util.PlatformHarness;

public class SettlementEngineTest {
    @Rule
    public ExpectedException thrown = ExpectedException.none();

    private PlatformHarness m_harness;

    @Before
    public void init() {
        m_harness = new PlatformHarness();
    }

    private Contribution _contribution(long id, ECPoint backer) {
        return m_harness.platform.getLedger().getCampaign(id).getContribution(backer);
    }

    /**
     * Drives a campaign through every allowed timeout until its reveal fails
     * for good.
     */
    private long _decryptionFailedCampaign(long target, long... contributions) {
        long id = m_harness.fundedCampaign(target, contributions);
        m_harness.toDeadline(id);
        m_harness.platform.requestFinalization(id, m_harness.creator, m_harness.now());
        CampaignStatus status;
        do {
            m_harness.local.dropPending();
            m_harness.advance(PlatformHarness.HOUR);
            status = m_harness.platform.onTimeoutCheck(id, m_harness.mallory, m_harness.now());
        } while (status == CampaignStatus.DECRYPTION_PENDING);
        Assert.assertEquals(CampaignStatus.DECRYPTION_FAILED, status);
        return id;
    }

    @Test
    public void testWithdraw() {
        long id = m_harness.settledCampaign(1000, 600, 500);

        Assert.assertEquals(1100, m_harness.platform.withdraw(id, m_harness.creator, m_harness.now()));
        Assert.assertEquals(1100, m_harness.vault.totalPaidTo(id, m_harness.creator));
        Assert.assertEquals(0, m_harness.vault.heldBalance(id));
        Assert.assertEquals(CampaignStatus.WITHDRAWN, m_harness.platform.getCampaign(id).getStatus());
        Assert.assertTrue(m_harness.platform.getCampaign(id).isWithdrawn());
    }

    @Test
    public void testWithdrawTwice() {
        long id = m_harness.settledCampaign(1000, 600, 500);
        m_harness.platform.withdraw(id, m_harness.creator, m_harness.now());

        try {
            m_harness.platform.withdraw(id, m_harness.creator, m_harness.now());
            Assert.fail("Withdrew twice");
        } catch (StateException e) {
            Assert.assertEquals(1, m_harness.vault.getPayouts(id).size());
        }
    }

    @Test
    public void testWithdrawByStranger() {
        long id = m_harness.settledCampaign(1000, 600, 500);

        thrown.expect(AuthorizationException.class);
        m_harness.platform.withdraw(id, m_harness.alice, m_harness.now());
    }

    @Test
    public void testWithdrawFailedCampaign() {
        long id = m_harness.settledCampaign(1000, 600);

        thrown.expect(StateException.class);
        m_harness.platform.withdraw(id, m_harness.creator, m_harness.now());
    }

    @Test
    public void testWithdrawPendingCampaign() {
        long id = m_harness.fundedCampaign(1000, 1600);
        m_harness.toDeadline(id);
        m_harness.platform.requestFinalization(id, m_harness.creator, m_harness.now());

        thrown.expect(StateException.class);
        m_harness.platform.withdraw(id, m_harness.creator, m_harness.now());
    }

    @Test
    public void testRefund() {
        long id = m_harness.settledCampaign(1000, 300, 200);

        long requestId = m_harness.platform.requestRefund(id, m_harness.alice, m_harness.now());
        RevealTicket ticket = m_harness.local.getPendingTickets().get(0);
        Assert.assertEquals(requestId, ticket.getRequestId());
        Assert.assertArrayEquals(m_harness.alice.getEncoded(true), ticket.getContext());
        Assert.assertTrue(_contribution(id, m_harness.alice).isRefundRequested());
        Assert.assertEquals(0, m_harness.vault.totalPaidTo(id, m_harness.alice));

        m_harness.local.deliverNext();

        Contribution alice = _contribution(id, m_harness.alice);
        Assert.assertTrue(alice.isRefunded());
        Assert.assertEquals(300, alice.getRefundedAmount());
        Assert.assertEquals(300, m_harness.vault.totalPaidTo(id, m_harness.alice));
        Assert.assertEquals(200, m_harness.vault.heldBalance(id));
        Assert.assertEquals(200, m_harness.decrypt(m_harness.platform.getLedger().getCampaign(id).getRaised()));
        Assert.assertEquals(CampaignStatus.FAILED, m_harness.platform.getCampaign(id).getStatus());

        Assert.assertEquals(ContributionEvent.Kind.REFUNDED, m_harness.platform.getAuditLog()
                .getContributionEvents(id).get(3).getKind());
        Assert.assertEquals(ContributionEvent.Kind.REFUND_REQUESTED, m_harness.platform.getAuditLog()
                .getContributionEvents(id).get(2).getKind());
    }

    @Test
    public void testRefundRequestedTwice() {
        long id = m_harness.settledCampaign(1000, 300);
        m_harness.platform.requestRefund(id, m_harness.alice, m_harness.now());

        try {
            m_harness.platform.requestRefund(id, m_harness.alice, m_harness.now());
            Assert.fail("Refund requested twice");
        } catch (StateException e) {
            Assert.assertEquals(1, m_harness.local.getPendingTickets().size());
        }

        m_harness.local.deliverNext();
        thrown.expect(StateException.class);
        thrown.expectMessage("already refunded");
        m_harness.platform.requestRefund(id, m_harness.alice, m_harness.now());
    }

    @Test
    public void testRefundByStranger() {
        long id = m_harness.settledCampaign(1000, 300);

        thrown.expect(AuthorizationException.class);
        m_harness.platform.requestRefund(id, m_harness.mallory, m_harness.now());
    }

    @Test
    public void testRefundFromSuccessfulCampaign() {
        long id = m_harness.settledCampaign(1000, 1300);

        thrown.expect(StateException.class);
        m_harness.platform.requestRefund(id, m_harness.alice, m_harness.now());
    }

    @Test
    public void testRefundBlockedByCustody() {
        long id = m_harness.settledCampaign(1000, 300, 200);
        m_harness.vault.release(id, m_harness.mallory, 300);
        m_harness.platform.requestRefund(id, m_harness.alice, m_harness.now());
        RevealTicket ticket = m_harness.local.getPendingTickets().get(0);

        try {
            m_harness.local.deliverNext();
            Assert.fail("Refund paid from an underfunded campaign");
        } catch (InsufficientFundsException e) {
            Assert.assertFalse(_contribution(id, m_harness.alice).isRefunded());
            Assert.assertEquals(200, m_harness.vault.heldBalance(id));
        }

        // Once custody is topped up the same verified response settles.
        m_harness.vault.deposit(id, m_harness.creator, 300);
        RevealResponse response = m_harness.oracle.answer(ticket);
        m_harness.local.replay(response);
        Assert.assertEquals(300, m_harness.vault.totalPaidTo(id, m_harness.alice));
    }

    @Test
    public void testRefundRequestAfterDecryptionFailure() {
        long id = _decryptionFailedCampaign(1000, 300);

        Assert.assertEquals(-1, m_harness.platform.requestRefund(id, m_harness.alice, m_harness.now()));
        Assert.assertTrue(m_harness.local.getPendingTickets().isEmpty());
        Assert.assertTrue(_contribution(id, m_harness.alice).isRefundRequested());
    }

    @Test
    public void testEmergencyRefundShares() {
        long id = _decryptionFailedCampaign(1000, 100, 200, 301);

        try {
            m_harness.platform.emergencyRefund(id, m_harness.alice, m_harness.now());
            Assert.fail("Emergency refund before the window opened");
        } catch (StateException e) {
            Assert.assertEquals(601, m_harness.vault.heldBalance(id));
        }

        m_harness.advance(PlatformHarness.HOUR);
        Assert.assertEquals(200, m_harness.platform.emergencyRefund(id, m_harness.alice, m_harness.now()));
        Assert.assertEquals(200, m_harness.platform.emergencyRefund(id, m_harness.bob, m_harness.now()));
        Assert.assertEquals(201, m_harness.platform.emergencyRefund(id, m_harness.carol, m_harness.now()));

        Assert.assertEquals(0, m_harness.vault.heldBalance(id));
        Assert.assertEquals(ContributionEvent.Kind.EMERGENCY_REFUNDED, m_harness.platform.getAuditLog()
                .getContributionEvents(id).get(5).getKind());
        Assert.assertEquals(CampaignStatus.DECRYPTION_FAILED, m_harness.platform.getCampaign(id).getStatus());
    }

    @Test
    public void testEmergencyRefundTwice() {
        long id = _decryptionFailedCampaign(1000, 100, 200);
        m_harness.advance(PlatformHarness.HOUR);
        m_harness.platform.emergencyRefund(id, m_harness.alice, m_harness.now());

        thrown.expect(StateException.class);
        m_harness.platform.emergencyRefund(id, m_harness.alice, m_harness.now());
    }

    @Test
    public void testEmergencyRefundByStranger() {
        long id = _decryptionFailedCampaign(1000, 100);
        m_harness.advance(PlatformHarness.HOUR);

        thrown.expect(AuthorizationException.class);
        m_harness.platform.emergencyRefund(id, m_harness.mallory, m_harness.now());
    }

    @Test
    public void testEmergencyRefundOnFailedCampaign() {
        long id = m_harness.settledCampaign(1000, 100);

        thrown.expect(StateException.class);
        m_harness.platform.emergencyRefund(id, m_harness.alice, m_harness.now() + 3 * PlatformHarness.HOUR);
    }
}
