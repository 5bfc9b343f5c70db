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

package cloakfund.custody;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

import org.bouncycastle.math.ec.ECPoint;

import com.google.common.collect.ImmutableList;

import cloakfund.errors.InsufficientFundsException;

/**
 * An in-memory {@link FundCustody} that keeps a balance per campaign and
 * records every payout it makes.
 */
public class EscrowVault implements FundCustody {
    private static final Logger LOGGER = Logger.getLogger("cloakfund");

    public static class Payout {
        private final long m_campaignId;
        private final ECPoint m_recipient;
        private final long m_amount;

        public Payout(long campaignId, ECPoint recipient, long amount) {
            m_campaignId = campaignId;
            m_recipient = recipient;
            m_amount = amount;
        }

        public long getCampaignId() {
            return m_campaignId;
        }

        public ECPoint getRecipient() {
            return m_recipient;
        }

        public long getAmount() {
            return m_amount;
        }

        @Override
        public boolean equals(Object o) {
            if (o == this) return true;
            if (!(o instanceof Payout)) return false;

            Payout p = (Payout) o;
            return m_campaignId == p.m_campaignId && m_amount == p.m_amount && m_recipient.equals(p.m_recipient);
        }

        @Override
        public int hashCode() {
            return Objects.hash(m_campaignId, m_recipient, m_amount);
        }
    }

    private final Map<Long, Long> m_balances = new HashMap<>();
    private final List<Payout> m_payouts = new ArrayList<>();

    @Override
    public synchronized void deposit(long campaignId, ECPoint from, long amount) {
        if (amount <= 0) throw new IllegalArgumentException("Deposits must be positive");
        m_balances.put(campaignId, Math.addExact(heldBalance(campaignId), amount));
    }

    @Override
    public synchronized long heldBalance(long campaignId) {
        return m_balances.getOrDefault(campaignId, 0L);
    }

    @Override
    public synchronized void release(long campaignId, ECPoint to, long amount) {
        if (amount < 0) throw new IllegalArgumentException("Cannot release a negative amount");
        long balance = heldBalance(campaignId);
        if (balance < amount)
            throw new InsufficientFundsException(
                    "Campaign " + campaignId + " holds " + balance + " but " + amount + " was requested");

        m_balances.put(campaignId, balance - amount);
        m_payouts.add(new Payout(campaignId, to, amount));
        LOGGER.fine("Released " + amount + " from campaign " + campaignId);
    }

    public synchronized List<Payout> getPayouts() {
        return ImmutableList.copyOf(m_payouts);
    }

    public synchronized List<Payout> getPayouts(long campaignId) {
        ImmutableList.Builder<Payout> payouts = ImmutableList.builder();
        for (Payout p : m_payouts)
            if (p.getCampaignId() == campaignId) payouts.add(p);
        return payouts.build();
    }

    /**
     * @return the total paid to {@code recipient} from the given campaign.
     */
    public synchronized long totalPaidTo(long campaignId, ECPoint recipient) {
        long total = 0;
        for (Payout p : m_payouts)
            if (p.getCampaignId() == campaignId && p.getRecipient().equals(recipient)) total += p.getAmount();
        return total;
    }
}
