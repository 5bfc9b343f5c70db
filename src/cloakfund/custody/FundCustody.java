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

import org.bouncycastle.math.ec.ECPoint;

import cloakfund.errors.InsufficientFundsException;

/**
 * Holds the funds paid into each campaign. Only the settlement engine releases
 * funds, and only after its state checks have passed.
 */
public interface FundCustody {
    public void deposit(long campaignId, ECPoint from, long amount);

    public long heldBalance(long campaignId);

    /**
     * Transfers {@code amount} out of the campaign's held balance.
     *
     * @throws InsufficientFundsException if the campaign holds less than
     *             {@code amount}. Nothing is transferred in that case.
     */
    public void release(long campaignId, ECPoint to, long amount);
}
