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

package test.util;

import java.io.IOException;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.bouncycastle.crypto.ec.ECPair;
import org.bouncycastle.math.ec.ECPoint;

import com.google.common.collect.ImmutableList;

import cloakfund.cipher.CipherAlgebra;
import cloakfund.custody.EscrowVault;
import cloakfund.protocol.CrowdfundPlatform;
import cloakfund.protocol.PlatformConfig;
import cloakfund.protocol.PrngBeacon;
import cloakfund.reveal.LocalRevealOracle;
import cloakfund.reveal.RevealOracle;
import cloakfund.reveal.RevealPayload;
import cloakfund.reveal.RevealTicket;
import cloakfund.state.CampaignMetadata;
import cloakfund.util.EncryptionParams;

/**
 * A platform wired to an in-process oracle that only answers when told to,
 * with a settable clock and an inspectable escrow vault.
 */
public class PlatformHarness {
    public static final long START = 1_700_000_000L;
    public static final long DAY = TimeUnit.DAYS.toSeconds(1);
    public static final long HOUR = TimeUnit.HOURS.toSeconds(1);
    public static final long DURATION = 30 * DAY;

    public final EncryptionParams params;
    public final PlatformConfig config;
    public final RevealOracle oracle;
    public final LocalRevealOracle local;
    public final EscrowVault vault = new EscrowVault();
    public final AtomicLong clock = new AtomicLong(START);
    public final CrowdfundPlatform platform;

    public final ECPoint owner;
    public final ECPoint creator;
    public final ECPoint alice;
    public final ECPoint bob;
    public final ECPoint carol;
    public final ECPoint mallory;

    public PlatformHarness() {
        this(TestUtils.sharedParams());
    }

    public PlatformHarness(EncryptionParams params) {
        this(params, new PlatformConfig.Builder());
    }

    /**
     * The revealable maxima are applied on top of {@code configBuilder}.
     */
    public PlatformHarness(EncryptionParams params, PlatformConfig.Builder configBuilder) {
        this.params = params;
        config = configBuilder.setMaxTarget(TestUtils.MAX_REVEALABLE).setMaxContribution(TestUtils.MAX_REVEALABLE)
                .setMaxCampaignBalance(TestUtils.MAX_REVEALABLE).build();
        oracle = RevealOracle.generate(params);
        local = new LocalRevealOracle(oracle);
        owner = identity();
        platform = new CrowdfundPlatform(config, owner, new CipherAlgebra(params, oracle.getEncryptionKey()),
                oracle.buildVerifier(), local, vault, new PrngBeacon(new Random(TestUtils.RANDOM_SEED)), clock::get);

        creator = identity();
        alice = identity();
        bob = identity();
        carol = identity();
        mallory = identity();
    }

    public ECPoint identity() {
        return params.derivePublicKey(params.getRandomIndex());
    }

    /**
     * Asks the oracle directly what a ciphertext holds, bypassing the
     * platform.
     */
    public long decrypt(ECPair cipher) {
        RevealTicket ticket = new RevealTicket(Long.MAX_VALUE, ImmutableList.of(cipher), new byte[0]);
        try {
            return RevealPayload.decode(oracle.answer(ticket).getPlaintexts(), 1).get(0);
        } catch (IOException e) {
            throw new AssertionError(e);
        }
    }

    public static CampaignMetadata metadata(String title) {
        return new CampaignMetadata(title, "A test campaign", "art", "QmTestContentHash");
    }

    public long now() {
        return clock.get();
    }

    public long advance(long seconds) {
        return clock.addAndGet(seconds);
    }

    /**
     * Creates a campaign now and records the contributions in order, one
     * second apart, from alice, bob and carol.
     */
    public long fundedCampaign(long target, long... contributions) {
        ECPoint[] backers = new ECPoint[] { alice, bob, carol };
        long id = platform.createCampaign(creator, metadata("Campaign"), target, DURATION, now());
        for (int i = 0; i < contributions.length; i++) {
            platform.recordContribution(id, backers[i], contributions[i], "", now() + i);
        }
        return id;
    }

    /**
     * Moves the clock to the campaign's deadline.
     */
    public void toDeadline(long campaignId) {
        clock.set(platform.getCampaign(campaignId).getDeadline());
    }

    /**
     * Funds, finalizes and settles a campaign through the oracle.
     */
    public long settledCampaign(long target, long... contributions) {
        long id = fundedCampaign(target, contributions);
        toDeadline(id);
        platform.requestFinalization(id, creator, now());
        local.deliverNext();
        return id;
    }
}
