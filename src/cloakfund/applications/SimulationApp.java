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

package cloakfund.applications;

import java.io.IOException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bouncycastle.math.ec.ECPoint;

import com.google.common.base.Stopwatch;

import cloakfund.cipher.CipherAlgebra;
import cloakfund.custody.EscrowVault;
import cloakfund.protocol.CrowdfundPlatform;
import cloakfund.protocol.PlatformConfig;
import cloakfund.protocol.PrngBeacon;
import cloakfund.reveal.LocalRevealOracle;
import cloakfund.reveal.RevealCapability;
import cloakfund.reveal.RevealOracle;
import cloakfund.reveal.RevealVerifier;
import cloakfund.state.CampaignMetadata;
import cloakfund.state.CampaignStatus;
import cloakfund.util.EncryptionParams;
import cloakfund.util.ThreadLogFormatter;
import cloakfund.zookeeper.OracleKeys;
import cloakfund.zookeeper.ZooKeeperRevealChannel;

/**
 * Walks campaigns through their full lifecycle and logs each outcome.
 *
 * With no arguments the success, failure and oracle-timeout scenarios run
 * in-process against a local oracle. With a ZooKeeper connect string the
 * success scenario runs against a remote {@link OracleNode}.
 */
public class SimulationApp {
    private static final Logger LOGGER = Logger.getLogger("cloakfund");

    private static final long START_TIME = 1_700_000_000L;
    private static final long DAY = TimeUnit.DAYS.toSeconds(1);

    private final EncryptionParams m_params;
    private final EscrowVault m_vault = new EscrowVault();
    private final AtomicLong m_clock = new AtomicLong(START_TIME);
    private final CrowdfundPlatform m_platform;

    private final ECPoint m_owner;
    private final ECPoint m_creator;
    private final ECPoint[] m_backers;

    public SimulationApp(EncryptionParams params, ECPoint oracleEncryptionKey, RevealVerifier verifier,
            RevealCapability capability) {
        m_params = params;
        long maxRevealable = params.getMaxDiscreteLog();
        PlatformConfig config = new PlatformConfig.Builder().setMaxTarget(maxRevealable)
                .setMaxContribution(maxRevealable).setMaxCampaignBalance(maxRevealable).build();
        m_owner = _newIdentity();
        m_platform = new CrowdfundPlatform(config, m_owner, new CipherAlgebra(params, oracleEncryptionKey), verifier,
                capability, m_vault, new PrngBeacon(), m_clock::get);

        m_creator = _newIdentity();
        m_backers = new ECPoint[] { _newIdentity(), _newIdentity(), _newIdentity() };
    }

    public CrowdfundPlatform getPlatform() {
        return m_platform;
    }

    public EscrowVault getVault() {
        return m_vault;
    }

    private ECPoint _newIdentity() {
        return m_params.derivePublicKey(m_params.getRandomIndex());
    }

    private long _fundCampaign(String title, long target, long... contributions) {
        m_clock.set(m_clock.get() + DAY);
        long id = m_platform.createCampaign(m_creator,
                new CampaignMetadata(title, "A simulated campaign", "simulation", ""), target, 30 * DAY, m_clock.get());
        for (int i = 0; i < contributions.length; i++) {
            m_platform.recordContribution(id, m_backers[i], contributions[i], "Good luck!", m_clock.get() + i);
        }
        m_clock.set(m_platform.getCampaign(id).getDeadline());
        return id;
    }

    /**
     * Target 1000 raised by 400 + 400 + 300; the creator withdraws 1100.
     *
     * @param awaitReveal blocks until the reveal has been applied.
     * @return the amount withdrawn.
     */
    public long runSuccessScenario(Runnable awaitReveal) {
        long id = _fundCampaign("Community mural", 1000, 400, 400, 300);
        m_platform.requestFinalization(id, m_creator, m_clock.get());
        awaitReveal.run();

        CampaignStatus status = m_platform.getCampaign(id).getStatus();
        if (status != CampaignStatus.SUCCESSFUL) throw new IllegalStateException("Expected success but was " + status);
        long withdrawn = m_platform.withdraw(id, m_creator, m_clock.get());
        LOGGER.info("Success scenario: creator withdrew " + withdrawn);
        return withdrawn;
    }

    /**
     * Target 1000 raised by 300 + 200; the first backer is refunded 300.
     *
     * @return the amount refunded.
     */
    public long runFailureScenario(LocalRevealOracle oracle) {
        long id = _fundCampaign("Poetry anthology", 1000, 300, 200);
        m_platform.requestFinalization(id, m_creator, m_clock.get());
        oracle.deliverPending();

        m_platform.requestRefund(id, m_backers[0], m_clock.get());
        oracle.deliverPending();

        long refunded = m_vault.totalPaidTo(id, m_backers[0]);
        LOGGER.info("Failure scenario: status " + m_platform.getCampaign(id).getStatus() + ", backer refunded "
                + refunded);
        return refunded;
    }

    /**
     * The oracle never answers; after three timeout checks every backer takes
     * an emergency refund.
     *
     * @return the total paid out in emergency refunds.
     */
    public long runTimeoutScenario(LocalRevealOracle oracle) {
        long id = _fundCampaign("Jazz festival", 1000, 300, 200, 100);
        m_platform.requestFinalization(id, m_creator, m_clock.get());

        long timeout = TimeUnit.HOURS.toSeconds(1);
        while (m_platform.getCampaign(id).getStatus() == CampaignStatus.DECRYPTION_PENDING) {
            oracle.dropPending();
            m_clock.addAndGet(timeout);
            m_platform.onTimeoutCheck(id, m_creator, m_clock.get());
        }
        m_clock.addAndGet(2 * timeout);

        long total = 0;
        for (ECPoint backer : m_backers)
            total += m_platform.emergencyRefund(id, backer, m_clock.get());
        LOGGER.info("Timeout scenario: status " + m_platform.getCampaign(id).getStatus()
                + ", emergency refunds totalled " + total);
        return total;
    }

    /**
     * Runs all three scenarios against an in-process oracle.
     *
     * @return whether every scenario produced the expected payouts.
     */
    public static boolean runLocalScenarios(EncryptionParams params) {
        RevealOracle oracle = RevealOracle.generate(params);
        LocalRevealOracle local = new LocalRevealOracle(oracle);
        SimulationApp app = new SimulationApp(params, oracle.getEncryptionKey(), oracle.buildVerifier(), local);

        boolean ok = app.runSuccessScenario(local::deliverPending) == 1100;
        ok &= app.runFailureScenario(local) == 300;
        ok &= app.runTimeoutScenario(local) == 600;
        LOGGER.info(app.getPlatform().getPlatformStats().toString());
        return ok;
    }

    public static void main(String[] args) throws IOException, InterruptedException {
        ThreadLogFormatter.installOn("cloakfund", Level.INFO);
        EncryptionParams params = OracleNode.buildParams();
        Stopwatch watch = Stopwatch.createStarted();

        boolean ok;
        if (args.length == 0) {
            ok = runLocalScenarios(params);
        } else {
            try (ZooKeeperRevealChannel channel = new ZooKeeperRevealChannel(params, args[0])) {
                channel.start();
                OracleKeys keys = channel.awaitOracleKeys(1, TimeUnit.MINUTES);
                if (keys == null) {
                    System.out.println("No oracle published its keys.");
                    System.exit(-1);
                }

                SimulationApp app = new SimulationApp(params, keys.getEncryptionKey(), keys.buildVerifier(params),
                        channel);
                ok = app.runSuccessScenario(() -> _awaitSettlement(app)) == 1100;
            }
        }

        watch.stop();
        System.out.printf("# Scenarios %s in %d ms%n", ok ? "passed" : "FAILED", watch.elapsed(TimeUnit.MILLISECONDS));
        if (!ok) System.exit(1);
    }

    private static void _awaitSettlement(SimulationApp app) {
        long id = app.getPlatform().campaignCounter();
        try {
            for (int i = 0; i < 600; i++) {
                if (app.getPlatform().getCampaign(id).getStatus() != CampaignStatus.DECRYPTION_PENDING) return;
                Thread.sleep(100);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        }
        throw new IllegalStateException("Oracle did not answer within a minute");
    }
}
