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

import java.util.concurrent.TimeUnit;

/**
 * Protocol constants for a platform instance. All durations are stored in
 * seconds, matching the epoch-second times supplied to every operation.
 */
public class PlatformConfig {
    private final long m_minDuration;
    private final long m_maxDuration;
    private final long m_gracePeriod;
    private final long m_revealTimeout;
    private final int m_maxRetries;

    private final long m_maxTarget;
    private final long m_maxContribution;
    private final long m_maxCampaignBalance;

    private final long m_minMultiplier;
    private final long m_maxMultiplier;

    private final int m_maxTitleBytes;
    private final int m_maxDescriptionBytes;
    private final int m_maxCategoryBytes;
    private final int m_maxContentRefBytes;
    private final int m_maxMessageBytes;

    private PlatformConfig(Builder builder) {
        m_minDuration = builder.m_minDuration;
        m_maxDuration = builder.m_maxDuration;
        m_gracePeriod = builder.m_gracePeriod;
        m_revealTimeout = builder.m_revealTimeout;
        m_maxRetries = builder.m_maxRetries;

        m_maxTarget = builder.m_maxTarget;
        m_maxContribution = builder.m_maxContribution;
        m_maxCampaignBalance = builder.m_maxCampaignBalance;

        m_minMultiplier = builder.m_minMultiplier;
        m_maxMultiplier = builder.m_maxMultiplier;

        m_maxTitleBytes = builder.m_maxTitleBytes;
        m_maxDescriptionBytes = builder.m_maxDescriptionBytes;
        m_maxCategoryBytes = builder.m_maxCategoryBytes;
        m_maxContentRefBytes = builder.m_maxContentRefBytes;
        m_maxMessageBytes = builder.m_maxMessageBytes;
    }

    public long getMinDuration() {
        return m_minDuration;
    }

    public long getMaxDuration() {
        return m_maxDuration;
    }

    public long getGracePeriod() {
        return m_gracePeriod;
    }

    public long getRevealTimeout() {
        return m_revealTimeout;
    }

    public int getMaxRetries() {
        return m_maxRetries;
    }

    public long getMaxTarget() {
        return m_maxTarget;
    }

    public long getMaxContribution() {
        return m_maxContribution;
    }

    /**
     * @return the most a single campaign may raise. Contributions that would
     *         push the raised total past this are rejected so that the total
     *         always stays revealable.
     */
    public long getMaxCampaignBalance() {
        return m_maxCampaignBalance;
    }

    /**
     * @return the inclusive lower bound of the obfuscation multiplier range.
     */
    public long getMinMultiplier() {
        return m_minMultiplier;
    }

    /**
     * @return the exclusive upper bound of the obfuscation multiplier range.
     */
    public long getMaxMultiplier() {
        return m_maxMultiplier;
    }

    public int getMaxTitleBytes() {
        return m_maxTitleBytes;
    }

    public int getMaxDescriptionBytes() {
        return m_maxDescriptionBytes;
    }

    public int getMaxCategoryBytes() {
        return m_maxCategoryBytes;
    }

    public int getMaxContentRefBytes() {
        return m_maxContentRefBytes;
    }

    public int getMaxMessageBytes() {
        return m_maxMessageBytes;
    }

    public static class Builder {
        private long m_minDuration = TimeUnit.DAYS.toSeconds(7);
        private long m_maxDuration = TimeUnit.DAYS.toSeconds(90);
        private long m_gracePeriod = TimeUnit.DAYS.toSeconds(7);
        private long m_revealTimeout = TimeUnit.HOURS.toSeconds(1);
        private int m_maxRetries = 3;

        private long m_maxTarget = 1L << 40;
        private long m_maxContribution = 1L << 40;
        private long m_maxCampaignBalance = 1L << 40;

        private long m_minMultiplier = 1000;
        private long m_maxMultiplier = 2000;

        private int m_maxTitleBytes = 100;
        private int m_maxDescriptionBytes = 1000;
        private int m_maxCategoryBytes = 50;
        private int m_maxContentRefBytes = 100;
        private int m_maxMessageBytes = 280;

        private boolean m_isBuilt = false;

        private void _checkNotBuilt() {
            if (m_isBuilt) throw new IllegalStateException("Cannot set parameters after building.");
        }

        public Builder setFundingDurationBounds(long min, long max, TimeUnit unit) {
            _checkNotBuilt();
            if (min <= 0 || max < min) throw new IllegalArgumentException("Need 0 < min duration <= max duration");
            m_minDuration = unit.toSeconds(min);
            m_maxDuration = unit.toSeconds(max);
            return this;
        }

        public Builder setGracePeriod(long grace, TimeUnit unit) {
            _checkNotBuilt();
            if (grace < 0) throw new IllegalArgumentException("Grace period cannot be negative");
            m_gracePeriod = unit.toSeconds(grace);
            return this;
        }

        public Builder setRevealTimeout(long timeout, TimeUnit unit) {
            _checkNotBuilt();
            if (timeout <= 0) throw new IllegalArgumentException("Reveal timeout must be positive");
            m_revealTimeout = unit.toSeconds(timeout);
            return this;
        }

        public Builder setMaxRetries(int retries) {
            _checkNotBuilt();
            if (retries < 1) throw new IllegalArgumentException("Must allow at least one timeout check");
            m_maxRetries = retries;
            return this;
        }

        public Builder setMaxTarget(long maxTarget) {
            _checkNotBuilt();
            if (maxTarget <= 0) throw new IllegalArgumentException("Maximum target must be positive");
            m_maxTarget = maxTarget;
            return this;
        }

        public Builder setMaxContribution(long maxContribution) {
            _checkNotBuilt();
            if (maxContribution <= 0) throw new IllegalArgumentException("Maximum contribution must be positive");
            m_maxContribution = maxContribution;
            return this;
        }

        public Builder setMaxCampaignBalance(long maxBalance) {
            _checkNotBuilt();
            if (maxBalance <= 0) throw new IllegalArgumentException("Maximum campaign balance must be positive");
            m_maxCampaignBalance = maxBalance;
            return this;
        }

        /**
         * Sets the multiplier range {@code [min, max)}.
         */
        public Builder setMultiplierRange(long min, long max) {
            _checkNotBuilt();
            if (min < 1 || max <= min) throw new IllegalArgumentException("Need 1 <= min multiplier < max");
            m_minMultiplier = min;
            m_maxMultiplier = max;
            return this;
        }

        public Builder setMetadataBounds(int title, int description, int category, int contentRef) {
            _checkNotBuilt();
            if (title < 1 || description < 0 || category < 1 || contentRef < 0)
                throw new IllegalArgumentException("Invalid metadata bounds");
            m_maxTitleBytes = title;
            m_maxDescriptionBytes = description;
            m_maxCategoryBytes = category;
            m_maxContentRefBytes = contentRef;
            return this;
        }

        public Builder setMaxMessageBytes(int maxMessage) {
            _checkNotBuilt();
            if (maxMessage < 0) throw new IllegalArgumentException("Message bound cannot be negative");
            m_maxMessageBytes = maxMessage;
            return this;
        }

        /**
         * @throws IllegalStateException if already built or the settings are
         *             inconsistent: the obfuscated target must not overflow and
         *             a single contribution must fit in a campaign.
         */
        public PlatformConfig build() {
            if (m_isBuilt) throw new IllegalStateException("Cannot build the same config twice.");
            if (m_maxTarget > Long.MAX_VALUE / (m_maxMultiplier - 1))
                throw new IllegalStateException("Maximum target times maximum multiplier overflows");
            if (m_maxContribution > m_maxCampaignBalance)
                throw new IllegalStateException("Maximum contribution exceeds maximum campaign balance");

            m_isBuilt = true;
            return new PlatformConfig(this);
        }
    }
}
