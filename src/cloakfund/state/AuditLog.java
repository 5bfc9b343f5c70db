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

package cloakfund.state;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;

/**
 * Append-only record of every status transition and contribution event.
 * Reporting reads it; nothing ever edits or removes an entry.
 */
public class AuditLog {
    private final List<StatusTransition> m_transitions = new ArrayList<>();
    private final List<ContributionEvent> m_contributionEvents = new ArrayList<>();

    public synchronized void append(StatusTransition transition) {
        m_transitions.add(transition);
    }

    public synchronized void append(ContributionEvent event) {
        m_contributionEvents.add(event);
    }

    public synchronized List<StatusTransition> getTransitions() {
        return ImmutableList.copyOf(m_transitions);
    }

    public synchronized List<StatusTransition> getTransitions(long campaignId) {
        return ImmutableList.copyOf(m_transitions.stream().filter(t -> t.getCampaignId() == campaignId)
                .collect(Collectors.toList()));
    }

    public synchronized List<ContributionEvent> getContributionEvents() {
        return ImmutableList.copyOf(m_contributionEvents);
    }

    public synchronized List<ContributionEvent> getContributionEvents(long campaignId) {
        return ImmutableList.copyOf(m_contributionEvents.stream().filter(e -> e.getCampaignId() == campaignId)
                .collect(Collectors.toList()));
    }
}
