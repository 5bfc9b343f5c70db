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

import java.util.Objects;

/**
 * Human readable campaign metadata. The platform only checks its size; the
 * content reference is typically a content-addressed hash of richer media.
 */
public class CampaignMetadata {
    private final String m_title;
    private final String m_description;
    private final String m_category;
    private final String m_contentRef;

    public CampaignMetadata(String title, String description, String category, String contentRef) {
        m_title = Objects.requireNonNull(title);
        m_description = Objects.requireNonNull(description);
        m_category = Objects.requireNonNull(category);
        m_contentRef = Objects.requireNonNull(contentRef);
    }

    public String getTitle() {
        return m_title;
    }

    public String getDescription() {
        return m_description;
    }

    public String getCategory() {
        return m_category;
    }

    public String getContentRef() {
        return m_contentRef;
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) return true;
        if (!(o instanceof CampaignMetadata)) return false;

        CampaignMetadata meta = (CampaignMetadata) o;
        return m_title.equals(meta.m_title) && m_description.equals(meta.m_description)
                && m_category.equals(meta.m_category) && m_contentRef.equals(meta.m_contentRef);
    }

    @Override
    public int hashCode() {
        return Objects.hash(m_title, m_description, m_category, m_contentRef);
    }

    @Override
    public String toString() {
        return "\"" + m_title + "\" [" + m_category + "]";
    }
}
