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

package cloakfund.reveal;

/**
 * The platform's side of the reveal oracle boundary. Submission is
 * fire-and-forget: the response, if one ever arrives, is handed to the
 * registered {@link RevealResponseHandler}.
 */
public interface RevealCapability {
    public void setResponseHandler(RevealResponseHandler handler);

    public void submit(RevealTicket ticket);
}
