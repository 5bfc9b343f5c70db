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

package cloakfund.errors;

/**
 * Thrown when a reveal response is forged, replayed, mismatched with its
 * request, or malformed. Nothing from the response is applied.
 */
public class ProofVerificationException extends SecurityException {
    private static final long serialVersionUID = 1L;

    public ProofVerificationException(String message) {
        super(message);
    }

    public ProofVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
