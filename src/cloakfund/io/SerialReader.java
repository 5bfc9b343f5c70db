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

package cloakfund.io;

import java.io.IOException;
import java.io.InputStream;

import cloakfund.util.EncryptionParams;

/**
 * The deserializing counterpart of {@link SerialWriter}, normally a method
 * reference to a class's static {@code serialReadIn} method.
 *
 * @param <T> the type read from the stream.
 */
@FunctionalInterface
public interface SerialReader<T> {
    public T serialReadIn(InputStream inStream, EncryptionParams params) throws IOException;
}
