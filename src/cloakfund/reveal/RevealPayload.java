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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

import com.google.common.collect.ImmutableList;

import cloakfund.io.SerialHelpers;

/**
 * Encoding of revealed plaintexts: a four byte count followed by each value as
 * an eight byte big endian integer. Decoding fails closed on any deviation
 * from the expected shape.
 */
public class RevealPayload {
    public static byte[] encode(List<Long> values) {
        try {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            SerialHelpers.writeInt(out, values.size());
            for (long value : values)
                SerialHelpers.writeLong(out, value);
            return out.toByteArray();
        } catch (IOException e) {
            // There's no real IO here.
            throw new RuntimeException(e);
        }
    }

    /**
     * Decodes exactly {@code expectedCount} non-negative values.
     *
     * @param payload the encoded plaintexts.
     * @param expectedCount the number of values the request asked for.
     * @return the decoded values in request order.
     * @throws IOException if the count differs, a value is negative, or there
     *             are missing or trailing bytes.
     */
    public static List<Long> decode(byte[] payload, int expectedCount) throws IOException {
        ByteArrayInputStream in = new ByteArrayInputStream(payload);
        int count = SerialHelpers.readInt(in);
        if (count != expectedCount)
            throw new IOException("Expected " + expectedCount + " revealed values but found " + count);

        ImmutableList.Builder<Long> values = ImmutableList.builder();
        for (int i = 0; i < count; i++) {
            long value = SerialHelpers.readLong(in);
            if (value < 0) throw new IOException("Revealed value out of range: " + value);
            values.add(value);
        }
        if (in.available() > 0) throw new IOException("Trailing bytes after revealed values");
        return values.build();
    }

    private RevealPayload() {}
}
