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

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.math.BigInteger;
import java.util.List;

import org.bouncycastle.crypto.ec.ECPair;
import org.bouncycastle.math.ec.ECPoint;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;

import cloakfund.util.EncryptionParams;

/**
 * This class provides several static utility methods for reading and writing
 * specific types of values from IO streams in a byte-packed manner. Each reader
 * assumes that the correct type of value is being read with only minimal sanity
 * checking. Writers write in the format expected by the associated reader.
 *
 * @author ethan@cs.cornell.edu
 */
public class SerialHelpers {
    /**
     * Upper bound on the length of any length-prefixed byte string, so a
     * corrupted length cannot trigger a huge allocation.
     */
    public static final int MAX_BYTES_LENGTH = 1 << 20;

    /**
     * Reads a {@code BigInteger} written by
     * {@link #writeBigInteger(OutputStream, BigInteger) writeBigInteger}: a
     * single length byte followed by that many bytes compatible with
     * {@code BigInteger}'s byte[] constructor.
     *
     * @param stream the {@code InputStream} from which to read.
     * @return the {@code BigInteger} read from the stream.
     * @throws EOFException if there are not enough bytes in {@code stream}.
     * @throws IOException if there is a problem reading from {@code stream}.
     */
    public static BigInteger readBigInteger(InputStream stream) throws IOException {
        int length = stream.read();
        if (length < 0)
            throw new EOFException();
        else if (length == 0) throw new IOException("Tried to read BigInteger of length 0");

        return new BigInteger(_readFully(stream, length));
    }

    /**
     * Reads a length-prefixed byte string written by
     * {@link #writeBytes(OutputStream, byte[]) writeBytes}.
     *
     * @param stream the {@code InputStream} from which to read.
     * @return the bytes read.
     * @throws IOException if the length is negative or exceeds
     *             {@link #MAX_BYTES_LENGTH}, or the stream ends early.
     */
    public static byte[] readBytes(InputStream stream) throws IOException {
        int length = readInt(stream);
        if (length < 0 || length > MAX_BYTES_LENGTH) throw new IOException("Invalid byte string length: " + length);
        return _readFully(stream, length);
    }

    /**
     * Reads an {@code ECPair} formatted as two {@code ECPoint}s in sequence.
     *
     * @param stream the {@code InputStream} from which to read.
     * @param params the {@code EncryptionParams} used to decode the points.
     * @return the read {@code ECPair}
     * @throws IOException if there is a problem reading from {@code stream}.
     */
    public static ECPair readECPair(InputStream stream, EncryptionParams params) throws IOException {
        ECPoint xPoint = readECPoint(stream, params);
        ECPoint yPoint = readECPoint(stream, params);
        return new ECPair(xPoint, yPoint);
    }

    /**
     * Reads a list of {@code ECPair}s written by
     * {@link #writeECPairList(OutputStream, List, boolean) writeECPairList}.
     *
     * @param stream the {@code InputStream} from which to read.
     * @param params the {@code EncryptionParams} used to decode the points.
     * @return an immutable list of the pairs read.
     * @throws IOException if there is a problem reading from {@code stream}.
     */
    public static List<ECPair> readECPairList(InputStream stream, EncryptionParams params) throws IOException {
        int count = stream.read();
        if (count < 0) throw new EOFException();

        ImmutableList.Builder<ECPair> pairs = ImmutableList.builder();
        for (int i = 0; i < count; i++)
            pairs.add(readECPair(stream, params));
        return pairs.build();
    }

    /**
     * Reads an {@code ECPoint} formatted as a length byte followed by the
     * point's encoding, decoded with
     * {@link cloakfund.util.EncryptionParams#decodePoint(byte[])
     * params.decodePoint}.
     *
     * @param stream the {@code InputStream} from which to read.
     * @param params the {@code EncryptionParams} used to decode the point.
     * @return the read {@code ECPoint}
     * @throws IOException if there is a problem reading from {@code stream} or
     *             the encoding is not a point on the curve.
     */
    public static ECPoint readECPoint(InputStream stream, EncryptionParams params) throws IOException {
        int length = stream.read();
        if (length < 0) throw new EOFException();

        byte[] buffer = _readFully(stream, length);
        try {
            return params.decodePoint(buffer);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid point encoding", e);
        }
    }

    /**
     * Reads a four byte big endian {@code int}.
     *
     * @param stream the {@code InputStream} from which to read.
     * @return the read integer
     * @throws EOFException if there are not enough bytes in {@code stream}.
     * @throws IOException if there is a problem reading from {@code stream}.
     */
    public static int readInt(InputStream stream) throws IOException {
        int value = 0;
        for (int i = 0; i < 4; i++) {
            value <<= 8;
            int unsignedByte = stream.read();
            if (unsignedByte < 0) throw new EOFException();
            value |= unsignedByte;
        }
        return value;
    }

    /**
     * Reads an eight byte big endian {@code long}.
     *
     * @param stream the {@code InputStream} from which to read.
     * @return the read {@code long} value
     * @throws EOFException if there are not enough bytes in {@code stream}.
     * @throws IOException if there is a problem reading from {@code stream}.
     */
    public static long readLong(InputStream stream) throws IOException {
        long value = 0;
        for (int i = 0; i < 8; i++) {
            value <<= 8;
            int unsignedByte = stream.read();
            if (unsignedByte < 0) throw new EOFException();
            value |= unsignedByte;
        }
        return value;
    }

    /**
     * Reads a UTF-8 encoded, null-terminated {@code String}.
     *
     * @param stream the {@code InputStream} from which to read.
     * @return the read {@code String} value
     * @throws EOFException if {@code stream} ends before a 0 byte.
     * @throws IOException if there is a problem reading from {@code stream}.
     */
    public static String readString(InputStream stream) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        int nextByte = stream.read();
        while (nextByte > 0) {
            buffer.write(nextByte);
            nextByte = stream.read();
        }
        if (nextByte < 0) throw new EOFException();
        return buffer.toString(Charsets.UTF_8.name());
    }

    /**
     * Reads a set of headers written by
     * {@link #writeHeaders(OutputStream, EncryptionParams) writeHeaders} and
     * checks if they match up with the parameters in {@code params}.
     *
     * @param stream the {@code InputStream} from which to read.
     * @param params the current {@code EncryptionParams} to check against.
     * @return whether the headers of {@code stream} match the specified
     *         configuration
     * @throws IOException if there is a problem reading from {@code stream}.
     */
    public static boolean verifyHeaders(InputStream stream, EncryptionParams params) throws IOException {
        int versionId = readInt(stream);
        String curveName = readString(stream);
        String hashAlgorithm = readString(stream);

        return versionId == EncryptionParams.VERSION_ID && curveName.equals(params.getCurveName())
                && hashAlgorithm.equals(params.getHashAlgorithm());
    }

    /**
     * Writes a {@code BigInteger} as a single length byte followed by its
     * two's-complement bytes.
     *
     * @param stream the {@code OutputStream} to write to.
     * @param value the value to write out.
     * @throws IOException if there is a problem writing to {@code stream}.
     */
    public static void writeBigInteger(OutputStream stream, BigInteger value) throws IOException {
        byte[] array = value.toByteArray();
        if (array.length > 0xff)
            throw new IllegalArgumentException("Cannot write BigInteger with more than 255 bytes.");
        stream.write(array.length);
        stream.write(array);
    }

    /**
     * Writes a byte string as a four byte length followed by the bytes.
     *
     * @param stream the {@code OutputStream} to write to.
     * @param value the bytes to write out.
     * @throws IOException if there is a problem writing to {@code stream}.
     */
    public static void writeBytes(OutputStream stream, byte[] value) throws IOException {
        if (value.length > MAX_BYTES_LENGTH) throw new IllegalArgumentException("Byte string too long to write.");
        writeInt(stream, value.length);
        stream.write(value);
    }

    /**
     * Writes an {@code ECPair} as two consecutive {@code ECPoint}s.
     *
     * @param stream the {@code OutputStream} to write to.
     * @param pair the pair of elliptic curve points to write out.
     * @param compressed whether or not use a compressed point encoding.
     * @throws IOException if there is a problem writing to {@code stream}.
     */
    public static void writeECPair(OutputStream stream, ECPair pair, boolean compressed) throws IOException {
        writeECPoint(stream, pair.getX(), compressed);
        writeECPoint(stream, pair.getY(), compressed);
    }

    /**
     * Writes a count byte followed by each pair in order.
     *
     * @param stream the {@code OutputStream} to write to.
     * @param pairs at most 255 pairs to write out.
     * @param compressed whether or not use a compressed point encoding.
     * @throws IOException if there is a problem writing to {@code stream}.
     */
    public static void writeECPairList(OutputStream stream, List<ECPair> pairs, boolean compressed)
            throws IOException {
        if (pairs.size() > 0xff) throw new IllegalArgumentException("Cannot write more than 255 pairs.");
        stream.write(pairs.size());
        for (ECPair pair : pairs)
            writeECPair(stream, pair, compressed);
    }

    /**
     * Writes an {@code ECPoint} as a length byte followed by the encoding
     * generated by {@link org.bouncycastle.math.ec.ECPoint#getEncoded(boolean)}.
     *
     * @param stream the {@code OutputStream} to write to.
     * @param point the elliptic curve point to write out.
     * @param compressed whether or not to use a compressed encoding.
     * @throws IOException if there is a problem writing to {@code stream}.
     */
    public static void writeECPoint(OutputStream stream, ECPoint point, boolean compressed) throws IOException {
        byte[] encoding = point.getEncoded(compressed);
        if (encoding.length > 0xff)
            throw new IllegalArgumentException("Cannot write points whose encoding exceeds 255 bytes.");
        stream.write(encoding.length);
        stream.write(encoding);
    }

    /**
     * Writes a set of top-level headers to {@code stream} based on the values
     * set in {@code params}.
     *
     * @param stream the {@code OutputStream} to write to.
     * @param params the {@code EncryptionParams} currently in use.
     * @throws IOException if there is a problem writing to {@code stream}.
     */
    public static void writeHeaders(OutputStream stream, EncryptionParams params) throws IOException {
        writeInt(stream, EncryptionParams.VERSION_ID);
        writeString(stream, params.getCurveName());
        writeString(stream, params.getHashAlgorithm());
    }

    /**
     * Writes an {@code int} as four bytes in big endian.
     *
     * @param stream the {@code OutputStream} to write to.
     * @param value the value to write out.
     * @throws IOException if there is a problem writing to {@code stream}.
     */
    public static void writeInt(OutputStream stream, int value) throws IOException {
        stream.write(new byte[] { (byte) (value >>> 24), (byte) (value >>> 16), (byte) (value >>> 8), (byte) (value) });
    }

    /**
     * Writes a {@code long} as eight bytes in big endian.
     *
     * @param stream the {@code OutputStream} to write to.
     * @param value the value to write out.
     * @throws IOException if there is a problem writing to {@code stream}.
     */
    public static void writeLong(OutputStream stream, long value) throws IOException {
        stream.write(
                new byte[] { (byte) (value >>> 56), (byte) (value >>> 48), (byte) (value >>> 40), (byte) (value >>> 32),
                        (byte) (value >>> 24), (byte) (value >>> 16), (byte) (value >>> 8), (byte) (value) });
    }

    /**
     * Writes a {@code String} encoded in UTF-8 and terminated with a 0 byte.
     *
     * @param stream the {@code OutputStream} to write to.
     * @param value the string to write out.
     * @throws IOException if there is a problem writing to {@code stream}.
     */
    public static void writeString(OutputStream stream, String value) throws IOException {
        stream.write(value.getBytes(Charsets.UTF_8));
        stream.write(0);
    }

    private static byte[] _readFully(InputStream stream, int length) throws IOException {
        byte[] buffer = new byte[length];
        int offset = 0;
        while (offset < length) {
            int bytesRead = stream.read(buffer, offset, length - offset);
            if (bytesRead < 0) throw new EOFException();
            offset += bytesRead;
        }
        return buffer;
    }

    // Static utility class.
    private SerialHelpers() {}
}
