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

package test.cloakfund.util;

import java.math.BigInteger;
import java.util.Random;

import org.bouncycastle.crypto.ec.ECPair;
import org.bouncycastle.math.ec.ECPoint;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.experimental.theories.DataPoints;
import org.junit.experimental.theories.Theories;
import org.junit.experimental.theories.Theory;
import org.junit.rules.ExpectedException;
import org.junit.runner.RunWith;

import cloakfund.util.CryptoConstants;
import cloakfund.util.Decryptor;
import cloakfund.util.EncryptionParams;
import cloakfund.util.Encryptor;

import test.util.TestUtils;

@RunWith(Theories.class)
public class EncryptDecryptTest {
    private static final BigInteger SECRET_KEY = new BigInteger(
            "2afe91f84df247fa7e52ba800c9980de0335ec9849a28f2d462080129899cb11", 16);
    private static final ECPoint PUBLIC_KEY = CryptoConstants.CURVE.getG().multiply(SECRET_KEY).normalize();

    private static final int MAX_AMOUNT = 128;

    @Rule
    public ExpectedException thrown = ExpectedException.none();

    @DataPoints("table gap")
    public static final int[] ALL_TABLE_GAPS = new int[] { 1, 3, 16 };

    @DataPoints
    public static final long[] GOOD_AMOUNTS = new long[] { 0, 1, 2, 15, 16, 17, MAX_AMOUNT / 2, MAX_AMOUNT - 1,
            MAX_AMOUNT };

    @DataPoints
    public static final BigInteger[] BAD_VALUES = new BigInteger[] { BigInteger.valueOf(-1),
            BigInteger.valueOf(-MAX_AMOUNT), BigInteger.valueOf(MAX_AMOUNT + 1), BigInteger.valueOf(MAX_AMOUNT * 2),
            // Random very large values that can only be decrypted to points.
            new BigInteger("269f692585502513dba2bb95aa33d840fed53dd9fa820f2726fc3331bd91fe13", 16),
            new BigInteger("3aafbb7b3309a86a3a80f4ee9d926fcd3f5626b9466a030b9f208e6076cd14fb", 16) };

    private EncryptionParams _buildParams(int tableGap, boolean normalize, boolean blind) {
        EncryptionParams.Builder paramsBuilder = new EncryptionParams.Builder(new Random(TestUtils.RANDOM_SEED),
                CryptoConstants.CURVE, CryptoConstants.DIGEST).setMaxDiscreteLog(MAX_AMOUNT)
                        .setLookupTableGap(tableGap).forTesting();
        if (normalize) paramsBuilder.normalizePoints();
        if (blind) paramsBuilder.blindDecryption();

        return paramsBuilder.build();
    }

    @Theory
    public void testEncryptionDecryption(int tableGap, boolean normalize, boolean blind, long amount) {
        EncryptionParams params = _buildParams(tableGap, normalize, blind);
        Encryptor encryptor = params.getEncryptor(PUBLIC_KEY);
        Decryptor decryptor = params.getDecryptor(SECRET_KEY);

        ECPair encryption = encryptor.encryptAmount(amount);
        ECPair reencryption = encryptor.reencrypt(encryption);

        Assert.assertEquals(amount, decryptor.decryptAmount(encryption));
        Assert.assertEquals(amount, decryptor.decryptAmount(reencryption));

        ECPoint expectedPoint = params.getGenerator().multiply(BigInteger.valueOf(amount)).normalize();
        Assert.assertEquals(expectedPoint, decryptor.decryptPoint(encryption));
        Assert.assertEquals(expectedPoint, decryptor.decryptPoint(reencryption));
    }

    @Theory
    public void testPointDecryption(int tableGap, boolean normalize, boolean blind, BigInteger value) {
        EncryptionParams params = _buildParams(tableGap, normalize, blind);
        Encryptor encryptor = params.getEncryptor(PUBLIC_KEY);
        Decryptor decryptor = params.getDecryptor(SECRET_KEY);

        ECPoint point = params.getGenerator().multiply(value.mod(params.getGroupSize())).normalize();

        Assert.assertEquals(point, decryptor.decryptPoint(encryptor.encryptValue(value.mod(params.getGroupSize()))));
        Assert.assertEquals(point, decryptor.decryptPoint(encryptor.reencrypt(encryptor.encryptPoint(point))));
    }

    @Theory
    public void testUnrevealableEncryption(int tableGap, BigInteger value) {
        thrown.expect(IllegalArgumentException.class);

        EncryptionParams params = _buildParams(tableGap, false, false);
        params.getEncryptor(PUBLIC_KEY).encryptAmount(value.longValue());
    }

    @Theory
    public void testUnrevealableDecryption(int tableGap, boolean blind, BigInteger value) {
        thrown.expect(IllegalArgumentException.class);

        EncryptionParams params = _buildParams(tableGap, false, blind);
        ECPair enc = params.getEncryptor(PUBLIC_KEY).encryptValue(value.mod(params.getGroupSize()));
        params.getDecryptor(SECRET_KEY).decryptAmount(enc);
    }
}
