/*
 * Copyright 2017 Saxon State and University Library Dresden (SLUB)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package de.qucosa.oaipmh.token;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.apache.commons.lang3.StringUtils;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.joda.time.Duration;
import org.junit.Before;
import org.junit.Test;

import de.qucosa.oaipmh.cursor.Cursor;
import de.qucosa.oaipmh.cursor.Granularity;
import de.qucosa.oaipmh.cursor.Watermark;
import de.qucosa.oaipmh.error.BadResumptionTokenException;
import de.qucosa.oaipmh.util.SettableClock;

public class ResumptionTokenCodecTest {

    private static final byte[] KEY_A = key('a');
    private static final byte[] KEY_B = key('b');
    private static final byte[] KEY_C = key('c');

    private static final DateTime NOW = new DateTime(2024, 6, 1, 9, 30, 15, 123, DateTimeZone.UTC);
    private static final Duration TTL = Duration.standardMinutes(30);

    private SettableClock clock;
    private ResumptionTokenCodec codec;
    private Cursor cursor;

    @Test
    public void decodesEncodedCursor() throws Exception {
        assertEquals(cursor, codec.decode(codec.encode(cursor)));
    }

    @Test
    public void decodesCursorWithoutOptionalFields() throws Exception {
        Cursor plain = Cursor.initial("oai_dc", null, null, null, Granularity.SECOND, 100, NOW, TTL);

        assertEquals(plain, codec.decode(codec.encode(plain)));
    }

    /**
     * Identifiers and set specs may contain characters that have a meaning in the payload
     * encoding.
     */
    @Test
    public void decodesCursorWithReservedCharacters() throws Exception {
        Cursor odd = Cursor.initial("x&y=z", "a:b", null, null, Granularity.DAY, 5, NOW, TTL)
                .successor(new Watermark(NOW.minusDays(1), "oai:ex.org:ä&b=c%20+d.e"), 5, NOW);

        assertEquals(odd, codec.decode(codec.encode(odd)));
    }

    @Test
    public void tokenIsUrlSafeAndUnpadded() throws Exception {
        String token = codec.encode(cursor);

        assertTrue("Not URL safe: " + token, token.matches("[A-Za-z0-9_-]+\\.[A-Za-z0-9_-]+"));
    }

    @Test
    public void encodingIsDeterministic() throws Exception {
        assertEquals(codec.encode(cursor), codec.encode(cursor));
    }

    /**
     * Flip every bit of every character of a valid token; no mutation may be accepted.
     */
    @Test
    public void rejectsEverySingleBitMutation() throws Exception {
        String token = codec.encode(cursor);

        for (int position = 0; position < token.length(); position++) {
            for (int bit = 0; bit < 8; bit++) {
                char[] chars = token.toCharArray();
                chars[position] = (char) (chars[position] ^ (1 << bit));
                assertRejected(new String(chars));
            }
        }
    }

    @Test
    public void rejectsFlippedByteInTag() throws Exception {
        String token = codec.encode(cursor);
        int separator = token.indexOf('.');
        byte[] tag = Base64.decodeBase64(token.substring(separator + 1));
        tag[tag.length / 2] ^= 0x01;

        assertRejected(token.substring(0, separator + 1) + Base64.encodeBase64URLSafeString(tag));
    }

    @Test
    public void rejectsExpiredToken() throws Exception {
        String token = codec.encode(cursor);

        clock.set(cursor.getExpirationDate());
        assertEquals("Token must be valid up to its expiration date", cursor, codec.decode(token));

        clock.advance(Duration.millis(1));
        assertRejected(token);
    }

    @Test
    public void acceptsTokenSignedWithPreviousKey() throws Exception {
        String token = codec.encode(cursor);
        ResumptionTokenCodec rotated = new ResumptionTokenCodec(new StaticSigningKeySource(KEY_B, KEY_A), clock);

        assertEquals(cursor, rotated.decode(token));
        assertRejected(new ResumptionTokenCodec(new StaticSigningKeySource(KEY_B, null), clock), token);
    }

    /**
     * Only one previous key is kept; tokens two rotations old are rejected.
     */
    @Test
    public void rejectsTokenSignedWithRetiredKey() throws Exception {
        String token = codec.encode(cursor);

        assertRejected(new ResumptionTokenCodec(new StaticSigningKeySource(KEY_C, KEY_B), clock), token);
    }

    @Test
    public void newTokensAreSignedWithCurrentKey() throws Exception {
        ResumptionTokenCodec rotated = new ResumptionTokenCodec(new StaticSigningKeySource(KEY_B, KEY_A), clock);
        String token = rotated.encode(cursor);

        assertRejected(codec, token);
        assertEquals(cursor, new ResumptionTokenCodec(new StaticSigningKeySource(KEY_B, null), clock).decode(token));
    }

    /**
     * metadataPrefix, set and identifier of maximum length, made of characters that grow most
     * in the payload encoding, still give a token that is accepted.
     */
    @Test
    public void longestCursorFitsIntoToken() throws Exception {
        Cursor longest = Cursor.initial(StringUtils.repeat('(', Cursor.MAX_METADATA_FORMAT_LENGTH),
                StringUtils.repeat("a:", 127) + "a", Granularity.SECOND.parse("2024-01-01T00:00:00Z"),
                Granularity.SECOND.parse("2024-05-31T23:59:59Z"), Granularity.SECOND, Cursor.MAX_PAGE_SIZE,
                NOW.minusMinutes(10), TTL)
                .successor(new Watermark(NOW.minusDays(1), StringUtils.repeat('\u20ac', Watermark.MAX_IDENTIFIER_LENGTH)),
                        Cursor.MAX_PAGE_SIZE, NOW);

        String token = codec.encode(longest);

        assertTrue("Token has " + token.length() + " characters",
                token.length() <= ResumptionTokenCodec.MAX_TOKEN_LENGTH);
        assertEquals(longest, codec.decode(token));
    }

    @Test
    public void rejectsMalformedTokens() throws Exception {
        for (String malformed : Arrays.asList(null, "", "abc", "abc.", ".abc", "a.b.c", "!!!.???", "dj0x.dj0x",
                StringUtils.repeat('A', ResumptionTokenCodec.MAX_TOKEN_LENGTH) + ".AAAA")) {
            assertRejected(malformed);
        }
    }

    /**
     * A correctly signed payload that does not describe a cursor is rejected as well.
     */
    @Test
    public void rejectsSignedPayloadThatIsNoCursor() throws Exception {
        assertRejected(sign("v=1&f=oai_dc"));
        assertRejected(sign("c=0&ea=1800000&f=oai_dc&g=YYYY-MM-DD&ia=1717234215123&n=10&v=2"));
        assertRejected(sign("c=0&ea=1800000&f=oai_dc&g=YYYY-MM-DD&ia=1717234215123&n=10&v=1&x=1"));
        assertRejected(sign("c=0&c=0&ea=1800000&f=oai_dc&g=YYYY-MM-DD&ia=1717234215123&n=10&v=1"));
        assertRejected(sign("c=5&ea=1800000&f=oai_dc&g=YYYY-MM-DD&ia=1717234215123&n=10&v=1"));
        assertRejected(sign("c=0&ea=1800000&f=oai_dc&g=YYYY-MM-DD&ia=1717234215123&n=ten&v=1"));
    }

    @Test
    public void acceptsHandSignedCursorPayload() throws Exception {
        Cursor expected = Cursor.initial("oai_dc", null, null, null, Granularity.DAY, 10, NOW, TTL);

        assertEquals(expected, codec.decode(sign("c=0&ea=1800000&f=oai_dc&g=YYYY-MM-DD&ia=1717234215123&n=10&v=1")));
    }

    private void assertRejected(String token) {
        assertRejected(codec, token);
    }

    private static void assertRejected(ResumptionTokenCodec codec, String token) {
        try {
            codec.decode(token);
            fail("Token must be rejected: " + token);
        } catch (BadResumptionTokenException e) {
            assertEquals(BadResumptionTokenException.MESSAGE, e.getMessage());
        }
    }

    private static String sign(String payload) {
        byte[] bytes = payload.getBytes(StandardCharsets.UTF_8);
        return Base64.encodeBase64URLSafeString(bytes) + "."
                + Base64.encodeBase64URLSafeString(new HmacUtils(HmacAlgorithms.HMAC_SHA_256, KEY_A).hmac(bytes));
    }

    private static byte[] key(char filler) {
        return StringUtils.repeat(filler, StaticSigningKeySource.MINIMUM_KEY_LENGTH).getBytes(StandardCharsets.US_ASCII);
    }

    @Before
    public void setUp() {
        clock = new SettableClock(NOW);
        codec = new ResumptionTokenCodec(new StaticSigningKeySource(KEY_A, null), clock);
        cursor = Cursor.initial("oai_dc", "ddc:000", Granularity.SECOND.parse("2024-01-01T00:00:00Z"),
                Granularity.SECOND.parse("2024-05-31T23:59:59Z"), Granularity.SECOND, 10, NOW.minusMinutes(10), TTL)
                .successor(new Watermark(new DateTime(2024, 2, 2, 2, 2, 2, 222, DateTimeZone.UTC), "oai:x:42"), 10,
                        NOW.minusMinutes(1));
    }
}
