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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.http.NameValuePair;
import org.apache.http.client.utils.URLEncodedUtils;
import org.apache.http.message.BasicNameValuePair;
import org.eclipse.jdt.annotation.Nullable;
import org.joda.time.DateTime;
import org.joda.time.DateTimeUtils.MillisProvider;
import org.joda.time.DateTimeZone;
import org.joda.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.qucosa.oaipmh.cursor.Cursor;
import de.qucosa.oaipmh.cursor.Granularity;
import de.qucosa.oaipmh.cursor.Watermark;
import de.qucosa.oaipmh.error.BadResumptionTokenException;

/**
 * Converts a {@link Cursor} into an opaque, signed resumption token and back.
 * <p>
 * A token has the form {@code payload.tag}. The payload is the cursor as sorted,
 * form encoded key value pairs; the tag is the HMAC-SHA256 of the payload. Both parts are
 * Base64url encoded without padding. Malformed, forged and expired tokens are all rejected
 * with the same {@link BadResumptionTokenException}; the reason is logged at DEBUG level.
 */
public class ResumptionTokenCodec {

    public static final String FORMAT_VERSION = "1";
    /**
     * Longest token {@link #decode(String)} accepts. Every token {@link #encode(Cursor)} creates
     * fits: a cursor with a metadataPrefix of {@link Cursor#MAX_METADATA_FORMAT_LENGTH}, a set of
     * {@link Cursor#MAX_SET_FILTER_LENGTH} and a watermark identifier of
     * {@link Watermark#MAX_IDENTIFIER_LENGTH} non-ASCII characters encodes to less than 4300
     * characters.
     */
    public static final int MAX_TOKEN_LENGTH = 4608;

    private static final char SEPARATOR = '.';

    private static final String VERSION = "v";
    private static final String FORMAT = "f";
    private static final String SET = "s";
    private static final String FROM = "fr";
    private static final String UNTIL = "un";
    private static final String GRANULARITY = "g";
    private static final String WATERMARK_TIME = "wt";
    private static final String WATERMARK_ID = "wi";
    private static final String PAGE_SIZE = "n";
    private static final String DELIVERED = "c";
    private static final String ISSUED_AT = "ia";
    private static final String EXPIRES_AFTER = "ea";

    private static final Set<String> REQUIRED_KEYS = new HashSet<>(Arrays.asList(
            VERSION, FORMAT, GRANULARITY, PAGE_SIZE, DELIVERED, ISSUED_AT, EXPIRES_AFTER));
    private static final Set<String> OPTIONAL_KEYS = new HashSet<>(Arrays.asList(
            SET, FROM, UNTIL, WATERMARK_TIME, WATERMARK_ID));

    private static final Comparator<NameValuePair> BY_NAME = new Comparator<NameValuePair>() {
        @Override
        public int compare(NameValuePair a, NameValuePair b) {
            return a.getName().compareTo(b.getName());
        }
    };

    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final SigningKeySource keySource;
    private final MillisProvider clock;

    /**
     * @param keySource keys to sign and verify tokens with
     * @param clock     source of the current time for the expiry check
     */
    public ResumptionTokenCodec(SigningKeySource keySource, MillisProvider clock) {
        if (keySource == null)
            throw new IllegalArgumentException("parameter keySource must not be null");
        if (clock == null)
            throw new IllegalArgumentException("parameter clock must not be null");
        this.keySource = keySource;
        this.clock = clock;
    }

    /**
     * @param cursor the state to carry
     * @return a URL safe token of at most {@value #MAX_TOKEN_LENGTH} characters, signed with
     * the current key
     * @throws IllegalStateException if the token would be longer than {@value #MAX_TOKEN_LENGTH}
     *                               characters
     */
    public String encode(Cursor cursor) throws IllegalStateException {
        byte[] payload = serialize(cursor).getBytes(StandardCharsets.UTF_8);
        byte[] tag = sign(keySource.getCurrentKey(), payload);
        String token = Base64.encodeBase64URLSafeString(payload) + SEPARATOR + Base64.encodeBase64URLSafeString(tag);
        if (token.length() > MAX_TOKEN_LENGTH) {
            throw new IllegalStateException("Resumption token for " + cursor + " exceeds " + MAX_TOKEN_LENGTH
                    + " characters");
        }
        return token;
    }

    /**
     * @param token as received from a harvester
     * @return the cursor the token was created from
     * @throws BadResumptionTokenException if the token is malformed, not signed with the
     *                                     current or previous key, or expired
     */
    public Cursor decode(@Nullable String token) throws BadResumptionTokenException {
        if (token == null || token.isEmpty() || token.length() > MAX_TOKEN_LENGTH) {
            throw reject("empty or oversized token");
        }
        int separatorIndex = token.indexOf(SEPARATOR);
        if (separatorIndex <= 0 || separatorIndex != token.lastIndexOf(SEPARATOR)
                || separatorIndex == token.length() - 1) {
            throw reject("token does not consist of payload and tag");
        }

        byte[] payload = decodeSegment(token.substring(0, separatorIndex));
        byte[] tag = decodeSegment(token.substring(separatorIndex + 1));
        if (payload == null || tag == null) {
            throw reject("token segment is not canonical Base64url");
        }
        if (!verify(payload, tag)) {
            throw reject("signature mismatch");
        }

        Cursor cursor = deserialize(new String(payload, StandardCharsets.UTF_8));
        if (cursor.isExpired(clock.getMillis())) {
            throw reject("token expired at " + cursor.getExpirationDate());
        }
        return cursor;
    }

    private boolean verify(byte[] payload, byte[] tag) {
        if (MessageDigest.isEqual(sign(keySource.getCurrentKey(), payload), tag)) {
            return true;
        }
        byte[] previousKey = keySource.getPreviousKey();
        if (previousKey != null && MessageDigest.isEqual(sign(previousKey, payload), tag)) {
            logger.debug("Accepted resumption token signed with previous key");
            return true;
        }
        return false;
    }

    private static byte[] sign(byte[] key, byte[] payload) {
        return new HmacUtils(HmacAlgorithms.HMAC_SHA_256, key).hmac(payload);
    }

    @Nullable
    private static byte[] decodeSegment(String segment) {
        byte[] decoded = Base64.decodeBase64(segment);
        // lenient decoding ignores foreign characters and trailing bits
        if (decoded.length == 0 || !Base64.encodeBase64URLSafeString(decoded).equals(segment)) {
            return null;
        }
        return decoded;
    }

    private static String serialize(Cursor cursor) {
        List<NameValuePair> pairs = new ArrayList<>();
        pairs.add(new BasicNameValuePair(VERSION, FORMAT_VERSION));
        pairs.add(new BasicNameValuePair(FORMAT, cursor.getMetadataFormat()));
        if (cursor.getSetFilter() != null) {
            pairs.add(new BasicNameValuePair(SET, cursor.getSetFilter()));
        }
        if (cursor.getFromInclusive() != null) {
            pairs.add(new BasicNameValuePair(FROM, String.valueOf(cursor.getFromInclusive().getMillis())));
        }
        if (cursor.getUntilInclusive() != null) {
            pairs.add(new BasicNameValuePair(UNTIL, String.valueOf(cursor.getUntilInclusive().getMillis())));
        }
        pairs.add(new BasicNameValuePair(GRANULARITY, cursor.getGranularity().getLabel()));
        Watermark watermark = cursor.getWatermark();
        if (watermark != null) {
            pairs.add(new BasicNameValuePair(WATERMARK_TIME, String.valueOf(watermark.getLastModifiedMillis())));
            pairs.add(new BasicNameValuePair(WATERMARK_ID, watermark.getRecordIdentifier()));
        }
        pairs.add(new BasicNameValuePair(PAGE_SIZE, String.valueOf(cursor.getPageSize())));
        pairs.add(new BasicNameValuePair(DELIVERED, String.valueOf(cursor.getDeliveredCount())));
        pairs.add(new BasicNameValuePair(ISSUED_AT, String.valueOf(cursor.getIssuedAt().getMillis())));
        pairs.add(new BasicNameValuePair(EXPIRES_AFTER, String.valueOf(cursor.getExpiresAfter().getMillis())));

        Collections.sort(pairs, BY_NAME);
        return URLEncodedUtils.format(pairs, StandardCharsets.UTF_8);
    }

    private Cursor deserialize(String payload) throws BadResumptionTokenException {
        Map<String, String> values = new HashMap<>();
        for (NameValuePair pair : URLEncodedUtils.parse(payload, StandardCharsets.UTF_8)) {
            if (!REQUIRED_KEYS.contains(pair.getName()) && !OPTIONAL_KEYS.contains(pair.getName())) {
                throw reject("unknown payload key '" + pair.getName() + "'");
            }
            if (pair.getValue() == null || values.put(pair.getName(), pair.getValue()) != null) {
                throw reject("missing value or repeated payload key '" + pair.getName() + "'");
            }
        }
        if (!values.keySet().containsAll(REQUIRED_KEYS)) {
            throw reject("payload lacks required keys");
        }
        if (!FORMAT_VERSION.equals(values.get(VERSION))) {
            throw reject("unsupported payload version " + values.get(VERSION));
        }
        if (values.containsKey(WATERMARK_TIME) != values.containsKey(WATERMARK_ID)) {
            throw reject("incomplete watermark");
        }

        try {
            Watermark watermark = values.containsKey(WATERMARK_TIME)
                    ? new Watermark(toDateTime(values.get(WATERMARK_TIME)), values.get(WATERMARK_ID))
                    : null;
            return new Cursor(
                    values.get(FORMAT),
                    values.get(SET),
                    values.containsKey(FROM) ? toDateTime(values.get(FROM)) : null,
                    values.containsKey(UNTIL) ? toDateTime(values.get(UNTIL)) : null,
                    Granularity.fromLabel(values.get(GRANULARITY)),
                    watermark,
                    Integer.parseInt(values.get(PAGE_SIZE)),
                    Long.parseLong(values.get(DELIVERED)),
                    toDateTime(values.get(ISSUED_AT)),
                    new Duration(Long.parseLong(values.get(EXPIRES_AFTER))));
        } catch (IllegalArgumentException e) {
            // also covers NumberFormatException
            logger.debug("Signed payload does not describe a valid cursor: {}", e.getMessage());
            throw new BadResumptionTokenException();
        }
    }

    private static DateTime toDateTime(String millis) throws NumberFormatException {
        return new DateTime(Long.parseLong(millis), DateTimeZone.UTC);
    }

    private BadResumptionTokenException reject(String reason) {
        logger.debug("Rejected resumption token: {}", StringUtils.abbreviate(reason, 200));
        return new BadResumptionTokenException();
    }
}
