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

import org.apache.commons.codec.binary.Base64;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.jdt.annotation.Nullable;

/**
 * {@link SigningKeySource} with keys fixed at construction, usually read from configuration.
 */
public class StaticSigningKeySource implements SigningKeySource {

    public static final int MINIMUM_KEY_LENGTH = 32;

    private final byte[] currentKey;
    @Nullable
    private final byte[] previousKey;

    /**
     * @param currentKey  key to sign and verify with, at least {@value #MINIMUM_KEY_LENGTH} bytes
     * @param previousKey key to verify with only, at least {@value #MINIMUM_KEY_LENGTH} bytes
     *                    or {@code null}
     * @throws IllegalArgumentException if a key is too short or currentKey is {@code null}
     */
    public StaticSigningKeySource(byte[] currentKey, @Nullable byte[] previousKey) throws IllegalArgumentException {
        checkKey(currentKey, "currentKey");
        if (previousKey != null) {
            checkKey(previousKey, "previousKey");
        }
        this.currentKey = currentKey.clone();
        this.previousKey = (previousKey == null) ? null : previousKey.clone();
    }

    /**
     * @param currentKey  Base64 encoded current key
     * @param previousKey Base64 encoded previous key, blank or {@code null} if there is none
     * @throws IllegalArgumentException if currentKey is blank or a decoded key is too short
     */
    public static StaticSigningKeySource fromBase64(String currentKey, @Nullable String previousKey)
            throws IllegalArgumentException {
        if (StringUtils.isBlank(currentKey))
            throw new IllegalArgumentException("a resumption token signing key must be configured");
        return new StaticSigningKeySource(Base64.decodeBase64(currentKey.trim()),
                StringUtils.isBlank(previousKey) ? null : Base64.decodeBase64(previousKey.trim()));
    }

    private static void checkKey(byte[] key, String name) throws IllegalArgumentException {
        if (key == null)
            throw new IllegalArgumentException("parameter " + name + " must not be null");
        if (key.length < MINIMUM_KEY_LENGTH)
            throw new IllegalArgumentException(name + " must have at least " + MINIMUM_KEY_LENGTH + " bytes, has "
                    + key.length);
    }

    @Override
    public byte[] getCurrentKey() {
        return currentKey.clone();
    }

    @Override
    @Nullable
    public byte[] getPreviousKey() {
        return (previousKey == null) ? null : previousKey.clone();
    }
}
