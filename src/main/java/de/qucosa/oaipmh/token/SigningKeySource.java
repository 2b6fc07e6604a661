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

import org.eclipse.jdt.annotation.Nullable;

/**
 * Keys used to sign and verify resumption tokens. Tokens are always signed with the current
 * key; the previous key is only accepted for verification, so that harvests started before a
 * key rotation can be finished.
 */
public interface SigningKeySource {

    public byte[] getCurrentKey();

    /**
     * @return the key that was current before the last rotation, {@code null} if there is none
     */
    @Nullable
    public byte[] getPreviousKey();
}
