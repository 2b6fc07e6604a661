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

package de.qucosa.oaipmh.query;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * {@link FormatRegistry} with a fixed list of metadataPrefixes, usually from
 * {@link de.qucosa.oaipmh.config.PaginationProperties#getMetadataFormats()}.
 */
public class ConfiguredFormatRegistry implements FormatRegistry {

    private final Set<String> metadataPrefixes;

    /**
     * @throws IllegalArgumentException if metadataPrefixes is {@code null} or empty
     */
    public ConfiguredFormatRegistry(Collection<String> metadataPrefixes) throws IllegalArgumentException {
        if (metadataPrefixes == null || metadataPrefixes.isEmpty())
            throw new IllegalArgumentException("at least one metadata format must be configured");
        this.metadataPrefixes = Collections.unmodifiableSet(new LinkedHashSet<>(metadataPrefixes));
    }

    @Override
    public boolean exists(String metadataPrefix) {
        return metadataPrefixes.contains(metadataPrefix);
    }
}
