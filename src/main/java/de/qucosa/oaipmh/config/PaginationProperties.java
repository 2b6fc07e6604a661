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

package de.qucosa.oaipmh.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.eclipse.jdt.annotation.Nullable;
import org.joda.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.qucosa.oaipmh.cursor.DeletedRecordPolicy;
import de.qucosa.oaipmh.cursor.Granularity;

/**
 * Configuration of the pagination engine. Values are read from {@code /default.properties} on
 * the classpath, overwritten by an optional {@code /local.properties} and finally by system
 * properties starting with {@code oai.}, {@code token.} or {@code db.}.
 */
public class PaginationProperties {

    private final Logger logger = LoggerFactory.getLogger(getClass());

    private static final String DEFAULT_PROPERTIES_FILE = "/default.properties";
    private static final String LOCAL_PROPERTIES_FILE = "/local.properties";
    private static final String PROPERTIES_FILE_FORMAT = "ISO-8859-1";
    private static final String[] SYSTEM_PROPERTY_PREFIXES = {"oai.", "token.", "db."};

    private static PaginationProperties instance;

    private final Properties props = new Properties();

    /**
     * @throws IOException if {@code /default.properties} is missing or a properties file
     *                     cannot be read
     */
    public PaginationProperties() throws IOException {
        try (InputStream in = getClass().getResourceAsStream(DEFAULT_PROPERTIES_FILE)) {
            if (in == null) {
                throw new IOException("Properties file " + DEFAULT_PROPERTIES_FILE + " not found on classpath");
            }
            try (Reader reader = new InputStreamReader(in, PROPERTIES_FILE_FORMAT)) {
                props.load(reader);
                logger.debug("Successful loaded properties");
            }
        }
        overwriteWithLocalProperties();
        overwriteWithSystemProperties();
    }

    public static synchronized PaginationProperties getInstance() throws IOException {
        if (PaginationProperties.instance == null) {
            instance = new PaginationProperties();
        }
        return instance;
    }

    private void overwriteWithLocalProperties() throws IOException {
        try (InputStream in = getClass().getResourceAsStream(LOCAL_PROPERTIES_FILE)) {

            // file local.properties is optional, it may not exist
            if (in != null) {
                try (Reader reader = new InputStreamReader(in, PROPERTIES_FILE_FORMAT)) {
                    props.load(reader);
                }
            }
        }
    }

    private void overwriteWithSystemProperties() {
        for (String key : System.getProperties().stringPropertyNames()) {
            if (StringUtils.startsWithAny(key, SYSTEM_PROPERTY_PREFIXES)) {
                props.setProperty(key, System.getProperty(key));
            }
        }
    }

    public int getPageSize() {
        return Integer.parseInt(props.getProperty("oai.pagesize").trim());
    }

    /**
     * @throws IllegalArgumentException if the configured value is no OAI-PMH granularity
     */
    public Granularity getRepositoryGranularity() throws IllegalArgumentException {
        return Granularity.fromLabel(props.getProperty("oai.granularity").trim());
    }

    /**
     * @throws IllegalArgumentException if the configured value is none of no, transient, persistent
     */
    public DeletedRecordPolicy getDeletedRecordPolicy() throws IllegalArgumentException {
        return DeletedRecordPolicy.fromValue(props.getProperty("oai.deletedrecord").trim());
    }

    /**
     * @return the metadataPrefixes of all supported formats, from the comma separated
     * property {@code oai.formats}
     */
    public List<String> getMetadataFormats() {
        List<String> formats = new ArrayList<>();
        for (String format : StringUtils.split(props.getProperty("oai.formats", ""), ',')) {
            if (StringUtils.isNotBlank(format)) {
                formats.add(format.trim());
            }
        }
        return formats;
    }

    public Duration getTokenTimeToLive() {
        return Duration.standardMinutes(Long.parseLong(props.getProperty("token.ttlminutes").trim()));
    }

    /**
     * @return the Base64 encoded key resumption tokens are signed with, {@code null} if not set
     */
    @Nullable
    public String getTokenKey() {
        return StringUtils.trimToNull(props.getProperty("token.key"));
    }

    /**
     * @return the Base64 encoded key that was current before the last key rotation,
     * {@code null} if not set
     */
    @Nullable
    public String getTokenPreviousKey() {
        return StringUtils.trimToNull(props.getProperty("token.previouskey"));
    }

    public String getPostgreSQLDatabaseURL() {
        return props.getProperty("db.url");
    }

    public String getPostgreSQLUser() {
        return props.getProperty("db.user");
    }

    public String getPostgreSQLPasswd() {
        return props.getProperty("db.passwd");
    }

    public int getStoreQueryTimeoutSeconds() {
        return Integer.parseInt(props.getProperty("db.querytimeoutseconds").trim());
    }

    public int getStoreWorkerCount() {
        return Integer.parseInt(props.getProperty("db.workers").trim());
    }
}
