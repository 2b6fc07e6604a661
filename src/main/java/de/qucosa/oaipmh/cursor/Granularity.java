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

package de.qucosa.oaipmh.cursor;

import java.util.regex.Pattern;

import org.eclipse.jdt.annotation.Nullable;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;

/**
 * The two datestamp granularities of OAI-PMH 2.0, section 3.3.1. A harvest keeps the
 * granularity of its first request for its whole lifetime.
 */
public enum Granularity {

    DAY("YYYY-MM-DD", "yyyy-MM-dd", "\\d{4}-\\d{2}-\\d{2}"),
    SECOND("YYYY-MM-DDThh:mm:ssZ", "yyyy-MM-dd'T'HH:mm:ss'Z'", "\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}Z");

    private final String label;
    private final DateTimeFormatter formatter;
    private final Pattern pattern;

    Granularity(String label, String formatPattern, String regEx) {
        this.label = label;
        this.formatter = DateTimeFormat.forPattern(formatPattern).withZoneUTC();
        this.pattern = Pattern.compile(regEx);
    }

    /**
     * @return the granularity as declared in an Identify response, e.g. {@code YYYY-MM-DD}
     */
    public String getLabel() {
        return label;
    }

    /**
     * @param label either {@code YYYY-MM-DD} or {@code YYYY-MM-DDThh:mm:ssZ}
     * @return the matching granularity, never {@code null}
     * @throws IllegalArgumentException if label is none of the two protocol values
     */
    public static Granularity fromLabel(String label) throws IllegalArgumentException {
        for (Granularity granularity : values()) {
            if (granularity.label.equals(label)) {
                return granularity;
            }
        }
        throw new IllegalArgumentException("Invalid granularity '" + label + "'. Allowed values are: "
                + DAY.label + ", " + SECOND.label);
    }

    /**
     * Determine the granularity a datestamp is written in, by shape only.
     *
     * @param datestamp as sent in a from or until argument
     * @return the granularity whose lexical form matches, or {@code null} if none does
     */
    @Nullable
    public static Granularity detect(@Nullable String datestamp) {
        if (datestamp == null) {
            return null;
        }
        for (Granularity granularity : values()) {
            if (granularity.pattern.matcher(datestamp).matches()) {
                return granularity;
            }
        }
        return null;
    }

    /**
     * @param datestamp in this granularity's lexical form
     * @return the start of the period denoted by datestamp, in UTC
     * @throws IllegalArgumentException if datestamp has the wrong shape or is not a valid
     *                                  calendar date (e.g. February 30th)
     */
    public DateTime parse(String datestamp) throws IllegalArgumentException {
        if (datestamp == null || !pattern.matcher(datestamp).matches()) {
            throw new IllegalArgumentException("'" + datestamp + "' does not match granularity " + label);
        }
        return formatter.parseDateTime(datestamp).withZone(DateTimeZone.UTC);
    }

    public String format(DateTime dateTime) {
        return formatter.print(dateTime);
    }

    /**
     * @return the last millisecond of the day or second that starts at periodStart
     */
    public DateTime endOfPeriod(DateTime periodStart) {
        DateTime nextPeriod = (this == DAY) ? periodStart.plusDays(1) : periodStart.plusSeconds(1);
        return nextPeriod.minusMillis(1);
    }

    public boolean isFinerThan(Granularity other) {
        return ordinal() > other.ordinal();
    }

    @Override
    public String toString() {
        return label;
    }
}
