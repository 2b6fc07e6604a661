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

package de.qucosa.oaipmh.util;

import org.joda.time.DateTime;
import org.joda.time.DateTimeUtils.MillisProvider;
import org.joda.time.Duration;

/**
 * Clock for tests, standing still until it is set or advanced.
 */
public class SettableClock implements MillisProvider {

    private volatile long millis;

    public SettableClock(DateTime now) {
        this.millis = now.getMillis();
    }

    @Override
    public long getMillis() {
        return millis;
    }

    public void set(DateTime now) {
        this.millis = now.getMillis();
    }

    public void advance(Duration duration) {
        this.millis += duration.getMillis();
    }
}
