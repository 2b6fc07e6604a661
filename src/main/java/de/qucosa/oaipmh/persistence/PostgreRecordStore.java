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

package de.qucosa.oaipmh.persistence;

import java.sql.Array;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Calendar;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.TimeZone;

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.qucosa.oaipmh.config.PaginationProperties;
import de.qucosa.oaipmh.sets.HierarchicalSetResolver;

/**
 * {@link RecordStore} on the tables {@code "OAIRecord"} and {@code "OAIRecordMetadata"} of a
 * PostgreSQL database. Identifiers are ordered with collation {@code "C"}. Records not
 * available in the requested format are filtered by the database.
 */
public class PostgreRecordStore implements RecordStore {

    private static final String SELECT_RECORDS = "SELECT r.\"recordIdentifier\", r.\"datestamp\", r.\"setSpec\", "
            + "r.\"statusIsDeleted\", m.\"metadata\" FROM \"OAIRecord\" r "
            + "LEFT JOIN \"OAIRecordMetadata\" m ON m.\"recordIdentifier\" = r.\"recordIdentifier\" "
            + "AND m.\"metadataPrefix\" = ? "
            + "WHERE (m.\"metadata\" IS NOT NULL OR r.\"statusIsDeleted\")";

    private static final String ORDER_AND_LIMIT = " ORDER BY r.\"datestamp\", r.\"recordIdentifier\" COLLATE \"C\" LIMIT ?";

    private final String databasePassword;
    private final String databaseUser;
    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final String url;
    private final int queryTimeoutSeconds;

    /**
     * @param url                 as required by
     *                            {@link DriverManager#getConnection(String, String, String)}
     * @param databaseUser        as required by
     *                            {@link DriverManager#getConnection(String, String, String)}
     * @param databasePassword    as required by
     *                            {@link DriverManager#getConnection(String, String, String)}
     * @param queryTimeoutSeconds passed to {@link PreparedStatement#setQueryTimeout(int)},
     *                            0 for no limit
     * @throws IllegalArgumentException if any parameter is {@code null} or the timeout is
     *                                  negative
     * @throws SQLException             in case credentials can't be used to establish a database
     *                                  connection to the url or a database access error occurs
     */
    public PostgreRecordStore(String url, String databaseUser, String databasePassword, int queryTimeoutSeconds)
            throws IllegalArgumentException, SQLException {
        if (url == null) {
            throw new IllegalArgumentException("parameter url must not be null");
        }
        if (databaseUser == null) {
            throw new IllegalArgumentException("parameter databaseUser must not be null");
        }
        if (databasePassword == null) {
            throw new IllegalArgumentException("parameter databasePassword must not be null");
        }
        if (queryTimeoutSeconds < 0) {
            throw new IllegalArgumentException("parameter queryTimeoutSeconds must not be negative");
        }

        this.url = url;
        this.databaseUser = databaseUser;
        this.databasePassword = databasePassword;
        this.queryTimeoutSeconds = queryTimeoutSeconds;

        // check url and credentials and throw SQLException if a database access error occurs
        Connection con = DriverManager.getConnection(url, databaseUser, databasePassword);
        con.close();
    }

    public static PostgreRecordStore fromProperties(PaginationProperties properties) throws SQLException {
        return new PostgreRecordStore(properties.getPostgreSQLDatabaseURL(), properties.getPostgreSQLUser(),
                properties.getPostgreSQLPasswd(), properties.getStoreQueryTimeoutSeconds());
    }

    @Override
    public List<HarvestRecord> findRecords(RecordRangeQuery query) throws PersistenceException {
        StringBuilder stm = new StringBuilder(SELECT_RECORDS);
        List<Object> parameters = new LinkedList<>();
        parameters.add(query.getMetadataFormat());

        if (!query.isIncludeDeleted()) {
            stm.append(" AND NOT r.\"statusIsDeleted\"");
        }
        if (query.getLowerBound() != null) {
            stm.append(" AND r.\"datestamp\" >= ?");
            parameters.add(query.getLowerBound());
        }
        if (query.getUpperBound() != null) {
            stm.append(" AND r.\"datestamp\" <= ?");
            parameters.add(query.getUpperBound());
        }
        if (query.getAfter() != null) {
            DateTime afterDatestamp = query.getAfter().getLastModified();
            stm.append(" AND (r.\"datestamp\" > ? OR (r.\"datestamp\" = ? AND r.\"recordIdentifier\" COLLATE \"C\" > ?))");
            parameters.add(afterDatestamp);
            parameters.add(afterDatestamp);
            parameters.add(query.getAfter().getRecordIdentifier());
        }
        if (query.getSetFilter() != null) {
            stm.append(" AND EXISTS (SELECT 1 FROM unnest(r.\"setSpec\") AS s(\"spec\") "
                    + "WHERE s.\"spec\" = ? OR s.\"spec\" LIKE ?)");
            parameters.add(query.getSetFilter());
            parameters.add(escapeLikePattern(query.getSetFilter()) + HierarchicalSetResolver.HIERARCHY_SEPARATOR + "%");
        }
        stm.append(ORDER_AND_LIMIT);
        parameters.add(query.getLimit());

        List<HarvestRecord> records = new LinkedList<>();

        try (Connection con = DriverManager.getConnection(url, databaseUser, databasePassword);
             PreparedStatement pst = con.prepareStatement(stm.toString())) {

            pst.setQueryTimeout(queryTimeoutSeconds);
            bindParameters(pst, parameters);

            try (ResultSet rs = pst.executeQuery()) {
                while (rs.next()) {
                    records.add(new HarvestRecord(
                            rs.getString("recordIdentifier"),
                            new DateTime(rs.getTimestamp("datestamp", utcCalendar()).getTime(), DateTimeZone.UTC),
                            convertNullableSQLArrayToList(rs.getArray("setSpec")),
                            rs.getBoolean("statusIsDeleted"),
                            rs.getString("metadata")));
                }
            }

        } catch (SQLTimeoutException e) {
            throw new PersistenceException("Record query exceeded " + queryTimeoutSeconds + " seconds: " + query, e);
        } catch (SQLException e) {
            throw new PersistenceException("Could not fetch records from database: " + query, e);
        }

        logger.trace("{} returned {} records", query, records.size());
        return records;
    }

    private void bindParameters(PreparedStatement pst, List<Object> parameters) throws SQLException {
        int index = 0;
        for (Object parameter : parameters) {
            ++index;
            if (parameter instanceof DateTime) {
                pst.setTimestamp(index, new Timestamp(((DateTime) parameter).getMillis()), utcCalendar());
            } else if (parameter instanceof Integer) {
                pst.setInt(index, (Integer) parameter);
            } else {
                pst.setString(index, (String) parameter);
            }
        }
    }

    private List<String> convertNullableSQLArrayToList(Array array) throws SQLException {
        if (array == null) {
            return Collections.emptyList();
        }
        String[] values = (String[]) array.getArray();
        return new ArrayList<>(Arrays.asList(values));
    }

    static String escapeLikePattern(String value) {
        return value.replace("\\", "\\\\").replace("_", "\\_").replace("%", "\\%");
    }

    private static Calendar utcCalendar() {
        return Calendar.getInstance(TimeZone.getTimeZone("UTC"));
    }
}
