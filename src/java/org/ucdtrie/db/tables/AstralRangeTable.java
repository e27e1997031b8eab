/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.ucdtrie.db.tables;

import org.ucdtrie.exceptions.TableIntegrityException;

/**
 * Sorted range table classifying codepoints of planes 2 to 16.
 *
 * Each record is 4 words: plane, lower offset, upper offset (inclusive) and category code, the offsets being the low
 * 16 bits of the codepoints. Records are ordered by (plane, lower offset), do not overlap, and adjacent records of the
 * same category were merged when the table was generated.
 */
public final class AstralRangeTable
{
    public static final int RECORD_SIZE = 4;
    public static final int MIN_CODEPOINT = 0x20000;
    public static final int MAX_CODEPOINT = 0x10FFFF;

    private final char[] records;

    public AstralRangeTable(char[] records)
    {
        if (records.length < RECORD_SIZE || records.length % RECORD_SIZE != 0)
            throw new TableIntegrityException("Invalid astral table length " + records.length);
        this.records = records;
    }

    public int recordCount()
    {
        return records.length / RECORD_SIZE;
    }

    /**
     * Returns the category code of an astral codepoint, or {@code defaultCode} if no record covers it.
     */
    public int lookup(int cv, int defaultCode)
    {
        int plane = cv >> 16;
        int offset = cv & 0xFFFF;
        int record = floor(plane, offset);

        int base = record * RECORD_SIZE;
        if (plane == records[base] && offset >= records[base + 1] && offset <= records[base + 2])
            return records[base + 3];
        return defaultCode;
    }

    /**
     * Finds the last record whose (plane, lower offset) does not exceed the query. If the query sorts before every
     * record, record 0 is returned and the caller's containment check rejects it.
     *
     * The probe is always at least one above the lower bound, and the lower bound moves onto the probe when the
     * query is greater or equal, so an exact match is never skipped and the loop ends with a single candidate.
     */
    int floor(int plane, int offset)
    {
        int lbound = 0;
        int ubound = recordCount() - 1;
        while (lbound < ubound)
        {
            int mid = lbound + (ubound - lbound) / 2;
            if (mid <= lbound)
                mid = lbound + 1;

            int cmp = compare(plane, offset, mid);
            if (cmp < 0)
            {
                ubound = mid - 1;
            }
            else if (cmp > 0)
            {
                lbound = mid;
            }
            else
            {
                lbound = mid;
                ubound = mid;
            }
        }
        return lbound;
    }

    private int compare(int plane, int offset, int record)
    {
        int base = record * RECORD_SIZE;
        int cmp = Integer.compare(plane, records[base]);
        return cmp != 0 ? cmp : Integer.compare(offset, records[base + 1]);
    }
}
