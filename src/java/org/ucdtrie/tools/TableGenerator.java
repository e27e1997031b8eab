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
package org.ucdtrie.tools;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.ucdtrie.db.GeneralCategory;
import org.ucdtrie.db.TableId;
import org.ucdtrie.db.tables.AstralRangeTable;
import org.ucdtrie.db.tables.CaseFolder;
import org.ucdtrie.db.tables.CategoryClassifier;
import org.ucdtrie.exceptions.TableIntegrityException;
import org.ucdtrie.io.tries.TrieWriter;
import org.ucdtrie.tools.ucd.CaseFoldingEntry;
import org.ucdtrie.tools.ucd.UnicodeDataRecord;

/**
 * Builds the runtime tables from parsed Unicode Character Database records.
 *
 * Any record that breaks the layout the runtime relies on (a range where single codepoints are expected, a record
 * straddling two table domains, a mapping crossing planes...) fails generation with a
 * {@link TableIntegrityException}.
 */
public final class TableGenerator
{
    private static final Logger logger = LoggerFactory.getLogger(TableGenerator.class);

    public static final int MAX_CASE_DATA_OFFSET = 0x3FFE;

    private static final int BITMAP_FIRST = CategoryClassifier.CORE_SIZE;
    private static final int BITMAP_LAST = 0x1FFFF;

    private TableGenerator() {}

    /**
     * Case folding tries and data array.
     */
    public static final class CaseTables
    {
        public final char[] lower;
        public final char[] upper;
        public final char[] data;

        CaseTables(char[] lower, char[] upper, char[] data)
        {
            this.lower = lower;
            this.upper = upper;
            this.data = data;
        }
    }

    /**
     * General category tries for planes 0 and 1.
     */
    public static final class GeneralTries
    {
        public final char[] low;
        public final char[] high;

        GeneralTries(char[] low, char[] high)
        {
            this.low = low;
            this.high = high;
        }
    }

    /**
     * Builds the case folding tables from the full (C and F) entries, in the given order.
     */
    public static CaseTables caseTables(Iterable<CaseFoldingEntry> entries)
    {
        TrieWriter lower = TrieWriter.create(CaseFolder.TRIE_DEPTH);
        TrieWriter upper = TrieWriter.create(CaseFolder.TRIE_DEPTH);
        StringBuilder data = new StringBuilder();

        for (CaseFoldingEntry entry : entries)
        {
            if (!entry.status().isFull())
                continue;

            int plane = entry.codepoint() >> 16;
            if (plane > 1)
                throw new TableIntegrityException(String.format("Case folding source U+%04X beyond plane 1", entry.codepoint()));
            for (int cv : entry.mapping())
            {
                if (cv >> 16 != plane)
                    throw new TableIntegrityException(String.format("Case folding of U+%04X maps to U+%04X in another plane", entry.codepoint(), cv));
            }

            int offset = data.length();
            if (offset > MAX_CASE_DATA_OFFSET)
                throw new TableIntegrityException("Too many case folding sequences, data offset " + offset);

            for (int cv : entry.mapping())
                data.append((char) (cv & 0xFFFF));
            (plane == 0 ? lower : upper).add(entry.codepoint() & 0xFFFF, CaseFolder.dataKey(offset, entry.mappingLength()));
        }

        logger.info("Case folding: {} plane 0 and {} plane 1 mappings, {} data words", lower.count(), upper.count(), data.length());
        char[] words = new char[data.length()];
        data.getChars(0, words.length, words, 0);
        return new CaseTables(lower.compile(), upper.compile(), words);
    }

    /**
     * Builds the general category tries over U+0100..U+1FFFF, leaving out the categories handled by the bitmap, the
     * hardcoded ranges and the Cn default.
     */
    public static GeneralTries generalTries(Iterable<UnicodeDataRecord> records)
    {
        TrieWriter low = TrieWriter.create(CategoryClassifier.TRIE_DEPTH);
        TrieWriter high = TrieWriter.create(CategoryClassifier.TRIE_DEPTH);

        for (UnicodeDataRecord record : records)
        {
            if (record.ubound() < BITMAP_FIRST || record.lbound() > BITMAP_LAST)
                continue;
            if (!inGeneralTrie(record.category()))
                continue;
            if (record.isRange())
                throw new TableIntegrityException("Unexpected range in general category trie: " + record);

            int cv = record.lbound();
            if (cv <= 0xFFFF)
                low.add(cv, record.category().code());
            else
                high.add(cv - 0x10000, record.category().code());
        }

        logger.info("General category: {} plane 0 and {} plane 1 codepoints", low.count(), high.count());
        return new GeneralTries(low.compile(), high.compile());
    }

    /**
     * Builds the astral range table from the assigned records at or above U+20000, merging adjacent records of the same
     * category.
     */
    public static char[] astral(Iterable<UnicodeDataRecord> records)
    {
        List<int[]> table = new ArrayList<>();
        for (UnicodeDataRecord record : records)
        {
            if (record.category() == GeneralCategory.Cn || record.ubound() < AstralRangeTable.MIN_CODEPOINT)
                continue;
            if (record.lbound() < AstralRangeTable.MIN_CODEPOINT)
                throw new TableIntegrityException("Record crosses into the astral range: " + record);

            int plane = record.lbound() >> 16;
            if (record.ubound() >> 16 != plane)
                throw new TableIntegrityException("Astral record spans several planes: " + record);

            int lower = record.lbound() & 0xFFFF;
            int upper = record.ubound() & 0xFFFF;
            int code = record.category().code();

            if (!table.isEmpty())
            {
                int[] last = table.get(table.size() - 1);
                if (last[0] > plane || (last[0] == plane && last[2] >= lower))
                    throw new TableIntegrityException("Astral records out of order at " + record);
                if (last[0] == plane && last[2] == lower - 1 && last[3] == code)
                {
                    last[2] = upper;
                    continue;
                }
            }
            table.add(new int[]{ plane, lower, upper, code });
        }

        if (table.isEmpty())
            throw new TableIntegrityException("No astral records");

        char[] words = new char[table.size() * AstralRangeTable.RECORD_SIZE];
        for (int i = 0; i < table.size(); i++)
        {
            int[] r = table.get(i);
            for (int j = 0; j < AstralRangeTable.RECORD_SIZE; j++)
                words[i * AstralRangeTable.RECORD_SIZE + j] = (char) r[j];
        }
        logger.info("Astral table: {} ranges", table.size());
        return words;
    }

    /**
     * Builds the 256 entry table of U+0000..U+00FF, every one of which must be assigned individually.
     */
    public static char[] core(Iterable<UnicodeDataRecord> records)
    {
        int cn = GeneralCategory.Cn.code();
        char[] table = new char[CategoryClassifier.CORE_SIZE];
        Arrays.fill(table, (char) cn);

        for (UnicodeDataRecord record : records)
        {
            if (record.lbound() >= CategoryClassifier.CORE_SIZE)
                break;
            if (record.isRange())
                throw new TableIntegrityException("Range record in core range: " + record);
            if (record.category() == GeneralCategory.Cn)
                throw new TableIntegrityException("Unassigned record in core range: " + record);
            if (table[record.lbound()] != cn)
                throw new TableIntegrityException("Duplicate core definition: " + record);
            table[record.lbound()] = (char) record.category().code();
        }

        for (int i = 0; i < table.length; i++)
        {
            if (table[i] == cn)
                throw new TableIntegrityException(String.format("Unassigned core codepoint U+%04X", i));
        }
        return table;
    }

    /**
     * Builds the 2-bit per codepoint Lo/Ll/So bitmap over U+0100..U+1FFFF.
     */
    public static char[] bitmap(Iterable<UnicodeDataRecord> records)
    {
        char[] table = new char[CategoryClassifier.BITMAP_SIZE];
        int assigned = 0;
        for (UnicodeDataRecord record : records)
        {
            if (!inBitmapDomain(record))
                continue;

            int value = bitmapValue(record.category());
            if (value == 0)
                continue;

            for (int cv = record.lbound(); cv <= record.ubound(); cv++)
            {
                int offset = cv - BITMAP_FIRST;
                int index = offset / 8;
                int shift = (offset % 8) * 2;
                if (((table[index] >> shift) & 0x3) != 0)
                    throw new TableIntegrityException(String.format("Duplicate bitmap definition for U+%04X", cv));
                table[index] |= value << shift;
                ++assigned;
            }
        }
        logger.info("Bitmap: {} codepoints assigned", assigned);
        return table;
    }

    /**
     * Lists the surrogate and private use ranges of U+0100..U+1FFFF, adjacent records merged. These are the ranges
     * the classifier hardcodes.
     */
    public static List<UnicodeDataRecord> remainder(Iterable<UnicodeDataRecord> records)
    {
        List<UnicodeDataRecord> result = new ArrayList<>();
        UnicodeDataRecord pending = null;
        for (UnicodeDataRecord record : records)
        {
            if (!inBitmapDomain(record))
                continue;
            if (record.category() != GeneralCategory.Cs && record.category() != GeneralCategory.Co)
                continue;

            if (pending != null && pending.category() == record.category() && record.lbound() == pending.ubound() + 1)
            {
                pending = UnicodeDataRecord.range(pending.lbound(), record.ubound(), record.category());
                continue;
            }
            if (pending != null)
                result.add(pending);
            pending = record;
        }
        if (pending != null)
            result.add(pending);
        return result;
    }

    /**
     * Generates every runtime table.
     */
    public static Map<TableId, char[]> bundle(List<UnicodeDataRecord> records, List<CaseFoldingEntry> foldings)
    {
        Map<TableId, char[]> tables = new EnumMap<>(TableId.class);
        CaseTables cases = caseTables(foldings);
        tables.put(TableId.CASE_LOWER, cases.lower);
        tables.put(TableId.CASE_UPPER, cases.upper);
        tables.put(TableId.CASE_DATA, cases.data);

        GeneralTries general = generalTries(records);
        tables.put(TableId.GCAT_CORE, core(records));
        tables.put(TableId.GCAT_GEN_LOW, general.low);
        tables.put(TableId.GCAT_GEN_HIGH, general.high);
        tables.put(TableId.GCAT_BITMAP, bitmap(records));
        tables.put(TableId.GCAT_ASTRAL, astral(records));
        return tables;
    }

    static boolean inGeneralTrie(GeneralCategory category)
    {
        switch (category)
        {
            case Lo:
            case Ll:
            case So:
            case Cs:
            case Co:
            case Cn:
                return false;
            default:
                return true;
        }
    }

    private static int bitmapValue(GeneralCategory category)
    {
        switch (category)
        {
            case Lo:
                return 1;
            case Ll:
                return 2;
            case So:
                return 3;
            default:
                return 0;
        }
    }

    /**
     * @return whether the record lies in U+0100..U+1FFFF, failing if it only partly does
     */
    private static boolean inBitmapDomain(UnicodeDataRecord record)
    {
        if (record.ubound() < BITMAP_FIRST || record.lbound() > BITMAP_LAST)
            return false;
        if (record.lbound() < BITMAP_FIRST || record.ubound() > BITMAP_LAST)
            throw new TableIntegrityException("Record overlaps the bitmap range boundaries: " + record);
        return true;
    }
}
