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
package org.ucdtrie.tools.ucd;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.base.Splitter;

import org.ucdtrie.db.GeneralCategory;

/**
 * Sequential reader of UnicodeData.txt.
 *
 * Comments and blank lines are skipped. A {@code <..., First>} line and the {@code <..., Last>} line following it
 * are merged into a single range record; both must agree on category and combining class and neither may carry a
 * decomposition. Records come out strictly ascending, anything else being rejected.
 */
public class UnicodeDataReader implements Closeable
{
    private static final Pattern RECORD = Pattern.compile("^([^;]*);([^;]*);([^;]*);([^;]*);[^;]*;([^;]*);.*$");
    private static final Pattern CODEPOINT = Pattern.compile("^\\s*([0-9A-Fa-f]{1,6})\\s*$");
    private static final Pattern CATEGORY = Pattern.compile("^\\s*([A-Z][a-z])\\s*$");
    private static final Pattern COMBINING_CLASS = Pattern.compile("^\\s*([0-9]{1,3})\\s*$");
    private static final Pattern RANGE_FIRST = Pattern.compile("^\\s*<.*First\\s*>\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern RANGE_LAST = Pattern.compile("^\\s*<.*Last\\s*>\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DECOMPOSITION_TAG = Pattern.compile("^<[^>]*>(.*)$");
    private static final Splitter ON_WHITESPACE = Splitter.onPattern("\\s+").omitEmptyStrings();

    private final String source;
    private final BufferedReader reader;
    private int lineNumber = 0;
    private int position = -1;

    public UnicodeDataReader(String source, BufferedReader reader)
    {
        this.source = source;
        this.reader = reader;
    }

    public static UnicodeDataReader open(Path path) throws IOException
    {
        return new UnicodeDataReader(path.getFileName().toString(), Files.newBufferedReader(path, StandardCharsets.UTF_8));
    }

    /**
     * Reads a whole file.
     */
    public static List<UnicodeDataRecord> readAll(Path path) throws IOException, UcdParseException
    {
        try (UnicodeDataReader reader = open(path))
        {
            return reader.readAll();
        }
    }

    public List<UnicodeDataRecord> readAll() throws IOException, UcdParseException
    {
        List<UnicodeDataRecord> records = new ArrayList<>();
        for (UnicodeDataRecord record = next(); record != null; record = next())
            records.add(record);
        return records;
    }

    /**
     * @return the next record, or {@code null} at the end of the input
     */
    @Nullable
    public UnicodeDataRecord next() throws IOException, UcdParseException
    {
        RawRecord first = readRaw();
        if (first == null)
            return null;

        UnicodeDataRecord record;
        if (first.range > 0)
        {
            RawRecord last = readRaw();
            if (last == null)
                throw error("Unclosed range starting at U+%04X", first.codepoint);
            if (last.range >= 0)
                throw error("Range starting at U+%04X is not closed by a Last record", first.codepoint);
            if (first.decomposition != null || last.decomposition != null)
                throw error("Decompositions not allowed in ranges");
            if (first.category != last.category || first.combiningClass != last.combiningClass)
                throw error("Parameter mismatch in range U+%04X..U+%04X", first.codepoint, last.codepoint);
            if (last.codepoint <= first.codepoint)
                throw error("Invalid range boundaries U+%04X..U+%04X", first.codepoint, last.codepoint);
            record = new UnicodeDataRecord(first.codepoint, last.codepoint, first.category, first.combiningClass, null, false);
        }
        else if (first.range == 0)
        {
            record = new UnicodeDataRecord(first.codepoint, first.codepoint, first.category, first.combiningClass,
                                           first.decomposition, first.compatibility);
        }
        else
        {
            throw error("Improper range: Last record U+%04X without First", first.codepoint);
        }

        if (record.lbound() <= position)
            throw error("Records out of order at U+%04X", record.lbound());
        position = record.ubound();
        return record;
    }

    @Override
    public void close() throws IOException
    {
        reader.close();
    }

    @Nullable
    private RawRecord readRaw() throws IOException, UcdParseException
    {
        String text;
        while ((text = reader.readLine()) != null)
        {
            ++lineNumber;
            int comment = text.indexOf('#');
            if (comment >= 0)
                text = text.substring(0, comment);
            text = text.trim();
            if (!text.isEmpty())
                break;
        }
        if (text == null)
            return null;

        Matcher m = RECORD.matcher(text);
        if (!m.matches())
            throw error("Invalid record");

        RawRecord raw = new RawRecord();
        raw.codepoint = parseCodepoint(m.group(1), "Invalid codepoint field");

        String name = m.group(2);
        if (RANGE_FIRST.matcher(name).matches())
            raw.range = 1;
        else if (RANGE_LAST.matcher(name).matches())
            raw.range = -1;

        Matcher category = CATEGORY.matcher(m.group(3));
        if (!category.matches())
            throw error("Invalid category '%s'", m.group(3));
        try
        {
            raw.category = GeneralCategory.fromAbbreviation(category.group(1));
        }
        catch (IllegalArgumentException e)
        {
            throw error("Unknown category '%s'", category.group(1));
        }

        Matcher cclass = COMBINING_CLASS.matcher(m.group(4));
        if (!cclass.matches())
            throw error("Invalid combining class '%s'", m.group(4));
        raw.combiningClass = Integer.parseInt(cclass.group(1));
        if (raw.combiningClass > 255)
            throw error("Combining class out of range: %d", raw.combiningClass);

        String decomposition = m.group(5).trim();
        if (!decomposition.isEmpty())
        {
            Matcher tagged = DECOMPOSITION_TAG.matcher(decomposition);
            if (tagged.matches())
            {
                raw.compatibility = true;
                decomposition = tagged.group(1).trim();
            }
            if (decomposition.isEmpty())
                throw error("Invalid decomposition");

            List<String> parts = ON_WHITESPACE.splitToList(decomposition);
            raw.decomposition = new int[parts.size()];
            for (int i = 0; i < parts.size(); i++)
                raw.decomposition[i] = parseCodepoint(parts.get(i), "Invalid decomposition");
        }
        return raw;
    }

    private int parseCodepoint(String field, String message) throws UcdParseException
    {
        Matcher m = CODEPOINT.matcher(field);
        if (!m.matches())
            throw error("%s '%s'", message, field);
        int codepoint = Integer.parseInt(m.group(1), 16);
        if (codepoint > 0x10FFFF)
            throw error("Codepoint out of range: %s", field.trim());
        return codepoint;
    }

    private UcdParseException error(String format, Object... args)
    {
        return new UcdParseException(source, lineNumber, String.format(format, args));
    }

    private static final class RawRecord
    {
        int codepoint;
        int range;
        GeneralCategory category;
        int combiningClass;
        int[] decomposition;
        boolean compatibility;
    }
}
