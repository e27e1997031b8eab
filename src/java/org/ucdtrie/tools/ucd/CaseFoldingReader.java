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

/**
 * Sequential reader of CaseFolding.txt. Entries of every status are returned in file order; codepoints and mapped
 * codepoints above U+1FFFF are rejected since the tables only cover the first two planes.
 */
public class CaseFoldingReader implements Closeable
{
    public static final int MAX_CODEPOINT = 0x1FFFF;

    private static final Pattern RECORD = Pattern.compile("^([^;]*);([^;]*);([^;]*);$");
    private static final Pattern CODEPOINT = Pattern.compile("^\\s*([0-9A-Fa-f]{1,6})\\s*$");
    private static final Pattern STATUS = Pattern.compile("^\\s*([CFST])\\s*$");
    private static final Splitter ON_WHITESPACE = Splitter.onPattern("\\s+").omitEmptyStrings();

    private final String source;
    private final BufferedReader reader;
    private int lineNumber = 0;

    public CaseFoldingReader(String source, BufferedReader reader)
    {
        this.source = source;
        this.reader = reader;
    }

    public static CaseFoldingReader open(Path path) throws IOException
    {
        return new CaseFoldingReader(path.getFileName().toString(), Files.newBufferedReader(path, StandardCharsets.UTF_8));
    }

    public static List<CaseFoldingEntry> readAll(Path path) throws IOException, UcdParseException
    {
        try (CaseFoldingReader reader = open(path))
        {
            return reader.readAll();
        }
    }

    public List<CaseFoldingEntry> readAll() throws IOException, UcdParseException
    {
        List<CaseFoldingEntry> entries = new ArrayList<>();
        for (CaseFoldingEntry entry = next(); entry != null; entry = next())
            entries.add(entry);
        return entries;
    }

    @Nullable
    public CaseFoldingEntry next() throws IOException, UcdParseException
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

        int codepoint = parseCodepoint(m.group(1), "Invalid codepoint field");

        Matcher status = STATUS.matcher(m.group(2));
        if (!status.matches())
            throw error("Mapping type invalid: '%s'", m.group(2).trim());

        List<String> parts = ON_WHITESPACE.splitToList(m.group(3));
        if (parts.isEmpty() || parts.size() > CaseFoldingEntry.MAX_MAPPING)
            throw error("Mapping length out of range: %d", parts.size());

        int[] mapping = new int[parts.size()];
        for (int i = 0; i < mapping.length; i++)
            mapping[i] = parseCodepoint(parts.get(i), "Invalid codepoint in mapping");

        return new CaseFoldingEntry(codepoint, CaseFoldingEntry.Status.valueOf(status.group(1)), mapping);
    }

    @Override
    public void close() throws IOException
    {
        reader.close();
    }

    private int parseCodepoint(String field, String message) throws UcdParseException
    {
        Matcher m = CODEPOINT.matcher(field);
        if (!m.matches())
            throw error("%s '%s'", message, field.trim());
        int codepoint = Integer.parseInt(m.group(1), 16);
        if (codepoint > MAX_CODEPOINT)
            throw error("Codepoint out of range: U+%04X", codepoint);
        return codepoint;
    }

    private UcdParseException error(String format, Object... args)
    {
        return new UcdParseException(source, lineNumber, String.format(format, args));
    }
}
