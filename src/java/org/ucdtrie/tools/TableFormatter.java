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

import java.util.List;
import java.util.Map;

import org.ucdtrie.db.TableId;
import org.ucdtrie.io.util.Base64Words;
import org.ucdtrie.tools.ucd.UnicodeDataRecord;

/**
 * Text renderings of generated tables.
 */
public final class TableFormatter
{
    public static final int WORDS_PER_LINE = 8;

    private TableFormatter() {}

    /**
     * Hexadecimal listing, 8 words per line, each line prefixed with the index of its first word:
     * <pre>
     * 0000: 0x4363, 0x4363, ...
     * </pre>
     */
    public static String pretty(char[] words)
    {
        StringBuilder sb = new StringBuilder(words.length * 8 + 16);
        for (int i = 0; i < words.length; i++)
        {
            if (i > 0)
                sb.append(',');
            if (i % WORDS_PER_LINE == 0)
            {
                if (i > 0)
                    sb.append('\n');
                sb.append(String.format("%04x: ", i));
            }
            else
            {
                sb.append(' ');
            }
            sb.append(String.format("0x%04x", (int) words[i]));
        }
        return sb.append('\n').toString();
    }

    /**
     * Base64 encoding split into lines of {@link Base64Words#LINE_LENGTH} characters.
     */
    public static String base64(char[] words)
    {
        StringBuilder sb = new StringBuilder();
        for (String line : Base64Words.encodeLines(words))
            sb.append(line).append('\n');
        return sb.toString();
    }

    public static String format(char[] words, Style style)
    {
        return style == Style.pretty ? pretty(words) : base64(words);
    }

    public static String ranges(List<UnicodeDataRecord> records)
    {
        StringBuilder sb = new StringBuilder();
        for (UnicodeDataRecord record : records)
            sb.append(String.format("[%s] U+%04X - U+%04X%n", record.category().abbreviation(), record.lbound(), record.ubound()));
        return sb.toString();
    }

    /**
     * Renders every table as a properties resource readable by
     * {@link org.ucdtrie.config.ResourceDataTableStore}. Each value is continued over lines of
     * {@link Base64Words#LINE_LENGTH} characters.
     */
    public static String bundle(Map<TableId, char[]> tables, String header)
    {
        StringBuilder sb = new StringBuilder();
        for (String line : header.split("\n"))
            sb.append("# ").append(line).append('\n');

        for (TableId id : TableId.VALUES)
        {
            char[] words = tables.get(id);
            if (words == null)
                throw new IllegalArgumentException("Missing table " + id.property());

            sb.append('\n').append(String.format("# %d: %d words%n", id.key(), words.length));
            sb.append(id.property()).append(" = \\\n");
            String[] lines = Base64Words.encodeLines(words);
            for (int i = 0; i < lines.length; i++)
            {
                sb.append("    ").append(lines[i]);
                sb.append(i + 1 < lines.length ? "\\\n" : "\n");
            }
        }
        return sb.toString();
    }

    public enum Style
    {
        pretty,
        base64
    }
}
