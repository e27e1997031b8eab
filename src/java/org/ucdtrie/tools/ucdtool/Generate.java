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
package org.ucdtrie.tools.ucdtool;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import io.airlift.airline.Arguments;
import io.airlift.airline.Command;

import org.ucdtrie.tools.TableFormatter;
import org.ucdtrie.tools.TableFormatter.Style;
import org.ucdtrie.tools.TableGenerator;
import org.ucdtrie.tools.TableKind;
import org.ucdtrie.tools.ucd.CaseFoldingReader;
import org.ucdtrie.tools.ucd.UcdParseException;
import org.ucdtrie.tools.ucd.UnicodeDataReader;
import org.ucdtrie.tools.ucd.UnicodeDataRecord;

import static com.google.common.base.Preconditions.checkArgument;

@Command(name = "generate", description = "Generate one kind of table from a UCD file")
public class Generate extends UcdCommand
{
    @Arguments(usage = "<case|genchar|astral|core|bitmap|remainder> <pretty|base64> <file>",
               description = "The table kind, the output style and the UCD file (CaseFolding.txt for case, UnicodeData.txt otherwise)",
               required = true)
    private List<String> args = new ArrayList<>();

    @Override
    protected void execute(PrintStream out) throws IOException, UcdParseException
    {
        checkArgument(args.size() == 3, "generate requires <kind> <style> <file>");
        TableKind kind = TableKind.fromName(args.get(0));
        Style style = parseStyle(args.get(1));
        Path path = Paths.get(args.get(2));

        if (kind.fromCaseFolding())
        {
            TableGenerator.CaseTables tables = TableGenerator.caseTables(CaseFoldingReader.readAll(path));
            section(out, "Lower index", tables.lower, style, true);
            section(out, "Upper index", tables.upper, style, false);
            section(out, "Data table", tables.data, style, false);
            return;
        }

        List<UnicodeDataRecord> records = UnicodeDataReader.readAll(path);
        switch (kind)
        {
            case GENCHAR:
                TableGenerator.GeneralTries tries = TableGenerator.generalTries(records);
                section(out, "Lower index", tries.low, style, true);
                section(out, "Upper index", tries.high, style, false);
                break;
            case ASTRAL:
                section(out, "Astral table", TableGenerator.astral(records), style, true);
                break;
            case CORE:
                section(out, "Core table", TableGenerator.core(records), style, true);
                break;
            case BITMAP:
                section(out, "Character bitmap", TableGenerator.bitmap(records), style, true);
                break;
            case REMAINDER:
                checkArgument(style == Style.pretty, "base64 not supported for the remainder table");
                out.print("Remainder table:\n\n");
                out.print(TableFormatter.ranges(TableGenerator.remainder(records)));
                break;
            default:
                throw new AssertionError(kind);
        }
    }

    private static Style parseStyle(String style)
    {
        try
        {
            return Style.valueOf(style);
        }
        catch (IllegalArgumentException e)
        {
            throw new IllegalArgumentException("Unrecognized style '" + style + "'");
        }
    }

    private static void section(PrintStream out, String title, char[] words, Style style, boolean first)
    {
        if (!first)
            out.print('\n');
        out.print(title + ":\n\n");
        out.print(TableFormatter.format(words, style));
    }
}
