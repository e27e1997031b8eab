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

import java.io.PrintStream;

import io.airlift.airline.Arguments;
import io.airlift.airline.Command;

import org.ucdtrie.config.DataTableStore;
import org.ucdtrie.db.TableId;
import org.ucdtrie.io.util.Base64Words;
import org.ucdtrie.tools.TableFormatter;
import org.ucdtrie.tools.UcdToolException;

@Command(name = "dump", description = "Print a table of the configured store in pretty form")
public class Dump extends UcdCommand
{
    @Arguments(usage = "<table>", description = "The table property name (case.lower, gcat.core...) or numeric key", required = true)
    private String table;

    @Override
    protected void execute(PrintStream out)
    {
        TableId id = parseTable(table);
        String encoded = DataTableStore.create().fetch(id);
        if (encoded == null)
            throw new UcdToolException("Table " + id.property() + " is not available");

        char[] words = Base64Words.decode(encoded);
        out.printf("%s (%d), %d words:%n%n", id.property(), id.key(), words.length);
        out.print(TableFormatter.pretty(words));
    }

    static TableId parseTable(String name)
    {
        TableId id = TableId.fromProperty(name);
        if (id == null && name.matches("\\d{1,9}"))
            id = TableId.fromKey(Integer.parseInt(name));
        if (id == null)
            throw new IllegalArgumentException("Unknown table '" + name + "'");
        return id;
    }
}
