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

import org.ucdtrie.db.GeneralCategory;
import org.ucdtrie.service.UnicodeService;

@Command(name = "category", description = "Print the general category of a codepoint")
public class Category extends UcdCommand
{
    @Arguments(usage = "<U+XXXX>", description = "The codepoint to classify", required = true)
    private String codepoint;

    @Override
    protected void execute(PrintStream out)
    {
        int cv = parseCodepoint(codepoint);
        ensureInitialized();
        GeneralCategory category = UnicodeService.category(cv);
        out.printf("%s (%s)%n", category.abbreviation(), category.description());
    }
}
