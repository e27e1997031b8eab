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

import org.ucdtrie.db.CaseFolding;
import org.ucdtrie.service.UnicodeService;

import static com.google.common.base.Preconditions.checkArgument;

@Command(name = "fold", description = "Print the full case folding of a codepoint")
public class Fold extends UcdCommand
{
    @Arguments(usage = "<U+XXXX>", description = "The codepoint to fold", required = true)
    private String codepoint;

    @Override
    protected void execute(PrintStream out)
    {
        int cv = parseCodepoint(codepoint);
        checkArgument(UnicodeService.isValidCodepoint(cv), "Codepoint out of range: %s", codepoint);

        ensureInitialized();
        CaseFolding folding = UnicodeService.foldCase(cv);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < folding.length(); i++)
        {
            if (i > 0)
                sb.append(' ');
            sb.append(String.format("U+%04x", folding.codepoint(i)));
        }
        out.println(sb);
    }
}
