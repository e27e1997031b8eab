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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.annotations.VisibleForTesting;

import org.ucdtrie.service.UnicodeService;
import org.ucdtrie.service.UnicodeTables;
import org.ucdtrie.tools.UcdToolException;
import org.ucdtrie.tools.ucd.UcdParseException;

/**
 * Base of the {@code ucdtool} commands.
 */
public abstract class UcdCommand implements Runnable
{
    private static final Pattern CODEPOINT = Pattern.compile("^[Uu]\\+([0-9A-Fa-f]{1,6})$");

    private PrintStream out = System.out;

    @Override
    public void run()
    {
        try
        {
            execute(out);
        }
        catch (IOException e)
        {
            throw new UcdToolException("I/O error: " + e.getMessage(), e);
        }
        catch (UcdParseException e)
        {
            throw new UcdToolException(e.getMessage(), e);
        }
    }

    protected abstract void execute(PrintStream out) throws IOException, UcdParseException;

    @VisibleForTesting
    public UcdCommand withOutput(PrintStream out)
    {
        this.out = out;
        return this;
    }

    /**
     * Parses {@code U+XXXX} (or {@code u+xxxx}), 1 to 6 hex digits, into a codepoint of at most U+10FFFF.
     *
     * @throws IllegalArgumentException if the argument is malformed or out of range
     */
    public static int parseCodepoint(String arg)
    {
        Matcher m = CODEPOINT.matcher(arg == null ? "" : arg);
        if (!m.matches())
            throw new IllegalArgumentException("Invalid codepoint parameter: " + arg);
        int cv = Integer.parseInt(m.group(1), 16);
        if (cv > UnicodeTables.MAX_CODEPOINT)
            throw new IllegalArgumentException("Codepoint parameter out of range: " + arg);
        return cv;
    }

    /**
     * Initializes the service from the configured table store, unless done already.
     */
    static void ensureInitialized()
    {
        UnicodeService.ensureInitialized();
    }
}
