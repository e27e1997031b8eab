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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Throwables;
import io.airlift.airline.Cli;
import io.airlift.airline.Help;
import io.airlift.airline.ParseException;

import org.ucdtrie.exceptions.TableException;
import org.ucdtrie.tools.ucdtool.Bundle;
import org.ucdtrie.tools.ucdtool.Category;
import org.ucdtrie.tools.ucdtool.Dump;
import org.ucdtrie.tools.ucdtool.Fold;
import org.ucdtrie.tools.ucdtool.Generate;

/**
 * Command line tool to generate the tables from the Unicode Character Database and to query them.
 */
public class UcdTool
{
    private static final String TOOL_NAME = "ucdtool";
    private static final String LOGBACK_CONFIGURATION = "logback.configurationFile";

    public static void main(String... args)
    {
        if (System.getProperty(LOGBACK_CONFIGURATION) == null)
            System.setProperty(LOGBACK_CONFIGURATION, "logback-tools.xml");

        System.exit(execute(args));
    }

    /**
     * Runs a command line and returns the exit status: 0 on success, 1 for bad usage or an expected error, 2 for an
     * unexpected one.
     */
    @VisibleForTesting
    static int execute(String... args)
    {
        Runnable runnable;
        try
        {
            runnable = createCli().parse(args);
        }
        catch (ParseException e)
        {
            printBadUse(e);
            return 1;
        }
        catch (Throwable t)
        {
            printUnexpectedError(Throwables.getRootCause(t));
            return 2;
        }

        try
        {
            runnable.run();
            return 0;
        }
        catch (UcdToolException | IllegalArgumentException | TableException e)
        {
            printExpectedError(e);
            return 1;
        }
        catch (Throwable t)
        {
            printUnexpectedError(t);
            return 2;
        }
    }

    @VisibleForTesting
    static Cli<Runnable> createCli()
    {
        Cli.CliBuilder<Runnable> builder = Cli.builder(TOOL_NAME);

        builder.withDescription("Generate and query compact Unicode tables")
               .withDefaultCommand(Help.class)
               .withCommand(Help.class)
               .withCommand(Generate.class)
               .withCommand(Bundle.class)
               .withCommand(Fold.class)
               .withCommand(Category.class)
               .withCommand(Dump.class);

        return builder.build();
    }

    private static void printBadUse(ParseException e)
    {
        System.err.printf("%s: %s%n", TOOL_NAME, e.getMessage());
        System.err.printf("See '%s help' or '%s help <command>'.%n", TOOL_NAME, TOOL_NAME);
    }

    private static void printExpectedError(Throwable e)
    {
        System.err.println("error: " + e.getMessage());
    }

    private static void printUnexpectedError(Throwable e)
    {
        System.err.printf("Unexpected error: %s (this indicates a bug)%n", e.getMessage());
        System.err.println("-- StackTrace --");
        e.printStackTrace();
    }
}
