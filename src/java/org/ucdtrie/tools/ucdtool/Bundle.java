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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import io.airlift.airline.Arguments;
import io.airlift.airline.Command;
import io.airlift.airline.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.ucdtrie.db.TableId;
import org.ucdtrie.tools.TableFormatter;
import org.ucdtrie.tools.TableGenerator;
import org.ucdtrie.tools.ucd.CaseFoldingReader;
import org.ucdtrie.tools.ucd.UcdParseException;
import org.ucdtrie.tools.ucd.UnicodeDataReader;

import static com.google.common.base.Preconditions.checkArgument;

@Command(name = "bundle", description = "Generate the properties resource holding every table")
public class Bundle extends UcdCommand
{
    private static final Logger logger = LoggerFactory.getLogger(Bundle.class);

    @Arguments(usage = "<UnicodeData.txt> <CaseFolding.txt>", description = "The UCD files to build the tables from", required = true)
    private List<String> args = new ArrayList<>();

    @Option(name = { "-o", "--output" }, description = "File to write to instead of the standard output")
    private String output;

    @Option(name = "--ucd-version", description = "Unicode version recorded in the header")
    private String ucdVersion = "unknown";

    @Override
    protected void execute(PrintStream out) throws IOException, UcdParseException
    {
        checkArgument(args.size() == 2, "bundle requires <UnicodeData.txt> <CaseFolding.txt>");

        Map<TableId, char[]> tables = TableGenerator.bundle(UnicodeDataReader.readAll(Paths.get(args.get(0))),
                                                            CaseFoldingReader.readAll(Paths.get(args.get(1))));
        String header = String.format("Unicode General Category and case folding tables.%n" +
                                      "Generated by ucdtool bundle from Unicode Character Database %s.", ucdVersion);
        String bundle = TableFormatter.bundle(tables, header);

        if (output == null)
        {
            out.print(bundle);
        }
        else
        {
            Files.write(Paths.get(output), bundle.getBytes(StandardCharsets.US_ASCII));
            logger.info("Wrote {} tables to {}", tables.size(), output);
        }
    }
}
