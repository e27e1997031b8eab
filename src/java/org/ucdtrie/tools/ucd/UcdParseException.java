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

/**
 * Malformed Unicode Character Database input.
 */
public class UcdParseException extends Exception
{
    private final String source;
    private final int line;

    public UcdParseException(String source, int line, String msg)
    {
        super(String.format("%s:%d: %s", source, line, msg));
        this.source = source;
        this.line = line;
    }

    public String source()
    {
        return source;
    }

    /**
     * @return the 1-based line of the offending record, the last record of a range included
     */
    public int line()
    {
        return line;
    }
}
