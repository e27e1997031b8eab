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
package org.ucdtrie.exceptions;

/**
 * Thrown when a caller passes a value that is not a valid Unicode scalar value to an operation that requires one.
 * Callers are expected to avoid this by checking {@code UnicodeService.isValidCodepoint} first.
 */
public class InvalidCodepointException extends IllegalArgumentException
{
    private final int codepoint;

    public InvalidCodepointException(int codepoint)
    {
        super(String.format("Invalid codepoint 0x%X", codepoint));
        this.codepoint = codepoint;
    }

    public int codepoint()
    {
        return codepoint;
    }
}
