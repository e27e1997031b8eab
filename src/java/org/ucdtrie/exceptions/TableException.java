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
 * Base class of the errors that signal a corrupted table artifact or a programming defect.
 *
 * None of these are recoverable. They are routed through
 * {@link org.ucdtrie.utils.UnicodeStabilityInspector} to the installed
 * {@link org.ucdtrie.utils.FatalErrorHandler} and are always rethrown afterwards.
 */
public abstract class TableException extends RuntimeException
{
    protected TableException(String msg)
    {
        super(msg);
    }

    protected TableException(String msg, Throwable cause)
    {
        super(msg, cause);
    }
}
