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
package org.ucdtrie.utils;

import org.ucdtrie.exceptions.TableException;

/**
 * Receives the fatal table errors, for diagnostics.
 *
 * A handler may log, record or terminate the JVM, but it cannot resume normal execution: once it returns, the error
 * is rethrown to the caller of the failing operation.
 */
public interface FatalErrorHandler
{
    /**
     * @param error the error that occurred
     */
    void handleFatalError(TableException error);
}
