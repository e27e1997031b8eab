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
package org.ucdtrie.config;

import javax.annotation.Nullable;

import org.ucdtrie.db.TableId;
import org.ucdtrie.exceptions.ConfigurationException;

/**
 * Supplies the base64 encoded data tables.
 */
public interface DataTableStore
{
    /**
     * Creates the store named by the {@code ucdtrie.table_store} system property. When the property is not set, a
     * {@link ResourceDataTableStore} over the bundled tables is returned.
     *
     * @throws ConfigurationException if the named class cannot be constructed.
     */
    public static DataTableStore create() throws ConfigurationException
    {
        String storeClass = UcdConfig.getTableStoreClass();
        return storeClass == null ? new ResourceDataTableStore(UcdConfig.getTableResource())
                                  : construct(storeClass);
    }

    /**
     * Returns the base64 string of a table, or {@code null} if this store does not know the table.
     */
    @Nullable
    String fetch(TableId id);

    static DataTableStore construct(String className) throws ConfigurationException
    {
        try
        {
            Class<?> cls = Class.forName(className);
            if (!DataTableStore.class.isAssignableFrom(cls))
                throw new ConfigurationException(String.format("Table store class %s does not implement %s", className, DataTableStore.class.getName()));
            return (DataTableStore) cls.getConstructor().newInstance();
        }
        catch (ClassNotFoundException e)
        {
            throw new ConfigurationException(String.format("Unable to find table store class '%s'", className), e);
        }
        catch (ReflectiveOperationException e)
        {
            throw new ConfigurationException(String.format("Unable to instantiate table store class '%s'", className), e);
        }
    }
}
