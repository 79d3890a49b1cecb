/*
 * Copyright 2010 - 2023 JetBrains s.r.o.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package jetbrains.memdict.dict;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Set of capabilities parameterizing a {@linkplain Dict}: how keys are hashed and compared, how keys and
 * values are copied on insertion and released on removal, and whether a table may allocate a larger
 * bucket array. Only {@linkplain #hash(Object)} is mandatory.
 *
 * @param <K> key type
 * @param <V> value type
 * @see DictEnvironment#openDict(DictType)
 */
public interface DictType<K, V> {

    /**
     * @param key key
     * @return 64-bit hash of the key, the table addresses buckets by its lowest bits
     */
    long hash(@NotNull K key);

    /**
     * Compares keys which are not the same reference.
     */
    default boolean keyCompare(@NotNull K key1, @NotNull K key2) {
        return key1.equals(key2);
    }

    /**
     * Returns the key actually stored by the table for a newly inserted one.
     */
    @NotNull
    default K keyDup(@NotNull K key) {
        return key;
    }

    /**
     * Returns the value actually stored by the table when a value is set.
     */
    @Nullable
    default V valDup(@Nullable V value) {
        return value;
    }

    default void keyDestructor(@NotNull K key) {
    }

    default void valDestructor(@Nullable V value) {
    }

    /**
     * Is called before a table grows automatically.
     *
     * @param moreMem   approximate number of bytes of the bucket array to be allocated
     * @param usedRatio current load factor, number of entries divided by number of buckets
     * @return {@code false} to veto the growth
     */
    default boolean expandAllowed(long moreMem, double usedRatio) {
        return true;
    }
}
