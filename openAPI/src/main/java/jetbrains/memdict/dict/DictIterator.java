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

import java.util.Iterator;

/**
 * Iterator over entries of a {@linkplain Dict}: buckets of the active bucket array in increasing order,
 * then buckets of the incoming one if the table is rehashing, most recently inserted entries of a
 * bucket first. Must be closed.
 *
 * <p>A safe iterator pauses rehashing of the table until it is closed, so the table can be modified while
 * iterating and {@linkplain #remove()} is supported. An unsafe iterator only allows to call
 * {@linkplain Dict#find(Object)} and alike during iteration; structural modifications are detected on
 * {@linkplain #close()} which throws {@linkplain ConcurrentDictModificationException}.
 *
 * @see Dict#iterator()
 * @see Dict#safeIterator()
 */
public interface DictIterator<K, V> extends Iterator<DictEntry<K, V>>, AutoCloseable {

    boolean isSafe();

    @Override
    void close();
}
