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

final class DictEntryImpl<K, V> implements DictEntry<K, V> {

    @NotNull
    final K key;
    @Nullable
    V value;
    // next entry of the same bucket, the entry is referenced either by the bucket or by its predecessor
    @Nullable
    DictEntryImpl<K, V> next;

    DictEntryImpl(@NotNull final K key) {
        this.key = key;
    }

    @NotNull
    @Override
    public K getKey() {
        return key;
    }

    @Nullable
    @Override
    public V getValue() {
        return value;
    }

    @Override
    public String toString() {
        return key + "=" + value;
    }
}
