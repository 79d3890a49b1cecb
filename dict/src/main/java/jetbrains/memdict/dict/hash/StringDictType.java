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
package jetbrains.memdict.dict.hash;

import jetbrains.memdict.dict.DictType;
import org.jetbrains.annotations.NotNull;

/**
 * {@linkplain DictType} of string keys hashed by SipHash-2-4 of their UTF-8 representation.
 */
public class StringDictType<V> implements DictType<String, V> {

    @NotNull
    protected final DictHashing hashing;

    public StringDictType(@NotNull final DictHashing hashing) {
        this.hashing = hashing;
    }

    @Override
    public long hash(@NotNull final String key) {
        return hashing.hash(key);
    }

    @Override
    public boolean keyCompare(@NotNull final String key1, @NotNull final String key2) {
        return key1.equals(key2);
    }
}
