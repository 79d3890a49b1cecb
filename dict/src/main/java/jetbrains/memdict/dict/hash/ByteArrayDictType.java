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

import java.util.Arrays;

/**
 * {@linkplain DictType} of byte array keys compared by contents. Keys are copied on insertion, so callers
 * can reuse their buffers.
 */
public class ByteArrayDictType<V> implements DictType<byte[], V> {

    @NotNull
    private final DictHashing hashing;
    private final boolean trustedKeys;

    public ByteArrayDictType(@NotNull final DictHashing hashing) {
        this(hashing, false);
    }

    /**
     * @param trustedKeys if {@code true} keys are hashed by XXH64 rather than by SipHash-2-4
     */
    public ByteArrayDictType(@NotNull final DictHashing hashing, final boolean trustedKeys) {
        this.hashing = hashing;
        this.trustedKeys = trustedKeys;
    }

    @Override
    public long hash(@NotNull final byte[] key) {
        return trustedKeys ? hashing.xxHash(key) : hashing.hash(key);
    }

    @Override
    public boolean keyCompare(@NotNull final byte[] key1, @NotNull final byte[] key2) {
        return Arrays.equals(key1, key2);
    }

    @NotNull
    @Override
    public byte[] keyDup(@NotNull final byte[] key) {
        return Arrays.copyOf(key, key.length);
    }
}
