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

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import jetbrains.memdict.InvalidSettingException;
import jetbrains.memdict.dict.DictConfig;
import jetbrains.memdict.dict.DictEnvironment;
import jetbrains.memdict.dict.DictEnvironmentImpl;
import net.jpountz.xxhash.XXHash64;
import net.jpountz.xxhash.XXHashFactory;
import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Keyed hash functions seeded by the 128-bit seed of a {@linkplain DictEnvironment}. SipHash-2-4 is the default
 * one since it makes hash flooding with crafted keys impractical without knowledge of the seed. XXH64 is faster
 * but should be used only for keys which can't be chosen by an adversary.
 */
public final class DictHashing {

    private static final XXHash64 xxHash = XXHashFactory.fastestInstance().hash64();

    private final long k0;
    private final long k1;
    @NotNull
    private final HashFunction sipHash;

    public DictHashing(@NotNull final byte[] seed) {
        if (seed.length != DictConfig.HASH_SEED_LENGTH) {
            throw new InvalidSettingException("Hash seed should be " + DictConfig.HASH_SEED_LENGTH + " bytes long: " + seed.length);
        }
        final ByteBuffer buffer = ByteBuffer.wrap(seed).order(ByteOrder.LITTLE_ENDIAN);
        k0 = buffer.getLong();
        k1 = buffer.getLong();
        sipHash = Hashing.sipHash24(k0, k1);
    }

    @NotNull
    public static DictHashing of(@NotNull final DictEnvironment env) {
        if (env instanceof DictEnvironmentImpl) {
            return ((DictEnvironmentImpl) env).getHashing();
        }
        return new DictHashing(env.getHashSeed());
    }

    public long hash(@NotNull final byte[] bytes) {
        return hash(bytes, 0, bytes.length);
    }

    public long hash(@NotNull final byte[] bytes, final int offset, final int length) {
        return sipHash.hashBytes(bytes, offset, length).asLong();
    }

    public long hash(@NotNull final CharSequence s) {
        return sipHash.hashString(s, StandardCharsets.UTF_8).asLong();
    }

    /**
     * SipHash-2-4 of the bytes with ASCII letters folded to lower case.
     */
    public long hashCaseInsensitive(@NotNull final byte[] bytes) {
        final byte[] folded = new byte[bytes.length];
        for (int i = 0; i < bytes.length; ++i) {
            final byte b = bytes[i];
            folded[i] = (b >= 'A' && b <= 'Z') ? (byte) (b + ('a' - 'A')) : b;
        }
        return hash(folded);
    }

    public long hashCaseInsensitive(@NotNull final CharSequence s) {
        return hashCaseInsensitive(s.toString().getBytes(StandardCharsets.UTF_8));
    }

    public long xxHash(@NotNull final byte[] bytes) {
        return xxHash(bytes, 0, bytes.length);
    }

    public long xxHash(@NotNull final byte[] bytes, final int offset, final int length) {
        return xxHash.hash(bytes, offset, length, k0 ^ Long.rotateLeft(k1, 32));
    }
}
