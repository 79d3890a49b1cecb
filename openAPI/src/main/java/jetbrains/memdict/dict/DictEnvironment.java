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

import java.util.List;

/**
 * Pool of {@linkplain Dict tables} sharing the {@linkplain DictConfig configuration}: resize mode, force resize
 * ratio, minimum capacity and the seed of the keyed hash function. Environments are independent of each other.
 *
 * @see DictConfig
 */
public interface DictEnvironment extends AutoCloseable {

    @NotNull
    DictConfig getConfig();

    @NotNull
    <K, V> Dict<K, V> openDict(@NotNull DictType<K, V> type);

    @NotNull
    List<Dict<?, ?>> getOpenDicts();

    @NotNull
    ResizeMode getResizeMode();

    void setResizeMode(@NotNull ResizeMode mode);

    /**
     * @return copy of the 128-bit hash seed
     */
    @NotNull
    byte[] getHashSeed();

    /**
     * @throws jetbrains.memdict.InvalidSettingException if the environment has open tables
     */
    void setHashSeed(@NotNull byte[] seed);

    /**
     * Spends up to {@code ms} milliseconds rehashing open tables which are in the middle of a rehash.
     *
     * @return number of rehash steps performed
     */
    int rehashMilliseconds(int ms);

    boolean isOpen();

    /**
     * Releases all open tables.
     */
    @Override
    void close();
}
