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

import java.util.List;

/**
 * Chained hash table with power of two sized bucket arrays which grows incrementally: when it needs more buckets
 * it allocates a second array and moves entries to it bucket by bucket, one step per lookup or update, so no
 * single call pays for the whole rehash.
 *
 * <p>A {@code Dict} is not thread-safe, it assumes a single mutator. Absence of a key and rejected resizes are
 * reported by return values rather than by exceptions.
 *
 * @param <K> key type
 * @param <V> value type
 * @see DictEnvironment#openDict(DictType)
 */
public interface Dict<K, V> {

    @NotNull
    DictEnvironment getEnvironment();

    @NotNull
    DictType<K, V> getType();

    /**
     * @return number of entries in both bucket arrays
     */
    long size();

    /**
     * @return total number of buckets of both bucket arrays
     */
    long slots();

    /**
     * @param table {@code 0} for the active bucket array, {@code 1} for the incoming one
     * @return number of buckets of the array, {@code 0} if it's not allocated
     */
    long capacity(int table);

    boolean isRehashing();

    /**
     * @return index of the next bucket of the active array to be moved, {@code -1} if not rehashing
     */
    long getRehashIndex();

    int getPauseCount();

    // core operations

    /**
     * @return {@code false} if the key already exists
     */
    boolean add(@NotNull K key, @Nullable V value);

    /**
     * Adds an entry without a value. The caller sets the value using {@linkplain #setValue(DictEntry, Object)}.
     *
     * @return the new entry, or {@code null} if the key already exists
     */
    @Nullable
    DictEntry<K, V> addRaw(@NotNull K key);

    /**
     * @return the new entry if the key didn't exist, otherwise the existing entry
     */
    @NotNull
    DictEntry<K, V> addOrFind(@NotNull K key);

    /**
     * Adds the entry or overwrites the value of the existing one. The new value is set before the old one
     * is destroyed since they can be the same reference.
     *
     * @return {@code true} if the key was added, {@code false} if the value was overwritten
     */
    boolean replace(@NotNull K key, @Nullable V value);

    void setValue(@NotNull DictEntry<K, V> entry, @Nullable V value);

    @Nullable
    DictEntry<K, V> find(@NotNull K key);

    @Nullable
    V fetchValue(@NotNull K key);

    /**
     * Removes the entry and invokes key and value destructors.
     *
     * @return {@code false} if the key was not found
     */
    boolean delete(@NotNull K key);

    /**
     * Removes the entry from the table without destroying it, so that it can be used before the caller
     * releases it with {@linkplain #freeUnlinkedEntry(DictEntry)}.
     *
     * @return the removed entry, or {@code null} if the key was not found
     */
    @Nullable
    DictEntry<K, V> unlink(@NotNull K key);

    void freeUnlinkedEntry(@Nullable DictEntry<K, V> entry);

    /**
     * @return hash of the key computed by the {@linkplain DictType}
     */
    long getHash(@NotNull K key);

    /**
     * Finds the entry which references exactly the specified key object, the key is not compared to others
     * by value and is not even hashed.
     *
     * @param key  key reference stored in the table
     * @param hash hash of the key obtained by {@linkplain #getHash(Object)}
     */
    @Nullable
    DictEntry<K, V> findByKeyIdentity(@NotNull Object key, long hash);

    // resizing

    /**
     * Creates or grows the table so that it has at least {@code size} buckets. The table is rehashed incrementally
     * unless it is the first allocation.
     *
     * @return {@code false} if the table is rehashing, rehashing is paused on an allocated table, {@code size} is
     * less than the number of entries, the size is too large or the table already has the same number of buckets
     * @throws OutOfMemoryError if the bucket array can't be allocated
     */
    boolean expand(long size);

    /**
     * The same as {@linkplain #expand(long)}, but failure to allocate the bucket array is reported by
     * returning {@code false}.
     */
    boolean tryExpand(long size);

    /**
     * Shrinks the table to the minimal number of buckets holding all entries with the load factor not greater
     * than 1. Allowed only in {@linkplain ResizeMode#ENABLED} mode.
     *
     * @return {@code false} if the resize was rejected, e.g. the table is rehashing or rehashing is paused
     */
    boolean resize();

    /**
     * Performs {@code n} steps of incremental rehashing. A step moves a whole bucket to the incoming array.
     * The call can return after visiting a bounded number of empty buckets without moving anything.
     * Does nothing while rehashing is paused.
     *
     * @return {@code true} if there are still entries to move, {@code false} if the table is not rehashing
     * or the {@linkplain ResizeMode resize mode} doesn't allow to move entries
     */
    boolean rehash(int n);

    /**
     * Rehashes in batches until the rehash completes or {@code ms} milliseconds elapse.
     *
     * @return number of steps performed
     */
    int rehashMilliseconds(int ms);

    void pauseRehashing();

    void resumeRehashing();

    // iteration

    /**
     * @return unsafe iterator
     */
    @NotNull
    DictIterator<K, V> iterator();

    @NotNull
    DictIterator<K, V> safeIterator();

    /**
     * Visits all entries of the bucket(s) addressed by the cursor. Start with cursor {@code 0} and pass
     * the returned value to the next call until it returns {@code 0}. Every entry present during the whole
     * scan is visited at least once even if the table is resized between calls, some entries can be
     * visited more than once.
     *
     * @return next cursor
     */
    long scan(long cursor, @NotNull DictScanFunction<K, V> fn);

    // random sampling

    /**
     * @return entry from a random non-empty bucket, or {@code null} if the table is empty
     */
    @Nullable
    DictEntry<K, V> randomEntry();

    /**
     * Collects up to {@code count} entries from consecutive buckets starting at a random position. It's much
     * faster than calling {@linkplain #randomEntry()} {@code count} times, but can return fewer entries, and
     * entries are not distributed uniformly.
     */
    @NotNull
    List<DictEntry<K, V>> sampleEntries(int count);

    /**
     * Random entry with better distribution than {@linkplain #randomEntry()} has for tables with chains of
     * different lengths.
     */
    @Nullable
    DictEntry<K, V> fairRandomEntry();

    // the rest

    /**
     * Removes all entries invoking destructors.
     *
     * @param callback if not {@code null}, is invoked periodically while buckets are being cleared
     */
    void clear(@Nullable Runnable callback);

    /**
     * Clears the table and removes it from the environment.
     */
    void release();

    /**
     * @return checksum of identities, sizes and numbers of entries of both bucket arrays
     */
    long fingerprint();

    @NotNull
    DictStatistics getStatistics();
}
