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

import org.jetbrains.annotations.Nullable;

/**
 * Power of two sized array of chain heads. An array created with the no-arg constructor is not allocated,
 * it has no buckets.
 */
final class BucketArray<K, V> {

    @Nullable
    final DictEntryImpl<K, V>[] buckets;
    final int size;
    final long mask;
    long used;

    BucketArray() {
        buckets = null;
        size = 0;
        mask = 0;
    }

    @SuppressWarnings("unchecked")
    BucketArray(final int size) {
        buckets = new DictEntryImpl[size];
        this.size = size;
        mask = size - 1;
    }

    boolean isAllocated() {
        return buckets != null;
    }

    int indexFor(final long hash) {
        return (int) (hash & mask);
    }

    @Nullable
    DictEntryImpl<K, V> get(final int index) {
        //noinspection ConstantConditions
        return buckets[index];
    }

    /**
     * Inserts the entry at the top of the chain as recently added entries are more likely to be accessed.
     */
    void prepend(final DictEntryImpl<K, V> entry, final int index) {
        //noinspection ConstantConditions
        entry.next = buckets[index];
        buckets[index] = entry;
        ++used;
    }

    /**
     * Takes the entry out of its chain.
     *
     * @param prev predecessor of the entry in the chain, {@code null} if the entry is the head
     */
    void unlink(final int index, @Nullable final DictEntryImpl<K, V> prev, final DictEntryImpl<K, V> entry) {
        if (prev == null) {
            //noinspection ConstantConditions
            buckets[index] = entry.next;
        } else {
            prev.next = entry.next;
        }
        entry.next = null;
        --used;
    }

    int chainLength(final int index) {
        int result = 0;
        for (DictEntryImpl<K, V> e = get(index); e != null; e = e.next) {
            ++result;
        }
        return result;
    }

    long identity() {
        return buckets == null ? 0 : System.identityHashCode(buckets);
    }
}
