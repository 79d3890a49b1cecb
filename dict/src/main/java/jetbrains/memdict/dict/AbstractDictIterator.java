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

import java.util.NoSuchElementException;

abstract class AbstractDictIterator<K, V> implements DictIterator<K, V> {

    @NotNull
    protected final DictImpl<K, V> dict;
    private int table;
    private int bucket;
    // next entry of the current chain, is saved before the current one is returned so that it can be deleted
    @Nullable
    private DictEntryImpl<K, V> nextEntry;
    @Nullable
    private DictEntryImpl<K, V> prefetched;
    @Nullable
    protected DictEntryImpl<K, V> lastReturned;
    private boolean isFinished;
    private boolean isClosed;

    protected AbstractDictIterator(@NotNull final DictImpl<K, V> dict) {
        this.dict = dict;
        bucket = -1;
    }

    @Override
    public boolean hasNext() {
        checkNotClosed();
        if (prefetched == null && !isFinished) {
            prefetched = advance();
            isFinished = prefetched == null;
        }
        return prefetched != null;
    }

    @Override
    public DictEntry<K, V> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        lastReturned = prefetched;
        prefetched = null;
        return lastReturned;
    }

    @Override
    public void close() {
        if (!isClosed) {
            isClosed = true;
            release();
        }
    }

    protected abstract void release();

    protected void checkNotClosed() {
        if (isClosed) {
            throw new IllegalStateException("Iterator is closed");
        }
    }

    @Nullable
    private DictEntryImpl<K, V> advance() {
        while (true) {
            final DictEntryImpl<K, V> current = nextEntry;
            if (current != null) {
                nextEntry = current.next;
                return current;
            }
            final BucketArray<K, V> ht = table == 0 ? dict.table0 : dict.table1;
            if (++bucket >= ht.size) {
                if (table == 0 && dict.isRehashing()) {
                    table = 1;
                    bucket = -1;
                    continue;
                }
                return null;
            }
            nextEntry = ht.get(bucket);
        }
    }
}
