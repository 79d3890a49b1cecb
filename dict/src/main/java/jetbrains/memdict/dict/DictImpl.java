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

import jetbrains.memdict.util.MathUtil;
import jetbrains.memdict.util.Random;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public class DictImpl<K, V> implements Dict<K, V> {

    private static final Logger logger = LoggerFactory.getLogger(DictImpl.class);

    static final int MAX_CAPACITY = 1 << 30;
    static final int NOT_REHASHING = -1;
    private static final int BUCKET_REFERENCE_SIZE = 8;
    private static final int CLEAR_CALLBACK_PERIOD = 65536;
    private static final int FAIR_RANDOM_SAMPLE_SIZE = 15;
    private static final int SAMPLE_MIN_EMPTY_RUN = 5;

    @NotNull
    private final DictEnvironmentImpl env;
    @NotNull
    private final DictType<K, V> type;
    @NotNull
    private final ResizePolicy policy;
    @NotNull
    private final Random random;
    @NotNull
    BucketArray<K, V> table0;
    @NotNull
    BucketArray<K, V> table1;
    // buckets of table0 with indices less than rehashIndex are empty
    int rehashIndex;
    private int pauseCount;

    DictImpl(@NotNull final DictEnvironmentImpl env, @NotNull final DictType<K, V> type) {
        this.env = env;
        this.type = type;
        policy = env.getResizePolicy();
        random = env.getRandom();
        table0 = new BucketArray<>();
        table1 = new BucketArray<>();
        rehashIndex = NOT_REHASHING;
    }

    @NotNull
    @Override
    public DictEnvironment getEnvironment() {
        return env;
    }

    @NotNull
    @Override
    public DictType<K, V> getType() {
        return type;
    }

    @Override
    public long size() {
        return table0.used + table1.used;
    }

    @Override
    public long slots() {
        return table0.size + table1.size;
    }

    @Override
    public long capacity(final int table) {
        if (table < 0 || table > 1) {
            throw new IllegalArgumentException("Table should be 0 or 1: " + table);
        }
        return table == 0 ? table0.size : table1.size;
    }

    @Override
    public boolean isRehashing() {
        return rehashIndex != NOT_REHASHING;
    }

    @Override
    public long getRehashIndex() {
        return rehashIndex;
    }

    @Override
    public int getPauseCount() {
        return pauseCount;
    }

    @Override
    public boolean add(@NotNull final K key, @Nullable final V value) {
        final DictEntryImpl<K, V> entry = addRawEntry(key);
        if (entry == null) {
            return false;
        }
        entry.value = type.valDup(value);
        return true;
    }

    @Nullable
    @Override
    public DictEntry<K, V> addRaw(@NotNull final K key) {
        return addRawEntry(key);
    }

    @NotNull
    @Override
    public DictEntry<K, V> addOrFind(@NotNull final K key) {
        final long hash = prepareInsert(key);
        final DictEntryImpl<K, V> existing = findEntry(key, hash);
        return existing != null ? existing : insert(key, hash);
    }

    @Override
    public boolean replace(@NotNull final K key, @Nullable final V value) {
        final long hash = prepareInsert(key);
        final DictEntryImpl<K, V> existing = findEntry(key, hash);
        if (existing == null) {
            insert(key, hash).value = type.valDup(value);
            return true;
        }
        final V oldValue = existing.value;
        existing.value = type.valDup(value);
        type.valDestructor(oldValue);
        return false;
    }

    /**
     * Sets the value without destroying the previous one.
     */
    @Override
    public void setValue(@NotNull final DictEntry<K, V> entry, @Nullable final V value) {
        ((DictEntryImpl<K, V>) entry).value = type.valDup(value);
    }

    @Nullable
    @Override
    public DictEntry<K, V> find(@NotNull final K key) {
        checkKey(key);
        if (size() == 0) {
            return null;
        }
        if (isRehashing()) {
            rehashStep();
        }
        return findEntry(key, type.hash(key));
    }

    @Nullable
    @Override
    public V fetchValue(@NotNull final K key) {
        final DictEntry<K, V> entry = find(key);
        return entry == null ? null : entry.getValue();
    }

    @Override
    public boolean delete(@NotNull final K key) {
        return genericDelete(key, true) != null;
    }

    @Nullable
    @Override
    public DictEntry<K, V> unlink(@NotNull final K key) {
        return genericDelete(key, false);
    }

    @Override
    public void freeUnlinkedEntry(@Nullable final DictEntry<K, V> entry) {
        if (entry != null) {
            destroy((DictEntryImpl<K, V>) entry);
        }
    }

    @Override
    public long getHash(@NotNull final K key) {
        return type.hash(key);
    }

    @Nullable
    @Override
    public DictEntry<K, V> findByKeyIdentity(@NotNull final Object key, final long hash) {
        if (size() == 0) {
            return null;
        }
        for (int table = 0; table <= 1; ++table) {
            final BucketArray<K, V> ht = table == 0 ? table0 : table1;
            if (ht.isAllocated()) {
                for (DictEntryImpl<K, V> e = ht.get(ht.indexFor(hash)); e != null; e = e.next) {
                    if (e.key == key) {
                        return e;
                    }
                }
            }
            if (!isRehashing()) {
                break;
            }
        }
        return null;
    }

    @Override
    public boolean expand(final long size) {
        return expand(size, false);
    }

    @Override
    public boolean tryExpand(final long size) {
        return expand(size, true);
    }

    @Override
    public boolean resize() {
        if (!policy.allowsShrink() || isRehashing()) {
            return false;
        }
        return expand(Math.max(table0.used, policy.getMinCapacity()));
    }

    @Override
    public boolean rehash(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Number of rehash steps can't be negative: " + n);
        }
        if (!isRehashing()) {
            return false;
        }
        // no progress while paused, though work remains
        if (pauseCount > 0) {
            return true;
        }
        if (!policy.allowsRehash(table0.size, table1.size)) {
            return false;
        }
        long emptyVisits = (long) n * policy.getEmptyVisitsPerStep();
        while (n-- > 0 && table0.used != 0) {
            if (rehashIndex >= table0.size) {
                throw new IllegalStateException("Rehash index " + rehashIndex + " is out of table of size " + table0.size);
            }
            while (table0.get(rehashIndex) == null) {
                ++rehashIndex;
                if (--emptyVisits == 0) {
                    return true;
                }
            }
            moveBucket(rehashIndex++);
        }
        if (table0.used == 0) {
            completeRehash();
            return false;
        }
        return true;
    }

    @Override
    public int rehashMilliseconds(final int ms) {
        if (pauseCount > 0) {
            return 0;
        }
        final long started = System.currentTimeMillis();
        final int batchSize = policy.getRehashBatchSize();
        int rehashes = 0;
        while (rehash(batchSize)) {
            rehashes += batchSize;
            if (System.currentTimeMillis() - started > ms) {
                break;
            }
        }
        return rehashes;
    }

    @Override
    public void pauseRehashing() {
        ++pauseCount;
    }

    @Override
    public void resumeRehashing() {
        if (pauseCount <= 0) {
            throw new IllegalStateException("Rehashing is not paused");
        }
        --pauseCount;
    }

    @NotNull
    @Override
    public DictIterator<K, V> iterator() {
        return new UnsafeDictIterator<>(this);
    }

    @NotNull
    @Override
    public DictIterator<K, V> safeIterator() {
        return new SafeDictIterator<>(this);
    }

    @Override
    public long scan(long cursor, @NotNull final DictScanFunction<K, V> fn) {
        if (size() == 0) {
            return 0;
        }
        // the callback can look up the table, that must not move entries between the arrays
        pauseRehashing();
        try {
            if (!isRehashing()) {
                final long m0 = table0.mask;
                visitBucket(table0.get((int) (cursor & m0)), fn);
                return MathUtil.reverseIncrement(cursor, m0);
            }
            BucketArray<K, V> t0 = table0;
            BucketArray<K, V> t1 = table1;
            // t0 is the smaller one
            if (t0.size > t1.size) {
                t0 = table1;
                t1 = table0;
            }
            final long m0 = t0.mask;
            final long m1 = t1.mask;
            visitBucket(t0.get((int) (cursor & m0)), fn);
            // visit all buckets of the larger array which are expansions of the cursor in the smaller one
            do {
                visitBucket(t1.get((int) (cursor & m1)), fn);
                cursor = MathUtil.reverseIncrement(cursor, m1);
            } while ((cursor & (m0 ^ m1)) != 0);
            return cursor;
        } finally {
            resumeRehashing();
        }
    }

    @Nullable
    @Override
    public DictEntry<K, V> randomEntry() {
        if (size() == 0) {
            return null;
        }
        if (isRehashing()) {
            rehashStep();
        }
        DictEntryImpl<K, V> head;
        if (isRehashing()) {
            final long size0 = table0.size;
            final long candidates = slots() - rehashIndex;
            do {
                final long h = rehashIndex + random.nextLong(candidates);
                head = h >= size0 ? table1.get((int) (h - size0)) : table0.get((int) h);
            } while (head == null);
        } else {
            do {
                head = table0.get(table0.indexFor(random.nextLong()));
            } while (head == null);
        }
        int chainLength = 0;
        for (DictEntryImpl<K, V> e = head; e != null; e = e.next) {
            ++chainLength;
        }
        int position = random.nextInt(chainLength);
        while (position-- > 0) {
            head = head.next;
        }
        return head;
    }

    @NotNull
    @Override
    public List<DictEntry<K, V>> sampleEntries(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Number of sampled entries can't be negative: " + count);
        }
        if (size() < count) {
            count = (int) size();
        }
        final List<DictEntry<K, V>> result = new ArrayList<>(count);
        if (count == 0) {
            return result;
        }
        // rehashing work proportional to the sample size
        for (int j = 0; j < count && isRehashing(); ++j) {
            rehashStep();
        }
        final int tables = isRehashing() ? 2 : 1;
        long maxSizeMask = table0.mask;
        if (tables > 1 && maxSizeMask < table1.mask) {
            maxSizeMask = table1.mask;
        }
        long maxSteps = (long) count * 10;
        long i = random.nextLong() & maxSizeMask;
        long emptyLength = 0;
        while (result.size() < count && maxSteps-- > 0) {
            for (int j = 0; j < tables; ++j) {
                if (tables == 2 && j == 0 && i < rehashIndex) {
                    // table0 is empty below the rehash index, and so are both arrays if i is out of table1
                    if (i >= table1.size) {
                        i = rehashIndex;
                    } else {
                        continue;
                    }
                }
                final BucketArray<K, V> ht = j == 0 ? table0 : table1;
                if (i >= ht.size) {
                    continue;
                }
                DictEntryImpl<K, V> e = ht.get((int) i);
                if (e == null) {
                    ++emptyLength;
                    if (emptyLength >= SAMPLE_MIN_EMPTY_RUN && emptyLength > count) {
                        i = random.nextLong() & maxSizeMask;
                        emptyLength = 0;
                    }
                } else {
                    emptyLength = 0;
                    while (e != null) {
                        result.add(e);
                        if (result.size() == count) {
                            return result;
                        }
                        e = e.next;
                    }
                }
            }
            i = (i + 1) & maxSizeMask;
        }
        return result;
    }

    @Nullable
    @Override
    public DictEntry<K, V> fairRandomEntry() {
        final List<DictEntry<K, V>> entries = sampleEntries(FAIR_RANDOM_SAMPLE_SIZE);
        // sampling can be unlucky even if the table isn't empty
        if (entries.isEmpty()) {
            return randomEntry();
        }
        return entries.get(random.nextInt(entries.size()));
    }

    @Override
    public void clear(@Nullable final Runnable callback) {
        clearTable(table0, callback);
        clearTable(table1, callback);
        table0 = new BucketArray<>();
        table1 = new BucketArray<>();
        rehashIndex = NOT_REHASHING;
        pauseCount = 0;
    }

    @Override
    public void release() {
        clear(null);
        env.dictReleased(this);
    }

    /**
     * Combines identities, sizes and numbers of entries of both arrays using Thomas Wang's 64-bit integer hash
     * so that the same numbers in a different order produce a different fingerprint.
     */
    @Override
    public long fingerprint() {
        final long[] integers = {
            table0.identity(), table0.size, table0.used,
            table1.identity(), table1.size, table1.used
        };
        long hash = 0;
        for (final long integer : integers) {
            hash += integer;
            hash = (~hash) + (hash << 21);
            hash = hash ^ (hash >>> 24);
            hash = (hash + (hash << 3)) + (hash << 8);
            hash = hash ^ (hash >>> 14);
            hash = (hash + (hash << 2)) + (hash << 4);
            hash = hash ^ (hash >>> 28);
            hash = hash + (hash << 31);
        }
        return hash;
    }

    @NotNull
    @Override
    public DictStatistics getStatistics() {
        final List<DictStatistics.TableStatistics> tables = new ArrayList<>(2);
        tables.add(getTableStatistics(table0, 0));
        if (isRehashing()) {
            tables.add(getTableStatistics(table1, 1));
        }
        return new DictStatistics(tables);
    }

    @Override
    public String toString() {
        return "Dict{size=" + size() + ", slots=" + slots() + ", rehashIndex=" + rehashIndex + '}';
    }

    @Nullable
    private DictEntryImpl<K, V> addRawEntry(@NotNull final K key) {
        final long hash = prepareInsert(key);
        if (findEntry(key, hash) != null) {
            return null;
        }
        return insert(key, hash);
    }

    /**
     * Performs a rehash step and grows the table if needed.
     *
     * @return hash of the key
     */
    private long prepareInsert(@NotNull final K key) {
        checkKey(key);
        if (isRehashing()) {
            rehashStep();
        }
        final long hash = type.hash(key);
        expandIfNeeded();
        return hash;
    }

    /**
     * Inserts new entry to the array receiving entries, which is table1 while rehashing.
     */
    @NotNull
    private DictEntryImpl<K, V> insert(@NotNull final K key, final long hash) {
        final BucketArray<K, V> ht = isRehashing() ? table1 : table0;
        final DictEntryImpl<K, V> entry = new DictEntryImpl<>(type.keyDup(key));
        ht.prepend(entry, ht.indexFor(hash));
        return entry;
    }

    @Nullable
    private DictEntryImpl<K, V> findEntry(@NotNull final K key, final long hash) {
        final DictEntryImpl<K, V> result = findEntry(table0, key, hash);
        if (result != null || !isRehashing()) {
            return result;
        }
        return findEntry(table1, key, hash);
    }

    @Nullable
    private DictEntryImpl<K, V> findEntry(@NotNull final BucketArray<K, V> ht, @NotNull final K key, final long hash) {
        if (!ht.isAllocated()) {
            return null;
        }
        for (DictEntryImpl<K, V> e = ht.get(ht.indexFor(hash)); e != null; e = e.next) {
            final K entryKey = e.key;
            if (entryKey == key || type.keyCompare(key, entryKey)) {
                return e;
            }
        }
        return null;
    }

    @Nullable
    private DictEntryImpl<K, V> genericDelete(@NotNull final K key, final boolean free) {
        checkKey(key);
        if (size() == 0) {
            return null;
        }
        if (isRehashing()) {
            rehashStep();
        }
        final long hash = type.hash(key);
        for (int table = 0; table <= 1; ++table) {
            final BucketArray<K, V> ht = table == 0 ? table0 : table1;
            if (ht.isAllocated()) {
                final int index = ht.indexFor(hash);
                DictEntryImpl<K, V> prev = null;
                for (DictEntryImpl<K, V> e = ht.get(index); e != null; prev = e, e = e.next) {
                    final K entryKey = e.key;
                    if (entryKey == key || type.keyCompare(key, entryKey)) {
                        ht.unlink(index, prev, e);
                        if (free) {
                            destroy(e);
                        }
                        return e;
                    }
                }
            }
            if (!isRehashing()) {
                break;
            }
        }
        return null;
    }

    private void destroy(@NotNull final DictEntryImpl<K, V> entry) {
        type.keyDestructor(entry.key);
        type.valDestructor(entry.value);
    }

    private void rehashStep() {
        if (pauseCount == 0) {
            rehash(1);
        }
    }

    private void moveBucket(final int index) {
        DictEntryImpl<K, V> e = table0.get(index);
        while (e != null) {
            final DictEntryImpl<K, V> next = e.next;
            table1.prepend(e, table1.indexFor(type.hash(e.key)));
            --table0.used;
            e = next;
        }
        //noinspection ConstantConditions
        table0.buckets[index] = null;
    }

    private void completeRehash() {
        if (logger.isDebugEnabled()) {
            logger.debug("Rehashing to " + table1.size + " buckets completed, entries: " + table1.used);
        }
        table0 = table1;
        table1 = new BucketArray<>();
        rehashIndex = NOT_REHASHING;
    }

    private boolean expand(final long size, final boolean reportAllocationFailure) {
        if (isRehashing() || table0.used > size) {
            return false;
        }
        // while paused, only an empty table can get its first bucket array
        if (pauseCount > 0 && table0.isAllocated()) {
            return false;
        }
        final long realSize = MathUtil.nextPowerOfTwo(size, policy.getMinCapacity(), MAX_CAPACITY);
        if (realSize < 0 || realSize == table0.size) {
            return false;
        }
        final BucketArray<K, V> ht;
        try {
            ht = allocate((int) realSize);
        } catch (OutOfMemoryError e) {
            if (!reportAllocationFailure) {
                throw e;
            }
            logger.warn("Failed to allocate bucket array of " + realSize + " buckets", e);
            return false;
        }
        if (!table0.isAllocated()) {
            // first allocation, nothing to rehash
            table0 = ht;
            return true;
        }
        if (logger.isDebugEnabled()) {
            logger.debug("Rehashing from " + table0.size + " to " + realSize + " buckets started, entries: " + table0.used);
        }
        table1 = ht;
        rehashIndex = 0;
        return true;
    }

    @NotNull
    BucketArray<K, V> allocate(final int size) {
        return new BucketArray<>(size);
    }

    /**
     * Growth is deferred while rehashing is paused so that safe iterators and scans see the same arrays.
     */
    private void expandIfNeeded() {
        if (isRehashing()) {
            return;
        }
        if (!table0.isAllocated()) {
            expand(policy.getMinCapacity());
            return;
        }
        if (pauseCount > 0) {
            return;
        }
        final long used = table0.used;
        final long size = table0.size;
        if (!policy.shouldGrow(used, size)) {
            return;
        }
        final long newSize = MathUtil.nextPowerOfTwo(used + 1, policy.getMinCapacity(), MAX_CAPACITY);
        if (newSize < 0 || !type.expandAllowed(newSize * BUCKET_REFERENCE_SIZE, (double) used / size)) {
            return;
        }
        expand(used + 1);
    }

    private void clearTable(@NotNull final BucketArray<K, V> ht, @Nullable final Runnable callback) {
        for (int i = 0; i < ht.size && ht.used > 0; ++i) {
            if (callback != null && (i & (CLEAR_CALLBACK_PERIOD - 1)) == 0) {
                callback.run();
            }
            DictEntryImpl<K, V> e = ht.get(i);
            if (e == null) {
                continue;
            }
            //noinspection ConstantConditions
            ht.buckets[i] = null;
            while (e != null) {
                final DictEntryImpl<K, V> next = e.next;
                e.next = null;
                destroy(e);
                --ht.used;
                e = next;
            }
        }
    }

    @NotNull
    private static <K, V> DictStatistics.TableStatistics getTableStatistics(@NotNull final BucketArray<K, V> ht, final int tableId) {
        final long[] chainLengths = new long[DictStatistics.CHAIN_LENGTH_SLOTS];
        long slots = 0;
        long maxChainLength = 0;
        long totalChainLength = 0;
        if (ht.used > 0) {
            for (int i = 0; i < ht.size; ++i) {
                final int chainLength = ht.chainLength(i);
                ++chainLengths[Math.min(chainLength, DictStatistics.CHAIN_LENGTH_SLOTS - 1)];
                if (chainLength == 0) {
                    continue;
                }
                ++slots;
                maxChainLength = Math.max(maxChainLength, chainLength);
                totalChainLength += chainLength;
            }
        }
        return new DictStatistics.TableStatistics(tableId, ht.size, ht.used, slots, maxChainLength, totalChainLength, chainLengths);
    }

    private static void checkKey(final Object key) {
        //noinspection ConstantConditions
        if (key == null) {
            throw new IllegalArgumentException("Key can't be null");
        }
    }

    private static <K, V> void visitBucket(@Nullable DictEntryImpl<K, V> e, @NotNull final DictScanFunction<K, V> fn) {
        while (e != null) {
            // the callback is allowed to delete the entry
            final DictEntryImpl<K, V> next = e.next;
            fn.visit(e);
            e = next;
        }
    }
}
