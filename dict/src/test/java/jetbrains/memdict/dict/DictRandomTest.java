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

import org.junit.Assert;
import org.junit.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class DictRandomTest extends DictTestBase {

    @Test
    public void emptyDict() {
        final DictImpl<Integer, String> dict = openDict();
        Assert.assertNull(dict.randomEntry());
        Assert.assertNull(dict.fairRandomEntry());
        Assert.assertTrue(dict.sampleEntries(10).isEmpty());
    }

    @Test
    public void randomEntryCoversAllKeys() {
        final DictImpl<Integer, String> dict = openDict();
        fill(dict, 0, 10);
        finishRehashing(dict);
        final Set<Integer> seen = new HashSet<>();
        for (int i = 0; i < 2000; ++i) {
            final DictEntry<Integer, String> entry = dict.randomEntry();
            Assert.assertNotNull(entry);
            Assert.assertTrue(entry.getKey() < 10);
            seen.add(entry.getKey());
        }
        Assert.assertEquals(10, seen.size());
    }

    @Test
    public void randomEntryOfLongChain() {
        final DictImpl<Integer, String> dict = openDict();
        env.setResizeMode(ResizeMode.FORBIDDEN);
        // all keys in bucket 0
        for (int i = 0; i < 5; ++i) {
            dict.add(i * 4, "");
        }
        final Set<Integer> seen = new HashSet<>();
        for (int i = 0; i < 1000; ++i) {
            seen.add(dict.randomEntry().getKey());
        }
        Assert.assertEquals(5, seen.size());
    }

    @Test
    public void randomEntryWhileRehashing() {
        final DictImpl<Integer, String> dict = openDict();
        fill(dict, 0, 600);
        Assert.assertTrue(dict.isRehashing());
        dict.pauseRehashing();
        final Set<Integer> seen = new HashSet<>();
        for (int i = 0; i < 20000; ++i) {
            final DictEntry<Integer, String> entry = dict.randomEntry();
            Assert.assertNotNull(entry);
            Assert.assertNotNull(dict.find(entry.getKey()));
            seen.add(entry.getKey());
        }
        // both arrays are sampled
        boolean inTable0 = false;
        boolean inTable1 = false;
        for (final Integer key : seen) {
            if (isInTable0(dict, key)) {
                inTable0 = true;
            } else {
                inTable1 = true;
            }
        }
        dict.resumeRehashing();
        Assert.assertTrue(inTable0);
        Assert.assertTrue(inTable1);
    }

    @Test
    public void sampleEntries() {
        final DictImpl<Integer, String> dict = openDict();
        fill(dict, 0, 1000);
        finishRehashing(dict);
        for (int i = 0; i < 100; ++i) {
            final List<DictEntry<Integer, String>> sample = dict.sampleEntries(20);
            Assert.assertTrue(sample.size() <= 20);
            Assert.assertFalse(sample.isEmpty());
            for (final DictEntry<Integer, String> entry : sample) {
                Assert.assertSame(entry, dict.find(entry.getKey()));
            }
        }
    }

    @Test
    public void sampleMoreThanSize() {
        final DictImpl<Integer, String> dict = openDict();
        fill(dict, 0, 3);
        final List<DictEntry<Integer, String>> sample = dict.sampleEntries(10);
        Assert.assertEquals(3, sample.size());
        final Set<Integer> keys = new HashSet<>();
        for (final DictEntry<Integer, String> entry : sample) {
            keys.add(entry.getKey());
        }
        Assert.assertEquals(3, keys.size());
    }

    @Test
    public void sampleEntriesWhileRehashing() {
        final DictImpl<Integer, String> dict = openDict();
        fill(dict, 0, 600);
        Assert.assertTrue(dict.isRehashing());
        final long rehashIndex = dict.getRehashIndex();
        final List<DictEntry<Integer, String>> sample = dict.sampleEntries(10);
        Assert.assertFalse(sample.isEmpty());
        // rehashing work proportional to the sample size
        Assert.assertEquals(rehashIndex + 10, dict.getRehashIndex());
        for (final DictEntry<Integer, String> entry : sample) {
            Assert.assertSame(entry, dict.find(entry.getKey()));
        }
    }

    @Test
    public void sparseTable() {
        final DictImpl<Integer, String> dict = openDict();
        dict.expand(1 << 16);
        dict.add(12345, "");
        dict.add(54321, "");
        for (int i = 0; i < 100; ++i) {
            final List<DictEntry<Integer, String>> sample = dict.sampleEntries(2);
            Assert.assertTrue(sample.size() <= 2);
            Assert.assertNotNull(dict.fairRandomEntry());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeCount() {
        openDict().sampleEntries(-1);
    }

    @Test
    public void fairRandomEntry() {
        final DictImpl<Integer, String> dict = openDict();
        fill(dict, 0, 100);
        final Set<Integer> seen = new HashSet<>();
        for (int i = 0; i < 5000; ++i) {
            final DictEntry<Integer, String> entry = dict.fairRandomEntry();
            Assert.assertNotNull(entry);
            seen.add(entry.getKey());
        }
        Assert.assertTrue(seen.size() > 50);
    }

    private static boolean isInTable0(final DictImpl<Integer, String> dict, final int key) {
        for (DictEntryImpl<Integer, String> e = dict.table0.get(dict.table0.indexFor(key)); e != null; e = e.next) {
            if (e.key == key) {
                return true;
            }
        }
        return false;
    }
}
