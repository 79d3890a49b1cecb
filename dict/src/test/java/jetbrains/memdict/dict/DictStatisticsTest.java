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

public class DictStatisticsTest extends DictTestBase {

    @Test
    public void emptyDict() {
        final DictStatistics stats = openDict().getStatistics();
        Assert.assertEquals(1, stats.getTables().size());
        Assert.assertEquals(0, stats.getMainTable().getUsed());
        Assert.assertTrue(stats.toString().contains("No stats available for empty dictionaries"));
    }

    @Test
    public void uniformTable() {
        final DictImpl<Integer, String> dict = openDict();
        fill(dict, 0, 4);
        final DictStatistics.TableStatistics stats = dict.getStatistics().getMainTable();
        Assert.assertEquals(0, stats.getTableId());
        Assert.assertEquals(4, stats.getSize());
        Assert.assertEquals(4, stats.getUsed());
        Assert.assertEquals(4, stats.getSlots());
        Assert.assertEquals(1, stats.getMaxChainLength());
        Assert.assertEquals(4, stats.getChainLengthCount(1));
        Assert.assertEquals(0, stats.getChainLengthCount(0));
        Assert.assertEquals(1.0, stats.getCountedAverageChainLength(), 0.0);
        final String report = stats.toString();
        Assert.assertTrue(report.startsWith("Hash table 0 stats (main hash table):\n"));
        Assert.assertTrue(report.contains(" table size: 4\n"));
        Assert.assertTrue(report.contains(" number of elements: 4\n"));
        Assert.assertTrue(report.contains("   1: 4 (100.00%)\n"));
    }

    @Test
    public void collisions() {
        final DictImpl<Integer, String> dict = openDict();
        fill(dict, 0, 1);
        dict.add(4, "4");
        dict.add(8, "8");
        final DictStatistics.TableStatistics stats = dict.getStatistics().getMainTable();
        Assert.assertEquals(3, stats.getUsed());
        Assert.assertEquals(1, stats.getSlots());
        Assert.assertEquals(3, stats.getMaxChainLength());
        Assert.assertEquals(3, stats.getChainLengthCount(0));
        Assert.assertEquals(1, stats.getChainLengthCount(3));
        Assert.assertEquals(3.0, stats.getCountedAverageChainLength(), 0.0);
        Assert.assertEquals(3.0, stats.getComputedAverageChainLength(), 0.0);
        Assert.assertTrue(stats.toString().contains(" max chain length: 3\n"));
    }

    @Test
    public void longChainsShareLastSlot() {
        env.setResizeMode(ResizeMode.FORBIDDEN);
        final DictImpl<Integer, String> dict = openDict();
        for (int i = 0; i < 60; ++i) {
            dict.add(i * 4, "");
        }
        final DictStatistics.TableStatistics stats = dict.getStatistics().getMainTable();
        Assert.assertEquals(60, stats.getMaxChainLength());
        Assert.assertEquals(1, stats.getChainLengthCount(DictStatistics.CHAIN_LENGTH_SLOTS - 1));
        Assert.assertEquals(1, stats.getChainLengthCount(100));
        Assert.assertTrue(stats.toString().contains(">= 49: 1"));
    }

    @Test
    public void rehashingTable() {
        final DictImpl<Integer, String> dict = openDict();
        fill(dict, 0, 5);
        Assert.assertTrue(dict.isRehashing());
        final DictStatistics stats = dict.getStatistics();
        Assert.assertEquals(2, stats.getTables().size());
        Assert.assertEquals(4, stats.getTables().get(0).getUsed());
        Assert.assertEquals(1, stats.getTables().get(1).getUsed());
        Assert.assertEquals(8, stats.getTables().get(1).getSize());
        Assert.assertTrue(stats.toString().contains("Hash table 1 stats (rehashing target):\n"));
    }
}
