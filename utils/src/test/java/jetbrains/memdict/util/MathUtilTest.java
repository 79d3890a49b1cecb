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
package jetbrains.memdict.util;

import org.junit.Assert;
import org.junit.Test;

import java.util.HashSet;
import java.util.Set;

public class MathUtilTest {

    @Test
    public void logarithms() {
        Assert.assertEquals(0, MathUtil.integerLogarithm(1));
        Assert.assertEquals(1, MathUtil.integerLogarithm(2));
        Assert.assertEquals(2, MathUtil.integerLogarithm(3));
        Assert.assertEquals(10, MathUtil.integerLogarithm(1024));
        Assert.assertEquals(11, MathUtil.integerLogarithm(1025));
        Assert.assertEquals(40, MathUtil.longLogarithm(1L << 40));
    }

    @Test
    public void powerOfTwo() {
        Assert.assertTrue(MathUtil.isPowerOfTwo(1));
        Assert.assertTrue(MathUtil.isPowerOfTwo(4));
        Assert.assertTrue(MathUtil.isPowerOfTwo(1L << 62));
        Assert.assertFalse(MathUtil.isPowerOfTwo(0));
        Assert.assertFalse(MathUtil.isPowerOfTwo(6));
        Assert.assertFalse(MathUtil.isPowerOfTwo(-4));
    }

    @Test
    public void nextPowerOfTwo() {
        final long max = 1 << 30;
        Assert.assertEquals(4, MathUtil.nextPowerOfTwo(0, 4, max));
        Assert.assertEquals(4, MathUtil.nextPowerOfTwo(3, 4, max));
        Assert.assertEquals(4, MathUtil.nextPowerOfTwo(4, 4, max));
        Assert.assertEquals(8, MathUtil.nextPowerOfTwo(5, 4, max));
        Assert.assertEquals(1024, MathUtil.nextPowerOfTwo(1000, 4, max));
        Assert.assertEquals(max, MathUtil.nextPowerOfTwo(max, 4, max));
        Assert.assertEquals(-1, MathUtil.nextPowerOfTwo(max + 1, 4, max));
    }

    @Test
    public void reverseIncrementOrder() {
        final long mask = 3;
        long cursor = MathUtil.reverseIncrement(0, mask);
        Assert.assertEquals(2, cursor);
        cursor = MathUtil.reverseIncrement(cursor, mask);
        Assert.assertEquals(1, cursor);
        cursor = MathUtil.reverseIncrement(cursor, mask);
        Assert.assertEquals(3, cursor);
        Assert.assertEquals(0, MathUtil.reverseIncrement(cursor, mask));
    }

    @Test
    public void reverseIncrementVisitsEachIndexOnce() {
        final long mask = 1023;
        final Set<Long> visited = new HashSet<>();
        long cursor = 0;
        do {
            Assert.assertTrue(visited.add(cursor));
            cursor = MathUtil.reverseIncrement(cursor, mask);
        } while (cursor != 0);
        Assert.assertEquals(1024, visited.size());
    }

    @Test
    public void reverseIncrementSurvivesGrowth() {
        // cursor 2 of a 4-bucket array addresses buckets 2 and 6 of an 8-bucket one
        final long cursor = MathUtil.reverseIncrement(0, 3);
        Assert.assertEquals(6, MathUtil.reverseIncrement(cursor, 7));
    }
}
