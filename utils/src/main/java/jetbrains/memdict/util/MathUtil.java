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

public class MathUtil {

    private MathUtil() {
    }

    /**
     * @param i integer
     * @return discrete logarithm of specified integer base 2
     */
    public static int integerLogarithm(final int i) {
        return i <= 0 ? 0 : Integer.SIZE - Integer.numberOfLeadingZeros(i - 1);
    }

    /**
     * @param l long
     * @return discrete logarithm of specified integer base 2
     */
    public static long longLogarithm(final long l) {
        return l <= 0 ? 0 : Long.SIZE - Long.numberOfLeadingZeros(l - 1);
    }

    public static boolean isPowerOfTwo(final long l) {
        return l > 0 && (l & (l - 1)) == 0;
    }

    /**
     * @param size    requested size
     * @param minimum power of two the result can't be less than
     * @param maximum power of two the result can't be greater than
     * @return the smallest power of two which is not less than both {@code size} and {@code minimum},
     * or {@code -1} if it would exceed {@code maximum}
     */
    public static long nextPowerOfTwo(final long size, final long minimum, final long maximum) {
        if (size > maximum) {
            return -1;
        }
        if (size <= minimum) {
            return minimum;
        }
        return 1L << longLogarithm(size);
    }

    /**
     * Increments the cursor starting from its highest bit within the {@code mask}, i.e. reverses bits of
     * the cursor, increments it and reverses the bits back. Bits not covered by the mask are set before
     * the increment, so the carry passes through them and the result always has them cleared.
     *
     * @param cursor cursor
     * @param mask   capacity - 1 of a power of two sized table
     * @return next cursor, {@code 0} if the whole range was passed
     */
    public static long reverseIncrement(long cursor, final long mask) {
        cursor |= ~mask;
        cursor = Long.reverse(cursor);
        cursor++;
        return Long.reverse(cursor);
    }
}
