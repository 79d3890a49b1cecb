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

import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Snapshot of the shape of a {@linkplain Dict}: one {@linkplain TableStatistics} for the active bucket array
 * and one more for the incoming array if the table is rehashing. {@linkplain #toString()} renders a human
 * readable report. The report is informational only and its format is not stable.
 */
public class DictStatistics {

    /**
     * Number of slots of the chain length histogram, the last one accumulates all longer chains.
     */
    public static final int CHAIN_LENGTH_SLOTS = 50;

    @NotNull
    private final List<TableStatistics> tables;

    public DictStatistics(@NotNull final List<TableStatistics> tables) {
        this.tables = Collections.unmodifiableList(tables);
    }

    @NotNull
    public List<TableStatistics> getTables() {
        return tables;
    }

    @NotNull
    public TableStatistics getMainTable() {
        return tables.get(0);
    }

    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder();
        for (final TableStatistics table : tables) {
            table.appendTo(builder);
        }
        return builder.toString();
    }

    public static class TableStatistics {

        private final int tableId;
        private final long size;
        private final long used;
        private final long slots;
        private final long maxChainLength;
        private final long totalChainLength;
        @NotNull
        private final long[] chainLengths;

        public TableStatistics(final int tableId, final long size, final long used, final long slots,
                               final long maxChainLength, final long totalChainLength,
                               @NotNull final long[] chainLengths) {
            this.tableId = tableId;
            this.size = size;
            this.used = used;
            this.slots = slots;
            this.maxChainLength = maxChainLength;
            this.totalChainLength = totalChainLength;
            this.chainLengths = chainLengths;
        }

        public int getTableId() {
            return tableId;
        }

        public long getSize() {
            return size;
        }

        public long getUsed() {
            return used;
        }

        /**
         * @return number of non-empty buckets
         */
        public long getSlots() {
            return slots;
        }

        public long getMaxChainLength() {
            return maxChainLength;
        }

        public double getCountedAverageChainLength() {
            return slots == 0 ? 0 : (double) totalChainLength / slots;
        }

        public double getComputedAverageChainLength() {
            return slots == 0 ? 0 : (double) used / slots;
        }

        /**
         * @param length chain length, 0 for empty buckets
         * @return number of buckets having chains of specified length
         */
        public long getChainLengthCount(final int length) {
            return chainLengths[Math.min(length, CHAIN_LENGTH_SLOTS - 1)];
        }

        @Override
        public String toString() {
            final StringBuilder builder = new StringBuilder();
            appendTo(builder);
            return builder.toString();
        }

        private void appendTo(@NotNull final StringBuilder builder) {
            builder.append("Hash table ").append(tableId).append(" stats (")
                .append(tableId == 0 ? "main hash table" : "rehashing target").append("):\n");
            if (used == 0) {
                builder.append("No stats available for empty dictionaries\n");
                return;
            }
            builder.append(" table size: ").append(size).append('\n');
            builder.append(" number of elements: ").append(used).append('\n');
            builder.append(" different slots: ").append(slots).append('\n');
            builder.append(" max chain length: ").append(maxChainLength).append('\n');
            builder.append(" avg chain length (counted): ").append(format(getCountedAverageChainLength())).append('\n');
            builder.append(" avg chain length (computed): ").append(format(getComputedAverageChainLength())).append('\n');
            builder.append(" Chain length distribution:\n");
            for (int i = 0; i < CHAIN_LENGTH_SLOTS; ++i) {
                final long count = chainLengths[i];
                if (count == 0) continue;
                builder.append("   ").append(i == CHAIN_LENGTH_SLOTS - 1 ? ">= " : "").append(i).append(": ")
                    .append(count).append(" (").append(format(100.0 * count / size)).append("%)\n");
            }
        }

        private static String format(final double d) {
            return String.format(Locale.ROOT, "%.02f", d);
        }
    }
}
