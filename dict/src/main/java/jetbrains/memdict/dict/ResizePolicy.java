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

/**
 * Resize and rehash decisions of all tables of an environment. Values are cached from {@linkplain DictConfig}
 * and refreshed by the environment on settings change.
 */
final class ResizePolicy {

    @NotNull
    private ResizeMode mode;
    private int forceResizeRatio;
    private int minCapacity;
    private int emptyVisitsPerStep;
    private int rehashBatchSize;

    ResizePolicy(@NotNull final DictConfig config) {
        mode = config.getResizeMode();
        forceResizeRatio = config.getForceResizeRatio();
        minCapacity = config.getMinCapacity();
        emptyVisitsPerStep = config.getRehashEmptyVisitsPerStep();
        rehashBatchSize = config.getRehashBatchSize();
    }

    void update(@NotNull final String key, @NotNull final DictConfig config) {
        switch (key) {
            case DictConfig.RESIZE_MODE:
                mode = config.getResizeMode();
                break;
            case DictConfig.FORCE_RESIZE_RATIO:
                forceResizeRatio = config.getForceResizeRatio();
                break;
            case DictConfig.MIN_CAPACITY:
                minCapacity = config.getMinCapacity();
                break;
            case DictConfig.REHASH_EMPTY_VISITS_PER_STEP:
                emptyVisitsPerStep = config.getRehashEmptyVisitsPerStep();
                break;
            case DictConfig.REHASH_BATCH_SIZE:
                rehashBatchSize = config.getRehashBatchSize();
                break;
        }
    }

    @NotNull
    ResizeMode getMode() {
        return mode;
    }

    int getForceResizeRatio() {
        return forceResizeRatio;
    }

    int getMinCapacity() {
        return minCapacity;
    }

    int getEmptyVisitsPerStep() {
        return emptyVisitsPerStep;
    }

    int getRehashBatchSize() {
        return rehashBatchSize;
    }

    /**
     * Growth is due if the load factor reached 1 and resizing is enabled, or if it exceeds the force ratio and
     * resizing is not forbidden.
     */
    boolean shouldGrow(final long used, final long size) {
        return (mode == ResizeMode.ENABLED && used >= size) ||
            (mode != ResizeMode.FORBIDDEN && used / size > forceResizeRatio);
    }

    boolean allowsShrink() {
        return mode == ResizeMode.ENABLED;
    }

    /**
     * @param size0 number of buckets of the active array
     * @param size1 number of buckets of the incoming array
     */
    boolean allowsRehash(final long size0, final long size1) {
        if (mode == ResizeMode.FORBIDDEN) {
            return false;
        }
        if (mode == ResizeMode.AVOID) {
            return (size1 > size0 && size1 / size0 >= forceResizeRatio) ||
                (size1 < size0 && size0 / size1 >= forceResizeRatio);
        }
        return true;
    }
}
