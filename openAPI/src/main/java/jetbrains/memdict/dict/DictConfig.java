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

import jetbrains.memdict.AbstractConfig;
import jetbrains.memdict.ConfigurationStrategy;
import jetbrains.memdict.InvalidSettingException;
import jetbrains.memdict.MemDictException;
import jetbrains.memdict.core.dataStructures.Pair;
import jetbrains.memdict.util.HexUtil;
import jetbrains.memdict.util.MathUtil;
import org.jetbrains.annotations.NotNull;

/**
 * Specifies settings of {@linkplain DictEnvironment}. Default settings are specified by {@linkplain #DEFAULT}
 * which is immutable. Any newly created {@code DictConfig} has the same settings as {@linkplain #DEFAULT}
 * unless system properties override them.
 *
 * <p>Creation of a {@linkplain DictEnvironment} whose tables don't grow during a snapshot can look as follows:
 * <pre>
 *     final DictConfig config = new DictConfig().setResizeMode(ResizeMode.AVOID).setForceResizeRatio(8);
 *     final DictEnvironment env = DictEnvironments.newInstance(config);
 * </pre>
 * <p>
 * Settings mutable at runtime take effect on every table of the environment immediately.
 *
 * @see DictEnvironment
 * @see DictEnvironment#getConfig()
 */
@SuppressWarnings({"WeakerAccess", "unused", "AutoBoxing", "AutoUnboxing"})
public class DictConfig extends AbstractConfig {

    public static final DictConfig DEFAULT = new DictConfig(ConfigurationStrategy.IGNORE) {
        @Override
        public DictConfig setMutable(boolean isMutable) {
            if (!this.isMutable() && isMutable) {
                throw new MemDictException("Can't make DictConfig.DEFAULT mutable");
            }
            return super.setMutable(isMutable);
        }
    }.setMutable(false);

    /**
     * Defines the {@linkplain ResizeMode} of tables: {@code enabled}, {@code avoid} or {@code forbidden}.
     * Default value is {@code enabled}.
     * <p>Mutable at runtime: yes
     */
    public static final String RESIZE_MODE = "memdict.resize.mode";

    /**
     * Defines the ratio of entries to buckets above which a table grows even in the {@linkplain ResizeMode#AVOID}
     * mode. Default value is {@code 5}.
     * <p>Mutable at runtime: yes
     */
    public static final String FORCE_RESIZE_RATIO = "memdict.resize.forceRatio";

    /**
     * Defines the minimum number of buckets of a table, must be a power of two. Default value is {@code 4}.
     * <p>Mutable at runtime: yes, affects subsequent resizes only
     */
    public static final String MIN_CAPACITY = "memdict.minCapacity";

    /**
     * Defines the 128-bit seed of the keyed hash function as a string of 32 hex digits. Empty string means
     * that a random seed is generated on environment creation. Default value is empty string.
     * <p>Mutable at runtime: only while the environment has no open tables
     */
    public static final String HASH_SEED = "memdict.hashSeed";

    /**
     * Defines how many empty buckets a single step of incremental rehashing can visit before it gives up
     * for this call. Default value is {@code 10}.
     * <p>Mutable at runtime: yes
     */
    public static final String REHASH_EMPTY_VISITS_PER_STEP = "memdict.rehash.emptyVisitsPerStep";

    /**
     * Defines the number of rehashing steps performed between two clock checks by
     * {@linkplain Dict#rehashMilliseconds(int)}. Default value is {@code 100}.
     * <p>Mutable at runtime: yes
     */
    public static final String REHASH_BATCH_SIZE = "memdict.rehash.batchSize";

    public static final int HASH_SEED_LENGTH = 16;

    public DictConfig() {
        this(ConfigurationStrategy.SYSTEM_PROPERTY);
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    public DictConfig(@NotNull final ConfigurationStrategy strategy) {
        super(new Pair[]{
            new Pair(RESIZE_MODE, ResizeMode.ENABLED.id),
            new Pair(FORCE_RESIZE_RATIO, 5),
            new Pair(MIN_CAPACITY, 4),
            new Pair(HASH_SEED, ""),
            new Pair(REHASH_EMPTY_VISITS_PER_STEP, 10),
            new Pair(REHASH_BATCH_SIZE, 100)
        }, strategy);
    }

    @Override
    public DictConfig setSetting(@NotNull final String key, @NotNull final Object value) {
        return (DictConfig) super.setSetting(key, value);
    }

    /**
     * Set {@code true} for making it possible to change settings of this {@code DictConfig} instance.
     * {@code DictConfig.DEFAULT} is always immutable.
     *
     * @param isMutable {@code true} if this {@code DictConfig} instance can be mutated
     * @return this {@code DictConfig} instance
     */
    @Override
    public DictConfig setMutable(boolean isMutable) {
        return (DictConfig) super.setMutable(isMutable);
    }

    @NotNull
    public ResizeMode getResizeMode() {
        return ResizeMode.fromId((String) getSetting(RESIZE_MODE));
    }

    public DictConfig setResizeMode(@NotNull final ResizeMode mode) {
        return setSetting(RESIZE_MODE, mode.id);
    }

    public int getForceResizeRatio() {
        return (Integer) getSetting(FORCE_RESIZE_RATIO);
    }

    public DictConfig setForceResizeRatio(final int ratio) throws InvalidSettingException {
        if (ratio < 1) {
            throw new InvalidSettingException("Invalid force resize ratio: " + ratio);
        }
        return setSetting(FORCE_RESIZE_RATIO, ratio);
    }

    public int getMinCapacity() {
        return (Integer) getSetting(MIN_CAPACITY);
    }

    public DictConfig setMinCapacity(final int capacity) throws InvalidSettingException {
        if (!MathUtil.isPowerOfTwo(capacity)) {
            throw new InvalidSettingException("Minimum capacity should be a power of two: " + capacity);
        }
        return setSetting(MIN_CAPACITY, capacity);
    }

    /**
     * @return the 16 bytes of the hash seed, or an empty array if the seed is not set
     */
    @NotNull
    public byte[] getHashSeed() {
        return HexUtil.stringToByteArray((String) getSetting(HASH_SEED));
    }

    public DictConfig setHashSeed(@NotNull final byte[] seed) throws InvalidSettingException {
        if (seed.length != HASH_SEED_LENGTH) {
            throw new InvalidSettingException("Hash seed should be " + HASH_SEED_LENGTH + " bytes long: " + seed.length);
        }
        return setSetting(HASH_SEED, HexUtil.byteArrayToString(seed));
    }

    public int getRehashEmptyVisitsPerStep() {
        return (Integer) getSetting(REHASH_EMPTY_VISITS_PER_STEP);
    }

    public DictConfig setRehashEmptyVisitsPerStep(final int visits) throws InvalidSettingException {
        if (visits < 1) {
            throw new InvalidSettingException("Invalid number of empty visits per rehash step: " + visits);
        }
        return setSetting(REHASH_EMPTY_VISITS_PER_STEP, visits);
    }

    public int getRehashBatchSize() {
        return (Integer) getSetting(REHASH_BATCH_SIZE);
    }

    public DictConfig setRehashBatchSize(final int batchSize) throws InvalidSettingException {
        if (batchSize < 1) {
            throw new InvalidSettingException("Invalid rehash batch size: " + batchSize);
        }
        return setSetting(REHASH_BATCH_SIZE, batchSize);
    }

    @Override
    protected void applySetting(@NotNull final String key, @NotNull final Object value) {
        switch (key) {
            case RESIZE_MODE:
                setResizeMode(ResizeMode.fromId((String) value));
                break;
            case FORCE_RESIZE_RATIO:
                setForceResizeRatio((Integer) value);
                break;
            case MIN_CAPACITY:
                setMinCapacity((Integer) value);
                break;
            case HASH_SEED:
                final String seed = (String) value;
                if (seed.isEmpty()) {
                    setSetting(HASH_SEED, seed);
                } else {
                    try {
                        setHashSeed(HexUtil.stringToByteArray(seed));
                    } catch (IllegalArgumentException e) {
                        throw new InvalidSettingException("Invalid hash seed: " + e.getMessage());
                    }
                }
                break;
            case REHASH_EMPTY_VISITS_PER_STEP:
                setRehashEmptyVisitsPerStep((Integer) value);
                break;
            case REHASH_BATCH_SIZE:
                setRehashBatchSize((Integer) value);
                break;
            default:
                super.applySetting(key, value);
        }
    }
}
