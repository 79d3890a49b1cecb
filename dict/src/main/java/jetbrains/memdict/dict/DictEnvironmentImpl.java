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

import jetbrains.memdict.ConfigSettingChangeListener;
import jetbrains.memdict.InvalidSettingException;
import jetbrains.memdict.MemDictException;
import jetbrains.memdict.dict.hash.DictHashing;
import jetbrains.memdict.util.Random;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

public class DictEnvironmentImpl implements DictEnvironment {

    private static final Logger logger = LoggerFactory.getLogger(DictEnvironmentImpl.class);

    @NotNull
    private final DictConfig config;
    @NotNull
    private final ResizePolicy resizePolicy;
    @NotNull
    private final Random random;
    @NotNull
    private final List<DictImpl<?, ?>> dicts;
    @NotNull
    private final ConfigSettingChangeListener settingsListener;
    @NotNull
    private byte[] hashSeed;
    @NotNull
    private DictHashing hashing;
    private boolean isOpen;

    DictEnvironmentImpl(@NotNull final DictConfig config) {
        this.config = config;
        resizePolicy = new ResizePolicy(config);
        random = new Random();
        dicts = new ArrayList<>();
        hashSeed = initHashSeed(config);
        hashing = new DictHashing(hashSeed);
        settingsListener = new DictSettingsListener();
        config.addChangedSettingsListener(settingsListener);
        isOpen = true;
        if (logger.isDebugEnabled()) {
            logger.debug("Dict environment created, resize mode: " + resizePolicy.getMode().id);
        }
    }

    @NotNull
    @Override
    public DictConfig getConfig() {
        return config;
    }

    @NotNull
    @Override
    public <K, V> Dict<K, V> openDict(@NotNull final DictType<K, V> type) {
        checkIsOpen();
        final DictImpl<K, V> result = new DictImpl<>(this, type);
        dicts.add(result);
        return result;
    }

    @NotNull
    @Override
    public List<Dict<?, ?>> getOpenDicts() {
        return Collections.unmodifiableList(new ArrayList<>(dicts));
    }

    @NotNull
    @Override
    public ResizeMode getResizeMode() {
        return resizePolicy.getMode();
    }

    @Override
    public void setResizeMode(@NotNull final ResizeMode mode) {
        config.setResizeMode(mode);
    }

    @NotNull
    @Override
    public byte[] getHashSeed() {
        return hashSeed.clone();
    }

    @Override
    public void setHashSeed(@NotNull final byte[] seed) {
        config.setHashSeed(seed);
    }

    @NotNull
    public DictHashing getHashing() {
        return hashing;
    }

    @Override
    public int rehashMilliseconds(final int ms) {
        final long started = System.currentTimeMillis();
        int result = 0;
        for (final DictImpl<?, ?> dict : new ArrayList<>(dicts)) {
            final long elapsed = System.currentTimeMillis() - started;
            if (elapsed >= ms) {
                break;
            }
            if (dict.isRehashing()) {
                result += dict.rehashMilliseconds((int) (ms - elapsed));
            }
        }
        return result;
    }

    @Override
    public boolean isOpen() {
        return isOpen;
    }

    @Override
    public void close() {
        if (!isOpen) {
            return;
        }
        // a failing destructor doesn't prevent other tables from being released
        RuntimeException failure = null;
        for (final DictImpl<?, ?> dict : new ArrayList<>(dicts)) {
            try {
                dict.release();
            } catch (RuntimeException e) {
                logger.error("Failed to release " + dict, e);
                if (failure == null) {
                    failure = e;
                }
            }
        }
        dicts.clear();
        config.removeChangedSettingsListener(settingsListener);
        isOpen = false;
        logger.debug("Dict environment closed");
        if (failure != null) {
            throw MemDictException.wrap(failure);
        }
    }

    @NotNull
    ResizePolicy getResizePolicy() {
        return resizePolicy;
    }

    @NotNull
    Random getRandom() {
        return random;
    }

    void dictReleased(@NotNull final DictImpl<?, ?> dict) {
        dicts.remove(dict);
    }

    private void checkIsOpen() {
        if (!isOpen) {
            throw new MemDictException("Dict environment is closed");
        }
    }

    @NotNull
    private static byte[] initHashSeed(@NotNull final DictConfig config) {
        final byte[] seed = config.getHashSeed();
        if (seed.length != 0) {
            return seed;
        }
        final byte[] result = generateHashSeed();
        if (config.isMutable()) {
            DictConfig.suppressConfigChangeListenersForThread();
            try {
                config.setHashSeed(result);
            } finally {
                DictConfig.resumeConfigChangeListenersForThread();
            }
        }
        return result;
    }

    @NotNull
    private static byte[] generateHashSeed() {
        final byte[] result = new byte[DictConfig.HASH_SEED_LENGTH];
        new SecureRandom().nextBytes(result);
        return result;
    }

    private class DictSettingsListener implements ConfigSettingChangeListener {

        @Override
        public void beforeSettingChanged(@NotNull String key, @NotNull Object value, @NotNull Map<String, Object> context) {
            if (key.equals(DictConfig.HASH_SEED) && !dicts.isEmpty()) {
                throw new InvalidSettingException("Can't change hash seed while the environment has open tables");
            }
        }

        @Override
        public void afterSettingChanged(@NotNull String key, @NotNull Object value, @NotNull Map<String, Object> context) {
            if (key.equals(DictConfig.HASH_SEED)) {
                hashSeed = initHashSeed(config);
                hashing = new DictHashing(hashSeed);
            } else {
                resizePolicy.update(key, config);
                if (key.equals(DictConfig.RESIZE_MODE) && logger.isInfoEnabled()) {
                    logger.info("Resize mode changed to " + value);
                }
            }
        }
    }
}
