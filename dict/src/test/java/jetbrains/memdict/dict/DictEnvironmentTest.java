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

import jetbrains.memdict.ConfigurationStrategy;
import jetbrains.memdict.InvalidSettingException;
import jetbrains.memdict.MemDictException;
import jetbrains.memdict.dict.hash.DictHashing;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;

public class DictEnvironmentTest extends DictTestBase {

    @Test
    public void configuredSeed() {
        Assert.assertArrayEquals(SEED, env.getHashSeed());
        // a copy is returned
        env.getHashSeed()[0] = 42;
        Assert.assertArrayEquals(SEED, env.getHashSeed());
    }

    @Test
    public void generatedSeed() {
        final DictConfig config = new DictConfig(ConfigurationStrategy.IGNORE);
        try (DictEnvironment env1 = DictEnvironments.newInstance(config)) {
            final byte[] seed = env1.getHashSeed();
            Assert.assertEquals(DictConfig.HASH_SEED_LENGTH, seed.length);
            // stored to the config
            Assert.assertArrayEquals(seed, config.getHashSeed());
            try (DictEnvironment env2 = DictEnvironments.newInstance(new DictConfig(ConfigurationStrategy.IGNORE))) {
                Assert.assertFalse(Arrays.equals(seed, env2.getHashSeed()));
            }
        }
    }

    @Test
    public void immutableConfig() {
        try (DictEnvironment env = DictEnvironments.newInstance(DictConfig.DEFAULT)) {
            Assert.assertEquals(DictConfig.HASH_SEED_LENGTH, env.getHashSeed().length);
            Assert.assertEquals(0, DictConfig.DEFAULT.getHashSeed().length);
            final Dict<Integer, String> dict = env.openDict(new IntDictType());
            fill(dict, 0, 10);
            Assert.assertEquals(10, dict.size());
            try {
                env.setResizeMode(ResizeMode.AVOID);
                Assert.fail();
            } catch (MemDictException ignored) {
            }
        }
    }

    @Test
    public void seedCantChangeWithOpenTables() {
        final DictImpl<Integer, String> dict = openDict();
        final byte[] newSeed = new byte[DictConfig.HASH_SEED_LENGTH];
        try {
            env.setHashSeed(newSeed);
            Assert.fail();
        } catch (InvalidSettingException ignored) {
        }
        Assert.assertArrayEquals(SEED, env.getHashSeed());
        Assert.assertArrayEquals(SEED, env.getConfig().getHashSeed());
        dict.release();
        final long hash = DictHashing.of(env).hash("key");
        env.setHashSeed(newSeed);
        Assert.assertArrayEquals(newSeed, env.getHashSeed());
        Assert.assertNotEquals(hash, DictHashing.of(env).hash("key"));
    }

    @Test
    public void resizeModeChangesAffectOpenTables() {
        final DictImpl<Integer, String> dict1 = openDict();
        final DictImpl<Integer, String> dict2 = openDict();
        env.setResizeMode(ResizeMode.FORBIDDEN);
        Assert.assertEquals(ResizeMode.FORBIDDEN, env.getResizeMode());
        Assert.assertEquals(ResizeMode.FORBIDDEN, env.getConfig().getResizeMode());
        fill(dict1, 0, 10);
        fill(dict2, 0, 10);
        Assert.assertEquals(4, dict1.capacity(0));
        Assert.assertEquals(4, dict2.capacity(0));
        env.getConfig().setResizeMode(ResizeMode.ENABLED);
        Assert.assertEquals(ResizeMode.ENABLED, env.getResizeMode());
        dict1.add(10, "10");
        Assert.assertTrue(dict1.isRehashing());
    }

    @Test
    public void environmentsAreIndependent() {
        try (DictEnvironment other = DictEnvironments.newInstance(createConfig())) {
            other.setResizeMode(ResizeMode.FORBIDDEN);
            Assert.assertEquals(ResizeMode.ENABLED, env.getResizeMode());
            final Dict<Integer, String> dict1 = env.openDict(new IntDictType());
            final Dict<Integer, String> dict2 = other.openDict(new IntDictType());
            fill(dict1, 0, 10);
            fill(dict2, 0, 10);
            finishRehashing(dict1);
            Assert.assertEquals(16, dict1.capacity(0));
            Assert.assertEquals(4, dict2.capacity(0));
        }
    }

    @Test
    public void close() {
        final IntDictType type1 = new IntDictType();
        final IntDictType type2 = new IntDictType();
        final DictEnvironment env = DictEnvironments.newInstance(createConfig());
        fill(env.openDict(type1), 0, 10);
        fill(env.openDict(type2), 0, 20);
        Assert.assertEquals(2, env.getOpenDicts().size());
        Assert.assertTrue(env.isOpen());
        env.close();
        Assert.assertFalse(env.isOpen());
        Assert.assertEquals(10, type1.keyDestructions);
        Assert.assertEquals(20, type2.valDestructions);
        Assert.assertTrue(env.getOpenDicts().isEmpty());
        // closing again is no-op
        env.close();
        try {
            env.openDict(new IntDictType());
            Assert.fail();
        } catch (MemDictException ignored) {
        }
    }

    @Test
    public void closeWithFailingDestructor() {
        final IntDictType failing = new IntDictType() {
            @Override
            public void valDestructor(final String value) {
                throw new IllegalStateException("Can't destroy " + value);
            }
        };
        final IntDictType type = new IntDictType();
        final DictEnvironment env = DictEnvironments.newInstance(createConfig());
        fill(env.openDict(failing), 0, 1);
        fill(env.openDict(type), 0, 5);
        try {
            env.close();
            Assert.fail();
        } catch (MemDictException e) {
            Assert.assertTrue(e.getCause() instanceof IllegalStateException);
        }
        Assert.assertFalse(env.isOpen());
        Assert.assertEquals(5, type.keyDestructions);
        Assert.assertTrue(env.getOpenDicts().isEmpty());
    }
}
