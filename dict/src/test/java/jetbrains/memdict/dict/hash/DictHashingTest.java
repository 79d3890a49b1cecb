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
package jetbrains.memdict.dict.hash;

import jetbrains.memdict.InvalidSettingException;
import jetbrains.memdict.dict.Dict;
import jetbrains.memdict.dict.DictTestBase;
import org.junit.Assert;
import org.junit.Test;

import java.nio.charset.StandardCharsets;

public class DictHashingTest extends DictTestBase {

    @Test
    public void sipHashReferenceVectors() {
        final DictHashing hashing = new DictHashing(SEED);
        Assert.assertEquals(0x726fdb47dd0e0e31L, hashing.hash(new byte[0]));
        Assert.assertEquals(0x74f839c593dc67fdL, hashing.hash(new byte[]{0}));
    }

    @Test
    public void seedMatters() {
        final byte[] otherSeed = SEED.clone();
        otherSeed[15] = 100;
        final DictHashing hashing = new DictHashing(SEED);
        final DictHashing other = new DictHashing(otherSeed);
        Assert.assertEquals(hashing.hash("memdict"), new DictHashing(SEED).hash("memdict"));
        Assert.assertNotEquals(hashing.hash("memdict"), other.hash("memdict"));
        Assert.assertNotEquals(hashing.xxHash(new byte[]{1, 2, 3}), other.xxHash(new byte[]{1, 2, 3}));
    }

    @Test
    public void stringsAreHashedAsUtf8() {
        final DictHashing hashing = DictHashing.of(env);
        final String s = "ключ";
        Assert.assertEquals(hashing.hash(s.getBytes(StandardCharsets.UTF_8)), hashing.hash(s));
        final byte[] padded = ("__" + s).getBytes(StandardCharsets.UTF_8);
        Assert.assertEquals(hashing.hash(s), hashing.hash(padded, 2, padded.length - 2));
    }

    @Test
    public void caseInsensitive() {
        final DictHashing hashing = DictHashing.of(env);
        Assert.assertEquals(hashing.hashCaseInsensitive("Hello World"), hashing.hashCaseInsensitive("hELLO wORLD"));
        Assert.assertEquals(hashing.hash("hello world"), hashing.hashCaseInsensitive("HELLO WORLD"));
        Assert.assertNotEquals(hashing.hash("Hello"), hashing.hash("hello"));
    }

    @Test
    public void xxHash() {
        final DictHashing hashing = DictHashing.of(env);
        final byte[] bytes = "trusted".getBytes(StandardCharsets.UTF_8);
        Assert.assertEquals(hashing.xxHash(bytes), hashing.xxHash(bytes.clone()));
        Assert.assertNotEquals(hashing.hash(bytes), hashing.xxHash(bytes));
    }

    @Test(expected = InvalidSettingException.class)
    public void badSeedLength() {
        new DictHashing(new byte[15]);
    }

    @Test
    public void environmentHashing() {
        Assert.assertSame(DictHashing.of(env), DictHashing.of(env));
        Assert.assertEquals(new DictHashing(SEED).hash("key"), DictHashing.of(env).hash("key"));
    }

    @Test
    public void stringDictType() {
        final Dict<String, Integer> dict = env.openDict(new StringDictType<>(DictHashing.of(env)));
        for (int i = 0; i < 1000; ++i) {
            Assert.assertTrue(dict.add("key" + i, i));
        }
        for (int i = 0; i < 1000; ++i) {
            Assert.assertEquals(Integer.valueOf(i), dict.fetchValue("key" + i));
        }
        Assert.assertNull(dict.find("KEY1"));
    }

    @Test
    public void caseInsensitiveStringDictType() {
        final Dict<String, Integer> dict = env.openDict(new CaseInsensitiveStringDictType<>(DictHashing.of(env)));
        Assert.assertTrue(dict.add("Content-Type", 1));
        Assert.assertFalse(dict.add("content-type", 2));
        Assert.assertEquals(Integer.valueOf(1), dict.fetchValue("CONTENT-TYPE"));
        Assert.assertNull(dict.find("Content-Length"));
        Assert.assertTrue(dict.delete("CoNtEnT-tYpE"));
        Assert.assertEquals(0, dict.size());
    }

    @Test
    public void byteArrayDictType() {
        for (final boolean trusted : new boolean[]{false, true}) {
            final Dict<byte[], String> dict = env.openDict(new ByteArrayDictType<>(DictHashing.of(env), trusted));
            final byte[] key = {1, 2, 3};
            Assert.assertTrue(dict.add(key, "123"));
            // the stored key is a copy
            key[0] = 0;
            Assert.assertNull(dict.find(key));
            Assert.assertEquals("123", dict.fetchValue(new byte[]{1, 2, 3}));
            Assert.assertFalse(dict.add(new byte[]{1, 2, 3}, "again"));
            dict.release();
        }
    }
}
