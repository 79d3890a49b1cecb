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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Doesn't prevent the table from rehashing, checks on close that the table was not structurally modified.
 */
final class UnsafeDictIterator<K, V> extends AbstractDictIterator<K, V> {

    private static final Logger logger = LoggerFactory.getLogger(UnsafeDictIterator.class);

    private final long fingerprint;

    UnsafeDictIterator(@NotNull final DictImpl<K, V> dict) {
        super(dict);
        fingerprint = dict.fingerprint();
    }

    @Override
    public boolean isSafe() {
        return false;
    }

    @Override
    protected void release() {
        final long actual = dict.fingerprint();
        if (actual != fingerprint) {
            logger.error("Table was structurally modified during unsafe iteration: " + dict);
            throw new ConcurrentDictModificationException(fingerprint, actual);
        }
    }
}
