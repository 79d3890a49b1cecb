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
 * Keeps rehashing of the table paused until closed, so the table can be modified during iteration.
 */
final class SafeDictIterator<K, V> extends AbstractDictIterator<K, V> {

    SafeDictIterator(@NotNull final DictImpl<K, V> dict) {
        super(dict);
        dict.pauseRehashing();
    }

    @Override
    public boolean isSafe() {
        return true;
    }

    @Override
    public void remove() {
        checkNotClosed();
        final DictEntryImpl<K, V> entry = lastReturned;
        if (entry == null) {
            throw new IllegalStateException("No entry to remove");
        }
        lastReturned = null;
        dict.delete(entry.key);
    }

    @Override
    protected void release() {
        dict.resumeRehashing();
    }
}
