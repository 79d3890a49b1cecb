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

import org.jetbrains.annotations.NotNull;

public class CaseInsensitiveStringDictType<V> extends StringDictType<V> {

    public CaseInsensitiveStringDictType(@NotNull final DictHashing hashing) {
        super(hashing);
    }

    @Override
    public long hash(@NotNull final String key) {
        return hashing.hashCaseInsensitive(key);
    }

    // folds ASCII letters only, consistently with the hash
    @Override
    public boolean keyCompare(@NotNull final String key1, @NotNull final String key2) {
        final int length = key1.length();
        if (length != key2.length()) {
            return false;
        }
        for (int i = 0; i < length; ++i) {
            if (toLowerAscii(key1.charAt(i)) != toLowerAscii(key2.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static char toLowerAscii(final char c) {
        return (c >= 'A' && c <= 'Z') ? (char) (c + ('a' - 'A')) : c;
    }
}
