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

import jetbrains.memdict.InvalidSettingException;
import org.jetbrains.annotations.NotNull;

import java.util.Locale;

/**
 * Global switch consulted by every {@linkplain Dict} before it grows, shrinks or moves entries to a new
 * bucket array.
 *
 * @see DictConfig#RESIZE_MODE
 */
public enum ResizeMode {

    /**
     * Tables grow as soon as the number of entries reaches the number of buckets.
     */
    ENABLED("enabled"),
    /**
     * Tables avoid growing and rehashing unless the ratio of entries to buckets (or of the bucket counts of
     * both arrays while rehashing) exceeds {@linkplain DictConfig#FORCE_RESIZE_RATIO}. Suits copy-on-write
     * sensitive windows where moving memory around is expensive.
     */
    AVOID("avoid"),
    /**
     * Nothing is resized or rehashed at all.
     */
    FORBIDDEN("forbidden");

    @NotNull
    public final String id;

    ResizeMode(@NotNull final String id) {
        this.id = id;
    }

    @NotNull
    public static ResizeMode fromId(@NotNull final String id) {
        final String lowerCased = id.trim().toLowerCase(Locale.ROOT);
        for (final ResizeMode mode : values()) {
            if (mode.id.equals(lowerCased)) {
                return mode;
            }
        }
        throw new InvalidSettingException("Unknown resize mode: " + id);
    }
}
