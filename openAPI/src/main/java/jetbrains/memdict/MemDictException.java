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
package jetbrains.memdict;

import org.jetbrains.annotations.Nullable;

/**
 * Any memdict exception is {@code MemDictException}.
 */
public class MemDictException extends RuntimeException {

    public MemDictException() {
    }

    public MemDictException(String message) {
        super(message);
    }

    public MemDictException(String message, Throwable cause) {
        super(message, cause);
    }

    public MemDictException(Throwable cause) {
        super(cause);
    }

    public static MemDictException wrap(Exception e) {
        return e instanceof MemDictException ? (MemDictException) e : new MemDictException(e);
    }

    public static RuntimeException toMemDictException(final Throwable e, @Nullable final String message) {
        if (e instanceof RuntimeException) {
            return (RuntimeException) e;
        }
        return message == null ? new MemDictException(e) : new MemDictException(message, e);
    }

    public static RuntimeException toMemDictException(Throwable e) {
        return toMemDictException(e, null);
    }
}
