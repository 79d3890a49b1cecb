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

import org.junit.Assert;
import org.junit.Test;

import java.io.IOException;

public class MemDictExceptionTest {

    @Test
    public void wrap() {
        final MemDictException e = new MemDictException("e");
        Assert.assertSame(e, MemDictException.wrap(e));
        final IOException io = new IOException("io");
        final MemDictException wrapped = MemDictException.wrap(io);
        Assert.assertSame(io, wrapped.getCause());
    }

    @Test
    public void toMemDictException() {
        final IllegalStateException runtime = new IllegalStateException();
        Assert.assertSame(runtime, MemDictException.toMemDictException(runtime));
        final IOException io = new IOException("io");
        final RuntimeException converted = MemDictException.toMemDictException(io, "failed");
        Assert.assertTrue(converted instanceof MemDictException);
        Assert.assertEquals("failed", converted.getMessage());
        Assert.assertSame(io, converted.getCause());
    }
}
