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

/**
 * Source of initial values of {@linkplain jetbrains.memdict.dict.DictConfig} settings. {@link #IGNORE} keeps
 * the defaults, {@link #SYSTEM_PROPERTY} reads {@code memdict.*} system properties, so that a setting like
 * {@code -Dmemdict.resize.mode=avoid} applies to every {@code DictConfig} created by the default constructor.
 * Numeric values which can't be parsed fall back to the defaults.
 */
public interface ConfigurationStrategy {

    ConfigurationStrategy IGNORE = key -> null;

    ConfigurationStrategy SYSTEM_PROPERTY = System::getProperty;

    String getProperty(String key);
}
