/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
/**
 * Demo and chaos harness for the preference store.
 * <p>
 * {@link dev.mars.prefstore.demo.PrefStoreDemo} walks through normal use;
 * {@link dev.mars.prefstore.demo.StoreChaos} attacks the store with
 * concurrent writers, torn documents and failing writes.
 */
package dev.mars.prefstore.demo;
