/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

/// # Ark - pseudonym archive
///
/// Assigns stable, human-readable pseudonyms such as `Brave Otter` to arbitrary keys.
///
/// ## Layers
///
/// ```text
/// ┌───────────────────────────────────────────────────────────────┐
/// │ Ark            registry + two coordinated pools               │
/// ├───────────────────────────────────────────────────────────────┤
/// │ keys           rows -> fingerprints (DigestKeyHasher)         │
/// │ index          SubscriptCodec, AlliterationFinder,            │
/// │                PermutationPool                                │
/// │ names          NameSpace, NameParts (bundled word lists)      │
/// │ random         Commons RNG sources for the pool shuffles      │
/// └───────────────────────────────────────────────────────────────┘
/// ```
///
/// An index drawn from either pool is removed from the other in the same call, so a
/// pseudonym is never issued twice, whether it was requested as an alliteration or not.
package io.arkpseudonyms;
