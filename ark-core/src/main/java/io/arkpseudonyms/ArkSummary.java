package io.arkpseudonyms;

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

import io.arkpseudonyms.keys.Fingerprint;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

/// Text summary of an [Ark]: usage counts and the first few registry entries.
///
/// ```text
/// # An alliterating Ark
/// # 3 / 4 pseudonyms used (75%)
/// # 2 / 2 alliterations used (100%)
///
///   key         pseudonym
/// 1 3f2a9c01... Big Bear
/// 2 77b0e4d2... Blue Bat
/// # ...with 1 more entries
/// ```
public final class ArkSummary {

    /** Number of entries listed when no limit is given. */
    public static final int DEFAULT_ENTRIES = 10;

    private ArkSummary() {
    }

    /// Render a summary listing up to [#DEFAULT_ENTRIES] entries.
    /// @param ark the Ark to describe
    /// @return the summary text
    public static String render(Ark ark) {
        return render(ark, DEFAULT_ENTRIES);
    }

    /// Render a summary.
    /// @param ark the Ark to describe
    /// @param n the maximum number of entries to list, positive
    /// @return the summary text
    public static String render(Ark ark, int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("Number of entries to list must be positive, got " + n);
        }
        Map<Fingerprint, String> entries = ark.entries();
        int used = entries.size();
        int capacity = ark.capacity();
        int usedAlliterations = ark.alliterationCount();
        int alliterationCapacity = ark.alliterationCapacity();

        StringBuilder sb = new StringBuilder();
        sb.append(ark.isAlliterating() ? "# An alliterating Ark" : "# An Ark").append('\n');
        sb.append(String.format(Locale.ROOT, "# %d / %d pseudonyms used (%.0f%%)\n",
            used, capacity, percent(used, capacity)));
        sb.append(String.format(Locale.ROOT, "# %d / %d alliterations used (%.0f%%)\n",
            usedAlliterations, alliterationCapacity, percent(usedAlliterations, alliterationCapacity)));
        sb.append('\n');

        if (used == 0) {
            return sb.append("The Ark is empty.").toString();
        }
        if (used >= capacity) {
            return sb.append("The Ark is full").toString();
        }

        int shown = Math.min(n, used);
        int width = String.valueOf(shown).length();
        sb.append(String.format(Locale.ROOT, "%" + width + "s key         pseudonym\n", ""));
        Iterator<Map.Entry<Fingerprint, String>> it = entries.entrySet().iterator();
        for (int i = 1; i <= shown; i++) {
            Map.Entry<Fingerprint, String> entry = it.next();
            sb.append(String.format(Locale.ROOT, "%" + width + "d %s... %s\n",
                i, entry.getKey().shortHex(), entry.getValue()));
        }
        if (shown < used) {
            sb.append(String.format(Locale.ROOT, "# ...with %d more entries\n", used - shown));
        }
        return sb.toString();
    }

    private static double percent(int part, int whole) {
        return whole == 0 ? 0.0 : part * 100.0 / whole;
    }
}
