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

/// Thrown when an [Ark] cannot issue as many new pseudonyms as a call needs.
///
/// Both remaining capacities are reported whichever kind was requested. When only
/// alliterations ran out, [#isAlliterationShortage()] is true and the caller can retry
/// without alliteration; otherwise a larger set of name parts is needed.
public class CapacityExhaustedException extends RuntimeException {

    private final int requested;
    private final int remaining;
    private final int remainingAlliterations;
    private final boolean alliterate;

    /// @param requested number of new pseudonyms the call needed
    /// @param remaining pseudonyms of any kind still available
    /// @param remainingAlliterations alliterating pseudonyms still available
    /// @param alliterate whether alliterations were requested
    /// @param cause the pool failure
    public CapacityExhaustedException(int requested, int remaining, int remainingAlliterations,
                                      boolean alliterate, Throwable cause) {
        super(formatMessage(requested, remaining, remainingAlliterations, alliterate), cause);
        this.requested = requested;
        this.remaining = remaining;
        this.remainingAlliterations = remainingAlliterations;
        this.alliterate = alliterate;
    }

    public int getRequested() {
        return requested;
    }

    public int getRemaining() {
        return remaining;
    }

    public int getRemainingAlliterations() {
        return remainingAlliterations;
    }

    public boolean isAlliterate() {
        return alliterate;
    }

    /// @return true if alliterations were requested and ordinary pseudonyms would still suffice
    public boolean isAlliterationShortage() {
        return alliterate && requested <= remaining;
    }

    private static String formatMessage(int requested, int remaining, int remainingAlliterations,
                                        boolean alliterate) {
        String message = String.format(
            "Not enough unused pseudonyms left in the Ark. Requested: %d, available: %d (%d alliterations).",
            requested, remaining, remainingAlliterations);
        if (alliterate && requested <= remaining) {
            return message + " More alliterations were requested than are available, but there are"
                + " enough pseudonyms left that are not alliterations.";
        }
        return message + " Try using custom name parts.";
    }
}
