package io.arkpseudonyms.keys;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// Validation and transposition of key columns into key rows.
///
/// Keys arrive as one or more equal-length columns, conceptually a table. Row `i` is the
/// `i`-th value of every column, in column order.
public final class KeyRows {

    private KeyRows() {
    }

    /// Transpose columns into rows.
    /// @param columns one or more columns of equal length
    /// @return one row per position, each an unmodifiable list with one value per column
    /// @throws IllegalArgumentException if no columns are given
    /// @throws InconsistentLengthException if the columns differ in length
    public static List<List<Object>> rows(List<?>... columns) {
        int length = checkedLength(columns);
        List<List<Object>> rows = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            List<Object> row = new ArrayList<>(columns.length);
            for (List<?> column : columns) {
                row.add(column.get(i));
            }
            rows.add(Collections.unmodifiableList(row));
        }
        return rows;
    }

    /// Check that the columns can form a table.
    /// @param columns one or more columns
    /// @return the common column length
    /// @throws IllegalArgumentException if no columns are given
    /// @throws InconsistentLengthException if the columns differ in length
    public static int checkedLength(List<?>... columns) {
        if (columns == null || columns.length == 0) {
            throw new IllegalArgumentException("At least one key column is required");
        }
        int[] lengths = new int[columns.length];
        boolean consistent = true;
        for (int i = 0; i < columns.length; i++) {
            if (columns[i] == null) {
                throw new IllegalArgumentException("Key column " + i + " is null");
            }
            lengths[i] = columns[i].size();
            consistent &= lengths[i] == lengths[0];
        }
        if (!consistent) {
            throw new InconsistentLengthException(lengths);
        }
        return lengths[0];
    }

    /// Detect keys that are all whole numbers typed as floating point.
    ///
    /// Such keys hash differently from the same numbers typed as integers, which usually
    /// surprises callers, so this is worth a warning.
    /// @param columns the key columns
    /// @return true if every column is non-empty and holds only finite, whole
    ///     [Double] or [Float] values
    public static boolean allIntegralDoubles(List<?>... columns) {
        for (List<?> column : columns) {
            if (column.isEmpty()) {
                return false;
            }
            for (Object value : column) {
                if (!(value instanceof Double || value instanceof Float)) {
                    return false;
                }
                double d = ((Number) value).doubleValue();
                if (Double.isInfinite(d) || Double.isNaN(d) || d % 1 != 0) {
                    return false;
                }
            }
        }
        return columns.length > 0;
    }
}
