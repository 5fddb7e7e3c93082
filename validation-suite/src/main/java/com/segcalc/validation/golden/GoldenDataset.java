package com.segcalc.validation.golden;

import java.util.List;

/**
 * Rows of the golden catalogue plus where they were read from.
 */
public record GoldenDataset(String source, List<GoldenRecord> rows) {

    public GoldenDataset {
        rows = List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }
}
