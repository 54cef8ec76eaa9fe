package com.energyweather.recon.model;

/**
 * Counters of one {@code MasterStore.merge} call.
 *
 * @param incoming rows offered in the batch
 * @param dropped  rows excluded before conflict resolution (missing date)
 * @param inserted keys that did not exist before the merge
 * @param replaced accepted rows that overwrote an earlier row with the same key
 * @param total    rows in the store after the merge
 */
public record MergeResult(int incoming, int dropped, int inserted, int replaced, int total) {
}
