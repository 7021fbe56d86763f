package com.leadharvest.scrape.model;

/**
 * @param written false when a terminal record was matched and left untouched
 */
public record UpsertResult(ProspectRecord record, boolean created, boolean written) {
    public static UpsertResult created(ProspectRecord record) {
        return new UpsertResult(record, true, true);
    }

    public static UpsertResult updated(ProspectRecord record) {
        return new UpsertResult(record, false, true);
    }

    public static UpsertResult untouched(ProspectRecord record) {
        return new UpsertResult(record, false, false);
    }
}
