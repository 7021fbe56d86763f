package com.leadharvest.scrape.model;

/**
 * @param update overwrite existing targets with the same name instead of skipping them
 * @param disableMissing disable stored targets absent from the definitions
 * @param dryRun report what would change without writing
 */
public record TargetSyncOptions(boolean update, boolean disableMissing, boolean dryRun) {
}
