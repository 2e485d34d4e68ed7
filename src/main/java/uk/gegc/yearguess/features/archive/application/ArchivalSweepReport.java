package uk.gegc.yearguess.features.archive.application;

/**
 * Outcome counts of one archival sweep.
 *
 * @param examined     challenges older than the cutoff
 * @param finalized    challenges moved from collecting to finalized
 * @param deltaBatches late-guess batches written for already finalized challenges
 * @param skipped      challenges with nothing to do, archival disabled, or moved on by another process
 * @param failed       challenges whose processing threw; they are retried on the next sweep
 */
public record ArchivalSweepReport(int examined, int finalized, int deltaBatches, int skipped, int failed) {
}
