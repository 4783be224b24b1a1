package de.ialistannen.searchlight.scan;

/**
 * One run of a {@link ScanJob}.
 *
 * @param job the job
 * @param id the executor's id of this run
 */
public record ScanExecution(ScanJob job, String id) {

}
