package de.ialistannen.searchlight.scan;

/**
 * A created, not necessarily running, scan job.
 *
 * @param name the job name
 * @param id the executor's id for the job
 */
public record ScanJob(String name, String id) {

}
