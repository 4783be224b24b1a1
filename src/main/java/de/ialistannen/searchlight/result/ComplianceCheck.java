package de.ialistannen.searchlight.result;

/**
 * A single compliance check.
 *
 * @param id the check id
 * @param title the check title
 * @param status the upper-cased status as reported, e.g. {@code PASSED}
 * @param description the description, if the scanner sent one
 */
public record ComplianceCheck(String id, String title, String status, String description) {

}
