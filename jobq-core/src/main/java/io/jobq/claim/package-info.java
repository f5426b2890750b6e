/**
 * The claim protocol: advisory candidate selection followed by an atomic conditional claim.
 *
 * @see io.jobq.claim.JobClaimer
 */
package io.jobq.claim;
