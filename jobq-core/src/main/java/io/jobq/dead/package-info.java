/**
 * Inspection and replay of jobs that exhausted their attempts.
 */
package io.jobq.dead;
