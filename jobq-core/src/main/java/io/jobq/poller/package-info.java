/**
 * The poll stream: a scheduled loop that runs one claim per tick and hands the outcome to a
 * single consumer.
 */
package io.jobq.poller;
