/**
 * JSON payloads for jobq via Jackson.
 */
package io.jobq.jackson;
