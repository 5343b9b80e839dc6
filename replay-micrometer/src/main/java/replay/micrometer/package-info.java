/**
 * Micrometer bridge for replay metrics.
 */
package replay.micrometer;
