/**
 * Service-provider interface for database dialects.
 */
package replay.jdbc.spi;
