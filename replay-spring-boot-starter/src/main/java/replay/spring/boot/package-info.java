/**
 * Spring Boot auto-configuration for the replay connection pool.
 */
package replay.spring.boot;
