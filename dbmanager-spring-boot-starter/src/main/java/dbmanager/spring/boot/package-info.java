/**
 * Spring Boot auto-configuration for the database connection manager.
 *
 * @see dbmanager.spring.boot.DbManagerAutoConfiguration
 * @see dbmanager.spring.boot.DbManagerProperties
 */
package dbmanager.spring.boot;
