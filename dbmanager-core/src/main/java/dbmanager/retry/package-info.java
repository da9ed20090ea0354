/**
 * Retry policies for connection attempts.
 *
 * @see dbmanager.retry.RetryPolicy
 * @see dbmanager.retry.LinearBackoffRetryPolicy
 */
package dbmanager.retry;
