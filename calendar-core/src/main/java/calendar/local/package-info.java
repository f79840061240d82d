/**
 * In-memory implementations: the {@code local} backend, hidden-item store and UID index.
 */
package calendar.local;
