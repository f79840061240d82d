/**
 * JDBC persistence for the federation layer.
 *
 * <p>{@link calendar.jdbc.Database} is a calendar backend over plain JDBC, activated under the
 * canonical name {@code database}. {@link calendar.jdbc.JdbcHiddenItemStore} and
 * {@link calendar.jdbc.JdbcUidIndex} persist the dispatcher's hidden items and UID index.
 * All components share a table prefix (default {@code calendar_}); DDL for H2, PostgreSQL and
 * MySQL ships under {@code /schema}.
 *
 * @see calendar.jdbc.JdbcTemplate
 * @see calendar.jdbc.TableNames
 */
package calendar.jdbc;
