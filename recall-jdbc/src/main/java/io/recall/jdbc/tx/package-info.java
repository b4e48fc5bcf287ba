/**
 * Thread-bound JDBC transactions for use outside Spring.
 */
package io.recall.jdbc.tx;
