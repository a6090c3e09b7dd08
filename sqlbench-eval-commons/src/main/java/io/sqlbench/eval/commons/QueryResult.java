package io.sqlbench.eval.commons;

import java.sql.Connection;
import java.util.List;

/**
 * @param rows fetched rows, {@code null} when the statement produced no result set
 * @param connection the connection the statement ran on, to be reused for the rest of the phase
 */
public record QueryResult(List<List<Object>> rows, Connection connection) {
}
