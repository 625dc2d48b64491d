package org.opendigraph.util;

/** Implemented by classes that log through {@link Logger#belowLevel(IWritesLogs, int)};
 * their logging level is set with the simple class name. */
public interface IWritesLogs {
}
