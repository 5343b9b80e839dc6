/**
 * Built-in dialects and their error classifiers, discovered through {@link replay.jdbc.dialect.Dialects}.
 */
package replay.jdbc.dialect;
