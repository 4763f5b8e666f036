package org.waabox.filedex.jdbc;

import java.util.List;

/**
 * A secondary index of the catalog schema.
 *
 * @param name    the index name, never null
 * @param table   the indexed table, never null
 * @param columns the indexed columns in order, never empty
 * @param unique  whether the index enforces uniqueness
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record IndexDef(String name, String table, List<String> columns,
    boolean unique) {
}
