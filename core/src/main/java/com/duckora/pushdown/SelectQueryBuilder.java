package com.duckora.pushdown;

import com.duckora.scan.ScanBindData;
import com.duckora.util.SQLQuoting;

import java.util.List;
import java.util.OptionalLong;
import java.util.StringJoiner;

/**
 * Renders the remote SELECT for a scan.
 *
 * <p>Shape of the inner query:
 * <pre>
 *   SELECT "C1", "C2", ROWID "ROWID__" FROM "SCHEMA"."TABLE" WHERE f1 AND f2
 * </pre>
 *
 * <p>Paging depends on the remote major version. From 12 on the native
 * row-limiting clause is appended:
 * <pre>
 *   ... OFFSET 5 ROWS FETCH FIRST 10 ROWS ONLY
 * </pre>
 * Older servers get the inner query wrapped, unchanged, in a row-counter
 * filter:
 * <pre>
 *   SELECT "C1", "C2" FROM (SELECT t__.*, ROWNUM rowcounter__ FROM (inner) t__
 *     WHERE ROWNUM &lt;= 15) WHERE rowcounter__ &gt; 5 AND rowcounter__ &lt;= 15
 * </pre>
 */
public final class SelectQueryBuilder {

    /** First major version with OFFSET/FETCH FIRST. */
    public static final int NATIVE_PAGING_VERSION = 12;

    static final String ROW_COUNTER = "rowcounter__";

    private SelectQueryBuilder() {
    }

    /**
     * Builds the complete remote query for the bind data.
     *
     * @param bindData the scan descriptor
     * @return the SQL text
     */
    public static String build(ScanBindData bindData) {
        String inner = buildUnpaged(bindData);

        OptionalLong limit = bindData.limit();
        long offset = bindData.offset();
        if (limit.isEmpty() && offset == 0) {
            return inner;
        }

        if (bindData.majorVersion() >= NATIVE_PAGING_VERSION) {
            StringBuilder sb = new StringBuilder(inner);
            if (offset > 0) {
                sb.append(" OFFSET ").append(offset).append(" ROWS");
            }
            if (limit.isPresent()) {
                sb.append(" FETCH FIRST ").append(limit.getAsLong()).append(" ROWS ONLY");
            }
            return sb.toString();
        }

        return wrapWithRowCounter(inner, outputColumns(bindData), limit, offset);
    }

    /**
     * Builds the query without any paging.
     */
    public static String buildUnpaged(ScanBindData bindData) {
        StringBuilder sb = new StringBuilder("SELECT ");
        sb.append(selectList(bindData));
        sb.append(" FROM ").append(SQLQuoting.quoteQualified(bindData.schema(), bindData.table()));

        List<String> filters = bindData.filters();
        if (!filters.isEmpty()) {
            sb.append(" WHERE ").append(String.join(" AND ", filters));
        }
        return sb.toString();
    }

    private static String selectList(ScanBindData bindData) {
        StringJoiner cols = new StringJoiner(", ");
        List<String> names = bindData.columnNames();
        for (int id : bindData.projection()) {
            if (id == ScanBindData.ROW_ID) {
                cols.add("ROWID " + SQLQuoting.quoteIdentifier(ScanBindData.ROW_ID_NAME));
            } else {
                cols.add(SQLQuoting.quoteIdentifier(names.get(id)));
            }
        }
        return cols.toString();
    }

    private static String outputColumns(ScanBindData bindData) {
        StringJoiner cols = new StringJoiner(", ");
        for (String name : bindData.projectedNames()) {
            cols.add(SQLQuoting.quoteIdentifier(name));
        }
        return cols.toString();
    }

    private static String wrapWithRowCounter(String inner, String columns, OptionalLong limit, long offset) {
        StringBuilder sb = new StringBuilder("SELECT ").append(columns)
            .append(" FROM (SELECT t__.*, ROWNUM ").append(ROW_COUNTER)
            .append(" FROM (").append(inner).append(") t__");
        // a window reaching past Long.MAX_VALUE has no upper bound
        if (limit.isPresent() && limit.getAsLong() <= Long.MAX_VALUE - offset) {
            long upper = offset + limit.getAsLong();
            sb.append(" WHERE ROWNUM <= ").append(upper).append(")")
              .append(" WHERE ").append(ROW_COUNTER).append(" > ").append(offset)
              .append(" AND ").append(ROW_COUNTER).append(" <= ").append(upper);
        } else {
            sb.append(") WHERE ").append(ROW_COUNTER).append(" > ").append(offset);
        }
        return sb.toString();
    }
}
