package org.carball.lbs.ai;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the SQL statement out of a free-text model response.
 */
public final class SqlResponseParser {

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:sql|SQL|tsql)?\\s*\\n?(.*?)(?:```|$)", Pattern.DOTALL);
    private static final Pattern LINE_START = Pattern.compile("(?im)^\\s*(SELECT|WITH)\\b");
    private static final Pattern SELECT_KEYWORD = Pattern.compile("(?i)\\bSELECT\\b");

    private SqlResponseParser() {
    }

    public static String extractSql(String response) {
        if (response == null) {
            return "";
        }
        String sql = response.strip();

        Matcher fenced = FENCED_BLOCK.matcher(sql);
        if (fenced.find()) {
            sql = fenced.group(1).strip();
        }

        // Drop any prose before the statement
        Matcher start = LINE_START.matcher(sql);
        if (start.find()) {
            sql = sql.substring(start.start(1));
        } else {
            Matcher select = SELECT_KEYWORD.matcher(sql);
            if (select.find()) {
                sql = sql.substring(select.start());
            }
        }

        while (sql.endsWith(";")) {
            sql = sql.substring(0, sql.length() - 1).stripTrailing();
        }
        return sql;
    }
}
