package org.carball.lbs.ai;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.Statements;
import net.sf.jsqlparser.statement.select.Select;

import java.util.Optional;

/**
 * Rejects generated statements that would modify the warehouse. SQL the parser cannot read is
 * passed on to the database, which reports its own error.
 */
@Slf4j
public final class SqlSafetyValidator {

    private SqlSafetyValidator() {
    }

    /**
     * @return the rejection reason, or empty when the SQL may be executed
     */
    public static Optional<String> check(String sql) {
        if (sql == null || sql.isBlank()) {
            return Optional.of("No SQL statement was generated");
        }

        Statements statements;
        try {
            statements = CCJSqlParserUtil.parseStatements(sql, parser -> parser.withSquareBracketQuotation(true));
        } catch (JSQLParserException e) {
            log.debug("Could not parse generated SQL, leaving validation to the database: {}", e.getMessage());
            return Optional.empty();
        }

        for (Statement statement : statements.getStatements()) {
            if (!(statement instanceof Select)) {
                return Optional.of("Only SELECT statements can be executed, got: "
                        + statement.getClass().getSimpleName());
            }
        }
        return Optional.empty();
    }
}
