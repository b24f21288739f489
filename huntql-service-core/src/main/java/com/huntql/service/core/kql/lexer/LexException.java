package com.huntql.service.core.kql.lexer;

import com.huntql.service.core.error.QueryException;
import com.huntql.service.core.error.QueryStage;

/** Malformed query text. Raised at the first offending character; lexing never recovers. */
public class LexException extends QueryException {

    private final int offset;
    private final int line;
    private final int column;

    public LexException(String message, int offset, int line, int column) {
        super(QueryStage.LEX, message + " at line " + line + ", column " + column);
        this.offset = offset;
        this.line = line;
        this.column = column;
    }

    public int offset() {
        return offset;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
