package org.dxworks.cobolscope.lexer;

import java.util.Locale;
import java.util.Set;

/**
 * COBOL reserved words, figurative constants included. Anything else made of word characters
 * is a user-defined word.
 */
public final class ReservedWords {

    private static final Set<String> RESERVED = Set.of(
            "ACCEPT", "ACCESS", "ADD", "ADDRESS", "ADVANCING", "AFTER", "ALL", "ALPHABET", "ALPHABETIC",
            "ALPHABETIC-LOWER", "ALPHABETIC-UPPER", "ALPHANUMERIC", "ALPHANUMERIC-EDITED", "ALSO", "ALTER",
            "ALTERNATE", "AND", "ANY", "ARE", "AREA", "AREAS", "ASCENDING", "ASSIGN", "AT", "AUTHOR",
            "BEFORE", "BINARY", "BLANK", "BLOCK", "BOTTOM", "BY",
            "CALL", "CANCEL", "CHARACTER", "CHARACTERS", "CLASS", "CLOSE", "CODE", "CODE-SET", "COLLATING",
            "COMMA", "COMMON", "COMP", "COMP-1", "COMP-2", "COMP-3", "COMP-4", "COMP-5", "COMPUTATIONAL",
            "COMPUTATIONAL-1", "COMPUTATIONAL-2", "COMPUTATIONAL-3", "COMPUTATIONAL-4", "COMPUTATIONAL-5",
            "COMPUTE", "CONFIGURATION", "CONTAINS", "CONTENT", "CONTINUE", "CONVERTING", "COPY", "CORR",
            "CORRESPONDING", "COUNT", "CURRENCY",
            "DATA", "DATE", "DATE-COMPILED", "DATE-WRITTEN", "DAY", "DAY-OF-WEEK", "DEBUGGING", "DECIMAL-POINT",
            "DECLARATIVES", "DELETE", "DELIMITED", "DELIMITER", "DEPENDING", "DESCENDING", "DISPLAY",
            "DIVIDE", "DIVISION", "DOWN", "DUPLICATES", "DYNAMIC",
            "ELSE", "END", "END-ACCEPT", "END-ADD", "END-CALL", "END-COMPUTE", "END-DELETE", "END-DISPLAY",
            "END-DIVIDE", "END-EVALUATE", "END-EXEC", "END-IF", "END-MULTIPLY", "END-OF-PAGE", "END-PERFORM",
            "END-READ", "END-RETURN", "END-REWRITE", "END-SEARCH", "END-START", "END-STRING", "END-SUBTRACT",
            "END-UNSTRING", "END-WRITE", "ENTRY", "ENVIRONMENT", "EOP", "EQUAL", "ERROR", "EVALUATE",
            "EXCEPTION", "EXEC", "EXIT", "EXTEND", "EXTERNAL",
            "FALSE", "FD", "FILE", "FILE-CONTROL", "FILLER", "FIRST", "FOOTING", "FOR", "FROM", "FUNCTION",
            "GENERATE", "GIVING", "GLOBAL", "GO", "GOBACK", "GREATER", "GROUP",
            "HIGH-VALUE", "HIGH-VALUES",
            "I-O", "I-O-CONTROL", "ID", "IDENTIFICATION", "IF", "IN", "INDEX", "INDEXED", "INITIAL",
            "INITIALIZE", "INPUT", "INPUT-OUTPUT", "INSPECT", "INSTALLATION", "INTO", "INVALID", "IS",
            "JUST", "JUSTIFIED",
            "KEY",
            "LABEL", "LEADING", "LEFT", "LENGTH", "LESS", "LINAGE", "LINE", "LINES", "LINKAGE", "LOCAL-STORAGE",
            "LOCK", "LOW-VALUE", "LOW-VALUES",
            "MEMORY", "MERGE", "MODE", "MOVE", "MULTIPLE", "MULTIPLY",
            "NATIVE", "NEGATIVE", "NEXT", "NO", "NOT", "NULL", "NULLS", "NUMERIC", "NUMERIC-EDITED",
            "OBJECT-COMPUTER", "OCCURS", "OF", "OFF", "OMITTED", "ON", "OPEN", "OPTIONAL", "OR", "ORDER",
            "ORGANIZATION", "OTHER", "OUTPUT", "OVERFLOW",
            "PACKED-DECIMAL", "PADDING", "PAGE", "PERFORM", "PIC", "PICTURE", "POINTER", "POSITION",
            "POSITIVE", "PROCEDURE", "PROCEDURES", "PROCEED", "PROGRAM", "PROGRAM-ID",
            "QUOTE", "QUOTES",
            "RANDOM", "READ", "RECORD", "RECORDING", "RECORDS", "REDEFINES", "REEL", "REFERENCE",
            "RELATIVE", "RELEASE", "REMAINDER", "REMARKS", "REMOVAL", "RENAMES", "REPLACE", "REPLACING",
            "RERUN", "RESERVE", "RETURN", "RETURNING", "REWIND", "REWRITE", "RIGHT", "ROUNDED", "RUN",
            "SAME", "SD", "SEARCH", "SECTION", "SECURITY", "SEGMENT-LIMIT", "SELECT", "SENTENCE", "SEPARATE",
            "SEQUENCE", "SEQUENTIAL", "SET", "SIGN", "SIZE", "SORT", "SORT-MERGE", "SOURCE-COMPUTER",
            "SPACE", "SPACES", "SPECIAL-NAMES", "STANDARD", "STANDARD-1", "STANDARD-2", "START", "STATUS",
            "STOP", "STRING", "SUBTRACT", "SUPPRESS", "SYMBOLIC", "SYNC", "SYNCHRONIZED",
            "TALLYING", "TAPE", "TEST", "THAN", "THEN", "THROUGH", "THRU", "TIME", "TIMES", "TO", "TOP",
            "TRAILING", "TRUE",
            "UNIT", "UNSTRING", "UNTIL", "UP", "UPON", "USAGE", "USE", "USING",
            "VALUE", "VALUES", "VARYING",
            "WHEN", "WITH", "WORDS", "WORKING-STORAGE", "WRITE",
            "ZERO", "ZEROES", "ZEROS"
    );

    private static final Set<String> FIGURATIVE_CONSTANTS = Set.of(
            "ZERO", "ZEROS", "ZEROES", "SPACE", "SPACES", "HIGH-VALUE", "HIGH-VALUES",
            "LOW-VALUE", "LOW-VALUES", "QUOTE", "QUOTES", "NULL", "NULLS", "ALL"
    );

    private ReservedWords() {
    }

    public static boolean isReserved(String word) {
        return RESERVED.contains(word.toUpperCase(Locale.ROOT));
    }

    public static boolean isFigurativeConstant(String word) {
        return FIGURATIVE_CONSTANTS.contains(word.toUpperCase(Locale.ROOT));
    }
}
