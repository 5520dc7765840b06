package org.dxworks.rapidframe.analyzer;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Line-level patterns of the RAPID language. All keyword matching is
 * case-insensitive, as in the language.
 */
final class RapidSyntax {

    // Unicode-safe identifier: any word char except a digit or underscore to start
    static final String NAME = "[^\\W\\d_]\\w*";

    static final Pattern MODULE = Pattern.compile(
        "^\\s*MODULE\\s+(" + NAME + ")\\s*(?:\\(([^)]*)\\))?", Pattern.CASE_INSENSITIVE);
    static final Pattern END_MODULE = Pattern.compile("^\\s*ENDMODULE\\b", Pattern.CASE_INSENSITIVE);

    static final Pattern PROC_OR_TRAP = Pattern.compile(
        "^\\s*(LOCAL\\s+)?(PROC|TRAP)\\s+(" + NAME + ")", Pattern.CASE_INSENSITIVE);
    static final Pattern FUNC = Pattern.compile(
        "^\\s*(LOCAL\\s+)?FUNC\\s+\\w+\\s+(" + NAME + ")", Pattern.CASE_INSENSITIVE);
    static final Pattern ROUTINE_END = Pattern.compile(
        "^\\s*(ENDPROC|ENDFUNC|ENDTRAP)\\b", Pattern.CASE_INSENSITIVE);

    static final Pattern DECLARATION = Pattern.compile(
        "^\\s*(?:(?:LOCAL|TASK)\\s+)*(VAR|PERS|CONST)\\s+\\w+\\s+(" + NAME + ")", Pattern.CASE_INSENSITIVE);

    static final Pattern BLOCK_IF = Pattern.compile("^IF\\b.*\\bTHEN$", Pattern.CASE_INSENSITIVE);
    static final Pattern COMPACT_IF = Pattern.compile("^IF\\b", Pattern.CASE_INSENSITIVE);
    static final Pattern LOOP_OR_TEST = Pattern.compile("^(FOR|WHILE|TEST)\\b", Pattern.CASE_INSENSITIVE);
    static final Pattern EXTRA_DECISION = Pattern.compile("^(ELSEIF|CASE)\\b", Pattern.CASE_INSENSITIVE);
    static final Pattern BLOCK_END = Pattern.compile("^(ENDIF|ENDFOR|ENDWHILE|ENDTEST)\\b", Pattern.CASE_INSENSITIVE);

    static final Pattern CALL_STATEMENT = Pattern.compile("^(" + NAME + ")(?=\\s|;|\\\\|$)");
    static final Pattern FUNCTION_CALL = Pattern.compile("(?<![\\w.])(" + NAME + ")\\s*\\(");
    static final Pattern CALL_BY_VAR = Pattern.compile(
        "\\bCallByVar\\b[^\\n\"]*\"([^\"]+)\"", Pattern.CASE_INSENSITIVE);
    static final Pattern SIGNAL_ACCESS = Pattern.compile(
        "^(?:Set|Reset|Switch|SetDO|ResetDO|PulseDO)\\s+(?:\\\\[^,;]*,\\s*)*(" + NAME + ")", Pattern.CASE_INSENSITIVE);
    static final Pattern IDENTIFIER = Pattern.compile("(?<![\\w])" + NAME);
    // not a record field (p.x) and not an optional argument switch (\InPos)
    static final Pattern NAME_REFERENCE = Pattern.compile("(?<![\\w.\\\\])" + NAME);
    static final Pattern TP_WRITE = Pattern.compile("^TPWrite\\b", Pattern.CASE_INSENSITIVE);
    static final Pattern STRING_LITERAL = Pattern.compile("\"[^\"]*\"");

    static final Pattern WAIT_TIME = Pattern.compile("\\bWaitTime\\b", Pattern.CASE_INSENSITIVE);
    static final Pattern WAIT_TIME_SECONDS = Pattern.compile(
        "\\bWaitTime\\b\\s*(?:\\\\\\w+\\s*,\\s*)*(\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE);

    private static final Set<String> KEYWORDS = Set.of(
        "ALIAS", "AND", "BACKWARD", "CASE", "CONNECT", "CONST", "DEFAULT", "DIV", "DO", "ELSE",
        "ELSEIF", "ENDFOR", "ENDFUNC", "ENDIF", "ENDMODULE", "ENDPROC", "ENDRECORD", "ENDTEST",
        "ENDTRAP", "ENDWHILE", "ERROR", "EXIT", "FALSE", "FOR", "FROM", "FUNC", "GOTO", "IF",
        "INOUT", "LOCAL", "MOD", "MODULE", "NOSTEPIN", "NOT", "NOVIEW", "OR", "PERS", "PROC",
        "RAISE", "READONLY", "RECORD", "RETRY", "RETURN", "STEP", "SYSMODULE", "TASK", "TEST",
        "THEN", "TO", "TRAP", "TRUE", "TRYNEXT", "UNDO", "VAR", "VIEWONLY", "WHILE", "WITH", "XOR",
        "CALLBYVAR");

    private RapidSyntax() {
    }

    static boolean isKeyword(String word) {
        return KEYWORDS.contains(word.toUpperCase(Locale.ROOT));
    }

    static boolean isComment(String trimmed) {
        return trimmed.startsWith("!");
    }

    /**
     * Cuts a trailing "!" comment, ignoring "!" inside string literals.
     */
    static String stripInlineComment(String line) {
        boolean inString = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                inString = !inString;
            } else if (c == '!' && !inString) {
                return line.substring(0, i);
            }
        }
        return line;
    }

    static String stripStrings(String code) {
        return STRING_LITERAL.matcher(code).replaceAll("\"\"");
    }

    static int leadingWhitespace(String line) {
        int count = 0;
        while (count < line.length() && Character.isWhitespace(line.charAt(count))) {
            count++;
        }
        return count;
    }
}
