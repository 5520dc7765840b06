package org.dxworks.rapidframe.analyzer;

import org.dxworks.rapidframe.model.CallKind;
import org.dxworks.rapidframe.model.Diagnostic;
import org.dxworks.rapidframe.model.DiagnosticKind;
import org.dxworks.rapidframe.model.LineKind;
import org.dxworks.rapidframe.model.ParsedFile;
import org.dxworks.rapidframe.model.Procedure;
import org.dxworks.rapidframe.model.RoutineKind;
import org.dxworks.rapidframe.model.SourceFile;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Structural parser for RAPID modules (.mod, .prg, .sys).
 *
 * Works line by line with patterns rather than a grammar, so that ill-formed
 * files still yield as much structure as possible: unbalanced block ends clamp
 * the nesting counter at zero and unterminated routines are closed at the next
 * routine header, at ENDMODULE or at end of file.
 */
public class RapidModuleAnalyzer implements FileAnalyzer {

    @Override
    public ParsedFile analyze(SourceFile source) {
        ParseState state = new ParseState(source);
        for (int lineNo = 1; lineNo <= source.lineCount(); lineNo++) {
            state.processLine(lineNo, source.line(lineNo));
        }
        state.finish();
        return state.out.build();
    }

    private static final class ParseState {
        private final SourceFile source;
        private final ParsedFile.Builder out;
        private final Set<String> procedureNames = new HashSet<>();
        private final Set<String> declaredNames = new HashSet<>();
        private int nesting;
        private boolean seenModuleHeader;
        private Procedure.Builder current;

        ParseState(SourceFile source) {
            this.source = source;
            this.out = ParsedFile.builder(source);
        }

        void processLine(int lineNo, String rawLine) {
            String trimmed = rawLine.trim();
            if (trimmed.isEmpty()) {
                recordLine(LineKind.BLANK, false);
                return;
            }
            if (RapidSyntax.isComment(trimmed)) {
                recordLine(LineKind.COMMENT, false);
                return;
            }

            String code = RapidSyntax.stripInlineComment(trimmed).trim();

            if (handleModuleLines(lineNo, code)) {
                recordLine(LineKind.CODE, false);
                return;
            }

            if (handleRoutineStart(lineNo, code)) {
                recordLine(LineKind.CODE, false);
                return;
            }

            boolean routineEnd = RapidSyntax.ROUTINE_END.matcher(code).find();

            if (RapidSyntax.BLOCK_END.matcher(code).find()) {
                if (nesting == 0) {
                    out.addDiagnostic(Diagnostic.at(DiagnosticKind.MALFORMED_NESTING, source.id, lineNo,
                            "Block end without matching opener: " + firstWord(code)));
                } else {
                    nesting--;
                }
            }
            if (RapidSyntax.BLOCK_IF.matcher(code).find() || RapidSyntax.LOOP_OR_TEST.matcher(code).find()) {
                nesting++;
                out.addBlockOpener();
                out.addDecisionPoint();
            } else if (RapidSyntax.EXTRA_DECISION.matcher(code).find()
                    || RapidSyntax.COMPACT_IF.matcher(code).find()) {
                out.addDecisionPoint();
            }

            String expressions = code;
            Matcher declaration = RapidSyntax.DECLARATION.matcher(code);
            if (declaration.find()) {
                String variable = declaration.group(2);
                out.addDeclaredVariable(variable);
                declaredNames.add(variable.toLowerCase(Locale.ROOT));
                if (current != null) {
                    current.addLocalVariable(variable);
                }
                int init = code.indexOf(":=");
                expressions = init >= 0 ? code.substring(init + 2) : "";
            }
            collectIdentifierUses(expressions);

            Matcher signal = RapidSyntax.SIGNAL_ACCESS.matcher(code);
            if (signal.find()) {
                out.addSignalName(signal.group(1));
            }

            if (current != null && !routineEnd) {
                Set<String> called = collectCalls(lineNo, code);
                if (!RapidSyntax.TP_WRITE.matcher(code).find()) {
                    collectReferences(lineNo, expressions, called);
                }
            }

            recordLine(LineKind.CODE, true);

            if (routineEnd) {
                if (current == null) {
                    out.addDiagnostic(Diagnostic.at(DiagnosticKind.UNTERMINATED_PROCEDURE, source.id, lineNo,
                            "Routine end outside of any routine: " + firstWord(code)));
                } else {
                    closeCurrent(lineNo, true);
                }
            }
        }

        private boolean handleModuleLines(int lineNo, String code) {
            if (RapidSyntax.END_MODULE.matcher(code).find()) {
                if (current != null) {
                    out.addDiagnostic(Diagnostic.at(DiagnosticKind.UNTERMINATED_PROCEDURE, source.id, lineNo,
                            "ENDMODULE reached inside routine " + current.name()));
                    closeCurrent(lineNo - 1, false);
                }
                return true;
            }
            Matcher module = RapidSyntax.MODULE.matcher(code);
            if (!module.find()) {
                return false;
            }
            if (!seenModuleHeader) {
                seenModuleHeader = true;
                out.moduleName(module.group(1));
                String attributes = module.group(2);
                if (attributes != null) {
                    for (String attribute : attributes.split(",")) {
                        String normalized = attribute.trim().toUpperCase(Locale.ROOT);
                        if (normalized.isEmpty()) {
                            continue;
                        }
                        out.addModuleAttribute(normalized);
                        if ("NOSTEPIN".equals(normalized)) {
                            out.noStepIn(true);
                        }
                    }
                }
            }
            return true;
        }

        private boolean handleRoutineStart(int lineNo, String code) {
            String name;
            RoutineKind kind;
            boolean local;
            Matcher procOrTrap = RapidSyntax.PROC_OR_TRAP.matcher(code);
            if (procOrTrap.find()) {
                local = procOrTrap.group(1) != null;
                kind = RoutineKind.valueOf(procOrTrap.group(2).toUpperCase(Locale.ROOT));
                name = procOrTrap.group(3);
            } else {
                Matcher func = RapidSyntax.FUNC.matcher(code);
                if (!func.find()) {
                    return false;
                }
                local = func.group(1) != null;
                kind = RoutineKind.FUNC;
                name = func.group(2);
            }

            if (current != null) {
                out.addDiagnostic(Diagnostic.at(DiagnosticKind.UNTERMINATED_PROCEDURE, source.id, lineNo,
                        "Routine " + current.name() + " has no end before " + name));
                closeCurrent(lineNo - 1, false);
            }
            if (!procedureNames.add(name.toLowerCase(Locale.ROOT))) {
                out.addDiagnostic(Diagnostic.at(DiagnosticKind.DUPLICATE_PROCEDURE, source.id, lineNo,
                        "Routine " + name + " is declared more than once in this file"));
            }
            current = Procedure.builder(source.id, name)
                    .moduleName(out.hasModuleName() ? out.moduleName() : baseName(source.id))
                    .kind(kind)
                    .local(local)
                    .noStepIn(out.noStepIn())
                    .startLine(lineNo);
            return true;
        }

        private Set<String> collectCalls(int lineNo, String code) {
            Set<String> called = new HashSet<>();
            Matcher dynamic = RapidSyntax.CALL_BY_VAR.matcher(code);
            if (dynamic.find()) {
                String prefix = dynamic.group(1).trim();
                if (!prefix.isEmpty()) {
                    current.addCall(prefix, lineNo, CallKind.DYNAMIC);
                }
            }

            String withoutStrings = RapidSyntax.stripStrings(code);
            Matcher statement = RapidSyntax.CALL_STATEMENT.matcher(withoutStrings);
            if (statement.find()) {
                String target = statement.group(1);
                String rest = withoutStrings.substring(statement.end()).trim();
                if (!RapidSyntax.isKeyword(target) && !rest.startsWith(":")) {
                    current.addCall(target, lineNo, CallKind.STATIC);
                    called.add(target.toLowerCase(Locale.ROOT));
                }
            }

            Matcher function = RapidSyntax.FUNCTION_CALL.matcher(withoutStrings);
            while (function.find()) {
                String target = function.group(1);
                if (!RapidSyntax.isKeyword(target)) {
                    current.addCall(target, lineNo, CallKind.STATIC);
                    called.add(target.toLowerCase(Locale.ROOT));
                }
            }
            return called;
        }

        /**
         * Every other name on the line may still be a routine: the body of a
         * compact IF, the trap of CONNECT ... WITH, a routine passed along. The
         * graph keeps only the ones that name a known procedure.
         */
        private void collectReferences(int lineNo, String expressions, Set<String> called) {
            Set<String> seen = new HashSet<>(called);
            Matcher names = RapidSyntax.NAME_REFERENCE.matcher(RapidSyntax.stripStrings(expressions));
            while (names.find()) {
                String name = names.group();
                String key = name.toLowerCase(Locale.ROOT);
                if (RapidSyntax.isKeyword(name) || declaredNames.contains(key) || !seen.add(key)) {
                    continue;
                }
                current.addReference(name, lineNo);
            }
        }

        private void collectIdentifierUses(String code) {
            Matcher identifiers = RapidSyntax.IDENTIFIER.matcher(RapidSyntax.stripStrings(code));
            while (identifiers.find()) {
                String identifier = identifiers.group();
                if (!RapidSyntax.isKeyword(identifier)) {
                    out.addIdentifierUse(identifier.toLowerCase(Locale.ROOT));
                }
            }
        }

        private void recordLine(LineKind kind, boolean codeInRoutine) {
            out.addLine(kind, nesting);
            if (current != null) {
                current.addNestingSample(nesting);
                if (codeInRoutine) {
                    current.addCodeLine();
                }
            }
        }

        private void closeCurrent(int endLine, boolean terminated) {
            Procedure.Builder closing = current;
            current = null;
            out.addProcedure(closing.endLine(Math.max(endLine, 0)).terminated(terminated).build());
        }

        void finish() {
            if (current != null) {
                out.addDiagnostic(Diagnostic.at(DiagnosticKind.UNTERMINATED_PROCEDURE, source.id, source.lineCount(),
                        "End of file reached inside routine " + current.name()));
                closeCurrent(source.lineCount(), false);
            }
        }

        private static String firstWord(String code) {
            int space = code.indexOf(' ');
            String word = space < 0 ? code : code.substring(0, space);
            return word.endsWith(";") ? word.substring(0, word.length() - 1) : word;
        }

        private static String baseName(String fileId) {
            String name = fileId.replace('\\', '/');
            int slash = name.lastIndexOf('/');
            if (slash >= 0) {
                name = name.substring(slash + 1);
            }
            int dot = name.lastIndexOf('.');
            return dot > 0 ? name.substring(0, dot) : name;
        }
    }
}
