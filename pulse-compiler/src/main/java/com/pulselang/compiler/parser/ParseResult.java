package com.pulselang.compiler.parser;

import com.pulselang.compiler.analysis.Diagnostic;
import com.pulselang.compiler.ast.decl.Program;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 容错解析的结果
 *
 * <p>出错的顶层成员被跳过，{@link #getProgram()} 只含成功解析的部分。</p>
 */
public final class ParseResult {

    private final Program program;
    private final List<ParseError> errors;

    public ParseResult(Program program, List<ParseError> errors) {
        this.program = program;
        this.errors = Collections.unmodifiableList(new ArrayList<ParseError>(errors));
    }

    public Program getProgram() {
        return program;
    }

    /** 按出现顺序 */
    public List<ParseError> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public List<Diagnostic> toDiagnostics() {
        List<Diagnostic> result = new ArrayList<Diagnostic>(errors.size());
        for (ParseError error : errors) {
            result.add(error.toDiagnostic());
        }
        return result;
    }
}
