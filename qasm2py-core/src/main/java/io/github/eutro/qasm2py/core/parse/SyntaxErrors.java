package io.github.eutro.qasm2py.core.parse;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/**
 * Turns the first lexer or parser error into a {@link QasmSyntaxException}, instead of
 * letting ANTLR print it and recover.
 */
final class SyntaxErrors extends BaseErrorListener {
    static final SyntaxErrors INSTANCE = new SyntaxErrors();

    private SyntaxErrors() {
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer,
                            Object offendingSymbol,
                            int line,
                            int charPositionInLine,
                            String msg,
                            RecognitionException e) {
        QasmSyntaxException ex = new QasmSyntaxException(line, charPositionInLine + 1, msg);
        if (e != null) ex.initCause(e);
        throw ex;
    }
}
