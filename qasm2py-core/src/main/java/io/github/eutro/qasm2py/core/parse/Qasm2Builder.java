package io.github.eutro.qasm2py.core.parse;

import io.github.eutro.qasm2py.core.gates.Expr;
import io.github.eutro.qasm2py.core.gates.GateDefinition;
import io.github.eutro.qasm2py.core.gates.ModifiedGate;
import io.github.eutro.qasm2py.core.gates.Modifiers;
import io.github.eutro.qasm2py.core.ir.Circuit;
import io.github.eutro.qasm2py.core.ir.Clbit;
import io.github.eutro.qasm2py.core.ir.Param;
import io.github.eutro.qasm2py.core.ir.Qubit;
import io.github.eutro.qasm2py.core.parse.antlr.Qasm2BaseVisitor;
import io.github.eutro.qasm2py.core.parse.antlr.Qasm2Lexer;
import io.github.eutro.qasm2py.core.parse.antlr.Qasm2Parser;
import io.github.eutro.qasm2py.core.parse.antlr.Qasm2Parser.*;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Builds circuits from OpenQASM 2.0 parse trees.
 * <p>
 * Supported: {@code include "qelib1.inc"}, {@code qreg}, {@code creg}, {@code gate},
 * {@code opaque}, gate calls (with register broadcasting), {@code measure}, {@code reset},
 * {@code barrier} and classically conditioned operations. Conditions are dropped, so
 * {@code if (c==1) x q[0];} applies {@code x} unconditionally.
 */
final class Qasm2Builder extends Qasm2BaseVisitor<Void> {
    private static final Logger LOG = Logger.getLogger(Qasm2Builder.class.getName());

    private static final List<GateDefinition> BUILTINS = Arrays.asList(GateDefinition.U, GateDefinition.CX);
    private static final Map<String, Double> CONSTANTS = Collections.singletonMap("pi", Math.PI);
    static final Map<String, Param.Function> FUNCTIONS;

    static {
        Map<String, Param.Function> functions = new HashMap<>();
        for (Param.Function fn : Arrays.asList(
                Param.Function.SIN, Param.Function.COS, Param.Function.TAN,
                Param.Function.EXP, Param.Function.LN, Param.Function.SQRT)) {
            functions.put(fn.getName(), fn);
        }
        FUNCTIONS = Collections.unmodifiableMap(functions);
    }

    private final CircuitBuilder builder;

    private Qasm2Builder(boolean library) {
        builder = new CircuitBuilder(library, BUILTINS, CONSTANTS, FUNCTIONS);
    }

    private static Qasm2Parser parser(@NotNull String source) {
        Qasm2Lexer lexer = new Qasm2Lexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(SyntaxErrors.INSTANCE);
        Qasm2Parser parser = new Qasm2Parser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(SyntaxErrors.INSTANCE);
        return parser;
    }

    /**
     * Parse a program.
     *
     * @param source The source.
     * @return The circuit.
     * @throws QasmSyntaxException If the source is not a valid program.
     */
    static Circuit parseProgram(@NotNull String source) {
        Qasm2Builder visitor = new Qasm2Builder(false);
        visitor.visit(parser(source).program());
        return visitor.builder.getCircuit();
    }

    /**
     * Parse a library of gate definitions, with no version header.
     *
     * @param source The source.
     * @return The gates defined, and the built-ins, by source name.
     * @throws QasmSyntaxException If the source is not a valid library.
     */
    static Map<String, GateDefinition> parseLibrary(@NotNull String source) {
        Qasm2Builder visitor = new Qasm2Builder(true);
        visitor.visit(parser(source).library());
        return visitor.builder.getGates();
    }

    @Override
    public Void visitVersion(VersionContext ctx) {
        builder.checkVersion(ctx.number, 2);
        return null;
    }

    @Override
    public Void visitLibrary(LibraryContext ctx) {
        for (StatementContext statement : ctx.statement()) {
            visit(statement);
            builder.checkLibraryStatement(statement.getStart());
        }
        return null;
    }

    @Override
    public Void visitIncludeStatement(IncludeStatementContext ctx) {
        builder.include(ctx.StringLiteral().getSymbol(), Includes.QELIB1, Includes::qelib1);
        return null;
    }

    @Override
    public Void visitRegisterDeclaration(RegisterDeclarationContext ctx) {
        int size = builder.size(ctx.Integer().getSymbol());
        if (ctx.kind.getType() == Qasm2Lexer.QREG) {
            builder.declareQubits(ctx.Identifier().getSymbol(), size);
        } else {
            builder.declareClbits(ctx.Identifier().getSymbol(), size);
        }
        return null;
    }

    @Override
    public Void visitGateDefinition(GateDefinitionContext ctx) {
        Map<String, Integer> params = parameters(ctx.parameterList());
        Map<String, Integer> qargs = CircuitBuilder.names(ctx.identifierList().Identifier(), "qubit argument");
        List<GateDefinition.Statement> body = new ArrayList<>();
        for (BodyStatementContext statement : ctx.gateBody().bodyStatement()) {
            body.add(bodyStatement(statement, params, qargs));
        }
        builder.defineGate(ctx.Identifier().getSymbol(), GateDefinition.define(
                ctx.Identifier().getText(),
                new ArrayList<>(params.keySet()),
                new ArrayList<>(qargs.keySet()),
                body));
        return null;
    }

    @Override
    public Void visitOpaqueDefinition(OpaqueDefinitionContext ctx) {
        Map<String, Integer> params = parameters(ctx.parameterList());
        Map<String, Integer> qargs = ctx.identifierList() == null
                ? Collections.emptyMap()
                : CircuitBuilder.names(ctx.identifierList().Identifier(), "qubit argument");
        builder.defineGate(ctx.Identifier().getSymbol(), GateDefinition.opaque(
                ctx.Identifier().getText(),
                new ArrayList<>(params.keySet()),
                new ArrayList<>(qargs.keySet())));
        return null;
    }

    private static Map<String, Integer> parameters(@Nullable ParameterListContext ctx) {
        if (ctx == null || ctx.identifierList() == null) return Collections.emptyMap();
        return CircuitBuilder.names(ctx.identifierList().Identifier(), "parameter name");
    }

    private GateDefinition.Statement bodyStatement(BodyStatementContext ctx,
                                                   Map<String, Integer> params,
                                                   Map<String, Integer> qargs) {
        if (ctx instanceof BodyBarrierContext) {
            List<TerminalNode> ids = ((BodyBarrierContext) ctx).identifierList().Identifier();
            int[] args = new int[ids.size()];
            for (int i = 0; i < args.length; i++) {
                args[i] = CircuitBuilder.bodyQubit(ids.get(i), null, qargs);
            }
            return GateDefinition.Statement.barrier(args);
        }
        GateCallContext call = ((BodyGateCallContext) ctx).gateCall();
        ModifiedGate gate = builder.modify(call.Identifier().getSymbol(), Modifiers.NONE);
        List<ArgumentContext> arguments = call.argumentList() == null
                ? Collections.emptyList()
                : call.argumentList().argument();
        int[] args = new int[arguments.size()];
        for (int i = 0; i < args.length; i++) {
            args[i] = CircuitBuilder.bodyQubit(arguments.get(i).Identifier(), arguments.get(i).Integer(), qargs);
        }
        return CircuitBuilder.bodyCall(call.Identifier().getSymbol(), gate, expressions(call, params), args);
    }

    @Override
    public Void visitIfStatement(IfStatementContext ctx) {
        TerminalNode creg = ctx.Identifier();
        if (!builder.isClassicalRegister(creg.getText())) {
            throw CircuitBuilder.error(creg.getSymbol(), "unknown classical register " + creg.getText());
        }
        LOG.warning(() -> String.format("%d:%d: condition %s==%s is not supported and was dropped",
                ctx.getStart().getLine(), ctx.getStart().getCharPositionInLine() + 1,
                creg.getText(), ctx.Integer().getText()));
        return visit(ctx.quantumOperation());
    }

    @Override
    public Void visitGateOperation(GateOperationContext ctx) {
        GateCallContext call = ctx.gateCall();
        ModifiedGate gate = builder.modify(call.Identifier().getSymbol(), Modifiers.NONE);
        List<CircuitBuilder.Operand<Qubit>> operands = new ArrayList<>();
        if (call.argumentList() != null) {
            for (ArgumentContext argument : call.argumentList().argument()) {
                operands.add(builder.qubits(argument.Identifier(), argument.Integer()));
            }
        }
        builder.gateCall(call.Identifier().getSymbol(), gate, expressions(call, null), operands);
        return null;
    }

    @Override
    public Void visitMeasureOperation(MeasureOperationContext ctx) {
        ArgumentContext q = ctx.argument(0);
        ArgumentContext c = ctx.argument(1);
        CircuitBuilder.Operand<Qubit> qubits = builder.qubits(q.Identifier(), q.Integer());
        CircuitBuilder.Operand<Clbit> clbits = builder.clbits(c.Identifier(), c.Integer());
        builder.measure(ctx.MEASURE().getSymbol(), qubits, clbits);
        return null;
    }

    @Override
    public Void visitResetOperation(ResetOperationContext ctx) {
        builder.reset(builder.qubits(ctx.argument().Identifier(), ctx.argument().Integer()));
        return null;
    }

    @Override
    public Void visitBarrierStatement(BarrierStatementContext ctx) {
        List<CircuitBuilder.Operand<Qubit>> operands = new ArrayList<>();
        for (ArgumentContext argument : ctx.argumentList().argument()) {
            operands.add(builder.qubits(argument.Identifier(), argument.Integer()));
        }
        builder.barrier(ctx.BARRIER().getSymbol(), operands);
        return null;
    }

    private List<Expr> expressions(GateCallContext call, @Nullable Map<String, Integer> params) {
        if (call.expressionList() == null) return Collections.emptyList();
        ExpressionBuilder exprs = new ExpressionBuilder(params);
        List<Expr> built = new ArrayList<>();
        for (ExpressionContext expression : call.expressionList().expression()) {
            built.add(exprs.visit(expression));
        }
        return built;
    }

    /**
     * Builds parameter expressions.
     */
    private final class ExpressionBuilder extends Qasm2BaseVisitor<Expr> {
        @Nullable
        private final Map<String, Integer> params;

        ExpressionBuilder(@Nullable Map<String, Integer> params) {
            this.params = params;
        }

        @Override
        public Expr visitParenthesisExpression(ParenthesisExpressionContext ctx) {
            return visit(ctx.expression());
        }

        @Override
        public Expr visitPowerExpression(PowerExpressionContext ctx) {
            return CircuitBuilder.binary(Param.Operator.POW, visit(ctx.expression(0)), visit(ctx.expression(1)));
        }

        @Override
        public Expr visitUnaryExpression(UnaryExpressionContext ctx) {
            Expr operand = visit(ctx.expression());
            return ctx.op.getType() == Qasm2Lexer.MINUS ? CircuitBuilder.negate(operand) : operand;
        }

        @Override
        public Expr visitMultiplicativeExpression(MultiplicativeExpressionContext ctx) {
            Param.Operator op = ctx.op.getType() == Qasm2Lexer.ASTERISK ? Param.Operator.MUL : Param.Operator.DIV;
            return CircuitBuilder.binary(op, visit(ctx.expression(0)), visit(ctx.expression(1)));
        }

        @Override
        public Expr visitAdditiveExpression(AdditiveExpressionContext ctx) {
            Param.Operator op = ctx.op.getType() == Qasm2Lexer.PLUS ? Param.Operator.ADD : Param.Operator.SUB;
            return CircuitBuilder.binary(op, visit(ctx.expression(0)), visit(ctx.expression(1)));
        }

        @Override
        public Expr visitCallExpression(CallExpressionContext ctx) {
            return builder.call(ctx.Identifier().getSymbol(), visit(ctx.expression()));
        }

        @Override
        public Expr visitIdentifierExpression(IdentifierExpressionContext ctx) {
            return builder.identifier(ctx.Identifier().getSymbol(), params);
        }

        @Override
        public Expr visitLiteralExpression(LiteralExpressionContext ctx) {
            return builder.literal(ctx.value);
        }
    }
}
