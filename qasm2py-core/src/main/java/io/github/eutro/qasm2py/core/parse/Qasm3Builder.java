package io.github.eutro.qasm2py.core.parse;

import io.github.eutro.qasm2py.core.gates.Expr;
import io.github.eutro.qasm2py.core.gates.GateDefinition;
import io.github.eutro.qasm2py.core.gates.ModifiedGate;
import io.github.eutro.qasm2py.core.gates.Modifiers;
import io.github.eutro.qasm2py.core.ir.Circuit;
import io.github.eutro.qasm2py.core.ir.Clbit;
import io.github.eutro.qasm2py.core.ir.Param;
import io.github.eutro.qasm2py.core.ir.Qubit;
import io.github.eutro.qasm2py.core.parse.antlr.Qasm3BaseVisitor;
import io.github.eutro.qasm2py.core.parse.antlr.Qasm3Lexer;
import io.github.eutro.qasm2py.core.parse.antlr.Qasm3Parser;
import io.github.eutro.qasm2py.core.parse.antlr.Qasm3Parser.*;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds circuits from parse trees of the gate-level subset of OpenQASM 3.
 * <p>
 * Supported: {@code include "stdgates.inc"}, {@code qubit} and {@code bit} declarations
 * (and the legacy {@code qreg} and {@code creg}), {@code float} and {@code angle} inputs,
 * {@code gate}, gate calls (with register broadcasting and the {@code ctrl}, {@code negctrl},
 * {@code inv} and {@code pow} modifiers), {@code gphase}, measurement in both the assignment
 * and arrow forms, {@code reset} and {@code barrier}.
 * <p>
 * Inputs become symbolic parameters. Modifier arguments must be constants, and see
 * {@link Modifiers#applyTo} for which gates can be inverted or raised to a power.
 */
final class Qasm3Builder extends Qasm3BaseVisitor<Void> {
    private static final List<GateDefinition> BUILTINS = Arrays.asList(GateDefinition.U, GateDefinition.GPHASE);
    private static final List<GateDefinition> LIBRARY_BUILTINS =
            Arrays.asList(GateDefinition.U, GateDefinition.GPHASE, GateDefinition.CX);

    private static final Map<String, Double> CONSTANTS;
    private static final Map<String, Param.Function> FUNCTIONS;

    static {
        Map<String, Double> constants = new HashMap<>();
        constants.put("pi", Math.PI);
        constants.put("π", Math.PI);
        constants.put("tau", 2 * Math.PI);
        constants.put("τ", 2 * Math.PI);
        constants.put("euler", Math.E);
        constants.put("ℇ", Math.E);
        CONSTANTS = Collections.unmodifiableMap(constants);

        Map<String, Param.Function> functions = new HashMap<>(Qasm2Builder.FUNCTIONS);
        for (Param.Function fn : Arrays.asList(Param.Function.ARCSIN, Param.Function.ARCCOS, Param.Function.ARCTAN)) {
            functions.put(fn.getName(), fn);
        }
        FUNCTIONS = Collections.unmodifiableMap(functions);
    }

    private final CircuitBuilder builder;

    private Qasm3Builder(boolean library) {
        builder = new CircuitBuilder(library, library ? LIBRARY_BUILTINS : BUILTINS, CONSTANTS, FUNCTIONS);
    }

    private static Qasm3Parser parser(@NotNull String source) {
        Qasm3Lexer lexer = new Qasm3Lexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(SyntaxErrors.INSTANCE);
        Qasm3Parser parser = new Qasm3Parser(new CommonTokenStream(lexer));
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
        Qasm3Builder visitor = new Qasm3Builder(false);
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
        Qasm3Builder visitor = new Qasm3Builder(true);
        visitor.visit(parser(source).library());
        return visitor.builder.getGates();
    }

    @Override
    public Void visitVersion(VersionContext ctx) {
        builder.checkVersion(ctx.number, 3);
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
        builder.include(ctx.StringLiteral().getSymbol(), Includes.STDGATES, Includes::stdgates);
        return null;
    }

    private int size(@Nullable DesignatorContext designator) {
        return designator == null ? 1 : builder.size(designator.Integer().getSymbol());
    }

    @Override
    public Void visitQubitDeclaration(QubitDeclarationContext ctx) {
        builder.declareQubits(ctx.Identifier().getSymbol(), size(ctx.designator()));
        return null;
    }

    @Override
    public Void visitQregDeclaration(QregDeclarationContext ctx) {
        builder.declareQubits(ctx.Identifier().getSymbol(), size(ctx.designator()));
        return null;
    }

    @Override
    public Void visitBitDeclaration(BitDeclarationContext ctx) {
        builder.declareClbits(ctx.Identifier().getSymbol(), size(ctx.designator()));
        MeasureExpressionContext measure = ctx.measureExpression();
        if (measure != null) {
            builder.measure(measure.MEASURE().getSymbol(),
                    qubits(measure.indexedIdentifier()),
                    builder.clbits(ctx.Identifier(), null));
        }
        return null;
    }

    @Override
    public Void visitCregDeclaration(CregDeclarationContext ctx) {
        builder.declareClbits(ctx.Identifier().getSymbol(), size(ctx.designator()));
        return null;
    }

    @Override
    public Void visitInputDeclaration(InputDeclarationContext ctx) {
        builder.declareInput(ctx.Identifier().getSymbol());
        return null;
    }

    @Override
    public Void visitGateDefinition(GateDefinitionContext ctx) {
        Map<String, Integer> params = ctx.parameterList() == null || ctx.parameterList().identifierList() == null
                ? Collections.emptyMap()
                : CircuitBuilder.names(ctx.parameterList().identifierList().Identifier(), "parameter name");
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

    private GateDefinition.Statement bodyStatement(BodyStatementContext ctx,
                                                   Map<String, Integer> params,
                                                   Map<String, Integer> qargs) {
        if (ctx instanceof BodyBarrierContext) {
            IdentifierListContext list = ((BodyBarrierContext) ctx).identifierList();
            if (list == null) {
                int[] all = new int[qargs.size()];
                for (int i = 0; i < all.length; i++) all[i] = i;
                return GateDefinition.Statement.barrier(all);
            }
            List<TerminalNode> ids = list.Identifier();
            int[] args = new int[ids.size()];
            for (int i = 0; i < args.length; i++) {
                args[i] = CircuitBuilder.bodyQubit(ids.get(i), null, qargs);
            }
            return GateDefinition.Statement.barrier(args);
        }
        GateCallContext call = ((BodyGateCallContext) ctx).gateCall();
        Token name = call.Identifier().getSymbol();
        ModifiedGate gate = builder.modify(name, modifiers(call));
        List<IndexedIdentifierContext> arguments = call.indexedIdentifierList() == null
                ? Collections.emptyList()
                : call.indexedIdentifierList().indexedIdentifier();
        int[] args = new int[arguments.size()];
        for (int i = 0; i < args.length; i++) {
            IndexedIdentifierContext argument = arguments.get(i);
            args[i] = CircuitBuilder.bodyQubit(argument.Identifier(), argument.Integer(), qargs);
        }
        return CircuitBuilder.bodyCall(name, gate, expressions(call, params), args);
    }

    private Modifiers modifiers(GateCallContext call) {
        Modifiers modifiers = Modifiers.NONE;
        ExpressionBuilder constants = new ExpressionBuilder(null);
        for (GateModifierContext modifier : call.gateModifier()) {
            Token kw = modifier.getStart();
            try {
                if (modifier instanceof InverseModifierContext) {
                    modifiers = modifiers.inverse();
                } else if (modifier instanceof PowerModifierContext) {
                    Expr k = constants.visit(((PowerModifierContext) modifier).expression());
                    modifiers = modifiers.power(CircuitBuilder.constantArgument(kw, k));
                } else {
                    ControlModifierContext control = (ControlModifierContext) modifier;
                    int count = control.expression() == null
                            ? 1
                            : CircuitBuilder.controlCount(kw, constants.visit(control.expression()));
                    modifiers = modifiers.control(count, control.kind.getType() == Qasm3Lexer.CTRL);
                }
            } catch (IllegalArgumentException e) {
                throw CircuitBuilder.error(kw, e.getMessage());
            }
        }
        return modifiers;
    }

    @Override
    public Void visitGateCallStatement(GateCallStatementContext ctx) {
        GateCallContext call = ctx.gateCall();
        Token name = call.Identifier().getSymbol();
        ModifiedGate gate = builder.modify(name, modifiers(call));
        List<CircuitBuilder.Operand<Qubit>> operands = new ArrayList<>();
        if (call.indexedIdentifierList() != null) {
            for (IndexedIdentifierContext argument : call.indexedIdentifierList().indexedIdentifier()) {
                operands.add(qubits(argument));
            }
        }
        builder.gateCall(name, gate, expressions(call, null), operands);
        return null;
    }

    @Override
    public Void visitMeasureAssignment(MeasureAssignmentContext ctx) {
        MeasureExpressionContext measure = ctx.measureExpression();
        builder.measure(measure.MEASURE().getSymbol(), qubits(measure.indexedIdentifier()), clbits(ctx.indexedIdentifier()));
        return null;
    }

    @Override
    public Void visitMeasureArrow(MeasureArrowContext ctx) {
        MeasureExpressionContext measure = ctx.measureExpression();
        builder.measure(measure.MEASURE().getSymbol(), qubits(measure.indexedIdentifier()), clbits(ctx.indexedIdentifier()));
        return null;
    }

    @Override
    public Void visitResetStatement(ResetStatementContext ctx) {
        builder.reset(qubits(ctx.indexedIdentifier()));
        return null;
    }

    @Override
    public Void visitBarrierStatement(BarrierStatementContext ctx) {
        if (ctx.indexedIdentifierList() == null) {
            builder.barrierAll(ctx.BARRIER().getSymbol());
            return null;
        }
        List<CircuitBuilder.Operand<Qubit>> operands = new ArrayList<>();
        for (IndexedIdentifierContext argument : ctx.indexedIdentifierList().indexedIdentifier()) {
            operands.add(qubits(argument));
        }
        builder.barrier(ctx.BARRIER().getSymbol(), operands);
        return null;
    }

    private CircuitBuilder.Operand<Qubit> qubits(IndexedIdentifierContext ctx) {
        return builder.qubits(ctx.Identifier(), ctx.Integer());
    }

    private CircuitBuilder.Operand<Clbit> clbits(IndexedIdentifierContext ctx) {
        return builder.clbits(ctx.Identifier(), ctx.Integer());
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

    private final class ExpressionBuilder extends Qasm3BaseVisitor<Expr> {
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
            return ctx.op.getType() == Qasm3Lexer.MINUS ? CircuitBuilder.negate(operand) : operand;
        }

        @Override
        public Expr visitMultiplicativeExpression(MultiplicativeExpressionContext ctx) {
            Param.Operator op = ctx.op.getType() == Qasm3Lexer.ASTERISK ? Param.Operator.MUL : Param.Operator.DIV;
            return CircuitBuilder.binary(op, visit(ctx.expression(0)), visit(ctx.expression(1)));
        }

        @Override
        public Expr visitAdditiveExpression(AdditiveExpressionContext ctx) {
            Param.Operator op = ctx.op.getType() == Qasm3Lexer.PLUS ? Param.Operator.ADD : Param.Operator.SUB;
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
