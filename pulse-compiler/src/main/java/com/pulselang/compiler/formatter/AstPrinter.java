package com.pulselang.compiler.formatter;

import com.pulselang.compiler.ast.*;
import com.pulselang.compiler.ast.decl.*;
import com.pulselang.compiler.ast.expr.*;
import com.pulselang.compiler.ast.stmt.*;

import java.util.List;
import java.util.Map;

/**
 * PulseLang AST 打印器
 *
 * <p>把 {@link Program} 输出为规范源码。只在优先级需要时加括号；
 * 分支与循环体总是输出为代码块。合成类 {@code Main} 的成员输出在顶层，
 * 合成的 {@code main} 方法体还原为顶层语句。</p>
 */
public class AstPrinter implements AstVisitor<Void, PrinterContext> {

    // 表达式优先级（数值越大绑定越紧）
    private static final int PREC_ASSIGN = 1;
    private static final int PREC_OR = 2;
    private static final int PREC_AND = 3;
    private static final int PREC_EQUALITY = 4;
    private static final int PREC_RELATIONAL = 5;
    private static final int PREC_ADDITIVE = 6;
    private static final int PREC_MULTIPLICATIVE = 7;
    private static final int PREC_UNARY = 8;
    private static final int PREC_POSTFIX = 9;
    private static final int PREC_PRIMARY = 10;

    private String currentClass;
    private PrintConfig config = new PrintConfig();

    public String print(Program program, PrintConfig config) {
        this.config = config;
        PrinterContext ctx = new PrinterContext(config);
        visitProgram(program, ctx);
        return ctx.getOutput();
    }

    public String print(Program program) {
        return print(program, new PrintConfig());
    }

    // ============ 声明 ============

    @Override
    public Void visitProgram(Program node, PrinterContext ctx) {
        for (ClassDecl cls : node.getClasses()) {
            ctx.blankLine();
            cls.accept(this, ctx);
        }
        return null;
    }

    @Override
    public Void visitClassDecl(ClassDecl node, PrinterContext ctx) {
        if (node.isSynthetic()) {
            printSyntheticMembers(node, ctx);
            return null;
        }
        printAnnotations(node.getAnnotations(), ctx);
        printModifiers(node.getModifiers(), ctx);
        ctx.append("class ");
        ctx.append(node.getName());
        ctx.append(" {");
        ctx.newLine();
        ctx.indent();

        String outer = currentClass;
        currentClass = node.getName();
        for (FieldDecl field : node.getFields()) {
            field.accept(this, ctx);
        }
        boolean first = node.getFields().isEmpty();
        for (MethodDecl method : node.getMethods()) {
            if (!first && config.isBlankLineBetweenMethods()) {
                ctx.blankLine();
            }
            first = false;
            method.accept(this, ctx);
        }
        currentClass = outer;

        ctx.dedent();
        ctx.append("}");
        ctx.newLine();
        return null;
    }

    private void printSyntheticMembers(ClassDecl node, PrinterContext ctx) {
        for (FieldDecl field : node.getFields()) {
            field.accept(this, ctx);
        }
        MethodDecl entry = null;
        for (MethodDecl method : node.getMethods()) {
            if (isSynthesizedMain(method)) {
                entry = method;
                continue;
            }
            ctx.blankLine();
            method.accept(this, ctx);
        }
        if (entry != null) {
            ctx.blankLine();
            for (Statement stmt : entry.getBody().getStatements()) {
                printStatement(stmt, ctx);
            }
        }
    }

    /** 形如顶层语句合成出的 main：public static void main()，无注解 */
    private static boolean isSynthesizedMain(MethodDecl method) {
        List<Modifier> modifiers = method.getModifiers();
        return "main".equals(method.getName())
                && method.getParams().isEmpty()
                && method.getAnnotations().isEmpty()
                && method.getReturnType().isVoid()
                && modifiers.size() == 2
                && modifiers.get(0) == Modifier.PUBLIC
                && modifiers.get(1) == Modifier.STATIC
                && !method.getBody().isEmpty();
    }

    @Override
    public Void visitMethodDecl(MethodDecl node, PrinterContext ctx) {
        printAnnotations(node.getAnnotations(), ctx);
        printModifiers(node.getModifiers(), ctx);
        boolean constructor = node.getName().equals(currentClass) && node.getReturnType().isVoid();
        if (!constructor) {
            ctx.append(node.getReturnType().toString());
            ctx.append(" ");
        }
        ctx.append(node.getName());
        ctx.append("(");
        List<Parameter> params = node.getParams();
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) ctx.append(", ");
            params.get(i).accept(this, ctx);
        }
        ctx.append(") ");
        printBlock(node.getBody(), ctx);
        ctx.newLine();
        return null;
    }

    @Override
    public Void visitFieldDecl(FieldDecl node, PrinterContext ctx) {
        printAnnotations(node.getAnnotations(), ctx);
        printModifiers(node.getModifiers(), ctx);
        ctx.append(node.getType().toString());
        ctx.append(" ");
        ctx.append(node.getName());
        if (node.hasInitializer()) {
            ctx.append(" = ");
            printExpression(node.getInitializer(), PREC_ASSIGN, ctx);
        }
        ctx.append(";");
        ctx.newLine();
        return null;
    }

    @Override
    public Void visitParameter(Parameter node, PrinterContext ctx) {
        ctx.append(node.getType().toString());
        ctx.append(" ");
        ctx.append(node.getName());
        return null;
    }

    @Override
    public Void visitAnnotation(Annotation node, PrinterContext ctx) {
        ctx.append("@");
        ctx.append(node.getName());
        if (node.hasArgs()) {
            ctx.append("(");
            boolean first = true;
            for (Map.Entry<String, Object> arg : node.getArgs().entrySet()) {
                if (!first) ctx.append(", ");
                first = false;
                ctx.append(arg.getKey());
                ctx.append("=");
                ctx.append(formatConstant(arg.getValue()));
            }
            ctx.append(")");
        }
        return null;
    }

    private void printAnnotations(List<Annotation> annotations, PrinterContext ctx) {
        for (Annotation annotation : annotations) {
            annotation.accept(this, ctx);
            ctx.newLine();
        }
    }

    private void printModifiers(List<Modifier> modifiers, PrinterContext ctx) {
        for (Modifier modifier : modifiers) {
            ctx.append(modifier.getKeyword());
            ctx.append(" ");
        }
    }

    // ============ 语句 ============

    private void printStatement(Statement stmt, PrinterContext ctx) {
        stmt.accept(this, ctx);
        ctx.newLine();
    }

    /**
     * 输出代码块，不换行结尾
     */
    private void printBlock(Block block, PrinterContext ctx) {
        if (block.isEmpty()) {
            ctx.append("{}");
            return;
        }
        ctx.append("{");
        ctx.newLine();
        ctx.indent();
        for (Statement stmt : block.getStatements()) {
            printStatement(stmt, ctx);
        }
        ctx.dedent();
        ctx.append("}");
    }

    /**
     * 分支/循环体：非代码块的语句包进代码块输出
     */
    private void printBody(Statement body, PrinterContext ctx) {
        if (body instanceof Block) {
            printBlock((Block) body, ctx);
            return;
        }
        ctx.append("{");
        ctx.newLine();
        ctx.indent();
        printStatement(body, ctx);
        ctx.dedent();
        ctx.append("}");
    }

    @Override
    public Void visitBlock(Block node, PrinterContext ctx) {
        printBlock(node, ctx);
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, PrinterContext ctx) {
        printExpression(node.getExpression(), PREC_ASSIGN, ctx);
        ctx.append(";");
        return null;
    }

    @Override
    public Void visitVarDeclStmt(VarDeclStmt node, PrinterContext ctx) {
        printVarDecl(node, ctx);
        ctx.append(";");
        return null;
    }

    private void printVarDecl(VarDeclStmt node, PrinterContext ctx) {
        ctx.append(node.getType().toString());
        ctx.append(" ");
        ctx.append(node.getName());
        if (node.hasInitializer()) {
            ctx.append(" = ");
            printExpression(node.getInitializer(), PREC_ASSIGN, ctx);
        }
    }

    @Override
    public Void visitIfStmt(IfStmt node, PrinterContext ctx) {
        ctx.append("if (");
        printExpression(node.getCondition(), PREC_ASSIGN, ctx);
        ctx.append(") ");
        printBody(node.getThenBranch(), ctx);
        if (node.hasElse()) {
            ctx.append(" else ");
            if (node.getElseBranch() instanceof IfStmt) {
                node.getElseBranch().accept(this, ctx);
            } else {
                printBody(node.getElseBranch(), ctx);
            }
        }
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, PrinterContext ctx) {
        ctx.append("while (");
        printExpression(node.getCondition(), PREC_ASSIGN, ctx);
        ctx.append(") ");
        printBody(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitForStmt(ForStmt node, PrinterContext ctx) {
        ctx.append("for (");
        Statement init = node.getInit();
        if (init instanceof VarDeclStmt) {
            printVarDecl((VarDeclStmt) init, ctx);
        } else if (init instanceof ExpressionStmt) {
            printExpression(((ExpressionStmt) init).getExpression(), PREC_ASSIGN, ctx);
        }
        ctx.append(";");
        if (node.getCondition() != null) {
            ctx.append(" ");
            printExpression(node.getCondition(), PREC_ASSIGN, ctx);
        }
        ctx.append(";");
        if (node.getUpdate() != null) {
            ctx.append(" ");
            printExpression(node.getUpdate(), PREC_ASSIGN, ctx);
        }
        ctx.append(") ");
        printBody(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, PrinterContext ctx) {
        ctx.append("return");
        if (node.hasValue()) {
            ctx.append(" ");
            printExpression(node.getValue(), PREC_ASSIGN, ctx);
        }
        ctx.append(";");
        return null;
    }

    // ============ 表达式 ============

    /**
     * 输出表达式；其优先级低于 minPrecedence 时加括号
     */
    private void printExpression(Expression expr, int minPrecedence, PrinterContext ctx) {
        if (precedenceOf(expr) < minPrecedence) {
            ctx.append("(");
            expr.accept(this, ctx);
            ctx.append(")");
        } else {
            expr.accept(this, ctx);
        }
    }

    private static int precedenceOf(Expression expr) {
        if (expr instanceof AssignExpr) return PREC_ASSIGN;
        if (expr instanceof BinaryExpr) return precedenceOf(((BinaryExpr) expr).getOperator());
        if (expr instanceof UnaryExpr) {
            return ((UnaryExpr) expr).isPrefix() ? PREC_UNARY : PREC_POSTFIX;
        }
        if (expr instanceof CallExpr || expr instanceof MemberExpr || expr instanceof IndexExpr) {
            return PREC_POSTFIX;
        }
        return PREC_PRIMARY;
    }

    private static int precedenceOf(BinaryExpr.BinaryOp op) {
        switch (op) {
            case OR: return PREC_OR;
            case AND: return PREC_AND;
            case EQ:
            case NE: return PREC_EQUALITY;
            case LT:
            case GT:
            case LE:
            case GE: return PREC_RELATIONAL;
            case ADD:
            case SUB: return PREC_ADDITIVE;
            default: return PREC_MULTIPLICATIVE;
        }
    }

    @Override
    public Void visitLiteral(Literal node, PrinterContext ctx) {
        ctx.append(formatConstant(node.getValue()));
        return null;
    }

    private static String formatConstant(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String) {
            return "\"" + PulseStringUtils.escapeString((String) value) + "\"";
        }
        if (value instanceof Double) {
            return PulseStringUtils.formatDouble((Double) value);
        }
        return String.valueOf(value);
    }

    @Override
    public Void visitIdentifier(Identifier node, PrinterContext ctx) {
        ctx.append(node.getName());
        return null;
    }

    @Override
    public Void visitBinaryExpr(BinaryExpr node, PrinterContext ctx) {
        int precedence = precedenceOf(node.getOperator());
        // 左结合：右操作数同级时需要括号
        printExpression(node.getLeft(), precedence, ctx);
        ctx.append(" ");
        ctx.append(node.getOperator().toSourceString());
        ctx.append(" ");
        printExpression(node.getRight(), precedence + 1, ctx);
        return null;
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, PrinterContext ctx) {
        if (node.isPrefix()) {
            ctx.append(node.getOperator().toSourceString());
            Expression operand = node.getOperand();
            // "- -x" 不能写成 "--x"
            if (node.getOperator() == UnaryExpr.UnaryOp.NEG && operand instanceof UnaryExpr
                    && ((UnaryExpr) operand).isPrefix()
                    && ((UnaryExpr) operand).getOperator().toSourceString().startsWith("-")) {
                ctx.append("(");
                operand.accept(this, ctx);
                ctx.append(")");
            } else {
                printExpression(operand, PREC_UNARY, ctx);
            }
        } else {
            printExpression(node.getOperand(), PREC_POSTFIX, ctx);
            ctx.append(node.getOperator().toSourceString());
        }
        return null;
    }

    @Override
    public Void visitAssignExpr(AssignExpr node, PrinterContext ctx) {
        printExpression(node.getTarget(), PREC_POSTFIX, ctx);
        ctx.append(" = ");
        // 右结合
        printExpression(node.getValue(), PREC_ASSIGN, ctx);
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, PrinterContext ctx) {
        printExpression(node.getCallee(), PREC_POSTFIX, ctx);
        printArguments(node.getArgs(), ctx);
        return null;
    }

    private void printArguments(List<Expression> args, PrinterContext ctx) {
        ctx.append("(");
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) ctx.append(", ");
            printExpression(args.get(i), PREC_ASSIGN, ctx);
        }
        ctx.append(")");
    }

    @Override
    public Void visitMemberExpr(MemberExpr node, PrinterContext ctx) {
        printExpression(node.getTarget(), PREC_POSTFIX, ctx);
        ctx.append(".");
        ctx.append(node.getName());
        return null;
    }

    @Override
    public Void visitNewExpr(NewExpr node, PrinterContext ctx) {
        ctx.append("new ");
        TypeRef type = node.getType();
        ctx.append(type.getName());
        if (node.isArray()) {
            ctx.append("[");
            printExpression(node.getArraySize(), PREC_ASSIGN, ctx);
            ctx.append("]");
            for (int i = 0; i < type.getArrayDimensions(); i++) {
                ctx.append("[]");
            }
        } else {
            printArguments(node.getArgs(), ctx);
        }
        return null;
    }

    @Override
    public Void visitIndexExpr(IndexExpr node, PrinterContext ctx) {
        printExpression(node.getTarget(), PREC_POSTFIX, ctx);
        ctx.append("[");
        printExpression(node.getIndex(), PREC_ASSIGN, ctx);
        ctx.append("]");
        return null;
    }

    @Override
    public Void visitArrayLiteral(ArrayLiteral node, PrinterContext ctx) {
        ctx.append("{");
        List<Expression> elements = node.getElements();
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) ctx.append(", ");
            printExpression(elements.get(i), PREC_ASSIGN, ctx);
        }
        ctx.append("}");
        return null;
    }
}
