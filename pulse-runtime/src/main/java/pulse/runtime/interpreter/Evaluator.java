package pulse.runtime.interpreter;

import com.pulselang.compiler.ast.AstVisitor;
import com.pulselang.compiler.ast.SourceLocation;
import com.pulselang.compiler.ast.TypeRef;
import com.pulselang.compiler.ast.decl.*;
import com.pulselang.compiler.ast.expr.*;
import com.pulselang.compiler.ast.stmt.*;
import pulse.runtime.*;
import pulse.runtime.deadline.DeadlineViolation;
import pulse.runtime.safety.CallDepthGuard;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * AST 求值器：实现 AstVisitor，语句返回 {@link PulseNull#VOID}，表达式返回其值。
 *
 * <p>包内类，持有本次运行的 {@link RuntimeState}。除法、下标、成员访问、方法入口和每次绑定
 * 之前先请求安全检查；每条语句之后记录快照并按阈值触发收集。</p>
 */
final class Evaluator implements AstVisitor<PulseValue, Void> {

    private static final Logger LOG = Logger.getLogger(Evaluator.class.getName());

    static final String LOOP_LIMIT = "WARNING: Loop terminated after %d iterations for safety";

    final RuntimeState state;
    final Builtins builtins;

    Evaluator(RuntimeState state) {
        this.state = state;
        this.builtins = new Builtins(state);
    }

    // ============ 入口 ============

    /**
     * 先执行所有类的字段初始化；存在 {@code main} 时调用它，
     * 否则按声明顺序调用每个无参方法
     */
    void run(Program program) {
        program.accept(this, null);
    }

    @Override
    public PulseValue visitProgram(Program node, Void ctx) {
        state.program = node;
        for (ClassDecl cls : node.getClasses()) {
            cls.accept(this, null);
        }

        ClassDecl mainOwner = null;
        MethodDecl main = null;
        for (ClassDecl cls : node.getClasses()) {
            for (MethodDecl method : cls.getMethods()) {
                if (main == null && "main".equals(method.getName()) && method.getParams().size() <= 1) {
                    mainOwner = cls;
                    main = method;
                }
            }
        }

        if (main != null) {
            List<PulseValue> args = main.getParams().isEmpty()
                    ? Collections.<PulseValue>emptyList()
                    : Collections.<PulseValue>singletonList(
                            new PulseArray("String", Collections.<PulseValue>emptyList()));
            invoke(mainOwner, main, null, args, main.getLocation());
        } else {
            for (ClassDecl cls : node.getClasses()) {
                for (MethodDecl method : cls.getMethods()) {
                    if (method.getParams().isEmpty() && !isConstructor(cls, method)) {
                        invoke(cls, method, null, Collections.<PulseValue>emptyList(), method.getLocation());
                    }
                }
            }
        }
        return PulseNull.VOID;
    }

    /**
     * 类级字段作为全局绑定初始化
     */
    @Override
    public PulseValue visitClassDecl(ClassDecl node, Void ctx) {
        for (FieldDecl field : node.getFields()) {
            field.accept(this, null);
            state.afterStatement(field.getLine());
        }
        return PulseNull.VOID;
    }

    @Override
    public PulseValue visitFieldDecl(FieldDecl node, Void ctx) {
        PulseValue value = node.hasInitializer()
                ? evaluateInitializer(node.getType(), node.getInitializer())
                : TypeOps.defaultValue(node.getType());
        declare(node.getName(), node.getType(), value, node.getLocation());
        return PulseNull.VOID;
    }

    @Override
    public PulseValue visitMethodDecl(MethodDecl node, Void ctx) {
        // 方法体只通过 invoke 执行
        return PulseNull.VOID;
    }

    @Override
    public PulseValue visitParameter(Parameter node, Void ctx) {
        return PulseNull.VOID;
    }

    @Override
    public PulseValue visitAnnotation(Annotation node, Void ctx) {
        return PulseNull.VOID;
    }

    private static boolean isConstructor(ClassDecl cls, MethodDecl method) {
        return method.getName().equals(cls.getName());
    }

    // ============ 方法调用 ============

    /**
     * 调用方法：占用调用深度，绑定 this 和参数，处理注解，返回值按返回类型转换
     *
     * @param receiver 实例调用的接收者；静态调用为 null
     */
    PulseValue invoke(ClassDecl owner, MethodDecl method, PulseObject receiver,
                      List<PulseValue> args, SourceLocation callSite) {
        try (CallDepthGuard guard = state.verifier.enterMethod(callSite.getLine())) {
            state.report(guard.getViolations(), callSite);
            return invokeInFrame(owner, method, receiver, args, callSite);
        }
    }

    private PulseValue invokeInFrame(ClassDecl owner, MethodDecl method, PulseObject receiver,
                                     List<PulseValue> args, SourceLocation callSite) {
        String name = method.getName();
        CallFrame frame = new CallFrame(frameLabel(method), owner, receiver);
        state.pushFrame(frame);

        boolean realTime = method.hasAnnotation(Annotation.REAL_TIME);
        boolean safetyCheck = method.hasAnnotation(Annotation.SAFETY_CHECK);
        Annotation deadline = method.findAnnotation(Annotation.DEADLINE);
        long deadlineMs = deadline != null ? deadline.getLongArg("ms", 0) : 0;
        boolean timed = false;

        if (realTime) state.enterRealTime();
        if (safetyCheck) state.enterSafetyCheck();
        try {
            if (deadlineMs > 0) {
                state.deadlines.start(name, deadlineMs, method.getLine());
                timed = true;
            }
            if (receiver != null) {
                frame.declare("this", state.env);
                state.env.define("this", TypeRef.of(owner.getName()), receiver);
            }
            List<Parameter> params = method.getParams();
            for (int i = 0; i < params.size(); i++) {
                Parameter param = params.get(i);
                declare(param.getName(), param.getType(), args.get(i), callSite);
            }

            PulseValue result;
            try {
                method.getBody().accept(this, null);
                result = PulseNull.VOID;
            } catch (ControlFlow flow) {
                result = flow.getValue();
            }
            return coerceReturn(method, result, callSite);
        } catch (PulseRuntimeException e) {
            e.unwindThrough(frame.getLabel());
            throw e;
        } finally {
            if (timed) {
                Optional<DeadlineViolation> violation = state.deadlines.stop(name);
                if (violation.isPresent()) {
                    state.println(violation.get().toString());
                }
            }
            if (safetyCheck) state.exitSafetyCheck();
            if (realTime) state.exitRealTime();
            state.popFrame();
        }
    }

    private static String frameLabel(MethodDecl method) {
        Annotation sensor = method.findAnnotation(Annotation.SENSOR);
        if (sensor != null && sensor.getArg("type") != null) {
            return method.getName() + "[" + sensor.getArg("type") + "]";
        }
        return method.getName();
    }

    private static PulseValue coerceReturn(MethodDecl method, PulseValue result, SourceLocation callSite) {
        TypeRef returnType = method.getReturnType();
        if (returnType.isVoid()) {
            return PulseNull.VOID;
        }
        if (result instanceof PulseNull && ((PulseNull) result).isVoid()) {
            throw new PulseRuntimeException("Method '" + method.getName()
                    + "' must return a value of type " + returnType, callSite);
        }
        return TypeOps.coerceOrThrow(returnType, result, callSite);
    }

    // ============ 语句 ============

    /**
     * 执行语句；非块语句执行后记录快照并检查收集阈值
     */
    void execute(Statement stmt) {
        stmt.accept(this, null);
        if (!(stmt instanceof Block)) {
            state.afterStatement(stmt.getLine());
        }
    }

    @Override
    public PulseValue visitBlock(Block node, Void ctx) {
        for (Statement stmt : node.getStatements()) {
            execute(stmt);
        }
        return PulseNull.VOID;
    }

    @Override
    public PulseValue visitExpressionStmt(ExpressionStmt node, Void ctx) {
        evaluate(node.getExpression());
        return PulseNull.VOID;
    }

    @Override
    public PulseValue visitVarDeclStmt(VarDeclStmt node, Void ctx) {
        PulseValue value = node.hasInitializer()
                ? evaluateInitializer(node.getType(), node.getInitializer())
                : TypeOps.defaultValue(node.getType());
        declare(node.getName(), node.getType(), value, node.getLocation());
        return PulseNull.VOID;
    }

    @Override
    public PulseValue visitIfStmt(IfStmt node, Void ctx) {
        if (condition(node.getCondition())) {
            execute(node.getThenBranch());
        } else if (node.hasElse()) {
            execute(node.getElseBranch());
        }
        return PulseNull.VOID;
    }

    @Override
    public PulseValue visitWhileStmt(WhileStmt node, Void ctx) {
        long max = state.config.getMaxLoopIterations();
        long iterations = 0;
        while (condition(node.getCondition())) {
            if (iterations >= max) {
                loopLimitReached(max, node);
                break;
            }
            iterations++;
            execute(node.getBody());
        }
        return PulseNull.VOID;
    }

    @Override
    public PulseValue visitForStmt(ForStmt node, Void ctx) {
        if (node.getInit() != null) {
            node.getInit().accept(this, null);
        }
        long max = state.config.getMaxLoopIterations();
        long iterations = 0;
        while (node.getCondition() == null || condition(node.getCondition())) {
            if (iterations >= max) {
                loopLimitReached(max, node);
                break;
            }
            iterations++;
            execute(node.getBody());
            if (node.getUpdate() != null) {
                evaluate(node.getUpdate());
            }
        }
        return PulseNull.VOID;
    }

    private void loopLimitReached(long max, Statement loop) {
        String message = String.format(LOOP_LIMIT, max);
        LOG.log(Level.WARNING, "{0} (line {1})", new Object[]{message, loop.getLine()});
        state.println(message);
    }

    @Override
    public PulseValue visitReturnStmt(ReturnStmt node, Void ctx) {
        if (node.hasValue()) {
            throw ControlFlow.returnValue(evaluate(node.getValue()));
        }
        throw ControlFlow.returnVoid();
    }

    private boolean condition(Expression expr) {
        PulseValue value = evaluate(expr);
        if (!(value instanceof PulseBoolean)) {
            throw new PulseRuntimeException("Condition must be boolean, got " + value.getTypeName(),
                    expr.getLocation());
        }
        return ((PulseBoolean) value).getValue();
    }

    // ============ 绑定 ============

    /**
     * 声明变量：按类型转换、登记堆对象，并在当前帧记录被覆盖的绑定
     */
    private void declare(String name, TypeRef type, PulseValue value, SourceLocation loc) {
        PulseValue coerced = TypeOps.coerceOrThrow(type, value, loc);
        state.allocate(coerced, loc);
        CallFrame frame = state.currentFrame();
        if (frame != null) {
            frame.declare(name, state.env);
        }
        state.env.define(name, type, coerced);
    }

    /**
     * 声明的初始值；数组初始化器按声明的元素类型逐个转换
     */
    private PulseValue evaluateInitializer(TypeRef type, Expression init) {
        if (!(init instanceof ArrayLiteral)) {
            return evaluate(init);
        }
        if (!type.isArray()) {
            throw new PulseRuntimeException("Array initializer requires an array type, got " + type,
                    init.getLocation());
        }
        TypeRef elementType = type.elementType();
        List<PulseValue> elements = new ArrayList<PulseValue>();
        for (Expression element : ((ArrayLiteral) init).getElements()) {
            PulseValue value = evaluateInitializer(elementType, element);
            elements.add(TypeOps.coerceOrThrow(elementType, value, element.getLocation()));
        }
        return new PulseArray(elementType.toString(), elements);
    }

    /**
     * 接收者有同名字段且当前帧没有同名参数或局部变量时，名称指向字段
     */
    private PulseObject fieldOwner(String name) {
        CallFrame frame = state.currentFrame();
        if (frame == null || frame.getReceiver() == null || frame.declares(name)) {
            return null;
        }
        return frame.getReceiver().hasField(name) ? frame.getReceiver() : null;
    }

    private boolean isVariable(String name) {
        return state.env.isDefined(name) || fieldOwner(name) != null;
    }

    private ClassDecl classNamed(String name) {
        return state.program != null ? state.program.findClass(name) : null;
    }

    /**
     * 赋值到目标表达式
     *
     * @return 实际存入的值（已转换）
     */
    private PulseValue assignTo(Expression target, PulseValue value, SourceLocation loc) {
        if (target instanceof Identifier) {
            return assignVariable(((Identifier) target).getName(), value, loc);
        }
        if (target instanceof MemberExpr) {
            MemberExpr member = (MemberExpr) target;
            Expression owner = member.getTarget();
            if (isStaticReference(owner)) {
                return assignGlobal(member.getName(), value, loc);
            }
            PulseValue object = evaluate(owner);
            if (state.report(state.verifier.checkNullAccess(object, loc.getLine()), loc)) {
                return value;
            }
            if (!(object instanceof PulseObject)) {
                throw new PulseRuntimeException("Cannot assign to member '" + member.getName()
                        + "' of " + object.getTypeName(), loc);
            }
            return writeField((PulseObject) object, member.getName(), value, loc);
        }
        if (target instanceof IndexExpr) {
            return store(resolveSlot((IndexExpr) target, loc), value, loc);
        }
        throw new PulseRuntimeException("Invalid assignment target", loc);
    }

    private PulseValue assignVariable(String name, PulseValue value, SourceLocation loc) {
        PulseObject owner = fieldOwner(name);
        if (owner != null) {
            return writeField(owner, name, value, loc);
        }
        return assignGlobal(name, value, loc);
    }

    private PulseValue assignGlobal(String name, PulseValue value, SourceLocation loc) {
        TypeRef type = state.env.typeOf(name);
        if (type == null) {
            throw new PulseRuntimeException("Undefined variable '" + name + "'", loc);
        }
        PulseValue coerced = TypeOps.coerceOrThrow(type, value, loc);
        state.allocate(coerced, loc);
        state.env.assign(name, coerced);
        return coerced;
    }

    private PulseValue writeField(PulseObject object, String name, PulseValue value, SourceLocation loc) {
        if (!object.hasField(name)) {
            throw new PulseRuntimeException("Unknown field '" + name + "' on " + object.getClassName(), loc);
        }
        PulseValue coerced = TypeOps.coerceOrThrow(fieldType(object, name), value, loc);
        state.allocate(coerced, loc);
        object.setField(name, coerced);
        return coerced;
    }

    private TypeRef fieldType(PulseObject object, String name) {
        ClassDecl cls = classNamed(object.getClassName());
        if (cls != null) {
            for (FieldDecl field : cls.getFields()) {
                if (field.getName().equals(name)) {
                    return field.getType();
                }
            }
        }
        throw new IllegalStateException("Field '" + name + "' not declared in " + object.getClassName());
    }

    private static TypeRef elementType(PulseArray array) {
        String name = array.getElementType();
        int dimensions = 0;
        while (name.endsWith("[]")) {
            name = name.substring(0, name.length() - 2);
            dimensions++;
        }
        return new TypeRef(name, dimensions);
    }

    // ============ 表达式 ============

    PulseValue evaluate(Expression expr) {
        return expr.accept(this, null);
    }

    @Override
    public PulseValue visitLiteral(Literal node, Void ctx) {
        switch (node.getKind()) {
            case INT:
                return PulseInt.of((Integer) node.getValue());
            case DOUBLE:
                return PulseDouble.of((Double) node.getValue());
            case STRING:
                return PulseString.of((String) node.getValue());
            case BOOLEAN:
                return PulseBoolean.of((Boolean) node.getValue());
            default:
                return PulseNull.NULL;
        }
    }

    @Override
    public PulseValue visitIdentifier(Identifier node, Void ctx) {
        String name = node.getName();
        PulseObject owner = fieldOwner(name);
        if (owner != null) {
            return owner.getField(name);
        }
        PulseValue value = state.env.get(name);
        if (value != null) {
            return value;
        }
        if ("this".equals(name)) {
            throw new PulseRuntimeException("'this' is not available outside an instance method",
                    node.getLocation());
        }
        if (classNamed(name) != null) {
            throw new PulseRuntimeException("Class '" + name + "' cannot be used as a value", node.getLocation());
        }
        throw new PulseRuntimeException("Undefined variable '" + name + "'", node.getLocation());
    }

    @Override
    public PulseValue visitBinaryExpr(BinaryExpr node, Void ctx) {
        BinaryExpr.BinaryOp op = node.getOperator();
        if (op == BinaryExpr.BinaryOp.AND || op == BinaryExpr.BinaryOp.OR) {
            boolean left = logicalOperand(evaluate(node.getLeft()), node);
            if (op == BinaryExpr.BinaryOp.AND && !left) return PulseBoolean.of(false);
            if (op == BinaryExpr.BinaryOp.OR && left) return PulseBoolean.of(true);
            return PulseBoolean.of(logicalOperand(evaluate(node.getRight()), node));
        }

        PulseValue left = evaluate(node.getLeft());
        PulseValue right = evaluate(node.getRight());
        switch (op) {
            case EQ:
                return PulseBoolean.of(left.valueEquals(right));
            case NE:
                return PulseBoolean.of(!left.valueEquals(right));
            case LT:
            case GT:
            case LE:
            case GE:
                return compare(op, left, right, node);
            default:
                return arithmetic(op, left, right, node);
        }
    }

    private static boolean logicalOperand(PulseValue value, BinaryExpr node) {
        if (!(value instanceof PulseBoolean)) {
            throw new PulseRuntimeException("Operator '" + node.getOperator().toSourceString()
                    + "' requires boolean operands, got " + value.getTypeName(), node.getLocation());
        }
        return ((PulseBoolean) value).getValue();
    }

    private static PulseValue compare(BinaryExpr.BinaryOp op, PulseValue left, PulseValue right, BinaryExpr node) {
        if (!left.isNumber() || !right.isNumber()) {
            throw operandMismatch(op, left, right, node);
        }
        double a = TypeOps.toDouble(left);
        double b = TypeOps.toDouble(right);
        switch (op) {
            case LT: return PulseBoolean.of(a < b);
            case GT: return PulseBoolean.of(a > b);
            case LE: return PulseBoolean.of(a <= b);
            default: return PulseBoolean.of(a >= b);
        }
    }

    private PulseValue arithmetic(BinaryExpr.BinaryOp op, PulseValue left, PulseValue right, BinaryExpr node) {
        if (op == BinaryExpr.BinaryOp.ADD && (left.isString() || right.isString())) {
            return PulseString.of(left.toString() + right.toString());
        }
        if (!left.isNumber() || !right.isNumber()) {
            throw operandMismatch(op, left, right, node);
        }
        boolean integral = left instanceof PulseInt && right instanceof PulseInt;

        if (op == BinaryExpr.BinaryOp.DIV || op == BinaryExpr.BinaryOp.MOD) {
            if (state.report(state.verifier.checkDivision(left, right, node.getLine()), node.getLocation())) {
                return integral ? PulseInt.of(0) : PulseDouble.of(0.0);
            }
        }

        if (integral) {
            int a = ((PulseInt) left).getValue();
            int b = ((PulseInt) right).getValue();
            switch (op) {
                case ADD: return PulseInt.of(a + b);
                case SUB: return PulseInt.of(a - b);
                case MUL: return PulseInt.of(a * b);
                case DIV: return PulseInt.of(a / b);
                default: return PulseInt.of(a % b);
            }
        }
        double a = TypeOps.toDouble(left);
        double b = TypeOps.toDouble(right);
        switch (op) {
            case ADD: return PulseDouble.of(a + b);
            case SUB: return PulseDouble.of(a - b);
            case MUL: return PulseDouble.of(a * b);
            case DIV: return PulseDouble.of(a / b);
            default: return PulseDouble.of(a % b);
        }
    }

    private static PulseRuntimeException operandMismatch(BinaryExpr.BinaryOp op, PulseValue left,
                                                         PulseValue right, BinaryExpr node) {
        return new PulseRuntimeException("Operator '" + op.toSourceString() + "' cannot be applied to "
                + left.getTypeName() + " and " + right.getTypeName(), node.getLocation());
    }

    @Override
    public PulseValue visitUnaryExpr(UnaryExpr node, Void ctx) {
        UnaryExpr.UnaryOp op = node.getOperator();
        ElementSlot slot = null;
        PulseValue operand;
        if (isIncrement(op) && node.getOperand() instanceof IndexExpr) {
            slot = resolveSlot((IndexExpr) node.getOperand(), node.getLocation());
            operand = slot.get();
        } else {
            operand = evaluate(node.getOperand());
        }
        switch (op) {
            case NOT:
                if (!(operand instanceof PulseBoolean)) {
                    throw new PulseRuntimeException("Operator '!' requires a boolean, got "
                            + operand.getTypeName(), node.getLocation());
                }
                return PulseBoolean.of(!((PulseBoolean) operand).getValue());
            case NEG:
                if (operand instanceof PulseInt) return PulseInt.of(-((PulseInt) operand).getValue());
                if (operand instanceof PulseDouble) return PulseDouble.of(-((PulseDouble) operand).getValue());
                throw new PulseRuntimeException("Operator '-' requires a number, got "
                        + operand.getTypeName(), node.getLocation());
            default: {
                int delta = op == UnaryExpr.UnaryOp.INC ? 1 : -1;
                PulseValue updated;
                if (operand instanceof PulseInt) {
                    updated = PulseInt.of(((PulseInt) operand).getValue() + delta);
                } else if (operand instanceof PulseDouble) {
                    updated = PulseDouble.of(((PulseDouble) operand).getValue() + delta);
                } else {
                    throw new PulseRuntimeException("Operator '" + op.toSourceString()
                            + "' requires a number, got " + operand.getTypeName(), node.getLocation());
                }
                PulseValue stored = slot != null
                        ? store(slot, updated, node.getLocation())
                        : assignTo(node.getOperand(), updated, node.getLocation());
                return node.isPrefix() ? stored : operand;
            }
        }
    }

    private static boolean isIncrement(UnaryExpr.UnaryOp op) {
        return op == UnaryExpr.UnaryOp.INC || op == UnaryExpr.UnaryOp.DEC;
    }

    @Override
    public PulseValue visitAssignExpr(AssignExpr node, Void ctx) {
        PulseValue value = evaluate(node.getValue());
        return assignTo(node.getTarget(), value, node.getLocation());
    }

    @Override
    public PulseValue visitCallExpr(CallExpr node, Void ctx) {
        SourceLocation loc = node.getLocation();
        String path = node.getCalleePath();
        Expression callee = node.getCallee();

        if (path != null && isBuiltinNamespace(path)) {
            if (!Builtins.isBuiltin(path)) {
                throw new PulseRuntimeException("Unknown method '" + path + "'", loc);
            }
            return builtins.call(path, evaluateArgs(node.getArgs()), loc);
        }

        if (callee instanceof Identifier) {
            String name = ((Identifier) callee).getName();
            List<PulseValue> args = evaluateArgs(node.getArgs());
            CallFrame frame = state.currentFrame();
            if (frame != null) {
                MethodDecl method = frame.getOwner().findMethod(name, args.size());
                if (method != null) {
                    return invoke(frame.getOwner(), method, frame.getReceiver(), args, loc);
                }
            }
            for (ClassDecl cls : state.program.getClasses()) {
                MethodDecl method = cls.findMethod(name, args.size());
                if (method != null) {
                    return invoke(cls, method, null, args, loc);
                }
            }
            throw unknownMethod(name, args.size(), null, loc);
        }

        if (callee instanceof MemberExpr) {
            MemberExpr member = (MemberExpr) callee;
            String name = member.getName();
            if (isStaticReference(member.getTarget())) {
                ClassDecl cls = classNamed(((Identifier) member.getTarget()).getName());
                List<PulseValue> args = evaluateArgs(node.getArgs());
                MethodDecl method = cls.findMethod(name, args.size());
                if (method == null) {
                    throw unknownMethod(name, args.size(), cls.getName(), loc);
                }
                return invoke(cls, method, null, args, loc);
            }

            PulseValue target = evaluate(member.getTarget());
            if (state.report(state.verifier.checkNullAccess(target, loc.getLine()), loc)) {
                return PulseNull.NULL;
            }
            List<PulseValue> args = evaluateArgs(node.getArgs());
            if (target instanceof PulseString) {
                return builtins.callStringMethod((PulseString) target, name, args, loc);
            }
            if (target instanceof PulseObject) {
                PulseObject object = (PulseObject) target;
                ClassDecl cls = classNamed(object.getClassName());
                MethodDecl method = cls != null ? cls.findMethod(name, args.size()) : null;
                if (method == null) {
                    throw unknownMethod(name, args.size(), object.getClassName(), loc);
                }
                return invoke(cls, method, object, args, loc);
            }
            throw new PulseRuntimeException("Cannot call method '" + name + "' on " + target.getTypeName(), loc);
        }

        throw new PulseRuntimeException("Expression is not callable", loc);
    }

    private boolean isBuiltinNamespace(String path) {
        String root = path.contains(".") ? path.substring(0, path.indexOf('.')) : path;
        return ("System".equals(root) || "Math".equals(root)) && !isVariable(root) && classNamed(root) == null;
    }

    /**
     * 目标是类名（且没有同名变量）时为静态引用
     */
    private boolean isStaticReference(Expression target) {
        if (!(target instanceof Identifier)) {
            return false;
        }
        String name = ((Identifier) target).getName();
        return !isVariable(name) && classNamed(name) != null;
    }

    private List<PulseValue> evaluateArgs(List<Expression> args) {
        if (args.isEmpty()) {
            return Collections.emptyList();
        }
        List<PulseValue> values = new ArrayList<PulseValue>(args.size());
        for (Expression arg : args) {
            values.add(evaluate(arg));
        }
        return values;
    }

    private static PulseRuntimeException unknownMethod(String name, int arity, String className, SourceLocation loc) {
        return new PulseRuntimeException("Unknown method '" + name + "' with " + arity + " argument(s)"
                + (className != null ? " on " + className : ""), loc);
    }

    @Override
    public PulseValue visitMemberExpr(MemberExpr node, Void ctx) {
        SourceLocation loc = node.getLocation();
        String name = node.getName();
        if (isStaticReference(node.getTarget())) {
            PulseValue value = state.env.get(name);
            if (value == null) {
                throw new PulseRuntimeException("Undefined static field '"
                        + ((Identifier) node.getTarget()).getName() + "." + name + "'", loc);
            }
            return value;
        }

        PulseValue target = evaluate(node.getTarget());
        if (state.report(state.verifier.checkNullAccess(target, loc.getLine()), loc)) {
            return PulseNull.NULL;
        }
        if (target instanceof PulseArray && "length".equals(name)) {
            return PulseInt.of(((PulseArray) target).length());
        }
        if (target instanceof PulseObject) {
            PulseObject object = (PulseObject) target;
            if (!object.hasField(name)) {
                throw new PulseRuntimeException("Unknown field '" + name + "' on " + object.getClassName(), loc);
            }
            return object.getField(name);
        }
        throw new PulseRuntimeException("Unknown member '" + name + "' on " + target.getTypeName(), loc);
    }

    @Override
    public PulseValue visitNewExpr(NewExpr node, Void ctx) {
        SourceLocation loc = node.getLocation();
        if (node.isArray()) {
            PulseValue size = evaluate(node.getArraySize());
            if (!(size instanceof PulseInt)) {
                throw new PulseRuntimeException("Array size must be int, got " + size.getTypeName(), loc);
            }
            int length = ((PulseInt) size).getValue();
            if (length < 0) {
                throw new PulseRuntimeException("Negative array size: " + length, loc);
            }
            List<PulseValue> elements = new ArrayList<PulseValue>(length);
            for (int i = 0; i < length; i++) {
                elements.add(TypeOps.defaultValue(node.getType()));
            }
            return new PulseArray(node.getType().toString(), elements);
        }

        String className = node.getType().getName();
        ClassDecl cls = classNamed(className);
        if (cls == null) {
            throw new PulseRuntimeException("Unknown class '" + className + "'", loc);
        }
        PulseObject object = new PulseObject(className);
        for (FieldDecl field : cls.getFields()) {
            PulseValue value = field.hasInitializer()
                    ? evaluateInitializer(field.getType(), field.getInitializer())
                    : TypeOps.defaultValue(field.getType());
            PulseValue coerced = TypeOps.coerceOrThrow(field.getType(), value, field.getLocation());
            state.allocate(coerced, field.getLocation());
            object.setField(field.getName(), coerced);
        }

        List<PulseValue> args = evaluateArgs(node.getArgs());
        MethodDecl constructor = cls.findMethod(className, args.size());
        if (constructor != null) {
            invoke(cls, constructor, object, args, loc);
        } else if (!args.isEmpty()) {
            throw new PulseRuntimeException("No constructor for '" + className + "' taking "
                    + args.size() + " argument(s)", loc);
        }
        return object;
    }

    @Override
    public PulseValue visitIndexExpr(IndexExpr node, Void ctx) {
        return resolveSlot(node, node.getLocation()).get();
    }

    /**
     * 求值下标表达式的数组和下标各一次，得到可读写的元素位置。
     * 多维下标沿外层位置逐级解析，写回时不再重新求值。
     */
    private ElementSlot resolveSlot(IndexExpr node, SourceLocation loc) {
        ElementSlot parent = null;
        PulseValue target;
        if (node.getTarget() instanceof IndexExpr) {
            parent = resolveSlot((IndexExpr) node.getTarget(), loc);
            target = parent.get();
        } else {
            target = evaluate(node.getTarget());
        }
        int position = indexValue(node);
        if (state.report(state.verifier.checkNullAccess(target, loc.getLine()), loc)) {
            return ElementSlot.skipped(node, PulseNull.NULL);
        }
        PulseArray array = requireArray(target, node);
        if (state.report(state.verifier.checkArrayAccess(array, position, loc.getLine()), loc)) {
            return ElementSlot.skipped(node, TypeOps.defaultValue(elementType(array)));
        }
        return new ElementSlot(node, array, position, parent);
    }

    /**
     * 写入元素并把新数组写回其所在位置
     *
     * @return 强制转换后的元素；位置已因违规跳过时原样返回 value
     */
    private PulseValue store(ElementSlot slot, PulseValue value, SourceLocation loc) {
        if (slot.isSkipped()) {
            return value;
        }
        PulseValue element = TypeOps.coerceOrThrow(elementType(slot.array), value, loc);
        PulseArray updated = slot.array.with(slot.position, element);
        if (slot.parent != null) {
            store(slot.parent, updated, loc);
        } else {
            assignTo(slot.node.getTarget(), updated, loc);
        }
        return element;
    }

    private int indexValue(IndexExpr node) {
        PulseValue index = evaluate(node.getIndex());
        if (!(index instanceof PulseInt)) {
            throw new PulseRuntimeException("Array index must be int, got " + index.getTypeName(),
                    node.getIndex().getLocation());
        }
        return ((PulseInt) index).getValue();
    }

    private static PulseArray requireArray(PulseValue value, IndexExpr node) {
        if (!(value instanceof PulseArray)) {
            throw new PulseRuntimeException("Cannot index into " + value.getTypeName(), node.getLocation());
        }
        return (PulseArray) value;
    }

    @Override
    public PulseValue visitArrayLiteral(ArrayLiteral node, Void ctx) {
        // 声明中的初始化器由 evaluateInitializer 处理
        throw new PulseRuntimeException("Array initializer is only allowed in a declaration", node.getLocation());
    }
}
