package com.pulselang.compiler.parser;

import com.pulselang.compiler.ast.Modifier;
import com.pulselang.compiler.ast.TypeRef;
import com.pulselang.compiler.ast.decl.*;
import com.pulselang.compiler.ast.expr.*;
import com.pulselang.compiler.ast.stmt.*;
import com.pulselang.compiler.analysis.Diagnostic;
import com.pulselang.compiler.lexer.Lexer;
import com.pulselang.compiler.lexer.TokenType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private Program parse(String source) {
        return new Parser(new Lexer(source, "<test>")).parse();
    }

    /** 解析顶层语句，返回合成 main 的语句列表 */
    private List<Statement> statements(String source) {
        ClassDecl main = parse(source).findClass(ClassDecl.SYNTHETIC_NAME);
        assertNotNull(main, "synthetic class missing");
        return main.findMethod("main", 0).getBody().getStatements();
    }

    private Expression expression(String source) {
        Statement stmt = statements(source + ";").get(0);
        return ((ExpressionStmt) stmt).getExpression();
    }

    @Nested
    @DisplayName("程序结构")
    class ProgramShapeTests {

        @Test
        @DisplayName("顶层方法归入合成类 Main")
        void testFreeStandingMethod() {
            Program program = parse("@Deadline(ms=5)\npublic void sensorRead() { int t = 25; }");
            assertEquals(1, program.getClasses().size());
            ClassDecl main = program.getClasses().get(0);
            assertTrue(main.isSynthetic());
            assertEquals("Main", main.getName());

            MethodDecl method = main.getMethods().get(0);
            assertEquals("sensorRead", method.getName());
            assertEquals(List.of(Modifier.PUBLIC), method.getModifiers());
            assertTrue(method.getReturnType().isVoid());
            Annotation deadline = method.findAnnotation(Annotation.DEADLINE);
            assertNotNull(deadline);
            assertEquals(5, deadline.getArg("ms"));
            assertEquals(2, method.getLine());
        }

        @Test
        @DisplayName("顶层语句合成为 main 方法")
        void testTopLevelStatements() {
            Program program = parse("int x = 1;\nSystem.out.println(x);");
            MethodDecl main = program.findClass("Main").findMethod("main", 0);
            assertNotNull(main);
            assertTrue(main.isStatic());
            assertEquals(2, main.getBody().getStatements().size());
        }

        @Test
        @DisplayName("显式类与顶层成员共存")
        void testClassAndTopLevel() {
            Program program = parse("class Sensor { int value = 3; int read() { return value; } }\n"
                    + "Sensor s = new Sensor();");
            assertEquals(2, program.getClasses().size());
            ClassDecl sensor = program.findClass("Sensor");
            assertFalse(sensor.isSynthetic());
            assertEquals(1, sensor.getFields().size());
            assertEquals("value", sensor.getFields().get(0).getName());
            assertNotNull(sensor.findMethod("read", 0));
        }

        @Test
        @DisplayName("构造器解析为与类同名的方法")
        void testConstructor() {
            ClassDecl cls = parse("class Point { int x; Point(int x) { this.x = x; } }").findClass("Point");
            MethodDecl ctor = cls.findMethod("Point", 1);
            assertNotNull(ctor);
            assertTrue(ctor.getReturnType().isVoid());
            Statement body = ctor.getBody().getStatements().get(0);
            AssignExpr assign = (AssignExpr) ((ExpressionStmt) body).getExpression();
            MemberExpr target = (MemberExpr) assign.getTarget();
            assertEquals("this", ((Identifier) target.getTarget()).getName());
        }

        @Test
        @DisplayName("带修饰符的顶层声明成为字段")
        void testTopLevelField() {
            ClassDecl main = parse("static int counter = 0;\nvoid tick() { counter++; }").findClass("Main");
            assertEquals(1, main.getFields().size());
            assertEquals(List.of(Modifier.STATIC), main.getFields().get(0).getModifiers());
        }

        @Test
        @DisplayName("多个注解按顺序附加")
        void testMultipleAnnotations() {
            MethodDecl method = parse("@Deadline(ms=3)\n@SafetyCheck\n@Sensor(type=\"pressure\")\nvoid check() {}")
                    .findClass("Main").getMethods().get(0);
            assertEquals(3, method.getAnnotations().size());
            assertTrue(method.hasAnnotation(Annotation.SAFETY_CHECK));
            assertEquals("pressure", method.findAnnotation(Annotation.SENSOR).getArg("type"));
            assertFalse(method.findAnnotation(Annotation.SAFETY_CHECK).hasArgs());
        }

        @Test
        @DisplayName("注释被跳过")
        void testCommentsSkipped() {
            assertEquals(1, statements("// header\nint /* inline */ x = 1; // trailing").size());
        }

        @Test
        @DisplayName("空程序")
        void testEmptyProgram() {
            assertTrue(parse("  // nothing\n").getClasses().isEmpty());
        }
    }

    @Nested
    @DisplayName("语句")
    class StatementTests {

        @Test
        @DisplayName("变量声明含数组类型与初始化器")
        void testArrayDeclaration() {
            VarDeclStmt decl = (VarDeclStmt) statements("int[] v = {1, 2, 3};").get(0);
            assertEquals(new TypeRef("int", 1), decl.getType());
            ArrayLiteral literal = (ArrayLiteral) decl.getInitializer();
            assertEquals(3, literal.getElements().size());
        }

        @Test
        @DisplayName("类类型变量声明")
        void testClassTypedDeclaration() {
            VarDeclStmt decl = (VarDeclStmt) statements("Sensor s = null;").get(0);
            assertEquals(TypeRef.of("Sensor"), decl.getType());
        }

        @Test
        @DisplayName("无初始值的声明")
        void testUninitialized() {
            VarDeclStmt decl = (VarDeclStmt) statements("double d;").get(0);
            assertFalse(decl.hasInitializer());
        }

        @Test
        @DisplayName("if / else if / else")
        void testIfElseChain() {
            IfStmt stmt = (IfStmt) statements("if (a) { x = 1; } else if (b) x = 2; else { x = 3; }").get(0);
            assertTrue(stmt.getThenBranch() instanceof Block);
            IfStmt elseIf = (IfStmt) stmt.getElseBranch();
            assertTrue(elseIf.getThenBranch() instanceof ExpressionStmt);
            assertTrue(elseIf.hasElse());
        }

        @Test
        @DisplayName("else 绑定到最近的 if")
        void testDanglingElse() {
            IfStmt outer = (IfStmt) statements("if (a) if (b) x = 1; else x = 2;").get(0);
            assertFalse(outer.hasElse());
            assertTrue(((IfStmt) outer.getThenBranch()).hasElse());
        }

        @Test
        @DisplayName("for 循环各部分")
        void testFor() {
            ForStmt loop = (ForStmt) statements("for (int i = 0; i < 8; i++) { }").get(0);
            assertTrue(loop.getInit() instanceof VarDeclStmt);
            assertEquals(BinaryExpr.BinaryOp.LT, ((BinaryExpr) loop.getCondition()).getOperator());
            assertTrue(((UnaryExpr) loop.getUpdate()).isPostfix());
        }

        @Test
        @DisplayName("for 循环各部分均可省略")
        void testEmptyFor() {
            ForStmt loop = (ForStmt) statements("for (;;) x++;").get(0);
            assertNull(loop.getInit());
            assertNull(loop.getCondition());
            assertNull(loop.getUpdate());
        }

        @Test
        @DisplayName("while 与 return")
        void testWhileAndReturn() {
            MethodDecl method = parse("int f() { while (n > 0) n--; return n; }").findClass("Main").getMethods().get(0);
            List<Statement> body = method.getBody().getStatements();
            assertTrue(body.get(0) instanceof WhileStmt);
            assertTrue(((ReturnStmt) body.get(1)).hasValue());
        }
    }

    @Nested
    @DisplayName("表达式优先级")
    class PrecedenceTests {

        @Test
        @DisplayName("乘法优先于加法")
        void testMulOverAdd() {
            BinaryExpr add = (BinaryExpr) expression("a + b * c");
            assertEquals(BinaryExpr.BinaryOp.ADD, add.getOperator());
            assertEquals(BinaryExpr.BinaryOp.MUL, ((BinaryExpr) add.getRight()).getOperator());
        }

        @Test
        @DisplayName("减法左结合")
        void testLeftAssociative() {
            BinaryExpr sub = (BinaryExpr) expression("a - b - c");
            assertTrue(sub.getLeft() instanceof BinaryExpr);
            assertTrue(sub.getRight() instanceof Identifier);
        }

        @Test
        @DisplayName("赋值右结合")
        void testAssignRightAssociative() {
            AssignExpr assign = (AssignExpr) expression("a = b = 1");
            assertTrue(assign.getValue() instanceof AssignExpr);
        }

        @Test
        @DisplayName("|| 低于 &&，&& 低于比较")
        void testLogical() {
            BinaryExpr or = (BinaryExpr) expression("a > 1 || b < 2 && c == 3");
            assertEquals(BinaryExpr.BinaryOp.OR, or.getOperator());
            BinaryExpr and = (BinaryExpr) or.getRight();
            assertEquals(BinaryExpr.BinaryOp.AND, and.getOperator());
            assertEquals(BinaryExpr.BinaryOp.EQ, ((BinaryExpr) and.getRight()).getOperator());
        }

        @Test
        @DisplayName("一元负号与取反")
        void testUnary() {
            BinaryExpr mul = (BinaryExpr) expression("-a * !b");
            assertEquals(UnaryExpr.UnaryOp.NEG, ((UnaryExpr) mul.getLeft()).getOperator());
            assertEquals(UnaryExpr.UnaryOp.NOT, ((UnaryExpr) mul.getRight()).getOperator());
        }

        @Test
        @DisplayName("括号改变优先级")
        void testParentheses() {
            BinaryExpr mul = (BinaryExpr) expression("(a + b) * c");
            assertEquals(BinaryExpr.BinaryOp.MUL, mul.getOperator());
            assertTrue(mul.getLeft() instanceof BinaryExpr);
        }

        @Test
        @DisplayName("二元表达式位置为运算符位置")
        void testOperatorLocation() {
            BinaryExpr div = (BinaryExpr) expression("\n\nx\n / 0");
            assertEquals(4, div.getLine());
        }
    }

    @Nested
    @DisplayName("后缀与基本表达式")
    class PostfixTests {

        @Test
        @DisplayName("System.out.println 调用")
        void testQualifiedCall() {
            CallExpr call = (CallExpr) expression("System.out.println(\"hi\", 1)");
            assertEquals("System.out.println", call.getCalleePath());
            assertEquals(2, call.getArgs().size());
        }

        @Test
        @DisplayName("嵌套调用")
        void testNestedCall() {
            CallExpr floor = (CallExpr) expression("Math.floor(Math.random() * 10)");
            assertEquals("Math.floor", floor.getCalleePath());
            BinaryExpr arg = (BinaryExpr) floor.getArgs().get(0);
            assertEquals("Math.random", ((CallExpr) arg.getLeft()).getCalleePath());
        }

        @Test
        @DisplayName("下标赋值与 length 成员")
        void testIndexAndLength() {
            AssignExpr assign = (AssignExpr) expression("v[i] = v.length");
            assertTrue(assign.getTarget() instanceof IndexExpr);
            assertEquals("length", ((MemberExpr) assign.getValue()).getName());
        }

        @Test
        @DisplayName("new 对象与 new 数组")
        void testNew() {
            NewExpr object = (NewExpr) expression("new Sensor(1, 2)");
            assertFalse(object.isArray());
            assertEquals(2, object.getArgs().size());

            NewExpr array = (NewExpr) expression("new double[n + 1]");
            assertTrue(array.isArray());
            assertEquals(TypeRef.of("double"), array.getType());
            assertTrue(array.getArraySize() instanceof BinaryExpr);
        }

        @Test
        @DisplayName("前缀与后缀自增")
        void testIncrement() {
            UnaryExpr prefix = (UnaryExpr) expression("++count");
            assertTrue(prefix.isPrefix());
            UnaryExpr postfix = (UnaryExpr) expression("v[0]--");
            assertTrue(postfix.isPostfix());
            assertEquals(UnaryExpr.UnaryOp.DEC, postfix.getOperator());
        }

        @Test
        @DisplayName("字面量类型")
        void testLiterals() {
            assertEquals(Literal.LiteralKind.DOUBLE, ((Literal) expression("2.5")).getKind());
            assertEquals(Literal.LiteralKind.NULL, ((Literal) expression("null")).getKind());
            assertEquals(Boolean.TRUE, ((Literal) expression("true")).getValue());
            assertEquals("a\"b", ((Literal) expression("\"a\\\"b\"")).getValue());
        }
    }

    @Nested
    @DisplayName("错误")
    class ErrorTests {

        @Test
        @DisplayName("缺失分号报告行列与 token")
        void testMissingSemicolon() {
            ParseException e = assertThrows(ParseException.class, () -> parse("int x = 1\nint y = 2;"));
            assertEquals(2, e.getToken().getLine());
            assertEquals("int", e.getToken().getLexeme());
            assertTrue(e.getMessage().startsWith("Expected ';' after variable declaration at line 2, column 1"));
            assertTrue(e.getMessage().contains("(found 'int')"));
        }

        @Test
        @DisplayName("非法赋值目标")
        void testInvalidAssignTarget() {
            ParseException e = assertThrows(ParseException.class, () -> parse("1 = x;"));
            assertTrue(e.getMessage().startsWith("Invalid assignment target"));
            assertEquals("Invalid assignment target", e.getRawMessage());
        }

        @Test
        @DisplayName("输入提前结束")
        void testUnexpectedEnd() {
            ParseException e = assertThrows(ParseException.class, () -> parse("int x = 1"));
            assertTrue(e.getMessage().contains("(found end of input)"));
            assertEquals(TokenType.SEMICOLON, e.getExpected());
        }

        @Test
        @DisplayName("数组初始化器只能用于声明")
        void testArrayLiteralOutsideDeclaration() {
            assertThrows(ParseException.class, () -> parse("x = {1, 2};"));
        }

        @Test
        @DisplayName("注解参数必须是字面量")
        void testAnnotationLiteralOnly() {
            ParseException e = assertThrows(ParseException.class, () -> parse("@Deadline(ms=limit) void f() {}"));
            assertEquals("limit", e.getToken().getLexeme());
        }

        @Test
        @DisplayName("ERROR token 报告为解析错误")
        void testErrorToken() {
            ParseException e = assertThrows(ParseException.class, () -> parse("int x = 1 # 2;"));
            assertEquals("#", e.getToken().getLexeme());
        }

        @Test
        @DisplayName("顶层语句与显式 main 冲突")
        void testMainConflict() {
            assertThrows(ParseException.class, () -> parse("void main() {}\nint x = 1;"));
        }
    }

    @Nested
    @DisplayName("容错解析")
    class TolerantTests {

        @Test
        @DisplayName("收集多个错误并保留其余声明")
        void testCollectsErrors() {
            String source = "void a() { int x = ; }\n"
                    + "void b() { return; }\n"
                    + "void c() { y = = 2; }\n"
                    + "void d() { }";
            ParseResult result = new Parser(new Lexer(source, "<test>")).parseTolerant();
            assertTrue(result.hasErrors());
            assertEquals(2, result.getErrors().size());
            assertEquals(1, result.getErrors().get(0).getLine());
            assertEquals(3, result.getErrors().get(1).getLine());
            ClassDecl main = result.getProgram().findClass("Main");
            assertNotNull(main.findMethod("b", 0));
            assertNotNull(main.findMethod("d", 0));
        }

        @Test
        @DisplayName("错误消息不含位置，可转为诊断")
        void testErrorAsDiagnostic() {
            ParseResult result = new Parser(new Lexer("int x = ;", "<test>")).parseTolerant();
            ParseError error = result.getErrors().get(0);
            assertEquals("Expected expression", error.getMessage());
            assertEquals(1, error.getLine());
            assertEquals(9, error.getColumn());
            assertEquals("Line 1, column 9: Expected expression", error.toString());

            List<Diagnostic> diagnostics = result.toDiagnostics();
            assertEquals(1, diagnostics.size());
            assertTrue(diagnostics.get(0).isError());
            assertEquals("Line 1: Expected expression", diagnostics.get(0).toString());
        }

        @Test
        @DisplayName("无错误时与 parse 结果一致")
        void testNoErrors() {
            ParseResult result = new Parser(new Lexer("int x = 1;", "<test>")).parseTolerant();
            assertFalse(result.hasErrors());
            assertNotNull(result.getProgram().findClass("Main"));
        }
    }
}
