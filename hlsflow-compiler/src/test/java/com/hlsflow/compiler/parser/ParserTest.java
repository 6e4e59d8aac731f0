package com.hlsflow.compiler.parser;

import com.hlsflow.compiler.ast.Pragma;
import com.hlsflow.compiler.ast.decl.*;
import com.hlsflow.compiler.ast.expr.*;
import com.hlsflow.compiler.ast.stmt.*;
import com.hlsflow.compiler.ast.type.BuiltinType;
import com.hlsflow.compiler.ast.type.NamedType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private TranslationUnit parse(String source) {
        return new Parser(source, "<test>").parse();
    }

    private FunctionDecl parseFunction(String source) {
        List<Declaration> decls = parse(source).getDeclarations();
        Declaration last = decls.get(decls.size() - 1);
        assertTrue(last instanceof FunctionDecl, "Expected function, got " + last);
        return (FunctionDecl) last;
    }

    /** 解析函数体中的第一条语句 */
    private Statement firstStatement(String body) {
        return parseFunction("void f() { " + body + " }").getBody().getStatements().get(0);
    }

    private Expression expression(String expr) {
        Statement stmt = parseFunction("int a; int b; int c; void f() { " + expr + "; }")
                .getBody().getStatements().get(0);
        assertTrue(stmt instanceof ExprStmt);
        return ((ExprStmt) stmt).getExpression();
    }

    // ============ 函数声明 ============

    @Nested
    @DisplayName("函数声明")
    class FunctionDeclarationTests {

        @Test
        @DisplayName("带参数与返回值")
        void testSimpleFunction() {
            FunctionDecl fn = parseFunction("int add(int a, unsigned short b) { return a + b; }");
            assertEquals("add", fn.getName());
            assertEquals(2, fn.getParameters().size());
            BuiltinType second = (BuiltinType) fn.getParameters().get(1).getType();
            assertEquals(BuiltinType.Kind.SHORT, second.getKind());
            assertTrue(second.isUnsigned());
        }

        @Test
        @DisplayName("引用与 const 引用参数")
        void testReferenceParams() {
            FunctionDecl fn = parseFunction("void f(int &a, const int &b) { }");
            assertTrue(fn.getParameters().get(0).getType().isReference());
            assertFalse(fn.getParameters().get(0).getType().isConst());
            assertTrue(fn.getParameters().get(1).getType().isReference());
            assertTrue(fn.getParameters().get(1).getType().isConst());
        }

        @Test
        @DisplayName("数组参数与默认参数")
        void testArrayAndDefaultParams() {
            FunctionDecl fn = parseFunction("int f(int arr[4], int k = 3) { return arr[k]; }");
            assertTrue(fn.getParameters().get(0).isArray());
            assertTrue(fn.getParameters().get(1).hasDefaultValue());
            assertEquals(1, fn.getRequiredParameterCount());
        }

        @Test
        @DisplayName("pragma 附着到下一个声明")
        void testPragmaAttached() {
            FunctionDecl fn = parseFunction("#pragma hls_top\nint top() { return 1; }");
            assertTrue(fn.hasPragma(Pragma.TOP));
        }

        @Test
        @DisplayName("通道参数")
        void testChannelParam() {
            FunctionDecl fn = parseFunction("void f(__hls_channel<int> &in) { int x = in.read(); }");
            NamedType type = (NamedType) fn.getParameters().get(0).getType();
            assertEquals("__hls_channel", type.getName().toString());
            assertEquals(1, type.getTemplateArguments().size());
        }

        @Test
        @DisplayName("函数模板")
        void testFunctionTemplate() {
            FunctionDecl fn = parseFunction("template<typename T, int N> T scale(T x) { return x * N; }");
            assertTrue(fn.isTemplate());
            assertTrue(fn.getTemplateParameters().get(0).isTypeParameter());
            assertFalse(fn.getTemplateParameters().get(1).isTypeParameter());
        }

        @Test
        @DisplayName("自由运算符重载")
        void testFreeOperator() {
            FunctionDecl fn = parseFunction("struct P { int x; }; P operator+(P a, P b) { return a; }");
            assertEquals("operator+", fn.getName());
            assertTrue(fn.isOperator());
        }

        @Test
        @DisplayName("指针类型被拒绝")
        void testPointerRejected() {
            ParseException e = assertThrows(ParseException.class, () -> parse("void f(int *p) { }"));
            assertTrue(e.getMessage().contains("Pointer types are not supported"));
        }
    }

    // ============ 结构体 ============

    @Nested
    @DisplayName("结构体")
    class StructTests {

        @Test
        @DisplayName("字段、构造函数与方法")
        void testStructMembers() {
            TranslationUnit unit = parse(
                    "struct Point {\n" +
                    "  int x, y;\n" +
                    "  Point(int a, int b) : x(a), y(b) { }\n" +
                    "  int sum() const { return x + y; }\n" +
                    "  void set(int v) { x = v; }\n" +
                    "};");
            StructDecl struct = (StructDecl) unit.getDeclarations().get(0);
            assertEquals("Point", struct.getName());
            assertEquals(2, struct.getFields().size());
            assertEquals(3, struct.getMethods().size());
            FunctionDecl ctor = struct.getMethods().get(0);
            assertTrue(ctor.isConstructor());
            assertEquals(2, ctor.getMemberInitializers().size());
            assertTrue(struct.getMethods().get(1).isConstMethod());
        }

        @Test
        @DisplayName("继承与访问控制")
        void testInheritance() {
            TranslationUnit unit = parse(
                    "struct Base { int a; };\n" +
                    "class Derived : public Base {\n" +
                    " public:\n" +
                    "  int b;\n" +
                    "};");
            StructDecl derived = (StructDecl) unit.getDeclarations().get(1);
            assertTrue(derived.isClass());
            assertEquals(1, derived.getBases().size());
            assertEquals("Base", derived.getBases().get(0).getType().getSpelling());
        }

        @Test
        @DisplayName("转换运算符与成员运算符")
        void testOperators() {
            StructDecl struct = (StructDecl) parse(
                    "struct W {\n" +
                    "  int v;\n" +
                    "  operator int() const { return v; }\n" +
                    "  W operator+(const W &o) const { return o; }\n" +
                    "  W &operator+=(int d) { v += d; return *this; }\n" +
                    "};").getDeclarations().get(0);
            assertEquals(FunctionDecl.Kind.CONVERSION, struct.getMethods().get(0).getKind());
            assertEquals("operator+", struct.getMethods().get(1).getName());
            assertEquals("operator+=", struct.getMethods().get(2).getName());
        }

        @Test
        @DisplayName("结构体模板")
        void testStructTemplate() {
            TranslationUnit unit = parse(
                    "template<int W> struct Bits { int v; int width() { return W; } };\n" +
                    "int f() { Bits<4> b; return b.width(); }");
            StructDecl struct = (StructDecl) unit.getDeclarations().get(0);
            assertTrue(struct.isTemplate());
            FunctionDecl fn = (FunctionDecl) unit.getDeclarations().get(1);
            DeclStmt decl = (DeclStmt) fn.getBody().getStatements().get(0);
            NamedType type = (NamedType) decl.getVariables().get(0).getType();
            assertEquals(1, type.getTemplateArguments().size());
        }

        @Test
        @DisplayName("typedef 匿名结构体以别名命名")
        void testTypedefStruct() {
            TranslationUnit unit = parse("typedef struct { int a; } Pair; Pair make() { Pair p; return p; }");
            StructDecl struct = (StructDecl) unit.getDeclarations().get(0);
            assertEquals("Pair", struct.getName());
        }

        @Test
        @DisplayName("no_tuple pragma 附着到结构体")
        void testNoTuplePragma() {
            StructDecl struct = (StructDecl) parse("#pragma hls_no_tuple\nstruct S { int x; };")
                    .getDeclarations().get(0);
            assertTrue(struct.hasPragma(Pragma.NO_TUPLE));
        }

        @Test
        @DisplayName("命名空间内的类型")
        void testNamespace() {
            TranslationUnit unit = parse("namespace hw { struct R { int v; }; }\nint f() { hw::R r; return r.v; }");
            NamespaceDecl ns = (NamespaceDecl) unit.getDeclarations().get(0);
            assertEquals("hw", ns.getName());
            assertEquals(1, ns.getDeclarations().size());
        }
    }

    // ============ 语句 ============

    @Nested
    @DisplayName("语句")
    class StatementTests {

        @Test
        @DisplayName("带 unroll pragma 的 for 循环")
        void testForLoop() {
            Statement stmt = firstStatement("\n#pragma hls_unroll yes\nfor (int i = 0; i < 4; ++i) { }");
            ForStmt loop = (ForStmt) stmt;
            assertNotNull(Pragma.find(loop.getPragmas(), Pragma.UNROLL));
            assertTrue(loop.getInitializer() instanceof DeclStmt);
            assertNotNull(loop.getCondition());
            assertNotNull(loop.getUpdate());
        }

        @Test
        @DisplayName("for 循环缺少子句")
        void testForMissingClauses() {
            ForStmt loop = (ForStmt) firstStatement("for (;;) { }");
            assertNull(loop.getInitializer());
            assertNull(loop.getCondition());
            assertNull(loop.getUpdate());
        }

        @Test
        @DisplayName("switch 分段：连续标签合并")
        void testSwitchSections() {
            SwitchStmt sw = (SwitchStmt) parseFunction(
                    "int f(int x) { int r = 0; switch (x) { case 1: case 2: r = 1; break; default: r = 2; } return r; }")
                    .getBody().getStatements().get(1);
            assertEquals(2, sw.getSections().size());
            assertEquals(2, sw.getSections().get(0).getLabels().size());
            assertTrue(sw.getSections().get(1).hasDefault());
        }

        @Test
        @DisplayName("多变量声明与数组初始化")
        void testDeclarations() {
            DeclStmt decl = (DeclStmt) firstStatement("int a = 1, b[3] = {1, 2, 3};");
            assertEquals(2, decl.getVariables().size());
            VarDecl b = decl.getVariables().get(1);
            assertEquals(1, b.getArrayDimensions().size());
            assertTrue(b.getInitializer() instanceof InitListExpr);
        }

        @Test
        @DisplayName("static 局部变量")
        void testStaticLocal() {
            DeclStmt decl = (DeclStmt) firstStatement("static int count = 0;");
            assertTrue(decl.getVariables().get(0).isStatic());
        }

        @Test
        @DisplayName("局部结构体声明")
        void testLocalStruct() {
            assertTrue(firstStatement("struct { int a; } s;") instanceof TypeDeclStmt);
        }

        @Test
        @DisplayName("do-while")
        void testDoWhile() {
            WhileStmt loop = (WhileStmt) firstStatement("do { } while (false);");
            assertTrue(loop.isDoWhile());
        }
    }

    // ============ 表达式 ============

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("乘法优先于加法")
        void testPrecedence() {
            BinaryExpr add = (BinaryExpr) expression("a + b * c");
            assertEquals(BinaryExpr.BinaryOp.ADD, add.getOperator());
            assertEquals(BinaryExpr.BinaryOp.MUL, ((BinaryExpr) add.getRight()).getOperator());
        }

        @Test
        @DisplayName("比较不会被误认为模板实参")
        void testLessThan() {
            BinaryExpr cmp = (BinaryExpr) expression("a < b");
            assertEquals(BinaryExpr.BinaryOp.LT, cmp.getOperator());
        }

        @Test
        @DisplayName("复合赋值右结合")
        void testAssignment() {
            AssignExpr assign = (AssignExpr) expression("a += b = c");
            assertEquals(BinaryExpr.BinaryOp.ADD, assign.getCompoundOperator());
            assertTrue(assign.getValue() instanceof AssignExpr);
        }

        @Test
        @DisplayName("三元表达式")
        void testConditional() {
            assertTrue(expression("a ? b : c") instanceof ConditionalExpr);
        }

        @Test
        @DisplayName("三种类型转换")
        void testCasts() {
            assertEquals(CastExpr.Style.C_STYLE, ((CastExpr) expression("(long)a")).getStyle());
            assertEquals(CastExpr.Style.FUNCTIONAL, ((CastExpr) expression("bool(a)")).getStyle());
            assertEquals(CastExpr.Style.STATIC_CAST,
                    ((CastExpr) expression("static_cast<unsigned>(a)")).getStyle());
        }

        @Test
        @DisplayName("后缀自增与成员调用")
        void testPostfix() {
            UnaryExpr inc = (UnaryExpr) expression("a++");
            assertEquals(UnaryExpr.UnaryOp.POST_INC, inc.getOperator());
            CallExpr call = (CallExpr) parseFunction("void f(__hls_channel<int> &out) { out.write(3); }")
                    .getBody().getStatements().stream()
                    .map(s -> ((ExprStmt) s).getExpression()).findFirst().get();
            MemberExpr member = (MemberExpr) call.getCallee();
            assertEquals("write", member.getMember());
            assertEquals(1, call.getArguments().size());
        }

        @Test
        @DisplayName("十六进制字面量不是十进制")
        void testLiteralFlags() {
            IntLiteral hex = (IntLiteral) expression("0x10u");
            assertEquals(16L, hex.getValue());
            assertTrue(hex.isUnsigned());
            assertFalse(hex.isDecimal());
        }

        @Test
        @DisplayName("构造表达式")
        void testConstructExpr() {
            FunctionDecl fn = parseFunction("struct P { int x; P(int v) : x(v) { } }; int f() { return P(3).x; }");
            ReturnStmt ret = (ReturnStmt) fn.getBody().getStatements().get(0);
            MemberExpr member = (MemberExpr) ret.getValue();
            assertTrue(member.getTarget() instanceof ConstructExpr);
        }
    }

    @Test
    @DisplayName("语法错误携带位置")
    void testErrorLocation() {
        ParseException e = assertThrows(ParseException.class, () -> parse("int f( { }"));
        assertTrue(e.getMessage().contains("line 1"));
    }
}
