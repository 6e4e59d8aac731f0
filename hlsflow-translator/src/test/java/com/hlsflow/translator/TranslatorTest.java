package com.hlsflow.translator;

import com.hlsflow.ir.IrFunction;
import com.hlsflow.ir.IrPackage;
import com.hlsflow.ir.interp.IrInterpreter;
import com.hlsflow.ir.node.IrOp;
import com.hlsflow.ir.value.IrValue;
import com.hlsflow.translator.gen.GeneratedFunction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static com.hlsflow.translator.TranslationHarness.*;
import static org.assertj.core.api.Assertions.*;

/**
 * 函数模式翻译测试：翻译后解释执行，结果与源程序语义一致
 */
@DisplayName("Translator 函数模式测试")
class TranslatorTest {

    @Nested
    @DisplayName("基础")
    class BasicTests {

        @Test
        @DisplayName("常量返回")
        void testIntConst() {
            String src = source(
                    "int my_package(int a) {",
                    "  return 123;",
                    "}");
            assertThat(runSigned(src, "a", 100)).isEqualTo(123);
        }

        @Test
        @DisplayName("long long 常量")
        void testLongLongConst() {
            String src = source(
                    "long long my_package(long long a) {",
                    "  return 123LL;",
                    "}");
            assertThat(runSigned(src, "a", 100)).isEqualTo(123);
        }

        @Test
        @DisplayName("赋值与赋值表达式的值")
        void testAssignment() {
            assertThat(runSigned(source(
                    "int my_package(int a) {",
                    "  a = 5;",
                    "  return a;",
                    "}"), "a", 1000)).isEqualTo(5);
            assertThat(runSigned(source(
                    "int my_package(int a) {",
                    "  a = 5;",
                    "  return a = 10;",
                    "}"), "a", 1000)).isEqualTo(10);
        }

        @Test
        @DisplayName("复合赋值")
        void testChainedAssignment() {
            String src = source(
                    "int my_package(int a) {",
                    "  a += 5;",
                    "  a += 10;",
                    "  return a;",
                    "}");
            assertThat(runSigned(src, "a", 1000)).isEqualTo(1015);
        }

        @Test
        @DisplayName("unsigned char 按 8 位回绕")
        void testUnsignedChar() {
            String src = source(
                    "unsigned char my_package(unsigned char a) {",
                    "  return a+5;",
                    "}");
            assertThat(run(src, "a", 100).toUnsignedLong()).isEqualTo(105);
            assertThat(run(src, "a", 255).toUnsignedLong()).isEqualTo(4);
        }

        @Test
        @DisplayName("转 bool 为非零判断")
        void testBool() {
            String src = source(
                    "int my_package(long long a) {",
                    "  return bool(a);",
                    "}");
            assertThat(runSigned(src, "a", 1000)).isEqualTo(1);
            assertThat(runSigned(src, "a", 0)).isEqualTo(0);
            assertThat(runSigned(src, "a", -1)).isEqualTo(1);
        }

        @Test
        @DisplayName("一条声明多个变量")
        void testDeclGroup() {
            String src = source(
                    "long long my_package(long long a, long long b) {",
                    "  long long aa=a, bb=b;",
                    "  return aa+bb;",
                    "}");
            assertThat(runSigned(src, "a", 10, "b", 20)).isEqualTo(30);
        }

        @Test
        @DisplayName("short 加法")
        void testShort() {
            String src = source(
                    "short my_package(short a, short b) {",
                    "  return a+b;",
                    "}");
            assertThat(runSigned(src, "a", 100, "b", 200)).isEqualTo(300);
        }

        @Test
        @DisplayName("typedef 别名")
        void testTypedef() {
            String src = source(
                    "typedef long long my_int;",
                    "my_int my_package(my_int a) {",
                    "  return a*10;",
                    "}");
            assertThat(runSigned(src, "a", 4)).isEqualTo(40);
        }

        @Test
        @DisplayName("有符号转无符号再返回")
        void testSignExtend() {
            String src = source(
                    "long long my_package(long long a) {",
                    "  return (unsigned long)a;",
                    "}");
            assertThat(runSigned(src, "a", 3)).isEqualTo(3);
            assertThat(runSigned(src, "a", -3)).isEqualTo(-3);
        }

        @Test
        @DisplayName("条件表达式")
        void testTernary() {
            String src = source(
                    "int my_package(int a) {",
                    "  return a ? a : 11;",
                    "}");
            assertThat(runSigned(src, "a", 3)).isEqualTo(3);
            assertThat(runSigned(src, "a", 0)).isEqualTo(11);
        }

        @Test
        @DisplayName("内层作用域的同名变量不影响外层")
        void testShadowAssignment() {
            String src = source(
                    "int my_package(int a) {",
                    "  int r = a;",
                    "  {",
                    "    int r = 22;",
                    "    r = 55;",
                    "  }",
                    "  return r;",
                    "}");
            assertThat(runSigned(src, "a", 100)).isEqualTo(100);
        }

        @Test
        @DisplayName("括号中的左值")
        void testAssignmentInParens() {
            String src = source(
                    "int my_package(int a) {",
                    "  int r = a;",
                    "  (r) = 55;",
                    "  return r;",
                    "}");
            assertThat(runSigned(src, "a", 100)).isEqualTo(55);
        }

        @Test
        @DisplayName("数组元素赋值与二维数组")
        void testArrays() {
            assertThat(runSigned(source(
                    "long long my_package(long long a, long long b) {",
                    "  long long arr[4];",
                    "  arr[0] = a;",
                    "  arr[1] = b;",
                    "  return arr[0]+arr[1];",
                    "}"), "a", 11, "b", 50)).isEqualTo(61);
            assertThat(runSigned(source(
                    "int my_package(int a, int b) {",
                    "  int x[2][2] = {{b,b}, {b,b}};",
                    "  x[1][0] += a;",
                    "  return x[1][0];",
                    "}"), "a", 55, "b", 100)).isEqualTo(155);
        }

        @Test
        @DisplayName("数组参数")
        void testArrayParam() {
            String src = source(
                    "long long my_package(const long long arr[2]) {",
                    "  return arr[0]+arr[1];",
                    "}");
            IrValue arr = IrValue.array(Arrays.asList(IrValue.ofBits(64, 55), IrValue.ofBits(64, 20)));
            assertThat(run(src, "arr", arr).toSignedLong()).isEqualTo(75);
        }
    }

    @Nested
    @DisplayName("内建运算符")
    class NativeOperatorTests {

        private String binary(String op) {
            return source(
                    "long long my_package(long long a, long long b) {",
                    "  return a " + op + " b;",
                    "}");
        }

        private String compound(String op) {
            return source(
                    "long long my_package(long long a, long long b) {",
                    "  a " + op + "= b;",
                    "  return a;",
                    "}");
        }

        private String compare(String op) {
            return source(
                    "long long my_package(long long a, long long b) {",
                    "  return (long long)(a " + op + " b);",
                    "}");
        }

        private String compareUnsigned(String op) {
            return source(
                    "long long my_package(unsigned long long a, unsigned long long b) {",
                    "  return (long long)(a " + op + " b);",
                    "}");
        }

        @Test
        @DisplayName("加减乘")
        void testAddSubMul() {
            assertThat(runSigned(binary("+"), "a", 3, "b", 10)).isEqualTo(13);
            assertThat(runSigned(compound("+"), "a", 11, "b", 22)).isEqualTo(33);
            assertThat(runSigned(binary("-"), "a", 8, "b", 3)).isEqualTo(5);
            assertThat(runSigned(compound("-"), "a", 30, "b", 11)).isEqualTo(19);
            assertThat(runSigned(binary("*"), "a", 3, "b", 10)).isEqualTo(30);
            assertThat(runSigned(compound("*"), "a", 11, "b", 2)).isEqualTo(22);
        }

        @Test
        @DisplayName("有符号除法与取余向零截断")
        void testDivRem() {
            assertThat(runSigned(binary("/"), "a", 55, "b", 3)).isEqualTo(18);
            assertThat(runSigned(compound("/"), "a", -1800, "b", 18)).isEqualTo(-100);
            assertThat(runSigned(binary("/"), "a", -7, "b", 2)).isEqualTo(-3);
            assertThat(runSigned(binary("%"), "a", 55, "b", 3)).isEqualTo(1);
            assertThat(runSigned(compound("%"), "a", -1800, "b", 18)).isEqualTo(0);
            assertThat(runSigned(binary("%"), "a", -7, "b", 2)).isEqualTo(-1);
        }

        @Test
        @DisplayName("按位与或异或")
        void testBitwise() {
            assertThat(runSigned(binary("&"), "a", 0b1001, "b", 0b0110)).isEqualTo(0b0000);
            assertThat(runSigned(compound("&"), "a", 0b1001, "b", 0b1110)).isEqualTo(0b1000);
            assertThat(runSigned(binary("|"), "a", 0b1001, "b", 0b0110)).isEqualTo(0b1111);
            assertThat(runSigned(compound("|"), "a", 0b1000, "b", 0b1110)).isEqualTo(0b1110);
            assertThat(runSigned(binary("^"), "a", 0b1001, "b", 0b0110)).isEqualTo(0b1111);
            assertThat(runSigned(compound("^"), "a", 0b1001, "b", 0b1110)).isEqualTo(0b0111);
            assertThat(runSigned(compound("^"), "a", 0b1000, "b", 0b1110)).isEqualTo(0b0110);
        }

        @Test
        @DisplayName("按位取反与取负")
        void testNotAndNeg() {
            String not = source(
                    "long long my_package(unsigned long long a) {",
                    "  return (long long)(~a);",
                    "}");
            assertThat(runSigned(not, "a", 0b000)).isEqualTo(~0b000L);
            assertThat(runSigned(not, "a", 0b111)).isEqualTo(~0b111L);
            assertThat(runSigned(not, "a", 0b101)).isEqualTo(~0b101L);

            String neg = source(
                    "long long my_package(long long a) {",
                    "  return (long long)(-a);",
                    "}");
            assertThat(runSigned(neg, "a", 11)).isEqualTo(-11);
            assertThat(runSigned(neg, "a", 0)).isEqualTo(0);
            assertThat(runSigned(neg, "a", -1000)).isEqualTo(1000);
        }

        @Test
        @DisplayName("移位：有符号右移为算术移位，无符号为逻辑移位")
        void testShifts() {
            assertThat(runSigned(binary(">>"), "a", 10, "b", 1)).isEqualTo(5);
            assertThat(runSigned(compound(">>"), "a", -20, "b", 2)).isEqualTo(-5);
            assertThat(runSigned(binary("<<"), "a", 16, "b", 1)).isEqualTo(32);
            assertThat(runSigned(compound("<<"), "a", 13, "b", 2)).isEqualTo(52);

            String unsignedShr = source(
                    "unsigned long long my_package(unsigned long long a, unsigned long long b) {",
                    "  return a >> b;",
                    "}");
            assertThat(run(unsignedShr, "a", 10, "b", 1).toUnsignedLong()).isEqualTo(5);
            assertThat(run(unsignedShr, "a", -20, "b", 2).toUnsignedLong()).isEqualTo(4611686018427387899L);
        }

        @Test
        @DisplayName("前置与后置自增自减")
        void testIncDec() {
            assertThat(runSigned(source("int my_package(int a) {", "  return ++a;", "}"), "a", 10)).isEqualTo(11);
            assertThat(runSigned(source("int my_package(int a) {", "  ++a;", "  return a;", "}"), "a", 50))
                    .isEqualTo(51);
            assertThat(runSigned(source("int my_package(int a) {", "  return a++;", "}"), "a", 10)).isEqualTo(10);
            assertThat(runSigned(source("int my_package(int a) {", "  a++;", "  return a;", "}"), "a", 50))
                    .isEqualTo(51);
            assertThat(runSigned(source("int my_package(int a) {", "  return --a;", "}"), "a", 10)).isEqualTo(9);
            assertThat(runSigned(source("int my_package(int a) {", "  --a;", "  return a;", "}"), "a", 50))
                    .isEqualTo(49);
            assertThat(runSigned(source("int my_package(int a) {", "  return a--;", "}"), "a", 10)).isEqualTo(10);
            assertThat(runSigned(source("int my_package(int a) {", "  a--;", "  return a;", "}"), "a", 50))
                    .isEqualTo(49);
        }

        @Test
        @DisplayName("相等比较")
        void testEquality() {
            assertThat(runSigned(compare("=="), "a", 3, "b", 3)).isEqualTo(1);
            assertThat(runSigned(compare("=="), "a", 11, "b", 10)).isEqualTo(0);
            assertThat(runSigned(compare("!="), "a", 3, "b", 3)).isEqualTo(0);
            assertThat(runSigned(compare("!="), "a", 11, "b", 10)).isEqualTo(1);
        }

        @Test
        @DisplayName("有符号与无符号的大小比较")
        void testRelational() {
            long[][] inputs = {{-2, 3}, {2, 3}, {3, 3}, {11, 10}};
            assertRelational(compare(">"), inputs, 0, 0, 0, 1);
            assertRelational(compareUnsigned(">"), inputs, 1, 0, 0, 1);
            assertRelational(compare(">="), inputs, 0, 0, 1, 1);
            assertRelational(compareUnsigned(">="), inputs, 1, 0, 1, 1);
            assertRelational(compare("<"), inputs, 1, 1, 0, 0);
            assertRelational(compareUnsigned("<"), inputs, 0, 1, 0, 0);
            assertRelational(compare("<="), inputs, 1, 1, 1, 0);
            assertRelational(compareUnsigned("<="), inputs, 0, 1, 1, 0);
        }

        private void assertRelational(String src, long[][] inputs, long... expected) {
            for (int i = 0; i < inputs.length; i++) {
                assertThat(runSigned(src, "a", inputs[i][0], "b", inputs[i][1]))
                        .as("a=%d b=%d", inputs[i][0], inputs[i][1])
                        .isEqualTo(expected[i]);
            }
        }

        @Test
        @DisplayName("逻辑与或非")
        void testLogical() {
            assertThat(runSigned(compare("&&"), "a", 0b111, "b", 0b111)).isEqualTo(1);
            assertThat(runSigned(compare("&&"), "a", 0b001, "b", 0b100)).isEqualTo(1);
            assertThat(runSigned(compare("&&"), "a", 0b111, "b", 0)).isEqualTo(0);
            assertThat(runSigned(compare("&&"), "a", 0, "b", 0)).isEqualTo(0);
            assertThat(runSigned(compare("||"), "a", 0b001, "b", 0b100)).isEqualTo(1);
            assertThat(runSigned(compare("||"), "a", 0b111, "b", 0)).isEqualTo(1);
            assertThat(runSigned(compare("||"), "a", 0, "b", 0)).isEqualTo(0);

            String lnot = source(
                    "long long my_package(unsigned long long a) {",
                    "  return (long long)(!a);",
                    "}");
            assertThat(runSigned(lnot, "a", 0)).isEqualTo(1);
            assertThat(runSigned(lnot, "a", 11)).isEqualTo(0);
            assertThat(runSigned(lnot, "a", -11)).isEqualTo(0);
        }

        @Test
        @DisplayName("常用算术转换：混合符号比较与窄类型回绕")
        void testUsualArithmeticConversions() {
            String mixed = source(
                    "int my_package(unsigned int a, int b) {",
                    "  return a < b;",
                    "}");
            assertThat(runSigned(mixed, "a", 1, "b", -1)).isEqualTo(1);

            String narrow = source(
                    "unsigned char my_package(unsigned char a) {",
                    "  return a + 10;",
                    "}");
            assertThat(run(narrow, "a", 250).toUnsignedLong()).isEqualTo(4);
        }
    }

    @Nested
    @DisplayName("控制流")
    class ControlFlowTests {

        @Test
        @DisplayName("条件成立时才赋值")
        void testIfAssign() {
            String src = source(
                    "int my_package(int a, int b) {",
                    "  if(a>10){b=5*a;}",
                    "  return b;",
                    "}");
            assertThat(runSigned(src, "a", 20, "b", 7)).isEqualTo(100);
            assertThat(runSigned(src, "a", 5, "b", 7)).isEqualTo(7);
        }

        @Test
        @DisplayName("if / else if / else")
        void testIfElseChain() {
            String src = source(
                    "long long my_package(long long a) {",
                    "  if(a<-100) a = 1;",
                    "  else if(a<-10) a += 3;",
                    "  else { a *= 2; }",
                    "  return a;",
                    "}");
            assertThat(runSigned(src, "a", 60)).isEqualTo(120);
            assertThat(runSigned(src, "a", -50)).isEqualTo(-47);
            assertThat(runSigned(src, "a", -150)).isEqualTo(1);
        }

        @Test
        @DisplayName("嵌套条件中的后续赋值覆盖前面的赋值")
        void testIfAssignOverrideCondition() {
            String src = source(
                    "long long my_package(long long a, long long b) {",
                    "  if(a>1000) {",
                    "    if(b)",
                    "      a=55;",
                    "    a=1234;",
                    "  }",
                    "  return a;",
                    "}");
            assertThat(runSigned(src, "a", 60, "b", 0)).isEqualTo(60);
            assertThat(runSigned(src, "a", 1001, "b", 0)).isEqualTo(1234);
            assertThat(runSigned(src, "a", 1001, "b", 1)).isEqualTo(1234);
        }

        @Test
        @DisplayName("switch 与 default")
        void testSwitch() {
            String src = source(
                    "long long my_package(long long a) {",
                    "  long long ret;",
                    "  switch(a) {",
                    "    case 1:",
                    "      ret = 100;",
                    "      break;",
                    "    case 2:",
                    "      ret = 200;",
                    "      break;",
                    "    default:",
                    "      ret = 300;",
                    "      break;",
                    "  }",
                    "  return ret;",
                    "}");
            assertThat(runSigned(src, "a", 1)).isEqualTo(100);
            assertThat(runSigned(src, "a", 2)).isEqualTo(200);
            assertThat(runSigned(src, "a", 3)).isEqualTo(300);
        }

        @Test
        @DisplayName("default 写在最前面且 case 带花括号")
        void testSwitchDefaultTop() {
            String src = source(
                    "long long my_package(long long a) {",
                    "  long long ret;",
                    "  switch(a) {",
                    "    default:",
                    "      ret = 300;",
                    "      break;",
                    "    case 1: {",
                    "      ret = 100;",
                    "      break;",
                    "    } case 2:",
                    "      ret = 200;",
                    "      break;",
                    "  }",
                    "  return ret;",
                    "}");
            assertThat(runSigned(src, "a", 1)).isEqualTo(100);
            assertThat(runSigned(src, "a", 2)).isEqualTo(200);
            assertThat(runSigned(src, "a", 3)).isEqualTo(300);
        }

        @Test
        @DisplayName("switch 贯穿累积后续 case 的效果")
        void testSwitchFallthrough() {
            String src = source(
                    "long long my_package(long long a) {",
                    "  long long ret=0;",
                    "  switch(a) {",
                    "    case 1:",
                    "      ret += 300;",
                    "      ret += 2;",
                    "    case 2:",
                    "      ret += 5;",
                    "      ret += 100;",
                    "      break;",
                    "  }",
                    "  return ret;",
                    "}");
            assertThat(runSigned(src, "a", 1)).isEqualTo(407);
            assertThat(runSigned(src, "a", 2)).isEqualTo(105);
            assertThat(runSigned(src, "a", 3)).isEqualTo(0);
        }

        @Test
        @DisplayName("break 之后的语句不执行")
        void testSwitchDoubleBreak() {
            String src = source(
                    "long long my_package(long long a) {",
                    "  long long ret=0;",
                    "  switch(a) {",
                    "    case 1:",
                    "      ret += 300;",
                    "      ret += 2;",
                    "      break;",
                    "      break;",
                    "    case 2: {",
                    "      ret += 5;",
                    "      ret += 100;",
                    "      break;",
                    "      break;",
                    "    }",
                    "  }",
                    "  return ret;",
                    "}");
            assertThat(runSigned(src, "a", 1)).isEqualTo(302);
            assertThat(runSigned(src, "a", 2)).isEqualTo(105);
            assertThat(runSigned(src, "a", 3)).isEqualTo(0);
        }

        @Test
        @DisplayName("switch 中 return")
        void testSwitchReturn() {
            String src = source(
                    "long long my_package(long long a) {",
                    "  switch(a) {",
                    "    case 1:",
                    "      return 100;",
                    "    case 2:",
                    "      a+=10;",
                    "      break;",
                    "  }",
                    "  return a;",
                    "}");
            assertThat(runSigned(src, "a", 1)).isEqualTo(100);
            assertThat(runSigned(src, "a", 2)).isEqualTo(12);
            assertThat(runSigned(src, "a", 3)).isEqualTo(3);
        }

        @Test
        @DisplayName("default 与 case 共用一段")
        void testSwitchDefaultPlusCase() {
            String src = source(
                    "long long my_package(long long a) {",
                    "  switch(a) {",
                    "    default:",
                    "    case 1:",
                    "      return 100;",
                    "    case 2:",
                    "      a+=10;",
                    "      break;",
                    "  }",
                    "  return a;",
                    "}");
            assertThat(runSigned(src, "a", 1)).isEqualTo(100);
            assertThat(runSigned(src, "a", 2)).isEqualTo(12);
            assertThat(runSigned(src, "a", 3)).isEqualTo(100);
        }

        @Test
        @DisplayName("展开循环中的 switch")
        void testSwitchInFor() {
            String src = source(
                    "long long my_package(long long a) {",
                    "  #pragma hls_unroll yes",
                    "  for(int i=0;i<2;++i) {",
                    "    switch(i) {",
                    "      case 0:",
                    "        a += 300;",
                    "        break;",
                    "      case 1:",
                    "        a += 100;",
                    "        break;",
                    "    }",
                    "  }",
                    "  return a;",
                    "}");
            assertThat(runSigned(src, "a", 1)).isEqualTo(401);
        }

        @Test
        @DisplayName("switch 中的展开循环")
        void testForInSwitch() {
            String src = source(
                    "long long my_package(long long a) {",
                    "  switch(a) {",
                    "    case 0:",
                    "      #pragma hls_unroll yes",
                    "      for(int i=0;i<3;++i) {",
                    "        a+=10;",
                    "      }",
                    "      break;",
                    "    case 1:",
                    "      a += 100;",
                    "      break;",
                    "  }",
                    "  return a;",
                    "}");
            assertThat(runSigned(src, "a", 0)).isEqualTo(30);
            assertThat(runSigned(src, "a", 1)).isEqualTo(101);
            assertThat(runSigned(src, "a", 3)).isEqualTo(3);
        }

        @Test
        @DisplayName("数据相关 if 中的展开循环")
        void testForInDataDependentIf() {
            String src = source(
                    "int my_package(int a) {",
                    "  if(a > 0) {",
                    "    #pragma hls_unroll yes",
                    "    for(int i=0;i<3;++i) {",
                    "      a += 1;",
                    "    }",
                    "  }",
                    "  return a;",
                    "}");
            assertThat(runSigned(src, "a", 5)).isEqualTo(8);
            assertThat(runSigned(src, "a", -5)).isEqualTo(-5);
        }

        @Test
        @DisplayName("循环外声明的归纳变量只随执行的迭代推进")
        void testOuterInductionVariable() {
            String src = source(
                    "int my_package(int a) {",
                    "  int i = 100;",
                    "  if(a > 0) {",
                    "    #pragma hls_unroll yes",
                    "    for(i=0;i<10;++i) {",
                    "      if(i == a) break;",
                    "    }",
                    "  }",
                    "  return i;",
                    "}");
            assertThat(runSigned(src, "a", 4)).isEqualTo(4);
            assertThat(runSigned(src, "a", 20)).isEqualTo(10);
            assertThat(runSigned(src, "a", -1)).isEqualTo(100);
        }

        @Test
        @DisplayName("展开循环求和")
        void testForUnroll() {
            String src = source(
                    "long long my_package(long long a, long long b) {",
                    "  #pragma hls_unroll yes",
                    "  for(int i=1;i<=10;++i) {",
                    "    a += b;",
                    "    a += 2*b;",
                    "  }",
                    "  return a;",
                    "}");
            assertThat(runSigned(src, "a", 11, "b", 20)).isEqualTo(611);
        }

        @Test
        @DisplayName("嵌套展开循环，每次迭代有独立作用域")
        void testForNestedUnroll() {
            String src = source(
                    "long long my_package(long long a, long long b) {",
                    "  #pragma hls_unroll yes",
                    "  for(int i=1;i<=10;++i) {",
                    "    #pragma hls_unroll yes",
                    "    for(int j=0;j<4;++j) {",
                    "      int l = b;",
                    "      a += l;",
                    "    }",
                    "  }",
                    "  return a;",
                    "}");
            assertThat(runSigned(src, "a", 200, "b", 20)).isEqualTo(1000);
        }

        @Test
        @DisplayName("循环中的 break")
        void testForUnrollBreak() {
            assertThat(runSigned(source(
                    "long long my_package(long long a, long long b) {",
                    "  #pragma hls_unroll yes",
                    "  for(int i=0;i<50;++i) {",
                    "    a += b;",
                    "    if(a > 100) break;",
                    "  }",
                    "  return a;",
                    "}"), "a", 11, "b", 20)).isEqualTo(111);
            assertThat(runSigned(source(
                    "long long my_package(long long a, long long b) {",
                    "  #pragma hls_unroll yes",
                    "  for(int i=0;i<50;++i) {",
                    "    if(i==3) break;",
                    "    a += b;",
                    "  }",
                    "  return a;",
                    "}"), "a", 11, "b", 20)).isEqualTo(71);
            assertThat(runSigned(source(
                    "long long my_package(long long a, long long b) {",
                    "  #pragma hls_unroll yes",
                    "  for(int i=0;i<50;++i) {",
                    "    a += b;",
                    "    break;",
                    "  }",
                    "  return a;",
                    "}"), "a", 11, "b", 20)).isEqualTo(31);
        }

        @Test
        @DisplayName("循环中的 continue")
        void testForUnrollContinue() {
            assertThat(runSigned(source(
                    "long long my_package(long long a, long long b) {",
                    "  #pragma hls_unroll yes",
                    "  for(int i=0;i<11;++i) {",
                    "    continue;",
                    "    a += b;",
                    "  }",
                    "  return a;",
                    "}"), "a", 11, "b", 20)).isEqualTo(11);
            assertThat(runSigned(source(
                    "long long my_package(long long a, long long b) {",
                    "  #pragma hls_unroll yes",
                    "  for(int i=0;i<11;++i) {",
                    "    if(a>155) {",
                    "      continue;",
                    "    }",
                    "    a += b;",
                    "  }",
                    "  return a;",
                    "}"), "a", 11, "b", 20)).isEqualTo(171);
            assertThat(runSigned(source(
                    "long long my_package(long long a, long long b) {",
                    "  #pragma hls_unroll yes",
                    "  for(int i=0;i<11;++i) {",
                    "    {",
                    "      continue;",
                    "    }",
                    "    a += b;",
                    "  }",
                    "  return a;",
                    "}"), "a", 11, "b", 20)).isEqualTo(11);
        }

        @Test
        @DisplayName("循环中的条件 return")
        void testReturnFromFor() {
            String src = source(
                    "long long my_package(long long a, long long b) {",
                    "  #pragma hls_unroll yes",
                    "  for(int i=0;i<10;++i) {",
                    "    a += b;",
                    "    if(a>500) return a;",
                    "  }",
                    "  return 0;",
                    "}");
            assertThat(runSigned(src, "a", 140, "b", 55)).isEqualTo(525);
            assertThat(runSigned(src, "a", 0, "b", 1)).isEqualTo(0);
        }

        @Test
        @DisplayName("嵌套条件 return")
        void testConditionalReturn() {
            String src = source(
                    "long long my_package(long long a, long long b) {",
                    "  if(b) {",
                    "    if(a<200) return 2200;",
                    "    if(a<500) return 5500;",
                    "  }",
                    "  return a;",
                    "}");
            assertThat(runSigned(src, "a", 505, "b", 1)).isEqualTo(505);
            assertThat(runSigned(src, "a", 455, "b", 1)).isEqualTo(5500);
            assertThat(runSigned(src, "a", 101, "b", 1)).isEqualTo(2200);
            assertThat(runSigned(src, "a", 455, "b", 0)).isEqualTo(455);
        }

        @Test
        @DisplayName("第一个 return 生效")
        void testTripleReturn() {
            String src = source(
                    "long long my_package(long long a, long long b) {",
                    "  return 66;",
                    "  return 66;",
                    "  return a;",
                    "}");
            assertThat(runSigned(src, "a", 11, "b", 3)).isEqualTo(66);
        }

        @Test
        @DisplayName("void 顶层函数的引用参数是输出")
        void testVoidReturnReferenceOutput() {
            assertThat(runSigned(source(
                    "void my_package(int &a) {",
                    "  a = 22;",
                    "}"), "a", 1000)).isEqualTo(22);
            String early = source(
                    "void my_package(int &a) {",
                    "  if(a == 5) {",
                    "    return;",
                    "  }",
                    "  a = 22;",
                    "}");
            assertThat(runSigned(early, "a", 5)).isEqualTo(5);
            assertThat(runSigned(early, "a", 10)).isEqualTo(22);
        }
    }

    @Nested
    @DisplayName("结构体与运算符")
    class StructTests {

        @Test
        @DisplayName("嵌套成员访问")
        void testCompoundStructAccess() {
            String src = source(
                    "struct TestX {",
                    "  int x;",
                    "};",
                    "struct TestY {",
                    "  TestX tx;",
                    "};",
                    "int my_package(int a) {",
                    "  TestY y;",
                    "  y.tx.x = a;",
                    "  return y.tx.x;",
                    "}");
            assertThat(runSigned(src, "a", 56)).isEqualTo(56);
        }

        @Test
        @DisplayName("结构体数组与结构体中的数组")
        void testArraysAndStructs() {
            assertThat(runSigned(source(
                    "struct TestX { int x; };",
                    "struct TestY { TestX tx; };",
                    "int my_package(int a) {",
                    "  TestY y[3];",
                    "  y[2].tx.x = a;",
                    "  return y[2].tx.x;",
                    "}"), "a", 56)).isEqualTo(56);
            assertThat(runSigned(source(
                    "struct TestX { int x[3]; };",
                    "struct TestY { TestX tx; };",
                    "int my_package(int a) {",
                    "  TestY y;",
                    "  y.tx.x[2] = a;",
                    "  return y.tx.x[2];",
                    "}"), "a", 56)).isEqualTo(56);
        }

        @Test
        @DisplayName("模板结构体")
        void testTemplateStruct() {
            String src = source(
                    "template<typename T>",
                    "struct TestX {",
                    "  T x;",
                    "};",
                    "int my_package(int a) {",
                    "  TestX<int> x;",
                    "  x.x = a;",
                    "  return x.x;",
                    "}");
            assertThat(runSigned(src, "a", 56)).isEqualTo(56);
        }

        @Test
        @DisplayName("no-wrap 结构体展开为裸值")
        void testNoTupleStruct() {
            String src = source(
                    "#pragma hls_no_tuple",
                    "struct Test {",
                    "  int x;",
                    "};",
                    "Test my_package(int a) {",
                    "  Test s;",
                    "  s.x=a;",
                    "  return s;",
                    "}");
            IrValue result = run(src, "a", 311);
            assertThat(result.isBits()).isTrue();
            assertThat(result.toSignedLong()).isEqualTo(311);
        }

        @Test
        @DisplayName("注释中的 pragma 被忽略")
        void testNoTuplePragmaInComment() {
            assertThat(runSigned(source(
                    "//#pragma hls_no_tuple",
                    "struct Test {",
                    "  int x;",
                    "  int y;",
                    "};",
                    "int my_package(int a) {",
                    "  Test s;",
                    "  s.x=a;",
                    "  return s.x;",
                    "}"), "a", 311)).isEqualTo(311);
            assertThat(runSigned(source(
                    "/*",
                    "#pragma hls_no_tuple*/",
                    "struct Test {",
                    "  int x;",
                    "  int y;",
                    "};",
                    "int my_package(int a) {",
                    "  Test s;",
                    "  s.x=a;",
                    "  return s.x;",
                    "}"), "a", 311)).isEqualTo(311);
        }

        @Test
        @DisplayName("默认初始化为零")
        void testDefaultValues() {
            String src = source(
                    "struct Test {",
                    "  int x;",
                    "  int y;",
                    "};",
                    "int my_package(int a) {",
                    "  Test s;",
                    "  return s.x+s.y+a;",
                    "}");
            assertThat(runSigned(src, "a", 3)).isEqualTo(3);
        }

        @Test
        @DisplayName("构造函数：成员初始化列表与函数体")
        void testConstructors() {
            assertThat(runSigned(source(
                    "struct Test {",
                    "  Test() : x(5) {",
                    "    y = 10;",
                    "  }",
                    "  int x;",
                    "  int y;",
                    "};",
                    "int my_package(int a) {",
                    "  Test s;",
                    "  return s.x+s.y;",
                    "}"), "a", 3)).isEqualTo(15);
            assertThat(runSigned(source(
                    "struct Test {",
                    "  Test(int v) : x(v) {",
                    "    this->y = 10;",
                    "  }",
                    "  int x;",
                    "  int y;",
                    "};",
                    "int my_package(int a) {",
                    "  Test s(a);",
                    "  return s.x+s.y;",
                    "}"), "a", 3)).isEqualTo(13);
        }

        @Test
        @DisplayName("显式值初始化")
        void testExplicitDefaultConstructor() {
            String src = source(
                    "struct TestR {",
                    "  int bb;",
                    "};",
                    "#pragma hls_top",
                    "int my_package(int a) {",
                    "  TestR b = TestR();",
                    "  return b.bb + a;",
                    "}");
            assertThat(runSigned(src, "a", 3)).isEqualTo(3);
        }

        @Test
        @DisplayName("转换运算符")
        void testImplicitConversion() {
            String src = source(
                    "struct Test {",
                    "  Test(int v) : x(v) {",
                    "    this->y = 10;",
                    "  }",
                    "  operator int()const {",
                    "    return x+y;",
                    "  }",
                    "  int x;",
                    "  int y;",
                    "};",
                    "int my_package(int a) {",
                    "  Test s(a);",
                    "  return s;",
                    "}");
            assertThat(runSigned(src, "a", 3)).isEqualTo(13);
        }

        @Test
        @DisplayName("成员运算符重载")
        void testOperatorOverload() {
            String src = source(
                    "struct Test {",
                    "  Test(int v) : x(v) {",
                    "    this->y = 10;",
                    "  }",
                    "  Test operator+=(Test const&o) {",
                    "    x *= o.y;",
                    "    return *this;",
                    "  }",
                    "  Test operator+(Test const&o) {",
                    "    return x-o.x;",
                    "  }",
                    "  int x;",
                    "  int y;",
                    "};",
                    "int my_package(int a) {",
                    "  Test s1(a);",
                    "  Test s2(a);",
                    "  s1 += s2;",
                    "  return (s1 + s2).x;",
                    "}");
            assertThat(runSigned(src, "a", 3)).isEqualTo(27);
        }

        @Test
        @DisplayName("左操作数为内置类型的自由运算符")
        void testOperatorOnBuiltin() {
            String src = source(
                    "struct Test {",
                    "  Test(int v) : x(v) {",
                    "  }",
                    "  int x;",
                    "};",
                    "Test operator+(int a, Test b) {",
                    "  return Test(a+b.x);",
                    "}",
                    "int my_package(int a) {",
                    "  Test s1(a);",
                    "  return (10+s1).x;",
                    "}");
            assertThat(runSigned(src, "a", 3)).isEqualTo(13);
        }

        @Test
        @DisplayName("前缀自增重载的结果与副作用")
        void testPrefixIncrementOverload() {
            String body = source(
                    "struct Test {",
                    "  Test(int v) : x(v) {",
                    "    this->y = 10;",
                    "  }",
                    "  Test(const Test &o) : x(o.x) {",
                    "    this->y = 10;",
                    "  }",
                    "  Test operator ++() {",
                    "    x = x + 1;",
                    "    return (*this);",
                    "  }",
                    "  operator int () const {",
                    "    return x;",
                    "  }",
                    "  int x;",
                    "  int y;",
                    "};",
                    "int my_package(int a) {",
                    "  Test s1(a);",
                    "  Test s2(0);",
                    "  s2 = ++s1;");
            assertThat(runSigned(body + "\n  return s2;\n}", "a", 3)).isEqualTo(4);
            assertThat(runSigned(body + "\n  return s1;\n}", "a", 3)).isEqualTo(4);
        }

        @Test
        @DisplayName("类类型的循环变量")
        void testForUnrollClass() {
            String src = source(
                    "struct TestInt {",
                    "  TestInt(int v) : x(v) { }",
                    "  operator int()const {",
                    "    return x;",
                    "  }",
                    "  TestInt operator ++() {",
                    "    ++x;",
                    "    return *this;",
                    "  }",
                    "  bool operator <=(int v) {",
                    "    return x <= v;",
                    "  }",
                    "  int x;",
                    "};",
                    "long long my_package(long long a, long long b) {",
                    "  #pragma hls_unroll yes",
                    "  for(TestInt i=1;i<=10;++i) {",
                    "    a += b;",
                    "    a += 2*b;",
                    "  }",
                    "  return a;",
                    "}");
            assertThat(runSigned(src, "a", 11, "b", 20)).isEqualTo(611);
        }

        @Test
        @DisplayName("类类型的二维数组与复合赋值重载")
        void testArray2DClass() {
            String src = source(
                    "struct ts {",
                    "  ts(int v) : x(v) { };",
                    "  operator int () const { return x; }",
                    "  ts operator += (int v) { x += v; return (*this); }",
                    "  int x;",
                    "};",
                    "int my_package(int a, int b) {",
                    "  ts x[2][2] = {{b,b}, {b,b}};",
                    "  x[1][0] += a;",
                    "  return x[1][0];",
                    "}");
            assertThat(runSigned(src, "a", 55, "b", 100)).isEqualTo(155);
        }

        @Test
        @DisplayName("typedef 匿名结构体")
        void testTypedefStruct() {
            String src = source(
                    "typedef struct {",
                    "  int x;",
                    "  int y;",
                    "}Test;",
                    "int my_package(int a) {",
                    "  Test s;",
                    "  s.x = a;",
                    "  s.y = a*10;",
                    "  return s.x+s.y;",
                    "}");
            assertThat(runSigned(src, "a", 3)).isEqualTo(33);
        }

        @Test
        @DisplayName("转换为 void 被丢弃")
        void testConvertToVoid() {
            String src = source(
                    "struct ts {int x;};",
                    "long long my_package(long long a) {",
                    "  ts t;",
                    "  (void)t;",
                    "  return a;",
                    "}");
            assertThat(runSigned(src, "a", 10)).isEqualTo(10);
        }

        @Test
        @DisplayName("同一语句中对同一成员自增并赋值")
        void testCompoundAvoidUnsequenced() {
            assertThat(runSigned(source(
                    "struct Test {",
                    "  int x;",
                    "};",
                    "int my_package(int a) {",
                    "  Test s1;",
                    "  s1.x = a;",
                    "  s1.x = ++s1.x;",
                    "  return s1.x;",
                    "}"), "a", 3)).isEqualTo(4);
            assertThat(runSigned(source(
                    "int my_package(int a) {",
                    "  int s1[2] = {a, a};",
                    "  s1[0] = ++s1[1];",
                    "  return s1[0];",
                    "}"), "a", 3)).isEqualTo(4);
        }

        @Test
        @DisplayName("继承：基类字段与方法")
        void testInheritance() {
            assertThat(runSigned(source(
                    "struct Base {",
                    "  int x;",
                    "};",
                    "struct Derived : public Base {",
                    "  int foo()const {",
                    "    return x;",
                    "  }",
                    "};",
                    "int my_package(int x) {",
                    "  Derived b;",
                    "  b.x = x;",
                    "  return b.foo();",
                    "}"), "x", 47)).isEqualTo(47);
            assertThat(runSigned(source(
                    "struct Base {",
                    "  int x;",
                    "  void set(int v) { x=v; }",
                    "  int get()const { return x; }",
                    "};",
                    "struct Derived : public Base {",
                    "  void setd(int v) { x=v; }",
                    "  int getd()const { return x; }",
                    "};",
                    "int my_package(int x) {",
                    "  Derived d;",
                    "  d.setd(x);",
                    "  d.setd(d.getd()*3);",
                    "  d.set(d.get()*5);",
                    "  return d.x;",
                    "}"), "x", 10)).isEqualTo(150);
        }

        @Test
        @DisplayName("派生类默认构造调用基类构造")
        void testBaseConstructor() {
            String src = source(
                    "#pragma hls_no_tuple",
                    "struct Base {",
                    "  Base() : x(88) { }",
                    "  int x;",
                    "};",
                    "#pragma hls_no_tuple",
                    "struct Derived : public Base {",
                    "};",
                    "int my_package(int x) {",
                    "  Derived b;",
                    "  return x + b.x;",
                    "}");
            assertThat(runSigned(src, "x", 15)).isEqualTo(103);
        }

        @Test
        @DisplayName("方法中给 *this 赋值")
        void testSetThis() {
            String src = source(
                    "struct Test {",
                    "  void set_this(int v) {",
                    "    Test t;",
                    "    t.x = v;",
                    "    *this = t;",
                    "  }",
                    "  int x;",
                    "  int y;",
                    "};",
                    "int my_package(int a) {",
                    "  Test s;",
                    "  s.set_this(a);",
                    "  s.y = 12;",
                    "  return s.x+s.y;",
                    "}");
            assertThat(runSigned(src, "a", 3)).isEqualTo(15);
        }

        @Test
        @DisplayName("提前 return 的方法不修改对象")
        void testConditionallyAssignThis() {
            String src = source(
                    "struct ts {",
                    "  void blah() {",
                    "    return;",
                    "    v = v | 1;",
                    "  }",
                    "  int v;",
                    "};",
                    "#pragma hls_top",
                    "int my_package(int a) {",
                    "  ts t;",
                    "  t.v = a;",
                    "  t.blah();",
                    "  return t.v;",
                    "}");
            assertThat(runSigned(src, "a", 6)).isEqualTo(6);
        }

        @Test
        @DisplayName("结构体引用参数的更新跨调用保留")
        void testStructMemberReferenceParameter() {
            String src = source(
                    "struct Test {",
                    "  int p;",
                    "};",
                    "int do_something(Test &x, int a) {",
                    "  x.p += a;",
                    "  return x.p;",
                    "}",
                    "int my_package(int a) {",
                    "  Test ta;",
                    "  ta.p = a;",
                    "  do_something(ta, 5);",
                    "  return do_something(ta, 10);",
                    "}");
            assertThat(runSigned(src, "a", 3)).isEqualTo(18);
        }

        @Test
        @DisplayName("有状态对象作为引用参数：首字母大写")
        void testCapitalizeFirstLetter() {
            String src = source(
                    "class State {",
                    " public:",
                    "  State()",
                    "   : last_was_space_(true) {",
                    "  }",
                    "  unsigned char process(unsigned char c) {",
                    "    unsigned char ret = c;",
                    "    if(last_was_space_ && (c >= 'a') && (c <= 'z'))",
                    "      ret -= ('a' - 'A');",
                    "    last_was_space_ = (c == ' ');",
                    "    return ret;",
                    "  }",
                    " private:",
                    "  bool last_was_space_;",
                    "};",
                    "unsigned char my_package(State &st, unsigned char c) {",
                    "  return st.process(c);",
                    "}");
            IrFunction function = generate(src).getFunction();
            IrInterpreter interpreter = new IrInterpreter();
            IrValue state = IrValue.tuple(IrValue.ofBits(1, 1));
            StringBuilder output = new StringBuilder();
            for (char c : "hello world".toCharArray()) {
                Map<String, IrValue> args = new HashMap<>();
                args.put("st", state);
                args.put("c", IrValue.ofBits(8, c));
                IrValue result = interpreter.runKwargs(function, args);
                assertThat(result.getElements()).hasSize(2);
                output.append((char) result.getElement(0).toUnsignedLong());
                state = result.getElement(1);
            }
            assertThat(output.toString()).isEqualTo("Hello World");
        }
    }

    @Nested
    @DisplayName("函数调用")
    class CallTests {

        @Test
        @DisplayName("被调函数生成独立的 IR 函数并以 INVOKE 调用")
        void testFunctionInvoke() {
            String src = source(
                    "int do_something(int a) {",
                    "  return a;",
                    "}",
                    "int my_package(int a) {",
                    "  return do_something(a);",
                    "}");
            IrPackage pkg = new IrPackage(TOP);
            GeneratedFunction generated = scan(src).generateTopFunction(pkg);

            assertThat(pkg.getFunctions()).hasSize(2);
            assertThat(generated.getFunction().getNodesWithOp(IrOp.INVOKE)).hasSize(1);
            assertThat(pkg.getTopName()).isEqualTo(generated.getFunction().getName());
            assertThat(runSigned(src, "a", 3)).isEqualTo(3);
        }

        @Test
        @DisplayName("默认实参")
        void testDefaultArg() {
            String src = source(
                    "int do_something(int a, int b=2) {",
                    "  return a+b;",
                    "}",
                    "int my_package(int a) {",
                    "  return do_something(a);",
                    "}");
            assertThat(runSigned(src, "a", 3)).isEqualTo(5);
        }

        @Test
        @DisplayName("非类型模板参数")
        void testTemplateFunction() {
            assertThat(runSigned(source(
                    "template<int N>",
                    "int do_something(int a) {",
                    "  return a+N;",
                    "}",
                    "int my_package(int a) {",
                    "  return do_something<5>(a);",
                    "}"), "a", 3)).isEqualTo(8);
            String boolTemplate = source(
                    "template<bool C>",
                    "int do_something(int a) {",
                    "  return C?a:15;",
                    "}",
                    "int my_package(int a) {",
                    "  return do_something<%s>(a);",
                    "}");
            assertThat(runSigned(String.format(boolTemplate, "true"), "a", 3)).isEqualTo(3);
            assertThat(runSigned(String.format(boolTemplate, "false"), "a", 3)).isEqualTo(15);
        }

        @Test
        @DisplayName("推导类型模板参数")
        void testSubstTemplateType() {
            String src = source(
                    "struct TestR {",
                    "  int f()const {",
                    "    return 10;",
                    "  }",
                    "};",
                    "struct TestW {",
                    "  int f()const {",
                    "    return 11;",
                    "  }",
                    "};",
                    "template<typename T>",
                    "int do_something(T a) {",
                    "  return a.f();",
                    "}",
                    "int my_package(int a) {",
                    "  %s t;",
                    "  return do_something(t);",
                    "}");
            assertThat(runSigned(String.format(src, "TestR"), "a", 3)).isEqualTo(10);
            assertThat(runSigned(String.format(src, "TestW"), "a", 3)).isEqualTo(11);
        }

        @Test
        @DisplayName("引用参数写回调用者")
        void testReferenceParameter() {
            String src = source(
                    "int do_something(int &x, int a) {",
                    "  x += a;",
                    "  return x;",
                    "}",
                    "int my_package(int a) {",
                    "  do_something(a, 5);",
                    "  return do_something(a, 10);",
                    "}");
            assertThat(runSigned(src, "a", 3)).isEqualTo(18);
        }

        @Test
        @DisplayName("数组参数按引用传递")
        void testArrayRefParam() {
            String src = source(
                    "void asd(int b[2]) {",
                    "  b[0] += 5;",
                    "}",
                    "int my_package(int a) {",
                    "  int arr[2] = {a, 3*a};",
                    "  asd(arr);",
                    "  return arr[0] + arr[1];",
                    "}");
            assertThat(runSigned(src, "a", 11)).isEqualTo(11 + 5 + 33);
        }

        @Test
        @DisplayName("被调函数 return 之后的写入无效")
        void testAssignAfterReturnInCallee() {
            String src = source(
                    "void ff(int x[8]) {",
                    "  x[4] = x[2];",
                    "  return;",
                    "  x[3] = x[4];",
                    "}",
                    "#pragma hls_top",
                    "int my_package(int a, int b,int c,int d,int e,int f,int g,int h) {",
                    "  int arr[8] = {a,b,c,d,e,f,g,h};",
                    "  ff(arr);",
                    "  return arr[4]+arr[3]+arr[5];",
                    "}");
            assertThat(runSigned(src, "a", 3, "b", 4, "c", 5, "d", 6, "e", 7, "f", 8, "g", 9, "h", 10))
                    .isEqualTo(19);
        }

        @Test
        @DisplayName("静态方法")
        void testStaticMethod() {
            String src = source(
                    "struct Test {",
                    "  static int foo(int a) {",
                    "    return a+5;",
                    "  }",
                    "};",
                    "int my_package(int a) {",
                    "  return Test::foo(a);",
                    "}");
            assertThat(runSigned(src, "a", 3)).isEqualTo(8);
        }

        @Test
        @DisplayName("命名空间中的函数")
        void testNamespace() {
            String src = source(
                    "namespace test {",
                    "int do_something(int a) {",
                    "  return a;",
                    "}",
                    "}",
                    "int my_package(int a) {",
                    "  return test::do_something(a);",
                    "}");
            assertThat(runSigned(src, "a", 3)).isEqualTo(3);
        }

        @Test
        @DisplayName("单实参调用中的赋值被允许")
        void testAvoidUnsequencedRefParamUnary() {
            String src = source(
                    "long long nop(long long a) {",
                    "  return a;",
                    "}",
                    "long long my_package(long long a) {",
                    "  return -nop(a=10);",
                    "}");
            assertThat(runSigned(src, "a", 100)).isEqualTo(-10);
        }

        @Test
        @DisplayName("生成后内联去掉全部 INVOKE")
        void testInlineAfterGeneration() {
            String src = source(
                    "int twice(int a) {",
                    "  return a*2;",
                    "}",
                    "int my_package(int a) {",
                    "  return twice(a) + twice(a+1);",
                    "}");
            TranslatorOptions options = options();
            options.setInlineAfterGeneration(true);
            Translator translator = new Translator(options);
            translator.scan(src);
            IrPackage pkg = new IrPackage(TOP);
            IrFunction top = translator.generateTopFunction(pkg).getFunction();

            assertThat(top.getNodesWithOp(IrOp.INVOKE)).isEmpty();
            assertThat(new IrInterpreter().runKwargs(top, arguments(top, "a", 5)).toSignedLong()).isEqualTo(22);
        }
    }

    @Nested
    @DisplayName("错误分类")
    class ErrorTests {

        private void assertFails(String src, ErrorCategory category, String message) {
            TranslationException e = failure(src);
            assertThat(e.getCategory()).isEqualTo(category);
            assertThat(e.getMessage()).contains(message);
        }

        @Test
        @DisplayName("语法错误")
        void testParseFailure() {
            assertThatThrownBy(() -> scan("int my_package(int a) {"))
                    .isInstanceOf(TranslationException.class)
                    .hasMessageContaining("Unable to parse text")
                    .extracting(e -> ((TranslationException) e).getCategory())
                    .isEqualTo(ErrorCategory.PARSE);
        }

        @Test
        @DisplayName("内联 asm 不受支持")
        void testInlineAsmRejected() {
            TranslationException e = failure(source(
                    "long long my_package(long long a) {",
                    "  int asm_out;",
                    "  asm (",
                    "      \"fn (fid)(x: bits[i]) -> bits[r] { \"",
                    "      \"   ret op_(aid): bits[r] = bit_slice(x, start=s, width=r) }\"",
                    "    : \"=r\" (asm_out)",
                    "    : \"i\" (64), \"s\" (1), \"r\" (32), \"param0\" (a));",
                    "  return asm_out;",
                    "}"));
            assertThat(e.getCategory()).isEqualTo(ErrorCategory.PARSE);
        }

        @Test
        @DisplayName("同一表达式中修改并读取")
        void testUnsequencedAssign() {
            assertFails(source(
                    "int my_package(int a) {",
                    "  return (a=7)+a;",
                    "}"), ErrorCategory.SEQUENCING, "unsequenced modification and access to 'a'");
            assertFails(source(
                    "int my_package(int a) {",
                    "  return (a=7)?a:11;",
                    "}"), ErrorCategory.SEQUENCING, "unsequenced");
        }

        @Test
        @DisplayName("通过引用参数修改与读取的顺序无关")
        void testUnsequencedRefParam() {
            String callee = source(
                    "int make7(int &a) {",
                    "  return a=7;",
                    "}");
            assertFails(callee + "\n" + source(
                    "int my_package(int a) {",
                    "  return make7(a)+a;",
                    "}"), ErrorCategory.SEQUENCING, "unsequenced");
            assertFails(callee + "\n" + source(
                    "int my_package(int a) {",
                    "  return a+make7(a);",
                    "}"), ErrorCategory.SEQUENCING, "unsequenced");
        }

        @Test
        @DisplayName("多实参调用中的赋值")
        void testUnsequencedCallArguments() {
            assertFails(source(
                    "long long nop(long long a, long long b) {",
                    "  return a;",
                    "}",
                    "long long my_package(long long a) {",
                    "  return -nop(a=10, 100);",
                    "}"), ErrorCategory.SEQUENCING, "unsequenced assignment in call arguments");
        }

        @Test
        @DisplayName("switch 中的条件 break")
        void testSwitchConditionalBreak() {
            assertFails(source(
                    "long long my_package(long long a) {",
                    "  switch(a) {",
                    "    case 1:",
                    "      if(a > 0) break;",
                    "      a += 10;",
                    "      break;",
                    "  }",
                    "  return a;",
                    "}"), ErrorCategory.CONTROL_FLOW, "conditional breaks are not supported");
        }

        @Test
        @DisplayName("展开循环的结构要求")
        void testLoopShape() {
            assertFails(source(
                    "long long my_package(long long a, long long b) {",
                    "  for(int i=1;i<=10;++i) {",
                    "    a += b;",
                    "  }",
                    "  return a;",
                    "}"), ErrorCategory.CONTROL_FLOW, "Only unrolled for loops are supported");
            assertFails(source(
                    "long long my_package(long long a, long long b) {",
                    "  int i=1;",
                    "  #pragma hls_unroll yes",
                    "  for(;i<=10;++i) {",
                    "    a += b;",
                    "  }",
                    "  return a;",
                    "}"), ErrorCategory.CONTROL_FLOW, "must have an initializer");
            assertFails(source(
                    "long long my_package(long long a, long long b) {",
                    "  #pragma hls_unroll yes",
                    "  for(int i=1;;++i) {",
                    "    a += b;",
                    "  }",
                    "  return a;",
                    "}"), ErrorCategory.CONTROL_FLOW, "must have a condition");
            assertFails(source(
                    "long long my_package(long long a, long long b) {",
                    "  #pragma hls_unroll yes",
                    "  for(int i=1;i<=10;) {",
                    "    a += b;",
                    "  }",
                    "  return a;",
                    "}"), ErrorCategory.CONTROL_FLOW, "must have an increment");
            assertFails(source(
                    "long long my_package(long long a) {",
                    "  while(a) {",
                    "    a = a - 1;",
                    "  }",
                    "  return a;",
                    "}"), ErrorCategory.CONTROL_FLOW, "Only unrolled for loops are supported");
        }

        @Test
        @DisplayName("循环体中给循环变量赋值")
        void testAssignLoopVariable() {
            assertFails(source(
                    "long long my_package(long long a, long long b) {",
                    "  #pragma hls_unroll yes",
                    "  for(int i=1;i<=10;++i) {",
                    "    a += b;",
                    "    i++;",
                    "  }",
                    "  return a;",
                    "}"), ErrorCategory.CONTROL_FLOW, "Assignment to 'i' is forbidden in this context");
        }

        @Test
        @DisplayName("不终止的展开循环")
        void testInfiniteUnroll() {
            assertFails(source(
                    "long long my_package(long long a, long long b) {",
                    "  #pragma hls_unroll yes",
                    "  for(int i=1;i<=10;--i) {",
                    "    a += b;",
                    "  }",
                    "  return a;",
                    "}"), ErrorCategory.CONTROL_FLOW, "maximum iterations exceeded (1000)");
        }

        @Test
        @DisplayName("迭代上限可配置")
        void testConfiguredIterationLimit() {
            String src = source(
                    "long long my_package(long long a) {",
                    "  #pragma hls_unroll yes",
                    "  for(int i=0;i<100;++i) {",
                    "    a += i;",
                    "  }",
                    "  return a;",
                    "}");
            TranslatorOptions options = options();
            options.setMaxUnrollIterations(50);
            Translator translator = new Translator(options);
            translator.scan(src);

            assertThatThrownBy(() -> translator.generateTopFunction(new IrPackage(TOP)))
                    .isInstanceOf(TranslationException.class)
                    .hasMessageContaining("maximum iterations exceeded (50)");
        }

        @Test
        @DisplayName("匿名结构体声明")
        void testAnonymousStruct() {
            assertFails(source(
                    "int my_package(int a) {",
                    "  struct {",
                    "    int x;",
                    "  } s;",
                    "  s.x = a;",
                    "  return s.x;",
                    "}"), ErrorCategory.UNSUPPORTED, "DeclStmt other than Var");
        }

        @Test
        @DisplayName("no-wrap 结构体只能有一个字段")
        void testNoTupleMultiField() {
            assertFails(source(
                    "#pragma hls_no_tuple",
                    "struct Test {",
                    "  int x;",
                    "  int y;",
                    "};",
                    "Test my_package(int a) {",
                    "  Test s;",
                    "  s.x=a;",
                    "  return s;",
                    "}"), ErrorCategory.LAYOUT, "only 1 field supported with no-wrap directive");
        }

        @Test
        @DisplayName("数组初始化元素个数不符")
        void testArrayInitializerSize() {
            assertFails(source(
                    "int my_package(int a) {",
                    "  int arr[3] = {a, a};",
                    "  return arr[0];",
                    "}"), ErrorCategory.UNSUPPORTED, "Array initializer has 2 elements, expected 3");
        }

        @Test
        @DisplayName("多重继承")
        void testMultipleInheritance() {
            assertFails(source(
                    "struct A { int x; };",
                    "struct B { int y; };",
                    "struct C : public A, public B { };",
                    "int my_package(int a) {",
                    "  C c;",
                    "  return a;",
                    "}"), ErrorCategory.UNSUPPORTED, "multiple inheritance is not supported");
        }

        @Test
        @DisplayName("递归调用")
        void testRecursion() {
            assertFails(source(
                    "int f(int a) {",
                    "  return a ? f(a-1) : 0;",
                    "}",
                    "int my_package(int a) {",
                    "  return f(a);",
                    "}"), ErrorCategory.UNSUPPORTED, "Recursion is not supported: 'f'");
        }

        @Test
        @DisplayName("未限定命名空间的调用")
        void testNamespaceFailure() {
            assertFails(source(
                    "namespace test {",
                    "int do_something(int a) {",
                    "  return a;",
                    "}",
                    "}",
                    "int my_package(int a) {",
                    "  return do_something(a);",
                    "}"), ErrorCategory.PARSE, "do_something");
        }

        @Test
        @DisplayName("找不到顶层函数")
        void testNoTop() {
            assertFails(source(
                    "int not_top(int a) {",
                    "  return a;",
                    "}"), ErrorCategory.NOT_FOUND, "No top function found");
        }

        @Test
        @DisplayName("静态变量不能在循环中声明")
        void testStaticInLoop() {
            assertFails(source(
                    "int my_package(int a) {",
                    "  #pragma hls_unroll yes",
                    "  for(int i=0;i<2;++i) {",
                    "    static int s = 0;",
                    "    a += s;",
                    "  }",
                    "  return a;",
                    "}"), ErrorCategory.UNSUPPORTED, "cannot be declared inside a loop");
        }

        @Test
        @DisplayName("错误信息附带源码位置")
        void testErrorLocation() {
            TranslationException e = failure(source(
                    "int my_package(int a) {",
                    "  return (a=7)+a;",
                    "}"));
            assertThat(e.getDetail()).doesNotContain(" at ");
            assertThat(e.getMessage()).startsWith(e.getDetail()).contains(":2:");
        }
    }

    @Nested
    @DisplayName("静态局部变量")
    class StaticLocalTests {

        @Test
        @DisplayName("静态变量成为额外的参数与输出")
        void testStaticLocalThreadsThroughFunction() {
            String src = source(
                    "int my_package(int a) {",
                    "  static int count = 5;",
                    "  count += a;",
                    "  return count;",
                    "}");
            GeneratedFunction generated = generate(src);
            IrFunction function = generated.getFunction();

            assertThat(generated.getStaticLocals()).containsExactly("count");
            assertThat(function.getParam("count")).isNotNull();
            IrValue result = new IrInterpreter().runKwargs(function, arguments(function, "a", 3, "count", 10));
            assertThat(result).isEqualTo(IrValue.tuple(IrValue.ofBits(32, 13), IrValue.ofBits(32, 13)));
        }

        @Test
        @DisplayName("静态变量只允许常量初始化")
        void testStaticNeedsConstant() {
            TranslationException e = failure(source(
                    "int my_package(int a) {",
                    "  static int count = a;",
                    "  return count;",
                    "}"));
            assertThat(e.getCategory()).isEqualTo(ErrorCategory.UNSUPPORTED);
            assertThat(e.getMessage()).contains("must be a constant");
        }
    }

    @Nested
    @DisplayName("顶层选择与生成结果")
    class TopSelectionTests {

        @Test
        @DisplayName("按名字选择")
        void testTopFunctionByName() {
            String src = source(
                    "int my_package(int a) {",
                    "  return a + 1;",
                    "}");
            assertThat(runSigned(src, "a", 3)).isEqualTo(4);
        }

        @Test
        @DisplayName("hls_top 优先于配置的名字")
        void testTopFunctionPragma() {
            String src = source(
                    "int my_package(int a) {",
                    "  return a;",
                    "}",
                    "#pragma hls_top",
                    "int asdf(int a) {",
                    "  return a + 1;",
                    "}");
            Translator translator = scan(src);
            assertThat(translator.selectTop().getName()).isEqualTo("asdf");
            assertThat(runSigned(src, "a", 3)).isEqualTo(4);
        }

        @Test
        @DisplayName("扫描前选择顶层函数是编程错误")
        void testSelectBeforeScan() {
            Translator translator = new Translator(options());
            assertThatThrownBy(translator::selectTop)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("scan()");
        }

        @Test
        @DisplayName("两次翻译语义相同，名字不冲突")
        void testIdempotence() {
            String src = source(
                    "int helper(int a) {",
                    "  return a * 3;",
                    "}",
                    "int my_package(int a) {",
                    "  return helper(a) + 1;",
                    "}");
            Translator translator = scan(src);
            IrPackage pkg = new IrPackage(TOP);
            IrFunction first = translator.generateTopFunction(pkg).getFunction();
            IrFunction second = translator.generateTopFunction(pkg).getFunction();

            assertThat(first.getName()).isNotEqualTo(second.getName());
            IrInterpreter interpreter = new IrInterpreter();
            for (int a = -3; a <= 3; a++) {
                assertThat(interpreter.runKwargs(second, arguments(second, "a", a)))
                        .isEqualTo(interpreter.runKwargs(first, arguments(first, "a", a)));
            }
        }

        @Test
        @DisplayName("失败时目标包保持不变")
        void testFailureLeavesPackageUntouched() {
            String src = source(
                    "int helper(int a) {",
                    "  return a * 3;",
                    "}",
                    "int my_package(int a) {",
                    "  int x = helper(a);",
                    "  while(x) { x = x - 1; }",
                    "  return x;",
                    "}");
            Translator translator = scan(src);
            IrPackage pkg = new IrPackage(TOP);

            assertThatThrownBy(() -> translator.generateTopFunction(pkg))
                    .isInstanceOf(TranslationException.class);
            assertThat(pkg.getFunctions()).isEmpty();
            assertThat(pkg.getTopName()).isNull();
        }
    }
}
