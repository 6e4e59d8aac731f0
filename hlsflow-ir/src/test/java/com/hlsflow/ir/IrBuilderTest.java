package com.hlsflow.ir;

import com.hlsflow.ir.node.IrNode;
import com.hlsflow.ir.node.IrOp;
import com.hlsflow.ir.type.IrType;
import com.hlsflow.ir.value.IrValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

/**
 * IrBuilder 测试：节点构建与常量折叠
 */
@DisplayName("IrBuilder 测试")
class IrBuilderTest {

    private IrFunction function;
    private IrBuilder b;

    @BeforeEach
    void setUp() {
        function = new IrFunction("f");
        b = new IrBuilder(function);
    }

    @Nested
    @DisplayName("常量折叠")
    class FoldingTests {

        @Test
        @DisplayName("字面量运算折叠为字面量")
        void testArithmeticFolds() {
            IrNode sum = b.add(b.literal(32, 40), b.literal(32, 2));
            assertThat(sum.isLiteral()).isTrue();
            assertThat(sum.getLiteral()).isEqualTo(IrValue.ofBits(32, 42));
        }

        @Test
        @DisplayName("有符号比较按宽度解释")
        void testSignedCompare() {
            IrNode lt = b.slt(b.literal(8, 0xFF), b.literal(8, 1));
            assertThat(IrBuilder.isLiteralTrue(lt)).isTrue();
            IrNode ult = b.ult(b.literal(8, 0xFF), b.literal(8, 1));
            assertThat(IrBuilder.isLiteralFalse(ult)).isTrue();
        }

        @Test
        @DisplayName("纯函数调用的字面量实参直接求值")
        void testInvokeFolds() {
            IrFunction twice = new IrFunction("twice");
            IrBuilder tb = new IrBuilder(twice);
            IrNode x = tb.param("x", IrType.bits(32));
            twice.setReturnValue(tb.add(x, x));

            IrNode result = b.invoke(twice, Arrays.asList(b.literal(32, 21)));
            assertThat(result.getLiteral()).isEqualTo(IrValue.ofBits(32, 42));
            assertThat(function.getNodesWithOp(IrOp.INVOKE)).isEmpty();
        }

        @Test
        @DisplayName("关闭折叠后保留运算节点")
        void testFoldingDisabled() {
            b.setFolding(false);
            IrNode sum = b.add(b.literal(32, 1), b.literal(32, 2));
            assertThat(sum.getOp()).isEqualTo(IrOp.ADD);
        }
    }

    @Nested
    @DisplayName("代数化简")
    class SimplificationTests {

        @Test
        @DisplayName("与全 1 / 或全 0 返回另一操作数")
        void testIdentity() {
            IrNode p = b.param("p", IrType.bool());
            assertThat(b.and(p, b.literalBool(true))).isSameAs(p);
            assertThat(b.or(b.literalBool(false), p)).isSameAs(p);
        }

        @Test
        @DisplayName("与全 0 得 0")
        void testAnnihilator() {
            IrNode p = b.param("p", IrType.bool());
            assertThat(IrBuilder.isLiteralFalse(b.and(p, b.literalBool(false)))).isTrue();
            assertThat(IrBuilder.isLiteralTrue(b.or(p, b.literalBool(true)))).isTrue();
        }

        @Test
        @DisplayName("双重取反消去")
        void testDoubleNot() {
            IrNode p = b.param("p", IrType.bool());
            assertThat(b.not(b.not(p))).isSameAs(p);
        }

        @Test
        @DisplayName("常量条件的选择")
        void testSelectConstantCondition() {
            IrNode x = b.param("x", IrType.bits(8));
            IrNode y = b.param("y", IrType.bits(8));
            assertThat(b.select(b.literalBool(true), x, y)).isSameAs(x);
            assertThat(b.select(b.literalBool(false), x, y)).isSameAs(y);
        }

        @Test
        @DisplayName("布尔字面量选择化为条件本身或其反")
        void testSelectBoolLiterals() {
            IrNode c = b.param("c", IrType.bool());
            assertThat(b.select(c, b.literalBool(true), b.literalBool(false))).isSameAs(c);
            IrNode inverted = b.select(c, b.literalBool(false), b.literalBool(true));
            assertThat(inverted.getOp()).isEqualTo(IrOp.NOT);
        }

        @Test
        @DisplayName("元组构造后取下标直接返回元素")
        void testTupleIndexOfTuple() {
            IrNode x = b.param("x", IrType.bits(8));
            IrNode y = b.param("y", IrType.bits(4));
            assertThat(b.tupleIndex(b.tuple(x, y), 1)).isSameAs(y);
        }
    }

    @Nested
    @DisplayName("类型检查")
    class TypeCheckTests {

        @Test
        @DisplayName("宽度不同的二元运算被拒绝")
        void testWidthMismatch() {
            assertThatThrownBy(() -> b.add(b.literal(8, 1), b.literal(16, 1)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("add operands differ");
        }

        @Test
        @DisplayName("resize 截断与扩展")
        void testResize() {
            assertThat(b.resize(b.literal(8, 0x80), 16, true).getLiteral())
                    .isEqualTo(IrValue.ofBits(16, 0xFF80));
            assertThat(b.resize(b.literal(8, 0x80), 16, false).getLiteral())
                    .isEqualTo(IrValue.ofBits(16, 0x80));
            assertThat(b.resize(b.literal(16, 0x1234), 8, true).getLiteral())
                    .isEqualTo(IrValue.ofBits(8, 0x34));
        }
    }

    @Test
    @DisplayName("参数始终位于其他节点之前")
    void testParamsFirst() {
        b.literal(8, 1);
        IrNode p = b.param("late", IrType.bits(8));
        assertThat(function.getNodes().get(0)).isSameAs(p);
    }

    @Test
    @DisplayName("插入点之前插入节点")
    void testInsertionPoint() {
        IrNode x = b.param("x", IrType.bits(8));
        IrNode last = b.neg(x);
        b.setInsertionPoint(last);
        IrNode inserted = b.not(x);
        b.clearInsertionPoint();
        assertThat(function.getNodes()).containsSubsequence(inserted, last);
    }
}
