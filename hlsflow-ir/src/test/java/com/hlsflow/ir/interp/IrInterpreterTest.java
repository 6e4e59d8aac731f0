package com.hlsflow.ir.interp;

import com.hlsflow.ir.IrBuilder;
import com.hlsflow.ir.IrFunction;
import com.hlsflow.ir.node.IrNode;
import com.hlsflow.ir.type.IrType;
import com.hlsflow.ir.value.IrValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.*;

/**
 * IrInterpreter 测试：节点语义
 */
@DisplayName("IrInterpreter 测试")
class IrInterpreterTest {

    private final IrInterpreter interpreter = new IrInterpreter();

    /** 构造 f(a, b) = op(a, b)，关闭折叠以测试解释器本身 */
    private IrFunction binary(int width, BiFunction<IrBuilder, IrNode[], IrNode> body) {
        IrFunction f = new IrFunction("f");
        IrBuilder b = new IrBuilder(f);
        b.setFolding(false);
        IrNode x = b.param("a", IrType.bits(width));
        IrNode y = b.param("b", IrType.bits(width));
        f.setReturnValue(body.apply(b, new IrNode[]{x, y}));
        return f;
    }

    private long run(IrFunction f, int width, long a, long b) {
        return interpreter.run(f, Arrays.asList(IrValue.ofBits(width, a), IrValue.ofBits(width, b)))
                .toUnsignedLong();
    }

    @Nested
    @DisplayName("算术")
    class ArithmeticTests {

        @Test
        @DisplayName("加法按宽度回绕")
        void testAddWraps() {
            IrFunction f = binary(8, (b, p) -> b.add(p[0], p[1]));
            assertThat(run(f, 8, 200, 100)).isEqualTo(44);
        }

        @Test
        @DisplayName("有符号除法向零截断")
        void testSignedDivision() {
            IrFunction f = binary(32, (b, p) -> b.sdiv(p[0], p[1]));
            assertThat(interpreter.run(f, Arrays.asList(IrValue.ofBits(32, -7), IrValue.ofBits(32, 2)))
                    .toSignedLong()).isEqualTo(-3);
        }

        @Test
        @DisplayName("除零：无符号全 1，有符号取同号极值")
        void testDivisionByZero() {
            IrFunction u = binary(8, (b, p) -> b.udiv(p[0], p[1]));
            assertThat(run(u, 8, 5, 0)).isEqualTo(0xFF);
            IrFunction s = binary(8, (b, p) -> b.sdiv(p[0], p[1]));
            assertThat(run(s, 8, 5, 0)).isEqualTo(0x7F);
            assertThat(run(s, 8, 0xFB, 0)).isEqualTo(0x80);
        }

        @Test
        @DisplayName("模零为 0，有符号取模跟随被除数符号")
        void testModulo() {
            IrFunction u = binary(8, (b, p) -> b.umod(p[0], p[1]));
            assertThat(run(u, 8, 5, 0)).isEqualTo(0);
            IrFunction s = binary(32, (b, p) -> b.smod(p[0], p[1]));
            assertThat(interpreter.run(s, Arrays.asList(IrValue.ofBits(32, -7), IrValue.ofBits(32, 3)))
                    .toSignedLong()).isEqualTo(-1);
        }

        @Test
        @DisplayName("算术右移保留符号，超宽移位")
        void testShifts() {
            IrFunction sra = binary(8, (b, p) -> b.shra(p[0], p[1]));
            assertThat(run(sra, 8, 0x80, 2)).isEqualTo(0xE0);
            assertThat(run(sra, 8, 0x80, 9)).isEqualTo(0xFF);
            IrFunction shl = binary(8, (b, p) -> b.shll(p[0], p[1]));
            assertThat(run(shl, 8, 1, 8)).isEqualTo(0);
        }
    }

    @Nested
    @DisplayName("聚合")
    class AggregateTests {

        @Test
        @DisplayName("数组越界读取钳制到末元素，越界更新忽略")
        void testArrayBounds() {
            IrFunction f = new IrFunction("f");
            IrBuilder b = new IrBuilder(f);
            IrNode i = b.param("i", IrType.bits(32));
            IrNode arr = b.array(Arrays.asList(b.literal(8, 1), b.literal(8, 2), b.literal(8, 3)));
            IrNode updated = b.arrayUpdate(arr, i, b.literal(8, 9));
            f.setReturnValue(b.tuple(b.arrayIndex(arr, i), updated));

            IrValue inRange = interpreter.run(f, Collections.singletonList(IrValue.ofBits(32, 1)));
            assertThat(inRange.getElement(0).toUnsignedLong()).isEqualTo(2);
            assertThat(inRange.getElement(1).getElement(1).toUnsignedLong()).isEqualTo(9);

            IrValue outOfRange = interpreter.run(f, Collections.singletonList(IrValue.ofBits(32, 7)));
            assertThat(outOfRange.getElement(0).toUnsignedLong()).isEqualTo(3);
            assertThat(outOfRange.getElement(1).getElement(2).toUnsignedLong()).isEqualTo(3);
        }

        @Test
        @DisplayName("优先选择取最低置位")
        void testPrioritySelect() {
            IrFunction f = new IrFunction("f");
            IrBuilder b = new IrBuilder(f);
            IrNode sel = b.param("s", IrType.bits(2));
            f.setReturnValue(b.prioritySelect(sel,
                    Arrays.asList(b.literal(8, 10), b.literal(8, 20)), b.literal(8, 0)));
            assertThat(interpreter.run(f, Collections.singletonList(IrValue.ofBits(2, 3))).toUnsignedLong())
                    .isEqualTo(10);
            assertThat(interpreter.run(f, Collections.singletonList(IrValue.ofBits(2, 2))).toUnsignedLong())
                    .isEqualTo(20);
            assertThat(interpreter.run(f, Collections.singletonList(IrValue.ofBits(2, 0))).toUnsignedLong())
                    .isEqualTo(0);
        }

        @Test
        @DisplayName("concat 首操作数在高位")
        void testConcat() {
            IrFunction f = binary(4, (b, p) -> b.concat(Arrays.asList(p[0], p[1])));
            assertThat(run(f, 4, 0xA, 0x5)).isEqualTo(0xA5);
        }
    }

    @Nested
    @DisplayName("实参")
    class ArgumentTests {

        @Test
        @DisplayName("按名字传参")
        void testRunKwargs() {
            IrFunction f = binary(32, (b, p) -> b.sub(p[0], p[1]));
            Map<String, IrValue> args = new HashMap<>();
            args.put("b", IrValue.ofBits(32, 3));
            args.put("a", IrValue.ofBits(32, 10));
            assertThat(interpreter.runKwargs(f, args).toUnsignedLong()).isEqualTo(7);
        }

        @Test
        @DisplayName("缺少实参报错")
        void testMissingArgument() {
            IrFunction f = binary(32, (b, p) -> b.sub(p[0], p[1]));
            Map<String, IrValue> args = new HashMap<>();
            args.put("a", IrValue.ofBits(32, 10));
            assertThatThrownBy(() -> interpreter.runKwargs(f, args))
                    .isInstanceOf(IrEvaluationException.class)
                    .hasMessageContaining("Missing argument 'b'");
        }

        @Test
        @DisplayName("类型不符报错")
        void testWrongType() {
            IrFunction f = binary(32, (b, p) -> b.sub(p[0], p[1]));
            assertThatThrownBy(() -> interpreter.run(f,
                    Arrays.asList(IrValue.ofBits(8, 1), IrValue.ofBits(32, 1))))
                    .isInstanceOf(IrEvaluationException.class)
                    .hasMessageContaining("expected bits[32]");
        }
    }
}
