package com.hlsflow.ir.interp;

import com.hlsflow.ir.IrBuilder;
import com.hlsflow.ir.IrChannel;
import com.hlsflow.ir.IrPackage;
import com.hlsflow.ir.IrProc;
import com.hlsflow.ir.node.IrNode;
import com.hlsflow.ir.type.IrType;
import com.hlsflow.ir.value.IrValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * ProcInterpreter 测试：迭代、状态与阻塞回滚
 */
@DisplayName("ProcInterpreter 测试")
class ProcInterpreterTest {

    private IrPackage pkg;
    private IrProc proc;
    private IrBuilder b;

    @BeforeEach
    void setUp() {
        pkg = new IrPackage("test");
        pkg.addChannel(new IrChannel("in", IrType.bits(32), IrChannel.Kind.STREAMING, IrChannel.Direction.IN));
        pkg.addChannel(new IrChannel("out", IrType.bits(32), IrChannel.Kind.STREAMING, IrChannel.Direction.OUT));
        proc = pkg.addProc(new IrProc("acc"));
        b = new IrBuilder(proc);
    }

    /** out = sum += in */
    private void buildAccumulator() {
        IrNode sum = b.state("sum", IrValue.ofBits(32, 0));
        IrNode value = b.receive("in", IrType.bits(32), null);
        IrNode next = b.add(sum, value);
        b.send("out", next, null);
        proc.getStateElement("sum").setNext(next);
    }

    @Test
    @DisplayName("状态跨迭代保持")
    void testStateAcrossIterations() {
        buildAccumulator();
        ChannelQueueManager queues = new ChannelQueueManager(pkg);
        queues.write("in", IrValue.ofBits(32, 5));
        queues.write("in", IrValue.ofBits(32, 7));
        ProcInterpreter interpreter = new ProcInterpreter(proc, queues);

        assertThat(interpreter.runUntilBlocked(10)).isEqualTo(2);
        assertThat(queues.drain("out")).containsExactly(IrValue.ofBits(32, 5), IrValue.ofBits(32, 12));
        assertThat(interpreter.getState("sum")).isEqualTo(IrValue.ofBits(32, 12));
    }

    @Test
    @DisplayName("空队列阻塞且不产生副作用")
    void testBlockedIterationRollsBack() {
        IrNode first = b.receive("in", IrType.bits(32), null);
        b.send("out", first, null);
        IrNode second = b.receive("in", IrType.bits(32), null);
        b.send("out", second, null);

        ChannelQueueManager queues = new ChannelQueueManager(pkg);
        queues.write("in", IrValue.ofBits(32, 1));
        ProcInterpreter interpreter = new ProcInterpreter(proc, queues);

        ProcInterpreter.RunResult result = interpreter.tick();
        assertThat(result.isIterationComplete()).isFalse();
        assertThat(result.isProgressMade()).isFalse();
        assertThat(result.getBlockedChannels()).containsExactly("in");
        assertThat(queues.getQueue("out").isEmpty()).isTrue();
        assertThat(queues.getQueue("in").size()).isEqualTo(1);

        queues.write("in", IrValue.ofBits(32, 2));
        assertThat(interpreter.tick().isIterationComplete()).isTrue();
        assertThat(queues.drain("out")).containsExactly(IrValue.ofBits(32, 1), IrValue.ofBits(32, 2));
    }

    @Test
    @DisplayName("谓词为假的接收不阻塞")
    void testFalsePredicateDoesNotBlock() {
        pkg.addChannel(new IrChannel("en", IrType.bool(), IrChannel.Kind.SINGLE_VALUE, IrChannel.Direction.IN));
        IrNode enabled = b.receive("en", IrType.bool(), null);
        IrNode value = b.receive("in", IrType.bits(32), enabled);
        b.send("out", value, enabled);

        ChannelQueueManager queues = new ChannelQueueManager(pkg);
        queues.write("en", IrValue.ofBool(false));
        ProcInterpreter interpreter = new ProcInterpreter(proc, queues);

        assertThat(interpreter.tick().isIterationComplete()).isTrue();
        assertThat(queues.getQueue("out").isEmpty()).isTrue();
    }

    @Test
    @DisplayName("单值通道读取不消耗")
    void testSingleValueChannel() {
        pkg.addChannel(new IrChannel("k", IrType.bits(32), IrChannel.Kind.SINGLE_VALUE, IrChannel.Direction.IN));
        IrNode k = b.receive("k", IrType.bits(32), null);
        IrNode v = b.receive("in", IrType.bits(32), null);
        b.send("out", b.mul(k, v), null);

        ChannelQueueManager queues = new ChannelQueueManager(pkg);
        queues.write("k", IrValue.ofBits(32, 3));
        queues.write("in", IrValue.ofBits(32, 2));
        queues.write("in", IrValue.ofBits(32, 4));
        ProcInterpreter interpreter = new ProcInterpreter(proc, queues);

        assertThat(interpreter.runUntilBlocked(10)).isEqualTo(2);
        assertThat(queues.drain("out")).containsExactly(IrValue.ofBits(32, 6), IrValue.ofBits(32, 12));
    }

    @Test
    @DisplayName("写入类型不符的值报错")
    void testWrongChannelType() {
        ChannelQueueManager queues = new ChannelQueueManager(pkg);
        assertThatThrownBy(() -> queues.write("in", IrValue.ofBits(8, 1)))
                .isInstanceOf(IrEvaluationException.class)
                .hasMessageContaining("cannot write bits[8]");
    }
}
