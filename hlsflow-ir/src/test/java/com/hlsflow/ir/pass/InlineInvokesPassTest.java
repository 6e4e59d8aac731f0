package com.hlsflow.ir.pass;

import com.hlsflow.ir.IrBuilder;
import com.hlsflow.ir.IrFunction;
import com.hlsflow.ir.IrPackage;
import com.hlsflow.ir.interp.IrInterpreter;
import com.hlsflow.ir.node.IrNode;
import com.hlsflow.ir.node.IrOp;
import com.hlsflow.ir.type.IrType;
import com.hlsflow.ir.value.IrValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

/**
 * 内联与死节点删除测试
 */
@DisplayName("InlineInvokesPass 测试")
class InlineInvokesPassTest {

    private IrPackage buildPackage() {
        IrPackage pkg = new IrPackage("p");

        IrFunction inc = pkg.addFunction(new IrFunction("inc"));
        IrBuilder ib = new IrBuilder(inc);
        IrNode x = ib.param("x", IrType.bits(32));
        inc.setReturnValue(ib.add(x, ib.literal(32, 1)));

        IrFunction twice = pkg.addFunction(new IrFunction("inc_twice"));
        IrBuilder tb = new IrBuilder(twice);
        IrNode y = tb.param("y", IrType.bits(32));
        twice.setReturnValue(tb.invoke(inc, Collections.singletonList(tb.invoke(inc, Collections.singletonList(y)))));

        IrFunction top = pkg.addFunction(new IrFunction("top"));
        IrBuilder b = new IrBuilder(top);
        IrNode a = b.param("a", IrType.bits(32));
        b.literal(32, 99); // 无用节点
        top.setReturnValue(b.mul(b.invoke(twice, Collections.singletonList(a)), b.literal(32, 10)));
        return pkg;
    }

    @Test
    @DisplayName("嵌套调用全部展开且语义不变")
    void testInlinePreservesSemantics() {
        IrPackage pkg = buildPackage();
        IrFunction top = pkg.getFunction("top");
        IrValue before = new IrInterpreter().run(top, Arrays.asList(IrValue.ofBits(32, 4)));

        new InlineInvokesPass().run(pkg);

        assertThat(top.getNodesWithOp(IrOp.INVOKE)).isEmpty();
        assertThat(CombinationalReadinessCheck.isReady(pkg)).isTrue();
        IrValue after = new IrInterpreter().run(top, Arrays.asList(IrValue.ofBits(32, 4)));
        assertThat(after).isEqualTo(before).isEqualTo(IrValue.ofBits(32, 60));
    }

    @Test
    @DisplayName("未内联时就绪检查报告残留调用")
    void testReadinessReportsInvokes() {
        IrPackage pkg = buildPackage();
        assertThat(CombinationalReadinessCheck.findProblems(pkg))
                .anySatisfy(p -> assertThat(p).contains("unresolved invoke"));
    }

    @Test
    @DisplayName("死节点删除保留返回值依赖")
    void testDeadNodeElimination() {
        IrPackage pkg = PassPipeline.createDefault().run(buildPackage());
        IrFunction top = pkg.getFunction("top");
        assertThat(top.getNodes()).noneMatch(n -> n.isLiteral() && n.getLiteral().equals(IrValue.ofBits(32, 99)));
        assertThat(new IrInterpreter().run(top, Arrays.asList(IrValue.ofBits(32, 0))))
                .isEqualTo(IrValue.ofBits(32, 20));
    }
}
