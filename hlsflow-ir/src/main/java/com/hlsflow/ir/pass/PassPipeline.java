package com.hlsflow.ir.pass;

import com.hlsflow.ir.IrPackage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * 按顺序执行一组 IR pass。
 */
public class PassPipeline {

    private static final Logger LOG = Logger.getLogger(PassPipeline.class.getName());

    private final List<IrPass> passes = new ArrayList<>();

    /**
     * 默认管线：内联全部调用后删除死节点。
     */
    public static PassPipeline createDefault() {
        PassPipeline pipeline = new PassPipeline();
        pipeline.addPass(new InlineInvokesPass());
        pipeline.addPass(new DeadNodeEliminationPass());
        return pipeline;
    }

    public PassPipeline addPass(IrPass pass) {
        passes.add(pass);
        return this;
    }

    public List<IrPass> getPasses() {
        return Collections.unmodifiableList(passes);
    }

    public IrPackage run(IrPackage pkg) {
        IrPackage current = pkg;
        for (IrPass pass : passes) {
            LOG.fine(() -> "Running pass " + pass.getName() + " on " + pkg.getName());
            current = pass.run(current);
        }
        return current;
    }
}
