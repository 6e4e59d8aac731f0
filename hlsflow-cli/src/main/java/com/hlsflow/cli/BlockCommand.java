package com.hlsflow.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * picocli block 子命令：按 JSON 块描述生成 proc
 */
@Command(name = "block", mixinStandardHelpOptions = true, description = "按块描述把顶层函数翻译为 proc 并打印")
public class BlockCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "C++ 源文件")
    Path file;

    @Option(names = {"-b", "--block"}, required = true, description = "JSON 块描述文件")
    Path blockFile;

    @Option(names = "--single-value", description = "FIFO 端口使用单值通道（默认流式）")
    boolean singleValue;

    @Mixin
    CommonOptions common;

    @Override
    public Integer call() {
        LoggingSetup.configure(common.isVerbose());
        return new TranslateRunner(spec.commandLine().getOut(), spec.commandLine().getErr())
                .translateBlock(file, blockFile, singleValue, common);
    }
}
