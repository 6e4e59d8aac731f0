package com.hlsflow.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * picocli function 子命令：顶层函数翻译为纯 IR 函数
 */
@Command(name = "function", mixinStandardHelpOptions = true, description = "把顶层函数翻译为 IR 函数并打印")
public class FunctionCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "C++ 源文件")
    Path file;

    @Mixin
    CommonOptions common;

    @Override
    public Integer call() {
        LoggingSetup.configure(common.isVerbose());
        return new TranslateRunner(spec.commandLine().getOut(), spec.commandLine().getErr())
                .translateFunction(file, common);
    }
}
