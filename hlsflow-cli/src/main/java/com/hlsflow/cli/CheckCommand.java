package com.hlsflow.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * picocli check 子命令：逐个文件翻译，只报告结果
 */
@Command(name = "check", mixinStandardHelpOptions = true, description = "检查源文件能否翻译")
public class CheckCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(arity = "1..*", description = "C++ 源文件")
    List<Path> files;

    @Mixin
    CommonOptions common;

    @Override
    public Integer call() {
        LoggingSetup.configure(common.isVerbose());
        TranslateRunner runner = new TranslateRunner(spec.commandLine().getOut(), spec.commandLine().getErr());
        int exitCode = TranslateRunner.OK;
        for (Path file : files) {
            if (runner.check(file, common) != TranslateRunner.OK) {
                exitCode = TranslateRunner.FAILED;
            }
        }
        return exitCode;
    }
}
