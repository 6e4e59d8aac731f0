package com.hlsflow.cli;

import com.hlsflow.translator.TranslatorOptions;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * 各子命令共用的选项（picocli mixin）；命令行值覆盖 hlsflow.properties
 */
public class CommonOptions {

    @Option(names = "--top", description = "顶层函数名（#pragma hls_top 优先）")
    String top;

    @Option(names = "--max-unroll-iterations", description = "展开循环的迭代上限（默认 1000）")
    Integer maxUnrollIterations;

    @Option(names = "--inline", description = "生成后内联全部调用")
    boolean inline;

    @Option(names = "--package", description = "IR 包名（默认取源文件名）")
    String packageName;

    @Option(names = {"-o", "--output"}, description = "输出文件（默认打印到标准输出）")
    Path output;

    @Option(names = {"-v", "--verbose"}, description = "输出翻译过程日志")
    boolean verbose;

    /**
     * @throws IllegalArgumentException 迭代上限不是正数
     */
    TranslatorOptions toTranslatorOptions() {
        TranslatorOptions options = TranslatorOptions.load();
        if (top != null) {
            options.setTopName(top);
        }
        if (maxUnrollIterations != null) {
            options.setMaxUnrollIterations(maxUnrollIterations);
        }
        if (inline) {
            options.setInlineAfterGeneration(true);
        }
        return options;
    }

    /** 显式给出的包名，否则取源文件名去掉扩展名 */
    String packageNameFor(Path file) {
        if (packageName != null) {
            return packageName;
        }
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        StringBuilder sb = new StringBuilder();
        for (char c : name.toCharArray()) {
            sb.append(Character.isLetterOrDigit(c) || c == '_' ? c : '_');
        }
        return sb.toString();
    }

    Path getOutput() {
        return output;
    }

    boolean isVerbose() {
        return verbose;
    }
}
