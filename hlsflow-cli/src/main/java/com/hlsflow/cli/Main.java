package com.hlsflow.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.Charset;

/**
 * HlsFlow CLI 入口点（picocli）
 */
@Command(name = "hlsflow", version = "HlsFlow v0.1.0",
         mixinStandardHelpOptions = true,
         description = "把 C++ 子集翻译为数据流 IR",
         subcommands = {FunctionCommand.class, BlockCommand.class, CheckCommand.class})
public class Main implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        throw new ParameterException(spec.commandLine(), "Missing required subcommand");
    }

    public static void main(String[] args) {
        // Windows 控制台可能不是 UTF-8，按 native.encoding 输出
        Charset charset = consoleCharset();
        PrintStream out = new PrintStream(System.out, true, charset);
        PrintStream err = new PrintStream(System.err, true, charset);
        System.setOut(out);
        System.setErr(err);

        CommandLine cmd = new CommandLine(new Main());
        cmd.setOut(new PrintWriter(new OutputStreamWriter(out, charset), true));
        cmd.setErr(new PrintWriter(new OutputStreamWriter(err, charset), true));
        System.exit(cmd.execute(args));
    }

    private static Charset consoleCharset() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null && Charset.isSupported(nativeEnc)) {
            return Charset.forName(nativeEnc);
        }
        return Charset.defaultCharset();
    }
}
