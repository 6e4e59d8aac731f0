package com.hlsflow.cli;

import com.hlsflow.ir.IrPackage;
import com.hlsflow.ir.IrPrinter;
import com.hlsflow.translator.TranslationException;
import com.hlsflow.translator.Translator;
import com.hlsflow.translator.block.ChannelMode;
import com.hlsflow.translator.block.HlsBlock;
import com.hlsflow.translator.gen.GeneratedFunction;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 读取源码、翻译并输出 IR 的执行器；返回进程退出码
 */
public class TranslateRunner {

    private static final Logger LOG = Logger.getLogger(TranslateRunner.class.getName());

    public static final int OK = 0;
    public static final int FAILED = 1;

    private final PrintWriter out;
    private final PrintWriter err;

    public TranslateRunner(PrintWriter out, PrintWriter err) {
        this.out = out;
        this.err = err;
    }

    /** 一种生成方式：函数模式或 proc 模式 */
    private interface Generation {
        void generate(Translator translator, IrPackage pkg);
    }

    /**
     * 函数模式：把顶层函数翻译为 IR 函数并打印整个包
     */
    public int translateFunction(Path file, CommonOptions common) {
        return translate(file, common, (translator, pkg) -> translator.generateTopFunction(pkg));
    }

    /**
     * proc 模式：按块描述把顶层函数翻译为 proc
     */
    public int translateBlock(Path file, Path blockFile, boolean singleValue, CommonOptions common) {
        final HlsBlock block;
        try (Reader reader = Files.newBufferedReader(blockFile, StandardCharsets.UTF_8)) {
            block = HlsBlock.fromJson(reader);
        } catch (NoSuchFileException e) {
            err.println("error: block description not found: " + blockFile);
            return FAILED;
        } catch (IOException e) {
            err.println("error: cannot read " + blockFile + ": " + e.getMessage());
            return FAILED;
        } catch (IllegalArgumentException e) {
            err.println("error: " + blockFile + ": " + e.getMessage());
            return FAILED;
        }
        final ChannelMode mode = singleValue ? ChannelMode.ALL_SINGLE_VALUE : ChannelMode.ALL_STREAMING;
        return translate(file, common, (translator, pkg) -> translator.generateBlock(pkg, block, mode));
    }

    /**
     * 只做翻译，报告结果或错误类别与信息
     */
    public int check(Path file, CommonOptions common) {
        Translator translator = createTranslator(common);
        String source = readSource(file);
        if (translator == null || source == null) {
            return FAILED;
        }
        try {
            translator.scan(source, file.getFileName().toString());
            GeneratedFunction generated = translator.generateTopFunction(new IrPackage(common.packageNameFor(file)));
            out.println(file + ": OK (top '" + translator.getTop().getName() + "', "
                    + generated.getFunction().getParams().size() + " params, "
                    + generated.getOutputCount() + " outputs, "
                    + generated.getIoOps().size() + " IO ops)");
            return OK;
        } catch (TranslationException e) {
            report(file, e);
            return FAILED;
        }
    }

    private int translate(Path file, CommonOptions common, Generation generation) {
        Translator translator = createTranslator(common);
        String source = readSource(file);
        if (translator == null || source == null) {
            return FAILED;
        }
        IrPackage pkg = new IrPackage(common.packageNameFor(file));
        try {
            translator.scan(source, file.getFileName().toString());
            generation.generate(translator, pkg);
        } catch (TranslationException e) {
            report(file, e);
            return FAILED;
        }
        return emit(IrPrinter.print(pkg), common.getOutput());
    }

    private Translator createTranslator(CommonOptions common) {
        try {
            return new Translator(common.toTranslatorOptions());
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            return null;
        }
    }

    private String readSource(Path file) {
        try {
            return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            err.println("error: file not found: " + file);
        } catch (IOException e) {
            err.println("error: cannot read " + file + ": " + e.getMessage());
        }
        return null;
    }

    private void report(Path file, TranslationException e) {
        err.println(file + ": " + e.getCategory() + ": " + e.getMessage());
        LOG.log(Level.FINE, "Translation of " + file + " failed", e);
    }

    private int emit(String text, Path output) {
        if (output == null) {
            out.print(text);
            out.flush();
            return OK;
        }
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(output, text.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            err.println("error: cannot write " + output + ": " + e.getMessage());
            return FAILED;
        }
        out.println("Wrote " + output);
        return OK;
    }
}
