package com.hlsflow.translator;

import com.hlsflow.compiler.ast.Pragma;
import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.decl.FunctionDecl;
import com.hlsflow.compiler.ast.decl.TranslationUnit;
import com.hlsflow.compiler.parser.ParseException;
import com.hlsflow.compiler.parser.Parser;
import com.hlsflow.ir.IrPackage;
import com.hlsflow.ir.IrProc;
import com.hlsflow.ir.pass.CombinationalReadinessCheck;
import com.hlsflow.ir.pass.PassPipeline;
import com.hlsflow.translator.block.ChannelMode;
import com.hlsflow.translator.block.HlsBlock;
import com.hlsflow.translator.gen.FunctionGenerator;
import com.hlsflow.translator.gen.GeneratedFunction;
import com.hlsflow.translator.gen.GenerationSession;
import com.hlsflow.translator.gen.ProcGenerator;
import com.hlsflow.translator.scan.DeclarationIndex;

import java.util.List;
import java.util.logging.Logger;

/**
 * 翻译入口：扫描源码、选择顶层函数、生成 IR 函数或 proc。
 *
 * <p>每次生成请求使用独立的会话状态；失败时目标包不被修改。</p>
 *
 * <pre>
 * Translator translator = new Translator();
 * translator.scan(source);
 * translator.selectTop("my_top");
 * IrPackage pkg = new IrPackage("my_package");
 * translator.generateTopFunction(pkg);
 * </pre>
 */
public class Translator {

    private static final Logger LOG = Logger.getLogger(Translator.class.getName());

    private final TranslatorOptions options;
    private TranslationUnit unit;
    private DeclarationIndex index;
    private FunctionDecl top;

    public Translator() {
        this(TranslatorOptions.load());
    }

    public Translator(TranslatorOptions options) {
        this.options = options;
    }

    public TranslatorOptions getOptions() {
        return options;
    }

    public void scan(String source) {
        scan(source, "<source>");
    }

    /**
     * 解析源码并建立声明索引，之前选择的顶层函数失效
     *
     * @throws TranslationException 语法错误（PARSE）
     */
    public void scan(String source, String fileName) {
        try {
            unit = new Parser(source, fileName).parse();
        } catch (ParseException e) {
            SourceLocation loc = e.getToken() != null
                    ? new SourceLocation(fileName, e.getToken().getLine(), e.getToken().getColumn())
                    : SourceLocation.UNKNOWN;
            throw new TranslationException(ErrorCategory.PARSE, "Unable to parse text: " + e.getMessage(), loc, e);
        }
        index = DeclarationIndex.build(unit);
        top = null;
        LOG.fine("Scanned " + fileName + ": " + unit.getDeclarations().size() + " top-level declarations");
    }

    /** 按配置中的顶层名选择 */
    public FunctionDecl selectTop() {
        return selectTop(options.getTopName());
    }

    /**
     * 选择顶层函数：带 #pragma hls_top 的函数优先，其次是名为 name 的函数
     *
     * @throws TranslationException 找不到顶层函数（NOT_FOUND）
     */
    public FunctionDecl selectTop(String name) {
        requireScanned();
        FunctionDecl marked = null;
        FunctionDecl named = null;
        for (FunctionDecl f : index.getAllFunctions()) {
            if (f.hasPragma(Pragma.TOP)) {
                if (marked == null) {
                    marked = f;
                } else {
                    LOG.warning("Ignoring #pragma hls_top on '" + f.getName() + "' at " + f.getLocation()
                            + ", already selected '" + marked.getName() + "'");
                }
            }
            if (named == null && name != null && name.equals(f.getName()) && f.hasBody()) {
                named = f;
            }
        }
        top = marked != null ? marked : named;
        if (top == null) {
            throw TranslationException.notFound("No top function found", SourceLocation.UNKNOWN);
        }
        LOG.fine("Selected top function '" + top.getName() + "'");
        return top;
    }

    public FunctionDecl getTop() {
        return top;
    }

    /**
     * 把顶层函数生成为纯函数并加入 pkg
     */
    public GeneratedFunction generateTopFunction(IrPackage pkg) {
        FunctionDecl selected = requireTop();
        GenerationSession session = new GenerationSession(index, options, pkg);
        GeneratedFunction result = new FunctionGenerator(session).generate(selected);
        session.commit();
        if (pkg.getTopName() == null) {
            pkg.setTopName(result.getFunction().getName());
        }
        if (options.isInlineAfterGeneration()) {
            inlineAllInvokes(pkg);
        }
        return result;
    }

    /**
     * 按块描述把顶层函数生成为 proc，并在 pkg 中建立其通道
     */
    public IrProc generateBlock(IrPackage pkg, HlsBlock block, ChannelMode mode) {
        FunctionDecl selected = requireTop();
        GenerationSession session = new GenerationSession(index, options, pkg);
        IrProc proc = new ProcGenerator(session).generate(selected, block, mode);
        session.commit();
        if (pkg.getTopName() == null) {
            pkg.setTopName(proc.getName());
        }
        if (options.isInlineAfterGeneration()) {
            inlineAllInvokes(pkg);
        }
        return proc;
    }

    /** 内联全部调用并删除死节点 */
    public void inlineAllInvokes(IrPackage pkg) {
        PassPipeline.createDefault().run(pkg);
        List<String> problems = CombinationalReadinessCheck.findProblems(pkg);
        if (!problems.isEmpty()) {
            LOG.fine("Package " + pkg.getName() + " is not combinationally ready: " + problems);
        }
    }

    private void requireScanned() {
        if (index == null) {
            throw new IllegalStateException("scan() must be called before selecting a top function");
        }
    }

    private FunctionDecl requireTop() {
        requireScanned();
        if (top == null) {
            selectTop();
        }
        return top;
    }
}
