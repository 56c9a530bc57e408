package com.transpyle.ir;

import com.transpyle.compiler.ast.decl.Program;
import com.transpyle.compiler.lexer.Lexer;
import com.transpyle.compiler.parser.ParseException;
import com.transpyle.compiler.parser.Parser;
import com.transpyle.ir.backend.CodeGenerator;
import com.transpyle.ir.backend.GeneratorConfig;
import com.transpyle.ir.backend.TargetLanguage;
import com.transpyle.ir.inst.IrProgram;
import com.transpyle.ir.lowering.AstToIrLowering;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 转译器门面。
 * 管线：源码 → Lexer → Parser → AST → IR → 目标语言源码。
 *
 * <p>每次调用都新建词法、语法、降级与生成器实例，实例本身只持有配置，可被共享。</p>
 */
public class Transpiler {

    private static final Logger LOG = Logger.getLogger(Transpiler.class.getName());

    private static final String DEFAULT_FILE_NAME = "<input>";

    private final GeneratorConfig config;

    public Transpiler() {
        this(new GeneratorConfig());
    }

    public Transpiler(GeneratorConfig config) {
        this.config = config;
    }

    /**
     * 转译源码。源码有语法错误时不抛出，输出中以一条错误注释代替程序主体。
     */
    public String translate(String source, TargetLanguage target) {
        return generate(parse(source), target);
    }

    /**
     * 按名称选择目标语言后转译
     *
     * @throws com.transpyle.ir.backend.UnsupportedTargetException 目标名称未知
     */
    public String translate(String source, String targetName) {
        TargetLanguage target = TargetLanguage.fromName(targetName);
        return translate(source, target);
    }

    /**
     * 转译文件
     */
    public String translateFile(File file, TargetLanguage target) throws IOException {
        String source = new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
        return generate(parse(source, file.getName()), target);
    }

    public IrProgram parse(String source) {
        return parse(source, DEFAULT_FILE_NAME);
    }

    /**
     * 源码 → IR。任何解析或降级失败都使整个程序变为一条错误注释，不保留部分结果。
     */
    public IrProgram parse(String source, String fileName) {
        try {
            Lexer lexer = new Lexer(source, fileName);
            Parser parser = new Parser(lexer, fileName);
            Program program = parser.parse();
            return new AstToIrLowering().lower(program);
        } catch (ParseException e) {
            LOG.fine(() -> "Parse failed in " + fileName + ": " + e.getMessage());
            return IrProgram.ofError(e.getMessage());
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Translation failed: " + fileName, e);
            return IrProgram.ofError(e.getMessage() != null ? e.getMessage() : e.getClass().getName());
        }
    }

    public String generate(IrProgram program, TargetLanguage target) {
        return new CodeGenerator(config).generate(program, target);
    }
}
