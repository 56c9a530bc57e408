package com.transpyle.cli;

import com.transpyle.ir.Transpiler;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.InputStream;
import java.util.concurrent.Callable;

/**
 * picocli ir 子命令：以 JSON 导出中间表示
 */
@Command(name = "ir", description = "以 JSON 导出源码的中间表示")
public class IrCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = "--verbose", description = "输出降级构造的调试日志")
    boolean verbose;

    @Parameters(index = "0", arity = "0..1", description = "源码文件（缺省或 - 表示标准输入）")
    String file;

    private final InputStream stdin;

    public IrCommand() {
        this(System.in);
    }

    IrCommand(InputStream stdin) {
        this.stdin = stdin;
    }

    @Override
    public Integer call() {
        Main.configureLogging(verbose);
        CommandLine cmd = spec.commandLine();
        return new CliRunner(new Transpiler(), cmd.getOut(), cmd.getErr(), stdin).dumpIr(file);
    }
}
