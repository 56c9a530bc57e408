package com.transpyle.cli;

import com.transpyle.ir.Transpiler;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.InputStream;
import java.util.concurrent.Callable;

/**
 * picocli convert 子命令：处理 JSON 转换请求
 */
@Command(name = "convert", description = "读取 {\"code\", \"toLang\"} 请求，输出 {\"result\"} 或 {\"error\"}")
public class ConvertCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = "--verbose", description = "输出降级构造的调试日志")
    boolean verbose;

    @Option(names = {"-i", "--input"}, description = "请求文件（默认标准输入）")
    String input;

    private final InputStream stdin;

    public ConvertCommand() {
        this(System.in);
    }

    ConvertCommand(InputStream stdin) {
        this.stdin = stdin;
    }

    @Override
    public Integer call() {
        Main.configureLogging(verbose);
        CommandLine cmd = spec.commandLine();
        return new CliRunner(new Transpiler(), cmd.getOut(), cmd.getErr(), stdin).convert(input);
    }
}
