package com.transpyle.cli;

import com.transpyle.ir.Transpiler;
import com.transpyle.ir.backend.GeneratorConfig;
import com.transpyle.ir.backend.ScopingMode;
import com.transpyle.ir.backend.TargetLanguage;
import com.transpyle.ir.backend.UnsupportedTargetException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.InputStream;
import java.util.concurrent.Callable;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

/**
 * Transpyle CLI 入口点（picocli）
 */
@Command(name = "transpyle", version = "Transpyle v0.1.0",
         mixinStandardHelpOptions = true,
         description = "将 Python 子集转译为 C / C++ / Java 源码",
         subcommands = {IrCommand.class, ConvertCommand.class})
public class Main implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_IO = 1;
    static final int EXIT_USAGE = 2;

    @Spec
    CommandSpec spec;

    @Option(names = {"-t", "--target"}, defaultValue = "c", description = "目标语言（c, cpp, java，默认 c）")
    String target;

    @Option(names = {"-o", "--output"}, description = "输出文件（默认标准输出）")
    String output;

    @Option(names = "--scoping", defaultValue = "BLOCK", description = "声明作用域（block, flat，默认 block）")
    ScopingMode scoping;

    @Option(names = "--indent-size", defaultValue = "4", description = "缩进空格数（默认 4）")
    int indentSize;

    @Option(names = "--use-tabs", description = "使用 Tab 缩进")
    boolean useTabs;

    @Option(names = "--verbose", description = "输出降级构造的调试日志")
    boolean verbose;

    @Parameters(index = "0", arity = "0..1", description = "源码文件（缺省或 - 表示标准输入）")
    String file;

    private final InputStream stdin;

    public Main() {
        this(System.in);
    }

    Main(InputStream stdin) {
        this.stdin = stdin;
    }

    @Override
    public Integer call() {
        configureLogging(verbose);
        CommandLine cmd = spec.commandLine();
        TargetLanguage language;
        GeneratorConfig config;
        try {
            language = TargetLanguage.fromName(target);
            config = generatorConfig();
        } catch (UnsupportedTargetException | IllegalArgumentException e) {
            cmd.getErr().println("错误: " + e.getMessage());
            return EXIT_USAGE;
        }
        return new CliRunner(new Transpiler(config), cmd.getOut(), cmd.getErr(), stdin)
                .translate(file, language, output);
    }

    GeneratorConfig generatorConfig() {
        GeneratorConfig config = new GeneratorConfig();
        config.setIndentSize(indentSize);
        config.setUseSpaces(!useTabs);
        config.setScopingMode(scoping);
        return config;
    }

    /**
     * 日志输出到 stderr；verbose 时放开到 FINE
     */
    static void configureLogging(boolean verbose) {
        Level level = verbose ? Level.FINE : Level.WARNING;
        Logger rootLogger = Logger.getLogger("");
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }
        Handler stderrHandler = new StreamHandler(System.err, new SimpleFormatter()) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        stderrHandler.setLevel(level);
        rootLogger.addHandler(stderrHandler);
        rootLogger.setLevel(level);
    }

    /**
     * 创建配置好的命令行实例
     */
    static CommandLine commandLine(Main main) {
        CommandLine cmd = new CommandLine(main, new StdinFactory(main.stdin));
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        cmd.getCommandSpec().exitCodeOnInvalidInput(EXIT_USAGE);
        cmd.getCommandSpec().exitCodeOnExecutionException(EXIT_IO);
        return cmd;
    }

    public static void main(String[] args) {
        System.exit(commandLine(new Main()).execute(args));
    }

    /**
     * 子命令共享同一个标准输入
     */
    private static final class StdinFactory implements CommandLine.IFactory {

        private final InputStream stdin;

        StdinFactory(InputStream stdin) {
            this.stdin = stdin;
        }

        @Override
        public <K> K create(Class<K> cls) throws Exception {
            if (cls == IrCommand.class) {
                return cls.cast(new IrCommand(stdin));
            }
            if (cls == ConvertCommand.class) {
                return cls.cast(new ConvertCommand(stdin));
            }
            return CommandLine.defaultFactory().create(cls);
        }
    }
}
