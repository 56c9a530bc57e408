package com.transpyle.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.transpyle.ir.Transpiler;
import com.transpyle.ir.backend.TargetLanguage;
import com.transpyle.ir.backend.UnsupportedTargetException;
import com.transpyle.ir.inst.IrProgram;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 转译、IR 导出、JSON 转换执行器。
 *
 * <p>所有方法返回进程退出码，错误信息写入 err。</p>
 */
public class CliRunner {

    private static final Logger LOG = Logger.getLogger(CliRunner.class.getName());

    private static final String STDIN = "-";

    private final Transpiler transpiler;
    private final PrintWriter out;
    private final PrintWriter err;
    private final InputStream stdin;
    private final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

    public CliRunner(Transpiler transpiler, PrintWriter out, PrintWriter err, InputStream stdin) {
        this.transpiler = transpiler;
        this.out = out;
        this.err = err;
        this.stdin = stdin;
    }

    /**
     * 转译源码文件，写到输出文件或标准输出
     */
    public int translate(String file, TargetLanguage target, String output) {
        String source;
        try {
            source = readSource(file);
        } catch (IOException e) {
            return ioError(file, e);
        }
        String result = transpiler.generate(transpiler.parse(source, displayName(file)), target);
        return write(result, output);
    }

    /**
     * 以 JSON 导出源码的 IR
     */
    public int dumpIr(String file) {
        String source;
        try {
            source = readSource(file);
        } catch (IOException e) {
            return ioError(file, e);
        }
        IrProgram program = transpiler.parse(source, displayName(file));
        out.println(new IrJsonWriter().toJson(program));
        out.flush();
        return Main.EXIT_OK;
    }

    /**
     * 处理一次 {"code", "toLang"} 请求，响应写到标准输出
     */
    public int convert(String input) {
        String json;
        try {
            json = readSource(input);
        } catch (IOException e) {
            return ioError(input, e);
        }
        ConvertResponse response;
        int exitCode = Main.EXIT_OK;
        try {
            ConvertRequest request = gson.fromJson(json, ConvertRequest.class);
            if (request == null) {
                throw new JsonParseException("empty request");
            }
            response = ConvertResponse.result(transpiler.translate(request.getCode(), request.getToLang()));
        } catch (JsonParseException e) {
            LOG.fine(() -> "Malformed convert request: " + e.getMessage());
            response = ConvertResponse.error("Invalid request: " + e.getMessage());
            exitCode = Main.EXIT_USAGE;
        } catch (UnsupportedTargetException e) {
            response = ConvertResponse.error(e.getMessage());
            exitCode = Main.EXIT_USAGE;
        }
        out.println(gson.toJson(response));
        out.flush();
        return exitCode;
    }

    /**
     * 读取文件内容；null 或 - 读取标准输入
     */
    String readSource(String file) throws IOException {
        if (file == null || STDIN.equals(file)) {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            byte[] chunk = new byte[8192];
            int n;
            while ((n = stdin.read(chunk)) != -1) {
                buffer.write(chunk, 0, n);
            }
            return new String(buffer.toByteArray(), StandardCharsets.UTF_8);
        }
        Path path = Paths.get(file);
        if (!Files.exists(path)) {
            throw new IOException("文件不存在 - " + file);
        }
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    private int write(String text, String output) {
        if (output == null || STDIN.equals(output)) {
            out.println(text);
            out.flush();
            return Main.EXIT_OK;
        }
        try {
            Files.write(Paths.get(output), (text + "\n").getBytes(StandardCharsets.UTF_8));
            return Main.EXIT_OK;
        } catch (IOException e) {
            return ioError(output, e);
        }
    }

    private int ioError(String file, IOException e) {
        LOG.log(Level.FINE, "I/O failure: " + displayName(file), e);
        err.println("错误: " + e.getMessage());
        err.flush();
        return Main.EXIT_IO;
    }

    private static String displayName(String file) {
        if (file == null || STDIN.equals(file)) {
            return "<stdin>";
        }
        Path name = Paths.get(file).getFileName();
        return name != null ? name.toString() : file;
    }
}
