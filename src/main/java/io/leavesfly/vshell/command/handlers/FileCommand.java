package io.leavesfly.vshell.command.handlers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.leavesfly.vshell.command.AbstractCommand;
import io.leavesfly.vshell.command.CommandContext;
import io.leavesfly.vshell.command.CommandHelp;
import io.leavesfly.vshell.shell.ShellResult;
import io.leavesfly.vshell.workspace.WorkspaceProvider;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * file - 识别文件类型
 * <p>
 * 先看扩展名，再嗅探内容（JSON、HTML、XML、shebang 脚本、空文件）。
 */
public class FileCommand extends AbstractCommand {

    private static final int JSON_SNIFF_LIMIT = 65_536;
    private static final int LONG_LINE = 500;
    private static final String UTF8 = "; charset=utf-8";

    private static final Map<String, String> MIME_BY_EXT = Map.ofEntries(
            Map.entry("json", "application/json"),
            Map.entry("js", "application/javascript"),
            Map.entry("mjs", "application/javascript"),
            Map.entry("jsx", "application/javascript"),
            Map.entry("ts", "application/typescript"),
            Map.entry("mts", "application/typescript"),
            Map.entry("tsx", "application/typescript"),
            Map.entry("html", "text/html"),
            Map.entry("htm", "text/html"),
            Map.entry("css", "text/css"),
            Map.entry("xml", "application/xml"),
            Map.entry("svg", "image/svg+xml"),
            Map.entry("md", "text/markdown"),
            Map.entry("csv", "text/csv"),
            Map.entry("yaml", "text/yaml"),
            Map.entry("yml", "text/yaml"),
            Map.entry("toml", "application/toml"),
            Map.entry("txt", "text/plain"),
            Map.entry("sh", "text/x-shellscript"),
            Map.entry("bash", "text/x-shellscript"),
            Map.entry("py", "text/x-python"),
            Map.entry("rb", "text/x-ruby"),
            Map.entry("java", "text/x-java"),
            Map.entry("c", "text/x-c"),
            Map.entry("h", "text/x-c"),
            Map.entry("cpp", "text/x-c++"),
            Map.entry("go", "text/x-go"),
            Map.entry("rs", "text/x-rust"));

    private static final Map<String, String> TYPE_BY_EXT = Map.ofEntries(
            Map.entry("js", "JavaScript source, UTF-8 Unicode text"),
            Map.entry("mjs", "JavaScript source, UTF-8 Unicode text"),
            Map.entry("jsx", "JavaScript source, UTF-8 Unicode text"),
            Map.entry("ts", "TypeScript source, UTF-8 Unicode text"),
            Map.entry("mts", "TypeScript source, UTF-8 Unicode text"),
            Map.entry("tsx", "TypeScript source, UTF-8 Unicode text"),
            Map.entry("py", "Python source, UTF-8 Unicode text"),
            Map.entry("rb", "Ruby source, UTF-8 Unicode text"),
            Map.entry("java", "Java source, UTF-8 Unicode text"),
            Map.entry("c", "C source, UTF-8 Unicode text"),
            Map.entry("h", "C source header, UTF-8 Unicode text"),
            Map.entry("cpp", "C++ source, UTF-8 Unicode text"),
            Map.entry("go", "Go source, UTF-8 Unicode text"),
            Map.entry("rs", "Rust source, UTF-8 Unicode text"),
            Map.entry("css", "CSS stylesheet, UTF-8 Unicode text"),
            Map.entry("md", "Markdown document, UTF-8 Unicode text"),
            Map.entry("yaml", "YAML document, UTF-8 Unicode text"),
            Map.entry("yml", "YAML document, UTF-8 Unicode text"),
            Map.entry("toml", "TOML document, UTF-8 Unicode text"),
            Map.entry("csv", "CSV text"),
            Map.entry("sh", "Bourne-Again shell script text executable"),
            Map.entry("bash", "Bourne-Again shell script text executable"));

    private final ObjectMapper objectMapper;

    public FileCommand(ObjectMapper objectMapper) {
        super("file", CommandHelp.builder()
                .usage("file [OPTIONS] [FILE...]")
                .description("Determine file type")
                .addFlag("-b", "Brief mode (do not prepend filename)")
                .addFlag("-i", "Output MIME type string")
                .addExample("file data.json", "Identify file type")
                .addExample("file -i script.py", "Show MIME type")
                .addExample("file -b readme.md", "Show type without filename")
                .addExample("file src", "Identify directory")
                .build());
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<ShellResult> execute(List<String> args, CommandContext context) {
        boolean brief = false;
        boolean mime = false;
        List<String> paths = new ArrayList<>();

        for (String arg : args) {
            if ("-b".equals(arg) || "--brief".equals(arg)) {
                brief = true;
            } else if ("-i".equals(arg) || "--mime".equals(arg)) {
                mime = true;
            } else if ("-bi".equals(arg) || "-ib".equals(arg)) {
                brief = true;
                mime = true;
            } else if (!arg.startsWith("-")) {
                paths.add(arg);
            }
        }

        if (paths.isEmpty()) {
            return Mono.just(ShellResult.error("file: missing file operand"));
        }

        WorkspaceProvider fs = context.getFs();
        final boolean briefMode = brief;
        final boolean mimeMode = mime;

        return Flux.fromIterable(paths)
                .concatMap(path -> describe(fs, path, mimeMode)
                        .map(type -> new Line(briefMode ? type : path + ": " + type, false))
                        .defaultIfEmpty(new Line("file: " + path + ": No such file or directory", true)))
                .collectList()
                .map(lines -> {
                    StringBuilder stdout = new StringBuilder();
                    boolean failed = false;
                    for (Line line : lines) {
                        stdout.append(line.text).append('\n');
                        failed |= line.error;
                    }
                    return ShellResult.of(failed ? 1 : 0, stdout.toString(), "");
                });
    }

    private Mono<String> describe(WorkspaceProvider fs, String path, boolean mime) {
        return fs.isDirectory(path).flatMap(dir -> {
            if (dir) {
                return Mono.just(mime ? "inode/directory; charset=binary" : "directory");
            }
            return fs.read(path).map(content -> mime ? detectMime(path, content) : detectType(path, content));
        });
    }

    String detectMime(String path, String content) {
        String ext = extensionOf(path);
        if (MIME_BY_EXT.containsKey(ext)) {
            return MIME_BY_EXT.get(ext) + UTF8;
        }
        if (content.isEmpty()) {
            return "inode/x-empty; charset=binary";
        }
        if (looksLikeJson(content)) {
            return "application/json" + UTF8;
        }
        if (looksLikeHtml(content)) {
            return "text/html" + UTF8;
        }
        if (looksLikeXml(content)) {
            return "application/xml" + UTF8;
        }
        return "text/plain" + UTF8;
    }

    String detectType(String path, String content) {
        String ext = extensionOf(path);
        if (content.isEmpty()) {
            return "empty";
        }
        if ("json".equals(ext) || (ext.isEmpty() && looksLikeJson(content))) {
            return "JSON text data";
        }
        if ("html".equals(ext) || "htm".equals(ext) || (ext.isEmpty() && looksLikeHtml(content))) {
            return "HTML document, UTF-8 Unicode text";
        }
        if ("svg".equals(ext)) {
            return "SVG Scalable Vector Graphics image";
        }
        if ("xml".equals(ext) || (ext.isEmpty() && looksLikeXml(content))) {
            return "XML document text";
        }
        if (content.startsWith("#!")) {
            return shebangType(content);
        }
        if (TYPE_BY_EXT.containsKey(ext)) {
            return TYPE_BY_EXT.get(ext);
        }
        for (String line : content.split("\n")) {
            if (line.length() > LONG_LINE) {
                return "UTF-8 Unicode text, with very long lines";
            }
        }
        return "UTF-8 Unicode text";
    }

    private static String shebangType(String content) {
        int newline = content.indexOf('\n');
        String firstLine = newline >= 0 ? content.substring(0, newline) : content;
        if (firstLine.contains("python")) {
            return "Python script text executable";
        }
        if (firstLine.contains("node")) {
            return "Node.js script text executable";
        }
        if (firstLine.contains("bash") || firstLine.contains("/sh")) {
            return "Bourne-Again shell script text executable";
        }
        if (firstLine.contains("ruby")) {
            return "Ruby script text executable";
        }
        if (firstLine.contains("perl")) {
            return "Perl script text executable";
        }
        return "script text executable";
    }

    static String extensionOf(String path) {
        String name = path.substring(path.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        if (dot <= 0) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private boolean looksLikeJson(String content) {
        String trimmed = content.stripLeading();
        if (!trimmed.startsWith("{") && !trimmed.startsWith("[")) {
            return false;
        }
        if (content.length() > JSON_SNIFF_LIMIT) {
            return false;
        }
        try {
            objectMapper.readTree(content);
            return true;
        } catch (JsonProcessingException e) {
            return false;
        }
    }

    private static boolean looksLikeHtml(String content) {
        String head = content.stripLeading();
        head = head.substring(0, Math.min(50, head.length())).toLowerCase(Locale.ROOT);
        return head.startsWith("<!doctype html") || head.startsWith("<html");
    }

    private static boolean looksLikeXml(String content) {
        return content.stripLeading().startsWith("<?xml");
    }

    private static final class Line {
        final String text;
        final boolean error;

        Line(String text, boolean error) {
            this.text = text;
            this.error = error;
        }
    }
}
