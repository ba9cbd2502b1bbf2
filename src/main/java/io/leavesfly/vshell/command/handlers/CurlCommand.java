package io.leavesfly.vshell.command.handlers;

import io.leavesfly.vshell.command.AbstractCommand;
import io.leavesfly.vshell.command.CommandContext;
import io.leavesfly.vshell.command.CommandHelp;
import io.leavesfly.vshell.config.ShellConfig;
import io.leavesfly.vshell.shell.ShellResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * curl - 发送 HTTP 请求
 */
@Slf4j
public class CurlCommand extends AbstractCommand {

    private final WebClient webClient;

    public CurlCommand(WebClient webClient) {
        super("curl", CommandHelp.builder()
                .usage("curl [OPTIONS] URL")
                .description("Transfer data from or to a server")
                .addFlag("-X METHOD", "Request method (GET, POST, PUT, DELETE, PATCH)")
                .addFlag("-d DATA", "Send data in request body (sets POST if no -X)")
                .addFlag("-H HEADER", "Add header (e.g. \"Content-Type: application/json\")")
                .addFlag("-s", "Silent mode (suppress progress)")
                .addFlag("-i", "Include response headers in output")
                .addFlag("-o FILE", "Write output to file (use shell redirection instead)")
                .addExample("curl https://api.example.com/users", "GET request")
                .addExample("curl -X POST https://api.com/data -d '{\"key\":\"value\"}'", "POST with JSON body")
                .addExample("curl -H \"Authorization: Bearer token\" https://api.com", "Request with auth header")
                .addExample("curl -s https://api.com | jq .data", "Fetch JSON and extract field")
                .note("Relative URLs resolved against configured baseUrl")
                .note("Default headers from config are included automatically")
                .note("Always quote URLs with special characters")
                .build());
        this.webClient = webClient;
    }

    @Override
    public Mono<ShellResult> execute(List<String> args, CommandContext context) {
        ShellConfig config = context.getConfig();
        String method = "GET";
        boolean methodSet = false;
        String url = null;
        String data = null;
        boolean includeHeaders = false;
        Map<String, String> headers = new LinkedHashMap<>();
        if (config.getDefaultHeaders() != null) {
            headers.putAll(config.getDefaultHeaders());
        }

        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            switch (arg) {
                case "-X":
                case "--request":
                    if (i + 1 >= args.size()) {
                        return Mono.just(ShellResult.error("curl: option " + arg + ": requires parameter"));
                    }
                    method = args.get(++i).toUpperCase(Locale.ROOT);
                    methodSet = true;
                    break;
                case "-d":
                case "--data":
                case "--data-raw":
                    if (i + 1 >= args.size()) {
                        return Mono.just(ShellResult.error("curl: option " + arg + ": requires parameter"));
                    }
                    data = args.get(++i);
                    break;
                case "-H":
                case "--header":
                    if (i + 1 >= args.size()) {
                        return Mono.just(ShellResult.error("curl: option " + arg + ": requires parameter"));
                    }
                    String header = args.get(++i);
                    int colon = header.indexOf(':');
                    if (colon > 0) {
                        headers.put(header.substring(0, colon).trim(), header.substring(colon + 1).trim());
                    }
                    break;
                case "-i":
                case "--include":
                    includeHeaders = true;
                    break;
                case "-o":
                case "--output":
                    // 输出文件由 Shell 重定向处理
                    i++;
                    break;
                default:
                    if (!arg.startsWith("-")) {
                        url = arg;
                    }
            }
        }

        if (url == null) {
            return Mono.just(ShellResult.error("curl: no URL specified"));
        }
        if (data != null && !methodSet) {
            method = "POST";
        }

        String target = resolveUrl(url, config);
        return send(method, target, headers, data, includeHeaders, config.getTimeoutMs());
    }

    /**
     * 相对 URL 拼接到 baseUrl 之后
     */
    static String resolveUrl(String url, ShellConfig config) {
        if (!config.hasBaseUrl() || url.startsWith("http")) {
            return url;
        }
        String base = config.getBaseUrl().replaceAll("/+$", "");
        return base + "/" + url.replaceFirst("^/+", "");
    }

    private Mono<ShellResult> send(String method, String url, Map<String, String> headers,
                                   String data, boolean includeHeaders, long timeoutMs) {
        log.debug("curl {} {}", method, url);

        WebClient.RequestBodySpec request = webClient.method(HttpMethod.valueOf(method))
                .uri(url)
                .headers(h -> headers.forEach(h::set));
        WebClient.RequestHeadersSpec<?> spec = data != null ? request.bodyValue(data) : request;

        Mono<ShellResult> response = spec.exchangeToMono(r -> r.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> toResult(r, body, includeHeaders)));
        if (timeoutMs > 0) {
            response = response.timeout(Duration.ofMillis(timeoutMs));
        }

        return response
                .onErrorResume(TimeoutException.class, e -> {
                    log.warn("curl timed out after {} ms: {}", timeoutMs, url);
                    return Mono.just(ShellResult.error(
                            "curl: (28) Operation timed out after " + timeoutMs + " milliseconds"));
                })
                .onErrorResume(e -> {
                    log.warn("curl failed: {} {} - {}", method, url, e.getMessage());
                    return Mono.just(ShellResult.error("curl: " + e.getMessage()));
                });
    }

    private ShellResult toResult(ClientResponse response, String body, boolean includeHeaders) {
        int status = response.statusCode().value();
        StringBuilder stdout = new StringBuilder();
        if (includeHeaders) {
            HttpStatus known = HttpStatus.resolve(status);
            stdout.append("HTTP/1.1 ").append(status);
            if (known != null) {
                stdout.append(' ').append(known.getReasonPhrase());
            }
            stdout.append('\n');
            response.headers().asHttpHeaders().forEach((name, values) -> {
                for (String value : values) {
                    stdout.append(name.toLowerCase(Locale.ROOT)).append(": ").append(value).append('\n');
                }
            });
            stdout.append('\n');
        }
        stdout.append(body);

        if (response.statusCode().is2xxSuccessful()) {
            return ShellResult.ok(stdout.toString());
        }
        return ShellResult.of(1, stdout.toString(), "curl: (22) HTTP error " + status);
    }
}
