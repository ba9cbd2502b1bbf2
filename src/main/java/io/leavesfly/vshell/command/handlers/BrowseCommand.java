package io.leavesfly.vshell.command.handlers;

import io.leavesfly.vshell.command.AbstractCommand;
import io.leavesfly.vshell.command.CommandContext;
import io.leavesfly.vshell.command.CommandHelp;
import io.leavesfly.vshell.shell.ShellResult;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * browse - 抓取网页并转换为可读文本
 * <p>
 * 使用 Jsoup 解析 HTML，移除 script / style / nav / footer，
 * 标题转为 # 形式，链接转为 [text](url)，列表项转为 "- "。
 */
@Slf4j
public class BrowseCommand extends AbstractCommand {

    private static final String USER_AGENT = "Mozilla/5.0 (compatible; ShellBrowser/1.0)";

    /**
     * 转换后少于该字符数视为无有效内容
     */
    private static final int MIN_CONTENT_LENGTH = 50;

    /**
     * 页面被拦截或需要 JavaScript 的特征
     */
    private static final List<Pattern> BLOCKED_PATTERNS = List.of(
            Pattern.compile("please\\s+enable\\s+javascript", Pattern.CASE_INSENSITIVE),
            Pattern.compile("you\\s+need\\s+to\\s+enable\\s+javascript", Pattern.CASE_INSENSITIVE),
            Pattern.compile("javascript\\s+is\\s+required", Pattern.CASE_INSENSITIVE),
            Pattern.compile("please\\s+click\\s+here\\s+if\\s+you\\s+are\\s+not\\s+redirected", Pattern.CASE_INSENSITIVE),
            Pattern.compile("if\\s+you\\s+are\\s+not\\s+redirected", Pattern.CASE_INSENSITIVE),
            Pattern.compile("checking\\s+(your\\s+)?browser", Pattern.CASE_INSENSITIVE),
            Pattern.compile("verify\\s+you\\s+are\\s+(a\\s+)?human", Pattern.CASE_INSENSITIVE),
            Pattern.compile("captcha", Pattern.CASE_INSENSITIVE),
            Pattern.compile("access\\s+denied", Pattern.CASE_INSENSITIVE),
            Pattern.compile("forbidden", Pattern.CASE_INSENSITIVE),
            Pattern.compile("bot\\s+detected", Pattern.CASE_INSENSITIVE),
            Pattern.compile("unusual\\s+traffic", Pattern.CASE_INSENSITIVE),
            Pattern.compile("automated\\s+requests", Pattern.CASE_INSENSITIVE)
    );

    private final WebClient webClient;

    public BrowseCommand(WebClient webClient) {
        super("browse", CommandHelp.builder()
                .usage("browse [OPTIONS] URL")
                .description("Fetch a web page and convert HTML to readable text")
                .addFlag("--raw", "Return raw HTML instead of converted text")
                .addExample("browse https://example.com", "Fetch and convert page to text")
                .addExample("browse --raw https://example.com", "Fetch raw HTML")
                .addExample("browse https://example.com | grep \"keyword\"", "Fetch and search for keyword")
                .addExample("browse https://example.com > page.md", "Save page content to file")
                .note("Strips <script>, <style>, <nav>, <footer> tags")
                .note("Converts headings to # format, links to [text](url)")
                .note("Output is trimmed to 50K characters")
                .note("No JavaScript engine: sites requiring JS will return errors")
                .note("Returns exitCode 1 if the page appears blocked or has no useful content")
                .note("For search, use a search API via curl instead of browsing search engine pages")
                .build());
        this.webClient = webClient;
    }

    @Override
    public Mono<ShellResult> execute(List<String> args, CommandContext context) {
        boolean raw = false;
        String url = null;
        for (String arg : args) {
            if ("--raw".equals(arg)) {
                raw = true;
            } else if (!arg.startsWith("-")) {
                url = arg;
            }
        }

        if (url == null) {
            return Mono.just(ShellResult.error("browse: no URL specified"));
        }

        final boolean rawOutput = raw;
        final String target = url;
        final int maxChars = context.limits().getBrowseMaxChars();
        long timeoutMs = context.getConfig().getTimeoutMs();

        log.info("Browsing URL: {}", target);

        Mono<ShellResult> response = webClient.get()
                .uri(target)
                .header("User-Agent", USER_AGENT)
                .header("Accept", "text/html, application/xhtml+xml, */*")
                .exchangeToMono(r -> r.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(html -> {
                            int status = r.statusCode().value();
                            if (!r.statusCode().is2xxSuccessful()) {
                                HttpStatus known = HttpStatus.resolve(status);
                                return ShellResult.error("browse: HTTP " + status
                                        + (known != null ? " " + known.getReasonPhrase() : ""));
                            }
                            return render(html, rawOutput, maxChars);
                        }));
        if (timeoutMs > 0) {
            response = response.timeout(Duration.ofMillis(timeoutMs));
        }

        return response
                .onErrorResume(TimeoutException.class, e -> {
                    log.warn("browse timed out after {} ms: {}", timeoutMs, target);
                    return Mono.just(ShellResult.error("browse: timed out after " + timeoutMs + " ms"));
                })
                .onErrorResume(e -> {
                    log.warn("Failed to browse URL: {} - {}", target, e.getMessage());
                    return Mono.just(ShellResult.error("browse: " + e.getMessage()));
                });
    }

    private ShellResult render(String html, boolean raw, int maxChars) {
        String output = raw ? html : htmlToText(html);

        if (!raw) {
            String warning = detectLowQuality(output);
            if (warning != null) {
                return ShellResult.of(1, output + "\n", warning);
            }
        }

        if (output.length() > maxChars) {
            output = output.substring(0, maxChars)
                    + "\n\n[... truncated at " + (maxChars / 1000) + "K characters]";
        }
        return ShellResult.ok(output + "\n");
    }

    /**
     * HTML 转为 markdown 风格纯文本
     */
    static String htmlToText(String html) {
        Document doc = Jsoup.parse(html);
        doc.select("script, style, nav, footer").remove();

        StringBuilder sb = new StringBuilder();
        Element root = doc.body() != null ? doc.body() : doc;
        for (Node child : root.childNodes()) {
            appendNode(child, sb);
        }

        return sb.toString()
                .replace('\u00a0', ' ')
                .replaceAll("[ \\t]+", " ")
                .replace("\n ", "\n")
                .replace(" \n", "\n")
                .replaceAll("\\n{3,}", "\n\n")
                .trim();
    }

    private static void appendNode(Node node, StringBuilder sb) {
        if (node instanceof TextNode) {
            sb.append(((TextNode) node).text());
            return;
        }
        if (!(node instanceof Element)) {
            return;
        }

        Element element = (Element) node;
        String tag = element.normalName();
        switch (tag) {
            case "h1":
            case "h2":
            case "h3":
            case "h4":
            case "h5":
            case "h6":
                int level = tag.charAt(1) - '0';
                sb.append('\n').append("#".repeat(level)).append(' ')
                        .append(element.text()).append('\n');
                return;
            case "a":
                if (element.hasAttr("href")) {
                    sb.append('[').append(element.text()).append("](")
                            .append(element.attr("href")).append(')');
                    return;
                }
                break;
            case "br":
                sb.append('\n');
                return;
            case "li":
                sb.append("- ");
                appendChildren(element, sb);
                sb.append('\n');
                return;
            default:
                break;
        }

        appendChildren(element, sb);
        if ("p".equals(tag)) {
            sb.append("\n\n");
        } else if ("div".equals(tag)) {
            sb.append('\n');
        }
    }

    private static void appendChildren(Element element, StringBuilder sb) {
        for (Node child : element.childNodes()) {
            appendNode(child, sb);
        }
    }

    /**
     * 检查转换结果是否为拦截页或无有效内容，正常时返回 null
     */
    static String detectLowQuality(String text) {
        if (text.length() < MIN_CONTENT_LENGTH) {
            return "browse: page returned very little content (" + text.length() + " chars). "
                    + "The site likely requires JavaScript or blocked the request. "
                    + "Try a different source or use `curl` with an API endpoint instead.";
        }
        for (Pattern pattern : BLOCKED_PATTERNS) {
            if (pattern.matcher(text).find()) {
                return "browse: page appears to require JavaScript or blocked the request (matched: "
                        + pattern.pattern() + "). Content returned is not useful. "
                        + "Try a different URL, use a direct API, or try a different source for this information.";
            }
        }
        return null;
    }
}
