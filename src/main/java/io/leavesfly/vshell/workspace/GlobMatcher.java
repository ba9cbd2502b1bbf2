package io.leavesfly.vshell.workspace;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.regex.Pattern;

/**
 * Glob 匹配器
 * <p>
 * 支持的通配符：
 * - '*'  匹配不含 '/' 的任意字符串
 * - '?'  匹配单个非 '/' 字符
 * - '**' 匹配任意字符串（含 '/'），'**&#47;' 可匹配零个或多个路径段
 * <p>
 * 其余字符按字面匹配，整个表达式首尾锚定
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class GlobMatcher {

    private static final int CACHE_SIZE = 512;

    /**
     * 编译结果缓存，同一模式在一次 find / grep -r 中会被反复使用
     */
    private static final LoadingCache<String, Pattern> PATTERN_CACHE = Caffeine.newBuilder()
            .maximumSize(CACHE_SIZE)
            .build(glob -> Pattern.compile(toRegex(glob)));

    /**
     * 判断路径是否匹配 glob 模式
     */
    public static boolean matches(String path, String glob) {
        return PATTERN_CACHE.get(glob).matcher(path).matches();
    }

    /**
     * 判断字符串是否含有通配符
     */
    public static boolean isGlob(String path) {
        return path.indexOf('*') >= 0 || path.indexOf('?') >= 0;
    }

    /**
     * 将 glob 模式翻译为正则表达式（不含锚点，调用 matches() 时整体匹配）
     */
    public static String toRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '*' || c == '?') {
                flushLiteral(regex, literal);
                if (c == '?') {
                    regex.append("[^/]");
                    i++;
                } else if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                    if (i + 2 < glob.length() && glob.charAt(i + 2) == '/') {
                        regex.append("(?:.*/)?");
                        i += 3;
                    } else {
                        regex.append(".*");
                        i += 2;
                    }
                } else {
                    regex.append("[^/]*");
                    i++;
                }
            } else {
                literal.append(c);
                i++;
            }
        }
        flushLiteral(regex, literal);
        return regex.toString();
    }

    private static void flushLiteral(StringBuilder regex, StringBuilder literal) {
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
        }
    }
}
