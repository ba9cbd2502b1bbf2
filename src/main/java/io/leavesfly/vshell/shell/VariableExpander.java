package io.leavesfly.vshell.shell;

import io.leavesfly.vshell.env.EnvironmentProvider;
import org.apache.commons.text.StringSubstitutor;
import org.apache.commons.text.lookup.StringLookup;
import org.apache.commons.text.lookup.StringLookupFactory;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 展开 $VAR 与 ${VAR} 引用
 * <p>
 * 查找顺序：运行时变量，其次环境提供者；都找不到时替换为空串。
 * 裸写的 $VAR 先改写为 ${VAR}，再交给 StringSubstitutor 一次性替换，
 * 变量值中的 $ 不再展开。
 */
public class VariableExpander {

    private static final Pattern BARE_VARIABLE = Pattern.compile("(?<!\\$)\\$(\\w+)");

    private static final Pattern NAME = Pattern.compile("\\w+");

    private final StringLookup runtime;
    private final EnvironmentProvider provider;
    private final StringSubstitutor substitutor;

    public VariableExpander(Map<String, String> env, EnvironmentProvider provider) {
        this.runtime = StringLookupFactory.INSTANCE.mapStringLookup(env);
        this.provider = provider;
        // 非变量名（如 ${a b}）返回 null，原样保留
        this.substitutor = new StringSubstitutor(name -> NAME.matcher(name).matches() ? lookup(name) : null);
        this.substitutor.setDisableSubstitutionInValues(true);
    }

    public String lookup(String name) {
        String value = runtime.lookup(name);
        if (value != null) {
            return value;
        }
        if (provider != null) {
            return provider.get(name).orElse("");
        }
        return "";
    }

    public String expand(String text) {
        if (text == null || text.indexOf('$') < 0) {
            return text;
        }
        Matcher matcher = BARE_VARIABLE.matcher(text);
        StringBuilder braced = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(braced, Matcher.quoteReplacement("${" + matcher.group(1) + "}"));
        }
        matcher.appendTail(braced);
        return substitutor.replace(braced.toString());
    }
}
