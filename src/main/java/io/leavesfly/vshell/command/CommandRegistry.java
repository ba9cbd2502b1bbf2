package io.leavesfly.vshell.command;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 命令注册表
 * <p>
 * 构建完成后不可变；每个 Shell 持有自己的注册表实例。
 */
@Slf4j
public class CommandRegistry {

    private final Map<String, CommandHandler> handlers;

    private CommandRegistry(Map<String, CommandHandler> handlers) {
        this.handlers = Collections.unmodifiableMap(new TreeMap<>(handlers));
    }

    /**
     * 查找命令
     */
    public Optional<CommandHandler> getCommand(String name) {
        return Optional.ofNullable(handlers.get(name));
    }

    public boolean hasCommand(String name) {
        return handlers.containsKey(name);
    }

    /**
     * 所有命令名（按字母排序）
     */
    public List<String> getCommandNames() {
        return new ArrayList<>(handlers.keySet());
    }

    public Collection<CommandHandler> getAllCommands() {
        return handlers.values();
    }

    public int size() {
        return handlers.size();
    }

    /**
     * 包含全部内置命令的注册表
     */
    public static CommandRegistry builtins(CommandServices services) {
        return builder().registerBuiltins(services).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        private final Map<String, CommandHandler> handlers = new TreeMap<>();

        /**
         * 注册全部内置命令
         */
        public Builder registerBuiltins(CommandServices services) {
            for (BuiltinCommand builtin : BuiltinCommand.values()) {
                register(builtin.create(services));
            }
            return this;
        }

        /**
         * 注册命令，同名命令被覆盖
         */
        public Builder register(CommandHandler handler) {
            if (handlers.put(handler.getName(), handler) != null) {
                log.debug("Overriding command: {}", handler.getName());
            }
            return this;
        }

        public CommandRegistry build() {
            CommandRegistry registry = new CommandRegistry(handlers);
            log.debug("Command registry built with {} commands", registry.size());
            return registry;
        }
    }
}
