package com.wangbin.hostkeeper.common.utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 远程 shell 命令构造器，负责参数转义和 sudo 前缀
 */
public class ShellCommand {

    private static final Pattern SAFE_ARGUMENT = Pattern.compile("^[A-Za-z0-9_./:=@%+,-]+$");

    private final List<String> arguments = new ArrayList<>();
    private boolean useSudo;
    private boolean ignoreStderr;

    public static ShellCommand of(String... arguments) {
        ShellCommand command = new ShellCommand();
        command.arguments.addAll(Arrays.asList(arguments));
        return command;
    }

    public ShellCommand argument(String argument) {
        arguments.add(argument);
        return this;
    }

    public ShellCommand arguments(String... more) {
        arguments.addAll(Arrays.asList(more));
        return this;
    }

    public ShellCommand useSudo(boolean useSudo) {
        this.useSudo = useSudo;
        return this;
    }

    public ShellCommand ignoreStderr(boolean ignoreStderr) {
        this.ignoreStderr = ignoreStderr;
        return this;
    }

    public boolean isEmpty() {
        return arguments.isEmpty();
    }

    /**
     * 单引号转义
     */
    public static String quote(String argument) {
        if (argument.isEmpty()) {
            return "''";
        }
        if (SAFE_ARGUMENT.matcher(argument).matches()) {
            return argument;
        }
        return "'" + argument.replace("'", "'\"'\"'") + "'";
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        if (useSudo) {
            builder.append("sudo ");
        }
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
                builder.append(' ');
            }
            builder.append(quote(arguments.get(i)));
        }
        if (ignoreStderr) {
            builder.append(" 2>/dev/null");
        }
        return builder.toString();
    }
}
