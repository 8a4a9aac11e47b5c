package com.wangbin.hostkeeper.common.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ShellCommandTest {

    @Test
    void safeArgumentsAreNotQuoted() {
        assertEquals("systemctl mask nginx.service", ShellCommand.of("systemctl", "mask", "nginx.service").toString());
    }

    @Test
    void unsafeArgumentsAreSingleQuoted() {
        assertEquals("echo 'a b'", ShellCommand.of("echo", "a b").toString());
        assertEquals("echo ''", ShellCommand.of("echo", "").toString());
        assertEquals("echo 'it'\"'\"'s'", ShellCommand.of("echo", "it's").toString());
        assertEquals("echo '$(reboot)'", ShellCommand.of("echo", "$(reboot)").toString());
    }

    @Test
    void sudoAndStderrSuppression() {
        String command = ShellCommand.of("nixos-rebuild", "list-generations", "--json")
                .useSudo(true)
                .ignoreStderr(true)
                .toString();

        assertEquals("sudo nixos-rebuild list-generations --json 2>/dev/null", command);
    }

    @Test
    void argumentsCanBeAppended() {
        ShellCommand command = ShellCommand.of("journalctl").argument("-q").arguments("-u", "ssh");

        assertFalse(command.isEmpty());
        assertEquals("journalctl -q -u ssh", command.toString());
        assertTrue(new ShellCommand().isEmpty());
    }
}
