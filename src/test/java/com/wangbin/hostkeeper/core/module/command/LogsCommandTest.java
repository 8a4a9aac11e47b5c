package com.wangbin.hostkeeper.core.module.command;

import com.wangbin.hostkeeper.core.connection.model.CommandResponse;
import com.wangbin.hostkeeper.core.module.model.CommandResult;
import com.wangbin.hostkeeper.core.module.model.ModuleContext;
import com.wangbin.hostkeeper.core.module.model.PlatformInfo;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LogsCommandTest {

    private static final PlatformInfo JOURNALD = PlatformInfo.builder()
            .os(PlatformInfo.OperatingSystem.LINUX)
            .subsystems(Set.of("journald"))
            .build();

    private final LogsCommand command = new LogsCommand(Map.of());
    private final ModuleContext context = new ModuleContext("web-1", JOURNALD, false, Map.of());

    @Test
    void defaultsToAllUnitsFirstPage() {
        assertEquals("journalctl -q -n 400", command.buildCommand(context, List.of()));
        assertEquals("journalctl -q -n 400", command.buildCommand(context, List.of("all", "")));
    }

    @Test
    void unitFilterAndPagination() {
        assertEquals("journalctl -q -n 200 -u nginx.service -g error | head -n 100",
                command.buildCommand(context, List.of("nginx.service", "error", "2", "100")));
    }

    @Test
    void dmesgAndQuotedFilter() {
        assertEquals("journalctl -q -n 400 --dmesg -g 'out of memory'",
                command.buildCommand(context, List.of("dmesg", "out of memory")));
    }

    @Test
    void sudoPrefixWhenConfigured() {
        ModuleContext sudo = new ModuleContext("web-1", JOURNALD, true, Map.of());

        assertTrue(command.buildCommand(sudo, List.of()).startsWith("sudo journalctl"));
    }

    @Test
    void rejectsInvalidUnitName() {
        assertTrue(command.validate(List.of("nginx;reboot")).isPresent());
        assertTrue(command.validate(List.of("-x")).isPresent());
        assertTrue(command.validate(List.of("all", "")).isEmpty());
        assertTrue(command.validate(List.of("getty@tty1.service")).isEmpty());
    }

    @Test
    void rejectsPageBeyondLineLimit() {
        assertTrue(command.validate(List.of("all", "", "100000", "100000")).isPresent());
        assertTrue(command.validate(List.of("all", "", "2", "100")).isEmpty());
        assertTrue(command.buildCommand(context, List.of("all", "", "100000", "100000"))
                .contains("-n " + Integer.MAX_VALUE));
    }

    @Test
    void resultIsHiddenFromNotifications() {
        CommandResult result = command.parseResult(context, CommandResponse.ok("line 1\nline 2\n"));

        assertEquals("line 1\nline 2\n", result.getMessage());
        assertFalse(result.isShowInNotification());
    }

    @Test
    void requiresJournald() {
        assertTrue(command.isApplicable(JOURNALD));
        assertFalse(command.isApplicable(PlatformInfo.builder().os(PlatformInfo.OperatingSystem.LINUX).build()));
    }
}
