package com.wangbin.hostkeeper.common.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValidatorUtilTest {

    @Test
    void unitNames() {
        assertTrue(ValidatorUtil.isValidUnitName("nginx.service"));
        assertTrue(ValidatorUtil.isValidUnitName("getty@tty1.service"));
        assertTrue(ValidatorUtil.isValidUnitName("dev-disk-by\\x2dlabel.device"));
        assertFalse(ValidatorUtil.isValidUnitName("-nginx"));
        assertFalse(ValidatorUtil.isValidUnitName("nginx service"));
        assertFalse(ValidatorUtil.isValidUnitName("a;b"));
        assertFalse(ValidatorUtil.isValidUnitName(""));
        assertFalse(ValidatorUtil.isValidUnitName(null));
    }

    @Test
    void hostIds() {
        assertTrue(ValidatorUtil.isHostId("web-1.example"));
        assertFalse(ValidatorUtil.isHostId(".hidden"));
        assertFalse(ValidatorUtil.isHostId("with space"));
        assertFalse(ValidatorUtil.isHostId(null));
    }

    @Test
    void regexValidity() {
        assertTrue(ValidatorUtil.isValidRegex("^[a-z]+$"));
        assertFalse(ValidatorUtil.isValidRegex("[unclosed"));
        assertFalse(ValidatorUtil.isValidRegex(null));
    }
}
