package com.chicu.botjobs.common.util;

import lombok.experimental.UtilityClass;

import java.util.Locale;
import java.util.UUID;

@UtilityClass
public class JobIds {

    /**
     * Новый id задачи (32 символа, lowercase hex, без '-').
     */
    public static String newId() {
        return UUID.randomUUID().toString()
                .replace("-", "")
                .toLowerCase(Locale.ROOT);
    }

    /**
     * Упоминание владельца в тексте уведомления.
     */
    public static String mention(String owner) {
        if (owner == null || owner.isBlank()) return "";
        return "<@" + owner.trim() + ">";
    }
}
