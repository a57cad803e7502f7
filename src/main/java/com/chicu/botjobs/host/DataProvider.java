package com.chicu.botjobs.host;

/**
 * Внешний источник рыночных данных.
 */
public interface DataProvider {

    ItemInfo lookup(String itemId);

    /**
     * Готова ли сессия к опросу (логин и т.п.). Если нет — тик пропускается.
     */
    default boolean ensureSession() {
        return true;
    }
}
