package com.chicu.botjobs.host.noop;

import com.chicu.botjobs.host.DataProvider;
import com.chicu.botjobs.host.ItemInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.stereotype.Service;

import java.util.Map;

@Slf4j
@Service
@ConditionalOnMissingBean(DataProvider.class)
public class NoopDataProvider implements DataProvider {

    @Override
    public ItemInfo lookup(String itemId) {
        log.debug("🧪 DataProvider = NOOP, itemId={}", itemId);
        // имя = id, чтобы backfill не зацикливался на пустых именах
        return new ItemInfo(itemId, itemId, Map.of());
    }
}
